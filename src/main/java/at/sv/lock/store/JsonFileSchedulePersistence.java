package at.sv.lock.store;

import at.sv.lock.schedule.ScheduleConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Durable backend keeping the whole document in a single JSON file. Writes go to a temporary file in the same
 * directory, which is then moved over the target, so readers never see a partially written file.
 */
@Slf4j
public final class JsonFileSchedulePersistence implements SchedulePersistence {

    private final Path file;
    private final ScheduleConfigMapper mapper;
    private final Supplier<ScheduleConfig> initialConfig;

    public JsonFileSchedulePersistence(Path file, ScheduleConfigMapper mapper, Supplier<ScheduleConfig> initialConfig) {
        this.file = file.toAbsolutePath();
        this.mapper = mapper;
        this.initialConfig = initialConfig;
    }

    @Override
    public ScheduleConfig load() {
        if (Files.notExists(file)) {
            log.info("Schedule store '{}' does not exist yet. Starting empty.", file);
            return initialConfig.get();
        }
        ScheduleConfig config = mapper.read(file);
        log.info("Loaded {} schedules and {} groups from '{}'.", config.schedules().size(), config.groups().size(),
                file);
        return config;
    }

    @Override
    public void save(ScheduleConfig config) {
        String json = mapper.write(config);
        try {
            Path directory = file.getParent();
            Files.createDirectories(directory);
            Path tempFile = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tempFile, json, StandardCharsets.UTF_8);
                move(tempFile);
            } finally {
                Files.deleteIfExists(tempFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write schedule store '" + file + "'", e);
        }
        log.trace("Saved schedule store '{}'.", file);
    }

    private void move(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for '{}', falling back to a plain replace.", file);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
