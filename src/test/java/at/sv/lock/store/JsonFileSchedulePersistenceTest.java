package at.sv.lock.store;

import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.LockAction;
import at.sv.lock.schedule.ScheduleConfig;
import at.sv.lock.schedule.ScheduleGroupDetails;
import at.sv.lock.schedule.ScheduleRecurrence;
import at.sv.lock.schedule.ScheduleRequest;
import at.sv.lock.schedule.ScheduleScope;
import at.sv.lock.schedule.ScheduleTarget;
import at.sv.lock.schedule.ScheduleWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSchedulePersistenceTest {

    @TempDir
    Path tempDir;

    private Path storeFile;
    private ZonedDateTime now;

    @BeforeEach
    void setUp() {
        storeFile = tempDir.resolve("store").resolve("schedules.json");
        now = ZonedDateTime.of(2025, 11, 12, 12, 0, 0, 0, ZoneId.of("UTC"));
    }

    private JsonFileSchedulePersistence createPersistence() {
        return new JsonFileSchedulePersistence(storeFile, new ScheduleConfigMapper(),
                () -> ScheduleConfig.empty("Europe/Vienna", Instant.EPOCH));
    }

    private ScheduleStoreImpl createStore() {
        return new ScheduleStoreImpl(createPersistence(), () -> now);
    }

    @Test
    void load_missingFile_initialDocument() {
        ScheduleConfig config = createPersistence().load();

        assertThat(config.schedules()).isEmpty();
        assertThat(config.metadata().timezone()).isEqualTo("Europe/Vienna");
        assertThat(Files.exists(storeFile)).isFalse();
    }

    @Test
    void store_survivesRestart() {
        ScheduleStoreImpl store = createStore();
        DeviceSchedule schedule = store.create(ScheduleRequest.builder()
                                                              .scope(ScheduleScope.OWNER)
                                                              .ownerKey("alice")
                                                              .label("Bedtime")
                                                              .targets(ScheduleTarget.devices("aa:bb:cc:dd:ee:01"))
                                                              .action(LockAction.LOCK)
                                                              .endAction(LockAction.UNLOCK)
                                                              .window(ScheduleWindow.of(
                                                                      LocalDateTime.parse("2025-11-12T21:00"),
                                                                      LocalDateTime.parse("2025-11-13T06:00")))
                                                              .recurrence(ScheduleRecurrence.daily(1))
                                                              .build());
        ScheduleGroupDetails group = store.createGroup("Nights", "alice", null, List.of(schedule.getId()), true);

        ScheduleStoreImpl restarted = createStore();

        assertThat(restarted.list()).containsExactly(store.get(schedule.getId()).orElseThrow());
        assertThat(restarted.getGroup(group.group().getId())).contains(store.getGroup(group.group().getId()).orElseThrow());
        assertThat(restarted.getMetadata()).isEqualTo(store.getMetadata());
    }

    @Test
    void save_leavesNoTemporaryFilesBehind() throws IOException {
        JsonFileSchedulePersistence persistence = createPersistence();

        persistence.save(ScheduleConfig.empty("UTC", Instant.EPOCH));
        persistence.save(ScheduleConfig.empty("Europe/Vienna", Instant.EPOCH));

        try (Stream<Path> files = Files.list(storeFile.getParent())) {
            assertThat(files).containsExactly(storeFile);
        }
        assertThat(persistence.load().metadata().timezone()).isEqualTo("Europe/Vienna");
    }

    @Test
    void load_corruptFile_uncheckedIOException() throws IOException {
        Files.createDirectories(storeFile.getParent());
        Files.writeString(storeFile, "{ not json");

        assertThatThrownBy(() -> createPersistence().load()).isInstanceOf(UncheckedIOException.class);
    }
}
