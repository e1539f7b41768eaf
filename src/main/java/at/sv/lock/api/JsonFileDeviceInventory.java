package at.sv.lock.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Device inventory and owner directory read from a JSON file:
 * <pre>
 * {"owners": [{"key": "kade", "displayName": "Kade"}],
 *  "devices": [{"name": "Xbox", "mac": "28:16:a8:ae:27:57", "type": "console", "owner": "kade"}]}
 * </pre>
 * The parsed file is cached and reloaded after the given invalidation interval, so changes are picked up without
 * restart. If a reload fails, the previously loaded inventory stays in use.
 */
@Slf4j
public final class JsonFileDeviceInventory implements DeviceInventory, OwnerDirectory {

    private static final String CACHE_KEY = "inventory";

    private final Path file;
    private final ObjectMapper mapper;
    private final LoadingCache<String, InMemoryDeviceInventory> cache;

    public JsonFileDeviceInventory(Path file, int cacheInvalidationIntervalInMinutes) {
        this(file, cacheInvalidationIntervalInMinutes, Ticker.systemTicker());
    }

    JsonFileDeviceInventory(Path file, int cacheInvalidationIntervalInMinutes, Ticker ticker) {
        this.file = file;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        cache = Caffeine.newBuilder()
                        .ticker(ticker)
                        .executor(Runnable::run)
                        .refreshAfterWrite(Duration.ofMinutes(cacheInvalidationIntervalInMinutes))
                        .build(key -> load());
    }

    private InMemoryDeviceInventory load() {
        try {
            InventoryDocument document = mapper.readValue(file.toFile(), InventoryDocument.class);
            log.debug("Loaded {} devices and {} owners from '{}'.", document.devices().size(),
                    document.owners().size(), file);
            return new InMemoryDeviceInventory(document.devices(), document.owners());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read inventory file '" + file + "'", e);
        }
    }

    private InMemoryDeviceInventory getInventory() {
        return cache.get(CACHE_KEY);
    }

    public void invalidate() {
        cache.invalidateAll();
        log.trace("Invalidated inventory cache.");
    }

    @Override
    public List<Device> listAll() {
        return getInventory().listAll();
    }

    @Override
    public List<Device> listByOwner(String ownerKey) {
        return getInventory().listByOwner(ownerKey);
    }

    @Override
    public Optional<Device> getByMac(String mac) {
        return getInventory().getByMac(mac);
    }

    @Override
    public boolean exists(String ownerKey) {
        return getInventory().exists(ownerKey);
    }
}
