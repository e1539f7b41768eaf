package at.sv.lock.store;

import at.sv.lock.schedule.ScheduleConfig;

import java.nio.file.Path;
import java.util.function.Supplier;

public final class SchedulePersistenceFactory {

    private SchedulePersistenceFactory() {
    }

    /**
     * @param backend       the backend to use
     * @param storeFile     the store file, required for {@link StoreBackend#FILE}
     * @param initialConfig the document used if nothing was stored yet
     */
    public static SchedulePersistence create(StoreBackend backend, Path storeFile,
                                             Supplier<ScheduleConfig> initialConfig) {
        switch (backend) {
            case MEMORY:
                return new InMemorySchedulePersistence(initialConfig.get());
            case FILE:
                if (storeFile == null) {
                    throw new IllegalArgumentException("The file store backend requires a store file.");
                }
                return new JsonFileSchedulePersistence(storeFile, new ScheduleConfigMapper(), initialConfig);
            default:
                throw new IllegalArgumentException("Unsupported store backend: " + backend);
        }
    }
}
