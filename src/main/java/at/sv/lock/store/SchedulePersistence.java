package at.sv.lock.store;

import at.sv.lock.schedule.ScheduleConfig;

/**
 * Storage port of the {@link ScheduleStore}. Implementations only load and save whole documents; all invariants
 * are maintained by the store.
 */
public interface SchedulePersistence {

    /**
     * @return the last saved document, or the initial document if nothing was saved yet. Not null.
     * @throws java.io.UncheckedIOException if the document could not be read
     */
    ScheduleConfig load();

    /**
     * @throws java.io.UncheckedIOException if the document could not be written
     */
    void save(ScheduleConfig config);
}
