package at.sv.lock.store;

import at.sv.lock.schedule.ScheduleConfig;

public final class InMemorySchedulePersistence implements SchedulePersistence {

    private volatile ScheduleConfig config;

    public InMemorySchedulePersistence(ScheduleConfig initialConfig) {
        config = initialConfig;
    }

    @Override
    public ScheduleConfig load() {
        return config;
    }

    @Override
    public void save(ScheduleConfig config) {
        this.config = config;
    }
}
