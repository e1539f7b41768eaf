package at.sv.lock.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Document format used by seed configuration files and the JSON file store.
 */
public record ScheduleConfig(ScheduleMetadata metadata, List<DeviceSchedule> schedules, List<ScheduleGroup> groups) {

    public ScheduleConfig {
        if (metadata == null) {
            metadata = new ScheduleMetadata(ScheduleMetadata.DEFAULT_TIMEZONE, Instant.EPOCH);
        }
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static ScheduleConfig empty(String timezone, Instant generatedAt) {
        return new ScheduleConfig(new ScheduleMetadata(timezone, generatedAt), List.of(), List.of());
    }
}
