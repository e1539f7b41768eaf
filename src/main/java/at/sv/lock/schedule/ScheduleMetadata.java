package at.sv.lock.schedule;

import java.time.Instant;

public record ScheduleMetadata(String timezone, Instant generatedAt) {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public ScheduleMetadata withGeneratedAt(Instant generatedAt) {
        return new ScheduleMetadata(timezone, generatedAt);
    }

    public ScheduleMetadata withTimezone(String timezone) {
        return new ScheduleMetadata(timezone, generatedAt);
    }
}
