package at.sv.lock.schedule;

import java.time.LocalDateTime;
import java.util.List;

public record ScheduleRecurrence(RecurrenceType type, Integer interval, List<String> daysOfWeek,
                                 Integer dayOfMonth, LocalDateTime until) {

    public ScheduleRecurrence {
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
    }

    public static ScheduleRecurrence oneShot() {
        return new ScheduleRecurrence(RecurrenceType.ONE_SHOT, 1, null, null, null);
    }

    public static ScheduleRecurrence daily(int interval) {
        return new ScheduleRecurrence(RecurrenceType.DAILY, interval, null, null, null);
    }

    public static ScheduleRecurrence weekly(int interval, String... daysOfWeek) {
        return new ScheduleRecurrence(RecurrenceType.WEEKLY, interval, List.of(daysOfWeek), null, null);
    }

    public static ScheduleRecurrence monthly(int interval, Integer dayOfMonth) {
        return new ScheduleRecurrence(RecurrenceType.MONTHLY, interval, null, dayOfMonth, null);
    }

    public ScheduleRecurrence withUntil(LocalDateTime until) {
        return new ScheduleRecurrence(type, interval, daysOfWeek, dayOfMonth, until);
    }

    public int effectiveInterval() {
        if (interval == null) {
            return 1;
        }
        return Math.max(interval, 1);
    }
}
