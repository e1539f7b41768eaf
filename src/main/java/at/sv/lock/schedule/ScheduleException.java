package at.sv.lock.schedule;

import java.time.LocalDate;

/**
 * Overrides the occurrence starting on the given date: either skips it or replaces its window.
 */
public record ScheduleException(LocalDate date, String reason, Boolean skip, ScheduleWindow overrideWindow) {

    public static ScheduleException skipOn(LocalDate date, String reason) {
        return new ScheduleException(date, reason, true, null);
    }

    public static ScheduleException overrideOn(LocalDate date, ScheduleWindow overrideWindow) {
        return new ScheduleException(date, null, null, overrideWindow);
    }

    public boolean skipsOccurrence() {
        return Boolean.TRUE.equals(skip);
    }
}
