package at.sv.lock.schedule;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A wall-clock time window, interpreted in the evaluation time zone.
 */
public record ScheduleWindow(LocalDateTime start, LocalDateTime end) {

    public static ScheduleWindow of(LocalDateTime start, LocalDateTime end) {
        return new ScheduleWindow(start, end);
    }

    /**
     * @return the positive length of the window. If end is not after start, the window is read as ending at the
     * time of day of end on a following day.
     */
    public Duration canonicalDuration() {
        Duration duration = Duration.between(start, end);
        while (duration.isNegative() || duration.isZero()) {
            duration = duration.plusDays(1);
        }
        return duration;
    }

    @Override
    public String toString() {
        return start + "/" + end;
    }
}
