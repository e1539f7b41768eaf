package at.sv.lock.time;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * One concrete instantiation of a schedule's recurrence. The end is exclusive.
 */
public record Occurrence(ZonedDateTime start, ZonedDateTime end) {

    public boolean contains(ZonedDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean isDegenerate() {
        return !end.isAfter(start);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public Occurrence withDuration(Duration duration) {
        return new Occurrence(start, start.plus(duration));
    }

    @Override
    public String toString() {
        return "[" + start.toLocalDateTime() + "," + end.toLocalDateTime() + ")";
    }
}
