package at.sv.lock.schedule;

import at.sv.lock.time.DayOfWeeksParser;
import at.sv.lock.time.InvalidPropertyValue;

import java.util.Locale;

/**
 * Structural validation of schedules. Owner existence is not checked here, see
 * {@link at.sv.lock.ScheduleService}.
 */
public final class ScheduleValidator {

    private static final int MAX_DAY_OF_MONTH = 31;

    private ScheduleValidator() {
    }

    public static String normalizeOwnerKey(String ownerKey) {
        if (ownerKey == null || ownerKey.isBlank()) {
            return null;
        }
        return ownerKey.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws InvalidScheduleException   if scope, owner key, label, action, targets or window are invalid
     * @throws InvalidRecurrenceException if the recurrence is missing or malformed
     */
    public static void validate(DeviceSchedule schedule) {
        if (schedule.getScope() == null) {
            throw new InvalidScheduleException("Schedule scope is required.");
        }
        if (schedule.getScope() == ScheduleScope.OWNER && schedule.getOwnerKey() == null) {
            throw new InvalidScheduleException("Owner schedules require an owner key.");
        }
        if (schedule.getScope() == ScheduleScope.GLOBAL && schedule.getOwnerKey() != null) {
            throw new InvalidScheduleException("Global schedules can't have an owner key, but got '"
                                               + schedule.getOwnerKey() + "'.");
        }
        if (schedule.getLabel() == null || schedule.getLabel().isBlank()) {
            throw new InvalidScheduleException("Schedule label is required.");
        }
        if (schedule.getAction() == null) {
            throw new InvalidScheduleException("Schedule action is required.");
        }
        if (schedule.getTargets() == null) {
            throw new InvalidScheduleException("Schedule targets are required.");
        }
        assertWindow(schedule.getWindow(), "Schedule window");
        validateRecurrence(schedule.getRecurrence());
        for (ScheduleException exception : schedule.getExceptions()) {
            if (exception.date() == null) {
                throw new InvalidScheduleException("Schedule exceptions require a date.");
            }
            if (exception.overrideWindow() != null) {
                assertWindow(exception.overrideWindow(), "Override window of exception on " + exception.date());
            }
        }
    }

    public static void validateRecurrence(ScheduleRecurrence recurrence) {
        if (recurrence == null || recurrence.type() == null) {
            throw new InvalidRecurrenceException("Recurrence type is required.");
        }
        if (recurrence.interval() != null && recurrence.interval() < 1) {
            throw new InvalidRecurrenceException("Recurrence interval must be >= 1, but was " + recurrence.interval());
        }
        switch (recurrence.type()) {
            case WEEKLY -> {
                try {
                    DayOfWeeksParser.parseDayOfWeeks(recurrence.daysOfWeek());
                } catch (InvalidPropertyValue e) {
                    throw new InvalidRecurrenceException(e.getMessage());
                }
            }
            case MONTHLY -> {
                Integer dayOfMonth = recurrence.dayOfMonth();
                if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > MAX_DAY_OF_MONTH)) {
                    throw new InvalidRecurrenceException("Day of month must be within [1," + MAX_DAY_OF_MONTH
                                                         + "], but was " + dayOfMonth);
                }
            }
            default -> {
            }
        }
    }

    private static void assertWindow(ScheduleWindow window, String name) {
        if (window == null || window.start() == null || window.end() == null) {
            throw new InvalidScheduleException(name + " requires a start and an end.");
        }
    }
}
