package at.sv.lock.time;

import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.ScheduleException;
import at.sv.lock.schedule.ScheduleRecurrence;
import at.sv.lock.schedule.ScheduleWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Expands the recurrence of a schedule into occurrences and decides if a schedule is active at a given instant.
 * Only a small neighbourhood of cycles around the reference instant is expanded, so the cost does not depend on
 * the age of a schedule.
 */
@Slf4j
public final class RecurrenceEvaluator {

    public boolean isActive(DeviceSchedule schedule, ZonedDateTime instant, ZoneId zone) {
        return findActiveOccurrence(schedule, instant, zone).isPresent();
    }

    /**
     * @return the resolved occurrence containing the given instant, or empty if the schedule is not active
     */
    public Optional<Occurrence> findActiveOccurrence(DeviceSchedule schedule, ZonedDateTime instant, ZoneId zone) {
        ZonedDateTime now = instant.withZoneSameInstant(zone);
        Duration canonicalDuration = schedule.getWindow().canonicalDuration();
        for (Occurrence occurrence : occurrences(schedule, now, zone)) {
            if (occurrence.isDegenerate()) {
                occurrence = occurrence.withDuration(canonicalDuration);
            }
            Optional<Occurrence> resolved = resolve(occurrence, schedule.getExceptions(), zone);
            if (resolved.isPresent() && resolved.get().contains(now)) {
                return resolved;
            }
        }
        return Optional.empty();
    }

    /**
     * @return the unresolved occurrences in the neighbourhood of the reference instant, ordered by start. Exceptions
     * are not yet applied, and occurrences can be degenerate if the raw window does not end after its start.
     */
    public List<Occurrence> occurrences(DeviceSchedule schedule, ZonedDateTime reference, ZoneId zone) {
        ScheduleRecurrence recurrence = schedule.getRecurrence();
        if (recurrence == null || recurrence.type() == null) {
            log.warn("Unsupported recurrence for schedule '{}': {}. Schedule will never activate.",
                    schedule.getId(), recurrence);
            return List.of();
        }
        ScheduleWindow window = schedule.getWindow();
        LocalDateTime now = reference.withZoneSameInstant(zone).toLocalDateTime();
        List<LocalDateTime> starts;
        switch (recurrence.type()) {
            case ONE_SHOT:
                return List.of(new Occurrence(window.start().atZone(zone), window.end().atZone(zone)));
            case DAILY:
                starts = getDailyStarts(window.start(), recurrence.effectiveInterval(), now);
                break;
            case WEEKLY:
                starts = getWeeklyStarts(schedule, now);
                break;
            case MONTHLY:
                starts = getMonthlyStarts(window.start(), recurrence, now);
                break;
            default:
                log.warn("Unsupported recurrence type '{}' for schedule '{}'.", recurrence.type(), schedule.getId());
                return List.of();
        }
        Duration rawDuration = Duration.between(window.start(), window.end());
        return starts.stream()
                     .filter(start -> isNotAfterUntil(start, recurrence))
                     .map(start -> new Occurrence(start.atZone(zone), start.plus(rawDuration).atZone(zone)))
                     .toList();
    }

    /**
     * Applies the first matching exception for the start date of the given occurrence.
     *
     * @return the occurrence, its override, or empty if the occurrence is skipped
     */
    public Optional<Occurrence> resolve(Occurrence occurrence, List<ScheduleException> exceptions, ZoneId zone) {
        LocalDate occurrenceDate = occurrence.start().withZoneSameInstant(zone).toLocalDate();
        for (ScheduleException exception : exceptions) {
            if (!occurrenceDate.equals(exception.date())) {
                continue;
            }
            if (exception.skipsOccurrence()) {
                return Optional.empty();
            }
            ScheduleWindow overrideWindow = exception.overrideWindow();
            if (overrideWindow != null) {
                ZonedDateTime start = overrideWindow.start().atZone(zone);
                ZonedDateTime end = overrideWindow.end().atZone(zone);
                if (!end.isAfter(start)) {
                    end = start.plus(occurrence.duration());
                }
                return Optional.of(new Occurrence(start, end));
            }
        }
        return Optional.of(occurrence);
    }

    private static List<LocalDateTime> getDailyStarts(LocalDateTime baseStart, int interval, LocalDateTime now) {
        if (now.isBefore(baseStart)) {
            return List.of(baseStart);
        }
        long cycles = ChronoUnit.DAYS.between(baseStart, now) / interval;
        List<LocalDateTime> starts = new ArrayList<>();
        for (long cycle = Math.max(cycles - 1, 0); cycle <= cycles + 1; cycle++) {
            starts.add(baseStart.plusDays(interval * cycle));
        }
        return starts;
    }

    private static List<LocalDateTime> getWeeklyStarts(DeviceSchedule schedule, LocalDateTime now) {
        LocalDateTime baseStart = schedule.getWindow().start();
        int interval = schedule.getRecurrence().effectiveInterval();
        EnumSet<DayOfWeek> days;
        try {
            days = DayOfWeeksParser.parseDayOfWeeks(schedule.getRecurrence().daysOfWeek());
        } catch (InvalidPropertyValue e) {
            log.warn("Invalid days of week for schedule '{}': {}", schedule.getId(), e.getMessage());
            return List.of();
        }
        if (days.isEmpty()) {
            days = EnumSet.of(baseStart.getDayOfWeek());
        }
        LocalDate anchorMonday = baseStart.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        long currentWeek = Math.floorDiv(ChronoUnit.DAYS.between(anchorMonday, now.toLocalDate()), 7);
        List<LocalDateTime> starts = new ArrayList<>();
        for (long week = Math.max(currentWeek - 1, 0); week <= Math.max(currentWeek + 1, 0); week++) {
            if (week % interval != 0) {
                continue;
            }
            LocalDate weekStart = anchorMonday.plusWeeks(week);
            for (DayOfWeek day : days) {
                LocalDateTime start = weekStart.plusDays(day.getValue() - 1L).atTime(baseStart.toLocalTime());
                if (!start.isBefore(baseStart)) {
                    starts.add(start);
                }
            }
        }
        return starts;
    }

    private static List<LocalDateTime> getMonthlyStarts(LocalDateTime baseStart, ScheduleRecurrence recurrence,
                                                        LocalDateTime now) {
        int interval = recurrence.effectiveInterval();
        int dayOfMonth = recurrence.dayOfMonth() != null ? recurrence.dayOfMonth() : baseStart.getDayOfMonth();
        YearMonth baseMonth = YearMonth.from(baseStart);
        long currentMonth = ChronoUnit.MONTHS.between(baseMonth, YearMonth.from(now));
        List<LocalDateTime> starts = new ArrayList<>();
        for (long month = Math.max(currentMonth - 1, 0); month <= Math.max(currentMonth + 1, 0); month++) {
            if (month % interval != 0) {
                continue;
            }
            YearMonth yearMonth = baseMonth.plusMonths(month);
            LocalDate date = yearMonth.atDay(Math.min(dayOfMonth, yearMonth.lengthOfMonth()));
            LocalDateTime start = date.atTime(baseStart.toLocalTime());
            if (!start.isBefore(baseStart)) {
                starts.add(start);
            }
        }
        return starts;
    }

    private static boolean isNotAfterUntil(LocalDateTime start, ScheduleRecurrence recurrence) {
        return recurrence.until() == null || !start.isAfter(recurrence.until());
    }
}
