package at.sv.lock.time;

import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.LockAction;
import at.sv.lock.schedule.ScheduleException;
import at.sv.lock.schedule.ScheduleRecurrence;
import at.sv.lock.schedule.ScheduleScope;
import at.sv.lock.schedule.ScheduleTarget;
import at.sv.lock.schedule.ScheduleWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecurrenceEvaluatorTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Vienna");

    private RecurrenceEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RecurrenceEvaluator();
    }

    private static LocalDateTime at(String dateTime) {
        return LocalDateTime.parse(dateTime);
    }

    private static DeviceSchedule schedule(String start, String end, ScheduleRecurrence recurrence,
                                           ScheduleException... exceptions) {
        return DeviceSchedule.builder()
                             .id("schedule")
                             .scope(ScheduleScope.GLOBAL)
                             .label("Bedtime")
                             .targets(ScheduleTarget.tags("all-devices"))
                             .action(LockAction.LOCK)
                             .window(ScheduleWindow.of(at(start), at(end)))
                             .recurrence(recurrence)
                             .exceptions(List.of(exceptions))
                             .build();
    }

    private void assertActive(DeviceSchedule schedule, String dateTime) {
        assertThat(evaluator.isActive(schedule, at(dateTime).atZone(ZONE), ZONE))
                .as("active at %s", dateTime)
                .isTrue();
    }

    private void assertInactive(DeviceSchedule schedule, String dateTime) {
        assertThat(evaluator.isActive(schedule, at(dateTime).atZone(ZONE), ZONE))
                .as("inactive at %s", dateTime)
                .isFalse();
    }

    @Test
    void oneShot_activeOnlyWithinWindow() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00", ScheduleRecurrence.oneShot());

        assertInactive(schedule, "2025-11-12T20:59");
        assertActive(schedule, "2025-11-12T21:00");
        assertActive(schedule, "2025-11-13T05:59");
        assertInactive(schedule, "2025-11-13T06:00");
        assertInactive(schedule, "2025-11-14T02:00");
    }

    @Test
    void oneShot_endBeforeStart_readAsOvernightWindow() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T06:00", ScheduleRecurrence.oneShot());

        assertActive(schedule, "2025-11-13T02:00");
        assertInactive(schedule, "2025-11-13T06:00");
    }

    @Test
    void daily_overnight_activeAcrossMidnight_endExclusive() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00", ScheduleRecurrence.daily(1));

        assertActive(schedule, "2025-11-14T23:00");
        assertActive(schedule, "2025-11-15T05:59");
        assertInactive(schedule, "2025-11-15T06:00");
        assertInactive(schedule, "2025-11-14T20:59");
        assertActive(schedule, "2025-11-14T21:00");
    }

    @Test
    void daily_overnight_activeLateEvening_inactiveMorning() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00", ScheduleRecurrence.daily(1));

        assertActive(schedule, "2025-11-20T22:30");
        assertInactive(schedule, "2025-11-20T10:00");
    }

    @Test
    void daily_sameDateOvernightWindow_behavesLikeOvernightWindow() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T06:00", ScheduleRecurrence.daily(1));

        assertActive(schedule, "2025-11-13T02:00");
        assertActive(schedule, "2025-11-20T23:30");
        assertInactive(schedule, "2025-11-20T12:00");
    }

    @Test
    void daily_beforeBaseStart_inactive() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00", ScheduleRecurrence.daily(1));

        assertInactive(schedule, "2025-11-11T21:30");
        assertActive(schedule, "2025-11-12T21:30");
    }

    @Test
    void daily_interval_onlyEveryNthDay() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00", ScheduleRecurrence.daily(2));

        assertInactive(schedule, "2025-11-13T21:30");
        assertActive(schedule, "2025-11-14T21:30");
        assertInactive(schedule, "2025-11-15T21:30");
        assertActive(schedule, "2025-11-16T21:30");
    }

    @Test
    void daily_until_inclusive() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00",
                ScheduleRecurrence.daily(1).withUntil(at("2025-11-14T21:00")));

        assertActive(schedule, "2025-11-14T21:30");
        assertInactive(schedule, "2025-11-15T21:30");
    }

    @Test
    void daily_keepsWallClockTime_acrossDaylightSavingTimeChange() {
        DeviceSchedule schedule = schedule("2025-10-20T21:00", "2025-10-20T22:00", ScheduleRecurrence.daily(1));

        assertActive(schedule, "2025-10-25T21:30");
        assertActive(schedule, "2025-10-27T21:30");
        assertInactive(schedule, "2025-10-27T20:30");
    }

    @Test
    void daily_oldSchedule_onlyNeighbourhoodIsExpanded() {
        DeviceSchedule schedule = schedule("2020-01-01T21:00", "2020-01-01T22:00", ScheduleRecurrence.daily(1));

        List<Occurrence> occurrences = evaluator.occurrences(schedule, at("2025-11-14T12:00").atZone(ZONE), ZONE);

        assertThat(occurrences).hasSize(3);
        assertThat(occurrences.get(1).start().toLocalDateTime()).isEqualTo(at("2025-11-13T21:00"));
    }

    @Test
    void weekly_friday_onlyActiveOnFridays() {
        DeviceSchedule schedule = schedule("2025-11-14T22:00", "2025-11-14T23:30", ScheduleRecurrence.weekly(1, "Fri"));

        assertActive(schedule, "2025-11-21T22:30");
        assertInactive(schedule, "2025-11-20T22:30");
        assertInactive(schedule, "2025-11-22T22:30");
        assertInactive(schedule, "2025-11-21T23:30");
    }

    @Test
    void weekly_friday_activeFridayEvening_inactiveSaturdayMorning() {
        DeviceSchedule schedule = schedule("2025-11-14T19:00", "2025-11-14T22:30", ScheduleRecurrence.weekly(1, "Fri"));

        assertActive(schedule, "2025-11-21T20:00");
        assertInactive(schedule, "2025-11-22T10:00");
    }

    @Test
    void weekly_noDaysGiven_usesWeekdayOfBaseStart() {
        DeviceSchedule schedule = schedule("2025-11-14T22:00", "2025-11-14T23:30", ScheduleRecurrence.weekly(1));

        assertActive(schedule, "2025-11-28T22:30");
        assertInactive(schedule, "2025-11-27T22:30");
    }

    @Test
    void weekly_interval_skipsWeeks() {
        DeviceSchedule schedule = schedule("2025-11-14T22:00", "2025-11-14T23:30", ScheduleRecurrence.weekly(2, "Fri"));

        assertInactive(schedule, "2025-11-21T22:30");
        assertActive(schedule, "2025-11-28T22:30");
    }

    @Test
    void weekly_multipleDaysAndRange() {
        DeviceSchedule schedule = schedule("2025-11-10T08:00", "2025-11-10T12:00",
                ScheduleRecurrence.weekly(1, "Mon-Wed", "Fri"));

        assertActive(schedule, "2025-11-18T09:00");
        assertInactive(schedule, "2025-11-20T09:00");
        assertActive(schedule, "2025-11-21T09:00");
    }

    @Test
    void weekly_overnightSunday_activeOnMondayMorning() {
        DeviceSchedule schedule = schedule("2025-11-16T22:00", "2025-11-17T06:00", ScheduleRecurrence.weekly(1, "Sun"));

        assertActive(schedule, "2025-11-24T03:00");
        assertInactive(schedule, "2025-11-25T03:00");
    }

    @Test
    void weekly_occurrencesBeforeBaseStart_notProduced() {
        DeviceSchedule schedule = schedule("2025-11-14T22:00", "2025-11-14T23:30",
                ScheduleRecurrence.weekly(1, "Mon", "Fri"));

        assertInactive(schedule, "2025-11-10T22:30");
        assertActive(schedule, "2025-11-17T22:30");
    }

    @Test
    void weekly_invalidDays_neverActive() {
        DeviceSchedule schedule = schedule("2025-11-14T22:00", "2025-11-14T23:30",
                ScheduleRecurrence.weekly(1, "Funday"));

        assertInactive(schedule, "2025-11-14T22:30");
    }

    @Test
    void monthly_dayOfMonth_clampedToMonthLength() {
        DeviceSchedule schedule = schedule("2025-01-31T08:00", "2025-01-31T09:00", ScheduleRecurrence.monthly(1, null));

        assertActive(schedule, "2025-01-31T08:30");
        assertInactive(schedule, "2025-02-27T08:30");
        assertActive(schedule, "2025-02-28T08:30");
        assertActive(schedule, "2025-03-31T08:30");
        assertInactive(schedule, "2025-03-30T08:30");
    }

    @Test
    void monthly_interval_onlyEveryNthMonth() {
        DeviceSchedule schedule = schedule("2025-01-15T08:00", "2025-01-15T09:00", ScheduleRecurrence.monthly(3, 15));

        assertInactive(schedule, "2025-02-15T08:30");
        assertActive(schedule, "2025-04-15T08:30");
        assertActive(schedule, "2025-07-15T08:30");
    }

    @Test
    void missingType_neverActive() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00",
                new ScheduleRecurrence(null, 1, null, null, null));

        assertThat(evaluator.occurrences(schedule, at("2025-11-12T22:00").atZone(ZONE), ZONE)).isEmpty();
        assertInactive(schedule, "2025-11-12T22:00");
    }

    @Test
    void skipException_suppressesWholeOccurrence() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00", ScheduleRecurrence.daily(1),
                ScheduleException.skipOn(LocalDate.parse("2025-11-14"), "holiday"));

        assertInactive(schedule, "2025-11-14T23:00");
        assertInactive(schedule, "2025-11-15T02:00");
        assertActive(schedule, "2025-11-13T23:00");
        assertActive(schedule, "2025-11-15T23:00");
    }

    @Test
    void overrideException_replacesWindow() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00", ScheduleRecurrence.daily(1),
                ScheduleException.overrideOn(LocalDate.parse("2025-11-14"),
                        ScheduleWindow.of(at("2025-11-14T18:00"), at("2025-11-14T19:00"))));

        assertActive(schedule, "2025-11-14T18:30");
        assertInactive(schedule, "2025-11-14T21:30");
        assertActive(schedule, "2025-11-15T21:30");
    }

    @Test
    void overrideException_withoutPositiveDuration_keepsOriginalDuration() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00", ScheduleRecurrence.daily(1),
                ScheduleException.overrideOn(LocalDate.parse("2025-11-14"),
                        ScheduleWindow.of(at("2025-11-14T18:00"), at("2025-11-14T18:00"))));

        assertActive(schedule, "2025-11-14T18:59");
        assertInactive(schedule, "2025-11-14T19:00");
    }

    @Test
    void exceptionWithoutSkipOrOverride_ignored() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-12T22:00", ScheduleRecurrence.daily(1),
                new ScheduleException(LocalDate.parse("2025-11-14"), "just a note", false, null));

        assertActive(schedule, "2025-11-14T21:30");
    }

    @Test
    void findActiveOccurrence_returnsResolvedOccurrence() {
        DeviceSchedule schedule = schedule("2025-11-12T21:00", "2025-11-13T06:00", ScheduleRecurrence.daily(1));

        Occurrence occurrence = evaluator.findActiveOccurrence(schedule, at("2025-11-15T03:00").atZone(ZONE), ZONE)
                                         .orElseThrow();

        assertThat(occurrence.start().toLocalDateTime()).isEqualTo(at("2025-11-14T21:00"));
        assertThat(occurrence.end().toLocalDateTime()).isEqualTo(at("2025-11-15T06:00"));
    }
}
