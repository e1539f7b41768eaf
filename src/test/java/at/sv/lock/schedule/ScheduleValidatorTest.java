package at.sv.lock.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleValidatorTest {

    private static DeviceSchedule.DeviceScheduleBuilder valid() {
        return DeviceSchedule.builder()
                             .id("1")
                             .scope(ScheduleScope.GLOBAL)
                             .label("Bedtime")
                             .targets(ScheduleTarget.tags("all-devices"))
                             .action(LockAction.LOCK)
                             .window(ScheduleWindow.of(LocalDateTime.parse("2025-11-12T21:00"),
                                     LocalDateTime.parse("2025-11-13T06:00")))
                             .recurrence(ScheduleRecurrence.daily(1));
    }

    @Test
    void normalizeOwnerKey() {
        assertThat(ScheduleValidator.normalizeOwnerKey(" Alice ")).isEqualTo("alice");
        assertThat(ScheduleValidator.normalizeOwnerKey("  ")).isNull();
        assertThat(ScheduleValidator.normalizeOwnerKey(null)).isNull();
    }

    @Test
    void validate_validSchedule_passes() {
        assertThatCode(() -> ScheduleValidator.validate(valid().build())).doesNotThrowAnyException();
    }

    @Test
    void validate_missingAction_invalid() {
        assertThatThrownBy(() -> ScheduleValidator.validate(valid().action(null).build()))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void validate_missingRecurrenceType_invalidRecurrence() {
        assertThatThrownBy(() -> ScheduleValidator.validate(valid()
                .recurrence(new ScheduleRecurrence(null, 1, null, null, null)).build()))
                .isInstanceOf(InvalidRecurrenceException.class);
    }

    @Test
    void validate_exceptionWithoutDate_invalid() {
        assertThatThrownBy(() -> ScheduleValidator.validate(valid()
                .exceptions(List.of(new ScheduleException(null, "x", true, null))).build()))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void validate_overrideWindowWithoutEnd_invalid() {
        ScheduleException exception = ScheduleException.overrideOn(LocalDate.parse("2025-11-14"),
                ScheduleWindow.of(LocalDateTime.parse("2025-11-14T18:00"), null));

        assertThatThrownBy(() -> ScheduleValidator.validate(valid().exceptions(List.of(exception)).build()))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void validateRecurrence_weeklyRange_passes() {
        assertThatCode(() -> ScheduleValidator.validateRecurrence(ScheduleRecurrence.weekly(2, "Mon-Fri")))
                .doesNotThrowAnyException();
    }
}
