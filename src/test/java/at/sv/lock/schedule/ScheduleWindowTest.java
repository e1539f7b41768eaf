package at.sv.lock.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class ScheduleWindowTest {

    private static Duration canonicalDuration(String start, String end) {
        return ScheduleWindow.of(LocalDateTime.parse(start), LocalDateTime.parse(end)).canonicalDuration();
    }

    @Test
    void canonicalDuration_positiveWindow_unchanged() {
        assertThat(canonicalDuration("2025-11-12T21:00", "2025-11-13T06:00"), is(Duration.ofHours(9)));
    }

    @Test
    void canonicalDuration_endBeforeStartOnSameDate_readAsOvernight() {
        assertThat(canonicalDuration("2025-11-12T21:00", "2025-11-12T06:00"), is(Duration.ofHours(9)));
    }

    @Test
    void canonicalDuration_endEqualsStart_fullDay() {
        assertThat(canonicalDuration("2025-11-12T21:00", "2025-11-12T21:00"), is(Duration.ofDays(1)));
    }

    @Test
    void canonicalDuration_endDaysBeforeStart_addsWholeDays() {
        assertThat(canonicalDuration("2025-11-12T21:00", "2025-11-10T22:00"), is(Duration.ofHours(1)));
    }
}
