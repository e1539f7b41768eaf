package at.sv.lock.time;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static java.time.DayOfWeek.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DayOfWeeksParserTest {

    private void parse(String input, DayOfWeek... days) {
        EnumSet<DayOfWeek> dayOfWeeks = EnumSet.noneOf(DayOfWeek.class);
        DayOfWeeksParser.parseDayOfWeeks(input, dayOfWeeks);

        assertThat("Day of weeks differ for '" + input + "'.", dayOfWeeks, is(EnumSet.copyOf(Arrays.asList(days))));
    }

    @Test
    void canParseSingle() {
        parse("Fri", FRIDAY);
    }

    @Test
    void canParseSingle_twoLetterAndFullNames_caseInsensitive() {
        parse("fr", FRIDAY);
        parse("SUNDAY", SUNDAY);
        parse(" Wednesday ", WEDNESDAY);
    }

    @Test
    void canParseRange_simple() {
        parse("Mon-Wed", MONDAY, TUESDAY, WEDNESDAY);
    }

    @Test
    void canParseRange_sameDay() {
        parse("Mon-Mon", MONDAY);
    }

    @Test
    void canParseRange_multiple() {
        parse("Mon-Wed, Fri-Sun", MONDAY, TUESDAY, WEDNESDAY, FRIDAY, SATURDAY, SUNDAY);
    }

    @Test
    void canParseRange_overflowsEndOfWeek_continuesWithMonday() {
        parse("Fri-Tu", FRIDAY, SATURDAY, SUNDAY, MONDAY, TUESDAY);
    }

    @Test
    void parseCollection_combinesAllEntries() {
        EnumSet<DayOfWeek> days = DayOfWeeksParser.parseDayOfWeeks(List.of("Mon", "Wed-Thu", "sa"));

        assertThat(days, is(EnumSet.of(MONDAY, WEDNESDAY, THURSDAY, SATURDAY)));
    }

    @Test
    void parseCollection_empty_noDays() {
        assertThat(DayOfWeeksParser.parseDayOfWeeks(List.of()), is(EnumSet.noneOf(DayOfWeek.class)));
    }

    @Test
    void range_invalid_exception() {
        assertThrows(InvalidPropertyValue.class, () -> parse("Fri-"));
    }

    @Test
    void unknownDay_exception() {
        assertThrows(InvalidPropertyValue.class, () -> parse("Funday"));
    }
}
