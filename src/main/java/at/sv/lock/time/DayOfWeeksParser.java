package at.sv.lock.time;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;

public final class DayOfWeeksParser {

    private DayOfWeeksParser() {
    }

    /**
     * @param values single days ("Fri"), ranges ("Mon-Thu") or comma separated combinations of both
     * @return the parsed days, empty if no values are given
     * @throws InvalidPropertyValue if a day or range can't be parsed
     */
    public static EnumSet<DayOfWeek> parseDayOfWeeks(Collection<String> values) {
        EnumSet<DayOfWeek> dayOfWeeks = EnumSet.noneOf(DayOfWeek.class);
        for (String value : values) {
            parseDayOfWeeks(value, dayOfWeeks);
        }
        return dayOfWeeks;
    }

    public static void parseDayOfWeeks(String value, EnumSet<DayOfWeek> dayOfWeeks) {
        String[] days = value.split(",");
        for (String day : days) {
            if (day.contains("-")) {
                String[] rangeStartAndEnd = getAndAssertDayRange(day);
                DayOfWeek rangeStart = parseDay(rangeStartAndEnd[0]);
                DayOfWeek rangeEnd = parseDay(rangeStartAndEnd[1]);
                if (overFlowsEndOfWeek(rangeStart, rangeEnd)) {
                    dayOfWeeks.addAll(EnumSet.range(rangeStart, DayOfWeek.SUNDAY));
                    dayOfWeeks.addAll(EnumSet.range(DayOfWeek.MONDAY, rangeEnd));
                } else {
                    dayOfWeeks.addAll(EnumSet.range(rangeStart, rangeEnd));
                }
            } else {
                dayOfWeeks.add(parseDay(day));
            }
        }
    }

    private static String[] getAndAssertDayRange(String day) {
        String[] rangeStartAndEnd = day.split("-");
        if (rangeStartAndEnd.length != 2) {
            throw new InvalidPropertyValue("Invalid day range definition '" + day + "'. Please make sure to separate the days with a single dash ('-').");
        }
        return rangeStartAndEnd;
    }

    private static DayOfWeek parseDay(String day) {
        switch (day.trim().toLowerCase(Locale.ENGLISH)) {
            case "mo":
            case "mon":
            case "monday":
                return DayOfWeek.MONDAY;
            case "tu":
            case "tue":
            case "tuesday":
                return DayOfWeek.TUESDAY;
            case "we":
            case "wed":
            case "wednesday":
                return DayOfWeek.WEDNESDAY;
            case "th":
            case "thu":
            case "thursday":
                return DayOfWeek.THURSDAY;
            case "fr":
            case "fri":
            case "friday":
                return DayOfWeek.FRIDAY;
            case "sa":
            case "sat":
            case "saturday":
                return DayOfWeek.SATURDAY;
            case "su":
            case "sun":
            case "sunday":
                return DayOfWeek.SUNDAY;
            default:
                throw new InvalidPropertyValue("Unknown day of week '" + day + "'. " +
                        "Supported values (case insensitive): [Mo|Mon|Monday, Tu|Tue|Tuesday, We|Wed|Wednesday, " +
                        "Th|Thu|Thursday, Fr|Fri|Friday, Sa|Sat|Saturday, Su|Sun|Sunday]");
        }
    }

    private static boolean overFlowsEndOfWeek(DayOfWeek rangeStart, DayOfWeek rangeEnd) {
        return rangeStart.compareTo(rangeEnd) > 0;
    }
}
