package at.sv.lock.schedule;

import java.util.List;

/**
 * @param devices literal MAC addresses
 * @param tags    {@code all-devices}, {@code <owner>-all} or an owner key
 */
public record ScheduleTarget(List<String> devices, List<String> tags) {

    public ScheduleTarget {
        devices = devices == null ? List.of() : List.copyOf(devices);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ScheduleTarget devices(String... macs) {
        return new ScheduleTarget(List.of(macs), List.of());
    }

    public static ScheduleTarget tags(String... tags) {
        return new ScheduleTarget(List.of(), List.of(tags));
    }
}
