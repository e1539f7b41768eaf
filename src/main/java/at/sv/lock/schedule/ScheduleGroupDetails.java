package at.sv.lock.schedule;

import java.util.List;

public record ScheduleGroupDetails(ScheduleGroup group, List<DeviceSchedule> schedules) {

    public List<String> getScheduleIds() {
        return schedules.stream().map(DeviceSchedule::getId).toList();
    }
}
