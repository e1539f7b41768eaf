package at.sv.lock.schedule;

import java.util.List;

public record OwnerSchedules(List<DeviceSchedule> ownerSchedules, List<DeviceSchedule> globalSchedules) {
}
