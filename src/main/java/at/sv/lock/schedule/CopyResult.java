package at.sv.lock.schedule;

import java.util.List;

/**
 * @param created       the clones created for the target owner
 * @param replacedCount the number of target schedules removed in {@link CopyMode#REPLACE} mode
 */
public record CopyResult(List<DeviceSchedule> created, int replacedCount) {
}
