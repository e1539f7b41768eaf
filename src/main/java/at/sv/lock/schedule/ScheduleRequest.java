package at.sv.lock.schedule;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The caller supplied part of a new schedule. Id and timestamps are assigned by the store.
 */
@Value
@Builder
public class ScheduleRequest {
    ScheduleScope scope;
    String ownerKey;
    String label;
    String description;
    ScheduleTarget targets;
    LockAction action;
    LockAction endAction;
    ScheduleWindow window;
    ScheduleRecurrence recurrence;
    List<ScheduleException> exceptions;
    Boolean enabled;
    List<String> groupIds;
}
