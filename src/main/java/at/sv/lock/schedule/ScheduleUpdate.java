package at.sv.lock.schedule;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial update of a schedule. Fields left {@code null} keep their current value.
 */
@Value
@Builder
public class ScheduleUpdate {
    ScheduleScope scope;
    String ownerKey;
    String label;
    String description;
    ScheduleTarget targets;
    LockAction action;
    LockAction endAction;
    /**
     * Removes the end action, as {@code endAction = null} means unchanged.
     */
    boolean clearEndAction;
    ScheduleWindow window;
    ScheduleRecurrence recurrence;
    List<ScheduleException> exceptions;
    Boolean enabled;
    List<String> groupIds;

    public DeviceSchedule applyTo(DeviceSchedule schedule) {
        DeviceSchedule.DeviceScheduleBuilder builder = schedule.toBuilder();
        if (scope != null) {
            builder.scope(scope);
            if (scope == ScheduleScope.GLOBAL) {
                builder.ownerKey(null);
            }
        }
        if (ownerKey != null) {
            builder.ownerKey(ScheduleValidator.normalizeOwnerKey(ownerKey));
        }
        if (label != null) {
            builder.label(label);
        }
        if (description != null) {
            builder.description(description);
        }
        if (targets != null) {
            builder.targets(targets);
        }
        if (action != null) {
            builder.action(action);
        }
        if (clearEndAction) {
            builder.endAction(null);
        } else if (endAction != null) {
            builder.endAction(endAction);
        }
        if (window != null) {
            builder.window(window);
        }
        if (recurrence != null) {
            builder.recurrence(recurrence);
        }
        if (exceptions != null) {
            builder.exceptions(List.copyOf(exceptions));
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        return builder.build();
    }
}
