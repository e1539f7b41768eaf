package at.sv.lock.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A recurring time window that locks or unlocks a set of devices. Instances are immutable, use
 * {@link #toBuilder()} to derive modified copies.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DeviceSchedule {
    String id;
    ScheduleScope scope;
    String ownerKey;
    String label;
    String description;
    ScheduleTarget targets;
    LockAction action;
    LockAction endAction;
    ScheduleWindow window;
    ScheduleRecurrence recurrence;
    @Builder.Default
    List<ScheduleException> exceptions = List.of();
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    List<String> groupIds = List.of();
    Instant createdAt;
    Instant updatedAt;

    public boolean isOwnedBy(String ownerKey) {
        return scope == ScheduleScope.OWNER && ownerKey != null && ownerKey.equals(this.ownerKey);
    }

    @JsonIgnore
    public boolean isGlobal() {
        return scope == ScheduleScope.GLOBAL;
    }

    @JsonIgnore
    public String getContextName() {
        return label == null ? id : label;
    }
}
