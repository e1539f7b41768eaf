package at.sv.lock.schedule;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutual exclusion scope over a set of schedules. Only one group per owner scope can be active; a {@code null}
 * owner key denotes a global group.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScheduleGroup {
    String id;
    String name;
    String description;
    String ownerKey;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public boolean sharesOwnerScopeWith(ScheduleGroup other) {
        return Objects.equals(ownerKey, other.ownerKey);
    }
}
