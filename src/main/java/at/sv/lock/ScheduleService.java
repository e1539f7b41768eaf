package at.sv.lock;

import at.sv.lock.api.OwnerDirectory;
import at.sv.lock.schedule.CopyMode;
import at.sv.lock.schedule.CopyResult;
import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.OwnerSchedules;
import at.sv.lock.schedule.ScheduleGroupDetails;
import at.sv.lock.schedule.ScheduleRequest;
import at.sv.lock.schedule.ScheduleScope;
import at.sv.lock.schedule.ScheduleUpdate;
import at.sv.lock.schedule.ScheduleValidator;
import at.sv.lock.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers that modify schedules on behalf of an owner. Verifies that referenced owners exist
 * before delegating to the {@link ScheduleStore}.
 */
@Slf4j
@RequiredArgsConstructor
public final class ScheduleService {

    private final ScheduleStore store;
    private final OwnerDirectory ownerDirectory;

    public DeviceSchedule create(ScheduleRequest request) {
        if (request.getScope() == ScheduleScope.OWNER) {
            assertOwnerExists(request.getOwnerKey());
        }
        DeviceSchedule schedule = store.create(request);
        log.info("Created schedule '{}' ({}).", schedule.getLabel(), schedule.getId());
        return schedule;
    }

    public Optional<DeviceSchedule> update(String id, ScheduleUpdate update) {
        if (update.getOwnerKey() != null && update.getScope() != ScheduleScope.GLOBAL) {
            assertOwnerExists(update.getOwnerKey());
        }
        return store.update(id, update);
    }

    public boolean delete(String id) {
        return store.delete(id);
    }

    public Optional<DeviceSchedule> setEnabled(String id, boolean enabled) {
        return store.setEnabled(id, enabled);
    }

    public OwnerSchedules listForOwner(String ownerKey) {
        assertOwnerExists(ownerKey);
        return store.listForOwner(ownerKey);
    }

    public Optional<DeviceSchedule> clone(String id, String targetOwner) {
        assertOwnerExists(targetOwner);
        return store.clone(id, targetOwner);
    }

    public CopyResult copyOwnerSchedules(String sourceOwner, String targetOwner, CopyMode mode) {
        assertOwnerExists(sourceOwner);
        assertOwnerExists(targetOwner);
        return store.copyOwnerSchedules(sourceOwner, targetOwner, mode);
    }

    public ScheduleGroupDetails createGroup(String name, String ownerKey, String description,
                                            List<String> scheduleIds, boolean active) {
        if (ownerKey != null) {
            assertOwnerExists(ownerKey);
        }
        return store.createGroup(name, ownerKey, description, scheduleIds, active);
    }

    public Optional<ScheduleGroupDetails> setGroupActive(String id, boolean active) {
        return store.setGroupActive(id, active);
    }

    private void assertOwnerExists(String ownerKey) {
        String owner = ScheduleValidator.normalizeOwnerKey(ownerKey);
        if (owner == null || !ownerDirectory.exists(owner)) {
            throw new UnknownOwnerException("Unknown owner '" + ownerKey + "'.");
        }
    }
}
