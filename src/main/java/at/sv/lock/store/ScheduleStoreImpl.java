package at.sv.lock.store;

import at.sv.lock.schedule.CopyMode;
import at.sv.lock.schedule.CopyResult;
import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.OwnerSchedules;
import at.sv.lock.schedule.ScheduleConfig;
import at.sv.lock.schedule.ScheduleGroup;
import at.sv.lock.schedule.ScheduleGroupDetails;
import at.sv.lock.schedule.ScheduleMetadata;
import at.sv.lock.schedule.ScheduleRequest;
import at.sv.lock.schedule.ScheduleScope;
import at.sv.lock.schedule.ScheduleUpdate;
import at.sv.lock.schedule.ScheduleValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
public final class ScheduleStoreImpl implements ScheduleStore {

    private final SchedulePersistence persistence;
    private final Supplier<ZonedDateTime> currentTime;
    private final Supplier<String> idGenerator;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ScheduleData data;

    public ScheduleStoreImpl(SchedulePersistence persistence, Supplier<ZonedDateTime> currentTime) {
        this(persistence, currentTime, () -> UUID.randomUUID().toString());
    }

    ScheduleStoreImpl(SchedulePersistence persistence, Supplier<ZonedDateTime> currentTime,
                      Supplier<String> idGenerator) {
        this.persistence = persistence;
        this.currentTime = currentTime;
        this.idGenerator = idGenerator;
        ScheduleData loaded = ScheduleData.from(persistence.load());
        enforceActivation(loaded, now());
        data = loaded;
        log.debug("Loaded {} schedule(s) and {} group(s).", loaded.getSchedules().size(), loaded.getGroups().size());
    }

    @Override
    public List<DeviceSchedule> list(ScheduleScope scope, String ownerKey, Boolean enabled) {
        String owner = ScheduleValidator.normalizeOwnerKey(ownerKey);
        return read(current -> current.getSchedules().stream()
                                      .filter(schedule -> scope == null || schedule.getScope() == scope)
                                      .filter(schedule -> owner == null || owner.equals(schedule.getOwnerKey()))
                                      .filter(schedule -> enabled == null || schedule.isEnabled() == enabled)
                                      .map(schedule -> current.view(schedule.getId()))
                                      .toList());
    }

    @Override
    public Optional<DeviceSchedule> get(String id) {
        return read(current -> Optional.ofNullable(current.getSchedule(id)).map(schedule -> current.view(id)));
    }

    @Override
    public DeviceSchedule create(ScheduleRequest request) {
        return mutate(working -> {
            Instant now = now();
            DeviceSchedule schedule = DeviceSchedule.builder()
                                                    .id(idGenerator.get())
                                                    .scope(request.getScope())
                                                    .ownerKey(ScheduleValidator.normalizeOwnerKey(request.getOwnerKey()))
                                                    .label(request.getLabel())
                                                    .description(request.getDescription())
                                                    .targets(request.getTargets())
                                                    .action(request.getAction())
                                                    .endAction(request.getEndAction())
                                                    .window(request.getWindow())
                                                    .recurrence(request.getRecurrence())
                                                    .exceptions(copyOrEmpty(request.getExceptions()))
                                                    .enabled(request.getEnabled() == null || request.getEnabled())
                                                    .createdAt(now)
                                                    .updatedAt(now)
                                                    .build();
            ScheduleValidator.validate(schedule);
            working.putSchedule(schedule);
            for (String groupId : distinct(request.getGroupIds())) {
                addMembership(working, requireGroup(working, groupId), schedule.getId(), now);
            }
            enforceActivation(working, now);
            return working.view(schedule.getId());
        });
    }

    @Override
    public Optional<DeviceSchedule> update(String id, ScheduleUpdate update) {
        return mutate(working -> {
            DeviceSchedule current = working.getSchedule(id);
            if (current == null) {
                return Optional.empty();
            }
            Instant now = now();
            DeviceSchedule updated = update.applyTo(current).toBuilder().updatedAt(now).build();
            ScheduleValidator.validate(updated);
            working.putSchedule(updated);
            if (update.getGroupIds() != null) {
                Set<String> desired = distinct(update.getGroupIds());
                List<String> existing = working.getGroupIdsOf(id);
                existing.stream()
                        .filter(groupId -> !desired.contains(groupId))
                        .forEach(groupId -> working.removeMember(groupId, id));
                for (String groupId : desired) {
                    if (!existing.contains(groupId)) {
                        addMembership(working, requireGroup(working, groupId), id, now);
                    }
                }
            }
            for (String groupId : working.getGroupIdsOf(id)) {
                assertSameOwner(working.getGroup(groupId), updated);
            }
            enforceActivation(working, now);
            return Optional.of(working.view(id));
        });
    }

    @Override
    public boolean delete(String id) {
        return mutate(working -> {
            if (working.getSchedule(id) == null) {
                return false;
            }
            working.removeSchedule(id);
            enforceActivation(working, now());
            return true;
        });
    }

    @Override
    public Optional<DeviceSchedule> setEnabled(String id, boolean enabled) {
        return mutate(working -> {
            DeviceSchedule schedule = working.getSchedule(id);
            if (schedule == null) {
                return Optional.empty();
            }
            Instant now = now();
            working.putSchedule(schedule.toBuilder().enabled(enabled).updatedAt(now).build());
            enforceActivation(working, now);
            return Optional.of(working.view(id));
        });
    }

    @Override
    public OwnerSchedules listForOwner(String ownerKey) {
        String owner = ScheduleValidator.normalizeOwnerKey(ownerKey);
        return read(current -> {
            List<DeviceSchedule> ownerSchedules = new ArrayList<>();
            List<DeviceSchedule> globalSchedules = new ArrayList<>();
            for (DeviceSchedule schedule : current.getSchedules()) {
                if (schedule.isGlobal()) {
                    globalSchedules.add(current.view(schedule.getId()));
                } else if (owner != null && schedule.isOwnedBy(owner)) {
                    ownerSchedules.add(current.view(schedule.getId()));
                }
            }
            return new OwnerSchedules(ownerSchedules, globalSchedules);
        });
    }

    @Override
    public Optional<DeviceSchedule> clone(String id, String targetOwner) {
        String owner = requireOwner(targetOwner);
        return mutate(working -> {
            DeviceSchedule source = working.getSchedule(id);
            if (source == null) {
                return Optional.empty();
            }
            Instant now = now();
            DeviceSchedule clone = cloneForOwner(source, owner, now);
            working.putSchedule(clone);
            enforceActivation(working, now);
            return Optional.of(working.view(clone.getId()));
        });
    }

    @Override
    public CopyResult copyOwnerSchedules(String sourceOwner, String targetOwner, CopyMode mode) {
        String source = requireOwner(sourceOwner);
        String target = requireOwner(targetOwner);
        return mutate(working -> {
            List<DeviceSchedule> sources = working.getSchedules().stream()
                                                  .filter(schedule -> schedule.isOwnedBy(source))
                                                  .toList();
            if (sources.isEmpty()) {
                log.debug("Owner '{}' has no schedules to copy.", source);
                return new CopyResult(List.of(), 0);
            }
            Instant now = now();
            int replaced = 0;
            if (mode == CopyMode.REPLACE) {
                List<String> existing = working.getSchedules().stream()
                                               .filter(schedule -> schedule.isOwnedBy(target))
                                               .map(DeviceSchedule::getId)
                                               .toList();
                existing.forEach(working::removeSchedule);
                replaced = existing.size();
            }
            List<String> createdIds = new ArrayList<>();
            for (DeviceSchedule schedule : sources) {
                DeviceSchedule clone = cloneForOwner(schedule, target, now);
                working.putSchedule(clone);
                createdIds.add(clone.getId());
            }
            enforceActivation(working, now);
            log.info("Copied {} schedule(s) from '{}' to '{}' ({} replaced).", createdIds.size(), source, target,
                    replaced);
            return new CopyResult(createdIds.stream().map(working::view).toList(), replaced);
        });
    }

    @Override
    public List<ScheduleGroupDetails> listGroups(String ownerKey) {
        String owner = ScheduleValidator.normalizeOwnerKey(ownerKey);
        return read(current -> current.getGroups().stream()
                                      .filter(group -> owner == null || owner.equals(group.getOwnerKey()))
                                      .map(group -> current.getGroupDetails(group.getId()))
                                      .toList());
    }

    @Override
    public Optional<ScheduleGroupDetails> getGroup(String id) {
        return read(current -> Optional.ofNullable(current.getGroup(id)).map(group -> current.getGroupDetails(id)));
    }

    @Override
    public ScheduleGroupDetails createGroup(String name, String ownerKey, String description,
                                            List<String> scheduleIds, boolean active) {
        return mutate(working -> {
            Instant now = now();
            ScheduleGroup group = ScheduleGroup.builder()
                                               .id(idGenerator.get())
                                               .name(requireName(name))
                                               .ownerKey(ScheduleValidator.normalizeOwnerKey(ownerKey))
                                               .description(trimToNull(description))
                                               .active(false)
                                               .createdAt(now)
                                               .updatedAt(now)
                                               .build();
            working.putGroup(group);
            for (String scheduleId : distinct(scheduleIds)) {
                addMembership(working, group, scheduleId, now);
            }
            if (active && !working.getMembers(group.getId()).isEmpty()) {
                activateGroup(working, group.getId(), now);
            } else {
                if (active) {
                    log.debug("Group '{}' has no schedules. Creating it inactive.", group.getName());
                }
                enforceActivation(working, now);
            }
            return working.getGroupDetails(group.getId());
        });
    }

    @Override
    public Optional<ScheduleGroupDetails> updateGroup(String id, String name, String description,
                                                      List<String> scheduleIds, Boolean active) {
        return mutate(working -> {
            ScheduleGroup group = working.getGroup(id);
            if (group == null) {
                return Optional.empty();
            }
            Instant now = now();
            ScheduleGroup.ScheduleGroupBuilder builder = group.toBuilder().updatedAt(now);
            if (name != null) {
                builder.name(requireName(name));
            }
            if (description != null) {
                builder.description(trimToNull(description));
            }
            ScheduleGroup updated = builder.build();
            working.putGroup(updated);
            if (scheduleIds != null) {
                Set<String> desired = distinct(scheduleIds);
                Set<String> existing = new LinkedHashSet<>(working.getMembers(id));
                existing.stream()
                        .filter(scheduleId -> !desired.contains(scheduleId))
                        .forEach(scheduleId -> working.removeMember(id, scheduleId));
                for (String scheduleId : desired) {
                    if (!existing.contains(scheduleId)) {
                        addMembership(working, updated, scheduleId, now);
                    }
                }
            }
            applyActivation(working, id, active, now);
            return Optional.of(working.getGroupDetails(id));
        });
    }

    @Override
    public boolean deleteGroup(String id) {
        return mutate(working -> {
            if (working.getGroup(id) == null) {
                return false;
            }
            working.removeGroup(id);
            enforceActivation(working, now());
            return true;
        });
    }

    @Override
    public Optional<ScheduleGroupDetails> setGroupActive(String id, boolean active) {
        return mutate(working -> {
            if (working.getGroup(id) == null) {
                return Optional.empty();
            }
            applyActivation(working, id, active, now());
            return Optional.of(working.getGroupDetails(id));
        });
    }

    @Override
    public ScheduleMetadata getMetadata() {
        return read(ScheduleData::getMetadata);
    }

    @Override
    public void syncFromConfig(ScheduleConfig config, boolean replace) {
        config.schedules().forEach(ScheduleValidator::validate);
        mutate(working -> {
            if (replace) {
                working.clear();
                working.merge(config);
                working.setMetadata(config.metadata());
            } else {
                working.merge(config);
                working.setMetadata(working.getMetadata().withTimezone(config.metadata().timezone()));
            }
            enforceActivation(working, now());
            log.info("Synced {} schedule(s) and {} group(s) from config (replace={}).", config.schedules().size(),
                    config.groups().size(), replace);
            return null;
        });
    }

    private <T> T read(Function<ScheduleData, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(data);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies the mutation to a working copy, which is persisted and committed only if the mutation succeeded and
     * changed anything.
     */
    private <T> T mutate(Function<ScheduleData, T> mutation) {
        lock.writeLock().lock();
        try {
            ScheduleData working = data.copy();
            T result = mutation.apply(working);
            if (working.isModified()) {
                working.setMetadata(working.getMetadata().withGeneratedAt(now()));
                persistence.save(working.toConfig());
                data = working;
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void applyActivation(ScheduleData working, String groupId, Boolean active, Instant now) {
        if (active == null) {
            enforceActivation(working, now);
        } else if (active) {
            activateGroup(working, groupId, now);
        } else {
            deactivateGroup(working, groupId, now);
        }
    }

    private void activateGroup(ScheduleData working, String groupId, Instant now) {
        ScheduleGroup target = working.getGroup(groupId);
        if (working.getMembers(groupId).isEmpty()) {
            throw new EmptyGroupException("Group '" + target.getName() + "' has no schedules and can't be activated.");
        }
        for (ScheduleGroup group : List.copyOf(working.getGroups())) {
            if (!group.sharesOwnerScopeWith(target)) {
                continue;
            }
            boolean shouldBeActive = group.getId().equals(groupId);
            if (group.isActive() != shouldBeActive) {
                working.putGroup(group.toBuilder().active(shouldBeActive).updatedAt(now).build());
            }
        }
        enforceActivation(working, now);
    }

    private void deactivateGroup(ScheduleData working, String groupId, Instant now) {
        ScheduleGroup group = working.getGroup(groupId);
        if (group.isActive()) {
            working.putGroup(group.toBuilder().active(false).updatedAt(now).build());
        }
        enforceActivation(working, now);
    }

    /**
     * Deactivates active groups without members and every active group after the first one of the same owner scope,
     * then aligns the enabled flag of every group managed schedule with the union of the active groups.
     */
    private void enforceActivation(ScheduleData working, Instant now) {
        Set<String> activeScheduleIds = new HashSet<>();
        List<ScheduleGroup> activeGroups = new ArrayList<>();
        for (ScheduleGroup group : List.copyOf(working.getGroups())) {
            if (!group.isActive()) {
                continue;
            }
            Set<String> members = working.getMembers(group.getId());
            if (members.isEmpty()) {
                log.debug("Deactivating group '{}' as it has no schedules left.", group.getName());
                working.putGroup(group.toBuilder().active(false).updatedAt(now).build());
            } else if (activeGroups.stream().anyMatch(group::sharesOwnerScopeWith)) {
                log.warn("Deactivating group '{}' as another group of the same owner is already active.",
                        group.getName());
                working.putGroup(group.toBuilder().active(false).updatedAt(now).build());
            } else {
                activeGroups.add(group);
                activeScheduleIds.addAll(members);
            }
        }
        for (DeviceSchedule schedule : List.copyOf(working.getSchedules())) {
            if (!working.isGroupManaged(schedule.getId())) {
                continue;
            }
            boolean shouldBeEnabled = activeScheduleIds.contains(schedule.getId());
            if (schedule.isEnabled() != shouldBeEnabled) {
                working.putSchedule(schedule.toBuilder().enabled(shouldBeEnabled).updatedAt(now).build());
            }
        }
    }

    private void addMembership(ScheduleData working, ScheduleGroup group, String scheduleId, Instant now) {
        DeviceSchedule schedule = working.getSchedule(scheduleId);
        if (schedule == null) {
            throw new ScheduleNotFoundException("Schedule '" + scheduleId + "' not found.");
        }
        assertSameOwner(group, schedule);
        working.addMember(group.getId(), scheduleId);
        working.putSchedule(schedule.toBuilder().updatedAt(now).build());
    }

    private static void assertSameOwner(ScheduleGroup group, DeviceSchedule schedule) {
        if (ScheduleData.ownersConflict(group, schedule)) {
            throw new OwnerMismatchException("Schedule '" + schedule.getLabel() + "' of owner '"
                                             + schedule.getOwnerKey() + "' can't be added to group '"
                                             + group.getName() + "' of owner '" + group.getOwnerKey() + "'.");
        }
    }

    private static ScheduleGroup requireGroup(ScheduleData working, String groupId) {
        ScheduleGroup group = working.getGroup(groupId);
        if (group == null) {
            throw new GroupNotFoundException("Group '" + groupId + "' not found.");
        }
        return group;
    }

    private DeviceSchedule cloneForOwner(DeviceSchedule source, String ownerKey, Instant now) {
        return source.toBuilder()
                     .id(idGenerator.get())
                     .scope(ScheduleScope.OWNER)
                     .ownerKey(ownerKey)
                     .groupIds(List.of())
                     .enabled(true)
                     .createdAt(now)
                     .updatedAt(now)
                     .build();
    }

    private static String requireOwner(String ownerKey) {
        String owner = ScheduleValidator.normalizeOwnerKey(ownerKey);
        if (owner == null) {
            throw new IllegalArgumentException("Owner key is required.");
        }
        return owner;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required.");
        }
        return name.trim();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Set<String> distinct(List<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        return new LinkedHashSet<>(ids);
    }

    private static <T> List<T> copyOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private Instant now() {
        return currentTime.get().toInstant();
    }
}
