package at.sv.lock.store;

import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.ScheduleConfig;
import at.sv.lock.schedule.ScheduleGroup;
import at.sv.lock.schedule.ScheduleGroupDetails;
import at.sv.lock.schedule.ScheduleMetadata;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of the {@link ScheduleStoreImpl}. The store only ever mutates a {@link #copy()} and swaps it in once
 * the whole operation succeeded. Stored schedules carry no group ids, those are derived from the memberships.
 */
@Slf4j
final class ScheduleData {

    private final Map<String, DeviceSchedule> schedules;
    private final Map<String, ScheduleGroup> groups;
    private final Map<String, Set<String>> membersByGroup;
    @Getter
    private ScheduleMetadata metadata;
    @Getter
    private boolean modified;

    ScheduleData(ScheduleMetadata metadata) {
        schedules = new LinkedHashMap<>();
        groups = new LinkedHashMap<>();
        membersByGroup = new LinkedHashMap<>();
        this.metadata = metadata;
    }

    private ScheduleData(ScheduleData other) {
        schedules = new LinkedHashMap<>(other.schedules);
        groups = new LinkedHashMap<>(other.groups);
        membersByGroup = new LinkedHashMap<>();
        other.membersByGroup.forEach((groupId, members) -> membersByGroup.put(groupId, new LinkedHashSet<>(members)));
        metadata = other.metadata;
    }

    static ScheduleData from(ScheduleConfig config) {
        ScheduleData data = new ScheduleData(config.metadata());
        data.merge(config);
        data.modified = false;
        return data;
    }

    ScheduleData copy() {
        return new ScheduleData(this);
    }

    /**
     * Adds all groups and schedules with unknown ids. Memberships are taken from the group ids of the added
     * schedules; references to unknown groups and to groups of another owner are dropped.
     */
    void merge(ScheduleConfig config) {
        for (ScheduleGroup group : config.groups()) {
            if (!groups.containsKey(group.getId())) {
                putGroup(group);
            }
        }
        for (DeviceSchedule schedule : config.schedules()) {
            if (schedules.containsKey(schedule.getId())) {
                continue;
            }
            putSchedule(schedule);
            for (String groupId : schedule.getGroupIds()) {
                ScheduleGroup group = groups.get(groupId);
                if (group == null) {
                    log.warn("Schedule '{}' references unknown group '{}'. Ignoring membership.", schedule.getId(),
                            groupId);
                } else if (ownersConflict(group, schedule)) {
                    log.warn("Schedule '{}' of owner '{}' references group '{}' of owner '{}'. Ignoring membership.",
                            schedule.getId(), schedule.getOwnerKey(), groupId, group.getOwnerKey());
                } else {
                    addMember(groupId, schedule.getId());
                }
            }
        }
    }

    static boolean ownersConflict(ScheduleGroup group, DeviceSchedule schedule) {
        return group.getOwnerKey() != null && schedule.getOwnerKey() != null
               && !group.getOwnerKey().equals(schedule.getOwnerKey());
    }

    void clear() {
        schedules.clear();
        groups.clear();
        membersByGroup.clear();
        modified = true;
    }

    ScheduleConfig toConfig() {
        List<DeviceSchedule> views = schedules.keySet().stream().map(this::view).toList();
        return new ScheduleConfig(metadata, views, List.copyOf(groups.values()));
    }

    void setMetadata(ScheduleMetadata metadata) {
        this.metadata = metadata;
        modified = true;
    }

    DeviceSchedule getSchedule(String id) {
        return schedules.get(id);
    }

    Collection<DeviceSchedule> getSchedules() {
        return Collections.unmodifiableCollection(schedules.values());
    }

    void putSchedule(DeviceSchedule schedule) {
        schedules.put(schedule.getId(), schedule.getGroupIds().isEmpty() ? schedule
                : schedule.toBuilder().groupIds(List.of()).build());
        modified = true;
    }

    void removeSchedule(String id) {
        schedules.remove(id);
        membersByGroup.values().forEach(members -> members.remove(id));
        modified = true;
    }

    /**
     * @return the stored schedule together with its derived group ids
     */
    DeviceSchedule view(String id) {
        DeviceSchedule schedule = schedules.get(id);
        List<String> groupIds = getGroupIdsOf(id);
        if (groupIds.isEmpty()) {
            return schedule;
        }
        return schedule.toBuilder().groupIds(groupIds).build();
    }

    ScheduleGroup getGroup(String id) {
        return groups.get(id);
    }

    Collection<ScheduleGroup> getGroups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    void putGroup(ScheduleGroup group) {
        groups.put(group.getId(), group);
        membersByGroup.computeIfAbsent(group.getId(), id -> new LinkedHashSet<>());
        modified = true;
    }

    void removeGroup(String id) {
        groups.remove(id);
        membersByGroup.remove(id);
        modified = true;
    }

    ScheduleGroupDetails getGroupDetails(String id) {
        List<DeviceSchedule> members = getMembers(id).stream().map(this::view).toList();
        return new ScheduleGroupDetails(groups.get(id), members);
    }

    Set<String> getMembers(String groupId) {
        return Collections.unmodifiableSet(membersByGroup.getOrDefault(groupId, Set.of()));
    }

    void addMember(String groupId, String scheduleId) {
        membersByGroup.computeIfAbsent(groupId, id -> new LinkedHashSet<>()).add(scheduleId);
        modified = true;
    }

    void removeMember(String groupId, String scheduleId) {
        Set<String> members = membersByGroup.get(groupId);
        if (members != null && members.remove(scheduleId)) {
            modified = true;
        }
    }

    List<String> getGroupIdsOf(String scheduleId) {
        List<String> groupIds = new ArrayList<>();
        membersByGroup.forEach((groupId, members) -> {
            if (members.contains(scheduleId)) {
                groupIds.add(groupId);
            }
        });
        return groupIds;
    }

    boolean isGroupManaged(String scheduleId) {
        return membersByGroup.values().stream().anyMatch(members -> members.contains(scheduleId));
    }
}
