package at.sv.lock.store;

import at.sv.lock.schedule.CopyMode;
import at.sv.lock.schedule.CopyResult;
import at.sv.lock.schedule.DeviceSchedule;
import at.sv.lock.schedule.OwnerSchedules;
import at.sv.lock.schedule.ScheduleConfig;
import at.sv.lock.schedule.ScheduleGroupDetails;
import at.sv.lock.schedule.ScheduleMetadata;
import at.sv.lock.schedule.ScheduleRequest;
import at.sv.lock.schedule.ScheduleScope;
import at.sv.lock.schedule.ScheduleUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Canonical collection of schedules, schedule groups and their memberships.
 * <p>
 * All operations are atomic: a failing mutation leaves no partial state behind. After every mutation each schedule
 * that belongs to an active group is enabled, each schedule that only belongs to inactive groups is disabled, and at
 * most one group per owner scope is active. Schedules without group membership keep their own enabled flag.
 * Returned schedules and groups are immutable snapshots.
 */
public interface ScheduleStore {

    /**
     * Filters are combined with AND, a {@code null} filter is ignored.
     */
    List<DeviceSchedule> list(ScheduleScope scope, String ownerKey, Boolean enabled);

    default List<DeviceSchedule> list() {
        return list(null, null, null);
    }

    Optional<DeviceSchedule> get(String id);

    /**
     * @throws at.sv.lock.schedule.InvalidScheduleException   if the schedule is structurally invalid
     * @throws at.sv.lock.schedule.InvalidRecurrenceException if the recurrence is malformed
     * @throws GroupNotFoundException                         if one of the given group ids is unknown
     * @throws OwnerMismatchException                         if a group belongs to another owner
     */
    DeviceSchedule create(ScheduleRequest request);

    /**
     * Merges the given partial update. Changed group ids are diffed against the current memberships.
     *
     * @return the updated schedule, or empty if no schedule with the given id exists
     * @throws at.sv.lock.schedule.InvalidScheduleException if the resulting schedule is invalid
     * @throws GroupNotFoundException                       if one of the added group ids is unknown
     * @throws OwnerMismatchException                       if a group belongs to another owner
     */
    Optional<DeviceSchedule> update(String id, ScheduleUpdate update);

    /**
     * @return true, iff the schedule existed and was removed together with its memberships
     */
    boolean delete(String id);

    /**
     * Sets the enabled flag directly. Group managed schedules are pulled back to the state their groups dictate.
     */
    Optional<DeviceSchedule> setEnabled(String id, boolean enabled);

    OwnerSchedules listForOwner(String ownerKey);

    /**
     * Copies the schedule as an enabled owner schedule of the given owner, without group memberships.
     *
     * @return the clone, or empty if no schedule with the given id exists
     */
    Optional<DeviceSchedule> clone(String id, String targetOwner);

    /**
     * Clones all owner schedules of the source owner for the target owner. Does nothing if the source owner has
     * no schedules.
     */
    CopyResult copyOwnerSchedules(String sourceOwner, String targetOwner, CopyMode mode);

    /**
     * @param ownerKey the owner of the groups, or {@code null} for all groups
     */
    List<ScheduleGroupDetails> listGroups(String ownerKey);

    Optional<ScheduleGroupDetails> getGroup(String id);

    /**
     * A group requested as active but created without schedules is stored inactive.
     *
     * @throws ScheduleNotFoundException if one of the schedule ids is unknown
     * @throws OwnerMismatchException    if one of the schedules belongs to another owner
     */
    ScheduleGroupDetails createGroup(String name, String ownerKey, String description, List<String> scheduleIds,
                                     boolean active);

    /**
     * Parameters left {@code null} keep their current value.
     *
     * @throws ScheduleNotFoundException if one of the added schedule ids is unknown
     * @throws OwnerMismatchException    if one of the added schedules belongs to another owner
     * @throws EmptyGroupException       if the group should be active but has no schedules
     */
    Optional<ScheduleGroupDetails> updateGroup(String id, String name, String description, List<String> scheduleIds,
                                               Boolean active);

    /**
     * Removes the group and all its memberships. The member schedules themselves are kept.
     */
    boolean deleteGroup(String id);

    /**
     * Activating a group deactivates all other groups of the same owner scope.
     *
     * @throws EmptyGroupException if the group should be activated but has no schedules
     */
    Optional<ScheduleGroupDetails> setGroupActive(String id, boolean active);

    ScheduleMetadata getMetadata();

    /**
     * Imports the given document. If {@code replace} is set, the whole state is replaced; otherwise schedules and
     * groups with unknown ids are added and the time zone is taken over. Memberships in unknown groups or in groups
     * of another owner are dropped. If the result holds several active groups of the same owner scope, only the first
     * one stays active.
     */
    void syncFromConfig(ScheduleConfig config, boolean replace);
}
