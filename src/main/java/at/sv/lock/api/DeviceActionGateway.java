package at.sv.lock.api;

import java.util.List;

/**
 * Applies lock and unlock actions on the network controller.
 */
public interface DeviceActionGateway {

    /**
     * Failures for single devices are reported as {@link ActionStatus#ERROR} results and do not abort the
     * remaining devices. Implementations own their request timeouts.
     *
     * @param devices the devices to lock or unlock
     * @param unlock  true to unlock, false to lock
     * @param actor   who requested the action, e.g. {@code schedule:<id>}
     * @param reason  a human-readable reason, may be null
     * @return one result per given device. Not null.
     */
    List<DeviceActionResult> apply(List<Device> devices, boolean unlock, String actor, String reason);
}
