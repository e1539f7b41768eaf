package at.sv.lock.api;

/**
 * Outcome of a lock or unlock request for a single device.
 *
 * @param locked the lock state of the device after the request
 */
public record DeviceActionResult(String mac, boolean locked, ActionStatus status, String message) {

    public static DeviceActionResult success(String mac, boolean locked) {
        return new DeviceActionResult(mac, locked, ActionStatus.SUCCESS, null);
    }

    public static DeviceActionResult skipped(String mac, boolean locked, String message) {
        return new DeviceActionResult(mac, locked, ActionStatus.SKIPPED, message);
    }

    public static DeviceActionResult error(String mac, boolean locked, String message) {
        return new DeviceActionResult(mac, locked, ActionStatus.ERROR, message);
    }

    public boolean isError() {
        return status == ActionStatus.ERROR;
    }
}
