package at.sv.lock.api;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Dry-run gateway used when no network controller is connected. Every device is reported as skipped.
 */
@Slf4j
public final class LoggingDeviceActionGateway implements DeviceActionGateway {

    static final String DRY_RUN = "dry run";

    @Override
    public List<DeviceActionResult> apply(List<Device> devices, boolean unlock, String actor, String reason) {
        return devices.stream()
                      .map(device -> {
                          log.info("Dry run: {} {} ({}, owner={}) requested by {}: {}", unlock ? "Unlock" : "Lock",
                                  device.mac(), device.name(), device.owner(), actor, reason);
                          return DeviceActionResult.skipped(device.mac(), !unlock, DRY_RUN);
                      })
                      .toList();
    }
}
