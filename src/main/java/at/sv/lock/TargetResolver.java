package at.sv.lock;

import at.sv.lock.api.Device;
import at.sv.lock.api.DeviceInventory;
import at.sv.lock.api.OwnerDirectory;
import at.sv.lock.schedule.ScheduleTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands the targets of a schedule into concrete devices, deduplicated by MAC address in first-seen order.
 */
@Slf4j
@RequiredArgsConstructor
public final class TargetResolver {

    static final String ALL_DEVICES_TAG = "all-devices";
    static final String OWNER_TAG_SUFFIX = "-all";

    private final DeviceInventory inventory;
    private final OwnerDirectory ownerDirectory;

    public List<Device> resolve(ScheduleTarget target) {
        if (target == null) {
            return List.of();
        }
        Map<String, Device> devices = new LinkedHashMap<>();
        for (String mac : target.devices()) {
            String normalizedMac = normalize(mac);
            if (normalizedMac.isEmpty()) {
                continue;
            }
            Device device = inventory.getByMac(normalizedMac).orElseGet(() -> Device.unregistered(normalizedMac));
            devices.putIfAbsent(normalizedMac, device);
        }
        for (String tag : target.tags()) {
            for (Device device : resolveTag(normalize(tag))) {
                devices.putIfAbsent(normalize(device.mac()), device);
            }
        }
        return new ArrayList<>(devices.values());
    }

    private List<Device> resolveTag(String tag) {
        if (ALL_DEVICES_TAG.equals(tag)) {
            return inventory.listAll();
        }
        if (tag.endsWith(OWNER_TAG_SUFFIX) && tag.length() > OWNER_TAG_SUFFIX.length()) {
            return inventory.listByOwner(tag.substring(0, tag.length() - OWNER_TAG_SUFFIX.length()));
        }
        if (!tag.isEmpty() && ownerDirectory.exists(tag)) {
            return inventory.listByOwner(tag);
        }
        log.warn("Unknown target tag '{}'. Skipping.", tag);
        return List.of();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
