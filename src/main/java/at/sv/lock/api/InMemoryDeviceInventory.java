package at.sv.lock.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable inventory and owner directory backed by the given devices and owners.
 */
public final class InMemoryDeviceInventory implements DeviceInventory, OwnerDirectory {

    private final List<Device> devices;
    private final Map<String, Device> devicesByMac;
    private final Map<String, List<Device>> devicesByOwner;
    private final Set<String> ownerKeys;

    public InMemoryDeviceInventory(Collection<Device> devices, Collection<Owner> owners) {
        this.devices = List.copyOf(devices);
        devicesByMac = new LinkedHashMap<>();
        devicesByOwner = new LinkedHashMap<>();
        for (Device device : devices) {
            devicesByMac.put(normalize(device.mac()), device);
            devicesByOwner.computeIfAbsent(normalize(device.owner()), key -> new ArrayList<>()).add(device);
        }
        ownerKeys = owners.stream().map(owner -> normalize(owner.key())).collect(Collectors.toUnmodifiableSet());
    }

    public static InMemoryDeviceInventory empty() {
        return new InMemoryDeviceInventory(List.of(), List.of());
    }

    @Override
    public List<Device> listAll() {
        return devices;
    }

    @Override
    public List<Device> listByOwner(String ownerKey) {
        return List.copyOf(devicesByOwner.getOrDefault(normalize(ownerKey), List.of()));
    }

    @Override
    public Optional<Device> getByMac(String mac) {
        return Optional.ofNullable(devicesByMac.get(normalize(mac)));
    }

    @Override
    public boolean exists(String ownerKey) {
        return ownerKey != null && ownerKeys.contains(normalize(ownerKey));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
