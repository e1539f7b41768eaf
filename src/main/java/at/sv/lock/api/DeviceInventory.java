package at.sv.lock.api;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the registered devices. MAC addresses and owner keys are compared in lower case.
 */
public interface DeviceInventory {

    /**
     * @return all registered devices. Not null.
     */
    List<Device> listAll();

    /**
     * @return the devices of the given owner, or an empty list if the owner is unknown. Not null.
     */
    List<Device> listByOwner(String ownerKey);

    Optional<Device> getByMac(String mac);
}
