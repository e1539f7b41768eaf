package at.sv.lock.api;

import java.util.List;

/**
 * JSON layout of the inventory file.
 */
public record InventoryDocument(List<Owner> owners, List<Device> devices) {

    public InventoryDocument {
        owners = owners == null ? List.of() : owners;
        devices = devices == null ? List.of() : devices;
    }
}
