package at.sv.lock.api;

public record Device(String name, String mac, String type, String owner) {

    public static final String UNREGISTERED_OWNER = "unregistered";
    public static final String UNKNOWN_TYPE = "unknown";

    /**
     * @return a placeholder for a MAC address that is not part of the inventory
     */
    public static Device unregistered(String mac) {
        return new Device(mac, mac, UNKNOWN_TYPE, UNREGISTERED_OWNER);
    }
}
