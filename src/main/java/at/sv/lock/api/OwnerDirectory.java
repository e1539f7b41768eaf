package at.sv.lock.api;

public interface OwnerDirectory {

    /**
     * @return true, iff an owner with the given (case-insensitive) key is known
     */
    boolean exists(String ownerKey);
}
