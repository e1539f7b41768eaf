package at.sv.lock.store;

/**
 * Thrown if a group without member schedules should be activated.
 */
public class EmptyGroupException extends RuntimeException {
    public EmptyGroupException(String message) {
        super(message);
    }
}
