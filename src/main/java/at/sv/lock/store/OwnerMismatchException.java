package at.sv.lock.store;

/**
 * Thrown if an owner schedule is added to a group of another owner.
 */
public class OwnerMismatchException extends RuntimeException {
    public OwnerMismatchException(String message) {
        super(message);
    }
}
