package at.sv.lock.schedule;

/**
 * Thrown if a schedule is structurally invalid, e.g. an owner schedule without owner key.
 */
public class InvalidScheduleException extends RuntimeException {
    public InvalidScheduleException(String message) {
        super(message);
    }
}
