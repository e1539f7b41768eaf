package at.sv.lock.schedule;

public class InvalidRecurrenceException extends InvalidScheduleException {
    public InvalidRecurrenceException(String message) {
        super(message);
    }
}
