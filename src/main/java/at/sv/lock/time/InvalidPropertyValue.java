package at.sv.lock.time;

public class InvalidPropertyValue extends RuntimeException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
