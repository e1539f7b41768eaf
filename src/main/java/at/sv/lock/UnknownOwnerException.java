package at.sv.lock;

public class UnknownOwnerException extends RuntimeException {
    public UnknownOwnerException(String message) {
        super(message);
    }
}
