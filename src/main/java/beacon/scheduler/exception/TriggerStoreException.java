package beacon.scheduler.exception;

/**
 * Exception thrown when the backing store fails (connectivity, SQL errors)
 */
public class TriggerStoreException extends RuntimeException {
    public TriggerStoreException(String message) {
        super(message);
    }

    public TriggerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
