package domain.exceptions;

/**
 * Failure raised by a post store. The in-memory store only raises
 * {@link PostNotFoundException}; other backends may raise this directly.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
