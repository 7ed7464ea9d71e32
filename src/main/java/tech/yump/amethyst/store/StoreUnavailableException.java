package tech.yump.amethyst.store;

/**
 * The database could not be reached or no pooled connection became available in time.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
