package net.fiddleserver.exception;

/**
 * Thrown when the bundle store cannot answer a read for reasons other than a missing or
 * inaccessible object, such as network failures or 5xx responses.
 */
public class ObjectStoreUnavailableException extends RuntimeException {

    private final String key;

    public ObjectStoreUnavailableException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
