package fwapi.spi;

/**
 * Exception thrown when no usable rule storage provider can be selected,
 * or the selected provider fails to create its repository.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
