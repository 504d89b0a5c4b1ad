package cloud.vaultloader.sdk;

/**
 * Base exception raised when a refresh cycle cannot complete.
 */
public class VaultLoaderException extends Exception {

    private static final long serialVersionUID = 1L;

    public VaultLoaderException(String message) {
        super(message);
    }

    public VaultLoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
