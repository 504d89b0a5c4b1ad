package cloud.vaultloader.sdk;

/**
 * Raised by the {@link PollWatcher} once every attempt of a refresh cycle has failed.
 */
public final class RetryExhaustedException extends VaultLoaderException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetryExhaustedException(String loaderName, int attempts, Throwable lastFailure) {
        super("loader " + loaderName + " failed to refresh after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
