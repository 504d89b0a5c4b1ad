package cloud.vaultloader.sdk;

import java.util.List;

/**
 * Exception representing an error returned by the Vault HTTP API. When the server responds with a non-2xx status
 * the loader hydrates this type so callers can inspect both the HTTP status and the messages Vault reported.
 */
public final class VaultApiException extends VaultLoaderException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<String> errors;

    public VaultApiException(int statusCode, List<String> errors) {
        super(message(statusCode, errors));
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * @return HTTP status code returned by Vault.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return messages from the {@code errors} array of the response body, empty when the body carried none.
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String message(int status, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Vault request failed with status " + status;
        }
        return "Vault request failed with status " + status + ": " + String.join("; ", errors);
    }
}
