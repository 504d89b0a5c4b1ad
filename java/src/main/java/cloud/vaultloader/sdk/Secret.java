package cloud.vaultloader.sdk;

import java.util.Objects;

/**
 * Identifies one path in the secret store whose payload is merged into the configuration.
 *
 * @param key path read from the store, for example {@code secret/data/payments}
 */
public record Secret(String key) {

    public Secret {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("secret key must be non-empty");
        }
    }
}
