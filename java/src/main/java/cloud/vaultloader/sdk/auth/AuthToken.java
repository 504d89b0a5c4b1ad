package cloud.vaultloader.sdk.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Bearer credential issued by an {@link AuthProvider} together with the duration it stays valid.
 */
public record AuthToken(String token, Duration ttl) {

    public AuthToken {
        Objects.requireNonNull(token, "token");
        ttl = ttl == null ? Duration.ZERO : ttl;
    }

    @Override
    public String toString() {
        return "AuthToken[token=<redacted>, ttl=" + ttl + "]";
    }
}
