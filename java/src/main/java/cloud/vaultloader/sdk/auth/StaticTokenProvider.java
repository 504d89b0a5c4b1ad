package cloud.vaultloader.sdk.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * AuthProvider returning a pre-issued token, such as a development root token or one read from {@code VAULT_TOKEN}.
 */
public final class StaticTokenProvider implements AuthProvider {

    private final AuthToken token;

    public StaticTokenProvider(String token, Duration ttl) {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative");
        }
        this.token = new AuthToken(token, ttl);
    }

    @Override
    public AuthToken token() {
        return token;
    }
}
