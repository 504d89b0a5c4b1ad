package cloud.vaultloader.sdk.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration used to bootstrap {@link HttpVaultClient} and {@link
 * cloud.vaultloader.sdk.auth.KubernetesAuthProvider} instances.
 */
public final class VaultClientConfig {

    public static final String DEFAULT_ADDRESS = "https://127.0.0.1:8200";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String ENV_ADDRESS = "VAULT_ADDR";
    static final String ENV_NAMESPACE = "VAULT_NAMESPACE";
    static final String ENV_TOKEN = "VAULT_TOKEN";

    private final String address;
    private final String namespace;
    private final String token;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    private VaultClientConfig(Builder builder) {
        this.address = builder.address;
        this.namespace = builder.namespace;
        this.token = builder.token;
        this.httpClient = builder.httpClient;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code VAULT_ADDR}, {@code VAULT_NAMESPACE} and {@code VAULT_TOKEN} from the process environment.
     */
    public static VaultClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static VaultClientConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
            .address(env.get(ENV_ADDRESS))
            .namespace(env.get(ENV_NAMESPACE))
            .token(env.get(ENV_TOKEN))
            .build();
    }

    public VaultClientConfig withDefaults() {
        String resolvedAddress = sanitizeUrl(Optional.ofNullable(trimToNull(address)).orElse(DEFAULT_ADDRESS));

        Duration resolvedTimeout = Optional.ofNullable(requestTimeout).orElse(DEFAULT_REQUEST_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_REQUEST_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .address(resolvedAddress)
            .namespace(trimToNull(namespace))
            .token(trimToNull(token))
            .httpClient(resolvedClient)
            .requestTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Vault address must include scheme and host: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid Vault address: " + trimmed, ex);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getAddress() {
        return address;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @return token supplied through configuration, or {@code null} when callers authenticate another way
     */
    public String getToken() {
        return token;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public static final class Builder {
        private String address;
        private String namespace;
        private String token;
        private HttpClient httpClient;
        private Duration requestTimeout;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public VaultClientConfig build() {
            return new VaultClientConfig(this).withDefaults();
        }

        private VaultClientConfig buildInternal() {
            return new VaultClientConfig(this);
        }
    }
}
