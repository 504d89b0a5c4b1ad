package cloud.vaultloader.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.vaultloader.sdk.VaultLoaderException;
import cloud.vaultloader.sdk.client.VaultClientConfig;
import cloud.vaultloader.sdk.internal.ApiErrorDecoder;
import cloud.vaultloader.sdk.internal.HttpUtil;
import cloud.vaultloader.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AuthProvider logging in through Vault's Kubernetes auth method with the pod's service account token.
 */
public final class KubernetesAuthProvider implements AuthProvider {

    public static final String DEFAULT_MOUNT = "kubernetes";
    public static final Path DEFAULT_JWT_PATH = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

    private final HttpClient httpClient;
    private final String address;
    private final String namespace;
    private final Duration requestTimeout;
    private final String role;
    private final String mount;
    private final Path jwtPath;

    private KubernetesAuthProvider(Builder builder) {
        VaultClientConfig config = Objects.requireNonNull(builder.config, "config").withDefaults();
        this.httpClient = config.getHttpClient();
        this.address = config.getAddress();
        this.namespace = config.getNamespace();
        this.requestTimeout = config.getRequestTimeout();
        this.role = Objects.requireNonNull(builder.role, "role");
        if (role.isBlank()) {
            throw new IllegalArgumentException("role must be non-empty");
        }
        String resolvedMount = builder.mount == null || builder.mount.isBlank() ? DEFAULT_MOUNT : builder.mount.trim();
        this.mount = stripSlashes(resolvedMount);
        this.jwtPath = builder.jwtPath == null ? DEFAULT_JWT_PATH : builder.jwtPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public AuthToken token() throws VaultLoaderException {
        String jwt = readJwt();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("role", role);
        body.put("jwt", jwt);

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(
                httpClient,
                "POST",
                address + "/v1/auth/" + mount + "/login",
                body,
                Map.of(HttpUtil.NAMESPACE_HEADER, namespace == null ? "" : namespace),
                requestTimeout
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VaultLoaderException("kubernetes login interrupted", ex);
        } catch (IOException ex) {
            throw new VaultLoaderException("kubernetes login: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }

            JsonNode auth = Json.mapper().readTree(bodyStream).path("auth");
            String clientToken = auth.path("client_token").asText(null);
            if (clientToken == null || clientToken.isBlank()) {
                throw new VaultLoaderException("login response missing auth.client_token");
            }
            long leaseSeconds = Math.max(0L, auth.path("lease_duration").asLong(0L));
            return new AuthToken(clientToken, Duration.ofSeconds(leaseSeconds));
        } catch (IOException ex) {
            throw new VaultLoaderException("decode login response: " + ex.getMessage(), ex);
        }
    }

    private String readJwt() throws VaultLoaderException {
        String jwt;
        try {
            jwt = Files.readString(jwtPath, StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            throw new VaultLoaderException("read service account token " + jwtPath + ": " + ex.getMessage(), ex);
        }
        if (jwt.isEmpty()) {
            throw new VaultLoaderException("service account token " + jwtPath + " is empty");
        }
        return jwt;
    }

    private static String stripSlashes(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    public static final class Builder {
        private VaultClientConfig config;
        private String role;
        private String mount;
        private Path jwtPath;

        public Builder config(VaultClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        /**
         * Path the Kubernetes auth method is mounted at, {@code kubernetes} unless overridden.
         */
        public Builder mount(String mount) {
            this.mount = mount;
            return this;
        }

        public Builder jwtPath(Path jwtPath) {
            this.jwtPath = jwtPath;
            return this;
        }

        public KubernetesAuthProvider build() {
            return new KubernetesAuthProvider(this);
        }
    }
}
