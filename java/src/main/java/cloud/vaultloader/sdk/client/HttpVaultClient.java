package cloud.vaultloader.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import cloud.vaultloader.sdk.VaultLoaderException;
import cloud.vaultloader.sdk.internal.ApiErrorDecoder;
import cloud.vaultloader.sdk.internal.HttpUtil;
import cloud.vaultloader.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SecretStoreClient reading secrets through the Vault HTTP API.
 *
 * <p>
 * Secrets stored in a KV version 2 engine come back wrapped in {@code data.data} next to {@code data.metadata}; the
 * client unwraps them so callers always receive the flat key/value payload.
 * </p>
 */
public final class HttpVaultClient implements SecretStoreClient {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final String address;
    private final String namespace;
    private final Duration requestTimeout;

    private volatile String token;

    public HttpVaultClient(VaultClientConfig config) {
        Objects.requireNonNull(config, "config");
        VaultClientConfig resolved = config.withDefaults();
        this.httpClient = resolved.getHttpClient();
        this.address = resolved.getAddress();
        this.namespace = resolved.getNamespace();
        this.requestTimeout = resolved.getRequestTimeout();
        this.token = resolved.getToken();
    }

    @Override
    public void setToken(String token) {
        this.token = token;
    }

    String getToken() {
        return token;
    }

    @Override
    public LeasedSecret read(String path) throws VaultLoaderException {
        String normalized = normalizePath(path);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpUtil.TOKEN_HEADER, token);
        headers.put(HttpUtil.NAMESPACE_HEADER, namespace);

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(httpClient, "GET", address + "/v1/" + normalized, null, headers, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VaultLoaderException("read secret " + normalized + " interrupted", ex);
        } catch (IOException ex) {
            throw new VaultLoaderException("read secret " + normalized + ": " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            if (node == null || !node.path("data").isObject()) {
                throw new VaultLoaderException("secret " + normalized + " has no data");
            }

            JsonNode data = node.path("data");
            if (isKvVersion2(data)) {
                data = data.path("data");
            }

            Map<String, Object> values = Json.mapper().convertValue(data, MAP_TYPE);
            long leaseSeconds = node.path("lease_duration").asLong(0L);
            return new LeasedSecret(values, Duration.ofSeconds(Math.max(0L, leaseSeconds)));
        } catch (IOException ex) {
            throw new VaultLoaderException("decode secret " + normalized + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isKvVersion2(JsonNode data) {
        return data.size() == 2 && data.path("data").isObject() && data.path("metadata").isObject();
    }

    private static String normalizePath(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }
}
