package cloud.vaultloader.sdk.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for issuing Vault HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    public static final String TOKEN_HEADER = "X-Vault-Token";
    public static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendJson(
        HttpClient client,
        String method,
        String url,
        Object payload,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.header(name, value);
                }
            });
        }

        if (timeout != null) {
            builder.timeout(timeout);
        }

        builder.header("Accept", "application/json");

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }
}
