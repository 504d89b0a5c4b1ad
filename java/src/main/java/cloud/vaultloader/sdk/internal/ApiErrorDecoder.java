package cloud.vaultloader.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.vaultloader.sdk.VaultApiException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility for decoding Vault error payloads of the form {@code {"errors": ["..."]}}.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static VaultApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new VaultApiException(statusCode, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new VaultApiException(statusCode, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            List<String> errors = new ArrayList<>();
            node.path("errors").forEach(item -> {
                String text = item.asText();
                if (text != null && !text.isBlank()) {
                    errors.add(text);
                }
            });
            return new VaultApiException(statusCode, errors);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8).trim();
            return new VaultApiException(statusCode, fallback.isEmpty() ? null : List.of(fallback));
        }
    }
}
