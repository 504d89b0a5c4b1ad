package cloud.vaultloader.sdk.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Centralised ObjectMapper configuration for Vault request and response bodies.
 *
 * <p>
 * A body followed by anything other than whitespace is rejected rather than silently truncated.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
