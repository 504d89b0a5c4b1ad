package cloud.vaultloader.sdk;

import java.util.Map;

/**
 * Receiver of the key/value pairs produced by a refresh cycle. Existing keys are overwritten.
 */
@FunctionalInterface
public interface ValueSink {

    void put(String key, Object value);

    /**
     * Writes every entry in iteration order. Implementations shared between threads should override this to apply the
     * batch atomically.
     */
    default void putAll(Map<String, ?> values) {
        values.forEach(this::put);
    }
}
