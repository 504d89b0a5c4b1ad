package cloud.vaultloader.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe in-memory {@link ValueSink}. A batch written through {@link #putAll(Map)} becomes visible to readers
 * all at once.
 */
public final class ConfigValues implements ValueSink {

    private final Object lock = new Object();
    private final Map<String, Object> values = new LinkedHashMap<>();

    @Override
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            values.put(key, value);
        }
    }

    @Override
    public void putAll(Map<String, ?> batch) {
        Objects.requireNonNull(batch, "batch");
        synchronized (lock) {
            values.putAll(batch);
        }
    }

    public Object get(String key) {
        synchronized (lock) {
            return values.get(key);
        }
    }

    public Optional<String> getString(String key) {
        return Optional.ofNullable(get(key)).map(String::valueOf);
    }

    public boolean containsKey(String key) {
        synchronized (lock) {
            return values.containsKey(key);
        }
    }

    public int size() {
        synchronized (lock) {
            return values.size();
        }
    }

    /**
     * @return an immutable copy of the current values in insertion order
     */
    public Map<String, Object> snapshot() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }
}
