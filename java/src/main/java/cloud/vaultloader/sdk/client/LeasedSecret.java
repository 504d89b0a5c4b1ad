package cloud.vaultloader.sdk.client;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value payload of one secret and the lease the store granted on it.
 */
public record LeasedSecret(Map<String, Object> data, Duration leaseDuration) {

    public LeasedSecret {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        leaseDuration = leaseDuration == null ? Duration.ZERO : leaseDuration;
    }

    @Override
    public String toString() {
        return "LeasedSecret[keys=" + data.keySet() + ", leaseDuration=" + leaseDuration + "]";
    }
}
