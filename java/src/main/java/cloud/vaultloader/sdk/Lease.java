package cloud.vaultloader.sdk;

import java.time.Duration;

/**
 * A lease duration tagged with what issued it.
 */
public record Lease(Duration duration, Source source) {

    public enum Source {
        TOKEN,
        SECRET
    }

    public static Lease token(Duration duration) {
        return new Lease(duration, Source.TOKEN);
    }

    public static Lease secret(Duration duration) {
        return new Lease(duration, Source.SECRET);
    }
}
