package cloud.vaultloader.sdk;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Derives the refresh interval from the leases observed during a refresh cycle.
 *
 * <p>
 * The loader refreshes at three quarters of the shortest lease so the next cycle completes before the token or any
 * secret expires. Missing, zero and negative leases count as zero and therefore govern the result.
 * </p>
 */
public final class LeaseAggregator {

    private static final long NUMERATOR = 3;
    private static final long DENOMINATOR = 4;

    private LeaseAggregator() {
    }

    /**
     * @param tokenLease     validity of the auth token
     * @param minSecretLease shortest lease among the secrets fetched in the cycle
     * @return {@code 0.75 × min(tokenLease, minSecretLease)}
     */
    public static Duration refreshInterval(Duration tokenLease, Duration minSecretLease) {
        return refreshInterval(List.of(Lease.token(tokenLease), Lease.secret(minSecretLease)));
    }

    /**
     * Same as {@link #refreshInterval(Duration, Duration)} over any mix of token and secret leases. An empty collection
     * yields {@link Duration#ZERO}.
     */
    public static Duration refreshInterval(Collection<Lease> leases) {
        if (leases == null || leases.isEmpty()) {
            return Duration.ZERO;
        }
        Duration shortest = null;
        for (Lease lease : leases) {
            Duration value = lease == null ? null : lease.duration();
            shortest = shortest == null ? normalize(value) : minimum(shortest, value);
        }
        return scale(shortest);
    }

    /**
     * @return the shorter of the two leases, {@code null} and negative values counting as zero
     */
    public static Duration minimum(Duration first, Duration second) {
        Duration a = normalize(first);
        Duration b = normalize(second);
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration normalize(Duration lease) {
        if (lease == null || lease.isNegative()) {
            return Duration.ZERO;
        }
        return lease;
    }

    private static Duration scale(Duration lease) {
        // multiplying first keeps whole-second leases exact; dividing first avoids overflow on huge leases
        long nanos;
        try {
            nanos = Math.multiplyExact(lease.toNanos(), NUMERATOR) / DENOMINATOR;
        } catch (ArithmeticException ex) {
            return lease.dividedBy(DENOMINATOR).multipliedBy(NUMERATOR);
        }
        return Duration.ofNanos(nanos);
    }
}
