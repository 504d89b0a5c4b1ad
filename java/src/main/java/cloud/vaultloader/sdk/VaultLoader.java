package cloud.vaultloader.sdk;

import cloud.vaultloader.sdk.auth.AuthToken;
import cloud.vaultloader.sdk.client.LeasedSecret;
import cloud.vaultloader.sdk.client.SecretStoreClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * <p>
 * Loads secrets from the store into a {@link ValueSink} and keeps track of when they must be loaded again.
 * </p>
 *
 * <h2>Refresh cycle</h2>
 * <ol>
 *   <li>Obtains a token from the configured {@link cloud.vaultloader.sdk.auth.AuthProvider} and applies it to the
 *       {@link SecretStoreClient}.</li>
 *   <li>Reads every configured {@link Secret} in configuration order. The first failure aborts the cycle and nothing is
 *       written to the sink.</li>
 *   <li>Writes the merged payloads to the sink in one batch; later secrets overwrite keys of earlier ones.</li>
 *   <li>Stores the next refresh interval, {@code 0.75 × min(token lease, shortest secret lease)}.</li>
 * </ol>
 *
 * <p>
 * Cycles are serialised per loader, whether they come from callers of {@link #refresh(ValueSink)} or from the
 * background {@link PollWatcher} started when {@link LoaderConfig#isRenew()} is set.
 * </p>
 */
public final class VaultLoader implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(VaultLoader.class.getName());

    private final LoaderConfig config;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ReentrantLock intervalLock = new ReentrantLock();
    private Duration ttl;
    private final AtomicLong completedCycles = new AtomicLong();

    private final PollWatcher watcher;

    /**
     * Constructs a loader and, when renewal is enabled, starts its background watcher.
     *
     * @param config loader configuration; secrets, auth provider and client are mandatory.
     * @throws IllegalArgumentException when the configuration is incomplete. The loader is never partially built.
     */
    public VaultLoader(LoaderConfig config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        if (this.config.isRenew()) {
            this.watcher = new PollWatcher(this);
            this.watcher.start();
        } else {
            this.watcher = null;
        }
    }

    /**
     * Runs one refresh cycle against the sink supplied by the caller.
     *
     * @throws VaultLoaderException the failure raised by the auth provider or the client, unchanged. Neither the sink nor
     *                              the refresh interval is modified in that case.
     */
    public void refresh(ValueSink sink) throws VaultLoaderException {
        Objects.requireNonNull(sink, "sink");
        cycleLock.lock();
        try {
            runCycle(sink);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs one refresh cycle against the configured sink.
     */
    public void load() throws VaultLoaderException {
        refresh(config.getSink());
    }

    /**
     * Runs a cycle against the configured sink unless one completed after {@code observedCycles} was read, in which case
     * the values and interval are already fresh.
     *
     * @return {@code true} when this call ran the cycle
     */
    boolean loadIfNoCycleSince(long observedCycles) throws VaultLoaderException {
        cycleLock.lock();
        try {
            if (completedCycles.get() != observedCycles) {
                return false;
            }
            runCycle(config.getSink());
            return true;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * @return number of successful cycles, foreground and background
     */
    long completedCycles() {
        return completedCycles.get();
    }

    private void runCycle(ValueSink sink) throws VaultLoaderException {
        AuthToken token = config.getAuthProvider().token();
        if (token == null) {
            throw new VaultLoaderException("auth provider returned no token");
        }

        SecretStoreClient client = config.getClient();
        client.setToken(token.token());

        Map<String, Object> staged = new LinkedHashMap<>();
        Duration minSecretLease = null;
        for (Secret secret : config.getSecrets()) {
            LeasedSecret leased = client.read(secret.key());
            if (leased == null) {
                throw new VaultLoaderException("secret " + secret.key() + " returned no payload");
            }
            staged.putAll(leased.data());
            minSecretLease = minSecretLease == null
                ? leased.leaseDuration()
                : LeaseAggregator.minimum(minSecretLease, leased.leaseDuration());
        }

        sink.putAll(staged);

        Duration next = LeaseAggregator.refreshInterval(token.ttl(), minSecretLease);
        setRefreshInterval(next);
        completedCycles.incrementAndGet();

        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vault-loader] %s loaded %d key(s) from %d secret(s); next refresh in %s",
            config.getName(), staged.size(), config.getSecrets().size(), next));
    }

    /**
     * @return interval computed by the last successful cycle, empty before the first one
     */
    public Optional<Duration> refreshInterval() {
        intervalLock.lock();
        try {
            return Optional.ofNullable(ttl);
        } finally {
            intervalLock.unlock();
        }
    }

    void setRefreshInterval(Duration interval) {
        intervalLock.lock();
        try {
            this.ttl = interval;
        } finally {
            intervalLock.unlock();
        }
    }

    public String name() {
        return config.getName();
    }

    public int maxRetry() {
        return config.getMaxRetry();
    }

    public Duration retryDelay() {
        return config.getRetryDelay();
    }

    public boolean stopOnFailure() {
        return config.isStopOnFailure();
    }

    public LoaderConfig config() {
        return config;
    }

    /**
     * @return the background watcher, present only when renewal is enabled
     */
    public Optional<PollWatcher> watcher() {
        return Optional.ofNullable(watcher);
    }

    /**
     * Asks the background watcher to stop. An in-flight cycle is allowed to finish.
     */
    @Override
    public void close() {
        if (watcher != null) {
            watcher.stop();
        }
    }
}
