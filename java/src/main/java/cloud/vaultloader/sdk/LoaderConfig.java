package cloud.vaultloader.sdk;

import cloud.vaultloader.sdk.auth.AuthProvider;
import cloud.vaultloader.sdk.client.SecretStoreClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Immutable configuration container used to bootstrap {@link VaultLoader} instances.
 */
public final class LoaderConfig {

    public static final String DEFAULT_NAME = "vault";
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ZERO;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ZERO;
    /**
     * Floor for the watcher's waits once a cycle has run. A zero lease therefore schedules the next cycle after this
     * floor rather than immediately; configure {@link Duration#ZERO} to refresh immediately on zero leases.
     */
    public static final Duration DEFAULT_MINIMUM_INTERVAL = Duration.ofSeconds(1);

    private final String name;
    private final SecretStoreClient client;
    private final List<Secret> secrets;
    private final AuthProvider authProvider;
    private final ValueSink sink;
    private final boolean renew;
    private final int maxRetry;
    private final Duration retryDelay;
    private final boolean stopOnFailure;
    private final Duration initialDelay;
    private final Duration minimumInterval;
    private final Consumer<RetryExhaustedException> onRetryExhausted;

    private LoaderConfig(Builder builder) {
        this.name = builder.name;
        this.client = builder.client;
        this.secrets = builder.secrets == null ? null : List.copyOf(builder.secrets);
        this.authProvider = builder.authProvider;
        this.sink = builder.sink;
        this.renew = builder.renew;
        this.maxRetry = builder.maxRetry;
        this.retryDelay = builder.retryDelay;
        this.stopOnFailure = builder.stopOnFailure;
        this.initialDelay = builder.initialDelay;
        this.minimumInterval = builder.minimumInterval;
        this.onRetryExhausted = builder.onRetryExhausted;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates the configuration and fills in defaults for optional settings.
     *
     * @throws IllegalArgumentException when no secret, no auth provider or no client is configured, when renewal is
     *                                  enabled without a sink, or when a retry or scheduling setting is negative
     */
    public LoaderConfig withDefaults() {
        if (secrets == null || secrets.isEmpty()) {
            throw new IllegalArgumentException("at least one secret is required");
        }
        if (authProvider == null) {
            throw new IllegalArgumentException("AuthProvider is required");
        }
        if (client == null) {
            throw new IllegalArgumentException("Client is required");
        }
        if (renew && sink == null) {
            throw new IllegalArgumentException("Sink is required when Renew is enabled");
        }
        if (maxRetry < 0) {
            throw new IllegalArgumentException("MaxRetry cannot be negative");
        }

        Duration resolvedRetryDelay = nonNegative(retryDelay, DEFAULT_RETRY_DELAY, "RetryDelay");
        Duration resolvedInitialDelay = nonNegative(initialDelay, DEFAULT_INITIAL_DELAY, "InitialDelay");
        Duration resolvedMinimumInterval = nonNegative(minimumInterval, DEFAULT_MINIMUM_INTERVAL, "MinimumInterval");

        String resolvedName = Optional.ofNullable(name)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_NAME);

        ValueSink resolvedSink = sink == null ? new ConfigValues() : sink;

        return new Builder()
            .name(resolvedName)
            .client(client)
            .secrets(secrets)
            .authProvider(authProvider)
            .sink(resolvedSink)
            .renew(renew)
            .maxRetry(maxRetry)
            .retryDelay(resolvedRetryDelay)
            .stopOnFailure(stopOnFailure)
            .initialDelay(resolvedInitialDelay)
            .minimumInterval(resolvedMinimumInterval)
            .onRetryExhausted(onRetryExhausted)
            .buildInternal();
    }

    private static Duration nonNegative(Duration value, Duration fallback, String field) {
        Duration resolved = Optional.ofNullable(value).orElse(fallback);
        if (resolved.isNegative()) {
            throw new IllegalArgumentException(field + " cannot be negative");
        }
        return resolved;
    }

    public String getName() {
        return name;
    }

    public SecretStoreClient getClient() {
        return client;
    }

    public List<Secret> getSecrets() {
        return secrets;
    }

    public AuthProvider getAuthProvider() {
        return authProvider;
    }

    /**
     * @return sink refreshed by {@link VaultLoader#load()} and the background watcher
     */
    public ValueSink getSink() {
        return sink;
    }

    public boolean isRenew() {
        return renew;
    }

    public int getMaxRetry() {
        return maxRetry;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public boolean isStopOnFailure() {
        return stopOnFailure;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMinimumInterval() {
        return minimumInterval;
    }

    /**
     * @return callback notified when the watcher gives up with {@code stopOnFailure} set, or {@code null}
     */
    public Consumer<RetryExhaustedException> getOnRetryExhausted() {
        return onRetryExhausted;
    }

    public static final class Builder {
        private String name;
        private SecretStoreClient client;
        private List<Secret> secrets;
        private AuthProvider authProvider;
        private ValueSink sink;
        private boolean renew;
        private int maxRetry;
        private Duration retryDelay;
        private boolean stopOnFailure;
        private Duration initialDelay;
        private Duration minimumInterval;
        private Consumer<RetryExhaustedException> onRetryExhausted;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder client(SecretStoreClient client) {
            this.client = client;
            return this;
        }

        /**
         * Secrets are read and merged in list order; on key collisions the later secret wins.
         */
        public Builder secrets(List<Secret> secrets) {
            this.secrets = secrets == null ? null : new ArrayList<>(secrets);
            return this;
        }

        public Builder secret(String key) {
            if (this.secrets == null) {
                this.secrets = new ArrayList<>();
            }
            this.secrets.add(new Secret(key));
            return this;
        }

        public Builder authProvider(AuthProvider authProvider) {
            this.authProvider = authProvider;
            return this;
        }

        /**
         * Sink written by {@link VaultLoader#load()}. Required with {@link #renew(boolean)} so the background watcher
         * refreshes values the application actually reads.
         */
        public Builder sink(ValueSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder renew(boolean renew) {
            this.renew = renew;
            return this;
        }

        public Builder maxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder stopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        /**
         * Lower bound on the watcher's wait between cycles, {@link LoaderConfig#DEFAULT_MINIMUM_INTERVAL} unless overridden. It
         * applies even when a zero lease yields a zero refresh interval; pass {@link Duration#ZERO} to refresh
         * immediately in that case. The stored refresh interval is never altered.
         */
        public Builder minimumInterval(Duration minimumInterval) {
            this.minimumInterval = minimumInterval;
            return this;
        }

        public Builder onRetryExhausted(Consumer<RetryExhaustedException> onRetryExhausted) {
            this.onRetryExhausted = onRetryExhausted;
            return this;
        }

        public LoaderConfig build() {
            return new LoaderConfig(this).withDefaults();
        }

        private LoaderConfig buildInternal() {
            return new LoaderConfig(this);
        }
    }
}
