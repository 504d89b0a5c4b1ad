package cloud.vaultloader.sdk;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop that reloads a {@link VaultLoader} before its leases run out.
 *
 * <p>
 * The watcher sleeps for the loader's last refresh interval (or the configured initial delay before the first
 * successful cycle), then runs a cycle. A failed cycle is retried up to {@link LoaderConfig#getMaxRetry()} times,
 * {@link LoaderConfig#getRetryDelay()} apart, keeping the previous interval. When every attempt fails the watcher either
 * stops for good ({@link LoaderConfig#isStopOnFailure()}) or logs the failure and waits for the next interval.
 * </p>
 *
 * <p>
 * If another cycle, such as a foreground {@link VaultLoader#load()}, completes while the watcher is waiting, the
 * watcher skips its own fetch and waits for the new interval instead.
 * </p>
 *
 * <p>
 * Once a cycle has run, waits are never shorter than {@link LoaderConfig#getMinimumInterval()}. With the default floor
 * a zero lease refreshes after one second instead of immediately; configure a zero floor to refresh immediately.
 * </p>
 */
public final class PollWatcher {

    private static final Logger LOGGER = Logger.getLogger(PollWatcher.class.getName());

    public enum State {
        IDLE,
        REFRESHING,
        STOPPED
    }

    private final VaultLoader loader;
    private final LoaderConfig config;
    private final Thread thread;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicLong cycles = new AtomicLong();
    private volatile RetryExhaustedException lastExhaustion;
    private boolean attempted;

    PollWatcher(VaultLoader loader) {
        this.loader = loader;
        this.config = loader.config();
        this.thread = new Thread(this::run, "vault-loader-" + config.getName());
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    /**
     * Requests a cooperative stop. A sleeping watcher wakes immediately; a running cycle completes first.
     */
    public void stop() {
        stopSignal.countDown();
    }

    /**
     * @return {@code true} when the loop ended within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return terminated.await(toNanos(timeout), TimeUnit.NANOSECONDS);
    }

    public State state() {
        return state.get();
    }

    /**
     * @return number of successful background cycles
     */
    public long cycles() {
        return cycles.get();
    }

    /**
     * @return the most recent exhaustion of the retry policy, if any
     */
    public Optional<RetryExhaustedException> lastExhaustion() {
        return Optional.ofNullable(lastExhaustion);
    }

    private void run() {
        LOGGER.info(() -> "[vault-loader] " + config.getName() + " watcher started");
        try {
            long observedCycles = loader.completedCycles();
            while (!awaitStop(nextWait())) {
                state.set(State.REFRESHING);
                boolean refreshed = refreshWithRetry(observedCycles);
                if (!refreshed && (config.isStopOnFailure() || stopRequested())) {
                    break;
                }
                state.set(State.IDLE);
                observedCycles = loader.completedCycles();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.info(() -> "[vault-loader] " + config.getName() + " watcher interrupted");
        } finally {
            state.set(State.STOPPED);
            terminated.countDown();
            LOGGER.info(() -> "[vault-loader] " + config.getName() + " watcher stopped");
        }
    }

    private boolean refreshWithRetry(long observedCycles) throws InterruptedException {
        Exception lastFailure = null;
        long attempts = 0;
        while (true) {
            attempts++;
            attempted = true;
            try {
                if (loader.loadIfNoCycleSince(observedCycles)) {
                    cycles.incrementAndGet();
                } else {
                    LOGGER.fine(() -> "[vault-loader] " + config.getName() + " already refreshed; skipping cycle");
                }
                return true;
            } catch (VaultLoaderException | RuntimeException ex) {
                lastFailure = ex;
                long attempt = attempts;
                LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                    "[vault-loader] %s refresh attempt %d of %d failed: %s",
                    config.getName(), attempt, config.getMaxRetry() + 1L, ex.getMessage()));
            }

            if (attempts > config.getMaxRetry()) {
                break;
            }
            if (awaitStop(config.getRetryDelay())) {
                return false;
            }
        }

        RetryExhaustedException exhausted = new RetryExhaustedException(
            config.getName(), (int) Math.min(attempts, Integer.MAX_VALUE), lastFailure);
        lastExhaustion = exhausted;

        if (config.isStopOnFailure()) {
            LOGGER.log(Level.SEVERE, exhausted, () -> "[vault-loader] " + exhausted.getMessage() + "; stopping watcher");
            stopSignal.countDown();
            notifyExhausted(exhausted);
        } else {
            Duration wait = nextWait();
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[vault-loader] %s; keeping previous values and retrying in %s",
                exhausted.getMessage(), wait));
        }
        return false;
    }

    private void notifyExhausted(RetryExhaustedException exhausted) {
        Consumer<RetryExhaustedException> handler = config.getOnRetryExhausted();
        if (handler == null) {
            return;
        }
        try {
            handler.accept(exhausted);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, ex, () -> "[vault-loader] retry exhaustion handler failed: " + ex.getMessage());
        }
    }

    // the floor does not apply to the initial delay, only once a cycle has run
    private Duration nextWait() {
        Optional<Duration> interval = loader.refreshInterval();
        if (!attempted) {
            return interval.orElse(config.getInitialDelay());
        }
        Duration wait = interval.orElse(config.getInitialDelay());
        Duration floor = config.getMinimumInterval();
        return wait.compareTo(floor) < 0 ? floor : wait;
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    private boolean awaitStop(Duration wait) throws InterruptedException {
        return stopSignal.await(toNanos(wait), TimeUnit.NANOSECONDS);
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }
}
