package cloud.vaultloader.sdk;

import cloud.vaultloader.sdk.auth.AuthProvider;
import cloud.vaultloader.sdk.auth.AuthToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class PollWatcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private VaultLoader loader;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (loader != null) {
            loader.close();
            Optional<PollWatcher> watcher = loader.watcher();
            if (watcher.isPresent()) {
                assertTrue(watcher.get().awaitStopped(TIMEOUT));
            }
        }
    }

    @Test
    void refreshesOnComputedInterval() {
        ScriptedClient client = new ScriptedClient()
            .answer("secret/app", Map.of("VERSION", "v1"), Duration.ofMillis(200))
            .answer("secret/app", Map.of("VERSION", "v2"), Duration.ofMillis(200))
            .answer("secret/app", Map.of("VERSION", "v3"), Duration.ofMillis(200));
        ConfigValues sink = new ConfigValues();

        loader = new VaultLoader(LoaderConfig.builder()
            .client(client)
            .secret("secret/app")
            .authProvider(() -> new AuthToken("t", Duration.ofMillis(200)))
            .sink(sink)
            .renew(true)
            .minimumInterval(Duration.ZERO)
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 3);

        assertEquals("v3", sink.get("VERSION"));
        assertEquals(Duration.ofMillis(150), loader.refreshInterval().orElseThrow());
        assertNotEquals(PollWatcher.State.STOPPED, watcher.state());
    }

    @Test
    void stopsAfterExhaustingRetriesWhenConfigured() throws Exception {
        VaultLoaderException failure = new VaultLoaderException("permission denied");
        AtomicInteger tokenCalls = new AtomicInteger();
        AtomicReference<RetryExhaustedException> reported = new AtomicReference<>();
        CountDownLatch exhausted = new CountDownLatch(1);

        loader = new VaultLoader(LoaderConfig.builder()
            .client(new ScriptedClient())
            .secret("secret/app")
            .authProvider(() -> {
                tokenCalls.incrementAndGet();
                throw failure;
            })
            .sink(new ConfigValues())
            .renew(true)
            .maxRetry(2)
            .retryDelay(Duration.ofMillis(10))
            .stopOnFailure(true)
            .onRetryExhausted(ex -> {
                reported.set(ex);
                exhausted.countDown();
            })
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        assertTrue(exhausted.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertTrue(watcher.awaitStopped(TIMEOUT));

        assertEquals(PollWatcher.State.STOPPED, watcher.state());
        assertEquals(3, tokenCalls.get());
        assertEquals(3, reported.get().getAttempts());
        assertSame(failure, reported.get().getCause());
        assertSame(reported.get(), watcher.lastExhaustion().orElseThrow());
        assertEquals(0, watcher.cycles());
    }

    @Test
    void keepsPollingAfterExhaustionWithoutStopOnFailure() {
        AtomicInteger tokenCalls = new AtomicInteger();
        AtomicInteger handlerCalls = new AtomicInteger();
        AuthProvider flaky = () -> {
            if (tokenCalls.incrementAndGet() <= 2) {
                throw new VaultLoaderException("vault sealed");
            }
            return new AuthToken("t", Duration.ofHours(1));
        };

        loader = new VaultLoader(LoaderConfig.builder()
            .client(new ScriptedClient().answer("secret/app", Map.of("FOO", "BAR"), Duration.ofHours(1)))
            .secret("secret/app")
            .authProvider(flaky)
            .sink(new ConfigValues())
            .renew(true)
            .maxRetry(0)
            .minimumInterval(Duration.ofMillis(20))
            .onRetryExhausted(ex -> handlerCalls.incrementAndGet())
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 1);

        assertEquals(3, tokenCalls.get());
        assertEquals(1, watcher.lastExhaustion().orElseThrow().getAttempts());
        assertEquals(0, handlerCalls.get());
        assertNotEquals(PollWatcher.State.STOPPED, watcher.state());
        assertEquals(Duration.ofMinutes(45), loader.refreshInterval().orElseThrow());
    }

    @Test
    void retryKeepsPreviousIntervalUntilAFetchSucceeds() {
        VaultLoaderException failure = new VaultLoaderException("read secret secret/app: timeout");
        ScriptedClient client = new ScriptedClient()
            .answer("secret/app", Map.of("FOO", "first"), Duration.ofMillis(400))
            .fail("secret/app", failure)
            .answer("secret/app", Map.of("FOO", "second"), Duration.ofHours(1));
        ConfigValues sink = new ConfigValues();
        AtomicReference<Duration> intervalDuringRetry = new AtomicReference<>();

        AtomicInteger tokenCalls = new AtomicInteger();
        AtomicReference<VaultLoader> self = new AtomicReference<>();
        AuthProvider auth = () -> {
            if (tokenCalls.incrementAndGet() == 3) {
                intervalDuringRetry.set(self.get().refreshInterval().orElse(null));
            }
            return new AuthToken("t", Duration.ofHours(1));
        };

        loader = new VaultLoader(LoaderConfig.builder()
            .client(client)
            .secret("secret/app")
            .authProvider(auth)
            .sink(sink)
            .renew(true)
            .maxRetry(3)
            .retryDelay(Duration.ofMillis(10))
            .initialDelay(Duration.ofMillis(100))
            .minimumInterval(Duration.ZERO)
            .build());
        self.set(loader);

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 2);

        assertEquals(Duration.ofMillis(300), intervalDuringRetry.get());
        assertEquals("second", sink.get("FOO"));
        assertEquals(Duration.ofMinutes(45), loader.refreshInterval().orElseThrow());
        assertTrue(watcher.lastExhaustion().isEmpty());
    }

    @Test
    void stopWakesSleepingWatcher() throws Exception {
        loader = new VaultLoader(LoaderConfig.builder()
            .client(new ScriptedClient().answer("secret/app", Map.of("FOO", "BAR"), Duration.ofHours(1)))
            .secret("secret/app")
            .authProvider(() -> new AuthToken("t", Duration.ofHours(1)))
            .sink(new ConfigValues())
            .renew(true)
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 1);

        long started = System.nanoTime();
        watcher.stop();

        assertTrue(watcher.awaitStopped(TIMEOUT));
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(2));
        assertEquals(PollWatcher.State.STOPPED, watcher.state());
    }

    @Test
    void stopDuringRetryDelayIsNotReportedAsExhaustion() throws Exception {
        CountDownLatch firstFailure = new CountDownLatch(1);
        AtomicInteger handlerCalls = new AtomicInteger();

        loader = new VaultLoader(LoaderConfig.builder()
            .client(new ScriptedClient())
            .secret("secret/app")
            .authProvider(() -> {
                firstFailure.countDown();
                throw new VaultLoaderException("connection refused");
            })
            .sink(new ConfigValues())
            .renew(true)
            .maxRetry(5)
            .retryDelay(Duration.ofHours(1))
            .stopOnFailure(true)
            .onRetryExhausted(ex -> handlerCalls.incrementAndGet())
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        assertTrue(firstFailure.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        loader.close();

        assertTrue(watcher.awaitStopped(TIMEOUT));
        assertTrue(watcher.lastExhaustion().isEmpty());
        assertEquals(0, handlerCalls.get());
    }

    @Test
    void skipsFetchWhenForegroundLoadCompletedDuringWait() throws Exception {
        ScriptedClient client = new ScriptedClient()
            .answer("secret/app", Map.of("FOO", "BAR"), Duration.ofHours(1));
        ConfigValues sink = new ConfigValues();

        loader = new VaultLoader(LoaderConfig.builder()
            .client(client)
            .secret("secret/app")
            .authProvider(() -> new AuthToken("t", Duration.ofHours(1)))
            .sink(sink)
            .renew(true)
            .initialDelay(Duration.ofMillis(200))
            .build());

        loader.load();
        Thread.sleep(500);

        PollWatcher watcher = loader.watcher().orElseThrow();
        assertEquals(1, client.reads().size());
        assertEquals(0, watcher.cycles());
        assertEquals(PollWatcher.State.IDLE, watcher.state());
        assertEquals("BAR", sink.get("FOO"));
    }

    @Test
    void zeroLeaseRefreshesImmediatelyWithoutFloor() {
        ScriptedClient client = new ScriptedClient()
            .answer("secret/app", Map.of("FOO", "BAR"), Duration.ZERO);

        loader = new VaultLoader(LoaderConfig.builder()
            .client(client)
            .secret("secret/app")
            .authProvider(() -> new AuthToken("t", Duration.ofHours(1)))
            .sink(new ConfigValues())
            .renew(true)
            .minimumInterval(Duration.ZERO)
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 5);

        assertEquals(Duration.ZERO, loader.refreshInterval().orElseThrow());
    }

    @Test
    void defaultFloorDelaysZeroLeaseRefresh() throws Exception {
        ScriptedClient client = new ScriptedClient()
            .answer("secret/app", Map.of("FOO", "BAR"), Duration.ZERO);

        loader = new VaultLoader(LoaderConfig.builder()
            .client(client)
            .secret("secret/app")
            .authProvider(() -> new AuthToken("t", Duration.ofHours(1)))
            .sink(new ConfigValues())
            .renew(true)
            .build());

        PollWatcher watcher = loader.watcher().orElseThrow();
        awaitCondition(() -> watcher.cycles() >= 1);
        Thread.sleep(300);

        assertEquals(1, watcher.cycles());
        assertEquals(1, client.reads().size());
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + TIMEOUT);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                fail("interrupted while waiting");
            }
        }
    }
}
