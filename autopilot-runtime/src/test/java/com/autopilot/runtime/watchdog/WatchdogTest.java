package com.autopilot.runtime.watchdog;

import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.exchange.model.TradingConfig.WatchdogConfig;
import com.autopilot.execution.spi.UserSettings;
import com.autopilot.runtime.InstanceRegistry;
import com.autopilot.runtime.Instances;
import com.autopilot.runtime.MemoryStore;
import com.autopilot.runtime.StubVenue;
import com.autopilot.runtime.TestClock;
import com.autopilot.runtime.TradingInstance;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatchdogTest {

    @TempDir
    Path dataDir;

    private TradingConfig config;
    private WatchdogConfig watchdogConfig;
    private StubVenue venue;
    private MemoryStore store;
    private TestClock clock;
    private InstanceRegistry registry;
    private ResourceSampler.Usage usage;
    private Watchdog watchdog;

    @BeforeEach
    void setUp() {
        config = Instances.fastConfig(dataDir);
        watchdogConfig = config.getWatchdog();
        watchdogConfig.setMaxFailures(2);
        watchdogConfig.setMaxRestarts(2);
        venue = new StubVenue();
        venue.balanceFailure = new NetworkException("venue down", null);
        store = new MemoryStore();
        clock = new TestClock(Instant.parse("2026-03-03T12:00:00Z"));
        registry = new InstanceRegistry();
        usage = new ResourceSampler.Usage(100, 5);
    }

    @AfterEach
    void tearDown() {
        if (watchdog != null) {
            watchdog.close();
        }
        registry.all().forEach(TradingInstance::close);
    }

    private Watchdog watchdog() {
        if (watchdog == null) {
            watchdog = new Watchdog(registry, watchdogConfig, store, () -> usage, clock,
                    dataDir.resolve("heartbeat.json"));
        }
        return watchdog;
    }

    /**
     * An instance whose saved settings say enabled, but whose loop was never started.
     */
    private TradingInstance enabledButStopped(String id) {
        store.saveUserSettings(id, new UserSettings(true, null, List.of()));
        return registry.register(Instances.create(id, config, venue, store, clock));
    }

    @Nested
    @DisplayName("Restarts")
    class Restarts {

        @Test
        @Timeout(10)
        @DisplayName("restarts an enabled instance after max consecutive failures")
        void restartAfterMaxFailures() {
            TradingInstance instance = enabledButStopped("alpha");

            watchdog().check();
            assertEquals(1, watchdog.getRecord("alpha").getFailureCount());
            assertFalse(instance.isRunning(), "one failure is not enough");

            watchdog.check();

            assertTrue(instance.isRunning());
            HeartbeatRecord record = watchdog.getRecord("alpha");
            assertEquals(0, record.getFailureCount());
            assertEquals(1, record.getRestartCount());
            assertEquals(1, instance.getRestartCount());
            assertEquals(List.of(new Watchdog.RestartEvent("alpha", clock.instant(), "enabled but not running")),
                    watchdog.getRestartHistory());
            assertTrue(store.notified("Instance Restarted"));
        }

        @Test
        @DisplayName("a healthy observation resets the failure count")
        void healthyResets() {
            TradingInstance instance = enabledButStopped("alpha");
            watchdog().check();
            instance.start();

            watchdog.check();

            assertEquals(0, watchdog.getRecord("alpha").getFailureCount());
            assertEquals(clock.instant(), watchdog.getRecord("alpha").getLastSeen());
            assertTrue(watchdog.getRestartHistory().isEmpty());
        }

        @Test
        @DisplayName("without auto restart failures are only counted")
        void noAutoRestart() {
            watchdogConfig.setAutoRestart(false);
            TradingInstance instance = enabledButStopped("alpha");

            watchdog().check();
            watchdog.check();
            watchdog.check();

            assertFalse(instance.isRunning());
            assertEquals(3, watchdog.getRecord("alpha").getFailureCount());
            assertTrue(watchdog.getRestartHistory().isEmpty());
        }

        @Test
        @DisplayName("disabled instances are left alone")
        void disabledIgnored() {
            registry.register(Instances.create("alpha", config, venue, store, clock));

            watchdog().check();
            watchdog.check();

            assertEquals(0, watchdog.getRecord("alpha").getFailureCount());
            assertFalse(store.notified("Instance Restarted"));
        }
    }

    @Nested
    @DisplayName("Failure detection")
    class Detection {

        @Test
        @Timeout(10)
        @DisplayName("a running loop without a cycle for longer than the timeout is a failure")
        void staleHeartbeat() throws Exception {
            TradingInstance instance = enabledButStopped("alpha");
            instance.start();
            Instances.await(() -> instance.getLastResult() != null, 5000);

            clock.advance(Duration.ofSeconds(600));

            assertEquals("no cycle for 600s", watchdog().diagnose(instance));
        }

        @Test
        @Timeout(10)
        @DisplayName("too many restarts is a failure even while running")
        void restartSanity() {
            watchdogConfig.setRestartSanityThreshold(0);
            TradingInstance instance = enabledButStopped("alpha");
            instance.start();
            instance.restart();

            assertEquals("restart count 1 above 0", watchdog().diagnose(instance));
        }

        @Test
        @Timeout(10)
        @DisplayName("a fresh running instance is healthy")
        void healthy() {
            TradingInstance instance = enabledButStopped("alpha");
            instance.start();

            assertNull(watchdog().diagnose(instance));
        }
    }

    @Nested
    @DisplayName("Fatal")
    class Fatal {

        @Test
        @Timeout(10)
        @DisplayName("after max restarts the next breach disables the instance")
        void disablesAfterMaxRestarts() {
            watchdogConfig.setMaxRestarts(0);
            TradingInstance instance = enabledButStopped("alpha");

            watchdog().check();
            watchdog.check();

            assertFalse(instance.isEnabled());
            assertFalse(instance.isRunning());
            assertTrue(watchdog.getRecord("alpha").isFatal());
            assertTrue(store.notified("Instance Disabled"));
            assertFalse(store.getUserSettings("alpha").autoTradingEnabled(), "disabled state is persisted");
            assertEquals(List.of("alpha"), watchdog.getStatus().fatalInstances());
        }

        @Test
        @Timeout(10)
        @DisplayName("explicit enable clears the fatal state")
        void enableClearsFatal() {
            watchdogConfig.setMaxRestarts(0);
            TradingInstance instance = enabledButStopped("alpha");
            watchdog().check();
            watchdog.check();

            instance.enable();
            watchdog.check();

            HeartbeatRecord record = watchdog.getRecord("alpha");
            assertFalse(record.isFatal());
            assertEquals(0, record.getFailureCount());
            assertTrue(instance.isRunning());
        }
    }

    @Test
    @Timeout(20)
    @DisplayName("a stuck cycle does not stall supervision of other instances")
    void stuckInstanceDoesNotStall() throws Exception {
        watchdogConfig.setMaxFailures(1);
        watchdogConfig.setMaxRestarts(0);
        config.getTrading().setJoinTimeoutSeconds(1);
        StubVenue slowVenue = new StubVenue();
        slowVenue.balanceDelayMs = 8000;
        store.saveUserSettings("slow", new UserSettings(true, null, List.of()));
        TradingInstance slow = registry.register(Instances.create("slow", config, slowVenue, store, clock));
        slow.start();
        Instances.await(() -> slowVenue.balanceCalls.get() > 0, 5000);
        enabledButStopped("zeta");
        clock.advance(Duration.ofSeconds(600));

        long started = System.currentTimeMillis();
        watchdog().check();
        long elapsed = System.currentTimeMillis() - started;

        assertTrue(elapsed < 4000, "check took " + elapsed + " ms");
        assertTrue(watchdog.getRecord("slow").isFatal());
        assertFalse(slow.isEnabled());
        assertTrue(watchdog.getRecord("zeta").isFatal(), "the next instance was still checked");
    }

    @Nested
    @DisplayName("Resources and reporting")
    class Reporting {

        @Test
        @DisplayName("resource thresholds only warn")
        void resourceWarnings() {
            usage = new ResourceSampler.Usage(1024, 95);
            TradingInstance instance = registry.register(Instances.create("alpha", config, venue, store, clock));

            watchdog().check();

            assertTrue(store.notified("High Memory Usage"));
            assertTrue(store.notified("High CPU Usage"));
            assertFalse(instance.isRunning());
        }

        @Test
        @DisplayName("unknown CPU load is not reported")
        void cpuUnknown() {
            usage = new ResourceSampler.Usage(100, Double.NaN);

            watchdog().check();

            assertFalse(store.notified("High CPU Usage"));
        }

        @Test
        @DisplayName("a failing resource check does not stop instance checks")
        void checksIsolated() {
            enabledButStopped("alpha");
            watchdog = new Watchdog(registry, watchdogConfig, store, () -> {
                throw new IllegalStateException("no mxbean");
            }, clock, null);

            watchdog.check();

            assertEquals(1, watchdog.getRecord("alpha").getFailureCount());
        }

        @Test
        @DisplayName("each check writes a JSON heartbeat file")
        void heartbeatFile() throws Exception {
            enabledButStopped("alpha");

            watchdog().check();

            Path file = dataDir.resolve("heartbeat.json");
            assertTrue(Files.exists(file));
            JsonNode node = new ObjectMapper().readTree(file.toFile());
            assertEquals(1, node.path("instances").asInt());
            assertEquals(1, node.path("failureCounts").path("alpha").asInt());
            assertEquals(0, node.path("totalRestarts").asInt());
            assertEquals(100, node.path("heapMb").asLong());
            assertFalse(Files.exists(dataDir.resolve("heartbeat.json.tmp")));
        }

        @Test
        @DisplayName("health report lists every instance")
        void healthReport() {
            enabledButStopped("alpha");
            registry.register(Instances.create("beta", config, venue, store, clock));

            watchdog().check();
            String report = watchdog.getHealthReport();

            assertTrue(report.startsWith("Watchdog stopped, 2 instances, 0 restarts"), report);
            assertTrue(report.contains("alpha: enabled, stopped, failures 1, watchdog restarts 0"), report);
            assertTrue(report.contains("beta: disabled, stopped, failures 0"), report);
        }

        @Test
        @DisplayName("start and stop toggle the running flag")
        void startStop() {
            watchdogConfig.setIntervalSeconds(3600);

            watchdog().start();
            assertTrue(watchdog.getStatus().running());

            watchdog.stop();
            assertFalse(watchdog.getStatus().running());
        }
    }
}
