package com.autopilot.runtime.watchdog;

import com.autopilot.exchange.model.TradingConfig.WatchdogConfig;
import com.autopilot.execution.spi.NotificationSink;
import com.autopilot.runtime.InstanceRegistry;
import com.autopilot.runtime.TradingInstance;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Supervises trading instances on its own scheduled daemon thread.
 *
 * <p>Each tick counts consecutive failed observations per enabled instance. Reaching
 * {@code maxFailures} restarts the instance; once {@code maxRestarts} watchdog restarts were spent,
 * the next breach disables it and notifies the operator. Resource thresholds only warn.
 */
public class Watchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private static final int MAX_HISTORY = 100;

    public record RestartEvent(String instanceId, Instant at, String reason) {}

    public record Status(
        boolean running,
        Instant startedAt,
        int instances,
        int totalRestarts,
        Map<String, Integer> failureCounts,
        List<String> fatalInstances,
        ResourceSampler.Usage lastUsage
    ) {}

    private final InstanceRegistry registry;
    private final WatchdogConfig config;
    private final NotificationSink notifier;
    private final ResourceSampler sampler;
    private final Clock clock;
    private final Path heartbeatFile;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, HeartbeatRecord> records = new ConcurrentHashMap<>();
    private final Deque<RestartEvent> restartHistory = new ArrayDeque<>();
    private final ScheduledExecutorService scheduler;

    private volatile boolean running;
    private volatile Instant startedAt;
    private volatile ResourceSampler.Usage lastUsage;
    private ScheduledFuture<?> task;

    /**
     * @param heartbeatFile where each tick writes its JSON heartbeat, or null for none
     */
    public Watchdog(InstanceRegistry registry, WatchdogConfig config, NotificationSink notifier,
                    ResourceSampler sampler, Clock clock, Path heartbeatFile) {
        this.registry = registry;
        this.config = config;
        this.notifier = notifier;
        this.sampler = sampler;
        this.clock = clock;
        this.heartbeatFile = heartbeatFile;
        this.startedAt = clock.instant();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "autopilot-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        startedAt = clock.instant();
        log.info("Starting watchdog (interval {}s, max failures {}, max restarts {})",
                config.getIntervalSeconds(), config.getMaxFailures(), config.getMaxRestarts());
        task = scheduler.scheduleAtFixedRate(this::check,
                config.getIntervalSeconds(), config.getIntervalSeconds(), TimeUnit.SECONDS);
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        if (task != null) {
            task.cancel(false);
        }
        log.info("Stopped watchdog");
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
    }

    // ========== Checks ==========

    /**
     * One supervision pass. Every step is isolated so a failing check never ends the schedule.
     */
    public void check() {
        try {
            checkResources();
        } catch (RuntimeException e) {
            log.warn("Resource check failed: {}", e.getMessage());
        }
        for (TradingInstance instance : registry.all()) {
            try {
                checkInstance(instance);
            } catch (RuntimeException e) {
                log.warn("Watchdog check for {} failed: {}", instance.getId(), e.getMessage());
            }
        }
        try {
            writeHeartbeat();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write heartbeat file {}: {}", heartbeatFile, e.getMessage());
        }
    }

    private void checkResources() {
        ResourceSampler.Usage usage = sampler.sample();
        lastUsage = usage;
        if (usage.heapMb() > config.getMemoryThresholdMb()) {
            String message = String.format("Heap usage %.0f MB above %d MB", usage.heapMb(), config.getMemoryThresholdMb());
            log.warn(message);
            notifier.notify("High Memory Usage", message);
        }
        if (!Double.isNaN(usage.cpuPercent()) && usage.cpuPercent() > config.getCpuThresholdPercent()) {
            String message = String.format("CPU load %.1f%% above %.1f%%", usage.cpuPercent(), config.getCpuThresholdPercent());
            log.warn(message);
            notifier.notify("High CPU Usage", message);
        }
    }

    private void checkInstance(TradingInstance instance) {
        HeartbeatRecord record = records.computeIfAbsent(instance.getId(), HeartbeatRecord::new);
        if (!instance.isEnabled()) {
            return;
        }
        if (record.isFatal()) {
            log.info("Instance {} re-enabled after being disabled by the watchdog", instance.getId());
            record.clearFatal();
        }

        String failure = diagnose(instance);
        if (failure == null) {
            record.healthy(clock.instant());
            return;
        }

        int failures = record.failed(failure);
        log.warn("Instance {} unhealthy ({}/{}): {}", instance.getId(), failures, config.getMaxFailures(), failure);
        if (failures < config.getMaxFailures()) {
            return;
        }

        if (record.getRestartCount() >= config.getMaxRestarts()) {
            record.markFatal();
            instance.disable();
            String message = String.format("[%s] disabled after %d restarts: %s",
                    instance.getId(), record.getRestartCount(), failure);
            log.error(message);
            notifier.notify("Instance Disabled", message);
        } else if (config.isAutoRestart()) {
            log.warn("Restarting instance {} ({})", instance.getId(), failure);
            instance.restart();
            record.restarted();
            remember(new RestartEvent(instance.getId(), clock.instant(), failure));
            notifier.notify("Instance Restarted", "[" + instance.getId() + "] " + failure);
        }
    }

    /**
     * @return the failure reason, or null when the instance looks healthy
     */
    String diagnose(TradingInstance instance) {
        if (!instance.isRunning()) {
            return "enabled but not running";
        }
        if (instance.getRestartCount() > config.getRestartSanityThreshold()) {
            return "restart count " + instance.getRestartCount() + " above " + config.getRestartSanityThreshold();
        }
        Duration silence = instance.sinceLastCycle();
        if (silence.getSeconds() > config.getHeartbeatTimeoutSeconds()) {
            return "no cycle for " + silence.getSeconds() + "s";
        }
        return null;
    }

    private void remember(RestartEvent event) {
        synchronized (restartHistory) {
            restartHistory.addLast(event);
            while (restartHistory.size() > MAX_HISTORY) {
                restartHistory.removeFirst();
            }
        }
    }

    // ========== Reporting ==========

    private void writeHeartbeat() throws IOException {
        if (heartbeatFile == null) return;
        Status status = getStatus();
        ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", clock.instant().toString());
        node.put("uptimeSeconds", Duration.between(status.startedAt(), clock.instant()).getSeconds());
        node.put("instances", status.instances());
        node.put("totalRestarts", status.totalRestarts());
        ObjectNode failures = node.putObject("failureCounts");
        status.failureCounts().forEach(failures::put);
        node.putPOJO("fatal", status.fatalInstances());
        if (status.lastUsage() != null) {
            node.put("heapMb", Math.round(status.lastUsage().heapMb()));
            if (!Double.isNaN(status.lastUsage().cpuPercent())) {
                node.put("cpuPercent", status.lastUsage().cpuPercent());
            }
        }
        if (heartbeatFile.getParent() != null) {
            Files.createDirectories(heartbeatFile.getParent());
        }
        Path tmp = heartbeatFile.resolveSibling(heartbeatFile.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), node);
        Files.move(tmp, heartbeatFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Status getStatus() {
        Map<String, Integer> failures = new TreeMap<>();
        List<String> fatal = new ArrayList<>();
        int restarts = 0;
        for (HeartbeatRecord record : records.values()) {
            failures.put(record.getInstanceId(), record.getFailureCount());
            restarts += record.getRestartCount();
            if (record.isFatal()) {
                fatal.add(record.getInstanceId());
            }
        }
        fatal.sort(null);
        return new Status(running, startedAt, registry.size(), restarts, failures, fatal, lastUsage);
    }

    public List<RestartEvent> getRestartHistory() {
        synchronized (restartHistory) {
            return List.copyOf(restartHistory);
        }
    }

    public HeartbeatRecord getRecord(String instanceId) {
        return records.get(instanceId);
    }

    public String getHealthReport() {
        Status status = getStatus();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Watchdog %s, %d instances, %d restarts%n",
                status.running() ? "running" : "stopped", status.instances(), status.totalRestarts()));
        for (TradingInstance instance : registry.all()) {
            HeartbeatRecord record = records.get(instance.getId());
            sb.append(String.format("  %s: %s, %s, failures %d, watchdog restarts %d%s%n",
                    instance.getId(),
                    instance.isEnabled() ? "enabled" : "disabled",
                    instance.isRunning() ? "running" : "stopped",
                    record != null ? record.getFailureCount() : 0,
                    record != null ? record.getRestartCount() : 0,
                    record != null && record.isFatal() ? ", FATAL" : ""));
        }
        if (status.lastUsage() != null) {
            sb.append(String.format("  heap %.0f MB", status.lastUsage().heapMb()));
            if (!Double.isNaN(status.lastUsage().cpuPercent())) {
                sb.append(String.format(", cpu %.1f%%", status.lastUsage().cpuPercent()));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
