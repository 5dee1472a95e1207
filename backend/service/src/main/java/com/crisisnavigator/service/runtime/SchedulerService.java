package com.crisisnavigator.service.runtime;

import com.crisisnavigator.collectors.api.Collector;
import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.core.events.AlertRaised;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final Map<String, ScheduledCollector> collectors = new LinkedHashMap<>();
    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> skippedTicks = new ConcurrentHashMap<>();
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService collectorExecutor = Executors.newCachedThreadPool();

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 100);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        for (ScheduledCollector scheduled : collectors) {
            String name = scheduled.collector().name();
            if (this.collectors.putIfAbsent(name, scheduled) != null) {
                throw new IllegalArgumentException("Duplicate collector name: " + name);
            }
            running.put(name, new AtomicBoolean(false));
            skippedTicks.put(name, new AtomicLong());
        }
        this.context = Objects.requireNonNull(context, "context is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledCollector scheduled : collectors.values()) {
            if (!scheduled.enabled()) {
                LOGGER.info("Collector disabled: " + scheduled.collector().name());
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> tick(scheduled.collector()),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
    }

    /** Starts the collector now unless it is unknown or still running from an earlier tick. */
    public Optional<CompletableFuture<CollectorResult>> runNow(String name) {
        ScheduledCollector scheduled = collectors.get(name);
        if (scheduled == null || !acquire(name)) {
            return Optional.empty();
        }
        try {
            return Optional.of(CompletableFuture
                    .supplyAsync(() -> runCollectorSafely(scheduled.collector()), collectorExecutor)
                    .whenComplete((result, error) -> release(name)));
        } catch (RejectedExecutionException e) {
            release(name);
            return Optional.empty();
        }
    }

    public List<CollectorResult> runOnceAllCollectors() {
        List<CompletableFuture<CollectorResult>> tasks = new ArrayList<>();
        for (ScheduledCollector scheduled : collectors.values()) {
            if (!scheduled.enabled()) {
                continue;
            }
            String name = scheduled.collector().name();
            tasks.add(runNow(name).orElseGet(() -> CompletableFuture.completedFuture(CollectorResult.failure(
                    "Collector busy: " + name,
                    Map.of("collector", name)
            ))));
        }
        List<CollectorResult> results = new ArrayList<>();
        for (CompletableFuture<CollectorResult> task : tasks) {
            results.add(task.join());
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledCollector> scheduledCollectors() {
        return List.copyOf(collectors.values());
    }

    public boolean hasCollector(String name) {
        return collectors.containsKey(name);
    }

    public boolean isRunning(String name) {
        AtomicBoolean flag = running.get(name);
        return flag != null && flag.get();
    }

    public long skippedTicks(String name) {
        AtomicLong count = skippedTicks.get(name);
        return count == null ? 0 : count.get();
    }

    private void tick(Collector collector) {
        String name = collector.name();
        if (!acquire(name)) {
            long skipped = skippedTicks.get(name).incrementAndGet();
            LOGGER.fine(() -> "Skipping tick for " + name + " (still running, skipped=" + skipped + ")");
            return;
        }
        try {
            collectorExecutor.submit(() -> {
                try {
                    runCollectorSafely(collector);
                } finally {
                    release(name);
                }
            });
        } catch (RejectedExecutionException e) {
            release(name);
            LOGGER.log(Level.FINE, "Scheduler is shutting down; dropped tick for " + name, e);
        }
    }

    private boolean acquire(String name) {
        return running.get(name).compareAndSet(false, true);
    }

    private void release(String name) {
        running.get(name).set(false);
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            return collector.poll(context).join();
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Collector run failed: " + collector.name(), ex);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "collector",
                    "Collector run failed: " + collector.name() + " - " + ex.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
