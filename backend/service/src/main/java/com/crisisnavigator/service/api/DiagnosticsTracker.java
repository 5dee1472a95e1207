package com.crisisnavigator.service.api;

import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.events.AlertRaised;
import com.crisisnavigator.core.events.CollectorTickCompleted;
import com.crisisnavigator.core.events.CollectorTickStarted;
import com.crisisnavigator.core.events.DisasterClassified;
import com.crisisnavigator.core.events.DisasterIngested;
import com.crisisnavigator.core.events.Event;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final IntSupplier sseClientCountSupplier;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder disastersIngestedTotal = new LongAdder();
    private final LongAdder disastersClassifiedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, IntSupplier sseClientCountSupplier) {
        this.clock = clock;
        this.sseClientCountSupplier = sseClientCountSupplier;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(DisasterIngested.class, event -> disastersIngestedTotal.increment());
        eventBus.subscribe(DisasterClassified.class, event -> disastersClassifiedTotal.increment());
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("sseClientsConnected", sseClientCountSupplier.getAsInt());
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("disastersIngestedTotal", disastersIngestedTotal.longValue());
        metrics.put("disastersClassifiedTotal", disastersClassifiedTotal.longValue());
        return metrics;
    }

    public Map<String, Object> collectorSnapshot(String collectorName) {
        CollectorStatus status = collectorStatuses.get(collectorName);
        return (status == null ? CollectorStatus.empty() : status).toMap();
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onTickStarted(CollectorTickStarted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) ->
                (current == null ? CollectorStatus.empty() : current).withLastRunAt(event.timestamp()));
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) ->
                (current == null ? CollectorStatus.empty() : current)
                        .withCompletion(event.timestamp(), event.durationMillis(), event.success()));
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"collector".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        collectorStatuses.compute(collectorName, (name, current) ->
                (current == null ? CollectorStatus.empty() : current).withLastErrorMessage(event.message()));
    }

    private record CollectorStatus(
            Instant lastRunAt,
            Instant lastCompletedAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage
    ) {
        private static CollectorStatus empty() {
            return new CollectorStatus(null, null, null, null, null);
        }

        private CollectorStatus withLastRunAt(Instant runAt) {
            return new CollectorStatus(runAt, lastCompletedAt, lastDurationMillis, lastSuccess, lastErrorMessage);
        }

        private CollectorStatus withCompletion(Instant completedAt, long durationMillis, boolean success) {
            return new CollectorStatus(lastRunAt, completedAt, durationMillis, success, success ? null : lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(String message) {
            return new CollectorStatus(lastRunAt, lastCompletedAt, lastDurationMillis, lastSuccess, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastCompletedAt", lastCompletedAt == null ? null : lastCompletedAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
