package com.crisisnavigator.collectors.classify;

import com.crisisnavigator.collectors.api.AnalysisProvider;
import com.crisisnavigator.collectors.api.Collector;
import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.collectors.config.ClassificationConfig;
import com.crisisnavigator.core.events.AlertRaised;
import com.crisisnavigator.core.events.CollectorTickCompleted;
import com.crisisnavigator.core.events.CollectorTickStarted;
import com.crisisnavigator.core.events.DisasterClassified;
import com.crisisnavigator.core.model.Activity;
import com.crisisnavigator.core.model.ActivityLevel;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.severity.AnalysisPayload;
import com.crisisnavigator.core.severity.SeverityAssessment;
import com.crisisnavigator.core.severity.SeverityBand;
import com.crisisnavigator.core.severity.SeverityReconciler;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ClassificationCollector implements Collector {
    public static final String NAME = "classificationCollector";
    private static final Logger LOGGER = Logger.getLogger(ClassificationCollector.class.getName());

    private final AnalysisProvider analysisProvider;
    private final SeverityReconciler reconciler;
    private final Duration interval;

    public ClassificationCollector(AnalysisProvider analysisProvider) {
        this(analysisProvider, new SeverityReconciler(), Duration.ofMinutes(1));
    }

    public ClassificationCollector(AnalysisProvider analysisProvider, SeverityReconciler reconciler, Duration interval) {
        this.analysisProvider = Objects.requireNonNull(analysisProvider, "analysisProvider is required");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        return CompletableFuture.supplyAsync(() -> classifyPending(ctx)).handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                String message = rootMessage(error);
                LOGGER.log(Level.WARNING, "Classification run failed: " + message, error);
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "collector",
                        "Classification run failed: " + message,
                        Map.of("collector", name())
                ));
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("Classification run failed: " + message, Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    durationMillis
            ));
            return result;
        });
    }

    private CollectorResult classifyPending(CollectorContext ctx) {
        ClassificationConfig cfg = ctx.requiredConfig(ClassificationConfig.CONFIG_KEY, ClassificationConfig.class);
        List<Disaster> pending = ctx.disasterStore().listUnprocessed().stream()
                .limit(cfg.maxEventsPerRun())
                .toList();

        int classified = 0;
        int failed = 0;
        for (int start = 0; start < pending.size(); start += cfg.batchSize()) {
            if (start > 0) {
                pause(cfg.batchPause());
            }
            List<Disaster> batch = pending.subList(start, Math.min(pending.size(), start + cfg.batchSize()));
            List<CompletableFuture<Boolean>> tasks = batch.stream()
                    .map(disaster -> classifyOne(disaster, cfg, ctx))
                    .toList();
            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
            for (CompletableFuture<Boolean> task : tasks) {
                if (task.join()) {
                    classified++;
                } else {
                    failed++;
                }
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("pending", pending.size());
        stats.put("classified", classified);
        stats.put("failed", failed);
        return CollectorResult.success("Classification run completed", stats);
    }

    private CompletableFuture<Boolean> classifyOne(Disaster disaster, ClassificationConfig cfg, CollectorContext ctx) {
        CompletableFuture<JsonNode> call;
        try {
            call = analysisProvider.analyze(disaster);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
                .orTimeout(cfg.analysisTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> applyAnalysis(disaster, response, ctx))
                .exceptionally(error -> markProcessedOnly(disaster, error, ctx));
    }

    private boolean applyAnalysis(Disaster disaster, JsonNode response, CollectorContext ctx) {
        AnalysisPayload payload = AnalysisPayload.read(response);
        SeverityAssessment assessment = reconciler.reconcile(payload);
        String analysis = payload.narrative() == null ? response.toString() : payload.narrative();

        Optional<Disaster> updated = ctx.disasterStore().update(
                disaster.id(),
                current -> current.classified(assessment.score(), analysis)
        );
        if (updated.isEmpty()) {
            return false;
        }

        ctx.eventBus().publish(new DisasterClassified(
                ctx.clock().instant(),
                disaster.id(),
                assessment.band().label(),
                assessment.score(),
                assessment.highTriggerCount()
        ));
        ctx.activityLog().record(
                Activity.AI_ANALYSIS,
                assessment.band().displayName() + " severity " + disaster.type().toLowerCase(Locale.ROOT)
                        + " analyzed - " + disaster.title(),
                activityLevel(assessment.band())
        );
        return true;
    }

    private boolean markProcessedOnly(Disaster disaster, Throwable error, CollectorContext ctx) {
        LOGGER.log(Level.WARNING, "Analysis failed for " + disaster.id() + ": " + rootMessage(error));
        ctx.disasterStore().update(disaster.id(), Disaster::markedProcessed);
        return false;
    }

    static ActivityLevel activityLevel(SeverityBand band) {
        if (band == SeverityBand.HIGH) {
            return ActivityLevel.ERROR;
        }
        if (band == SeverityBand.MEDIUM) {
            return ActivityLevel.WARNING;
        }
        return ActivityLevel.SUCCESS;
    }

    private static void pause(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
