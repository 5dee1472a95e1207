package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.Collector;
import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.core.dedup.DeduplicationGate;
import com.crisisnavigator.core.events.AlertRaised;
import com.crisisnavigator.core.events.CollectorTickCompleted;
import com.crisisnavigator.core.events.CollectorTickStarted;
import com.crisisnavigator.core.geo.CoordinateResolver;
import com.crisisnavigator.core.model.Activity;
import com.crisisnavigator.core.model.ActivityLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FeedCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(FeedCollector.class.getName());

    private final FeedSource source;
    private final CoordinateResolver resolver;
    private final Duration interval;

    public FeedCollector(FeedSource source, CoordinateResolver resolver, Duration interval) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
    }

    @Override
    public String name() {
        return source.name() + "Collector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    public FeedSource source() {
        return source;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        return CompletableFuture.supplyAsync(() -> ingest(ctx)).handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                String message = failureMessage(error);
                LOGGER.log(Level.WARNING, source.label() + " sync failed: " + message);
                ctx.activityLog().record(
                        Activity.DATA_INGESTION,
                        source.label() + " data sync failed: " + message,
                        ActivityLevel.ERROR
                );
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "collector",
                        source.label() + " fetch failed: " + message,
                        Map.of("collector", name())
                ));
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure(source.label() + " sync failed: " + message, Map.of());
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

    private CollectorResult ingest(CollectorContext ctx) {
        FeedsConfig feeds = ctx.requiredConfig(FeedsConfig.CONFIG_KEY, FeedsConfig.class);
        Instant cutoff = ctx.clock().instant().minus(Duration.ofDays(source.lookbackDays(ctx)));

        FeedBatch batch;
        try {
            batch = source.fetch(cutoff, ctx);
        } catch (FeedFetchException e) {
            throw new CompletionException(e);
        }

        IngestionPipeline pipeline = new IngestionPipeline(new DeduplicationGate(feeds.dedupWindow()), resolver);
        int created = 0;
        int duplicates = 0;
        int skippedNoLocation = 0;
        for (CandidateEvent candidate : batch.candidates()) {
            IngestionPipeline.Outcome outcome = pipeline.admit(candidate, source.name(), ctx);
            if (outcome == IngestionPipeline.Outcome.CREATED) {
                created++;
            } else if (outcome == IngestionPipeline.Outcome.DUPLICATE) {
                duplicates++;
            } else {
                skippedNoLocation++;
            }
        }

        ctx.activityLog().record(
                Activity.DATA_INGESTION,
                source.label() + " data sync complete - " + created + " new events ingested",
                ActivityLevel.INFO
        );
        LOGGER.fine(source.label() + " created " + created + " of " + batch.candidates().size() + " candidates");

        Map<String, Object> stats = new HashMap<>();
        stats.put("candidates", batch.candidates().size());
        stats.put("created", created);
        stats.put("duplicates", duplicates);
        stats.put("skippedNoLocation", skippedNoLocation);
        stats.put("rejected", batch.rejected());
        return CollectorResult.success(source.label() + " sync completed", stats);
    }

    private static String failureMessage(Throwable error) {
        Throwable cause = error;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
