package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.support.CollectorContractAssertions;
import com.crisisnavigator.collectors.support.EventCapture;
import com.crisisnavigator.collectors.support.InMemoryDisasters;
import com.crisisnavigator.collectors.support.RecordingActivityLog;
import com.crisisnavigator.collectors.support.TestContexts;
import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.events.AlertRaised;
import com.crisisnavigator.core.geo.CoordinateResolver;
import com.crisisnavigator.core.geo.CountryCentroids;
import com.crisisnavigator.core.geo.GeoPoint;
import com.crisisnavigator.core.model.ActivityLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedCollectorTest {
    private static final CoordinateResolver RESOLVER = new CoordinateResolver(CountryCentroids.loadDefault());

    @Test
    void duplicatesWithinOneBatchAreDropped() {
        Instant first = Instant.parse("2025-08-25T06:00:00Z");
        FakeSource source = new FakeSource(new FeedBatch(List.of(
                point("River flood", first),
                point("River flood", first.plus(Duration.ofHours(3))),
                point("  river FLOOD ", first.plus(Duration.ofHours(30)))
        ), 0));
        EventBus bus = TestContexts.strictBus();
        EventCapture capture = new EventCapture(bus);
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());

        CollectorResult result = CollectorContractAssertions.assertContract(
                new FeedCollector(source, RESOLVER, Duration.ofMinutes(5)),
                context(bus, store, Duration.ofHours(24)),
                capture,
                Duration.ofSeconds(2),
                false
        );

        assertEquals("Fake feed sync completed", result.message());
        assertEquals(2, result.stats().get("created"));
        assertEquals(1, result.stats().get("duplicates"));
        assertEquals(2, store.listAll().size());
    }

    @Test
    void configuredWindowControlsDeduplication() {
        Instant first = Instant.parse("2025-08-25T06:00:00Z");
        FakeSource source = new FakeSource(new FeedBatch(List.of(
                point("River flood", first),
                point("River flood", first.plus(Duration.ofHours(3)))
        ), 0));
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());

        CollectorResult result = new FeedCollector(source, RESOLVER, Duration.ofMinutes(5))
                .poll(context(TestContexts.strictBus(), store, Duration.ofHours(2)))
                .join();

        assertEquals(2, result.stats().get("created"));
        assertEquals(0, result.stats().get("duplicates"));
    }

    @Test
    void cutoffIsLookbackBeforeNow() {
        FakeSource source = new FakeSource(new FeedBatch(List.of(), 0));
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());

        new FeedCollector(source, RESOLVER, Duration.ofMinutes(5))
                .poll(context(TestContexts.strictBus(), store, Duration.ofHours(24)))
                .join();

        assertEquals(TestContexts.NOW.minus(Duration.ofDays(7)), source.lastCutoff.get());
    }

    @Test
    void fetchFailureIsReportedNotThrown() {
        FakeSource source = new FakeSource(null);
        EventBus bus = TestContexts.strictBus();
        EventCapture capture = new EventCapture(bus);
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());
        RecordingActivityLog activities = new RecordingActivityLog(TestContexts.fixedClock());
        CollectorContext ctx = TestContexts.context(bus, store, activities,
                Map.of(FeedsConfig.CONFIG_KEY, new FeedsConfig(null, null, null, null)));

        CollectorResult result = CollectorContractAssertions.assertContract(
                new FeedCollector(source, RESOLVER, Duration.ofMinutes(5)), ctx, capture, Duration.ofSeconds(2), true);

        assertEquals("Fake feed sync failed: connection reset", result.message());
        assertEquals(ActivityLevel.ERROR, activities.all().get(0).level());
        assertEquals("Fake feed data sync failed: connection reset", activities.all().get(0).message());
        AlertRaised alert = capture.byType(AlertRaised.class).get(0);
        assertEquals("Fake feed fetch failed: connection reset", alert.message());
        assertEquals("fakeCollector", alert.details().get("collector"));
    }

    @Test
    void missingFeedConfigFailsTheTick() {
        FakeSource source = new FakeSource(new FeedBatch(List.of(), 0));
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());
        RecordingActivityLog activities = new RecordingActivityLog(TestContexts.fixedClock());
        CollectorContext ctx = TestContexts.context(TestContexts.strictBus(), store, activities, Map.of());

        CollectorResult result = new FeedCollector(source, RESOLVER, Duration.ofMinutes(5)).poll(ctx).join();

        assertTrue(result.message().contains("Missing required config key: feeds"), result.message());
    }

    private static CandidateEvent point(String title, Instant timestamp) {
        return new CandidateEvent("Flood", title, null, "", timestamp, new GeoPoint(10.0, 20.0), null, null);
    }

    private static CollectorContext context(EventBus bus, InMemoryDisasters store, Duration window) {
        FeedsConfig feeds = new FeedsConfig(window, null, null, null);
        return TestContexts.context(
                bus,
                store,
                new RecordingActivityLog(TestContexts.fixedClock()),
                Map.of(FeedsConfig.CONFIG_KEY, feeds)
        );
    }

    private static final class FakeSource implements FeedSource {
        private final FeedBatch batch;
        private final AtomicReference<Instant> lastCutoff = new AtomicReference<>();

        private FakeSource(FeedBatch batch) {
            this.batch = batch;
        }

        @Override
        public String name() {
            return "fake";
        }

        @Override
        public String label() {
            return "Fake feed";
        }

        @Override
        public int lookbackDays(CollectorContext ctx) {
            return 7;
        }

        @Override
        public FeedBatch fetch(Instant cutoff, CollectorContext ctx) throws FeedFetchException {
            lastCutoff.set(cutoff);
            if (batch == null) {
                throw new FeedFetchException("connection reset");
            }
            return batch;
        }
    }
}
