package com.crisisnavigator.collectors.gdacs;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.config.GdacsFeedConfig;
import com.crisisnavigator.collectors.feed.CandidateEvent;
import com.crisisnavigator.collectors.feed.FeedCollector;
import com.crisisnavigator.collectors.support.CollectorContractAssertions;
import com.crisisnavigator.collectors.support.EventCapture;
import com.crisisnavigator.collectors.support.FixtureUtils;
import com.crisisnavigator.collectors.support.InMemoryDisasters;
import com.crisisnavigator.collectors.support.RecordingActivityLog;
import com.crisisnavigator.collectors.support.TestContexts;
import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.geo.CoordinateResolver;
import com.crisisnavigator.core.geo.CountryCentroids;
import com.crisisnavigator.core.geo.GeoPoint;
import com.crisisnavigator.core.geo.Jitter;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GdacsFeedSourceTest {
    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        String fixture = FixtureUtils.fixtureText("fixtures/gdacs-events.json");
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/gdacsapi/api/events/geteventlist/v2", exchange -> {
            lastQuery.set(exchange.getRequestURI().getQuery());
            writeResponse(exchange, 200, fixture);
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void ingestsHazardsWithJitteredPositions() {
        EventBus bus = TestContexts.strictBus();
        EventCapture capture = new EventCapture(bus);
        InMemoryDisasters store = new InMemoryDisasters(TestContexts.fixedClock());
        RecordingActivityLog activities = new RecordingActivityLog(TestContexts.fixedClock());

        CollectorResult result = CollectorContractAssertions.assertContract(
                collector(), context(bus, store, activities), capture, Duration.ofSeconds(5), false);

        assertEquals("fromdate=2025-07-27T12:00:00Z", lastQuery.get());
        assertEquals(2, result.stats().get("created"));
        assertEquals(1, result.stats().get("rejected"));

        Disaster quake = store.byTitle("EQ 1501234").get(0);
        assertEquals("EQ", quake.type());
        assertEquals(Instant.parse("2025-08-25T10:15:00Z"), quake.timestamp());
        assertEquals("GDACS EQ | alertlevel=Orange | population=12,000", quake.description());
        GeoPoint expected = Jitter.apply(34.5, 70.5, "EQ 1501234|EQ|2025-08-25T10:15:00");
        assertEquals(expected.latitude(), quake.latitude(), 1e-9);
        assertEquals(expected.longitude(), quake.longitude(), 1e-9);

        Disaster cyclone = store.byTitle("ERIN-25").get(0);
        assertEquals(Instant.parse("2025-08-24T00:00:00Z"), cyclone.timestamp());
        assertEquals("GDACS TC | alertlevel=Green | population=n/a", cyclone.description());
        assertTrue(Math.abs(cyclone.latitude() - 21.0) <= Jitter.MAX_OFFSET_DEGREES);

        assertEquals("GDACS data sync complete - 2 new events ingested", activities.all().get(0).message());
    }

    @Test
    void fallsBackToNowWhenFeatureHasNoDates() throws Exception {
        GdacsFeedSource source = new GdacsFeedSource();

        Optional<CandidateEvent> candidate = source.toCandidate(JsonUtils.objectMapper().readTree(
                "{\"geometry\":{\"coordinates\":[1.0,2.0]},\"properties\":{\"eventname\":\"Drought\"}}"),
                TestContexts.NOW);
        Optional<CandidateEvent> untitled = source.toCandidate(JsonUtils.objectMapper().readTree(
                "{\"geometry\":{\"coordinates\":[1.0,2.0]},\"properties\":{}}"),
                TestContexts.NOW);

        assertEquals(TestContexts.NOW, candidate.orElseThrow().timestamp());
        assertEquals("Hazard", candidate.orElseThrow().type());
        assertEquals("Drought|Hazard|" + TestContexts.NOW, candidate.orElseThrow().jitterKey());
        assertTrue(untitled.isEmpty());
    }

    private FeedCollector collector() {
        return new FeedCollector(
                new GdacsFeedSource(),
                new CoordinateResolver(CountryCentroids.loadDefault()),
                Duration.ofMinutes(15)
        );
    }

    private CollectorContext context(EventBus bus, InMemoryDisasters store, RecordingActivityLog activities) {
        String baseUrl = "http://localhost:" + server.getAddress().getPort();
        FeedsConfig feeds = new FeedsConfig(Duration.ofHours(24), null, null, new GdacsFeedConfig(baseUrl, 30));
        return TestContexts.context(bus, store, activities, Map.of(FeedsConfig.CONFIG_KEY, feeds));
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
