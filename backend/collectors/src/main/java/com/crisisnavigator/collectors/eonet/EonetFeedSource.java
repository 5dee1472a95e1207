package com.crisisnavigator.collectors.eonet;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.config.EonetFeedConfig;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.feed.CandidateEvent;
import com.crisisnavigator.collectors.feed.FeedBatch;
import com.crisisnavigator.collectors.feed.FeedRequests;
import com.crisisnavigator.collectors.feed.FeedSource;
import com.crisisnavigator.collectors.feed.FeedTimestamps;
import com.crisisnavigator.core.geo.GeoPoint;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class EonetFeedSource implements FeedSource {
    @Override
    public String name() {
        return "eonet";
    }

    @Override
    public String label() {
        return "NASA EONET";
    }

    @Override
    public int lookbackDays(CollectorContext ctx) {
        return config(ctx).lookbackDays();
    }

    @Override
    public FeedBatch fetch(Instant cutoff, CollectorContext ctx) throws FeedFetchException {
        EonetFeedConfig cfg = config(ctx);
        URI uri = URI.create(cfg.baseUrl() + "/api/v3/events?days=" + cfg.lookbackDays());
        JsonNode root = FeedRequests.getJson(uri, label(), ctx);

        List<CandidateEvent> candidates = new ArrayList<>();
        int rejected = 0;
        for (JsonNode event : root.path("events")) {
            Optional<CandidateEvent> candidate = toCandidate(event);
            if (candidate.isPresent()) {
                candidates.add(candidate.get());
            } else {
                rejected++;
            }
        }
        return new FeedBatch(candidates, rejected);
    }

    Optional<CandidateEvent> toCandidate(JsonNode event) {
        Optional<String> title = JsonUtils.text(event, "title");
        JsonNode geometry = event.path("geometry").path(0);
        JsonNode coordinates = geometry.path("coordinates");
        if (title.isEmpty() || !coordinates.isArray() || coordinates.size() != 2) {
            return Optional.empty();
        }
        double lon = JsonUtils.number(coordinates.get(0)).orElse(Double.NaN);
        double lat = JsonUtils.number(coordinates.get(1)).orElse(Double.NaN);
        if (!GeoPoint.isUsable(lat, lon)) {
            return Optional.empty();
        }
        Optional<Instant> timestamp = JsonUtils.text(geometry, "date").flatMap(FeedTimestamps::parse);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }

        String type = JsonUtils.text(event.path("categories").path(0), "title").orElse("Unknown");
        String description = JsonUtils.text(event, "description").orElse("");
        return Optional.of(new CandidateEvent(
                type,
                title.get(),
                null,
                description,
                timestamp.get(),
                new GeoPoint(lat, lon),
                null,
                event
        ));
    }

    private EonetFeedConfig config(CollectorContext ctx) {
        return ctx.requiredConfig(FeedsConfig.CONFIG_KEY, FeedsConfig.class).eonet();
    }
}
