package com.crisisnavigator.collectors.gdacs;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.config.GdacsFeedConfig;
import com.crisisnavigator.collectors.feed.CandidateEvent;
import com.crisisnavigator.collectors.feed.FeedBatch;
import com.crisisnavigator.collectors.feed.FeedRequests;
import com.crisisnavigator.collectors.feed.FeedSource;
import com.crisisnavigator.collectors.feed.FeedTimestamps;
import com.crisisnavigator.core.geo.GeoPoint;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class GdacsFeedSource implements FeedSource {
    @Override
    public String name() {
        return "gdacs";
    }

    @Override
    public String label() {
        return "GDACS";
    }

    @Override
    public int lookbackDays(CollectorContext ctx) {
        return config(ctx).lookbackDays();
    }

    @Override
    public FeedBatch fetch(Instant cutoff, CollectorContext ctx) throws FeedFetchException {
        GdacsFeedConfig cfg = config(ctx);
        URI uri = URI.create(cfg.baseUrl() + "/gdacsapi/api/events/geteventlist/v2?fromdate="
                + URLEncoder.encode(cutoff.toString(), StandardCharsets.UTF_8));
        JsonNode root = FeedRequests.getJson(uri, label(), ctx);

        Instant now = ctx.clock().instant();
        List<CandidateEvent> candidates = new ArrayList<>();
        int rejected = 0;
        for (JsonNode feature : root.path("features")) {
            Optional<CandidateEvent> candidate = toCandidate(feature, now);
            if (candidate.isPresent()) {
                candidates.add(candidate.get());
            } else {
                rejected++;
            }
        }
        return new FeedBatch(candidates, rejected);
    }

    Optional<CandidateEvent> toCandidate(JsonNode feature, Instant now) {
        JsonNode properties = feature.path("properties");
        JsonNode coordinates = feature.path("geometry").path("coordinates");
        double lon = JsonUtils.number(coordinates.path(0)).orElse(Double.NaN);
        double lat = JsonUtils.number(coordinates.path(1)).orElse(Double.NaN);
        if (!GeoPoint.isUsable(lat, lon)) {
            return Optional.empty();
        }

        String title = JsonUtils.text(properties, "eventname")
                .orElseGet(() -> (JsonUtils.text(properties, "eventtype").orElse("") + " "
                        + JsonUtils.text(properties, "eventid").orElse("")).trim());
        if (title.isEmpty()) {
            return Optional.empty();
        }
        String when = JsonUtils.firstText(properties, "updated", "fromdate").orElse(now.toString());
        Optional<Instant> timestamp = FeedTimestamps.parse(when);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }

        String type = JsonUtils.text(properties, "eventtype").orElse("Hazard");
        String description = "GDACS " + type
                + " | alertlevel=" + JsonUtils.text(properties, "alertlevel").orElse("n/a")
                + " | population=" + JsonUtils.text(properties, "population").orElse("n/a");
        return Optional.of(new CandidateEvent(
                type,
                title,
                null,
                description,
                timestamp.get(),
                new GeoPoint(lat, lon),
                title + "|" + type + "|" + when,
                feature
        ));
    }

    private GdacsFeedConfig config(CollectorContext ctx) {
        return ctx.requiredConfig(FeedsConfig.CONFIG_KEY, FeedsConfig.class).gdacs();
    }
}
