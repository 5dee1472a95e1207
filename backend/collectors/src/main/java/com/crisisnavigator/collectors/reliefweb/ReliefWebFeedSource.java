package com.crisisnavigator.collectors.reliefweb;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.collectors.config.ReliefWebFeedConfig;
import com.crisisnavigator.collectors.feed.CandidateEvent;
import com.crisisnavigator.collectors.feed.FeedBatch;
import com.crisisnavigator.collectors.feed.FeedRequests;
import com.crisisnavigator.collectors.feed.FeedSource;
import com.crisisnavigator.collectors.feed.FeedTimestamps;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class ReliefWebFeedSource implements FeedSource {
    static final String QUERY = "conflict OR war OR \"armed clashes\" OR \"civil unrest\" OR protest OR riot"
            + " OR \"food insecurity\" OR famine OR displacement OR refugee OR epidemic OR cholera OR measles OR ebola";
    static final List<String> QUERY_FIELDS = List.of("title", "body", "disaster", "country", "theme", "format");
    static final List<String> INCLUDED_FIELDS = List.of(
            "title", "url", "date", "country", "primary_country", "disaster", "theme", "format", "status"
    );
    static final String DEFAULT_TITLE = "ReliefWeb report";
    static final String DEFAULT_TYPE = "Crisis";

    private static final DateTimeFormatter CUTOFF_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T00:00:00+00:00'");

    @Override
    public String name() {
        return "reliefWeb";
    }

    @Override
    public String label() {
        return "ReliefWeb";
    }

    @Override
    public int lookbackDays(CollectorContext ctx) {
        return config(ctx).lookbackDays();
    }

    @Override
    public FeedBatch fetch(Instant cutoff, CollectorContext ctx) throws FeedFetchException {
        ReliefWebFeedConfig cfg = config(ctx);
        URI uri = URI.create(cfg.baseUrl() + "/v2/reports?appname="
                + URLEncoder.encode(cfg.appName(), StandardCharsets.UTF_8));
        JsonNode root = FeedRequests.postJson(uri, searchBody(cutoff, cfg.limit()), label(), ctx);

        Instant now = ctx.clock().instant();
        List<CandidateEvent> candidates = new ArrayList<>();
        int rejected = 0;
        for (JsonNode item : root.path("data")) {
            List<CandidateEvent> fanOut = toCandidates(item, now, cfg.maxCountriesPerReport());
            if (fanOut.isEmpty()) {
                rejected++;
            }
            candidates.addAll(fanOut);
        }
        return new FeedBatch(candidates, rejected);
    }

    /** Cutoff truncated to UTC midnight, e.g. {@code 2025-07-27T00:00:00+00:00}. */
    public static String cutoffParameter(Instant cutoff) {
        return LocalDate.ofInstant(cutoff, ZoneOffset.UTC).format(CUTOFF_FORMAT);
    }

    static ObjectNode searchBody(Instant cutoff, int limit) {
        ObjectNode body = JsonUtils.objectMapper().createObjectNode();

        ObjectNode query = body.putObject("query");
        query.put("value", QUERY);
        query.put("operator", "OR");
        ArrayNode queryFields = query.putArray("fields");
        QUERY_FIELDS.forEach(queryFields::add);

        ObjectNode filter = body.putObject("filter");
        filter.put("operator", "AND");
        ArrayNode conditions = filter.putArray("conditions");
        conditions.addObject().put("field", "status").put("value", "published");
        ObjectNode created = conditions.addObject().put("field", "date.created");
        created.putObject("value").put("from", cutoffParameter(cutoff));

        body.putArray("sort").add("date:desc");
        body.put("limit", limit);
        ArrayNode include = body.putObject("fields").putArray("include");
        INCLUDED_FIELDS.forEach(include::add);
        body.put("preset", "latest");
        body.put("slim", 1);
        return body;
    }

    List<CandidateEvent> toCandidates(JsonNode item, Instant now, int maxCountries) {
        JsonNode fields = item.path("fields");
        List<String> countries = countryNames(fields, maxCountries);
        if (countries.isEmpty()) {
            return List.of();
        }
        Optional<Instant> timestamp = JsonUtils.firstText(fields.path("date"), "created", "original")
                .map(FeedTimestamps::parse)
                .orElse(Optional.of(now));
        if (timestamp.isEmpty()) {
            return List.of();
        }

        String title = JsonUtils.text(fields, "title").orElse(DEFAULT_TITLE);
        List<String> types = new ArrayList<>();
        for (JsonNode disaster : fields.path("disaster")) {
            JsonUtils.text(disaster, "name").ifPresent(types::add);
        }
        String type = types.isEmpty() ? DEFAULT_TYPE : types.get(0);

        List<CandidateEvent> candidates = new ArrayList<>();
        for (String country : countries) {
            candidates.add(new CandidateEvent(
                    type,
                    title,
                    country,
                    "Source: ReliefWeb. Country: " + country + ". Types: " + String.join(", ", types),
                    timestamp.get(),
                    null,
                    title + "|" + country,
                    item
            ));
        }
        return candidates;
    }

    static List<String> countryNames(JsonNode fields, int maxCountries) {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode country : fields.path("country")) {
            JsonUtils.text(country, "name").ifPresent(names::add);
        }
        JsonUtils.text(fields.path("primary_country"), "name").ifPresent(names::add);
        return names.stream().limit(maxCountries).toList();
    }

    private ReliefWebFeedConfig config(CollectorContext ctx) {
        return ctx.requiredConfig(FeedsConfig.CONFIG_KEY, FeedsConfig.class).reliefWeb();
    }
}
