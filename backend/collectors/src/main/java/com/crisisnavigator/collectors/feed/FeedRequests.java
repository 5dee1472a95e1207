package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

public final class FeedRequests {
    public static final String USER_AGENT = "crisis-navigator/0.1";
    static final int EXCERPT_LENGTH = 200;

    private FeedRequests() {
    }

    public static JsonNode getJson(URI uri, String label, CollectorContext ctx) throws FeedFetchException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(ctx.requestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();
        return send(request, label, ctx);
    }

    public static JsonNode postJson(URI uri, JsonNode body, String label, CollectorContext ctx) throws FeedFetchException {
        String payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new FeedFetchException(label + " request body could not be encoded", e);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .timeout(ctx.requestTimeout())
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();
        return send(request, label, ctx);
    }

    private static JsonNode send(HttpRequest request, String label, CollectorContext ctx) throws FeedFetchException {
        HttpResponse<String> response;
        try {
            response = ctx.httpClient().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException(label + " request interrupted", e);
        } catch (IOException e) {
            throw new FeedFetchException(label + " request failed: " + describe(e), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new FeedFetchException(label + " " + response.statusCode() + ": " + excerpt(response.body()));
        }
        try {
            return JsonUtils.objectMapper().readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new FeedFetchException(label + " returned unreadable JSON", e);
        }
    }

    static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.strip();
        return trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
