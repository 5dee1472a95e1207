package com.crisisnavigator.service.analysis;

import com.crisisnavigator.collectors.api.AnalysisProvider;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.severity.ClassificationParseException;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class GeminiAnalysisClient implements AnalysisProvider {
    public static final String API_KEY_ENV = "GEMINI_API_KEY";
    public static final String FALLBACK_API_KEY_ENV = "GOOGLE_API_KEY";

    private final HttpClient httpClient;
    private final GeminiConfig config;
    private final String apiKey;
    private final Duration timeout;

    public GeminiAnalysisClient(HttpClient httpClient, GeminiConfig config, String apiKey, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
    }

    public static Optional<String> apiKey(Map<String, String> environment) {
        for (String name : new String[]{API_KEY_ENV, FALLBACK_API_KEY_ENV}) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    @Override
    public CompletableFuture<JsonNode> analyze(Disaster disaster) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint())
                    .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.objectMapper().writeValueAsString(requestBody(disaster))))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", apiKey)
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Unable to encode Gemini request", e));
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> readAnalysis(response.statusCode(), response.body()));
    }

    URI endpoint() {
        return URI.create(config.baseUrl() + "/v1beta/models/" + config.model() + ":generateContent");
    }

    static ObjectNode requestBody(Disaster disaster) {
        ObjectNode body = JsonUtils.objectMapper().createObjectNode();
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt(disaster));
        body.putObject("generationConfig").put("responseMimeType", "application/json");
        return body;
    }

    static String prompt(Disaster disaster) {
        return "DISASTER ANALYSIS REQUEST:\n"
                + "**Event**: " + disaster.title() + "\n"
                + "**Description**: " + disaster.description() + "\n"
                + "**Type**: " + disaster.type() + "\n"
                + "**Location**: " + disaster.latitude() + ", " + disaster.longitude() + "\n"
                + "**Date**: " + disaster.timestamp() + "\n\n"
                + "Respond with a single JSON object with this structure:\n"
                + "{\n"
                + "  \"severity\": number (1-10 scale),\n"
                + "  \"evidence\": {\n"
                + "    \"fatalities\": number, \"injuries\": number, \"displaced\": number,\n"
                + "    \"economicLossUsd\": number, \"emergencyDeclared\": boolean,\n"
                + "    \"emergencyDeclaredRegionalOnly\": boolean, \"internationalAid\": boolean,\n"
                + "    \"crossBorderImpact\": boolean, \"majorInfrastructureDisruption\": boolean,\n"
                + "    \"environmentalHazard\": boolean, \"rapidEscalation\": boolean\n"
                + "  },\n"
                + "  \"risks\": [\"risk1\", \"risk2\", \"risk3\"],\n"
                + "  \"immediateActions\": [\"action1\", \"action2\", \"action3\"],\n"
                + "  \"evacuationGuidance\": [\"guidance1\", \"guidance2\", \"guidance3\"],\n"
                + "  \"resourcePriorities\": {\"water\": number, \"medical\": number, \"shelters\": number},\n"
                + "  \"fullAnalysis\": \"detailed text analysis that states the overall severity level\"\n"
                + "}\n\n"
                + "Use 0 or false for evidence you cannot confirm. "
                + "Focus on practical, actionable advice for emergency response teams.";
    }

    static JsonNode readAnalysis(int status, String body) {
        if (status / 100 != 2) {
            throw new IllegalStateException("Gemini request failed with status " + status);
        }
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ClassificationParseException("Gemini response is not valid JSON", e);
        }
        String text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("");
        if (text.isBlank()) {
            throw new ClassificationParseException("Gemini response contained no analysis text");
        }
        try {
            return JsonUtils.objectMapper().readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new ClassificationParseException("Gemini analysis text is not valid JSON", e);
        }
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
