package com.crisisnavigator.service.config;

import com.crisisnavigator.collectors.config.ClassificationConfig;
import com.crisisnavigator.collectors.config.FeedsConfig;
import com.crisisnavigator.core.model.CollectorConfig;
import com.crisisnavigator.core.util.JsonUtils;
import com.crisisnavigator.service.analysis.GeminiConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static FeedsConfig loadFeeds(Path configDir) {
        return read(configDir.resolve("feeds.json"), new TypeReference<>() {
        });
    }

    public static ClassificationConfig loadClassification(Path configDir) {
        return read(configDir.resolve("classification.json"), new TypeReference<>() {
        });
    }

    public static GeminiConfig loadGemini(Path configDir) {
        Path path = configDir.resolve("classification.json");
        JsonNode gemini = read(path, new TypeReference<JsonNode>() {
        }).path("gemini");
        if (gemini.isMissingNode() || gemini.isNull()) {
            return GeminiConfig.defaults();
        }
        try {
            return JsonUtils.objectMapper().treeToValue(gemini, GeminiConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
