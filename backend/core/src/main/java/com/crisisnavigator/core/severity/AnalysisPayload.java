package com.crisisnavigator.core.severity;

import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

public record AnalysisPayload(Double rawScore, Evidence evidence, String narrative, JsonNode source) {
    public static AnalysisPayload parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ClassificationParseException("Analysis response was empty");
        }
        try {
            return read(JsonUtils.objectMapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new ClassificationParseException("Analysis response is not valid JSON", e);
        }
    }

    public static AnalysisPayload read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ClassificationParseException("Analysis payload must be a JSON object");
        }
        boolean hasScore = node.hasNonNull("severity");
        boolean hasEvidence = node.path("evidence").isObject();
        String narrative = JsonUtils.firstText(node, "fullAnalysis", "analysis", "narrative").orElse(null);
        if (!hasScore && !hasEvidence && narrative == null) {
            throw new ClassificationParseException("Analysis payload has no severity, evidence or narrative");
        }
        Double rawScore = JsonUtils.number(node, "severity").orElse(null);
        return new AnalysisPayload(rawScore, EvidenceExtractor.extract(node), narrative, node);
    }
}
