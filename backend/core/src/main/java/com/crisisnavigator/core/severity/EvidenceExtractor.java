package com.crisisnavigator.core.severity;

import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class EvidenceExtractor {
    private static final Set<String> TRUTHY = Set.of("true", "yes", "y", "1");

    private EvidenceExtractor() {
    }

    /** Reads the {@code evidence} object of an analysis payload, or the payload itself when it has none. */
    public static Evidence extract(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Evidence.NONE;
        }
        JsonNode node = payload.path("evidence").isObject() ? payload.path("evidence") : payload;
        return new Evidence(
                count(node, "fatalities", "deaths"),
                count(node, "injuries", "injured"),
                count(node, "displaced", "displacedCount"),
                amount(node, "economicLossUsd", "economicLossUSD", "economicLoss"),
                flag(node, "emergencyDeclared"),
                flag(node, "emergencyDeclaredRegionalOnly", "regionalEmergencyDeclared"),
                flag(node, "internationalAid", "internationalAidMobilized"),
                flag(node, "crossBorderImpact", "crossBorder"),
                flag(node, "majorInfrastructureDisruption", "infrastructureDisruption"),
                flag(node, "environmentalHazard"),
                flag(node, "rapidEscalation")
        );
    }

    private static int count(JsonNode node, String... fields) {
        double value = amount(node, fields);
        return (int) Math.min(Integer.MAX_VALUE, Math.round(value));
    }

    private static double amount(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<Double> value = JsonUtils.number(node, field);
            if (value.isPresent() && Double.isFinite(value.get())) {
                return Math.max(0d, value.get());
            }
        }
        return 0d;
    }

    private static boolean flag(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            if (value.isNumber()) {
                return value.asDouble() > 0;
            }
            if (value.isTextual()) {
                return TRUTHY.contains(value.asText().trim().toLowerCase(Locale.ROOT));
            }
        }
        return false;
    }
}
