package com.crisisnavigator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record Disaster(
        String id,
        String type,
        String title,
        String description,
        double latitude,
        double longitude,
        Instant timestamp,
        boolean processed,
        Integer severity,
        String analysis,
        JsonNode rawData,
        Instant createdAt,
        Instant updatedAt
) {
    public static Disaster fromDraft(String id, NewDisaster draft, Instant now) {
        return new Disaster(
                id,
                draft.type(),
                draft.title(),
                draft.description(),
                draft.latitude(),
                draft.longitude(),
                draft.timestamp(),
                draft.processed(),
                draft.severity(),
                draft.analysis(),
                draft.rawData(),
                now,
                now
        );
    }

    public Disaster classified(int newSeverity, String newAnalysis) {
        return new Disaster(id, type, title, description, latitude, longitude, timestamp,
                true, newSeverity, newAnalysis, rawData, createdAt, updatedAt);
    }

    public Disaster markedProcessed() {
        return new Disaster(id, type, title, description, latitude, longitude, timestamp,
                true, severity, analysis, rawData, createdAt, updatedAt);
    }

    public Disaster withUpdatedAt(Instant at) {
        return new Disaster(id, type, title, description, latitude, longitude, timestamp,
                processed, severity, analysis, rawData, createdAt, at);
    }

    public boolean isHighSeverity() {
        return severity != null && severity >= 7;
    }
}
