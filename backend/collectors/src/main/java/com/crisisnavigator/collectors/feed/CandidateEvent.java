package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.core.dedup.DeduplicationGate;
import com.crisisnavigator.core.geo.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

public record CandidateEvent(
        String type,
        String title,
        String regionKey,
        String description,
        Instant timestamp,
        GeoPoint location,
        String jitterKey,
        JsonNode rawData
) {
    public CandidateEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public String displayTitle() {
        return DeduplicationGate.compositeTitle(title, regionKey);
    }
}
