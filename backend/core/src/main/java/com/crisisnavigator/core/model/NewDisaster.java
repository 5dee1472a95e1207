package com.crisisnavigator.core.model;

import com.crisisnavigator.core.geo.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

public record NewDisaster(
        String type,
        String title,
        String description,
        double latitude,
        double longitude,
        Instant timestamp,
        boolean processed,
        Integer severity,
        String analysis,
        JsonNode rawData
) {
    public static final int PROVISIONAL_SEVERITY = 3;

    public NewDisaster {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static NewDisaster pending(
            String type,
            String title,
            String description,
            GeoPoint position,
            Instant timestamp,
            JsonNode rawData
    ) {
        return new NewDisaster(
                type,
                title,
                description == null ? "" : description,
                position.latitude(),
                position.longitude(),
                timestamp,
                false,
                PROVISIONAL_SEVERITY,
                null,
                rawData
        );
    }
}
