package com.crisisnavigator.core.events;

import java.time.Instant;

public record DisasterIngested(
        Instant timestamp,
        String disasterId,
        String source,
        String disasterType,
        String title,
        double latitude,
        double longitude
) implements Event {
    @Override
    public String type() {
        return "DisasterIngested";
    }
}
