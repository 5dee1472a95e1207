package com.crisisnavigator.core.events;

import java.time.Instant;

public record ActivityRecorded(
        Instant timestamp,
        String activityId,
        String activityType,
        String message,
        String level
) implements Event {
    @Override
    public String type() {
        return "ActivityRecorded";
    }
}
