package com.crisisnavigator.core.events;

import java.time.Instant;

public record DisasterClassified(
        Instant timestamp,
        String disasterId,
        String band,
        int severity,
        int highTriggerCount
) implements Event {
    @Override
    public String type() {
        return "DisasterClassified";
    }
}
