package com.crisisnavigator.core.model;

import java.time.Instant;
import java.util.Collection;

public record SystemStats(int totalEvents, int processedEvents, int highSeverityEvents, Instant lastUpdated) {
    public static SystemStats of(Collection<Disaster> disasters, Instant now) {
        int processed = 0;
        int high = 0;
        for (Disaster disaster : disasters) {
            if (disaster.processed()) {
                processed++;
            }
            if (disaster.isHighSeverity()) {
                high++;
            }
        }
        return new SystemStats(disasters.size(), processed, high, now);
    }
}
