package com.crisisnavigator.core.model;

import java.time.Instant;

public record Activity(String id, String type, String message, ActivityLevel level, Instant timestamp) {
    public static final String DATA_INGESTION = "data_ingestion";
    public static final String AI_ANALYSIS = "ai_analysis";
}
