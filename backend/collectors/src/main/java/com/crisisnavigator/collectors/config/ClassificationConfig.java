package com.crisisnavigator.collectors.config;

import java.time.Duration;

public record ClassificationConfig(
        int batchSize,
        Duration batchPause,
        int maxEventsPerRun,
        Duration analysisTimeout
) {
    public static final String CONFIG_KEY = "classification";
    public static final int DEFAULT_BATCH_SIZE = 5;
    public static final Duration DEFAULT_BATCH_PAUSE = Duration.ofMillis(2000);
    public static final int DEFAULT_MAX_EVENTS_PER_RUN = 10;
    public static final Duration DEFAULT_ANALYSIS_TIMEOUT = Duration.ofSeconds(60);

    public ClassificationConfig {
        batchSize = batchSize <= 0 ? DEFAULT_BATCH_SIZE : batchSize;
        batchPause = batchPause == null || batchPause.isNegative() ? DEFAULT_BATCH_PAUSE : batchPause;
        maxEventsPerRun = maxEventsPerRun <= 0 ? DEFAULT_MAX_EVENTS_PER_RUN : maxEventsPerRun;
        analysisTimeout = analysisTimeout == null || analysisTimeout.isZero() || analysisTimeout.isNegative()
                ? DEFAULT_ANALYSIS_TIMEOUT
                : analysisTimeout;
    }

    public static ClassificationConfig defaults() {
        return new ClassificationConfig(0, null, 0, null);
    }
}
