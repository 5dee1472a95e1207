package com.crisisnavigator.collectors.config;

final class FeedDefaults {
    static final int DEFAULT_LOOKBACK_DAYS = 30;

    private FeedDefaults() {
    }

    static String baseUrl(String configured, String fallback) {
        String value = configured == null || configured.isBlank() ? fallback : configured.trim();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    static int lookbackDays(int configured) {
        return configured <= 0 ? DEFAULT_LOOKBACK_DAYS : configured;
    }
}
