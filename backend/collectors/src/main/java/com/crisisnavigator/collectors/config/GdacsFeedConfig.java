package com.crisisnavigator.collectors.config;

public record GdacsFeedConfig(String baseUrl, int lookbackDays) {
    public static final String DEFAULT_BASE_URL = "https://www.gdacs.org";

    public GdacsFeedConfig {
        baseUrl = FeedDefaults.baseUrl(baseUrl, DEFAULT_BASE_URL);
        lookbackDays = FeedDefaults.lookbackDays(lookbackDays);
    }

    public static GdacsFeedConfig defaults() {
        return new GdacsFeedConfig(null, 0);
    }
}
