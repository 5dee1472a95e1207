package com.crisisnavigator.collectors.config;

public record EonetFeedConfig(String baseUrl, int lookbackDays) {
    public static final String DEFAULT_BASE_URL = "https://eonet.gsfc.nasa.gov";

    public EonetFeedConfig {
        baseUrl = FeedDefaults.baseUrl(baseUrl, DEFAULT_BASE_URL);
        lookbackDays = FeedDefaults.lookbackDays(lookbackDays);
    }

    public static EonetFeedConfig defaults() {
        return new EonetFeedConfig(null, 0);
    }
}
