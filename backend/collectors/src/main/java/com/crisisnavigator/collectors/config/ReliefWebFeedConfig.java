package com.crisisnavigator.collectors.config;

public record ReliefWebFeedConfig(
        String baseUrl,
        String appName,
        int lookbackDays,
        int limit,
        int maxCountriesPerReport
) {
    public static final String DEFAULT_BASE_URL = "https://api.reliefweb.int";
    public static final String DEFAULT_APP_NAME = "crisis-navigator/0.1";
    public static final int DEFAULT_LIMIT = 100;
    public static final int DEFAULT_MAX_COUNTRIES = 5;

    public ReliefWebFeedConfig {
        baseUrl = FeedDefaults.baseUrl(baseUrl, DEFAULT_BASE_URL);
        appName = appName == null || appName.isBlank() ? DEFAULT_APP_NAME : appName;
        lookbackDays = FeedDefaults.lookbackDays(lookbackDays);
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
        maxCountriesPerReport = maxCountriesPerReport <= 0 ? DEFAULT_MAX_COUNTRIES : maxCountriesPerReport;
    }

    public static ReliefWebFeedConfig defaults() {
        return new ReliefWebFeedConfig(null, null, 0, 0, 0);
    }

    public ReliefWebFeedConfig withAppName(String name) {
        return new ReliefWebFeedConfig(baseUrl, name, lookbackDays, limit, maxCountriesPerReport);
    }
}
