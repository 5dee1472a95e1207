package com.crisisnavigator.service.analysis;

public record GeminiConfig(String baseUrl, String model) {
    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    public static final String DEFAULT_MODEL = "gemini-2.5-flash";

    public GeminiConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
    }

    public static GeminiConfig defaults() {
        return new GeminiConfig(null, null);
    }
}
