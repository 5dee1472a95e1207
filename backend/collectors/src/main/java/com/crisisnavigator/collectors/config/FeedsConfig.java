package com.crisisnavigator.collectors.config;

import com.crisisnavigator.core.dedup.DeduplicationGate;

import java.time.Duration;

public record FeedsConfig(
        Duration dedupWindow,
        EonetFeedConfig eonet,
        ReliefWebFeedConfig reliefWeb,
        GdacsFeedConfig gdacs
) {
    public static final String CONFIG_KEY = "feeds";

    public FeedsConfig {
        dedupWindow = dedupWindow == null || dedupWindow.isZero() || dedupWindow.isNegative()
                ? DeduplicationGate.DEFAULT_WINDOW
                : dedupWindow;
        eonet = eonet == null ? EonetFeedConfig.defaults() : eonet;
        reliefWeb = reliefWeb == null ? ReliefWebFeedConfig.defaults() : reliefWeb;
        gdacs = gdacs == null ? GdacsFeedConfig.defaults() : gdacs;
    }

    public FeedsConfig withReliefWeb(ReliefWebFeedConfig replacement) {
        return new FeedsConfig(dedupWindow, eonet, replacement, gdacs);
    }
}
