package com.crisisnavigator.core.dedup;

import com.crisisnavigator.core.model.Disaster;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Exact-title duplicate check against the live event collection. Titles are compared trimmed and
 * lower-cased; timestamps must be strictly closer than the window. No fuzzy matching.
 */
public class DeduplicationGate {
    public static final Duration DEFAULT_WINDOW = Duration.ofDays(1);
    public static final String REGION_SEPARATOR = " — ";

    private final Duration window;

    public DeduplicationGate() {
        this(DEFAULT_WINDOW);
    }

    public DeduplicationGate(Duration window) {
        Objects.requireNonNull(window, "window is required");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Dedup window must be positive: " + window);
        }
        this.window = window;
    }

    public Duration window() {
        return window;
    }

    public boolean isDuplicate(
            String candidateTitle,
            String candidateRegionKey,
            Instant candidateTimestamp,
            Collection<Disaster> existingEvents
    ) {
        String key = normalize(compositeTitle(candidateTitle, candidateRegionKey));
        long windowMillis = window.toMillis();
        long candidateMillis = candidateTimestamp.toEpochMilli();
        for (Disaster existing : existingEvents) {
            if (existing.title() == null || existing.timestamp() == null) {
                continue;
            }
            if (!key.equals(normalize(existing.title()))) {
                continue;
            }
            if (Math.abs(existing.timestamp().toEpochMilli() - candidateMillis) < windowMillis) {
                return true;
            }
        }
        return false;
    }

    public static String compositeTitle(String title, String regionKey) {
        String base = title == null ? "" : title;
        if (regionKey == null || regionKey.isBlank()) {
            return base;
        }
        return base + REGION_SEPARATOR + regionKey;
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
