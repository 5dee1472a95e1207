package com.crisisnavigator.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum SeverityBand {
    LOW(1, 3, 2),
    MEDIUM(4, 6, 5),
    HIGH(7, 10, 8);

    private final int min;
    private final int max;
    private final int midpoint;

    SeverityBand(int min, int max, int midpoint) {
        this.min = min;
        this.max = max;
        this.midpoint = midpoint;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public int midpoint() {
        return midpoint;
    }

    /** Rounds the base into this band; a missing, NaN or zero base falls back to the midpoint. */
    public int clamp(Double base) {
        if (base == null || base.isNaN() || base == 0.0) {
            return midpoint;
        }
        long rounded = Math.round(base);
        return (int) Math.max(min, Math.min(max, rounded));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        String label = label();
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    public static SeverityBand forScore(int score) {
        if (score >= HIGH.min) {
            return HIGH;
        }
        if (score >= MEDIUM.min) {
            return MEDIUM;
        }
        return LOW;
    }

    public static Optional<SeverityBand> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if ("high".equals(normalized)) {
            return Optional.of(HIGH);
        }
        if ("medium".equals(normalized) || "moderate".equals(normalized)) {
            return Optional.of(MEDIUM);
        }
        if ("low".equals(normalized)) {
            return Optional.of(LOW);
        }
        return Optional.empty();
    }
}
