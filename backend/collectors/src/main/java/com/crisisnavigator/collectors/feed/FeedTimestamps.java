package com.crisisnavigator.collectors.feed;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class FeedTimestamps {
    private FeedTimestamps() {
    }

    /** ISO-8601 instant or offset date-time; zone-less values are read as UTC. */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            return Optional.of(Instant.parse(trimmed));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(OffsetDateTime.parse(trimmed).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }
}
