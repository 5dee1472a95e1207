package com.crisisnavigator.collectors.feed;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FeedTimestampsTest {
    @Test
    void acceptsInstantOffsetAndLocalForms() {
        Instant expected = Instant.parse("2025-08-25T08:30:00Z");

        assertEquals(Optional.of(expected), FeedTimestamps.parse("2025-08-25T08:30:00Z"));
        assertEquals(Optional.of(expected), FeedTimestamps.parse("2025-08-25T10:30:00+02:00"));
        assertEquals(Optional.of(expected), FeedTimestamps.parse(" 2025-08-25T08:30:00 "));
    }

    @Test
    void rejectsBlankAndFreeText() {
        assertEquals(Optional.empty(), FeedTimestamps.parse(null));
        assertEquals(Optional.empty(), FeedTimestamps.parse(""));
        assertEquals(Optional.empty(), FeedTimestamps.parse("yesterday"));
        assertEquals(Optional.empty(), FeedTimestamps.parse("2025-08-25"));
    }
}
