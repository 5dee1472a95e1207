package com.crisisnavigator.service.api;

import com.crisisnavigator.core.events.Event;
import com.crisisnavigator.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private EventCodec() {
    }

    public static String toSseData(Event event) {
        try {
            return MAPPER.writeValueAsString(new Envelope(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize SSE event " + event.type(), e);
        }
    }

    private record Envelope(String type, Instant timestamp, Event event) {
    }
}
