package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;
import com.crisisnavigator.collectors.support.InMemoryDisasters;
import com.crisisnavigator.collectors.support.RecordingActivityLog;
import com.crisisnavigator.collectors.support.TestContexts;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedRequestsTest {
    private HttpServer server;
    private CollectorContext ctx;
    private final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ok", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            writeResponse(exchange, 200, "{\"items\":[1,2]}");
        });
        server.createContext("/garbled", exchange -> writeResponse(exchange, 200, "<html>maintenance</html>"));
        server.createContext("/broken", exchange -> writeResponse(exchange, 500, "x".repeat(300)));
        server.start();
        ctx = TestContexts.context(
                TestContexts.strictBus(),
                new InMemoryDisasters(TestContexts.fixedClock()),
                new RecordingActivityLog(TestContexts.fixedClock()),
                Map.of()
        );
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void readsJsonAndIdentifiesClient() throws Exception {
        JsonNode body = FeedRequests.getJson(uri("/ok"), "Test feed", ctx);

        assertEquals(2, body.path("items").size());
        assertEquals(FeedRequests.USER_AGENT, userAgent.get());
    }

    @Test
    void nonJsonBodyIsAFetchFailure() {
        FeedFetchException error = assertThrows(FeedFetchException.class,
                () -> FeedRequests.getJson(uri("/garbled"), "Test feed", ctx));

        assertEquals("Test feed returned unreadable JSON", error.getMessage());
    }

    @Test
    void errorStatusCarriesTruncatedBody() {
        FeedFetchException error = assertThrows(FeedFetchException.class,
                () -> FeedRequests.getJson(uri("/broken"), "Test feed", ctx));

        assertTrue(error.getMessage().startsWith("Test feed 500: xxx"));
        assertTrue(error.getMessage().endsWith("..."));
        assertEquals("Test feed 500: ".length() + FeedRequests.EXCERPT_LENGTH + 3, error.getMessage().length());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getAddress().getPort() + path);
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
