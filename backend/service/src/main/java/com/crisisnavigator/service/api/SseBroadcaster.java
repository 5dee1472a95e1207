package com.crisisnavigator.service.api;

import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.events.Event;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SseBroadcaster {
    private static final Logger LOGGER = Logger.getLogger(SseBroadcaster.class.getName());

    private final List<SseClient> clients = new CopyOnWriteArrayList<>();
    private final Duration keepAliveInterval;

    public SseBroadcaster(EventBus eventBus) {
        this(eventBus, Duration.ofSeconds(15));
    }

    public SseBroadcaster(EventBus eventBus, Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
        eventBus.subscribeAll(this::broadcast);
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        SseClient client = new SseClient(exchange, exchange.getResponseBody());
        clients.add(client);
        try {
            write(client, ": connected to crisis navigator\n\n");
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(keepAliveInterval.toMillis());
                write(client, ": keepalive\n\n");
            }
        } catch (IOException e) {
            LOGGER.fine("SSE client disconnected: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            removeClient(client);
        }
    }

    public void broadcast(Event event) {
        if (clients.isEmpty()) {
            return;
        }
        String payload = "event: " + event.type() + "\n"
                + "data: " + EventCodec.toSseData(event) + "\n\n";
        for (SseClient client : clients) {
            try {
                write(client, payload);
            } catch (IOException e) {
                removeClient(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    private void write(SseClient client, String data) throws IOException {
        synchronized (client) {
            client.outputStream().write(data.getBytes(StandardCharsets.UTF_8));
            client.outputStream().flush();
        }
    }

    private void removeClient(SseClient client) {
        if (clients.remove(client)) {
            client.close();
        }
    }

    private record SseClient(HttpExchange exchange, OutputStream outputStream) {
        private void close() {
            try {
                outputStream.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Closing SSE stream failed", e);
            }
            exchange.close();
        }
    }
}
