package com.samt.configservice.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samt.configservice.notify.ChangeBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint /ws/config.
 *
 * Client messages: subscribe, unsubscribe (both with a "keys" array),
 * list_subscriptions, ping. Replies: subscribed, unsubscribed,
 * subscriptions_list, pong, error. Change notifications arrive as
 * config_changed messages pushed by the change bus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ChangeBus changeBus;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSubscriberSink> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSubscriberSink sink = new WebSocketSubscriberSink(
            new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES),
            objectMapper);
        connections.put(session.getId(), sink);
        changeBus.register(session.getId(), sink);

        sink.reply("connected", Map.of(
            "subscriberId", session.getId(),
            "message", "Connected to config service",
            "timestamp", Instant.now().toString()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WebSocketSubscriberSink sink = connections.get(session.getId());
        if (sink == null) {
            log.warn("Message from unregistered session {}", session.getId());
            return;
        }

        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sink.reply("error", Map.of("message", "Malformed message: expected a JSON object"));
            return;
        }

        String type = request.path("type").asText("");
        switch (type) {
            case "subscribe" -> withKeys(sink, request, keys -> {
                changeBus.subscribe(session.getId(), keys);
                sink.reply("subscribed", Map.of(
                    "keys", keys,
                    "message", "Subscribed to " + keys.size() + " configuration(s)"));
            });
            case "unsubscribe" -> withKeys(sink, request, keys -> {
                changeBus.unsubscribe(session.getId(), keys);
                sink.reply("unsubscribed", Map.of(
                    "keys", keys,
                    "message", "Unsubscribed from " + keys.size() + " configuration(s)"));
            });
            case "list_subscriptions" -> {
                List<String> subscriptions = changeBus.subscriptions(session.getId()).stream().sorted().toList();
                sink.reply("subscriptions_list", Map.of(
                    "subscriptions", subscriptions,
                    "count", subscriptions.size()));
            }
            case "ping" -> sink.reply("pong", Map.of("timestamp", Instant.now().toString()));
            default -> sink.reply("error", Map.of("message", "Unknown message type: " + type));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        changeBus.dropSubscriber(session.getId());
        log.debug("Session {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @FunctionalInterface
    private interface KeysAction {
        void accept(List<String> keys) throws IOException;
    }

    private void withKeys(WebSocketSubscriberSink sink, JsonNode request, KeysAction action) throws IOException {
        Optional<List<String>> keys = readKeys(request.get("keys"));
        if (keys.isEmpty()) {
            sink.reply("error", Map.of("message", "keys must be an array of strings"));
            return;
        }
        action.accept(keys.get());
    }

    private static Optional<List<String>> readKeys(JsonNode node) {
        if (node == null || !node.isArray()) {
            return Optional.empty();
        }
        List<String> keys = new ArrayList<>(node.size());
        for (JsonNode key : node) {
            if (!key.isTextual()) {
                return Optional.empty();
            }
            keys.add(key.asText());
        }
        return Optional.of(keys);
    }
}
