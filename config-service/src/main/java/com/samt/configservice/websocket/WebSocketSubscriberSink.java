package com.samt.configservice.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samt.common.events.ConfigChangedEvent;
import com.samt.configservice.notify.SubscriberSink;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adapts one WebSocket session into a change bus subscriber.
 * The session is expected to be thread-safe for sending (see ConcurrentWebSocketSessionDecorator).
 */
public class WebSocketSubscriberSink implements SubscriberSink {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketSubscriberSink(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(ConfigChangedEvent event) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }

    /**
     * Send a protocol message: {@code {"type": type, ...payload}}.
     */
    public void reply(String type, Map<String, ?> payload) throws IOException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.putAll(payload);
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }
}
