package com.samt.configservice.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.samt.common.events.ChangeAction;
import com.samt.configservice.notify.ChangeBus;
import com.samt.configservice.notify.DispatchLanes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ChangeBus changeBus = new ChangeBus(
        new DispatchLanes(List.of((Executor) Runnable::run)),
        Clock.systemUTC());
    private final ConfigWebSocketHandler handler = new ConfigWebSocketHandler(changeBus, objectMapper);

    private WebSocketSession session;

    @BeforeEach
    void connect() throws Exception {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("session-1");
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
    }

    @Test
    void greetsNewConnectionWithSubscriberId() throws Exception {
        JsonNode greeting = sent().get(0);

        assertThat(greeting.path("type").asText()).isEqualTo("connected");
        assertThat(greeting.path("subscriberId").asText()).isEqualTo("session-1");
        assertThat(changeBus.stats().connectedSubscribers()).isEqualTo(1);
    }

    @Test
    void subscribeThenReceivesChangesForThatKeyOnly() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"keys\":[\"cpa_level_amounts\"]}"));

        changeBus.publish("system_settings", JsonNodeFactory.instance.objectNode(), ChangeAction.UPDATE);
        changeBus.publish("cpa_level_amounts", JsonNodeFactory.instance.objectNode().put("level_1", 60), ChangeAction.UPDATE);

        List<JsonNode> messages = sent();
        assertThat(messages).extracting(m -> m.path("type").asText())
            .containsExactly("connected", "subscribed", "config_changed");

        JsonNode change = messages.get(2);
        assertThat(change.path("key").asText()).isEqualTo("cpa_level_amounts");
        assertThat(change.path("action").asText()).isEqualTo("UPDATE");
        assertThat(change.path("value").path("level_1").asInt()).isEqualTo(60);
    }

    @Test
    void listsSubscriptionsSorted() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"keys\":[\"b_key\",\"a_key\"]}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"unsubscribe\",\"keys\":[\"b_key\"]}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"list_subscriptions\"}"));

        JsonNode list = last();
        assertThat(list.path("type").asText()).isEqualTo("subscriptions_list");
        assertThat(list.path("count").asInt()).isEqualTo(1);
        assertThat(list.path("subscriptions").get(0).asText()).isEqualTo("a_key");
    }

    @Test
    void answersPing() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        assertThat(last().path("type").asText()).isEqualTo("pong");
    }

    @Test
    void reportsProtocolErrorsWithoutClosing() throws Exception {
        handler.handleTextMessage(session, new TextMessage("not json"));
        assertThat(last().path("message").asText()).isEqualTo("Malformed message: expected a JSON object");

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"keys\":\"a_key\"}"));
        assertThat(last().path("message").asText()).isEqualTo("keys must be an array of strings");

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"teleport\"}"));
        assertThat(last().path("type").asText()).isEqualTo("error");
        assertThat(last().path("message").asText()).isEqualTo("Unknown message type: teleport");

        assertThat(changeBus.subscriptions("session-1")).isEmpty();
    }

    @Test
    void closingDropsSubscriber() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"keys\":[\"a_key\"]}"));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(changeBus.stats().connectedSubscribers()).isZero();
        assertThat(changeBus.stats().totalSubscriptions()).isZero();
    }

    private List<JsonNode> sent() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            messages.add(objectMapper.readTree(message.getPayload()));
        }
        return messages;
    }

    private JsonNode last() throws Exception {
        List<JsonNode> messages = sent();
        return messages.get(messages.size() - 1);
    }
}
