package com.blissfly.proxy.core.session;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets session sub-protocol messages for one member connection.
 * <p>
 * Messages are JSON objects with a {@code type}: {@code init}, {@code state},
 * {@code action} and {@code ping}. Replies are {@code joined}, {@code state},
 * {@code event}, {@code pong} and {@code error}. A connection belongs to at most one
 * session at a time; a second {@code init} moves it.
 */
public class SessionProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(SessionProtocolHandler.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final SessionManager manager;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final SessionMember member;
    private String sessionId;

    /**
     * @param manager Shared session registry.
     * @param mapper  JSON mapper.
     * @param clock   Time source for message timestamps.
     * @param member  The connection this handler serves.
     */
    public SessionProtocolHandler(SessionManager manager, ObjectMapper mapper, Clock clock, SessionMember member) {
        this.manager = manager;
        this.mapper = mapper;
        this.clock = clock;
        this.member = member;
    }

    /**
     * Handles one text message from the member.
     *
     * @param text Raw message text.
     * @throws IOException if a reply cannot be delivered to the member.
     */
    public void onMessage(String text) throws IOException {
        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            sendError("Malformed JSON message");
            return;
        }
        if (message == null || !message.isObject() || !message.path("type").isTextual()) {
            sendError("Message must be a JSON object with a type");
            return;
        }

        String type = message.get("type").asText();
        switch (type) {
            case "init" -> handleInit(message);
            case "state" -> handleState(message);
            case "action" -> handleAction(message);
            case "ping" -> member.send(write(envelope("pong")));
            default -> sendError("Unknown message type: " + type);
        }
    }

    /**
     * Removes the member from its session and tells the remaining members.
     */
    public void onClose() {
        if (sessionId == null) {
            return;
        }
        String leaving = sessionId;
        sessionId = null;
        Optional<SessionView> remaining = manager.leave(leaving, member);
        remaining.ifPresent(view -> broadcastState(view));
    }

    /**
     * @return Id of the joined session, or null before {@code init}.
     */
    public String getSessionId() {
        return sessionId;
    }

    private void handleInit(JsonNode message) throws IOException {
        if (sessionId != null) {
            onClose();
        }
        String requestedId = textOrNull(message.get("sessionId"));
        String sessionType = textOrNull(message.get("sessionType"));
        Map<String, Object> settings = toMap(message.get("settings"));

        SessionView view = manager.join(requestedId, sessionType, settings, member);
        sessionId = view.id();
        log.debug("Member {} joined session {}", member.id(), sessionId);

        ObjectNode joined = envelope("joined");
        joined.set("session", mapper.valueToTree(view));
        member.send(write(joined));
        broadcastState(view);
    }

    private void handleState(JsonNode message) throws IOException {
        if (sessionId == null) {
            sendError("Session not initialized");
            return;
        }
        JsonNode state = message.get("state");
        if (state == null || !state.isObject()) {
            sendError("State update must carry a state object");
            return;
        }
        Optional<SessionView> view = manager.mergeState(sessionId, toMap(state));
        if (view.isPresent()) {
            broadcastState(view.get());
        } else {
            sendError("Session no longer exists");
        }
    }

    private void handleAction(JsonNode message) throws IOException {
        if (sessionId == null) {
            sendError("Session not initialized");
            return;
        }
        ObjectNode event = envelope("event");
        event.set("action", message.path("action").deepCopy());
        event.set("data", message.path("data").deepCopy());
        manager.broadcast(sessionId, write(event), member);
    }

    private void broadcastState(SessionView view) {
        ObjectNode state = envelope("state");
        state.set("session", mapper.valueToTree(view));
        try {
            manager.broadcast(view.id(), write(state), null);
        } catch (IOException e) {
            log.warn("Unable to serialize session state: {}", e.getMessage());
        }
    }

    private void sendError(String text) throws IOException {
        ObjectNode error = envelope("error");
        error.put("message", text);
        member.send(write(error));
    }

    private ObjectNode envelope(String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        node.put("timestamp", clock.millis());
        return node;
    }

    private String write(ObjectNode node) throws JsonProcessingException {
        return mapper.writeValueAsString(node);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
