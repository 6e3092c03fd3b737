package com.scicalc.mathfrontend.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scicalc.mathfrontend.parser.SyntaxError;
import com.scicalc.mathfrontend.parser.SyntaxValidator;

/**
 * Validates expressions as the user types. Each {@code validate} message is answered with
 * the full list of diagnostics for that expression, an empty list meaning it is well formed.
 */
@Component
public class LiveValidationHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveValidationHandler.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("Validation socket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendMessage(session, "error", Map.of("data", "Malformed message: expected a JSON object"));
            return;
        }
        String type = node.path("type").asText("");

        switch (type) {
            case "validate":
                String expression = node.path("expression").asText("");
                List<SyntaxError> errors = SyntaxValidator.validate(expression);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("expression", expression);
                payload.put("errors", errors);
                sendMessage(session, "diagnostics", payload);
                break;

            case "ping":
                sendMessage(session, "pong", Map.of("data", "Server alive"));
                break;

            default:
                log.warn("Unknown message type received: {}", type);
                sendMessage(session, "error", Map.of("data", "Unknown message type: " + type));
                break;
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Validation socket closed: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.error("Transport error on validation socket {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    private void sendMessage(WebSocketSession session, String type, Map<String, Object> fields) throws IOException {
        if (session == null || !session.isOpen()) {
            return;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.putAll(fields);
        message.put("timestamp", System.currentTimeMillis());

        String json = objectMapper.writeValueAsString(message);
        synchronized (session) {
            session.sendMessage(new TextMessage(json));
        }
    }
}
