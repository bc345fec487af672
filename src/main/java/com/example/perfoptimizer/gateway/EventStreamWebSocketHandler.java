package com.example.perfoptimizer.gateway;

import com.example.perfoptimizer.event.OrchestratorEvent;
import com.example.perfoptimizer.event.OrchestratorEventListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes every orchestrator event to connected /ws/events clients. Inbound messages are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStreamWebSocketHandler extends TextWebSocketHandler implements OrchestratorEventListener {

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("Event stream session connected: {} (total: {})", session.getId(), sessions.size());
        send(session, Map.of("type", "connected", "sessionId", session.getId(), "timestamp", Instant.now().toString()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Event stream session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    @Override
    public void onEvent(OrchestratorEvent event) {
        sessions.values().forEach(session -> {
            if (session.isOpen()) {
                send(session, event);
            }
        });
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send event to session {}: {}", session.getId(), e.getMessage());
        }
    }
}
