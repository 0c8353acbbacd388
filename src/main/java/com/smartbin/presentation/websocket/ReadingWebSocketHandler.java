package com.smartbin.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartbin.application.dto.ReadingDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Handler de WebSocket que envía las lecturas nuevas en tiempo real al
 * dashboard.
 */
@Component
@Slf4j
public class ReadingWebSocketHandler extends TextWebSocketHandler {

    static final String NEW_READING = "NEW_READING";

    private final CopyOnWriteArraySet<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    /**
     * Envía una lectura nueva a todos los clientes conectados.
     *
     * @param reading DTO de la lectura
     */
    public void broadcastReading(ReadingDto reading) {
        broadcast(NEW_READING, reading);
    }

    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(new WebSocketMessage(type, data));
        } catch (IOException e) {
            log.error("Error creando mensaje JSON: {}", e.getMessage());
            return;
        }

        TextMessage message = new TextMessage(json);
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                try {
                    session.sendMessage(message);
                } catch (IOException e) {
                    log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                    sessions.remove(session);
                }
            }
        }

        log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());
    }

    /**
     * Obtiene el número de clientes conectados.
     */
    public int getConnectedClients() {
        return sessions.size();
    }

    record WebSocketMessage(String type, Object data) {
    }
}
