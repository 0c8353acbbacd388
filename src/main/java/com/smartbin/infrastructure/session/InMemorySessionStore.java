package com.smartbin.infrastructure.session;

import com.smartbin.domain.port.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementación en memoria del almacén de sesiones. Los tokens viven mientras
 * viva el proceso: un reinicio invalida todas las sesiones.
 */
@Component
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(token));
    }

    @Override
    public void put(String token, String username) {
        sessions.put(token, username);
        log.debug("Sesión registrada para {} (activas: {})", username, sessions.size());
    }

    @Override
    public boolean delete(String token) {
        if (token == null) {
            return false;
        }
        return sessions.remove(token) != null;
    }

    /**
     * Cantidad de sesiones activas.
     */
    public int size() {
        return sessions.size();
    }
}
