package com.smartbin.domain.port;

import java.util.Optional;

/**
 * Almacén de tokens de sesión (token opaco → username).
 */
public interface SessionStore {

    /**
     * @return el username asociado al token, si la sesión existe
     */
    Optional<String> get(String token);

    void put(String token, String username);

    /**
     * @return true si el token existía
     */
    boolean delete(String token);
}
