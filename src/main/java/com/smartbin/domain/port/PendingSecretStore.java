package com.smartbin.domain.port;

import java.util.Optional;

/**
 * Almacén temporal de secrets TOTP generados y aún no activados. Las entradas
 * expiran pasado un tiempo.
 */
public interface PendingSecretStore {

    void put(String username, String secret);

    /**
     * @return el secret pendiente del usuario, si existe y no expiró
     */
    Optional<String> get(String username);

    void remove(String username);
}
