package com.smartbin.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.smartbin.domain.port.PendingSecretStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Secrets TOTP pendientes de activación, guardados en un cache Caffeine con
 * expiración después de la escritura. Un flujo de aprovisionamiento abandonado
 * se descarta al vencer el plazo.
 */
@Component
@Slf4j
public class CaffeinePendingSecretStore implements PendingSecretStore {

    private static final long MAX_PENDING_SECRETS = 10_000;

    private final Cache<String, String> secrets;

    @Autowired
    public CaffeinePendingSecretStore(@Value("${mfa.pending-secret-ttl-minutes:10}") long ttlMinutes) {
        this(Duration.ofMinutes(ttlMinutes), Ticker.systemTicker());
    }

    public CaffeinePendingSecretStore(Duration ttl, Ticker ticker) {
        this.secrets = Caffeine.newBuilder()
                .maximumSize(MAX_PENDING_SECRETS)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
        log.info("Almacén de secrets MFA pendientes listo (ttl={})", ttl);
    }

    @Override
    public void put(String username, String secret) {
        secrets.put(username, secret);
    }

    @Override
    public Optional<String> get(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(secrets.getIfPresent(username));
    }

    @Override
    public void remove(String username) {
        secrets.invalidate(username);
    }
}
