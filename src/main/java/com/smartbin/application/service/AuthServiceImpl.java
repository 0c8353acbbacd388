package com.smartbin.application.service;

import com.smartbin.application.dto.LoginResponse;
import com.smartbin.application.dto.UserDto;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.SessionStore;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.domain.security.PasswordHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Optional;

/**
 * Implementación de la autenticación. Los tokens son 32 bytes aleatorios en
 * base64url y viven mientras viva el proceso.
 */
@Service
@Slf4j
public class AuthServiceImpl implements AuthService {

    static final String USER_NOT_FOUND = "Usuário não encontrado";
    static final String USER_DISABLED = "Usuário desativado";
    static final String WRONG_PASSWORD = "Senha incorreta";

    private static final int TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final SessionStore sessionStore;
    private final AuditService auditService;
    private final Clock clock;
    private final PasswordHasher passwordHasher = new PasswordHasher();
    private final SecureRandom secureRandom = new SecureRandom();

    public AuthServiceImpl(UserRepository userRepository, SessionStore sessionStore,
            AuditService auditService, Clock clock) {
        this.userRepository = userRepository;
        this.sessionStore = sessionStore;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Override
    public ServiceResult<LoginResponse> authenticate(String username, String password) {
        Optional<UserAccount> found = username == null ? Optional.empty() : userRepository.findByUsername(username);
        if (found.isEmpty()) {
            log.warn("Login rechazado, usuario inexistente: {}", username);
            auditService.failure(username, AuditService.LOGIN, USER_NOT_FOUND);
            return ServiceResult.failure(ErrorKind.USER_NOT_FOUND, USER_NOT_FOUND);
        }

        UserAccount user = found.get();
        if (!user.isActive()) {
            log.warn("Login rechazado, usuario desactivado: {}", username);
            auditService.failure(username, AuditService.LOGIN, USER_DISABLED);
            return ServiceResult.failure(ErrorKind.USER_DISABLED, USER_DISABLED);
        }

        if (password == null || !passwordHasher.verify(password, user.getPasswordSalt(), user.getPasswordHash())) {
            log.warn("Login rechazado, contraseña incorrecta: {}", username);
            auditService.failure(username, AuditService.LOGIN, WRONG_PASSWORD);
            return ServiceResult.failure(ErrorKind.WRONG_PASSWORD, WRONG_PASSWORD);
        }

        user.setLastLogin(LocalDateTime.now(clock));
        UserAccount saved = userRepository.save(user);

        String token = newToken();
        sessionStore.put(token, saved.getUsername());

        log.info("Login exitoso: {} (MFA: {})", saved.getUsername(), saved.isMfaEnabled());
        auditService.success(saved.getUsername(), AuditService.LOGIN, "Login realizado com sucesso");

        return ServiceResult.success(LoginResponse.builder()
                .token(token)
                .user(UserDto.fromDomain(saved))
                .mfaEnabled(saved.isMfaEnabled())
                .requiresMfa(saved.isMfaEnabled())
                .build());
    }

    @Override
    public boolean logout(String token) {
        if (token == null) {
            return false;
        }
        Optional<String> username = sessionStore.get(token);
        boolean removed = sessionStore.delete(token);
        if (removed) {
            log.info("Sesión cerrada: {}", username.orElse("?"));
            auditService.success(username.orElse(null), AuditService.LOGOUT, "Logout realizado");
        }
        return removed;
    }

    @Override
    public Optional<String> resolveUsername(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return sessionStore.get(token);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
