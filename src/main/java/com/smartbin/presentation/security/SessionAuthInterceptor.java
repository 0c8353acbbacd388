package com.smartbin.presentation.security;

import com.smartbin.domain.exception.ServiceException;
import com.smartbin.domain.port.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Exige un token de sesión válido en {@code Authorization: Bearer <token>} y
 * deja el usuario y el token como atributos de la petición.
 */
@Slf4j
public class SessionAuthInterceptor implements HandlerInterceptor {

    public static final String CURRENT_USER = "smartbin.currentUser";
    public static final String CURRENT_TOKEN = "smartbin.currentToken";

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionStore sessionStore;

    public SessionAuthInterceptor(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            log.debug("Petición sin token a {}", request.getRequestURI());
            throw ServiceException.unauthorized();
        }

        String username = sessionStore.get(token).orElseThrow(() -> {
            log.debug("Token desconocido en {}", request.getRequestURI());
            return ServiceException.unauthorized();
        });

        request.setAttribute(CURRENT_USER, username);
        request.setAttribute(CURRENT_TOKEN, token);
        return true;
    }

    static String extractToken(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
