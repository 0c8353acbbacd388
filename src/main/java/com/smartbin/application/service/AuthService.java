package com.smartbin.application.service;

import com.smartbin.application.dto.LoginResponse;
import com.smartbin.domain.model.ServiceResult;

import java.util.Optional;

/**
 * Servicio de autenticación por usuario y contraseña.
 */
public interface AuthService {

    /**
     * Autentica un usuario y emite un token de sesión nuevo.
     *
     * @param username Nombre de usuario
     * @param password Contraseña en texto plano
     * @return token y perfil, o USER_NOT_FOUND, USER_DISABLED, WRONG_PASSWORD
     */
    ServiceResult<LoginResponse> authenticate(String username, String password);

    /**
     * Revoca un token de sesión.
     *
     * @return true si el token existía
     */
    boolean logout(String token);

    /**
     * Resuelve el usuario dueño de un token.
     */
    Optional<String> resolveUsername(String token);
}
