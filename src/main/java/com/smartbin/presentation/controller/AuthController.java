package com.smartbin.presentation.controller;

import com.smartbin.application.dto.LoginResponse;
import com.smartbin.application.service.AuthService;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Login y logout por token.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * POST /api/login
     *
     * @param request username y senha
     * @return token, perfil y si se requiere MFA
     */
    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody LoginRequest request) {
        if (request.username() == null || request.username().isBlank()
                || request.senha() == null || request.senha().isEmpty()) {
            return ApiResponses.failure(ErrorKind.VALIDATION, "username e senha obrigatorios");
        }

        ServiceResult<LoginResponse> result = authService.authenticate(request.username(), request.senha());
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }

        LoginResponse login = result.getValue();
        Map<String, Object> response = ApiResponses.body(true);
        response.put("token", login.getToken());
        response.put("user", login.getUser());
        response.put("mfaEnabled", login.isMfaEnabled());
        response.put("requiresMfa", login.isRequiresMfa());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/logout
     */
    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_TOKEN) String token) {
        authService.logout(token);
        return ApiResponses.message("Sessao encerrada");
    }

    record LoginRequest(String username, String senha) {
    }
}
