package com.smartbin.presentation.controller;

import com.smartbin.application.dto.UserDto;
import com.smartbin.application.service.AuthorizationService;
import com.smartbin.application.service.UserAdminService;
import com.smartbin.domain.model.Role;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Administración de cuentas de usuario.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserAdminService userAdminService;
    private final AuthorizationService authorizationService;

    /**
     * POST /api/criar-usuario (solo admin)
     */
    @PostMapping("/criar-usuario")
    public ResponseEntity<Map<String, Object>> createUser(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String actor,
            @RequestBody CreateUserRequest request) {
        authorizationService.requireAnyRole(actor, Role.ADMIN);

        ServiceResult<UserDto> result = userAdminService.createUser(actor, request.username(), request.senha(),
                request.nome(), request.role(), request.email());
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }

        Map<String, Object> response = ApiResponses.body(true);
        response.put("message", "Usuario criado com sucesso");
        response.put("user", result.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /api/usuarios (admin o gestor)
     */
    @GetMapping("/usuarios")
    public ResponseEntity<Map<String, Object>> listUsers(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String actor) {
        authorizationService.requireAnyRole(actor, Role.ADMIN, Role.GESTOR);

        List<UserDto> users = userAdminService.listUsers();
        Map<String, Object> response = ApiResponses.body(true);
        response.put("total", users.size());
        response.put("users", users);
        return ResponseEntity.ok(response);
    }

    /**
     * DELETE /api/usuarios/{username} (solo admin)
     */
    @DeleteMapping("/usuarios/{username}")
    public ResponseEntity<Map<String, Object>> deleteUser(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String actor,
            @PathVariable String username) {
        authorizationService.requireAnyRole(actor, Role.ADMIN);

        ServiceResult<Void> result = userAdminService.deleteUser(actor, username);
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }
        return ApiResponses.message("Usuario removido");
    }

    /**
     * PUT /api/usuarios/{username}/senha (admin o el propio usuario)
     */
    @PutMapping("/usuarios/{username}/senha")
    public ResponseEntity<Map<String, Object>> changePassword(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String actor,
            @PathVariable String username,
            @RequestBody ChangePasswordRequest request) {
        if (!actor.equals(username)) {
            UserAccount admin = authorizationService.requireAnyRole(actor, Role.ADMIN);
            log.info("Administrador {} cambia la contraseña de {}", admin.getUsername(), username);
        }

        ServiceResult<Void> result = userAdminService.changePassword(actor, username, request.senha());
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }
        return ApiResponses.message("Senha alterada");
    }

    record CreateUserRequest(String username, String senha, String nome, String role, String email) {
    }

    record ChangePasswordRequest(String senha) {
    }
}
