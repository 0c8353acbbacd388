package com.smartbin.application.service;

import com.smartbin.application.dto.UserDto;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.AuditStatus;
import com.smartbin.domain.model.Role;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.domain.security.PasswordHasher;
import com.smartbin.domain.security.PasswordHasher.HashedPassword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Administración de cuentas: alta, listado, baja y cambio de contraseña. La
 * verificación del papel del actor se hace antes, en
 * {@link AuthorizationService}.
 */
@Service
@Slf4j
public class UserAdminService {

    private static final String USER_NOT_FOUND = "Usuário não encontrado";

    private final UserRepository userRepository;
    private final AuditService auditService;
    private final Clock clock;
    private final PasswordHasher passwordHasher = new PasswordHasher();

    public UserAdminService(UserRepository userRepository, AuditService auditService, Clock clock) {
        this.userRepository = userRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Crea una cuenta nueva.
     *
     * @param actor    Usuario que crea la cuenta
     * @param username Nombre de usuario
     * @param password Contraseña inicial
     * @param name     Nombre completo
     * @param roleCode Papel (admin, gestor, usuario); por defecto usuario
     * @param email    Email opcional
     * @return la cuenta creada, VALIDATION o CONFLICT
     */
    public ServiceResult<UserDto> createUser(String actor, String username, String password, String name,
            String roleCode, String email) {
        if (isBlank(username) || isBlank(password) || isBlank(name)) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "Campos obrigatorios: username, senha, nome");
        }

        Optional<Role> role = isBlank(roleCode) ? Optional.of(Role.USUARIO) : Role.fromCode(roleCode);
        if (role.isEmpty()) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "Perfil invalido: " + roleCode);
        }

        if (userRepository.existsByUsername(username)) {
            auditService.failure(actor, AuditService.CREATE_USER, "Usuario ja existe: " + username);
            return ServiceResult.failure(ErrorKind.CONFLICT, "Usuário já existe");
        }

        HashedPassword hashed = passwordHasher.hash(password);
        UserAccount saved = userRepository.save(UserAccount.builder()
                .username(username)
                .passwordHash(hashed.hash())
                .passwordSalt(hashed.salt())
                .name(name)
                .role(role.get())
                .email(email != null ? email : "")
                .createdAt(LocalDateTime.now(clock))
                .active(true)
                .mfaEnabled(false)
                .build());

        log.info("Usuario creado: {} ({}) por {}", username, role.get().getCode(), actor);
        auditService.success(actor, AuditService.CREATE_USER,
                "Usuario " + username + " criado com perfil " + role.get().getCode());
        return ServiceResult.success(UserDto.fromDomain(saved));
    }

    /**
     * Lista todas las cuentas, sin hash ni salt.
     */
    public List<UserDto> listUsers() {
        return userRepository.findAll().stream()
                .map(UserDto::fromDomain)
                .collect(Collectors.toList());
    }

    /**
     * Elimina una cuenta. Un usuario no puede eliminarse a sí mismo.
     */
    public ServiceResult<Void> deleteUser(String actor, String username) {
        if (username != null && username.equals(actor)) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "Nao e possivel remover o proprio usuario");
        }
        if (!userRepository.deleteByUsername(username)) {
            return ServiceResult.failure(ErrorKind.NOT_FOUND, USER_NOT_FOUND);
        }
        log.info("Usuario eliminado: {} por {}", username, actor);
        auditService.success(actor, AuditService.DELETE_USER, "Usuario " + username + " removido");
        return ServiceResult.success(null);
    }

    /**
     * Reemplaza la contraseña de una cuenta con un salt nuevo.
     */
    public ServiceResult<Void> changePassword(String actor, String username, String newPassword) {
        if (isBlank(newPassword)) {
            return ServiceResult.failure(ErrorKind.VALIDATION, "Senha obrigatoria");
        }
        Optional<UserAccount> found = userRepository.findByUsername(username);
        if (found.isEmpty()) {
            return ServiceResult.failure(ErrorKind.NOT_FOUND, USER_NOT_FOUND);
        }

        UserAccount user = found.get();
        HashedPassword hashed = passwordHasher.hash(newPassword);
        user.setPasswordHash(hashed.hash());
        user.setPasswordSalt(hashed.salt());
        userRepository.save(user);

        log.info("Contraseña actualizada para {} por {}", username, actor);
        auditService.record(actor, AuditService.CHANGE_PASSWORD, "Senha alterada para " + username,
                AuditStatus.SUCESSO, true);
        return ServiceResult.success(null);
    }

    /**
     * Crea la cuenta administradora inicial si no existe.
     *
     * @return true si se creó
     */
    public boolean ensureAdmin(String username, String password, String name, String email) {
        if (userRepository.existsByUsername(username)) {
            return false;
        }
        createUser("sistema", username, password, name, Role.ADMIN.getCode(), email);
        log.warn("Cuenta administradora inicial '{}' creada. Cambie la contraseña por defecto.", username);
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
