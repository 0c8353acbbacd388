package com.smartbin.application.service;

import com.smartbin.domain.exception.ServiceException;
import com.smartbin.domain.model.Permission;
import com.smartbin.domain.model.Role;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.domain.security.RolePermissions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Verifica permisos y papeles de la cuenta autenticada. Los rechazos se
 * auditan y se lanzan como {@link ServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationService {

    private final UserRepository userRepository;
    private final AuditService auditService;

    /**
     * Exige que el usuario tenga el permiso dado.
     *
     * @return la cuenta del usuario
     * @throws ServiceException UNAUTHORIZED si la cuenta no existe o está
     *                          desactivada, FORBIDDEN si falta el permiso
     */
    public UserAccount requirePermission(String username, Permission permission) {
        UserAccount user = requireActiveUser(username);
        if (!RolePermissions.hasPermission(user.getRole(), permission)) {
            deny(username, "Permissao " + permission.name().toLowerCase() + " requerida");
        }
        return user;
    }

    /**
     * Exige que el usuario tenga alguno de los papeles dados.
     */
    public UserAccount requireAnyRole(String username, Role... roles) {
        UserAccount user = requireActiveUser(username);
        Set<Role> allowed = roles.length == 0 ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(Arrays.asList(roles));
        if (!allowed.contains(user.getRole())) {
            deny(username, "Acesso restrito a " + allowed.stream().map(Role::getCode).collect(Collectors.toList()));
        }
        return user;
    }

    public boolean hasPermission(Role role, Permission permission) {
        return RolePermissions.hasPermission(role, permission);
    }

    private UserAccount requireActiveUser(String username) {
        if (username == null) {
            throw ServiceException.unauthorized();
        }
        UserAccount user = userRepository.findByUsername(username)
                .orElseThrow(ServiceException::unauthorized);
        if (!user.isActive()) {
            throw ServiceException.unauthorized();
        }
        return user;
    }

    private void deny(String username, String message) {
        log.warn("Acceso denegado a {}: {}", username, message);
        auditService.failure(username, AuditService.ACCESS_DENIED, message);
        throw ServiceException.forbidden(message);
    }
}
