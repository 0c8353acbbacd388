package com.smartbin.domain.security;

import com.smartbin.domain.model.Permission;
import com.smartbin.domain.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tabla estática papel → permisos.
 */
public final class RolePermissions {

    private static final Map<Role, Set<Permission>> PERMISSIONS = new EnumMap<>(Role.class);

    static {
        for (Role role : Role.values()) {
            PERMISSIONS.put(role, Collections.unmodifiableSet(permissionsFor(role)));
        }
    }

    private RolePermissions() {
    }

    // Sin default: cada papel nuevo debe declararse aquí
    private static EnumSet<Permission> permissionsFor(Role role) {
        return switch (role) {
            case ADMIN -> EnumSet.allOf(Permission.class);
            case GESTOR -> EnumSet.of(Permission.READ, Permission.UPDATE, Permission.EXPORT, Permission.ANALYZE);
            case USUARIO -> EnumSet.of(Permission.READ);
        };
    }

    /**
     * Verifica si el papel incluye el permiso.
     */
    public static boolean hasPermission(Role role, Permission permission) {
        if (role == null || permission == null) {
            return false;
        }
        return PERMISSIONS.get(role).contains(permission);
    }

    public static Set<Permission> permissionsOf(Role role) {
        return PERMISSIONS.get(role);
    }
}
