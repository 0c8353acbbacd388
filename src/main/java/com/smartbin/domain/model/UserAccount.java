package com.smartbin.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa una cuenta de usuario del panel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    private Long id;

    /** Nombre de usuario único */
    private String username;

    /** Hash PBKDF2 de la contraseña (hex) */
    private String passwordHash;

    /** Salt usado para el hash (hex) */
    private String passwordSalt;

    /** Nombre completo */
    private String name;

    private Role role;

    private String email;

    private LocalDateTime createdAt;

    /** Último login exitoso, null si nunca inició sesión */
    private LocalDateTime lastLogin;

    private boolean active;

    /** Indica si el usuario activó el segundo factor TOTP */
    private boolean mfaEnabled;

    /** Secret TOTP en base32, solo presente con MFA activado */
    private String mfaSecret;
}
