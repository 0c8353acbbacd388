package com.smartbin.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla usuarios.
 */
@Entity
@Table(name = "usuarios")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", unique = true, nullable = false, length = 100)
    private String username;

    @Column(name = "hash_senha", nullable = false, length = 128)
    private String passwordHash;

    @Column(name = "salt", nullable = false, length = 64)
    private String passwordSalt;

    @Column(name = "nome", length = 150)
    private String name;

    @Column(name = "perfil", nullable = false, length = 20)
    private String role;

    @Column(name = "email", length = 150)
    private String email;

    @Column(name = "criado_em")
    private LocalDateTime createdAt;

    @Column(name = "ultimo_login")
    private LocalDateTime lastLogin;

    @Column(name = "ativo", nullable = false)
    private Boolean active;

    @Column(name = "mfa_ativado", nullable = false)
    private Boolean mfaEnabled;

    @Column(name = "mfa_secret", length = 64)
    private String mfaSecret;
}
