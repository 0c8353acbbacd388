package com.smartbin.infrastructure.persistence;

import com.smartbin.domain.model.Role;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.infrastructure.persistence.entity.UserEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del puerto UserRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserRepositoryImpl implements UserRepository {

    private final JpaUserRepository jpaRepository;

    @Override
    public Optional<UserAccount> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return jpaRepository.findByUsername(username).map(this::toDomain);
    }

    @Override
    public boolean existsByUsername(String username) {
        return username != null && jpaRepository.existsByUsername(username);
    }

    @Override
    @Transactional
    public UserAccount save(UserAccount user) {
        UserEntity entity = jpaRepository.findByUsername(user.getUsername())
                .orElseGet(UserEntity::new);
        copyToEntity(user, entity);
        return toDomain(jpaRepository.save(entity));
    }

    @Override
    public List<UserAccount> findAll() {
        return jpaRepository.findAllByOrderByUsernameAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean deleteByUsername(String username) {
        long deleted = jpaRepository.deleteByUsername(username);
        log.info("Usuarios eliminados con username {}: {}", username, deleted);
        return deleted > 0;
    }

    private void copyToEntity(UserAccount user, UserEntity entity) {
        entity.setUsername(user.getUsername());
        entity.setPasswordHash(user.getPasswordHash());
        entity.setPasswordSalt(user.getPasswordSalt());
        entity.setName(user.getName());
        entity.setRole(user.getRole() != null ? user.getRole().getCode() : Role.USUARIO.getCode());
        entity.setEmail(user.getEmail());
        entity.setCreatedAt(user.getCreatedAt());
        entity.setLastLogin(user.getLastLogin());
        entity.setActive(user.isActive());
        entity.setMfaEnabled(user.isMfaEnabled());
        entity.setMfaSecret(user.getMfaSecret());
    }

    /**
     * Convierte una entidad JPA a una cuenta de dominio.
     */
    private UserAccount toDomain(UserEntity entity) {
        return UserAccount.builder()
                .id(entity.getId())
                .username(entity.getUsername())
                .passwordHash(entity.getPasswordHash())
                .passwordSalt(entity.getPasswordSalt())
                .name(entity.getName())
                // Un papel desconocido en la base se degrada a solo lectura
                .role(Role.fromCode(entity.getRole()).orElse(Role.USUARIO))
                .email(entity.getEmail())
                .createdAt(entity.getCreatedAt())
                .lastLogin(entity.getLastLogin())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .mfaEnabled(Boolean.TRUE.equals(entity.getMfaEnabled()))
                .mfaSecret(entity.getMfaSecret())
                .build();
    }
}
