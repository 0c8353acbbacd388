package com.smartbin.infrastructure.persistence;

import com.smartbin.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con usuarios.
 */
@Repository
public interface JpaUserRepository extends JpaRepository<UserEntity, Long> {

    /**
     * Busca un usuario por su username.
     *
     * @param username Nombre de usuario
     * @return Optional con el usuario si existe
     */
    Optional<UserEntity> findByUsername(String username);

    boolean existsByUsername(String username);

    List<UserEntity> findAllByOrderByUsernameAsc();

    long deleteByUsername(String username);
}
