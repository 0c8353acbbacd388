package com.smartbin.domain.port;

import com.smartbin.domain.model.UserAccount;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para la persistencia de cuentas de usuario.
 */
public interface UserRepository {

    Optional<UserAccount> findByUsername(String username);

    boolean existsByUsername(String username);

    /**
     * Crea o actualiza una cuenta.
     *
     * @param user Cuenta a guardar
     * @return Cuenta guardada
     */
    UserAccount save(UserAccount user);

    List<UserAccount> findAll();

    /**
     * Elimina una cuenta por su username.
     *
     * @return true si la cuenta existía
     */
    boolean deleteByUsername(String username);
}
