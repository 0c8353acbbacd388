package com.smartbin.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de un login exitoso.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    /** Token opaco de sesión */
    private String token;

    private UserDto user;

    private boolean mfaEnabled;

    /** El cliente debe pedir el código TOTP antes de continuar */
    private boolean requiresMfa;
}
