package com.smartbin.application.dto;

import com.smartbin.domain.model.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO de cuenta de usuario. Nunca expone hash, salt ni secret MFA.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDto {

    private String username;
    private String name;
    private String role;
    private String email;
    private String createdAt;
    private String lastLogin;
    private boolean active;
    private boolean mfaEnabled;

    /**
     * Convierte un modelo de dominio a DTO.
     */
    public static UserDto fromDomain(UserAccount user) {
        return UserDto.builder()
                .username(user.getUsername())
                .name(user.getName())
                .role(user.getRole() != null ? user.getRole().getCode() : null)
                .email(user.getEmail())
                .createdAt(user.getCreatedAt() != null
                        ? user.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        : null)
                .lastLogin(user.getLastLogin() != null
                        ? user.getLastLogin().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        : null)
                .active(user.isActive())
                .mfaEnabled(user.isMfaEnabled())
                .build();
    }
}
