package com.smartbin.application.service;

import com.smartbin.application.dto.UserDto;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.Role;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.domain.security.PasswordHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link UserAdminService}.
 */
@ExtendWith(MockitoExtension.class)
class UserAdminServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private AuditService auditService;

    private UserAdminService service;

    @BeforeEach
    void setUp() {
        service = new UserAdminService(userRepository, auditService,
                Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should create an account with a hashed password and no MFA")
    void shouldCreateUser() {
        when(userRepository.existsByUsername("gi")).thenReturn(false);
        when(userRepository.save(any(UserAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        ServiceResult<UserDto> result = service.createUser("admin", "gi", "segredo", "Giovana", "gestor", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getRole()).isEqualTo("gestor");
        assertThat(result.getValue().isMfaEnabled()).isFalse();

        ArgumentCaptor<UserAccount> saved = ArgumentCaptor.forClass(UserAccount.class);
        verify(userRepository).save(saved.capture());
        UserAccount account = saved.getValue();
        assertThat(account.getPasswordHash()).isNotEqualTo("segredo");
        assertThat(new PasswordHasher().verify("segredo", account.getPasswordSalt(), account.getPasswordHash()))
                .isTrue();
    }

    @Test
    @DisplayName("Should reject a duplicate username as a conflict")
    void shouldRejectDuplicate() {
        when(userRepository.existsByUsername("admin")).thenReturn(true);

        ServiceResult<UserDto> result = service.createUser("admin", "admin", "x", "Outro", "usuario", null);

        assertThat(result.getError()).isEqualTo(ErrorKind.CONFLICT);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject unknown roles and missing fields")
    void shouldValidateInput() {
        assertThat(service.createUser("admin", "x", "y", "Z", "superuser", null).getError())
                .isEqualTo(ErrorKind.VALIDATION);
        assertThat(service.createUser("admin", "x", "", "Z", "usuario", null).getError())
                .isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    @DisplayName("Should not let an administrator delete their own account")
    void shouldRefuseSelfDelete() {
        assertThat(service.deleteUser("admin", "admin").getError()).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    @DisplayName("Should report deleting a missing account as not found")
    void shouldReportMissingOnDelete() {
        when(userRepository.deleteByUsername("ghost")).thenReturn(false);

        assertThat(service.deleteUser("admin", "ghost").getError()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should replace hash and salt when changing the password")
    void shouldChangePassword() {
        UserAccount account = UserAccount.builder()
                .username("gi").role(Role.GESTOR).active(true)
                .passwordHash("old-hash").passwordSalt("old-salt")
                .build();
        when(userRepository.findByUsername("gi")).thenReturn(Optional.of(account));

        ServiceResult<Void> result = service.changePassword("gi", "gi", "nova-senha");

        assertThat(result.isSuccess()).isTrue();
        assertThat(account.getPasswordSalt()).isNotEqualTo("old-salt");
        assertThat(new PasswordHasher().verify("nova-senha", account.getPasswordSalt(), account.getPasswordHash()))
                .isTrue();
        verify(userRepository).save(account);
    }
}
