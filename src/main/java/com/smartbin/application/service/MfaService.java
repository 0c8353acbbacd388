package com.smartbin.application.service;

import com.smartbin.application.dto.MfaSetupDto;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.AuditStatus;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.domain.model.UserAccount;
import com.smartbin.domain.port.PendingSecretStore;
import com.smartbin.domain.port.QrCodeRenderer;
import com.smartbin.domain.port.UserRepository;
import com.smartbin.domain.security.TotpGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Segundo factor TOTP: aprovisionamiento del secret, activación y
 * verificación en el login.
 * <p>
 * La tolerancia es de {@code windowSteps} pasos de 30 s hacia cada lado
 * (±5 minutos por defecto). No hay límite de intentos.
 */
@Service
@Slf4j
public class MfaService {

    static final String NO_SECRET_PENDING = "Gere um QR Code primeiro";
    static final String INVALID_CODE = "Codigo MFA invalido";
    static final String NOT_REQUIRED = "MFA nao esta ativado para este usuario";

    private final UserRepository userRepository;
    private final PendingSecretStore pendingSecretStore;
    private final QrCodeRenderer qrCodeRenderer;
    private final AuditService auditService;
    private final Clock clock;
    private final TotpGenerator totpGenerator;
    private final String issuer;
    private final int windowSteps;

    @Autowired
    public MfaService(UserRepository userRepository,
            PendingSecretStore pendingSecretStore,
            QrCodeRenderer qrCodeRenderer,
            AuditService auditService,
            Clock clock,
            @Value("${mfa.issuer:Lixeira Inteligente}") String issuer,
            @Value("${mfa.window-steps:10}") int windowSteps) {
        this(userRepository, pendingSecretStore, qrCodeRenderer, auditService, clock,
                new TotpGenerator(), issuer, windowSteps);
    }

    MfaService(UserRepository userRepository,
            PendingSecretStore pendingSecretStore,
            QrCodeRenderer qrCodeRenderer,
            AuditService auditService,
            Clock clock,
            TotpGenerator totpGenerator,
            String issuer,
            int windowSteps) {
        this.userRepository = userRepository;
        this.pendingSecretStore = pendingSecretStore;
        this.qrCodeRenderer = qrCodeRenderer;
        this.auditService = auditService;
        this.clock = clock;
        this.totpGenerator = totpGenerator;
        this.issuer = issuer;
        this.windowSteps = windowSteps;
    }

    /**
     * Genera un secret nuevo, lo guarda como pendiente y devuelve los datos
     * para la app autenticadora. Un aprovisionamiento nuevo reemplaza al
     * anterior.
     */
    public MfaSetupDto provision(String username) {
        String secret = totpGenerator.generateSecret();
        pendingSecretStore.put(username, secret);

        String uri = totpGenerator.provisioningUri(secret, username, issuer);
        String qrCode = qrCodeRenderer.renderPngDataUri(uri);

        log.info("Secret MFA pendiente generado para {}", username);
        auditService.record(username, AuditService.MFA_SETUP, "QR Code MFA gerado", AuditStatus.SUCESSO, true);

        return MfaSetupDto.builder()
                .secret(secret)
                .provisioningUri(uri)
                .qrCode(qrCode)
                .build();
    }

    /**
     * Activa MFA si el código corresponde al secret pendiente.
     *
     * @return éxito, NO_SECRET_PENDING o INVALID_CODE
     */
    public ServiceResult<Void> activate(String username, String code) {
        Optional<String> pending = pendingSecretStore.get(username);
        if (pending.isEmpty()) {
            return ServiceResult.failure(ErrorKind.NO_SECRET_PENDING, NO_SECRET_PENDING);
        }

        if (!totpGenerator.matchesWithinWindow(pending.get(), code, clock.instant().getEpochSecond(), windowSteps)) {
            log.warn("Código MFA inválido en la activación de {}", username);
            auditService.failure(username, AuditService.MFA_ACTIVATION, INVALID_CODE);
            return ServiceResult.failure(ErrorKind.INVALID_CODE, INVALID_CODE);
        }

        Optional<UserAccount> user = userRepository.findByUsername(username);
        if (user.isEmpty()) {
            return ServiceResult.failure(ErrorKind.USER_NOT_FOUND, "Usuário não encontrado");
        }

        UserAccount account = user.get();
        account.setMfaEnabled(true);
        account.setMfaSecret(pending.get());
        userRepository.save(account);
        pendingSecretStore.remove(username);

        log.info("MFA activado para {}", username);
        auditService.record(username, AuditService.MFA_ACTIVATED, "MFA ativado", AuditStatus.SUCESSO, true);
        return ServiceResult.success(null);
    }

    /**
     * Verifica el código en el login contra el secret persistido.
     *
     * @return éxito, MFA_NOT_REQUIRED si la cuenta no usa MFA, o INVALID_CODE
     */
    public ServiceResult<Void> verifyAtLogin(String username, String code) {
        Optional<UserAccount> user = username == null ? Optional.empty() : userRepository.findByUsername(username);
        if (user.isEmpty() || !user.get().isMfaEnabled() || user.get().getMfaSecret() == null) {
            return ServiceResult.failure(ErrorKind.MFA_NOT_REQUIRED, NOT_REQUIRED);
        }

        boolean valid = totpGenerator.matchesWithinWindow(
                user.get().getMfaSecret(), code, clock.instant().getEpochSecond(), windowSteps);
        if (!valid) {
            log.warn("Código MFA inválido en el login de {}", username);
            auditService.failure(username, AuditService.MFA_VERIFICATION, INVALID_CODE);
            return ServiceResult.failure(ErrorKind.INVALID_CODE, INVALID_CODE);
        }

        auditService.success(username, AuditService.MFA_VERIFICATION, "Codigo MFA verificado");
        return ServiceResult.success(null);
    }
}
