package com.smartbin.presentation.controller;

import com.smartbin.application.dto.MfaSetupDto;
import com.smartbin.application.service.MfaService;
import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.model.ServiceResult;
import com.smartbin.presentation.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoints del segundo factor TOTP.
 */
@RestController
@RequestMapping("/api/mfa")
@RequiredArgsConstructor
@Slf4j
public class MfaController {

    private final MfaService mfaService;

    /**
     * POST /api/mfa/gerar-qrcode
     * Genera un secret pendiente para el usuario autenticado.
     */
    @PostMapping("/gerar-qrcode")
    public ResponseEntity<Map<String, Object>> provision(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username) {
        MfaSetupDto setup = mfaService.provision(username);

        Map<String, Object> response = ApiResponses.body(true);
        response.put("secret", setup.getSecret());
        response.put("provisioningUri", setup.getProvisioningUri());
        response.put("qrCode", setup.getQrCode());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/mfa/ativar
     */
    @PostMapping("/ativar")
    public ResponseEntity<Map<String, Object>> activate(
            @RequestAttribute(SessionAuthInterceptor.CURRENT_USER) String username,
            @RequestBody CodeRequest request) {
        ServiceResult<Void> result = mfaService.activate(username, request.codigo());
        if (!result.isSuccess()) {
            return ApiResponses.failure(result.getError(), result.getMessage());
        }
        return ApiResponses.message("MFA ativado com sucesso");
    }

    /**
     * POST /api/mfa/verificar
     * Paso de login para cuentas con MFA. Público: el código es la credencial.
     */
    @PostMapping("/verificar")
    public ResponseEntity<Map<String, Object>> verify(@RequestBody VerifyRequest request) {
        ServiceResult<Void> result = mfaService.verifyAtLogin(request.username(), request.codigo());

        if (result.isSuccess()) {
            return ApiResponses.message("Codigo MFA valido");
        }
        if (result.getError() == ErrorKind.MFA_NOT_REQUIRED) {
            Map<String, Object> response = ApiResponses.body(true);
            response.put("mfaRequired", false);
            response.put("message", result.getMessage());
            return ResponseEntity.ok(response);
        }
        return ApiResponses.failure(HttpStatus.UNAUTHORIZED, result.getError(), result.getMessage());
    }

    record CodeRequest(String codigo) {
    }

    record VerifyRequest(String username, String codigo) {
    }
}
