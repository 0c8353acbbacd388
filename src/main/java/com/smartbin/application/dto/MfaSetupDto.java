package com.smartbin.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Datos para configurar una app autenticadora.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MfaSetupDto {

    /** Secret base32 para ingreso manual */
    private String secret;

    private String provisioningUri;

    /** Imagen PNG del QR como data URI */
    private String qrCode;
}
