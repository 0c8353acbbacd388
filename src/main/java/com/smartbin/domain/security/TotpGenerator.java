package com.smartbin.domain.security;

import org.apache.commons.codec.binary.Base32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Locale;

/**
 * Generación y verificación de códigos TOTP (RFC 6238): HMAC-SHA1, 6 dígitos,
 * paso de 30 segundos.
 */
public class TotpGenerator {

    public static final int TIME_STEP_SECONDS = 30;
    public static final int CODE_DIGITS = 6;

    /** 160 bits, igual que los secrets de las apps autenticadoras */
    static final int SECRET_BYTES = 20;

    private static final String ALGORITHM = "HmacSHA1";
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000};

    private final SecureRandom secureRandom;
    private final Base32 base32 = new Base32();

    public TotpGenerator() {
        this(new SecureRandom());
    }

    public TotpGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Genera un secret aleatorio codificado en base32, sin padding.
     */
    public String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return base32.encodeToString(bytes).replace("=", "");
    }

    /**
     * Calcula el código válido en el instante dado.
     *
     * @param secret       Secret base32
     * @param epochSeconds Instante en segundos Unix
     * @return Código de 6 dígitos con ceros a la izquierda
     */
    public String codeAt(String secret, long epochSeconds) {
        byte[] key = base32.decode(secret.trim().toUpperCase(Locale.ROOT));
        long counter = Math.floorDiv(epochSeconds, TIME_STEP_SECONDS);

        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());

            // Truncamiento dinámico (RFC 4226, sección 5.3)
            int offset = hash[hash.length - 1] & 0x0F;
            int binary = ((hash[offset] & 0x7F) << 24)
                    | ((hash[offset + 1] & 0xFF) << 16)
                    | ((hash[offset + 2] & 0xFF) << 8)
                    | (hash[offset + 3] & 0xFF);

            int otp = binary % POWERS_OF_TEN[CODE_DIGITS];
            return String.format("%0" + CODE_DIGITS + "d", otp);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 no disponible", e);
        }
    }

    /**
     * Busca el código en los pasos {@code -windowSteps..+windowSteps} alrededor
     * del instante dado.
     *
     * @return true en la primera coincidencia
     */
    public boolean matchesWithinWindow(String secret, String code, long epochSeconds, int windowSteps) {
        if (code == null || code.isBlank()) {
            return false;
        }
        byte[] provided = code.trim().getBytes(StandardCharsets.US_ASCII);
        for (int i = -windowSteps; i <= windowSteps; i++) {
            String expected = codeAt(secret, epochSeconds + (long) i * TIME_STEP_SECONDS);
            if (MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII), provided)) {
                return true;
            }
        }
        return false;
    }

    /**
     * URI de aprovisionamiento para apps autenticadoras.
     * Formato: {@code otpauth://totp/{issuer}:{account}?secret={secret}&issuer={issuer}}
     */
    public String provisioningUri(String secret, String account, String issuer) {
        String encodedIssuer = encode(issuer);
        return String.format("otpauth://totp/%s:%s?secret=%s&issuer=%s",
                encodedIssuer, encode(account), secret, encodedIssuer);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
