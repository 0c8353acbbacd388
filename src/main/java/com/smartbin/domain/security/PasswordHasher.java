package com.smartbin.domain.security;

import org.apache.commons.codec.binary.Hex;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Hash de contraseñas con PBKDF2-HMAC-SHA256 (100 000 iteraciones).
 *
 * <p>
 * El salt son 16 bytes aleatorios guardados en hex; los bytes de entrada a
 * PBKDF2 son el texto hex en UTF-8, el mismo formato de las cuentas ya
 * existentes en la base.
 * </p>
 */
public class PasswordHasher {

    static final int ITERATIONS = 100_000;
    static final int SALT_BYTES = 16;
    private static final int KEY_LENGTH_BITS = 256;
    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Genera un salt nuevo y calcula el hash.
     */
    public HashedPassword hash(String password) {
        byte[] saltBytes = new byte[SALT_BYTES];
        secureRandom.nextBytes(saltBytes);
        String salt = Hex.encodeHexString(saltBytes);
        return new HashedPassword(hash(password, salt), salt);
    }

    /**
     * Calcula el hash con un salt existente.
     *
     * @param password Contraseña en texto plano
     * @param salt     Salt en hex
     * @return Hash en hex
     */
    public String hash(String password, String salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8), ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] derived = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return Hex.encodeHexString(derived);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " no disponible", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Recalcula el hash con el salt guardado y lo compara en tiempo constante.
     */
    public boolean verify(String password, String salt, String expectedHash) {
        if (password == null || salt == null || expectedHash == null) {
            return false;
        }
        String actual = hash(password, salt);
        return MessageDigest.isEqual(
                actual.getBytes(StandardCharsets.US_ASCII),
                expectedHash.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Hash y salt en hex.
     */
    public record HashedPassword(String hash, String salt) {
    }
}
