package com.smartbin.domain.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TotpGenerator}.
 */
class TotpGeneratorTest {

    /** "12345678901234567890" en base32 (RFC 6238, apéndice B) */
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private final TotpGenerator generator = new TotpGenerator();

    @Test
    @DisplayName("Should match the RFC 6238 SHA-1 reference values truncated to six digits")
    void shouldMatchRfcVectors() {
        assertThat(generator.codeAt(RFC_SECRET, 59)).isEqualTo("287082");
        assertThat(generator.codeAt(RFC_SECRET, 1111111109)).isEqualTo("081804");
        assertThat(generator.codeAt(RFC_SECRET, 1111111111)).isEqualTo("050471");
        assertThat(generator.codeAt(RFC_SECRET, 1234567890)).isEqualTo("005924");
        assertThat(generator.codeAt(RFC_SECRET, 2000000000)).isEqualTo("279037");
    }

    @Test
    @DisplayName("Should accept lowercase secrets")
    void shouldIgnoreSecretCase() {
        assertThat(generator.codeAt(RFC_SECRET.toLowerCase(), 59)).isEqualTo("287082");
    }

    @Test
    @DisplayName("Should accept codes up to ten steps away and reject beyond")
    void shouldHonourWindow() {
        long now = 1_700_000_000L;

        assertThat(generator.matchesWithinWindow(RFC_SECRET, "615856", now, 10)).isTrue();  // +300 s
        assertThat(generator.matchesWithinWindow(RFC_SECRET, "930689", now, 10)).isTrue();  // -300 s
        assertThat(generator.matchesWithinWindow(RFC_SECRET, "250418", now, 10)).isFalse(); // +330 s
        assertThat(generator.matchesWithinWindow(RFC_SECRET, "616499", now, 10)).isFalse(); // -360 s
    }

    @Test
    @DisplayName("Should reject blank codes")
    void shouldRejectBlankCode() {
        assertThat(generator.matchesWithinWindow(RFC_SECRET, null, 59, 10)).isFalse();
        assertThat(generator.matchesWithinWindow(RFC_SECRET, "  ", 59, 10)).isFalse();
    }

    @Test
    @DisplayName("Should generate 160-bit base32 secrets without padding")
    void shouldGenerateSecret() {
        String secret = generator.generateSecret();

        assertThat(secret).hasSize(32).matches("[A-Z2-7]+");
        assertThat(generator.generateSecret()).isNotEqualTo(secret);
    }

    @Test
    @DisplayName("Should build an otpauth URI with an encoded issuer")
    void shouldBuildProvisioningUri() {
        String uri = generator.provisioningUri("ABCDEF", "admin", "Lixeira Inteligente");

        assertThat(uri).isEqualTo(
                "otpauth://totp/Lixeira%20Inteligente:admin?secret=ABCDEF&issuer=Lixeira%20Inteligente");
    }
}
