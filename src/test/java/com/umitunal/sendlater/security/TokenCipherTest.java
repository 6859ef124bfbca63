package com.umitunal.sendlater.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class TokenCipherTest {

    private final TokenCipher cipher = TokenCipher.fromBase64Key(TokenCipher.generateKey());

    @Test
    @DisplayName("Should decrypt what it encrypted, with a fresh IV each time")
    void testEncryptDecrypt() throws Exception {
        // When
        String first = cipher.encrypt("vk1.a.token");
        String second = cipher.encrypt("vk1.a.token");

        // Then
        assertThat(first).isNotEqualTo(second).doesNotContain("vk1.a.token");
        assertThat(cipher.decrypt(first)).isEqualTo("vk1.a.token");
        assertThat(cipher.decrypt(second)).isEqualTo("vk1.a.token");
    }

    @Test
    @DisplayName("Should detect tampering")
    void testTampering() {
        // Given
        byte[] raw = Base64.getDecoder().decode(cipher.encrypt("vk1.a.token"));
        raw[raw.length - 1] ^= 1;

        // When / Then
        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(raw)))
                .isInstanceOf(TokenCipher.DecryptionException.class);
        assertThatThrownBy(() -> cipher.decrypt("%%%"))
                .isInstanceOf(TokenCipher.DecryptionException.class);
        assertThatThrownBy(() -> cipher.decrypt("AAAA"))
                .isInstanceOf(TokenCipher.DecryptionException.class);
    }

    @Test
    @DisplayName("Should refuse keys of the wrong size")
    void testKeySize() {
        assertThatThrownBy(() -> TokenCipher.fromBase64Key(Base64.getEncoder().encodeToString(new byte[10])))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TokenCipher.fromBase64Key(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TokenCipher.fromBase64Key("not base64!"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should show only the end of a client secret")
    void testSecretTail() {
        // Given
        String secret = ClientSecrets.generate();

        // Then
        assertThat(ClientSecrets.tail(secret)).isEqualTo("..." + secret.substring(secret.length() - 4));
        assertThat(ClientSecrets.tail("abc")).isEqualTo("****");
        assertThat(ClientSecrets.digest(secret)).hasSize(32).isEqualTo(ClientSecrets.digest(secret));
    }
}
