package com.umitunal.sendlater.security;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Encrypts upstream access tokens at rest with AES-GCM.
 *
 * Stored form: base64([iv(12 bytes)][ciphertext + tag]).
 * Instances are thread-safe; a Cipher is created per call.
 */
public class TokenCipher {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public TokenCipher(byte[] keyBytes) {
        if (keyBytes == null || (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32)) {
            throw new IllegalArgumentException("Encryption key must be 16, 24 or 32 bytes");
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Build a cipher from a base64 encoded key, as found in configuration.
     */
    public static TokenCipher fromBase64Key(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new IllegalArgumentException("Encryption key is missing");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encodedKey.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key is not valid base64", e);
        }
        return new TokenCipher(keyBytes);
    }

    /**
     * Generate a fresh 256-bit key, base64 encoded.
     */
    public static String generateKey() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256);
            return Base64.getEncoder().encodeToString(generator.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation unavailable", e);
        }
    }

    public String encrypt(String plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(UTF_8));
            byte[] out = ByteBuffer.allocate(IV_LENGTH + sealed.length).put(iv).put(sealed).array();
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    /**
     * @throws DecryptionException if the value was not produced by this key or was tampered with
     */
    public String decrypt(String encrypted) throws DecryptionException {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted token is not valid base64", e);
        }
        if (raw.length <= IV_LENGTH) {
            throw new DecryptionException("Encrypted token is truncated", null);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(raw, IV_LENGTH, raw.length - IV_LENGTH);
            return new String(plain, UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Encrypted token could not be decrypted", e);
        }
    }

    public static class DecryptionException extends Exception {
        public DecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
