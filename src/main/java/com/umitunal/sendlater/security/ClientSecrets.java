package com.umitunal.sendlater.security;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Client secrets handed out when an account is linked.
 */
public final class ClientSecrets {
    private static final int SECRET_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ClientSecrets() {
    }

    /**
     * 32 random bytes, URL-safe base64 without padding (43 characters).
     */
    public static String generate() {
        byte[] bytes = new byte[SECRET_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * SHA-256 of the secret. Stores index secrets by digest, never in clear.
     */
    public static byte[] digest(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Last four characters, for log lines.
     */
    public static String tail(String secret) {
        if (secret == null || secret.length() <= 4) {
            return "****";
        }
        return "..." + secret.substring(secret.length() - 4);
    }
}
