package com.example.integritychecker.crypto;

import com.example.integritychecker.config.IntegrityCheckerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates the per-request nonce bound into each attestation token.
 * Every call draws fresh characters; values are never cached or reused.
 */
@Component
public class NonceGenerator {

    private static final String ALLOWED =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom secureRandom;
    private final int defaultLength;

    @Autowired
    public NonceGenerator(IntegrityCheckerProperties properties) {
        this(createSecureRandom(), properties.getNonce().getLength());
    }

    NonceGenerator(SecureRandom secureRandom, int defaultLength) {
        if (defaultLength <= 0) {
            throw new IllegalArgumentException("Nonce length must be positive: " + defaultLength);
        }
        this.secureRandom = secureRandom;
        this.defaultLength = defaultLength;
    }

    public String generate() {
        return generate(defaultLength);
    }

    /**
     * @param length number of plaintext characters before encoding
     * @return URL-safe base64 of {@code length} random alphanumeric characters
     */
    public String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Nonce length must be positive: " + length);
        }
        StringBuilder plain = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            plain.append(ALLOWED.charAt(secureRandom.nextInt(ALLOWED.length())));
        }
        return Base64.getUrlEncoder().encodeToString(plain.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static SecureRandom createSecureRandom() {
        try {
            return SecureRandom.getInstance("DRBG");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("No DRBG entropy source available for nonce generation", e);
        }
    }
}
