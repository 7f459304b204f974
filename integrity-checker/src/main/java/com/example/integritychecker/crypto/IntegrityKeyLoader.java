package com.example.integritychecker.crypto;

import com.example.integritychecker.config.IntegrityCheckerProperties;
import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Security;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Resolves the provisioned token keys from configuration. Absent or unreadable
 * key material is reported as {@link Kind#KEYS_NOT_CONFIGURED} before any
 * network or cryptographic work is attempted.
 */
@Component
public class IntegrityKeyLoader {

    private static final Logger logger = LoggerFactory.getLogger(IntegrityKeyLoader.class);

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final IntegrityCheckerProperties.Keys keys;
    private final ResourceLoader resourceLoader;

    private volatile IntegrityKeys cached;

    public IntegrityKeyLoader(IntegrityCheckerProperties properties, ResourceLoader resourceLoader) {
        this.keys = properties.getKeys();
        this.resourceLoader = resourceLoader;
    }

    public IntegrityKeys load() throws IntegrityCheckException {
        IntegrityKeys current = cached;
        if (current != null) {
            return current;
        }

        if (isBlank(keys.getDecryptionKey())) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED, "decryption key is missing");
        }
        if (isBlank(keys.getVerificationKey()) && isBlank(keys.getVerificationKeyLocation())) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED, "verification key is missing");
        }

        SecretKey decryptionKey = decodeDecryptionKey(keys.getDecryptionKey());
        PublicKey verificationKey = isBlank(keys.getVerificationKey())
                ? readPemVerificationKey(keys.getVerificationKeyLocation())
                : decodeVerificationKey(keys.getVerificationKey(), keys.getVerificationKeyAlgorithm());

        current = new IntegrityKeys(decryptionKey, verificationKey);
        cached = current;
        logger.info("Loaded token keys: decryption={} bits, verification={}",
                decryptionKey.getEncoded().length * 8, verificationKey.getAlgorithm());
        return current;
    }

    private SecretKey decodeDecryptionKey(String base64) throws IntegrityCheckException {
        try {
            byte[] keyBytes = Base64.getMimeDecoder().decode(base64.trim());
            if (keyBytes.length == 0) {
                throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED, "decryption key is empty");
            }
            return new SecretKeySpec(keyBytes, 0, keyBytes.length, "AES");
        } catch (IllegalArgumentException e) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED, "decryption key is not valid base64", e);
        }
    }

    private PublicKey decodeVerificationKey(String base64, String algorithm) throws IntegrityCheckException {
        try {
            byte[] encoded = Base64.getMimeDecoder().decode(base64.trim());
            return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED,
                    "verification key could not be decoded as " + algorithm, e);
        }
    }

    private PublicKey readPemVerificationKey(String location) throws IntegrityCheckException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED,
                    "verification key resource not found: " + location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             PEMParser pemParser = new PEMParser(reader)) {
            Object obj = pemParser.readObject();
            if (!(obj instanceof SubjectPublicKeyInfo publicKeyInfo)) {
                throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED,
                        "verification key resource does not hold a PUBLIC KEY block: " + location);
            }
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME);
            return converter.getPublicKey(publicKeyInfo);
        } catch (IOException e) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED,
                    "verification key resource could not be read: " + location, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
