package com.example.integritychecker.crypto;

import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEDecrypter;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.AESDecrypter;
import com.nimbusds.jose.crypto.DirectDecrypter;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;

/**
 * Opens an attestation token: a compact JWE whose plaintext is a compact JWS.
 * The returned bytes are both confidential to the holder of the decryption key
 * and authenticated by the holder of the signing key.
 */
@Component
public class EnvelopeVerifier {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeVerifier.class);

    /**
     * Decrypts the outer envelope and verifies the inner signature.
     *
     * @param token compact-serialized JWE
     * @param keys  provisioned decryption and verification keys
     * @return the exact signed payload bytes
     * @throws IntegrityCheckException with kind KEYS_NOT_CONFIGURED, MALFORMED_TOKEN,
     *                                 DECRYPTION_FAILED or SIGNATURE_INVALID
     */
    public byte[] verify(String token, IntegrityKeys keys) throws IntegrityCheckException {
        if (keys == null || keys.decryptionKey() == null || keys.verificationKey() == null) {
            throw new IntegrityCheckException(Kind.KEYS_NOT_CONFIGURED, "token keys are not available");
        }
        if (token == null || token.isBlank()) {
            throw new IntegrityCheckException(Kind.MALFORMED_TOKEN, "token is empty");
        }

        JWEObject jweObject;
        try {
            jweObject = JWEObject.parse(token.trim());
        } catch (ParseException e) {
            throw new IntegrityCheckException(Kind.MALFORMED_TOKEN, "not a compact JWE: " + e.getMessage(), e);
        }

        String compactJws = decrypt(jweObject, keys.decryptionKey());

        JWSObject jwsObject;
        try {
            jwsObject = JWSObject.parse(compactJws);
        } catch (ParseException e) {
            throw new IntegrityCheckException(Kind.MALFORMED_TOKEN, "decrypted payload is not a compact JWS: " + e.getMessage(), e);
        }

        verifySignature(jwsObject, keys.verificationKey());

        logger.debug("Token verified: enc={}, sig={}",
                jweObject.getHeader().getEncryptionMethod(), jwsObject.getHeader().getAlgorithm());
        return jwsObject.getPayload().toBytes();
    }

    private String decrypt(JWEObject jweObject, SecretKey key) throws IntegrityCheckException {
        JWEAlgorithm algorithm = jweObject.getHeader().getAlgorithm();
        try {
            jweObject.decrypt(createDecrypter(algorithm, key));
        } catch (JOSEException e) {
            throw new IntegrityCheckException(Kind.DECRYPTION_FAILED, e.getMessage(), e);
        }
        if (jweObject.getState() != JWEObject.State.DECRYPTED || jweObject.getPayload() == null) {
            throw new IntegrityCheckException(Kind.DECRYPTION_FAILED, "no plaintext after decryption");
        }
        return jweObject.getPayload().toString();
    }

    private JWEDecrypter createDecrypter(JWEAlgorithm algorithm, SecretKey key)
            throws JOSEException, IntegrityCheckException {
        if (JWEAlgorithm.DIR.equals(algorithm)) {
            return new DirectDecrypter(key);
        }
        if (JWEAlgorithm.Family.AES_KW.contains(algorithm) || JWEAlgorithm.Family.AES_GCM_KW.contains(algorithm)) {
            return new AESDecrypter(key);
        }
        throw new IntegrityCheckException(Kind.DECRYPTION_FAILED, "unsupported key management algorithm: " + algorithm);
    }

    private void verifySignature(JWSObject jwsObject, PublicKey publicKey) throws IntegrityCheckException {
        boolean valid;
        try {
            valid = jwsObject.verify(createVerifier(publicKey));
        } catch (JOSEException e) {
            throw new IntegrityCheckException(Kind.SIGNATURE_INVALID, e.getMessage(), e);
        }
        if (!valid) {
            throw new IntegrityCheckException(Kind.SIGNATURE_INVALID,
                    "signature does not match verification key (" + jwsObject.getHeader().getAlgorithm() + ")");
        }
    }

    private JWSVerifier createVerifier(PublicKey publicKey) throws JOSEException, IntegrityCheckException {
        if (publicKey instanceof ECPublicKey ecPublicKey) {
            return new ECDSAVerifier(ecPublicKey);
        }
        if (publicKey instanceof RSAPublicKey rsaPublicKey) {
            return new RSASSAVerifier(rsaPublicKey);
        }
        throw new IntegrityCheckException(Kind.SIGNATURE_INVALID,
                "unsupported verification key type: " + publicKey.getAlgorithm());
    }
}
