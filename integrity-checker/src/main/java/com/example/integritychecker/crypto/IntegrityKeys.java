package com.example.integritychecker.crypto;

import javax.crypto.SecretKey;
import java.security.PublicKey;

/**
 * Key pair used to open attestation tokens: the symmetric key of the outer JWE
 * and the public key of the inner JWS.
 */
public record IntegrityKeys(
        SecretKey decryptionKey,
        PublicKey verificationKey
) {}
