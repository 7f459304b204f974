package com.example.integritychecker.client;

import java.util.concurrent.CompletableFuture;

/**
 * Source of attestation tokens. The returned future completes with the compact
 * token string bound to {@code nonce}, or exceptionally if the issuer refuses or
 * cannot be reached.
 */
public interface IntegrityTokenProvider {

    CompletableFuture<String> requestToken(String nonce);
}
