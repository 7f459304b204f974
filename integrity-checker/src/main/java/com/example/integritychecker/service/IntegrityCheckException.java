package com.example.integritychecker.service;

/**
 * Failure of one step of an integrity check. The {@link Kind} decides the stored
 * error text and whether the scheduler retries the check.
 */
public class IntegrityCheckException extends Exception {

    public enum Kind {
        KEYS_NOT_CONFIGURED("Keys not configured", false),
        TOKEN_ACQUISITION_FAILED("Token request failed", true),
        MALFORMED_TOKEN("Malformed token", true),
        DECRYPTION_FAILED("Decryption failed", true),
        SIGNATURE_INVALID("Signature invalid", true),
        PAYLOAD_PARSE_ERROR("Payload parse error", true),
        NONCE_MISMATCH("Nonce mismatch", true),
        STORE_UNAVAILABLE("State store unavailable", true);

        private final String prefix;
        private final boolean retryable;

        Kind(String prefix, boolean retryable) {
            this.prefix = prefix;
            this.retryable = retryable;
        }

        public String getPrefix() {
            return prefix;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Kind kind;

    public IntegrityCheckException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IntegrityCheckException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Text persisted as the snapshot's error message, e.g. {@code Decryption failed: Tag mismatch}.
     */
    public String toErrorMessage() {
        String detail = getMessage();
        if (detail == null || detail.isBlank()) {
            return kind.getPrefix();
        }
        return kind.getPrefix() + ": " + detail;
    }
}
