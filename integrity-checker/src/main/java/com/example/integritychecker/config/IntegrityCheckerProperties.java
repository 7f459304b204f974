package com.example.integritychecker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "integrity.checker")
public class IntegrityCheckerProperties {

    private Keys keys = new Keys();
    private Nonce nonce = new Nonce();
    private Token token = new Token();
    private Schedule schedule = new Schedule();
    private Notifications notifications = new Notifications();

    /**
     * Reject statements whose echoed request nonce differs from the one sent.
     */
    private boolean verifyRequestNonce = true;

    public static class Keys {
        private String decryptionKey;           // base64 raw AES key
        private String verificationKey;         // base64 X.509 SubjectPublicKeyInfo
        private String verificationKeyLocation; // PEM resource, used when verificationKey is empty
        private String verificationKeyAlgorithm = "EC";

        public String getDecryptionKey() {
            return decryptionKey;
        }

        public void setDecryptionKey(String decryptionKey) {
            this.decryptionKey = decryptionKey;
        }

        public String getVerificationKey() {
            return verificationKey;
        }

        public void setVerificationKey(String verificationKey) {
            this.verificationKey = verificationKey;
        }

        public String getVerificationKeyLocation() {
            return verificationKeyLocation;
        }

        public void setVerificationKeyLocation(String verificationKeyLocation) {
            this.verificationKeyLocation = verificationKeyLocation;
        }

        public String getVerificationKeyAlgorithm() {
            return verificationKeyAlgorithm;
        }

        public void setVerificationKeyAlgorithm(String verificationKeyAlgorithm) {
            this.verificationKeyAlgorithm = verificationKeyAlgorithm;
        }
    }

    public static class Nonce {
        private int length = 50;

        public int getLength() {
            return length;
        }

        public void setLength(int length) {
            this.length = length;
        }
    }

    public static class Token {
        private String issuerUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getIssuerUrl() {
            return issuerUrl;
        }

        public void setIssuerUrl(String issuerUrl) {
            this.issuerUrl = issuerUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Schedule {
        private Duration initialBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofHours(5);
        private Duration networkRetry = Duration.ofSeconds(30);

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public Duration getNetworkRetry() {
            return networkRetry;
        }

        public void setNetworkRetry(Duration networkRetry) {
            this.networkRetry = networkRetry;
        }
    }

    public static class Notifications {
        private boolean enabled = true;          // stands in for the OS notification permission
        private boolean notifyOnFailure = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isNotifyOnFailure() {
            return notifyOnFailure;
        }

        public void setNotifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
        }
    }

    public Keys getKeys() {
        return keys;
    }

    public void setKeys(Keys keys) {
        this.keys = keys;
    }

    public Nonce getNonce() {
        return nonce;
    }

    public void setNonce(Nonce nonce) {
        this.nonce = nonce;
    }

    public Token getToken() {
        return token;
    }

    public void setToken(Token token) {
        this.token = token;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public boolean isVerifyRequestNonce() {
        return verifyRequestNonce;
    }

    public void setVerifyRequestNonce(boolean verifyRequestNonce) {
        this.verifyRequestNonce = verifyRequestNonce;
    }
}
