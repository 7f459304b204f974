package com.example.integritychecker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Authenticated attestation payload. Every section is optional; the issuer omits
 * sections that do not apply to the request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntegrityStatement(
        RequestDetails requestDetails,
        AppIntegrity appIntegrity,
        DeviceIntegrity deviceIntegrity,
        AccountDetails accountDetails
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequestDetails(
            String requestPackageName,
            String nonce,
            String timestampMillis
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AppIntegrity(
            String appRecognitionVerdict,
            String packageName,
            List<String> certificateSha256Digest,
            String versionCode
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeviceIntegrity(
            List<String> deviceRecognitionVerdict
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AccountDetails(
            String appLicensingVerdict
    ) {}
}
