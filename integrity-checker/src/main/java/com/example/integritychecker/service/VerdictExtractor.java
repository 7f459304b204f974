package com.example.integritychecker.service;

import com.example.integritychecker.model.AppVerdict;
import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.ExtractedVerdicts;
import com.example.integritychecker.model.IntegrityStatement;
import com.example.integritychecker.model.LicensingVerdict;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns an authenticated payload into verdicts. Trusts its input: callers must
 * pass bytes that already went through {@link com.example.integritychecker.crypto.EnvelopeVerifier}.
 */
@Component
public class VerdictExtractor {

    private static final Logger logger = LoggerFactory.getLogger(VerdictExtractor.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public IntegrityStatement extract(byte[] payload) throws IntegrityCheckException {
        if (payload == null || payload.length == 0) {
            throw new IntegrityCheckException(Kind.PAYLOAD_PARSE_ERROR, "payload is empty");
        }
        IntegrityStatement statement;
        try {
            statement = objectMapper.readValue(payload, IntegrityStatement.class);
        } catch (JsonProcessingException e) {
            throw new IntegrityCheckException(Kind.PAYLOAD_PARSE_ERROR, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IntegrityCheckException(Kind.PAYLOAD_PARSE_ERROR, e.getMessage(), e);
        }
        if (statement == null) {
            throw new IntegrityCheckException(Kind.PAYLOAD_PARSE_ERROR, "payload is JSON null");
        }
        return statement;
    }

    /**
     * Absent sections map to an empty device set and null app/licensing verdicts.
     */
    public ExtractedVerdicts toVerdicts(IntegrityStatement statement) {
        Set<DeviceVerdict> deviceVerdicts = EnumSet.noneOf(DeviceVerdict.class);
        if (statement.deviceIntegrity() != null && statement.deviceIntegrity().deviceRecognitionVerdict() != null) {
            List<String> labels = statement.deviceIntegrity().deviceRecognitionVerdict();
            for (String label : labels) {
                DeviceVerdict verdict = DeviceVerdict.fromLabel(label);
                if (verdict == null) {
                    logger.warn("Ignoring unknown device verdict label: {}", label);
                } else {
                    deviceVerdicts.add(verdict);
                }
            }
        }

        AppVerdict appVerdict = null;
        if (statement.appIntegrity() != null) {
            String label = statement.appIntegrity().appRecognitionVerdict();
            appVerdict = AppVerdict.fromLabel(label);
            if (appVerdict == null && label != null && !label.isBlank()) {
                logger.warn("Ignoring unknown app verdict label: {}", label);
            }
        }

        LicensingVerdict licensingVerdict = null;
        if (statement.accountDetails() != null) {
            String label = statement.accountDetails().appLicensingVerdict();
            licensingVerdict = LicensingVerdict.fromLabel(label);
            if (licensingVerdict == null && label != null && !label.isBlank()) {
                logger.warn("Ignoring unknown licensing verdict label: {}", label);
            }
        }

        return new ExtractedVerdicts(deviceVerdicts, appVerdict, licensingVerdict);
    }

    /**
     * Rejects a statement that echoes a nonce other than the one sent. Statements
     * without request details are accepted.
     */
    public void checkRequestBinding(IntegrityStatement statement, String expectedNonce) throws IntegrityCheckException {
        if (statement.requestDetails() == null || statement.requestDetails().nonce() == null) {
            return;
        }
        if (!statement.requestDetails().nonce().equals(expectedNonce)) {
            throw new IntegrityCheckException(Kind.NONCE_MISMATCH,
                    "statement was issued for a different request");
        }
    }
}
