package com.example.integritychecker.service;

import com.example.integritychecker.client.IntegrityTokenProvider;
import com.example.integritychecker.config.IntegrityCheckerProperties;
import com.example.integritychecker.crypto.EnvelopeVerifier;
import com.example.integritychecker.crypto.IntegrityKeyLoader;
import com.example.integritychecker.crypto.IntegrityKeys;
import com.example.integritychecker.crypto.NonceGenerator;
import com.example.integritychecker.display.DisplayRefresher;
import com.example.integritychecker.display.NotificationSurface;
import com.example.integritychecker.model.ExtractedVerdicts;
import com.example.integritychecker.model.IntegrityStatement;
import com.example.integritychecker.model.VerdictChange;
import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.repository.CheckerSettingsRepository;
import com.example.integritychecker.repository.VerdictStateStore;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one integrity check end to end: read the previous state, obtain and open a
 * token, persist the verdicts, alert on changes and refresh the displays.
 */
@Service
public class IntegrityCheckService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrityCheckService.class);

    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final VerdictStateStore stateStore;
    private final CheckerSettingsRepository settingsRepository;
    private final IntegrityKeyLoader keyLoader;
    private final NonceGenerator nonceGenerator;
    private final IntegrityTokenProvider tokenProvider;
    private final EnvelopeVerifier envelopeVerifier;
    private final VerdictExtractor verdictExtractor;
    private final VerdictChangeDetector changeDetector;
    private final NotificationSurface notificationSurface;
    private final DisplayRefresher displayRefresher;
    private final IntegrityCheckerProperties properties;

    private volatile CheckPhase currentPhase = CheckPhase.IDLE;

    public IntegrityCheckService(VerdictStateStore stateStore,
                                 CheckerSettingsRepository settingsRepository,
                                 IntegrityKeyLoader keyLoader,
                                 NonceGenerator nonceGenerator,
                                 IntegrityTokenProvider tokenProvider,
                                 EnvelopeVerifier envelopeVerifier,
                                 VerdictExtractor verdictExtractor,
                                 VerdictChangeDetector changeDetector,
                                 NotificationSurface notificationSurface,
                                 DisplayRefresher displayRefresher,
                                 IntegrityCheckerProperties properties) {
        this.stateStore = stateStore;
        this.settingsRepository = settingsRepository;
        this.keyLoader = keyLoader;
        this.nonceGenerator = nonceGenerator;
        this.tokenProvider = tokenProvider;
        this.envelopeVerifier = envelopeVerifier;
        this.verdictExtractor = verdictExtractor;
        this.changeDetector = changeDetector;
        this.notificationSurface = notificationSurface;
        this.displayRefresher = displayRefresher;
        this.properties = properties;
    }

    public CheckPhase getCurrentPhase() {
        return currentPhase;
    }

    public CheckResult runCheck() {
        logger.info("Starting integrity check...");

        transition(CheckPhase.FETCHING_PREVIOUS);
        VerdictSnapshot previous;
        boolean alertsEnabled;
        IntegrityKeys keys;
        try {
            previous = stateStore.read();
            alertsEnabled = settingsRepository.load().alertsEnabled();
            keys = keyLoader.load();
        } catch (IntegrityCheckException e) {
            return fail(e);
        }

        VerdictSnapshot current;
        try {
            transition(CheckPhase.REQUESTING_TOKEN);
            String nonce = nonceGenerator.generate();
            String token = awaitToken(nonce);

            transition(CheckPhase.VERIFYING);
            byte[] payload = envelopeVerifier.verify(token, keys);

            transition(CheckPhase.EXTRACTING_VERDICT);
            IntegrityStatement statement = verdictExtractor.extract(payload);
            if (properties.isVerifyRequestNonce()) {
                verdictExtractor.checkRequestBinding(statement, nonce);
            }
            ExtractedVerdicts verdicts = verdictExtractor.toVerdicts(statement);

            transition(CheckPhase.PERSISTING);
            current = stateStore.recordSuccess(
                    verdicts.deviceVerdicts(), verdicts.appVerdict(), verdicts.licensingVerdict());
        } catch (IntegrityCheckException e) {
            return fail(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Integrity check cancelled during {}", currentPhase);
            displayRefresher.refreshAll();
            transition(CheckPhase.IDLE);
            return new CheckResult.Cancelled();
        }

        transition(CheckPhase.DETECTING_CHANGES);
        if (alertsEnabled) {
            Optional<VerdictChange> change = changeDetector.detect(previous, current);
            change.ifPresent(this::notifyChange);
        }

        transition(CheckPhase.NOTIFYING_DISPLAYS);
        displayRefresher.refreshAll();

        transition(CheckPhase.DONE);
        logger.info("Integrity check completed successfully: {}", current.overallStatus());
        return new CheckResult.Success();
    }

    private String awaitToken(String nonce) throws IntegrityCheckException, InterruptedException {
        Duration timeout = properties.getToken().getTimeout();
        CompletableFuture<String> pending;
        try {
            pending = tokenProvider.requestToken(nonce);
        } catch (RuntimeException e) {
            throw new IntegrityCheckException(Kind.TOKEN_ACQUISITION_FAILED, describe(e), e);
        }

        String token;
        try {
            token = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IntegrityCheckException(Kind.TOKEN_ACQUISITION_FAILED, describe(cause), cause);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IntegrityCheckException(Kind.TOKEN_ACQUISITION_FAILED, "no token within " + timeout, e);
        } catch (CancellationException e) {
            throw new IntegrityCheckException(Kind.TOKEN_ACQUISITION_FAILED, "token request was cancelled", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        }

        if (token == null || token.isBlank()) {
            throw new IntegrityCheckException(Kind.TOKEN_ACQUISITION_FAILED, "issuer returned an empty token");
        }
        return token;
    }

    private CheckResult fail(IntegrityCheckException e) {
        CheckPhase failedIn = currentPhase;
        transition(CheckPhase.FAILED);
        String message = truncate(e.toErrorMessage());
        logger.error("Integrity check failed during {}: {}", failedIn, message, e);

        try {
            stateStore.recordFailure(message);
        } catch (IntegrityCheckException storeError) {
            logger.error("Could not record check failure: {}", storeError.toErrorMessage(), storeError);
        }

        if (properties.getNotifications().isNotifyOnFailure()) {
            try {
                notificationSurface.notifyCheckFailed(message);
            } catch (RuntimeException notifyError) {
                logger.error("Failed to send check failure notification", notifyError);
            }
        }

        displayRefresher.refreshAll();

        if (e.getKind().isRetryable()) {
            return new CheckResult.Retry(message);
        }
        return new CheckResult.Failure(message);
    }

    private void notifyChange(VerdictChange change) {
        try {
            notificationSurface.notifyChange(change.title(), change.message(), change.improvement());
        } catch (RuntimeException e) {
            logger.error("Failed to send verdict change notification", e);
        }
    }

    private void transition(CheckPhase next) {
        logger.debug("Check phase {} -> {}", currentPhase, next);
        currentPhase = next;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        if (message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
