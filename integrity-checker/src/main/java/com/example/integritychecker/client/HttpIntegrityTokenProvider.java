package com.example.integritychecker.client;

import com.example.integritychecker.config.IntegrityCheckerProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Requests tokens from the configured issuer endpoint:
 * {@code POST {"nonce": ...}} answered by {@code {"token": ...}}.
 * Cancelling a returned future interrupts its request; each request has its own worker.
 */
@Component
public class HttpIntegrityTokenProvider implements IntegrityTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(HttpIntegrityTokenProvider.class);

    private final RestTemplate restTemplate;
    private final String issuerUrl;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "integrity-token-request");
        thread.setDaemon(true);
        return thread;
    });

    public HttpIntegrityTokenProvider(IntegrityCheckerProperties properties) {
        IntegrityCheckerProperties.Token token = properties.getToken();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(token.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(token.getTimeout());
        this.restTemplate = new RestTemplate(requestFactory);
        this.issuerUrl = token.getIssuerUrl();
    }

    @Override
    public CompletableFuture<String> requestToken(String nonce) {
        if (issuerUrl == null || issuerUrl.isBlank()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Token issuer URL is not configured"));
        }
        CompletableFuture<String> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(fetch(nonce));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((token, error) -> {
            if (result.isCancelled()) {
                logger.debug("Token request cancelled, interrupting worker");
                task.cancel(true);
            }
        });
        return result;
    }

    private String fetch(String nonce) {
        RequestEntity<Map<String, String>> request = RequestEntity.post(URI.create(issuerUrl))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(Map.of("nonce", nonce));

        TokenResponse response = restTemplate.exchange(request, TokenResponse.class).getBody();
        if (response == null || response.token() == null || response.token().isBlank()) {
            throw new IllegalStateException("Empty response from token issuer");
        }
        logger.debug("Received token from issuer ({} chars)", response.token().length());
        return response.token();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public record TokenResponse(@JsonProperty("token") String token) {}
}
