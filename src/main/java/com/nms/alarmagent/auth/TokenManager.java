package com.nms.alarmagent.auth;

import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.error.AuthFailureException;
import com.nms.alarmagent.error.RefreshFailureException;
import com.nms.alarmagent.metrics.Metrics;
import com.nms.alarmagent.scheduling.PeriodicTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the token protocol against the NMS authentication endpoint.
 *
 * The initial token is obtained with a client-credentials grant and then refreshed on a fixed
 * interval that is shorter than the token lifetime. The interval is deliberately not derived from
 * {@code expires_in}: the NMS clock and ours may drift.
 */
@Slf4j
@Component
public class TokenManager {

    static final Duration VALIDITY_MARGIN = Duration.ofSeconds(60);
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final AgentProperties.Api settings;
    private final RestTemplate restTemplate;
    private final CredentialStore credentialStore;
    private final Metrics metrics;
    private final Clock clock;
    private final PeriodicTask autoRefresh;

    public TokenManager(
            AgentProperties properties,
            @Qualifier("nmsRestTemplate") RestTemplate restTemplate,
            CredentialStore credentialStore,
            TaskScheduler taskScheduler,
            Metrics metrics,
            Clock clock
    ) {
        this.settings = properties.getApi();
        this.restTemplate = restTemplate;
        this.credentialStore = credentialStore;
        this.metrics = metrics;
        this.clock = clock;
        this.autoRefresh = new PeriodicTask("token-refresh", this::refreshQuietly, taskScheduler, clock);
    }

    /**
     * Obtain the first token with HTTP Basic client credentials.
     *
     * @throws AuthFailureException if the endpoint rejects us or answers without a token
     */
    public Credential acquireInitial() {
        String url = tokenUrl();
        log.info("Requesting initial token from {}", url);

        TokenResponse body;
        try {
            body = postForToken(url, Map.of("grant_type", "client_credentials"));
        } catch (RestClientResponseException e) {
            log.error("Initial authentication rejected with HTTP {}", e.getStatusCode().value());
            throw new AuthFailureException("Initial authentication failed with HTTP "
                    + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("Initial authentication failed: {}", e.getMessage());
            throw new AuthFailureException("Initial authentication failed: " + e.getMessage(), null, e);
        }

        if (body == null || isBlank(body.accessToken())) {
            throw new AuthFailureException("Token endpoint returned no access_token");
        }

        Credential credential = toCredential(body, null);
        credentialStore.replace(credential);
        log.info("Token obtained successfully. Expires in {} seconds at {}",
                credential.expiresInSeconds(), credential.expiresAt());
        return credential;
    }

    /**
     * Exchange the current refresh token for a new credential.
     *
     * On failure the stored credential is left untouched; it stays usable until it expires.
     *
     * @throws RefreshFailureException if there is nothing to refresh or the call fails
     */
    public Credential refresh() {
        Credential previous = credentialStore.current()
                .orElseThrow(() -> new RefreshFailureException(
                        "No refresh token available. Obtain the initial token first."));
        if (isBlank(previous.refreshToken())) {
            throw new RefreshFailureException("Current credential carries no refresh token");
        }

        log.info("Refreshing access token...");
        TokenResponse body;
        try {
            body = postForToken(tokenUrl(), Map.of(
                    "grant_type", "refresh_token",
                    "refresh_token", previous.refreshToken()
            ));
        } catch (RestClientResponseException e) {
            throw new RefreshFailureException("Token refresh failed with HTTP "
                    + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new RefreshFailureException("Token refresh failed: " + e.getMessage(), null, e);
        }

        if (body == null || isBlank(body.accessToken())) {
            throw new RefreshFailureException("Token endpoint returned no access_token on refresh");
        }

        Credential refreshed = toCredential(body, previous.refreshToken());
        credentialStore.replace(refreshed);
        log.info("Token refreshed successfully. New expiry: {}", refreshed.expiresAt());
        return refreshed;
    }

    public void startAutoRefresh(Duration interval) {
        autoRefresh.start(interval);
    }

    public void startAutoRefresh() {
        startAutoRefresh(settings.getRefreshInterval());
    }

    public boolean stopAutoRefresh(Duration timeout) {
        return autoRefresh.cancel(timeout);
    }

    public boolean isAutoRefreshRunning() {
        return autoRefresh.isScheduled();
    }

    public String currentAuthorizationHeader() {
        return credentialStore.currentAuthorizationHeader();
    }

    public Optional<Credential> currentCredential() {
        return credentialStore.current();
    }

    /**
     * A token is considered valid until one minute before its advertised expiry.
     */
    public boolean isTokenValid() {
        return credentialStore.current()
                .map(c -> c.isValidAt(clock.instant(), VALIDITY_MARGIN))
                .orElse(false);
    }

    /**
     * Revoke the current access token. Best-effort: failures are logged, never thrown.
     */
    public void revoke() {
        Optional<Credential> current = credentialStore.current();
        if (current.isEmpty()) {
            log.warn("No token to revoke");
            return;
        }
        String accessToken = current.get().accessToken();

        HttpHeaders headers = basicAuthHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("token", accessToken);
        form.add("token_type_hint", "token");

        try {
            restTemplate.exchange(settings.getBaseUrl() + "/auth/revocation", HttpMethod.POST,
                    new HttpEntity<>(form, headers), Void.class);
            credentialStore.clear();
            log.info("Token {} revoked successfully", Credential.mask(accessToken));
        } catch (RestClientException e) {
            log.error("Token revocation failed: {}", e.getMessage());
        }
    }

    private void refreshQuietly() {
        try {
            refresh();
            metrics.onTokenRefreshed();
        } catch (RefreshFailureException e) {
            metrics.onTokenRefreshFailed();
            log.error("Auto-refresh failed, keeping previous token until next cycle: {}", e.getMessage());
        }
    }

    private TokenResponse postForToken(String url, Map<String, String> payload) {
        HttpHeaders headers = basicAuthHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<TokenResponse> response = restTemplate.exchange(
                url, HttpMethod.POST, new HttpEntity<>(payload, headers), TokenResponse.class);
        return response.getBody();
    }

    private HttpHeaders basicAuthHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(settings.getUsername(), settings.getPassword(), StandardCharsets.UTF_8);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private Credential toCredential(TokenResponse body, String fallbackRefreshToken) {
        String refreshToken = isBlank(body.refreshToken()) ? fallbackRefreshToken : body.refreshToken();
        String tokenType = isBlank(body.tokenType()) || Credential.DEFAULT_TOKEN_TYPE.equalsIgnoreCase(body.tokenType())
                ? Credential.DEFAULT_TOKEN_TYPE
                : body.tokenType();
        long expiresIn = body.expiresIn() != null ? body.expiresIn() : DEFAULT_EXPIRES_IN;
        Instant issuedAt = clock.instant();
        return new Credential(body.accessToken(), refreshToken, tokenType, issuedAt, expiresIn);
    }

    private String tokenUrl() {
        return settings.getBaseUrl() + "/auth/token";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
