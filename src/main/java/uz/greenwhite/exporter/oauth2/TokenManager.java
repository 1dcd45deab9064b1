package uz.greenwhite.exporter.oauth2;

import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.notification.NotificationService;
import uz.greenwhite.exporter.oauth2.client.OAuth2Client;
import uz.greenwhite.exporter.oauth2.exception.AuthorizationRejectedException;
import uz.greenwhite.exporter.oauth2.exception.CredentialStoreException;
import uz.greenwhite.exporter.oauth2.exception.ReauthorizationRequiredException;
import uz.greenwhite.exporter.oauth2.exception.TokenEndpointException;
import uz.greenwhite.exporter.oauth2.exception.TransientTokenException;
import uz.greenwhite.exporter.oauth2.model.Credential;
import uz.greenwhite.exporter.oauth2.model.TokenResponse;
import uz.greenwhite.exporter.oauth2.model.TokenStatus;
import uz.greenwhite.exporter.oauth2.store.CredentialStore;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single live credential and its state machine.
 *
 * <p>All reads and writes of {@link #state} and {@link #credential} happen under {@link #lock}.
 * Network calls and file writes never run while holding it. A refresh is single-flight: the
 * first caller that finds the credential expired performs the exchange, every other caller
 * waits on the same future, because a refresh token may be invalidated by a second exchange.
 */
@Slf4j
public class TokenManager {

    private final OAuth2Client client;
    private final CredentialStore store;
    private final OAuth2Properties properties;
    private final ExporterMetrics metrics;
    private final NotificationService notificationService;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private TokenState state;
    private Credential credential;
    private CompletableFuture<Credential> inFlightRefresh;
    private long generation;

    // Orders file writes so an older snapshot never replaces a newer one
    private final ReentrantLock persistLock = new ReentrantLock();
    private long persistedGeneration;

    public TokenManager(OAuth2Client client,
                        CredentialStore store,
                        OAuth2Properties properties,
                        ExporterMetrics metrics,
                        NotificationService notificationService,
                        Clock clock) {
        this.client = client;
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.notificationService = notificationService;
        this.clock = clock;

        this.credential = store.load().orElse(null);
        if (credential == null) {
            state = TokenState.UNAUTHENTICATED;
        } else if (credential.isExpired(clock.instant())) {
            state = TokenState.AUTHENTICATED_EXPIRED;
        } else {
            state = TokenState.AUTHENTICATED_VALID;
        }
        log.info("Token manager started in state {}", state);
    }

    // ==================== CONSUMER API ====================

    /**
     * Access token usable right now. Refreshes at most once across all concurrent callers.
     *
     * @throws ReauthorizationRequiredException no credential, or the grant was revoked
     * @throws TransientTokenException          refresh failed for a retryable reason
     */
    public String getValidToken() {
        return getValidCredential().accessToken();
    }

    public Credential getValidCredential() {
        CompletableFuture<Credential> refresh;
        Credential expired = null;
        long startGeneration = 0;

        lock.lock();
        try {
            markExpiredIfDue();
            if (state == TokenState.AUTHENTICATED_VALID) {
                return credential;
            }
            if (state == TokenState.UNAUTHENTICATED) {
                throw new ReauthorizationRequiredException("No credential available, authorize via /oauth.auth");
            }
            if (state == TokenState.REFRESHING) {
                refresh = inFlightRefresh;
            } else {
                refresh = new CompletableFuture<>();
                inFlightRefresh = refresh;
                state = TokenState.REFRESHING;
                expired = credential;
                startGeneration = generation;
            }
        } finally {
            lock.unlock();
        }

        if (expired != null) {
            performRefresh(expired, startGeneration, refresh);
        }
        return await(refresh);
    }

    /**
     * Called when the vendor API answered 401 to {@code rejectedAccessToken}. Expires the
     * credential only if that token is still the current one, then behaves like
     * {@link #getValidToken()}.
     */
    public String forceRefresh(String rejectedAccessToken) {
        lock.lock();
        try {
            if (state == TokenState.AUTHENTICATED_VALID
                    && credential.accessToken().equals(rejectedAccessToken)) {
                log.info("Access token rejected by vehicle API before {}, forcing refresh", credential.expiresAt());
                state = TokenState.AUTHENTICATED_EXPIRED;
            }
        } finally {
            lock.unlock();
        }
        return getValidToken();
    }

    // ==================== AUTHORIZATION ====================

    /**
     * Exchange a one-time authorization code for the initial credential.
     * Only {@link AuthorizationFlowService} calls this, after the state check.
     *
     * @throws AuthorizationRejectedException vendor refused the code (already used, expired, ...)
     * @throws TransientTokenException        token endpoint unreachable
     * @throws CredentialStoreException       the new credential is live in memory but was not written
     */
    public Credential completeAuthorization(String code) {
        TokenResponse response;
        try {
            response = client.exchangeAuthorizationCode(properties, code);
        } catch (TokenEndpointException e) {
            if (e.isTransient()) {
                throw new TransientTokenException("Authorization code exchange failed: " + e.getMessage(), e);
            }
            metrics.getAuthorizationRejected().increment();
            throw new AuthorizationRejectedException(e.getMessage(), e);
        }

        validateScopes(response);
        Credential authorized = Credential.from(response, null, clock.instant(), properties.getExpiryMargin());
        if (!authorized.hasRefreshToken()) {
            log.warn("Authorization granted without a refresh token, the credential cannot be renewed");
        }

        long gen;
        lock.lock();
        try {
            credential = authorized;
            state = TokenState.AUTHENTICATED_VALID;
            inFlightRefresh = null;
            gen = ++generation;
        } finally {
            lock.unlock();
        }

        try {
            persist(authorized, gen);
        } catch (CredentialStoreException e) {
            log.error("Authorized credential could not be written, it will not survive a restart: {}",
                    e.getMessage(), e);
            throw e;
        }
        metrics.getAuthorizationSuccess().increment();
        log.info("Authorization completed: {}", authorized);
        return authorized;
    }

    // ==================== INTROSPECTION ====================

    public TokenState getState() {
        lock.lock();
        try {
            markExpiredIfDue();
            return state;
        } finally {
            lock.unlock();
        }
    }

    public TokenStatus getStatus(boolean authorizationPending) {
        lock.lock();
        try {
            markExpiredIfDue();
            if (credential == null) {
                return new TokenStatus(state, null, null, false, authorizationPending);
            }
            return new TokenStatus(state, credential.expiresAt(), credential.scope(),
                    credential.hasRefreshToken(), authorizationPending);
        } finally {
            lock.unlock();
        }
    }

    // ==================== REFRESH ====================

    private void performRefresh(Credential expired, long startGeneration, CompletableFuture<Credential> refresh) {
        Timer.Sample sample = Timer.start(metrics.getRegistry());
        try {
            if (!expired.hasRefreshToken()) {
                failTerminal(startGeneration, refresh, "Credential has no refresh token");
                return;
            }

            log.info("Refreshing access token expired at {}", expired.expiresAt());
            TokenResponse response = client.refreshAccessToken(properties, expired.refreshToken());
            Credential refreshed = Credential.from(response, expired, clock.instant(), properties.getExpiryMargin());

            long gen;
            lock.lock();
            try {
                if (superseded(startGeneration, refresh)) {
                    return;
                }
                credential = refreshed;
                state = TokenState.AUTHENTICATED_VALID;
                inFlightRefresh = null;
                gen = ++generation;
            } finally {
                lock.unlock();
            }

            persistOrReport(refreshed, gen);
            metrics.getTokenRefreshSuccess().increment();
            log.info("Access token refreshed: {}", refreshed);
            refresh.complete(refreshed);

        } catch (TokenEndpointException e) {
            if (e.isTransient()) {
                failTransient(startGeneration, refresh, e);
            } else {
                failTerminal(startGeneration, refresh, "Refresh grant rejected: " + e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure during token refresh: {}", e.getMessage(), e);
            failTransient(startGeneration, refresh, e);
        } finally {
            sample.stop(metrics.getTokenRefreshTimer());
            if (!refresh.isDone()) {
                refresh.completeExceptionally(new TransientTokenException("Token refresh did not complete"));
            }
        }
    }

    private void failTransient(long startGeneration, CompletableFuture<Credential> refresh, Exception cause) {
        lock.lock();
        try {
            if (superseded(startGeneration, refresh)) {
                return;
            }
            state = TokenState.AUTHENTICATED_EXPIRED;
            inFlightRefresh = null;
        } finally {
            lock.unlock();
        }
        metrics.getTokenRefreshTransient().increment();
        log.warn("Token refresh failed, will retry on next request: {}", cause.getMessage());
        refresh.completeExceptionally(new TransientTokenException("Token refresh failed: " + cause.getMessage(), cause));
    }

    private void failTerminal(long startGeneration, CompletableFuture<Credential> refresh, String reason) {
        long gen;
        lock.lock();
        try {
            if (superseded(startGeneration, refresh)) {
                return;
            }
            credential = null;
            state = TokenState.UNAUTHENTICATED;
            inFlightRefresh = null;
            gen = ++generation;
        } finally {
            lock.unlock();
        }

        persistOrReport(null, gen);
        metrics.getTokenRefreshTerminal().increment();
        log.error("Credential cleared, reauthorization required: {}", reason);
        // Waiters are released before the alert goes out
        refresh.completeExceptionally(new ReauthorizationRequiredException(reason));
        notificationService.sendReauthorizationAlert(reason);
    }

    private Credential await(CompletableFuture<Credential> refresh) {
        try {
            return refresh.get(properties.getRefreshWaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReauthorizationRequiredException) {
                throw new ReauthorizationRequiredException(cause.getMessage(), cause);
            }
            throw new TransientTokenException(cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransientTokenException("Timed out waiting for the in-flight token refresh", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTokenException("Interrupted while waiting for token refresh", e);
        }
    }

    // ==================== HELPERS ====================

    /**
     * True when a re-authorization replaced the credential while the refresh was running.
     * The new grant wins and is handed to the waiters. Caller holds {@link #lock}.
     */
    private boolean superseded(long startGeneration, CompletableFuture<Credential> refresh) {
        if (generation == startGeneration) {
            return false;
        }
        log.info("Refresh outcome discarded, credential was replaced meanwhile");
        if (credential != null) {
            refresh.complete(credential);
        } else {
            refresh.completeExceptionally(new ReauthorizationRequiredException("Credential was cleared during refresh"));
        }
        return true;
    }

    private void markExpiredIfDue() {
        if (state == TokenState.AUTHENTICATED_VALID && credential.isExpired(clock.instant())) {
            state = TokenState.AUTHENTICATED_EXPIRED;
        }
    }

    private void validateScopes(TokenResponse response) {
        if (!response.hasScope()) {
            // RFC 6749 5.1: omitted scope means the requested scope was granted
            return;
        }
        Set<String> missing = new HashSet<>(properties.getScopes());
        missing.removeAll(response.scopes());
        if (missing.isEmpty()) {
            return;
        }
        if (properties.isRequireAllScopes()) {
            metrics.getAuthorizationRejected().increment();
            throw new AuthorizationRejectedException("Granted scope is missing " + missing);
        }
        log.warn("Granted scope is missing {}, related metrics will stay empty", missing);
    }

    /**
     * Write {@code snapshot} (or clear the file when {@code null}) unless a newer generation
     * was already written.
     *
     * @throws CredentialStoreException the write failed; the in-memory credential stays
     */
    private void persist(Credential snapshot, long gen) {
        persistLock.lock();
        try {
            if (gen <= persistedGeneration) {
                return;
            }
            if (snapshot == null) {
                store.clear();
            } else {
                store.save(snapshot);
            }
            persistedGeneration = gen;
        } finally {
            persistLock.unlock();
        }
    }

    /**
     * Background transitions (refresh, terminal clear) have no operator to tell, so a failed
     * write is only reported.
     */
    private void persistOrReport(Credential snapshot, long gen) {
        try {
            persist(snapshot, gen);
        } catch (CredentialStoreException e) {
            log.error("Credential persistence failed, a restart may need reauthorization: {}", e.getMessage(), e);
        }
    }
}
