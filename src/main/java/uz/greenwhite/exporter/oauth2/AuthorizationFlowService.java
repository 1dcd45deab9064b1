package uz.greenwhite.exporter.oauth2;

import lombok.extern.slf4j.Slf4j;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.oauth2.client.OAuth2Client;
import uz.greenwhite.exporter.oauth2.exception.AuthorizationRejectedException;
import uz.greenwhite.exporter.oauth2.exception.StateMismatchException;
import uz.greenwhite.exporter.oauth2.model.Credential;
import uz.greenwhite.exporter.oauth2.model.PendingAuthorization;
import uz.greenwhite.exporter.oauth2.model.TokenStatus;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Browser consent step. Holds at most one pending attempt; starting a new one replaces it.
 */
@Slf4j
public class AuthorizationFlowService {

    private static final int STATE_BYTES = 32;

    private final TokenManager tokenManager;
    private final OAuth2Client client;
    private final OAuth2Properties properties;
    private final ExporterMetrics metrics;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    private final AtomicReference<PendingAuthorization> pending = new AtomicReference<>();

    public AuthorizationFlowService(TokenManager tokenManager,
                                    OAuth2Client client,
                                    OAuth2Properties properties,
                                    ExporterMetrics metrics,
                                    Clock clock) {
        this.tokenManager = tokenManager;
        this.client = client;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start a consent attempt and return the vendor URL the browser must be sent to.
     */
    public URI begin() {
        String state = generateState();
        Instant now = clock.instant();
        URI authorizationUri = client.buildAuthorizationUri(properties, state);

        PendingAuthorization previous = pending.getAndSet(new PendingAuthorization(
                state, authorizationUri, now, now.plus(properties.getPendingAuthorizationTtl())));
        if (previous != null && !previous.isExpired(now)) {
            log.info("Replacing unfinished authorization attempt started at {}", previous.createdAt());
        }
        log.info("Authorization attempt started, valid for {}", properties.getPendingAuthorizationTtl());
        return authorizationUri;
    }

    /**
     * Finish the attempt started by {@link #begin()}. The state is checked before anything
     * else; on mismatch the token endpoint is never called.
     *
     * @param error vendor error from the redirect (e.g. access_denied), or {@code null}
     * @throws StateMismatchException         no attempt pending, attempt expired, or state differs
     * @throws AuthorizationRejectedException the vendor or the operator refused the grant
     */
    public Credential complete(String code, String state, String error, String errorDescription) {
        PendingAuthorization current = pending.get();
        if (current == null) {
            metrics.getAuthorizationCsrf().increment();
            log.warn("Authorization callback without a pending attempt");
            throw new StateMismatchException("No authorization attempt is pending, start again at /oauth.auth");
        }
        if (!stateMatches(current.state(), state)) {
            metrics.getAuthorizationCsrf().increment();
            log.warn("Authorization callback state does not match the pending attempt");
            throw new StateMismatchException("Authorization state mismatch");
        }
        if (!pending.compareAndSet(current, null)) {
            metrics.getAuthorizationCsrf().increment();
            throw new StateMismatchException("Authorization attempt was already completed");
        }
        if (current.isExpired(clock.instant())) {
            metrics.getAuthorizationCsrf().increment();
            log.warn("Authorization callback arrived after the attempt expired at {}", current.expiresAt());
            throw new StateMismatchException("Authorization attempt expired, start again at /oauth.auth");
        }

        if (error != null && !error.isBlank()) {
            metrics.getAuthorizationRejected().increment();
            String message = errorDescription != null ? error + ": " + errorDescription : error;
            log.warn("Authorization refused at consent page: {}", message);
            throw new AuthorizationRejectedException(message);
        }
        if (code == null || code.isBlank()) {
            metrics.getAuthorizationRejected().increment();
            throw new AuthorizationRejectedException("Authorization callback carried no code");
        }

        return tokenManager.completeAuthorization(code);
    }

    public boolean isPending() {
        PendingAuthorization current = pending.get();
        return current != null && !current.isExpired(clock.instant());
    }

    public TokenStatus getStatus() {
        return tokenManager.getStatus(isPending());
    }

    private String generateState() {
        byte[] bytes = new byte[STATE_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean stateMatches(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
