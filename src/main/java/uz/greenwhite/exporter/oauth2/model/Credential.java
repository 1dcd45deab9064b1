package uz.greenwhite.exporter.oauth2.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The single live OAuth2 credential. Immutable; every exchange produces a new instance.
 * {@code expiresAt} already has the safety margin subtracted.
 */
public record Credential(String accessToken,
                         String refreshToken,
                         Instant expiresAt,
                         Set<String> scope,
                         String tokenType) {

    public Credential {
        Objects.requireNonNull(accessToken, "accessToken is null");
        Objects.requireNonNull(expiresAt, "expiresAt is null");
        scope = scope == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(scope));
    }

    /**
     * Build the credential for a token endpoint answer.
     *
     * @param previous credential being refreshed, or {@code null} for a code exchange;
     *                 its refresh token and scope survive when the answer omits them
     */
    public static Credential from(TokenResponse response, Credential previous, Instant now, Duration margin) {
        long expiresIn = response.expiresIn() != null ? response.expiresIn() : 0L;
        Instant expiresAt = now.plusSeconds(expiresIn).minus(margin);
        if (expiresAt.isBefore(now)) {
            expiresAt = now;
        }

        String refreshToken = response.refreshToken();
        if ((refreshToken == null || refreshToken.isBlank()) && previous != null) {
            refreshToken = previous.refreshToken();
        }

        Set<String> scope = response.scopes();
        if (!response.hasScope() && previous != null) {
            scope = previous.scope();
        }

        String tokenType = response.tokenType() != null ? response.tokenType() : "Bearer";
        return new Credential(response.accessToken(), refreshToken, expiresAt, scope, tokenType);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "Credential[expiresAt=" + expiresAt + ", scope=" + scope
                + ", refreshToken=" + (hasRefreshToken() ? "present" : "absent") + "]";
    }
}
