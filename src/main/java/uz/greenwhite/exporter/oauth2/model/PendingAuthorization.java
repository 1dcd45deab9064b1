package uz.greenwhite.exporter.oauth2.model;

import java.net.URI;
import java.time.Instant;

/**
 * The one outstanding browser consent attempt.
 */
public record PendingAuthorization(String state, URI authorizationUri, Instant createdAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
