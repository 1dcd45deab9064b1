package uz.greenwhite.exporter.oauth2;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Data
@ConfigurationProperties(prefix = "exporter.oauth2")
public class OAuth2Properties {

    /**
     * Token client implementation, must match an {@code OAuth2Client#getName()}
     */
    private String type = "mercedes";

    private String authorizationUrl;
    private String tokenUrl;
    private String clientId;
    private String clientSecret;
    private String redirectUri;
    private List<String> scopes = new ArrayList<>();

    /**
     * Subtracted from expires_in so a token counts as expired before the vendor's deadline
     */
    private Duration expiryMargin = Duration.ofSeconds(30);

    /**
     * Bound on a single token endpoint call
     */
    private Duration tokenTimeout = Duration.ofSeconds(30);

    /**
     * Bound on waiting for a refresh started by another caller
     */
    private Duration refreshWaitTimeout = Duration.ofSeconds(45);

    /**
     * Lifetime of the anti-forgery state handed out by /oauth.auth
     */
    private Duration pendingAuthorizationTtl = Duration.ofMinutes(10);

    /**
     * Reject code exchanges that grant fewer scopes than requested
     */
    private boolean requireAllScopes = false;

    /**
     * Persisted credential
     */
    private String stateFile = "state.json";

    @PostConstruct
    public void validate() {
        requireText(authorizationUrl, "authorization-url");
        requireText(tokenUrl, "token-url");
        requireText(clientId, "client-id");
        requireText(clientSecret, "client-secret");
        requireText(redirectUri, "redirect-uri");
        requireText(stateFile, "state-file");
        if (scopes == null || scopes.isEmpty()) {
            throw new IllegalArgumentException("exporter.oauth2.scopes must not be empty");
        }
        if (expiryMargin.isNegative()) {
            throw new IllegalArgumentException("exporter.oauth2.expiry-margin must be >= 0");
        }
        if (tokenTimeout.isZero() || tokenTimeout.isNegative()) {
            throw new IllegalArgumentException("exporter.oauth2.token-timeout must be > 0");
        }
        if (refreshWaitTimeout.compareTo(tokenTimeout) < 0) {
            throw new IllegalArgumentException("exporter.oauth2.refresh-wait-timeout must be >= token-timeout");
        }

        log.info("OAuth2 config: type={}, tokenUrl={}, scopes={}, expiryMargin={}, tokenTimeout={}",
                type, tokenUrl, scopes, expiryMargin, tokenTimeout);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("exporter.oauth2." + name + " must be set");
        }
    }
}
