package uz.greenwhite.exporter.oauth2.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import uz.greenwhite.exporter.config.RetryProperties;
import uz.greenwhite.exporter.oauth2.GrantType;
import uz.greenwhite.exporter.oauth2.OAuth2Properties;
import uz.greenwhite.exporter.oauth2.exception.OAuth2ErrorType;
import uz.greenwhite.exporter.oauth2.exception.TokenEndpointException;
import uz.greenwhite.exporter.oauth2.model.OAuth2TokenRequest;
import uz.greenwhite.exporter.oauth2.model.TokenResponse;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Mercedes-Benz identity provider: form-encoded grants, client credentials in HTTP Basic auth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MercedesOAuth2Client implements OAuth2Client {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryProperties retryProperties;

    private static final String NAME = "mercedes";
    private static final String INVALID_GRANT = "invalid_grant";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public URI buildAuthorizationUri(OAuth2Properties properties, String state) {
        return UriComponentsBuilder.fromHttpUrl(properties.getAuthorizationUrl())
                .queryParam("response_type", "code")
                .queryParam("client_id", properties.getClientId())
                .queryParam("redirect_uri", properties.getRedirectUri())
                .queryParam("scope", String.join(" ", properties.getScopes()))
                .queryParam("state", state)
                .encode()
                .build()
                .toUri();
    }

    @Override
    public TokenResponse exchangeAuthorizationCode(OAuth2Properties properties, String code) {
        OAuth2TokenRequest body = OAuth2TokenRequest.builder()
                .grantType(GrantType.AUTHORIZATION_CODE)
                .code(code)
                .redirectUri(properties.getRedirectUri())
                .build();

        return sendTokenRequest(properties, body);
    }

    @Override
    public TokenResponse refreshAccessToken(OAuth2Properties properties, String refreshToken) {
        OAuth2TokenRequest body = OAuth2TokenRequest.builder()
                .grantType(GrantType.REFRESH_TOKEN)
                .refreshToken(refreshToken)
                .build();

        return sendTokenRequest(properties, body);
    }

    private TokenResponse sendTokenRequest(OAuth2Properties properties, OAuth2TokenRequest body) {
        String responseBody;
        try {
            responseBody = webClient.post()
                    .uri(properties.getTokenUrl())
                    .headers(h -> {
                        h.setBasicAuth(properties.getClientId(), properties.getClientSecret(), StandardCharsets.UTF_8);
                        h.setAccept(List.of(MediaType.APPLICATION_JSON));
                    })
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(body.toFormData()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTokenTimeout())
                    .block();
        } catch (WebClientResponseException e) {
            throw classifyErrorResponse(body.getGrantType(), e);
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof TimeoutException
                    ? "token endpoint did not answer within " + properties.getTokenTimeout()
                    : cause.getMessage();
            log.warn("{} grant failed before a response arrived: {}", body.getGrantType().getValue(), reason);
            throw new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 0, null, reason, cause);
        }

        return parseToken(responseBody);
    }

    /**
     * Only {@code invalid_grant} means the grant itself is dead. Any other answer (wrong token URL,
     * bad client secret, proxy error page, vendor outage) keeps the refresh token so fixing the
     * configuration does not require a new consent.
     */
    private TokenEndpointException classifyErrorResponse(GrantType grantType, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String error = null;
        String description = null;
        try {
            JsonNode json = objectMapper.readTree(e.getResponseBodyAsString());
            if (json != null && json.hasNonNull("error")) {
                error = json.get("error").asText();
                description = json.hasNonNull("error_description") ? json.get("error_description").asText() : null;
            }
        } catch (Exception parseError) {
            log.debug("Token endpoint error body is not JSON: {}", parseError.getMessage());
        }

        OAuth2ErrorType type = INVALID_GRANT.equals(error)
                ? OAuth2ErrorType.TERMINAL_GRANT
                : OAuth2ErrorType.TRANSIENT_NETWORK;

        if (type == OAuth2ErrorType.TRANSIENT_NETWORK && !retryProperties.isRetryable(status)) {
            log.error("{} grant failed with status={}, error={}; check token-url and client credentials, "
                    + "credential kept", grantType.getValue(), status, error);
        } else {
            log.warn("{} grant rejected: status={}, error={}, classified as {}",
                    grantType.getValue(), status, error, type);
        }
        return new TokenEndpointException(type, status,
                error != null ? error : e.getStatusText(), description, e);
    }

    private TokenResponse parseToken(String responseBody) {
        JsonNode json;
        try {
            json = responseBody != null ? objectMapper.readTree(responseBody) : null;
        } catch (Exception e) {
            log.error("Failed to parse OAuth2 token response: {}", e.getMessage());
            throw new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 200, null,
                    "unparseable token response", e);
        }

        if (json == null || !json.hasNonNull("access_token") || json.get("access_token").asText().isBlank()) {
            throw new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 200, null,
                    "token response without access_token", null);
        }

        return new TokenResponse(
                json.get("access_token").asText(),
                json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null,
                json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : null,
                json.hasNonNull("scope") ? json.get("scope").asText() : null,
                json.hasNonNull("token_type") ? json.get("token_type").asText() : null
        );
    }
}
