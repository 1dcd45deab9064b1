package uz.greenwhite.exporter.oauth2.client;

import uz.greenwhite.exporter.oauth2.OAuth2Properties;
import uz.greenwhite.exporter.oauth2.model.TokenResponse;

import java.net.URI;

public interface OAuth2Client {

    /**
     * Client name, must match "exporter.oauth2.type" in application.yml
     * Example: "mercedes"
     */
    String getName();

    /**
     * Vendor consent page for the given anti-forgery state
     */
    URI buildAuthorizationUri(OAuth2Properties properties, String state);

    /**
     * Exchange a one-time authorization code (authorization_code grant)
     *
     * @throws uz.greenwhite.exporter.oauth2.exception.TokenEndpointException classified failure
     */
    TokenResponse exchangeAuthorizationCode(OAuth2Properties properties, String code);

    /**
     * Refresh existing credential (refresh_token grant)
     *
     * @throws uz.greenwhite.exporter.oauth2.exception.TokenEndpointException classified failure
     */
    TokenResponse refreshAccessToken(OAuth2Properties properties, String refreshToken);
}
