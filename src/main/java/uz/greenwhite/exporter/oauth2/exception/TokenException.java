package uz.greenwhite.exporter.oauth2.exception;

import lombok.Getter;

/**
 * Base for every credential lifecycle failure. Carries the classification only;
 * vendor response bodies never travel past the token client.
 */
@Getter
public class TokenException extends RuntimeException {

    private final OAuth2ErrorType type;

    public TokenException(OAuth2ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public TokenException(OAuth2ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }
}
