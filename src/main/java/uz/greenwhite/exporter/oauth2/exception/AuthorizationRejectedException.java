package uz.greenwhite.exporter.oauth2.exception;

/**
 * The vendor refused to turn an authorization code into tokens.
 * The message is the vendor's own error text; codes are single-use so this is never retried.
 */
public class AuthorizationRejectedException extends TokenException {

    public AuthorizationRejectedException(String message) {
        super(OAuth2ErrorType.TERMINAL_GRANT, message);
    }

    public AuthorizationRejectedException(String message, Throwable cause) {
        super(OAuth2ErrorType.TERMINAL_GRANT, message, cause);
    }
}
