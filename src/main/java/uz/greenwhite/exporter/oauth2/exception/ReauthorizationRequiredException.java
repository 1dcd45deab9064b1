package uz.greenwhite.exporter.oauth2.exception;

public class ReauthorizationRequiredException extends TokenException {

    public ReauthorizationRequiredException(String message) {
        super(OAuth2ErrorType.TERMINAL_GRANT, message);
    }

    public ReauthorizationRequiredException(String message, Throwable cause) {
        super(OAuth2ErrorType.TERMINAL_GRANT, message, cause);
    }
}
