package uz.greenwhite.exporter.oauth2.exception;

public class StateMismatchException extends TokenException {

    public StateMismatchException(String message) {
        super(OAuth2ErrorType.CSRF_MISMATCH, message);
    }
}
