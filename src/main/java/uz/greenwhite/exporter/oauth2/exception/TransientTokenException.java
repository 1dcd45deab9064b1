package uz.greenwhite.exporter.oauth2.exception;

public class TransientTokenException extends TokenException {

    public TransientTokenException(String message) {
        super(OAuth2ErrorType.TRANSIENT_NETWORK, message);
    }

    public TransientTokenException(String message, Throwable cause) {
        super(OAuth2ErrorType.TRANSIENT_NETWORK, message, cause);
    }
}
