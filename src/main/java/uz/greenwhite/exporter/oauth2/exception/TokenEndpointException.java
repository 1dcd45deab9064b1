package uz.greenwhite.exporter.oauth2.exception;

import lombok.Getter;

/**
 * Classified failure of a single token endpoint call.
 */
@Getter
public class TokenEndpointException extends TokenException {

    private final int httpStatus;
    private final String error;
    private final String errorDescription;

    public TokenEndpointException(OAuth2ErrorType type, int httpStatus, String error,
                                  String errorDescription, Throwable cause) {
        super(type, buildMessage(httpStatus, error, errorDescription), cause);
        this.httpStatus = httpStatus;
        this.error = error;
        this.errorDescription = errorDescription;
    }

    public boolean isTransient() {
        return getType() == OAuth2ErrorType.TRANSIENT_NETWORK;
    }

    private static String buildMessage(int httpStatus, String error, String errorDescription) {
        StringBuilder sb = new StringBuilder();
        if (error != null) {
            sb.append(error);
            if (errorDescription != null && !errorDescription.isBlank()) {
                sb.append(": ").append(errorDescription);
            }
        } else if (errorDescription != null && !errorDescription.isBlank()) {
            sb.append(errorDescription);
        } else {
            sb.append("token endpoint call failed");
        }
        if (httpStatus > 0) {
            sb.append(" (HTTP ").append(httpStatus).append(")");
        }
        return sb.toString();
    }
}
