package uz.greenwhite.exporter.oauth2;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uz.greenwhite.exporter.oauth2.exception.AuthorizationRejectedException;
import uz.greenwhite.exporter.oauth2.exception.CredentialStoreException;
import uz.greenwhite.exporter.oauth2.exception.ReauthorizationRequiredException;
import uz.greenwhite.exporter.oauth2.exception.StateMismatchException;
import uz.greenwhite.exporter.oauth2.exception.TokenException;
import uz.greenwhite.exporter.oauth2.exception.TransientTokenException;

@Slf4j
@RestControllerAdvice(assignableTypes = OAuth2AuthorizationController.class)
public class OAuth2ExceptionHandler {

    @ExceptionHandler(StateMismatchException.class)
    public ResponseEntity<String> handleStateMismatch(StateMismatchException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({AuthorizationRejectedException.class, ReauthorizationRequiredException.class})
    public ResponseEntity<String> handleRejected(TokenException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(TransientTokenException.class)
    public ResponseEntity<String> handleTransient(TransientTokenException ex) {
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(CredentialStoreException.class)
    public ResponseEntity<String> handleStoreFailure(CredentialStoreException ex) {
        log.error("OAuth2 callback could not persist the credential: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body("Authorized, but the credential could not be saved (" + ex.getMessage()
                        + "). Fix the state file location and authorize again.");
    }

    private ResponseEntity<String> respond(HttpStatus status, TokenException ex) {
        log.warn("OAuth2 callback failed [{}]: {}", ex.getType(), ex.getMessage());
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(ex.getType() + ": " + ex.getMessage());
    }
}
