package uz.greenwhite.exporter.oauth2;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.exporter.oauth2.model.Credential;
import uz.greenwhite.exporter.oauth2.model.TokenStatus;

import java.net.URI;

@Slf4j
@RestController
@RequiredArgsConstructor
public class OAuth2AuthorizationController {

    private final AuthorizationFlowService authorizationFlowService;

    /**
     * Start browser consent
     *
     * GET http://localhost:8080/oauth.auth  →  302 to the vendor consent page
     */
    @GetMapping("/oauth.auth")
    public ResponseEntity<Void> authorize() {
        URI location = authorizationFlowService.begin();
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, location.toString())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .build();
    }

    /**
     * Vendor redirect target
     *
     * GET http://localhost:8080/oauth.redirect?code=...&state=...
     * 200 when the credential is stored, 400 on state mismatch or vendor rejection,
     * 502 when the token endpoint is unreachable, 500 when the credential cannot be written
     */
    @GetMapping("/oauth.redirect")
    public ResponseEntity<String> redirect(@RequestParam(required = false) String code,
                                           @RequestParam(required = false) String state,
                                           @RequestParam(required = false) String error,
                                           @RequestParam(name = "error_description", required = false) String errorDescription) {
        Credential credential = authorizationFlowService.complete(code, state, error, errorDescription);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body("Authorized, access token valid until " + credential.expiresAt());
    }

    /**
     * Credential state for operators. Never contains token values.
     *
     * GET http://localhost:8080/oauth.status
     *
     * Response:
     * {
     *   "state": "AUTHENTICATED_VALID",
     *   "expiresAt": "2024-05-01T10:15:30Z",
     *   "scope": ["mb:vehicle:mbdata:evstatus", "offline_access"],
     *   "refreshTokenPresent": true,
     *   "authorizationPending": false
     * }
     */
    @GetMapping("/oauth.status")
    public ResponseEntity<TokenStatus> status() {
        return ResponseEntity.ok(authorizationFlowService.getStatus());
    }
}
