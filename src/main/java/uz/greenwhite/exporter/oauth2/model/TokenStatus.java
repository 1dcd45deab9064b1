package uz.greenwhite.exporter.oauth2.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import uz.greenwhite.exporter.oauth2.TokenState;

import java.time.Instant;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenStatus(TokenState state,
                          Instant expiresAt,
                          Set<String> scope,
                          boolean refreshTokenPresent,
                          boolean authorizationPending) {
}
