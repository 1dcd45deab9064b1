package uz.greenwhite.exporter.oauth2.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Successful token endpoint answer. {@code refreshToken}, {@code scope} and {@code expiresIn}
 * are optional on the wire and stay {@code null} when absent.
 */
public record TokenResponse(String accessToken,
                            String refreshToken,
                            Long expiresIn,
                            String scope,
                            String tokenType) {

    public boolean hasScope() {
        return scope != null && !scope.isBlank();
    }

    public Set<String> scopes() {
        return parseScopes(scope);
    }

    public static Set<String> parseScopes(String scope) {
        if (scope == null || scope.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public String toString() {
        return "TokenResponse[expiresIn=" + expiresIn + ", scope=" + scope
                + ", refreshToken=" + (refreshToken != null ? "present" : "absent") + "]";
    }
}
