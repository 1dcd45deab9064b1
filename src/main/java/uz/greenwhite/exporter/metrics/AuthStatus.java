package uz.greenwhite.exporter.metrics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Value of the {@code mb_exporter_auth_status} gauge.
 */
@Getter
@RequiredArgsConstructor
public enum AuthStatus {

    UNAUTHENTICATED(0),
    AUTHENTICATED(1),
    TOKEN_UNAVAILABLE(2);

    private final int gaugeValue;
}
