package uz.greenwhite.exporter.oauth2.exception;

/**
 * TRANSIENT_NETWORK: endpoint unreachable or temporarily failing, credential kept.
 * TERMINAL_GRANT: grant revoked or invalid, operator must re-authorize.
 * CSRF_MISMATCH: callback state did not match the pending attempt.
 * CORRUPT_STATE: persisted credential could not be read.
 */
public enum OAuth2ErrorType {
    TRANSIENT_NETWORK,
    TERMINAL_GRANT,
    CSRF_MISMATCH,
    CORRUPT_STATE
}
