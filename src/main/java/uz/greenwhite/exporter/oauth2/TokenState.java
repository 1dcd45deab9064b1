package uz.greenwhite.exporter.oauth2;

public enum TokenState {
    UNAUTHENTICATED,
    AUTHENTICATED_VALID,
    AUTHENTICATED_EXPIRED,
    REFRESHING
}
