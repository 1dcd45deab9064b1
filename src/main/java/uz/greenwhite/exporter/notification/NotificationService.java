package uz.greenwhite.exporter.notification;

public interface NotificationService {

    /**
     * Tell the operator the credential is gone and /oauth.auth must be visited again
     */
    void sendReauthorizationAlert(String reason);
}
