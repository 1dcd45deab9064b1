package uz.greenwhite.exporter.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnProperty(name = "exporter.telegram.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpNotificationService implements NotificationService {

    public NoOpNotificationService() {
        log.info("Telegram notification DISABLED, reauthorization alerts will only be logged");
    }

    @Override
    public void sendReauthorizationAlert(String reason) {
        log.warn("Reauthorization required (no notification configured): {}", reason);
    }
}
