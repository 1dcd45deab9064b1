package uz.greenwhite.exporter.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import uz.greenwhite.exporter.config.HttpProperties;
import uz.greenwhite.exporter.config.TelegramProperties;
import uz.greenwhite.exporter.config.VehicleProperties;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@ConditionalOnProperty(name = "exporter.telegram.enabled", havingValue = "true")
public class TelegramNotificationService implements NotificationService {

    private final TelegramProperties properties;
    private final VehicleProperties vehicleProperties;
    private final RestTemplate restTemplate;
    private static final String TELEGRAM_API = "https://api.telegram.org/bot%s/sendMessage";
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public TelegramNotificationService(TelegramProperties properties,
                                       VehicleProperties vehicleProperties,
                                       HttpProperties httpProperties,
                                       RestTemplateBuilder restTemplateBuilder) {
        this.properties = properties;
        this.vehicleProperties = vehicleProperties;
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(httpProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(httpProperties.getReadTimeoutMs()))
                .build();
        log.info("Telegram notification ENABLED: chatId={}", properties.getChatId());
    }

    @Override
    public void sendReauthorizationAlert(String reason) {
        try {
            sendMessage(formatMessage(reason));
            log.info("Reauthorization alert sent to Telegram");
        } catch (Exception e) {
            log.error("Failed to send reauthorization alert to Telegram: {}", e.getMessage());
        }
    }

    private String formatMessage(String reason) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔴 <b>REAUTHORIZATION REQUIRED</b>\n\n");
        sb.append("🚗 <b>Vehicle:</b> <code>").append(escapeHtml(vehicleProperties.getVin())).append("</code>\n");
        sb.append("❌ <b>Reason:</b> ").append(escapeHtml(truncate(reason, 200))).append("\n");
        sb.append("🕐 <b>Time:</b> ").append(LocalDateTime.now().format(FORMATTER)).append("\n");
        sb.append("Open /oauth.auth on the exporter to authorize again.");
        return sb.toString();
    }

    private void sendMessage(String text) {
        String url = String.format(TELEGRAM_API, properties.getBotToken());

        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", properties.getChatId());
        body.put("text", text);
        body.put("parse_mode", "HTML");

        if (properties.getMessageThreadId() != null) {
            body.put("message_thread_id", properties.getMessageThreadId());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
    }

    private String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }
}
