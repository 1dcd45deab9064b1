package uz.greenwhite.exporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "exporter.telegram")
public class TelegramProperties {

    private boolean enabled = false;
    private String botToken;
    private Long chatId;
    private Integer messageThreadId;
}
