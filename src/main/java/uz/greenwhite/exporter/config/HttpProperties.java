package uz.greenwhite.exporter.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Slf4j
@Getter
@Setter
@ConfigurationProperties(prefix = "exporter.http")
public class HttpProperties {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
    private int writeTimeoutMs = 30000;

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("exporter.http.connect-timeout-ms must be > 0");
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("exporter.http.read-timeout-ms must be > 0");
        }
        if (writeTimeoutMs <= 0) {
            throw new IllegalArgumentException("exporter.http.write-timeout-ms must be > 0");
        }

        log.info("HTTP client config: connect={}ms, read={}ms, write={}ms",
                connectTimeoutMs, readTimeoutMs, writeTimeoutMs);
    }
}
