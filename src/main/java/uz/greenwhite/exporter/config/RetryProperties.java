package uz.greenwhite.exporter.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token endpoint statuses expected to heal on their own. Other failures (except
 * {@code invalid_grant}) also keep the credential but are logged as configuration errors.
 * Retries themselves are driven by the next scrape, never by a loop here.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "exporter.retry")
public class RetryProperties {

    /**
     * Comma-separated HTTP status codes that are retryable
     * Default: 408,429,500,502,503,504
     */
    private String retryableStatuses = "408,429,500,502,503,504";

    /**
     * Cached set of retryable status codes, parsed once at startup
     */
    private Set<Integer> retryableStatusSet;

    @PostConstruct
    public void init() {
        this.retryableStatusSet = Collections.unmodifiableSet(
                Arrays.stream(retryableStatuses.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(Integer::parseInt)
                        .collect(Collectors.toSet())
        );
    }

    /**
     * Check if HTTP status is retryable
     */
    public boolean isRetryable(int httpStatus) {
        if (retryableStatusSet == null) {
            init();
        }
        return retryableStatusSet.contains(httpStatus);
    }
}
