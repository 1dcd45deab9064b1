package uz.greenwhite.exporter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exporter self-metrics. These stay exposed when no vehicle data can be fetched.
 *
 * Naming convention:
 *   mb.exporter.{area}.{metric_type}
 *
 * Tags:
 *   result    = success | transient | terminal | rejected | csrf
 *   operation = load | save | clear
 */
@Slf4j
@Getter
@Component
public class ExporterMetrics {

    private final MeterRegistry registry;

    private final AtomicInteger authStatus = new AtomicInteger(AuthStatus.UNAUTHENTICATED.getGaugeValue());

    // ==================== Token refresh ====================
    private final Timer tokenRefreshTimer;
    private final Counter tokenRefreshSuccess;
    private final Counter tokenRefreshTransient;
    private final Counter tokenRefreshTerminal;

    // ==================== Authorization ====================
    private final Counter authorizationSuccess;
    private final Counter authorizationRejected;
    private final Counter authorizationCsrf;

    // ==================== Scrape ====================
    private final Timer scrapeTimer;

    public ExporterMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("mb.exporter.auth.status", authStatus, AtomicInteger::get)
                .description("0: reauthorization required, 1: authenticated, 2: token temporarily unavailable")
                .register(registry);

        // ==================== Token refresh ====================

        this.tokenRefreshTimer = Timer.builder("mb.exporter.token.refresh.duration")
                .description("Time spent in refresh_token grants")
                .register(registry);

        this.tokenRefreshSuccess = Counter.builder("mb.exporter.token.refresh")
                .description("Successful token refreshes")
                .tag("result", "success")
                .register(registry);

        this.tokenRefreshTransient = Counter.builder("mb.exporter.token.refresh")
                .description("Token refreshes failed with a retryable error")
                .tag("result", "transient")
                .register(registry);

        this.tokenRefreshTerminal = Counter.builder("mb.exporter.token.refresh")
                .description("Token refreshes rejected, credential cleared")
                .tag("result", "terminal")
                .register(registry);

        // ==================== Authorization ====================

        this.authorizationSuccess = Counter.builder("mb.exporter.authorization")
                .description("Completed browser authorizations")
                .tag("result", "success")
                .register(registry);

        this.authorizationRejected = Counter.builder("mb.exporter.authorization")
                .description("Authorization codes rejected by the vendor")
                .tag("result", "rejected")
                .register(registry);

        this.authorizationCsrf = Counter.builder("mb.exporter.authorization")
                .description("Authorization callbacks with a mismatching state")
                .tag("result", "csrf")
                .register(registry);

        // ==================== Scrape ====================

        this.scrapeTimer = Timer.builder("mb.exporter.scrape.duration")
                .description("Time spent collecting vehicle data for one scrape")
                .register(registry);

        log.info("Exporter metrics registered");
    }

    // ==================== Convenience Methods ====================

    public void setAuthStatus(AuthStatus status) {
        authStatus.set(status.getGaugeValue());
    }

    public void recordStoreError(String operation) {
        Counter.builder("mb.exporter.credential.store.errors")
                .description("Credential file failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Record vehicle API result per container and status code
     */
    public void recordVehicleApiResult(String container, int statusCode) {
        Counter.builder("mb.exporter.vehicle.api.requests")
                .description("Vehicle data API calls")
                .tag("container", container)
                .tag("status", statusCode > 0 ? String.valueOf(statusCode) : "error")
                .register(registry)
                .increment();
    }
}
