package uz.greenwhite.exporter.vehicle;

import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.exporter.metrics.AuthStatus;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.metrics.VehicleGauges;
import uz.greenwhite.exporter.oauth2.TokenManager;
import uz.greenwhite.exporter.oauth2.exception.ReauthorizationRequiredException;
import uz.greenwhite.exporter.oauth2.exception.TokenException;
import uz.greenwhite.exporter.vehicle.model.ContainerResponse;
import uz.greenwhite.exporter.vehicle.model.ResourceSample;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Refreshes vehicle gauges on each scrape. Containers are only called once their hourly
 * budget allows it; in between the previous values are served.
 */
@Slf4j
@Component
public class VehicleMetricsCollector {

    private final TokenManager tokenManager;
    private final VehicleDataClient vehicleDataClient;
    private final VehicleGauges vehicleGauges;
    private final ExporterMetrics metrics;
    private final Clock clock;

    private final ReentrantLock collectLock = new ReentrantLock();
    private final Map<VehicleContainer, Instant> lastFetched = new EnumMap<>(VehicleContainer.class);

    public VehicleMetricsCollector(TokenManager tokenManager,
                                   VehicleDataClient vehicleDataClient,
                                   VehicleGauges vehicleGauges,
                                   ExporterMetrics metrics,
                                   Clock clock) {
        this.tokenManager = tokenManager;
        this.vehicleDataClient = vehicleDataClient;
        this.vehicleGauges = vehicleGauges;
        this.metrics = metrics;
        this.clock = clock;
    }

    public AuthStatus collect() {
        collectLock.lock();
        Timer.Sample sample = Timer.start(metrics.getRegistry());
        try {
            return doCollect();
        } finally {
            sample.stop(metrics.getScrapeTimer());
            collectLock.unlock();
        }
    }

    private AuthStatus doCollect() {
        String token;
        try {
            token = tokenManager.getValidToken();
        } catch (TokenException e) {
            return degrade(e);
        }
        metrics.setAuthStatus(AuthStatus.AUTHENTICATED);

        boolean forcedRefresh = false;
        Instant now = clock.instant();
        for (VehicleContainer container : VehicleContainer.values()) {
            if (!isDue(container, now)) {
                continue;
            }

            ContainerResponse response = vehicleDataClient.fetch(container, token);
            if (response.isUnauthorized() && !forcedRefresh) {
                // Only one forced refresh per scrape, a second 401 is just logged
                forcedRefresh = true;
                try {
                    token = tokenManager.forceRefresh(token);
                } catch (TokenException e) {
                    return degrade(e);
                }
                response = vehicleDataClient.fetch(container, token);
            }
            apply(response, now);
        }
        return AuthStatus.AUTHENTICATED;
    }

    /**
     * Drops vehicle gauges but keeps the per-container fetch times, so a token outage never
     * earns extra vendor calls. Gauges come back as containers become due again.
     */
    private AuthStatus degrade(TokenException e) {
        AuthStatus status = e instanceof ReauthorizationRequiredException
                ? AuthStatus.UNAUTHENTICATED
                : AuthStatus.TOKEN_UNAVAILABLE;
        metrics.setAuthStatus(status);
        vehicleGauges.clear();
        log.warn("No vehicle data this scrape [{}]: {}", e.getType(), e.getMessage());
        return status;
    }

    private boolean isDue(VehicleContainer container, Instant now) {
        Instant last = lastFetched.get(container);
        return last == null || !now.isBefore(last.plus(container.getMinInterval()));
    }

    private void apply(ContainerResponse response, Instant now) {
        VehicleContainer container = response.container();

        if (response.isOk()) {
            Map<String, VehicleResource> expected = new HashMap<>();
            container.getResources().forEach(r -> expected.put(r.getResourceName(), r));

            for (ResourceSample sample : response.samples()) {
                VehicleResource resource = expected.remove(sample.resourceName());
                if (resource == null) {
                    log.warn("Unexpected resource {} in container {}", sample.resourceName(), container.getPath());
                    continue;
                }
                try {
                    Instant measuredAt = sample.timestamp() != null ? Instant.ofEpochMilli(sample.timestamp()) : null;
                    vehicleGauges.recordValue(resource, resource.mapValue(sample.value()), measuredAt, now);
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring value of {}: {}", sample.resourceName(), e.getMessage());
                    vehicleGauges.recordNoNewValue(resource, now);
                }
            }
            expected.values().forEach(r -> vehicleGauges.recordNoNewValue(r, now));
            lastFetched.put(container, now);

        } else if (response.isNoContent() || response.isRateLimited()) {
            container.getResources().forEach(r -> vehicleGauges.recordNoNewValue(r, now));
            lastFetched.put(container, now);

        } else {
            log.error("Unexpected status code {} during requesting {}. Response text {}",
                    response.httpStatus(), container.getPath(), response.errorMessage());
        }
    }
}
