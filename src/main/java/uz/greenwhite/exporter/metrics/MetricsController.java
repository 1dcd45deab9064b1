package uz.greenwhite.exporter.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.exporter.vehicle.VehicleMetricsCollector;

@Slf4j
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final VehicleMetricsCollector collector;
    private final PrometheusMeterRegistry prometheusRegistry;

    /**
     * Prometheus scrape target. Always 200: a missing or stale token shows up in
     * mb_exporter_auth_status, not as a failed scrape.
     *
     * GET http://localhost:8080/metrics
     */
    @GetMapping("/metrics")
    public ResponseEntity<String> metrics(@RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        try {
            collector.collect();
        } catch (Exception e) {
            log.error("Vehicle data collection failed: {}", e.getMessage(), e);
        }

        String contentType = TextFormat.chooseContentType(accept);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(prometheusRegistry.scrape(contentType));
    }
}
