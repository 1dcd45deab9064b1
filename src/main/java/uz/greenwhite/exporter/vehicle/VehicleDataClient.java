package uz.greenwhite.exporter.vehicle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import uz.greenwhite.exporter.config.VehicleProperties;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.vehicle.model.ContainerResponse;
import uz.greenwhite.exporter.vehicle.model.ResourceSample;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class VehicleDataClient {

    static final String CIRCUIT_BREAKER_NAME = "vehicle-api";
    private static final MediaType VEHICLE_JSON = MediaType.parseMediaType("application/json;charset=utf-8");

    private final WebClient webClient;
    private final VehicleProperties properties;
    private final ObjectMapper objectMapper;
    private final ExporterMetrics metrics;
    private final CircuitBreaker circuitBreaker;

    public VehicleDataClient(WebClient webClient,
                             VehicleProperties properties,
                             ObjectMapper objectMapper,
                             ExporterMetrics metrics,
                             CircuitBreakerRegistry circuitBreakerRegistry) {
        this.webClient = webClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Circuit Breaker [{}] state change: {}", CIRCUIT_BREAKER_NAME, event.getStateTransition()));
    }

    /**
     * Fetch one container with the given bearer token. Never throws; every outcome,
     * including a 401, is reported through the returned response.
     */
    public ContainerResponse fetch(VehicleContainer container, String accessToken) {
        try {
            circuitBreaker.acquirePermission();
        } catch (CallNotPermittedException ex) {
            log.warn("Circuit breaker [{}] OPEN, skipping container {}", CIRCUIT_BREAKER_NAME, container.getPath());
            return ContainerResponse.empty(container, 0, "circuit breaker open");
        }

        long startTime = System.nanoTime();
        ResponseEntity<String> entity;
        try {
            entity = webClient.get()
                    .uri(properties.getApiBaseUrl() + "/vehicles/{vin}/containers/{container}",
                            Map.of("vin", properties.getVin(), "container", container.getPath()))
                    .headers(h -> {
                        h.setBearerAuth(accessToken);
                        h.setAccept(List.of(VEHICLE_JSON));
                    })
                    .exchangeToMono(response -> response.toEntity(String.class))
                    .block();
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            circuitBreaker.onError(System.nanoTime() - startTime, TimeUnit.NANOSECONDS, cause);
            metrics.recordVehicleApiResult(container.getPath(), 0);
            log.error("Vehicle API request failed for {}: {}", container.getPath(), cause.getMessage());
            return ContainerResponse.empty(container, 0, cause.getMessage());
        }

        long duration = System.nanoTime() - startTime;
        int status = entity.getStatusCode().value();
        metrics.recordVehicleApiResult(container.getPath(), status);
        if (status >= 500) {
            circuitBreaker.onError(duration, TimeUnit.NANOSECONDS,
                    new IllegalStateException("HTTP " + status));
        } else {
            circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
        }

        log.debug("Vehicle API {} -> status={}, time={}ms", container.getPath(), status, duration / 1_000_000);

        if (status != 200) {
            return ContainerResponse.empty(container, status, status == 204 || status == 429 || status == 401
                    ? null
                    : "HTTP " + status + ": " + entity.getBody());
        }

        try {
            return new ContainerResponse(container, status, parseSamples(entity.getBody()), null);
        } catch (Exception e) {
            log.error("Failed to parse {} response: {}", container.getPath(), e.getMessage());
            return ContainerResponse.empty(container, status, "unparseable response: " + e.getMessage());
        }
    }

    private List<ResourceSample> parseSamples(String body) throws Exception {
        List<ResourceSample> samples = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return samples;
        }
        JsonNode root = objectMapper.readTree(body);
        if (!root.isArray()) {
            throw new IllegalStateException("expected a JSON array");
        }
        for (JsonNode item : root) {
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode data = field.getValue();
                String value = data.hasNonNull("value") ? data.get("value").asText() : null;
                Long timestamp = data.hasNonNull("timestamp") ? data.get("timestamp").asLong() : null;
                samples.add(new ResourceSample(field.getKey(), value, timestamp));
            }
        }
        return samples;
    }
}
