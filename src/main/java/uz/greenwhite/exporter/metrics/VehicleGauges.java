package uz.greenwhite.exporter.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.exporter.config.VehicleProperties;
import uz.greenwhite.exporter.vehicle.VehicleResource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vendor-derived gauges, tagged with the VIN. Registered lazily on the first value and removed
 * from the registry as a whole when no valid token is available, so a scrape never shows stale
 * vehicle data next to an unauthenticated status.
 */
@Slf4j
@Component
public class VehicleGauges {

    private static final String VIN_TAG = "vin";

    private final MeterRegistry registry;
    private final String vin;
    private final Map<VehicleResource, ResourceGauges> gauges = new ConcurrentHashMap<>();

    public VehicleGauges(MeterRegistry registry, VehicleProperties vehicleProperties) {
        this.registry = registry;
        this.vin = vehicleProperties.getVin();
    }

    public void recordValue(VehicleResource resource, double value, Instant measuredAt, Instant now) {
        ResourceGauges g = gauges.computeIfAbsent(resource, ResourceGauges::new);
        g.value = value;
        if (measuredAt != null) {
            g.measurementTime = measuredAt.toEpochMilli() / 1000.0;
        }
        g.updateTime = now.toEpochMilli() / 1000.0;
        g.registerValueGauges();
    }

    /**
     * The container answered but had nothing new for this resource.
     */
    public void recordNoNewValue(VehicleResource resource, Instant now) {
        ResourceGauges g = gauges.computeIfAbsent(resource, ResourceGauges::new);
        g.updateTime = now.toEpochMilli() / 1000.0;
    }

    public void clear() {
        if (gauges.isEmpty()) {
            return;
        }
        gauges.values().forEach(ResourceGauges::remove);
        gauges.clear();
        log.debug("Vehicle gauges removed");
    }

    private final class ResourceGauges {

        private final VehicleResource resource;
        private final List<Meter> meters = new ArrayList<>();
        private volatile double value = Double.NaN;
        private volatile double measurementTime = Double.NaN;
        private volatile double updateTime = Double.NaN;
        private boolean valueGaugesRegistered;

        ResourceGauges(VehicleResource resource) {
            this.resource = resource;
            meters.add(Gauge.builder(resource.getMetricName() + ".update.time", this, g -> g.updateTime)
                    .description("Update time of " + resource.getMetricName())
                    .baseUnit("seconds")
                    .tag(VIN_TAG, vin)
                    .register(registry));
        }

        synchronized void registerValueGauges() {
            if (valueGaugesRegistered) {
                return;
            }
            meters.add(Gauge.builder(resource.getMetricName(), this, g -> g.value)
                    .description(resource.getDescription())
                    .baseUnit(resource.getBaseUnit())
                    .tag(VIN_TAG, vin)
                    .register(registry));
            meters.add(Gauge.builder(resource.getMetricName() + ".measurement.time", this, g -> g.measurementTime)
                    .description("Measurement time of " + resource.getMetricName())
                    .baseUnit("seconds")
                    .tag(VIN_TAG, vin)
                    .register(registry));
            valueGaugesRegistered = true;
        }

        synchronized void remove() {
            meters.forEach(registry::remove);
            meters.clear();
            valueGaugesRegistered = false;
        }
    }
}
