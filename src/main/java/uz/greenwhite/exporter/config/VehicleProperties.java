package uz.greenwhite.exporter.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Slf4j
@Getter
@Setter
@ConfigurationProperties(prefix = "exporter.vehicle")
public class VehicleProperties {

    /**
     * Vehicle identification number of the monitored vehicle
     */
    private String vin;

    /**
     * Vehicle data API base URL
     * Example: https://api.mercedes-benz.com/vehicledata/v2
     */
    private String apiBaseUrl = "https://api.mercedes-benz.com/vehicledata/v2";

    @PostConstruct
    public void validate() {
        if (vin == null || vin.isBlank()) {
            throw new IllegalArgumentException("exporter.vehicle.vin must be set");
        }
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            throw new IllegalArgumentException("exporter.vehicle.api-base-url must be set");
        }
        log.info("Vehicle API configured: baseUrl={}", apiBaseUrl);
    }
}
