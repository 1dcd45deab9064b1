package uz.greenwhite.exporter.vehicle;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uz.greenwhite.exporter.config.HttpClientConfig;
import uz.greenwhite.exporter.config.HttpProperties;
import uz.greenwhite.exporter.config.VehicleProperties;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.vehicle.model.ContainerResponse;
import uz.greenwhite.exporter.vehicle.model.ResourceSample;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class VehicleDataClientTest {

    private MockWebServer server;
    private SimpleMeterRegistry registry;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private VehicleDataClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        VehicleProperties properties = new VehicleProperties();
        properties.setVin("WDD1234567890");
        properties.setApiBaseUrl(server.url("/vehicledata/v2").toString());

        registry = new SimpleMeterRegistry();
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        client = new VehicleDataClient(HttpClientConfig.buildWebClient(new HttpProperties()), properties,
                new ObjectMapper(), new ExporterMetrics(registry), circuitBreakerRegistry);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void containerIsParsedIntoSamples() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json;charset=utf-8")
                .setBody("""
                        [{"soc":{"value":"80","timestamp":1714557600000}},
                         {"rangeelectric":{"value":"250","timestamp":1714557601000}}]
                        """));

        ContainerResponse response = client.fetch(VehicleContainer.ELECTRIC_VEHICLE, "access-1");

        assertTrue(response.isOk());
        assertEquals(2, response.samples().size());
        ResourceSample soc = response.samples().get(0);
        assertEquals("soc", soc.resourceName());
        assertEquals("80", soc.value());
        assertEquals(1714557600000L, soc.timestamp());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/vehicledata/v2/vehicles/WDD1234567890/containers/electricvehicle", request.getPath());
        assertEquals("Bearer access-1", request.getHeader("Authorization"));
        assertTrue(request.getHeader("Accept").startsWith("application/json"));
        assertEquals(1.0, registry.get("mb.exporter.vehicle.api.requests")
                .tag("container", "electricvehicle").tag("status", "200").counter().count());
    }

    @Test
    void unauthorizedIsReportedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(401));

        ContainerResponse response = client.fetch(VehicleContainer.FUEL_STATUS, "stale");

        assertTrue(response.isUnauthorized());
        assertFalse(response.isOk());
    }

    @Test
    void noContentAndRateLimitAreReported() {
        server.enqueue(new MockResponse().setResponseCode(204));
        server.enqueue(new MockResponse().setResponseCode(429));

        assertTrue(client.fetch(VehicleContainer.PAY_AS_YOU_DRIVE, "t").isNoContent());
        assertTrue(client.fetch(VehicleContainer.PAY_AS_YOU_DRIVE, "t").isRateLimited());
    }

    @Test
    void unexpectedStatusCarriesBody() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"reason\":\"consent missing\"}"));

        ContainerResponse response = client.fetch(VehicleContainer.VEHICLE_STATUS, "t");

        assertEquals(403, response.httpStatus());
        assertTrue(response.errorMessage().contains("consent missing"));
    }

    @Test
    void malformedBodyIsNotOk() {
        server.enqueue(new MockResponse().setBody("{\"not\":\"an array\"}"));

        ContainerResponse response = client.fetch(VehicleContainer.VEHICLE_LOCK_STATUS, "t");

        assertEquals(200, response.httpStatus());
        assertFalse(response.isOk());
    }

    @Test
    void connectionFailureHasNoStatus() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        VehicleProperties properties = new VehicleProperties();
        properties.setVin("WDD1234567890");
        properties.setApiBaseUrl(stopped.url("/vehicledata/v2").toString());
        stopped.shutdown();
        VehicleDataClient offline = new VehicleDataClient(HttpClientConfig.buildWebClient(new HttpProperties()),
                properties, new ObjectMapper(), new ExporterMetrics(registry), circuitBreakerRegistry);

        ContainerResponse response = offline.fetch(VehicleContainer.VEHICLE_STATUS, "t");

        assertEquals(0, response.httpStatus());
        assertNotNull(response.errorMessage());
        assertEquals(1.0, registry.get("mb.exporter.vehicle.api.requests")
                .tag("status", "error").counter().count());
    }

    @Test
    void openCircuitSkipsCall() {
        circuitBreakerRegistry.circuitBreaker(VehicleDataClient.CIRCUIT_BREAKER_NAME).transitionToOpenState();

        ContainerResponse response = client.fetch(VehicleContainer.VEHICLE_STATUS, "t");

        assertEquals(0, response.httpStatus());
        assertEquals(0, server.getRequestCount());
    }
}
