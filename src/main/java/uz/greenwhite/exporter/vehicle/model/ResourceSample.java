package uz.greenwhite.exporter.vehicle.model;

/**
 * One {@code {"<resource>": {"value": ..., "timestamp": ...}}} item of a container response.
 *
 * @param timestamp measurement time in epoch milliseconds, {@code null} when absent
 */
public record ResourceSample(String resourceName, String value, Long timestamp) {
}
