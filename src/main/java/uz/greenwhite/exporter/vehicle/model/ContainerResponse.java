package uz.greenwhite.exporter.vehicle.model;

import uz.greenwhite.exporter.vehicle.VehicleContainer;

import java.util.List;

/**
 * Outcome of one container call. {@code httpStatus} is 0 when no response arrived.
 */
public record ContainerResponse(VehicleContainer container,
                                int httpStatus,
                                List<ResourceSample> samples,
                                String errorMessage) {

    public static ContainerResponse empty(VehicleContainer container, int httpStatus, String errorMessage) {
        return new ContainerResponse(container, httpStatus, List.of(), errorMessage);
    }

    public boolean isOk() {
        return httpStatus == 200 && errorMessage == null;
    }

    public boolean isNoContent() {
        return httpStatus == 204;
    }

    public boolean isRateLimited() {
        return httpStatus == 429;
    }

    public boolean isUnauthorized() {
        return httpStatus == 401;
    }
}
