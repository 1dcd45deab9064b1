package uz.greenwhite.exporter.vehicle;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static uz.greenwhite.exporter.vehicle.VehicleResource.*;

/**
 * Vehicle data containers with the call budget the vendor grants per hour.
 */
@Getter
public enum VehicleContainer {

    ELECTRIC_VEHICLE("electricvehicle", 2,
            EnumSet.of(ELECTRIC_RANGE, STATE_OF_CHARGE)),
    FUEL_STATUS("fuelstatus", 1,
            EnumSet.of(LIQUID_FUEL_LEVEL, LIQUID_RANGE)),
    PAY_AS_YOU_DRIVE("payasyoudrive", 1,
            EnumSet.of(ODOMETER)),
    VEHICLE_LOCK_STATUS("vehiclelockstatus", 50,
            EnumSet.of(DECK_LID_LOCK_STATUS, VehicleResource.VEHICLE_LOCK_STATUS, GAS_TANK_LOCK_STATUS, VEHICLE_HEADING_POSITION)),
    VEHICLE_STATUS("vehiclestatus", 50,
            EnumSet.of(DECK_LID_STATUS,
                    DOOR_STATUS_FRONT_LEFT, DOOR_STATUS_FRONT_RIGHT, DOOR_STATUS_REAR_LEFT, DOOR_STATUS_REAR_RIGHT,
                    INTERIOR_LIGHTS_FRONT, INTERIOR_LIGHTS_REAR, LIGHT_SWITCH_POSITION,
                    READING_LAMP_FRONT_LEFT, READING_LAMP_FRONT_RIGHT,
                    ROOF_TOP_STATUS, SUN_ROOF_STATUS,
                    WINDOW_STATUS_FRONT_LEFT, WINDOW_STATUS_FRONT_RIGHT,
                    WINDOW_STATUS_REAR_LEFT, WINDOW_STATUS_REAR_RIGHT));

    private final String path;
    private final int callsPerHour;
    private final Set<VehicleResource> resources;

    VehicleContainer(String path, int callsPerHour, Set<VehicleResource> resources) {
        this.path = path;
        this.callsPerHour = callsPerHour;
        this.resources = Collections.unmodifiableSet(resources);
    }

    /**
     * Minimum spacing between two calls that stays within the hourly budget
     */
    public Duration getMinInterval() {
        return Duration.ofSeconds((long) Math.ceil(3600.0 / callsPerHour));
    }
}
