package uz.greenwhite.exporter.vehicle;

import lombok.Getter;

import java.util.function.ToDoubleFunction;

/**
 * Vehicle data resources and the gauges they feed. Metric names follow Micrometer's dotted
 * convention and render as e.g. {@code mb_electric_range_meters} in Prometheus.
 */
@Getter
public enum VehicleResource {

    STATE_OF_CHARGE("soc", "mb.electric.state.of.charge",
            "State of Charge obtained from electric vehicle api"),
    ELECTRIC_RANGE("rangeelectric", "mb.electric.range",
            "Electric range", "meters", ValueMappers::kilometersToMeters),

    LIQUID_FUEL_LEVEL("tanklevelpercent", "mb.liquid.fuel.level",
            "Liquid fuel level"),
    LIQUID_RANGE("rangeliquid", "mb.liquid.range",
            "Liquid range", "meters", ValueMappers::kilometersToMeters),

    ODOMETER("odo", "mb.odometer", "Odometer", "meters", ValueMappers::kilometersToMeters),

    DECK_LID_LOCK_STATUS("doorlockstatusdecklid", "mb.deck.lid.lock.status",
            "Deck lid lock status, 1: locked", null, ValueMappers::boolNot),
    VEHICLE_LOCK_STATUS("doorlockstatusvehicle", "mb.vehicle.lock.status",
            "Vehicle lock status, 0: vehicle unlocked, 1: vehicle internal locked, "
                    + "2: vehicle external locked, 3: vehicle selective unlocked"),
    GAS_TANK_LOCK_STATUS("doorlockstatusgas", "mb.gas.tank.lock.status",
            "Status of gas tank door lock, 1: locked", null, ValueMappers::boolNot),
    VEHICLE_HEADING_POSITION("positionHeading", "mb.vehicle.heading.position",
            "Vehicle heading position", "degrees", ValueMappers::number),

    DECK_LID_STATUS("decklidstatus", "mb.deck.lid.open",
            "Deck lid latch status opened/closed state", null, ValueMappers::bool),
    DOOR_STATUS_FRONT_LEFT("doorstatusfrontleft", "mb.door.status.front.left",
            "Status of the front left door", null, ValueMappers::bool),
    DOOR_STATUS_FRONT_RIGHT("doorstatusfrontright", "mb.door.status.front.right",
            "Status of the front right door", null, ValueMappers::bool),
    DOOR_STATUS_REAR_LEFT("doorstatusrearleft", "mb.door.status.rear.left",
            "Status of the rear left door", null, ValueMappers::bool),
    DOOR_STATUS_REAR_RIGHT("doorstatusrearright", "mb.door.status.rear.right",
            "Status of the rear right door", null, ValueMappers::bool),
    INTERIOR_LIGHTS_FRONT("interiorLightsFront", "mb.interior.front.light.status",
            "Front light inside", null, ValueMappers::bool),
    INTERIOR_LIGHTS_REAR("interiorLightsRear", "mb.interior.rear.light.status",
            "Rear light inside", null, ValueMappers::bool),
    LIGHT_SWITCH_POSITION("lightswitchposition", "mb.light.switch.position",
            "Light switch position: 0: auto; 1: headlights; 2: sidelight left; 3: sidelight right; 4: parking light"),
    READING_LAMP_FRONT_LEFT("readingLampFrontLeft", "mb.reading.lamp.front.left",
            "Front left reading light", null, ValueMappers::bool),
    READING_LAMP_FRONT_RIGHT("readingLampFrontRight", "mb.reading.lamp.front.right",
            "Front right reading light", null, ValueMappers::bool),
    ROOF_TOP_STATUS("rooftopstatus", "mb.roof.top.status",
            "Status of the convertible top opened/closed: 0: unlocked; 1: open and locked; 2: closed and locked"),
    SUN_ROOF_STATUS("sunroofstatus", "mb.sun.roof.status",
            "Status of the sunroof; 0: Tilt/slide sunroof is closed; 1: Tilt/slide sunroof is complete open; "
                    + "2: Lifting roof is open; 3: Tilt/slide sunroof is running; "
                    + "4: Tilt/slide sunroof in anti-booming position; 5: Sliding roof in intermediate position; "
                    + "6: Lifting roof in intermediate position"),
    WINDOW_STATUS_FRONT_LEFT("windowstatusfrontleft", "mb.window.status.front.left",
            "Status of the front left window; " + Window.STATES),
    WINDOW_STATUS_FRONT_RIGHT("windowstatusfrontright", "mb.window.status.front.right",
            "Status of the front right window; " + Window.STATES),
    WINDOW_STATUS_REAR_LEFT("windowstatusrearleft", "mb.window.status.rear.left",
            "Status of the rear left window; " + Window.STATES),
    WINDOW_STATUS_REAR_RIGHT("windowstatusrearright", "mb.window.status.rear.right",
            "Status of the rear right window; " + Window.STATES);

    private final String resourceName;
    private final String metricName;
    private final String description;
    private final String baseUnit;
    private final ToDoubleFunction<String> valueMapper;

    VehicleResource(String resourceName, String metricName, String description) {
        this(resourceName, metricName, description, null, ValueMappers::number);
    }

    VehicleResource(String resourceName, String metricName, String description,
                    String baseUnit, ToDoubleFunction<String> valueMapper) {
        this.resourceName = resourceName;
        this.metricName = metricName;
        this.description = description;
        this.baseUnit = baseUnit;
        this.valueMapper = valueMapper;
    }

    /**
     * @throws IllegalArgumentException value is not in the expected textual form
     */
    public double mapValue(String rawValue) {
        if (rawValue == null) {
            throw new IllegalArgumentException("Missing value for " + resourceName);
        }
        return valueMapper.applyAsDouble(rawValue);
    }

    private static final class Window {
        static final String STATES = "0: window in intermediate position; 1: window completely opened; "
                + "2: window completely closed; 3: window airing position; "
                + "4: window intermediate airing position; 5: window currently running";
    }
}
