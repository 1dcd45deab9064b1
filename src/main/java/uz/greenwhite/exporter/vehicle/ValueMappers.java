package uz.greenwhite.exporter.vehicle;

/**
 * Converters from the vendor's textual resource values to gauge values.
 */
final class ValueMappers {

    private ValueMappers() {
    }

    static double number(String value) {
        return Double.parseDouble(value.trim());
    }

    static double kilometersToMeters(String value) {
        return number(value) * 1000;
    }

    static double bool(String value) {
        return parseBoolean(value) ? 1 : 0;
    }

    /**
     * Lock statuses arrive as "unlocked" flags; exported as locked = 1.
     */
    static double boolNot(String value) {
        return parseBoolean(value) ? 0 : 1;
    }

    private static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase();
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }
}
