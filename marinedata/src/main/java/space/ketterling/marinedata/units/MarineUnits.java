package space.ketterling.marinedata.units;

/**
 * Conversions applied at the client boundary so records reach the router in
 * destination units.
 */
public final class MarineUnits {
    private static final double FEET_PER_METER = 3.280839895;
    private static final double MPH_PER_MPS = 2.236936292;
    private static final double INHG_PER_HPA = 0.0295299830714;

    private MarineUnits() {
    }

    public static double metersToFeet(double m) {
        return m * FEET_PER_METER;
    }

    public static double mpsToMph(double mps) {
        return mps * MPH_PER_MPS;
    }

    public static double celsiusToFahrenheit(double c) {
        return c * 9.0 / 5.0 + 32.0;
    }

    public static double hpaToInHg(double hpa) {
        return hpa * INHG_PER_HPA;
    }

    /**
     * Physical quantity of an NDBC column, as delivered (metric).
     */
    public enum Quantity {
        LENGTH,
        SPEED,
        TEMPERATURE,
        PRESSURE,
        /** seconds, degrees, psu, nmi and other values stored as delivered */
        PLAIN
    }

    /**
     * Converts a metric provider value into the target unit system.
     */
    public static double fromMetric(double value, Quantity q, UnitSystem target) {
        if (target == UnitSystem.METRIC)
            return value;
        switch (q) {
            case LENGTH:
                return metersToFeet(value);
            case SPEED:
                return mpsToMph(value);
            case TEMPERATURE:
                return celsiusToFahrenheit(value);
            case PRESSURE:
                return hpaToInHg(value);
            default:
                return value;
        }
    }
}
