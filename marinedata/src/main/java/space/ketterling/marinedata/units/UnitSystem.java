package space.ketterling.marinedata.units;

import space.ketterling.marinedata.config.ConfigurationException;

/**
 * Unit system the destination tables are stored in.
 */
public enum UnitSystem {
    /** feet, mph, Fahrenheit, inHg */
    US,
    /** meters, m/s, Celsius, hPa */
    METRIC;

    public static UnitSystem parse(String raw) {
        String v = raw == null ? "" : raw.trim().toUpperCase();
        switch (v) {
            case "US":
            case "ENGLISH":
                return US;
            case "METRIC":
            case "METRICWX":
                return METRIC;
            default:
                throw new ConfigurationException("Unknown unit system '" + raw + "'");
        }
    }

    /**
     * Value of the CO-OPS {@code units} query parameter for this system.
     */
    public String coopsUnits() {
        return this == US ? "english" : "metric";
    }
}
