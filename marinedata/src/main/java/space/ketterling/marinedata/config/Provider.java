package space.ketterling.marinedata.config;

/**
 * The NOAA data providers this collector polls.
 */
public enum Provider {
    /** NOAA CO-OPS tides and currents (JSON API). */
    COOPS("coops", "CO-OPS"),
    /** NOAA NDBC buoy real-time text files. */
    NDBC("ndbc", "NDBC");

    private final String key;
    private final String displayName;

    Provider(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Property prefix used in configuration, e.g. {@code coops}.
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a configuration key ({@code coops}, {@code ndbc}) to a provider.
     */
    public static Provider fromKey(String key) {
        for (Provider p : values()) {
            if (p.key.equalsIgnoreCase(key))
                return p;
        }
        throw new ConfigurationException("Unknown provider '" + key + "'");
    }
}
