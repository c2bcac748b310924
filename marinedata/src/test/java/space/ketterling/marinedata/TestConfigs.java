package space.ketterling.marinedata;

import space.ketterling.marinedata.config.AppConfig;

import java.util.Properties;

/**
 * Property sets for building {@link AppConfig} in tests.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    /**
     * Enabled collector with one CO-OPS and one NDBC station and a small set of
     * mappings.
     */
    public static Properties enabled() {
        Properties p = new Properties();
        p.setProperty("marine.enabled", "true");
        p.setProperty("coops.station.9414290", "true");
        p.setProperty("ndbc.station.46026", "true");
        p.setProperty("coops.baseUrl", "http://coops.test/datagetter");
        p.setProperty("ndbc.baseUrl", "http://ndbc.test/realtime2");
        p.setProperty("coops.minRequestInterval", "PT0S");
        p.setProperty("db.dialect", "sqlite");
        p.setProperty("field.coops.water_level", "coops_realtime,marine_current_water_level,REAL");
        p.setProperty("field.coops.water_level_sigma", "coops_realtime,marine_water_level_sigma,REAL");
        p.setProperty("field.coops.water_temperature", "coops_realtime,marine_coastal_water_temp,REAL");
        p.setProperty("field.coops.next_high_level", "archive,marine_next_high_level,REAL");
        p.setProperty("field.coops.next_high_time", "archive,marine_next_high_time,TEXT");
        p.setProperty("field.ndbc.wave_height", "ndbc_data,marine_wave_height,REAL");
        p.setProperty("field.ndbc.marine_wind_speed", "ndbc_data,marine_wind_speed,REAL");
        p.setProperty("field.ndbc.marine_air_temp", "ndbc_data,marine_air_temp,REAL");
        p.setProperty("field.ndbc.ocean_temperature", "ndbc_data,ocean_temperature,REAL");
        return p;
    }

    public static AppConfig config(Properties p) {
        return AppConfig.from(p);
    }

    public static AppConfig enabledConfig() {
        return AppConfig.from(enabled());
    }
}
