package space.ketterling.marinedata.ingest;

import space.ketterling.marinedata.config.Station;

import java.time.Duration;

/**
 * A named collection job with its own cadence, run once per station when due.
 */
public record SubTask(String name, Duration interval, StationAction action) {

    @FunctionalInterface
    public interface StationAction {
        void collect(Station station) throws Exception;
    }
}
