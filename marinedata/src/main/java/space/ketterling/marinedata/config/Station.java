package space.ketterling.marinedata.config;

/**
 * One configured observation station. Immutable after configuration load.
 *
 * @param id       provider-scoped identifier (tide gauge number, buoy id)
 * @param provider provider the id belongs to
 * @param enabled  whether the station is polled
 */
public record Station(String id, Provider provider, boolean enabled) {
}
