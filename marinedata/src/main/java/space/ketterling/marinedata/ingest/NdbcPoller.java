package space.ketterling.marinedata.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.config.Station;
import space.ketterling.marinedata.fetch.FetchException;
import space.ketterling.marinedata.ndbc.NdbcClient;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * NDBC poller: standard meteorological file and, where the buoy has ocean
 * sensors, the ocean file.
 */
public final class NdbcPoller extends Poller {
    private static final Logger log = LoggerFactory.getLogger(NdbcPoller.class);

    static final String BUOY_OBSERVATION = "buoy-observation";
    static final String OCEAN_OBSERVATION = "ocean-observation";

    private final AppConfig cfg;
    private final NdbcClient client;
    private final RecordPipeline pipeline;

    public NdbcPoller(AppConfig cfg, NdbcClient client, RecordPipeline pipeline, Clock clock) {
        super(Provider.NDBC, cfg.stations(Provider.NDBC), cfg.tick(), cfg.errorCooldown(), cfg.logSuccess(), clock);
        this.cfg = cfg;
        this.client = client;
        this.pipeline = pipeline;
    }

    @Override
    protected List<SubTask> subTasks() {
        return List.of(
                new SubTask(BUOY_OBSERVATION, cfg.ndbcObservationInterval(), this::collectBuoy),
                new SubTask(OCEAN_OBSERVATION, cfg.ndbcOceanInterval(), this::collectOcean));
    }

    void collectBuoy(Station station) throws FetchException, InterruptedException {
        Instant collectedAt = clock.instant();
        Map<String, Object> values = client.standardMet(station.id());
        report("buoy observation", station.id(),
                pipeline.accept(new CollectionRecord(Provider.NDBC, station.id(), collectedAt, values)));
    }

    void collectOcean(Station station) throws FetchException, InterruptedException {
        Instant collectedAt = clock.instant();
        Map<String, Object> values;
        try {
            values = client.oceanData(station.id());
        } catch (FetchException e) {
            if (!e.notFound())
                throw e;
            log.debug("Buoy {} publishes no ocean file", station.id());
            return;
        }
        report("ocean observation", station.id(),
                pipeline.accept(new CollectionRecord(Provider.NDBC, station.id(), collectedAt, values)));
    }
}
