package space.ketterling.marinedata.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.config.Station;
import space.ketterling.marinedata.coops.CoopsClient;
import space.ketterling.marinedata.coops.TidePrediction;
import space.ketterling.marinedata.db.TidePredictionRepo;
import space.ketterling.marinedata.db.WriteResult;
import space.ketterling.marinedata.fetch.FetchException;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CO-OPS poller: tide predictions refresh the forecast table and the cached
 * next-tide summary; current observations carry water level, water
 * temperature when the station reports it, and that summary.
 */
public final class CoopsPoller extends Poller {
    private static final Logger log = LoggerFactory.getLogger(CoopsPoller.class);

    static final String TIDE_PREDICTIONS = "tide-predictions";
    static final String CURRENT_OBSERVATION = "current-observation";

    private final AppConfig cfg;
    private final CoopsClient client;
    private final RecordPipeline pipeline;
    private final TidePredictionRepo forecast;

    // station id -> last predictions fetched
    private final Map<String, List<TidePrediction>> predictions = new HashMap<>();

    public CoopsPoller(AppConfig cfg, CoopsClient client, RecordPipeline pipeline, TidePredictionRepo forecast,
            Clock clock) {
        super(Provider.COOPS, cfg.stations(Provider.COOPS), cfg.tick(), cfg.errorCooldown(), cfg.logSuccess(), clock);
        this.cfg = cfg;
        this.client = client;
        this.pipeline = pipeline;
        this.forecast = forecast;
    }

    @Override
    protected List<SubTask> subTasks() {
        return List.of(
                new SubTask(TIDE_PREDICTIONS, cfg.tidePredictionInterval(), this::refreshPredictions),
                new SubTask(CURRENT_OBSERVATION, cfg.coopsObservationInterval(), this::collectObservation));
    }

    void refreshPredictions(Station station) throws FetchException, InterruptedException {
        List<TidePrediction> fetched = client.tidePredictions(station.id());
        predictions.put(station.id(), fetched);
        WriteResult result = forecast.replaceForecast(station.id(), fetched, clock.instant());
        report("tide predictions", station.id(), List.of(result));
    }

    void collectObservation(Station station) throws FetchException, InterruptedException {
        Instant collectedAt = clock.instant();
        Map<String, Object> values = new LinkedHashMap<>(client.waterLevel(station.id()));
        try {
            values.putAll(client.waterTemperature(station.id()));
        } catch (FetchException e) {
            log.debug("No water temperature for station {}: {}", station.id(), e.getMessage());
        }
        List<TidePrediction> cached = predictions.get(station.id());
        if (cached != null)
            values.putAll(CoopsClient.nextTides(cached, collectedAt));

        if (values.isEmpty()) {
            log.info("No current CO-OPS data for station {}", station.id());
            return;
        }
        report("observation", station.id(),
                pipeline.accept(new CollectionRecord(Provider.COOPS, station.id(), collectedAt, values)));
    }
}
