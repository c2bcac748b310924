package space.ketterling.marinedata.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.ketterling.marinedata.MutableClock;
import space.ketterling.marinedata.RecordingSleeper;
import space.ketterling.marinedata.ScriptedTransport;
import space.ketterling.marinedata.SqliteTestDb;
import space.ketterling.marinedata.TestConfigs;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.config.Station;
import space.ketterling.marinedata.coops.CoopsClient;
import space.ketterling.marinedata.coops.TidePrediction;
import space.ketterling.marinedata.db.MarineRecordWriter;
import space.ketterling.marinedata.db.SqliteUpserter;
import space.ketterling.marinedata.db.TidePredictionRepo;
import space.ketterling.marinedata.db.WriteResult;
import space.ketterling.marinedata.fetch.HttpFetcher;
import space.ketterling.marinedata.fetch.Transport.RawResponse;
import space.ketterling.marinedata.ndbc.NdbcClient;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProviderPollersTest {

    private static final String STDMET = String.join("\n",
            "#YY  MM DD hh mm WDIR WSPD GST  WVHT   DPD   APD MWD   PRES  ATMP  WTMP  DEWP  VIS PTDY  TIDE",
            "#yr  mo dy hr mn degT m/s  m/s     m   sec   sec degT   hPa  degC  degC  degC  nmi  hPa    ft",
            "2025 01 31 20 40 290  5.0  7.0   1.5    12   8.1 280 1015.2  12.0  13.0   9.0   MM +0.3    MM");

    private static final String OCEAN = String.join("\n",
            "#YY  MM DD hh mm   DEPTH  OTMP   COND   SAL   O2% O2PPM  CLCON  TURB    PH    EH",
            "#yr  mo dy hr mn       m  degC  mS/cm   psu     %   ppm   ug/l   FTU     -    mv",
            "2025 01 31 20 00     1.0  13.2     MM  33.5    MM    MM     MM    MM  8.05    MM");

    private final AppConfig cfg = TestConfigs.enabledConfig();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-31T21:00:00Z"));
    private final ScriptedTransport transport = new ScriptedTransport();
    private final List<CollectionRecord> records = new ArrayList<>();
    private final List<List<TidePrediction>> forecasts = new ArrayList<>();

    private final RecordPipeline pipeline = new RecordPipeline(null, null, null) {
        @Override
        public List<WriteResult> accept(CollectionRecord record) {
            records.add(record);
            return List.of(WriteResult.written("t", 1));
        }
    };

    private final TidePredictionRepo forecast = new TidePredictionRepo(null, null, "tide_table",
            Duration.ofHours(24), ZoneOffset.UTC) {
        @Override
        public WriteResult replaceForecast(String stationId, List<TidePrediction> predictions, Instant now) {
            forecasts.add(predictions);
            return WriteResult.written("tide_table", predictions.size());
        }
    };

    private HttpFetcher fetcher(Provider provider) {
        return new HttpFetcher(provider, transport, Duration.ofSeconds(5), 2, Duration.ofMillis(1), Duration.ZERO,
                new RecordingSleeper());
    }

    @Test
    @DisplayName("CO-OPS observation carries water level and the next-tide summary, without a failing temperature")
    void shouldCollectCoopsObservation() throws Exception {
        transport.otherwise(uri -> {
            String q = uri.getQuery();
            if (q.contains("product=predictions"))
                return new RawResponse(200, "{\"predictions\":["
                        + "{\"t\":\"2025-02-01 03:12\",\"v\":\"5.321\",\"type\":\"H\"},"
                        + "{\"t\":\"2025-02-01 09:40\",\"v\":\"-0.412\",\"type\":\"L\"}]}");
            if (q.contains("product=water_level"))
                return new RawResponse(200, "{\"data\":[{\"t\":\"2025-01-31 20:54\",\"v\":\"2.500\",\"s\":\"0.010\"}]}");
            return new RawResponse(200, "{\"error\":{\"message\":\"No data was found.\"}}");
        });
        CoopsPoller poller = new CoopsPoller(cfg,
                new CoopsClient(cfg, new ObjectMapper(), fetcher(Provider.COOPS), clock), pipeline, forecast, clock);

        assertThat(poller.tick()).isEqualTo(2);

        assertThat(forecasts).hasSize(1);
        assertThat(forecasts.get(0)).hasSize(2);
        assertThat(records).hasSize(1);
        CollectionRecord r = records.get(0);
        assertThat(r.provider()).isEqualTo(Provider.COOPS);
        assertThat(r.stationId()).isEqualTo("9414290");
        assertThat(r.collectedAt()).isEqualTo(clock.instant());
        assertThat(r.values())
                .containsEntry("water_level", 2.5)
                .containsEntry("next_high_level", 5.321)
                .containsEntry("next_low_level", -0.412)
                .doesNotContainKey("water_temperature");
    }

    @Test
    @DisplayName("NDBC buoy without ocean sensors produces only the met record")
    void shouldSkipMissingOceanFile() throws Exception {
        transport.otherwise(uri -> uri.getPath().endsWith(".ocean")
                ? new RawResponse(404, "Not Found")
                : new RawResponse(200, STDMET));
        NdbcPoller poller = new NdbcPoller(cfg, new NdbcClient(cfg, fetcher(Provider.NDBC)), pipeline, clock);

        assertThat(poller.tick()).isEqualTo(2);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).provider()).isEqualTo(Provider.NDBC);
        assertThat(records.get(0).stationId()).isEqualTo("46026");
        assertThat(records.get(0).values()).containsKeys("wave_height", "marine_wind_speed");
        assertThat(transport.requests()).extracting(u -> u.getPath())
                .containsExactly("/realtime2/46026.txt", "/realtime2/46026.ocean");
        assertThat(poller.health().lastAlive()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("NDBC met and ocean records from one tick share a row in ndbc_data")
    void shouldKeepMetAndOceanColumnsInOneRow(@TempDir Path dir) throws Exception {
        transport.otherwise(uri -> uri.getPath().endsWith(".ocean")
                ? new RawResponse(200, OCEAN)
                : new RawResponse(200, STDMET));
        try (SqliteTestDb db = new SqliteTestDb(dir).createObservationTables()) {
            RecordPipeline stored = new RecordPipeline(new FieldRouter(cfg.fields()),
                    new MarineRecordWriter(db.dataSource(), new SqliteUpserter()), new LatestValues());
            NdbcPoller poller = new NdbcPoller(cfg, new NdbcClient(cfg, fetcher(Provider.NDBC)), stored, clock);

            assertThat(poller.tick()).isEqualTo(2);

            List<Map<String, Object>> rows = db.query("SELECT * FROM ndbc_data");
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0))
                    .containsEntry("station_id", "46026")
                    .containsKeys("marine_wave_height", "marine_wind_speed", "marine_air_temp");
            assertThat(rows.get(0).get("marine_wave_height")).isNotNull();
            assertThat(rows.get(0).get("marine_wind_speed")).isNotNull();
            assertThat((Double) rows.get(0).get("ocean_temperature")).isCloseTo(55.76, within(1e-9));
        }
    }

    @Test
    void shouldOnlyPollEnabledStations() {
        NdbcPoller poller = new NdbcPoller(cfg, new NdbcClient(cfg, fetcher(Provider.NDBC)), pipeline, clock);

        assertThat(poller.stations()).extracting(Station::id).containsExactly("46026");
        assertThat(poller.provider()).isEqualTo(Provider.NDBC);
    }
}
