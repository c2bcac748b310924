package space.ketterling.marinedata.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.config.Station;
import space.ketterling.marinedata.db.WriteResult;
import space.ketterling.marinedata.fetch.FetchException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-running collection loop for one provider.
 *
 * <p>
 * Each tick runs every sub-task whose interval has elapsed, once per enabled
 * station. A failing station is logged and the next one still runs. An error
 * escaping a whole tick puts the loop into its error cooldown. The loop marks
 * its {@link PollerHealth} after each completed tick.
 * </p>
 *
 * <p>
 * A stop request wakes the loop from its wait between ticks. It never
 * interrupts an in-flight fetch; the loop exits once the current tick ends.
 * </p>
 */
public abstract class Poller implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Poller.class);

    public enum State {
        NEW,
        RUNNING,
        STOPPING,
        STOPPED
    }

    private final Provider provider;
    private final List<Station> stations;
    private final Duration tick;
    private final Duration errorCooldown;
    private final boolean logSuccess;
    protected final Clock clock;

    private final PollerHealth health;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    // poller thread only
    private final Map<String, Instant> lastRun = new HashMap<>();
    private List<SubTask> tasks;

    protected Poller(Provider provider, List<Station> stations, Duration tick, Duration errorCooldown,
            boolean logSuccess, Clock clock) {
        this.provider = provider;
        this.stations = List.copyOf(stations);
        this.tick = tick;
        this.errorCooldown = errorCooldown;
        this.logSuccess = logSuccess;
        this.clock = clock;
        this.health = new PollerHealth(clock.instant());
    }

    /**
     * Sub-tasks in the order they run within a tick.
     */
    protected abstract List<SubTask> subTasks();

    public Provider provider() {
        return provider;
    }

    public List<Station> stations() {
        return stations;
    }

    public PollerHealth health() {
        return health;
    }

    public State state() {
        return state.get();
    }

    @Override
    public void run() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            log.warn("{} poller cannot run from state {}", provider.displayName(), state.get());
            state.compareAndSet(State.STOPPING, State.STOPPED);
            return;
        }
        log.info("{} poller started for {} station(s)", provider.displayName(), stations.size());
        try {
            while (state.get() == State.RUNNING) {
                Duration wait = tick;
                try {
                    tick();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("{} poller tick failed, cooling down for {}", provider.displayName(), errorCooldown, e);
                    wait = errorCooldown;
                }
                if (awaitStop(wait))
                    break;
            }
        } finally {
            state.set(State.STOPPED);
            log.info("{} poller stopped", provider.displayName());
        }
    }

    /**
     * Runs one pass over the due sub-tasks.
     *
     * @return number of sub-tasks that ran
     */
    public int tick() throws Exception {
        Instant now = clock.instant();
        int ran = 0;
        for (SubTask task : tasks()) {
            Instant last = lastRun.get(task.name());
            if (last != null && Duration.between(last, now).compareTo(task.interval()) < 0)
                continue;
            runForStations(task);
            lastRun.put(task.name(), now);
            ran++;
        }
        health.markAlive(clock.instant());
        return ran;
    }

    /**
     * Asks the loop to exit after its current tick. Safe to call from any
     * thread, more than once.
     */
    public void requestStop() {
        if (state.compareAndSet(State.RUNNING, State.STOPPING) || state.compareAndSet(State.NEW, State.STOPPING)) {
            log.info("{} poller stop requested", provider.displayName());
        }
        stopSignal.countDown();
    }

    private void runForStations(SubTask task) throws InterruptedException {
        MDC.put("job", provider.key() + "-" + task.name());
        try {
            for (Station station : stations) {
                if (state.get() != State.RUNNING && state.get() != State.NEW)
                    return;
                try {
                    task.action().collect(station);
                } catch (InterruptedException e) {
                    throw e;
                } catch (FetchException e) {
                    log.warn("{} {} failed for station {}: {}", provider.displayName(), task.name(), station.id(),
                            e.getMessage());
                } catch (Exception e) {
                    log.error("{} {} failed for station {}", provider.displayName(), task.name(), station.id(), e);
                }
            }
        } finally {
            MDC.remove("job");
        }
    }

    /**
     * Logs the outcome of one station's writes. Successes go to INFO only when
     * collection.logSuccess is set.
     */
    protected void report(String what, String stationId, List<WriteResult> results) {
        for (WriteResult r : results) {
            if (r.isFailure()) {
                log.warn("{} {} for station {} not stored in {}: {}", provider.displayName(), what, stationId,
                        r.table(), r.detail());
            } else if (logSuccess) {
                log.info("{} {} for station {}: {} {} row(s) in {}", provider.displayName(), what, stationId,
                        r.status(), r.rows(), r.table());
            } else {
                log.debug("{} {} for station {}: {} {} row(s) in {}", provider.displayName(), what, stationId,
                        r.status(), r.rows(), r.table());
            }
        }
    }

    private List<SubTask> tasks() {
        if (tasks == null)
            tasks = List.copyOf(subTasks());
        return tasks;
    }

    private boolean awaitStop(Duration wait) {
        try {
            return stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
