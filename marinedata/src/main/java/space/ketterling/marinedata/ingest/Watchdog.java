package space.ketterling.marinedata.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.metrics.ExternalApiMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Supervises the provider pollers.
 *
 * <p>
 * Every check restarts a poller whose thread has ended, and a poller whose
 * health has not advanced within its stale threshold. A stale poller is asked
 * to stop and joined for a bounded time; the replacement starts whether or not
 * the old thread exited. Each restart builds a fresh poller from its factory.
 * </p>
 */
public final class Watchdog {
    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final Duration interval;
    private final Duration joinTimeout;
    private final Clock clock;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "marine-watchdog");
        t.setDaemon(true);
        return t;
    });

    // guarded by this
    private final Map<Provider, Supervised> supervised = new EnumMap<>(Provider.class);
    private ScheduledFuture<?> checkTask;
    private boolean stopped;

    public Watchdog(Duration interval, Duration joinTimeout, Clock clock) {
        this.interval = interval;
        this.joinTimeout = joinTimeout;
        this.clock = clock;
    }

    public synchronized void register(Provider provider, Supplier<? extends Poller> factory, Duration staleAfter) {
        if (supervised.containsKey(provider))
            throw new IllegalStateException(provider.displayName() + " poller already registered");
        supervised.put(provider, new Supervised(provider, factory, staleAfter));
    }

    /**
     * Starts every registered poller and schedules the periodic check.
     */
    public synchronized void start() {
        if (checkTask != null || stopped)
            throw new IllegalStateException("Watchdog already started");
        for (Supervised s : supervised.values()) {
            s.launch(s.factory.get());
        }
        long ms = interval.toMillis();
        checkTask = exec.scheduleWithFixedDelay(safe("watchdog", this::checkOnce), ms, ms, TimeUnit.MILLISECONDS);
        log.info("Watchdog started for {} poller(s), checking every {}", supervised.size(), interval);
    }

    /**
     * Runs one supervision pass.
     *
     * @return number of pollers restarted
     */
    public synchronized int checkOnce() {
        if (stopped)
            return 0;
        int restarted = 0;
        for (Supervised s : supervised.values()) {
            Instant now = clock.instant();
            if (s.thread == null || !s.thread.isAlive()) {
                log.warn("{} poller thread is not running, restarting", s.provider.displayName());
                if (s.restart())
                    restarted++;
            } else if (s.poller.health().isStale(now, s.staleAfter)) {
                log.warn("{} poller made no progress since {} (threshold {}), restarting",
                        s.provider.displayName(), s.poller.health().lastAlive(), s.staleAfter);
                s.poller.requestStop();
                if (!join(s.thread, joinTimeout)) {
                    log.warn("{} poller thread did not exit within {}, abandoning it", s.provider.displayName(),
                            joinTimeout);
                }
                if (s.restart())
                    restarted++;
            }
        }
        log.debug("External API health: {}", ExternalApiMetrics.summary());
        return restarted;
    }

    /**
     * Cancels the periodic check, asks every poller to stop and waits up to the
     * join timeout for each.
     */
    public void stop() {
        List<Thread> threads = new ArrayList<>();
        synchronized (this) {
            if (stopped)
                return;
            stopped = true;
            if (checkTask != null)
                checkTask.cancel(false);
            for (Supervised s : supervised.values()) {
                if (s.poller != null)
                    s.poller.requestStop();
                if (s.thread != null)
                    threads.add(s.thread);
            }
        }
        exec.shutdown();
        for (Thread t : threads) {
            if (!join(t, joinTimeout))
                log.warn("Thread {} still running after {}, continuing shutdown", t.getName(), joinTimeout);
        }
        log.info("Watchdog stopped");
    }

    synchronized Optional<Poller> current(Provider provider) {
        Supervised s = supervised.get(provider);
        return s == null ? Optional.empty() : Optional.ofNullable(s.poller);
    }

    synchronized Optional<Thread> thread(Provider provider) {
        Supervised s = supervised.get(provider);
        return s == null ? Optional.empty() : Optional.ofNullable(s.thread);
    }

    synchronized int restarts(Provider provider) {
        Supervised s = supervised.get(provider);
        return s == null ? 0 : s.restarts;
    }

    private static boolean join(Thread t, Duration timeout) {
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }

    private static final class Supervised {
        final Provider provider;
        final Supplier<? extends Poller> factory;
        final Duration staleAfter;
        Poller poller;
        Thread thread;
        int restarts;

        Supervised(Provider provider, Supplier<? extends Poller> factory, Duration staleAfter) {
            this.provider = provider;
            this.factory = factory;
            this.staleAfter = staleAfter;
        }

        void launch(Poller fresh) {
            Thread t = new Thread(fresh, "marine-poller-" + provider.key());
            t.setDaemon(true);
            poller = fresh;
            thread = t;
            t.start();
        }

        boolean restart() {
            try {
                launch(factory.get());
                restarts++;
                return true;
            } catch (RuntimeException e) {
                log.error("Could not restart {} poller, retrying on next check", provider.displayName(), e);
                return false;
            }
        }
    }
}
