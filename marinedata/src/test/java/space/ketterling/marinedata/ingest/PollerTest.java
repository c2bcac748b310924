package space.ketterling.marinedata.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.marinedata.MutableClock;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.fetch.FetchException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

class PollerTest {

    private static final Instant START = Instant.parse("2025-01-31T00:00:00Z");

    @Test
    @DisplayName("sub-task runs floor(elapsed/interval) to floor(elapsed/interval)+1 times")
    void shouldRunSubTaskOnItsCadence() throws Exception {
        int[][] cases = { { 60, 600, 35 }, { 60, 3600, 200 }, { 60, 60, 10 }, { 45, 600, 100 } };
        for (int[] c : cases) {
            Duration tick = Duration.ofSeconds(c[0]);
            Duration interval = Duration.ofSeconds(c[1]);
            int ticks = c[2];
            MutableClock clock = new MutableClock(START);
            AtomicInteger runs = new AtomicInteger();
            TestPoller poller = new TestPoller(TestPoller.stations("9414290"), tick, Duration.ofMinutes(5), clock,
                    new SubTask("count", interval, s -> runs.incrementAndGet()));

            for (int i = 0; i < ticks; i++) {
                poller.tick();
                if (i < ticks - 1)
                    clock.advance(tick);
            }

            long elapsed = Duration.between(START, clock.instant()).getSeconds();
            long lower = elapsed / interval.getSeconds();
            assertThat(runs.get()).as("tick=%s interval=%s ticks=%d", tick, interval, ticks)
                    .isBetween((int) lower, (int) lower + 1);
        }
    }

    @Test
    @DisplayName("each sub-task keeps its own schedule")
    void shouldTrackSubTasksIndependently() throws Exception {
        MutableClock clock = new MutableClock(START);
        List<String> ran = new ArrayList<>();
        TestPoller poller = new TestPoller(TestPoller.stations("9414290"), Duration.ofMinutes(1),
                Duration.ofMinutes(5), clock,
                new SubTask("fast", Duration.ofMinutes(10), s -> ran.add("fast")),
                new SubTask("slow", Duration.ofHours(6), s -> ran.add("slow")));

        assertThat(poller.tick()).isEqualTo(2);
        clock.advance(Duration.ofMinutes(10));
        assertThat(poller.tick()).isEqualTo(1);
        clock.advance(Duration.ofMinutes(5));
        assertThat(poller.tick()).isZero();

        assertThat(ran).containsExactly("fast", "slow", "fast");
    }

    @Test
    @DisplayName("a failing station does not stop the others")
    void shouldIsolateStationFailures() throws Exception {
        MutableClock clock = new MutableClock(START);
        List<String> collected = new CopyOnWriteArrayList<>();
        TestPoller poller = new TestPoller(TestPoller.stations("A", "B", "C", "D"), Duration.ofMinutes(1),
                Duration.ofMinutes(5), clock,
                new SubTask("observe", Duration.ofMinutes(10), s -> {
                    if (s.id().equals("B"))
                        throw new FetchException(Provider.COOPS, "http://coops.test", 3, 503, "HTTP 503", null);
                    if (s.id().equals("C"))
                        throw new IllegalStateException("parse blew up");
                    collected.add(s.id());
                }));
        clock.advance(Duration.ofMinutes(3));

        poller.tick();

        assertThat(collected).containsExactly("A", "D");
        assertThat(poller.health().lastAlive()).isEqualTo(START.plus(Duration.ofMinutes(3)));
    }

    @Test
    @DisplayName("health advances after a tick even when nothing was due")
    void shouldMarkAliveOnIdleTick() throws Exception {
        MutableClock clock = new MutableClock(START);
        TestPoller poller = new TestPoller(TestPoller.stations("A"), Duration.ofMinutes(1), Duration.ofMinutes(5),
                clock, new SubTask("observe", Duration.ofHours(1), s -> {
                }));
        poller.tick();
        clock.advance(Duration.ofMinutes(1));

        assertThat(poller.tick()).isZero();
        assertThat(poller.health().lastAlive()).isEqualTo(START.plus(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("stop request wakes a poller waiting out its error cooldown")
    void shouldStopDuringCooldown() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Poller broken = new Poller(Provider.NDBC, TestPoller.stations("46026"), Duration.ofMillis(10),
                Duration.ofHours(1), false, Clock.systemUTC()) {
            @Override
            protected List<SubTask> subTasks() {
                attempts.incrementAndGet();
                throw new IllegalStateException("no sub-tasks");
            }
        };
        Instant created = broken.health().lastAlive();
        Thread t = new Thread(broken, "test-poller");
        t.start();

        waitFor(() -> attempts.get() >= 1);
        broken.requestStop();
        t.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(t.isAlive()).isFalse();
        assertThat(broken.state()).isEqualTo(Poller.State.STOPPED);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(broken.health().lastAlive()).isEqualTo(created);
    }

    @Test
    void shouldKeepTickingUntilStopped() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        TestPoller poller = new TestPoller(TestPoller.stations("A"), Duration.ofMillis(5), Duration.ofMinutes(5),
                Clock.systemUTC(), new SubTask("observe", Duration.ofMillis(1), s -> runs.incrementAndGet()));
        Thread t = new Thread(poller, "test-poller");
        t.start();

        waitFor(() -> runs.get() >= 3);
        assertThat(poller.state()).isEqualTo(Poller.State.RUNNING);
        poller.requestStop();
        t.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(poller.state()).isEqualTo(Poller.State.STOPPED);
    }

    @Test
    void shouldNotRunAfterEarlyStop() {
        AtomicInteger runs = new AtomicInteger();
        TestPoller poller = new TestPoller(TestPoller.stations("A"), Duration.ofMillis(5), Duration.ofMinutes(5),
                Clock.systemUTC(), new SubTask("observe", Duration.ofMillis(1), s -> runs.incrementAndGet()));

        poller.requestStop();
        poller.run();

        assertThat(runs.get()).isZero();
        assertThat(poller.state()).isEqualTo(Poller.State.STOPPED);
    }

    static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline)
                fail("condition not met within 5s");
            Thread.sleep(10);
        }
    }
}
