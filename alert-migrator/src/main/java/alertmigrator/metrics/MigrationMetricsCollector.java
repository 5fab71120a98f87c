package alertmigrator.metrics;

import alertmigrator.metrics.MigrationMetrics.Phase;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Collects counters and phase timings during a migration run.
 *
 * <p>Organizations may be migrated concurrently, so every counter is thread-safe.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector();
 * collector.start(runId);
 *
 * TranslatedCondition cond = collector.timed(Phase.CONDITION_TRANSLATION, () -&gt; translate(alert));
 * collector.alertMigrated();
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final Map<Phase, LongAdder> phaseNanos = new EnumMap<>(Phase.class);

    private final AtomicInteger orgCount = new AtomicInteger();
    private final AtomicInteger orgsFailed = new AtomicInteger();
    private final AtomicInteger alertsMigrated = new AtomicInteger();
    private final AtomicInteger alertsFailed = new AtomicInteger();
    private final AtomicInteger alertsTimedOut = new AtomicInteger();
    private final AtomicInteger titlesRenamed = new AtomicInteger();
    private final AtomicInteger silencesCreated = new AtomicInteger();
    private final AtomicInteger silencesFailed = new AtomicInteger();

    private volatile long runId;
    private volatile Instant startTime;

    public MigrationMetricsCollector() {
        for (Phase phase : Phase.values()) {
            phaseNanos.put(phase, new LongAdder());
        }
    }

    /**
     * Starts metrics collection for a new run.
     *
     * @param runId the unique run identifier
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long runId) {
        this.runId = runId;
        this.startTime = Instant.now();
        phaseNanos.values().forEach(LongAdder::reset);
        for (AtomicInteger counter : new AtomicInteger[] {orgCount, orgsFailed, alertsMigrated, alertsFailed,
                alertsTimedOut, titlesRenamed, silencesCreated, silencesFailed}) {
            counter.set(0);
        }
        return this;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     * Durations of the same phase add up.
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            phaseNanos.get(phase).add(System.nanoTime() - start);
        }
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timedRun(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            phaseNanos.get(phase).add(System.nanoTime() - start);
        }
    }

    public void orgStarted() { orgCount.incrementAndGet(); }

    public void orgFailed() { orgsFailed.incrementAndGet(); }

    public void alertMigrated() { alertsMigrated.incrementAndGet(); }

    public void alertFailed() { alertsFailed.incrementAndGet(); }

    public void alertsTimedOut(int count) { alertsTimedOut.addAndGet(count); }

    public void titleRenamed() { titlesRenamed.incrementAndGet(); }

    public void silenceCreated() { silencesCreated.incrementAndGet(); }

    public void silenceFailed() { silencesFailed.incrementAndGet(); }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected run metrics
     */
    public MigrationMetrics finish() {
        Instant endTime = Instant.now();
        Map<Phase, Long> durations = new EnumMap<>(Phase.class);
        phaseNanos.forEach((phase, nanos) -> durations.put(phase, Duration.ofNanos(nanos.sum()).toMillis()));

        return MigrationMetrics.builder()
                .runId(runId)
                .startTime(startTime)
                .endTime(endTime)
                .phaseDurations(durations)
                .totalDurationMs(startTime != null ? Duration.between(startTime, endTime).toMillis() : 0)
                .orgCount(orgCount.get())
                .orgsFailed(orgsFailed.get())
                .alertsMigrated(alertsMigrated.get())
                .alertsFailed(alertsFailed.get())
                .alertsTimedOut(alertsTimedOut.get())
                .titlesRenamed(titlesRenamed.get())
                .silencesCreated(silencesCreated.get())
                .silencesFailed(silencesFailed.get())
                .build();
    }
}
