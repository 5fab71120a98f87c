package alertmigrator.metrics;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during a migration run.
 *
 * <p>Phase durations are summed over every alert of every organization, so with
 * parallel organizations their total can exceed {@link #totalDurationMs()}.
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()}
 * for JSON serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long runId,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int orgCount,
        int orgsFailed,
        int alertsMigrated,
        int alertsFailed,
        int alertsTimedOut,
        int titlesRenamed,
        int silencesCreated,
        int silencesFailed
) {
    /**
     * Pipeline phases for timing breakdown.
     */
    public enum Phase {
        /** Legacy condition to unified queries */
        CONDITION_TRANSLATION,
        /** Query model repair */
        QUERY_REPAIR,
        /** Title deduplication, rule and silence construction */
        RULE_ASSEMBLY,
        /** Handing results to the rule store and notification policy builder */
        PERSISTENCE
    }

    public MigrationMetrics {
        EnumMap<Phase, Long> copy = new EnumMap<>(Phase.class);
        if (phaseDurations != null) copy.putAll(phaseDurations);
        phaseDurations = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Duration of a phase in milliseconds, 0 if the phase never ran. */
    public long phaseDurationMs(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Run %d: %d orgs (%d failed), %d alerts migrated, %d failed, %d timed out, "
                        + "%d titles renamed, %d silences (%d failed) in %d ms",
                runId, orgCount, orgsFailed, alertsMigrated, alertsFailed, alertsTimedOut,
                titlesRenamed, silencesCreated, silencesFailed, totalDurationMs);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime != null ? startTime.toString() : null);
        map.put("endTime", endTime != null ? endTime.toString() : null);
        map.put("totalDurationMs", totalDurationMs);
        map.put("orgCount", orgCount);
        map.put("orgsFailed", orgsFailed);
        map.put("alertsMigrated", alertsMigrated);
        map.put("alertsFailed", alertsFailed);
        map.put("alertsTimedOut", alertsTimedOut);
        map.put("titlesRenamed", titlesRenamed);
        map.put("silencesCreated", silencesCreated);
        map.put("silencesFailed", silencesFailed);
        Map<String, Long> phases = new LinkedHashMap<>();
        phaseDurations.forEach((p, d) -> phases.put(p.name(), d));
        map.put("phaseDurationsMs", phases);
        return map;
    }

    public static final class Builder {
        private long runId;
        private Instant startTime;
        private Instant endTime;
        private Map<Phase, Long> phaseDurations = Map.of();
        private long totalDurationMs;
        private int orgCount;
        private int orgsFailed;
        private int alertsMigrated;
        private int alertsFailed;
        private int alertsTimedOut;
        private int titlesRenamed;
        private int silencesCreated;
        private int silencesFailed;

        public Builder runId(long runId) { this.runId = runId; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }
        public Builder phaseDurations(Map<Phase, Long> phaseDurations) { this.phaseDurations = phaseDurations; return this; }
        public Builder totalDurationMs(long totalDurationMs) { this.totalDurationMs = totalDurationMs; return this; }
        public Builder orgCount(int orgCount) { this.orgCount = orgCount; return this; }
        public Builder orgsFailed(int orgsFailed) { this.orgsFailed = orgsFailed; return this; }
        public Builder alertsMigrated(int alertsMigrated) { this.alertsMigrated = alertsMigrated; return this; }
        public Builder alertsFailed(int alertsFailed) { this.alertsFailed = alertsFailed; return this; }
        public Builder alertsTimedOut(int alertsTimedOut) { this.alertsTimedOut = alertsTimedOut; return this; }
        public Builder titlesRenamed(int titlesRenamed) { this.titlesRenamed = titlesRenamed; return this; }
        public Builder silencesCreated(int silencesCreated) { this.silencesCreated = silencesCreated; return this; }
        public Builder silencesFailed(int silencesFailed) { this.silencesFailed = silencesFailed; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(runId, startTime, endTime, phaseDurations, totalDurationMs,
                    orgCount, orgsFailed, alertsMigrated, alertsFailed, alertsTimedOut,
                    titlesRenamed, silencesCreated, silencesFailed);
        }
    }
}
