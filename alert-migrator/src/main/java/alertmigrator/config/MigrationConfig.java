package alertmigrator.config;

import java.time.Duration;

/**
 * Central configuration for a migration run.
 *
 * <p>This class encapsulates all configurable parameters of the migration
 * engine, including:
 * <ul>
 *   <li>Scheduler base interval used to quantize rule intervals</li>
 *   <li>Length limits and case policy for rule titles, UIDs and group names</li>
 *   <li>Rule group naming mode and deduplication attempt bound</li>
 *   <li>Compatibility silence duration</li>
 *   <li>Organization parallelism, run timeout and alert level</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code migration.properties} or
 * {@code migration.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    /** Length limit of rule titles in the unified alert rule store. */
    public static final int DEFAULT_MAX_TITLE_LENGTH = 190;

    /** Length limit of rule UIDs in the unified alert rule store. */
    public static final int DEFAULT_MAX_UID_LENGTH = 40;

    public static final MigrationConfig DEFAULTS = builder().build();

    private final long baseIntervalSeconds;
    private final int maxTitleLength;
    private final boolean caseInsensitiveTitles;
    private final int maxUidLength;
    private final int uidLength;
    private final RuleGroupMode ruleGroupMode;
    private final int maxRuleGroupLength;
    private final int dedupMaxAttempts;
    private final Duration silenceDuration;
    private final int orgParallelism;
    private final Duration runTimeout;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.baseIntervalSeconds = b.baseIntervalSeconds;
        this.maxTitleLength = b.maxTitleLength;
        this.caseInsensitiveTitles = b.caseInsensitiveTitles;
        this.maxUidLength = b.maxUidLength;
        this.uidLength = Math.min(b.uidLength, b.maxUidLength);
        this.ruleGroupMode = b.ruleGroupMode;
        this.maxRuleGroupLength = b.maxRuleGroupLength;
        this.dedupMaxAttempts = b.dedupMaxAttempts;
        this.silenceDuration = b.silenceDuration;
        this.orgParallelism = b.orgParallelism;
        this.runTimeout = b.runTimeout;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the scheduler granularity in seconds; rule intervals are multiples of it. */
    public long baseIntervalSeconds() { return baseIntervalSeconds; }

    /** Returns the maximum rule title length. */
    public int maxTitleLength() { return maxTitleLength; }

    /** Returns true if titles in a folder are compared ignoring case (the store's collation). */
    public boolean caseInsensitiveTitles() { return caseInsensitiveTitles; }

    /** Returns the maximum rule UID length. */
    public int maxUidLength() { return maxUidLength; }

    /** Returns the length of generated rule UIDs, never above {@link #maxUidLength()}. */
    public int uidLength() { return uidLength; }

    /** Returns the rule group naming mode. */
    public RuleGroupMode ruleGroupMode() { return ruleGroupMode; }

    /** Returns the maximum rule group name length. */
    public int maxRuleGroupLength() { return maxRuleGroupLength; }

    /** Returns how many candidate names the deduplicators try before giving up. */
    public int dedupMaxAttempts() { return dedupMaxAttempts; }

    /** Returns how long compatibility silences stay active. */
    public Duration silenceDuration() { return silenceDuration; }

    /** Returns the number of organizations migrated concurrently. */
    public int orgParallelism() { return orgParallelism; }

    /** Returns the run timeout, or {@link Duration#ZERO} if disabled. */
    public Duration runTimeout() { return runTimeout; }

    /** Returns true if a run timeout is configured. */
    public boolean hasRunTimeout() { return !runTimeout.isZero() && !runTimeout.isNegative(); }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "baseIntervalSeconds=" + baseIntervalSeconds +
                ", maxTitleLength=" + maxTitleLength +
                ", caseInsensitiveTitles=" + caseInsensitiveTitles +
                ", maxUidLength=" + maxUidLength +
                ", uidLength=" + uidLength +
                ", ruleGroupMode=" + ruleGroupMode +
                ", maxRuleGroupLength=" + maxRuleGroupLength +
                ", dedupMaxAttempts=" + dedupMaxAttempts +
                ", silenceDuration=" + silenceDuration.toDays() + "d" +
                ", orgParallelism=" + orgParallelism +
                ", runTimeout=" + runTimeout.toSeconds() + "s" +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private long baseIntervalSeconds = 10;
        private int maxTitleLength = DEFAULT_MAX_TITLE_LENGTH;
        private boolean caseInsensitiveTitles = true;
        private int maxUidLength = DEFAULT_MAX_UID_LENGTH;
        private int uidLength = 14;
        private RuleGroupMode ruleGroupMode = RuleGroupMode.DASHBOARD_PANEL;
        private int maxRuleGroupLength = DEFAULT_MAX_TITLE_LENGTH;
        private int dedupMaxAttempts = 10;
        private Duration silenceDuration = Duration.ofDays(365);
        private int orgParallelism = 1;
        private Duration runTimeout = Duration.ZERO;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder baseIntervalSeconds(long seconds) {
            this.baseIntervalSeconds = positive("baseIntervalSeconds", seconds);
            return this;
        }

        public Builder maxTitleLength(int length) {
            this.maxTitleLength = (int) positive("maxTitleLength", length);
            return this;
        }

        public Builder caseInsensitiveTitles(boolean caseInsensitive) {
            this.caseInsensitiveTitles = caseInsensitive;
            return this;
        }

        public Builder maxUidLength(int length) {
            this.maxUidLength = (int) positive("maxUidLength", length);
            return this;
        }

        public Builder uidLength(int length) {
            this.uidLength = (int) positive("uidLength", length);
            return this;
        }

        public Builder ruleGroupMode(RuleGroupMode mode) {
            this.ruleGroupMode = mode;
            return this;
        }

        public Builder maxRuleGroupLength(int length) {
            this.maxRuleGroupLength = (int) positive("maxRuleGroupLength", length);
            return this;
        }

        public Builder dedupMaxAttempts(int attempts) {
            this.dedupMaxAttempts = (int) positive("dedupMaxAttempts", attempts);
            return this;
        }

        public Builder silenceDuration(Duration duration) {
            this.silenceDuration = duration;
            return this;
        }

        public Builder silenceDurationDays(long days) {
            return silenceDuration(Duration.ofDays(positive("silenceDurationDays", days)));
        }

        public Builder orgParallelism(int parallelism) {
            this.orgParallelism = (int) positive("orgParallelism", parallelism);
            return this;
        }

        public Builder runTimeout(Duration timeout) {
            this.runTimeout = timeout;
            return this;
        }

        public Builder runTimeoutSeconds(long seconds) {
            return runTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }

        private static long positive(String name, long value) {
            if (value <= 0) throw new MigrationConfigException(name + " must be positive");
            return value;
        }
    }
}
