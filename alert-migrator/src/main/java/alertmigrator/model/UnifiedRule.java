package alertmigrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A migrated, folder-scoped alert rule.
 *
 * <p>Built once by {@link alertmigrator.engine.RuleAssembler} and never modified
 * afterwards; all collections are unmodifiable copies.
 *
 * <p>Reserved keys always present on a migrated rule:
 * <ul>
 *   <li>label {@link #RULE_UID_LABEL}, used for routing and silence matching</li>
 *   <li>annotations {@link #DASHBOARD_UID_ANNOTATION}, {@link #PANEL_ID_ANNOTATION},
 *       {@link #ALERT_ID_ANNOTATION} and {@link #MESSAGE_ANNOTATION}</li>
 * </ul>
 */
public final class UnifiedRule {

    public static final String RULE_UID_LABEL = "__alert_rule_uid__";
    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    public static final String PANEL_ID_ANNOTATION = "__panelId__";
    public static final String ALERT_ID_ANNOTATION = "__alertId__";
    public static final String MESSAGE_ANNOTATION = "message";

    private final long orgId;
    private final String uid;
    private final String title;
    private final String condition;
    private final List<AlertQuery> data;
    private final long intervalSeconds;
    private final String namespaceUid;
    private final String dashboardUid;
    private final Long panelId;
    private final String ruleGroup;
    private final int ruleGroupIndex;
    private final Duration forDuration;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final boolean paused;
    private final NoDataState noDataState;
    private final ExecErrState execErrState;
    private final long version;
    private final Instant updated;

    private UnifiedRule(Builder b) {
        this.orgId = b.orgId;
        this.uid = Objects.requireNonNull(b.uid, "uid");
        this.title = Objects.requireNonNull(b.title, "title");
        this.condition = Objects.requireNonNull(b.condition, "condition");
        this.data = List.copyOf(b.data);
        this.intervalSeconds = b.intervalSeconds;
        this.namespaceUid = Objects.requireNonNull(b.namespaceUid, "namespaceUid");
        this.dashboardUid = b.dashboardUid;
        this.panelId = b.panelId;
        this.ruleGroup = Objects.requireNonNull(b.ruleGroup, "ruleGroup");
        this.ruleGroupIndex = b.ruleGroupIndex;
        this.forDuration = b.forDuration;
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(b.annotations));
        this.paused = b.paused;
        this.noDataState = Objects.requireNonNull(b.noDataState, "noDataState");
        this.execErrState = Objects.requireNonNull(b.execErrState, "execErrState");
        this.version = b.version;
        this.updated = Objects.requireNonNull(b.updated, "updated");
    }

    public static Builder builder() {
        return new Builder();
    }

    public long orgId() { return orgId; }

    public String uid() { return uid; }

    public String title() { return title; }

    /** RefId of the query that decides the alert state. */
    public String condition() { return condition; }

    public List<AlertQuery> data() { return data; }

    public long intervalSeconds() { return intervalSeconds; }

    /** Folder UID the rule lives in. */
    public String namespaceUid() { return namespaceUid; }

    public String dashboardUid() { return dashboardUid; }

    public Long panelId() { return panelId; }

    public String ruleGroup() { return ruleGroup; }

    public int ruleGroupIndex() { return ruleGroupIndex; }

    public Duration forDuration() { return forDuration; }

    public Map<String, String> labels() { return labels; }

    public Map<String, String> annotations() { return annotations; }

    public boolean isPaused() { return paused; }

    public NoDataState noDataState() { return noDataState; }

    public ExecErrState execErrState() { return execErrState; }

    public long version() { return version; }

    public Instant updated() { return updated; }

    @Override
    public String toString() {
        return "UnifiedRule{" +
                "orgId=" + orgId +
                ", uid='" + uid + '\'' +
                ", title='" + title + '\'' +
                ", namespaceUid='" + namespaceUid + '\'' +
                ", ruleGroup='" + ruleGroup + '\'' +
                ", intervalSeconds=" + intervalSeconds +
                ", paused=" + paused +
                '}';
    }

    /**
     * Builder for {@link UnifiedRule}. Group index and version default to 1.
     */
    public static final class Builder {
        private long orgId;
        private String uid;
        private String title;
        private String condition;
        private List<AlertQuery> data = List.of();
        private long intervalSeconds;
        private String namespaceUid;
        private String dashboardUid;
        private Long panelId;
        private String ruleGroup;
        private int ruleGroupIndex = 1;
        private Duration forDuration = Duration.ZERO;
        private Map<String, String> labels = Map.of();
        private Map<String, String> annotations = Map.of();
        private boolean paused;
        private NoDataState noDataState = NoDataState.NO_DATA;
        private ExecErrState execErrState = ExecErrState.ALERTING;
        private long version = 1;
        private Instant updated;

        public Builder orgId(long orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder data(List<AlertQuery> data) {
            this.data = data;
            return this;
        }

        public Builder intervalSeconds(long intervalSeconds) {
            if (intervalSeconds <= 0) throw new IllegalArgumentException("intervalSeconds must be positive");
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public Builder namespaceUid(String namespaceUid) {
            this.namespaceUid = namespaceUid;
            return this;
        }

        public Builder dashboardUid(String dashboardUid) {
            this.dashboardUid = dashboardUid;
            return this;
        }

        public Builder panelId(Long panelId) {
            this.panelId = panelId;
            return this;
        }

        public Builder ruleGroup(String ruleGroup) {
            this.ruleGroup = ruleGroup;
            return this;
        }

        public Builder ruleGroupIndex(int ruleGroupIndex) {
            this.ruleGroupIndex = ruleGroupIndex;
            return this;
        }

        public Builder forDuration(Duration forDuration) {
            this.forDuration = forDuration;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder annotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder paused(boolean paused) {
            this.paused = paused;
            return this;
        }

        public Builder noDataState(NoDataState noDataState) {
            this.noDataState = noDataState;
            return this;
        }

        public Builder execErrState(ExecErrState execErrState) {
            this.execErrState = execErrState;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder updated(Instant updated) {
            this.updated = updated;
            return this;
        }

        public UnifiedRule build() {
            if (intervalSeconds <= 0) throw new IllegalStateException("intervalSeconds not set");
            return new UnifiedRule(this);
        }
    }
}
