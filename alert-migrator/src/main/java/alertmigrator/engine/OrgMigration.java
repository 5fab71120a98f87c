package alertmigrator.engine;

import alertmigrator.config.MigrationConfig;
import alertmigrator.dedup.TitleDeduplicator;
import alertmigrator.dedup.UidAllocator;
import alertmigrator.exceptions.DeduplicationExhaustedException;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.model.ChannelReference;
import alertmigrator.model.LegacyAlert;
import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state of one organization during a run.
 *
 * <p>Owns a {@link TitleDeduplicator} per folder and collects the migrated
 * rules, silences and channel references until they are persisted. The
 * {@link UidAllocator} is shared with every other organization of the run.
 *
 * <p>Not thread-safe: one thread migrates the alerts of an organization in order.
 */
public final class OrgMigration {

    private final long orgId;
    private final MigrationConfig config;
    private final UidAllocator uids;

    private final Map<String, TitleDeduplicator> titleDedup = new HashMap<>();
    private final List<UnifiedRule> rules = new ArrayList<>();
    private final List<Silence> silences = new ArrayList<>();
    private final Map<String, List<ChannelReference>> channels = new LinkedHashMap<>();
    private final List<AlertFailure> failures = new ArrayList<>();

    public OrgMigration(long orgId, MigrationConfig config, UidAllocator uids) {
        this.orgId = orgId;
        this.config = Objects.requireNonNull(config, "config");
        this.uids = Objects.requireNonNull(uids, "uids");
    }

    public long orgId() {
        return orgId;
    }

    /**
     * Deduplicator of a folder, created on first use with the configured case
     * policy and title length limit.
     */
    public TitleDeduplicator titleDeduplicator(String folderUid) {
        return titleDedup.computeIfAbsent(folderUid, k -> new TitleDeduplicator(
                config.caseInsensitiveTitles(), config.maxTitleLength(), config.dedupMaxAttempts()));
    }

    public String allocateUid() throws DeduplicationExhaustedException {
        return uids.allocate();
    }

    void record(AlertMigrationResult result) {
        rules.add(result.rule());
        silences.addAll(result.silences());
        channels.put(result.rule().uid(), result.channels());
    }

    void recordFailure(LegacyAlert alert, MigrateException e) {
        failures.add(new AlertFailure(alert.id(), alert.name(), e.getStage(), e.getMessage()));
    }

    List<UnifiedRule> rules() {
        return rules;
    }

    List<Silence> silences() {
        return silences;
    }

    Map<String, List<ChannelReference>> channels() {
        return channels;
    }

    int failureCount() {
        return failures.size();
    }

    OrgMigrationResult toResult(boolean timedOut) {
        return new OrgMigrationResult(orgId, rules, silences, channels, failures, timedOut, null);
    }
}
