package alertmigrator.engine;

import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.model.UnifiedRule;

import java.util.List;
import java.util.Optional;

/**
 * Result of a migration run: one entry per organization, in source order.
 */
public record MigrationReport(long runId, List<OrgMigrationResult> orgs, MigrationMetrics metrics) {

    public MigrationReport {
        orgs = List.copyOf(orgs);
    }

    public Optional<OrgMigrationResult> org(long orgId) {
        return orgs.stream().filter(o -> o.orgId() == orgId).findFirst();
    }

    public List<UnifiedRule> allRules() {
        return orgs.stream().flatMap(o -> o.rules().stream()).toList();
    }

    public boolean hasFailures() {
        return orgs.stream().anyMatch(o -> o.isFailed() || o.timedOut() || !o.failures().isEmpty());
    }
}
