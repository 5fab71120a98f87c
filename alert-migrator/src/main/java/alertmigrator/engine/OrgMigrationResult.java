package alertmigrator.engine;

import alertmigrator.model.ChannelReference;
import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of migrating one organization.
 *
 * <p>{@code error} is set when the organization as a whole failed (alert source
 * or persistence failure); per-alert failures only show up in {@code failures}.
 *
 * @param orgId the organization
 * @param rules migrated rules, in migration order
 * @param silences compatibility silences
 * @param channels channel references per rule UID
 * @param failures skipped alerts
 * @param timedOut true if the run deadline stopped the organization early
 * @param error organization-level failure, or null
 */
public record OrgMigrationResult(
        long orgId,
        List<UnifiedRule> rules,
        List<Silence> silences,
        Map<String, List<ChannelReference>> channels,
        List<AlertFailure> failures,
        boolean timedOut,
        String error
) {
    public OrgMigrationResult {
        rules = List.copyOf(rules);
        silences = List.copyOf(silences);
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        failures = List.copyOf(failures);
    }

    static OrgMigrationResult failed(long orgId, Throwable error) {
        return new OrgMigrationResult(orgId, List.of(), List.of(), Map.of(), List.of(), false,
                error != null ? error.getMessage() : "Unknown error");
    }

    public boolean isFailed() {
        return error != null;
    }
}
