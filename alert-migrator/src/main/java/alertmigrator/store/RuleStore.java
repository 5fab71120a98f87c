package alertmigrator.store;

import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.util.List;

/**
 * Persists the output of a migrated organization. Implementations own the
 * storage format; a runtime failure fails the migration of that organization only.
 */
public interface RuleStore {

    void saveRules(long orgId, List<UnifiedRule> rules);

    void saveSilences(long orgId, List<Silence> silences);
}
