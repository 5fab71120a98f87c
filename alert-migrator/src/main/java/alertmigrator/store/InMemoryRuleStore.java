package alertmigrator.store;

import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link RuleStore} keeping everything in memory, for dry runs and tests.
 */
public final class InMemoryRuleStore implements RuleStore {

    private final Map<Long, List<UnifiedRule>> rules = new ConcurrentHashMap<>();
    private final Map<Long, List<Silence>> silences = new ConcurrentHashMap<>();

    @Override
    public void saveRules(long orgId, List<UnifiedRule> orgRules) {
        rules.computeIfAbsent(orgId, k -> new CopyOnWriteArrayList<>()).addAll(orgRules);
    }

    @Override
    public void saveSilences(long orgId, List<Silence> orgSilences) {
        silences.computeIfAbsent(orgId, k -> new CopyOnWriteArrayList<>()).addAll(orgSilences);
    }

    public List<UnifiedRule> rules(long orgId) {
        return List.copyOf(rules.getOrDefault(orgId, List.of()));
    }

    public List<Silence> silences(long orgId) {
        return List.copyOf(silences.getOrDefault(orgId, List.of()));
    }
}
