package alertmigrator.store;

import alertmigrator.model.ChannelReference;
import alertmigrator.model.UnifiedRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link NotificationPolicyBuilder} that records routes per organization,
 * keyed by rule UID.
 */
public final class InMemoryNotificationPolicyBuilder implements NotificationPolicyBuilder {

    private final Map<Long, Map<String, List<ChannelReference>>> routes = new ConcurrentHashMap<>();

    @Override
    public void addRoute(long orgId, UnifiedRule rule, List<ChannelReference> channels) {
        routes.computeIfAbsent(orgId, k -> new ConcurrentHashMap<>()).put(rule.uid(), List.copyOf(channels));
    }

    /** Routes of an organization: rule UID to channels. */
    public Map<String, List<ChannelReference>> routes(long orgId) {
        return new LinkedHashMap<>(routes.getOrDefault(orgId, Map.of()));
    }
}
