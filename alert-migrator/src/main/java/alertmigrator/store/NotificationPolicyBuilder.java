package alertmigrator.store;

import alertmigrator.model.ChannelReference;
import alertmigrator.model.UnifiedRule;

import java.util.List;

/**
 * Receives the legacy notification channels of every migrated rule so that
 * the unified notification policy can route the rule's alerts to them.
 */
public interface NotificationPolicyBuilder {

    /**
     * @param orgId organization of the rule
     * @param rule the migrated rule, routable through {@link UnifiedRule#RULE_UID_LABEL}
     * @param channels channels the legacy alert notified, may be empty
     */
    void addRoute(long orgId, UnifiedRule rule, List<ChannelReference> channels);
}
