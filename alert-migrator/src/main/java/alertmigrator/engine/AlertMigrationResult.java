package alertmigrator.engine;

import alertmigrator.model.ChannelReference;
import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.util.List;

/**
 * Output of migrating one legacy alert.
 *
 * @param rule the migrated rule
 * @param silences "keep last state" silences for the rule, possibly empty
 * @param channels notification channels the legacy alert used
 */
public record AlertMigrationResult(UnifiedRule rule, List<Silence> silences, List<ChannelReference> channels) {

    public AlertMigrationResult {
        silences = List.copyOf(silences);
        channels = List.copyOf(channels);
    }
}
