package alertmigrator.store;

import alertmigrator.model.DashboardAlert;

import java.util.List;

/**
 * Supplies the legacy alerts to migrate.
 *
 * <p>Called concurrently for different organizations when the run migrates
 * organizations in parallel.
 */
public interface LegacyAlertSource {

    /** Organizations to migrate, in the order they should be reported. */
    List<Long> orgIds();

    /**
     * Legacy alerts of an organization with their dashboard and target folder,
     * in migration order.
     */
    List<DashboardAlert> alerts(long orgId);
}
