package alertmigrator.exceptions;

import java.time.Duration;

/**
 * Exception raised when a migration run exceeds its configured deadline.
 *
 * <p>The deadline is only checked between alerts, never in the middle of the
 * per-alert pipeline, so an alert is either fully migrated or not touched.
 * The engine catches this exception per organization, logs it, and marks the
 * organization's result as timed out.
 *
 * @see alertmigrator.config.MigrationConfig#runTimeout()
 */
public class MigrationTimeoutException extends RuntimeException {

    private final long orgId;
    private final Duration timeout;
    private final int remainingAlerts;

    /**
     * Creates a new timeout exception.
     *
     * @param orgId the organization being migrated when the deadline passed
     * @param timeout the configured run timeout that was exceeded
     * @param remainingAlerts alerts of the organization left unmigrated
     */
    public MigrationTimeoutException(long orgId, Duration timeout, int remainingAlerts) {
        super(String.format("Migration of org %d timed out after %d ms with %d alerts remaining",
                orgId, timeout.toMillis(), remainingAlerts));
        this.orgId = orgId;
        this.timeout = timeout;
        this.remainingAlerts = remainingAlerts;
    }

    public long getOrgId() {
        return orgId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getRemainingAlerts() {
        return remainingAlerts;
    }
}
