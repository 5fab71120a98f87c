package alertmigrator.alert;

import alertmigrator.config.AlertLevel;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.MigrationTimeoutException;
import alertmigrator.metrics.MigrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Provides a consistent log format suitable for log aggregators (ELK, Splunk, etc.).
 * Log entries start with a marker like RUN_STARTED, ALERT_SKIPPED or ORG_FAILED
 * followed by key=value pairs for easy parsing and alerting.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: run and organization start/finish, migrated alerts</li>
 *   <li>WARN: renamed titles, failed silences, skipped alerts</li>
 *   <li>ERROR: failed organizations and timeouts</li>
 * </ul>
 * Failed silences, skipped alerts and errors are logged at every alert level.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED id=7 orgs=2
 * 12:00:00.010 INFO  migration - ORG_STARTED id=7 org=1 alerts=40
 * 12:00:00.020 WARN  migration - TITLE_RENAMED org=1 folder=fX1 old="CPU" new="CPU #2"
 * 12:00:00.030 WARN  migration - ALERT_SKIPPED org=1 alert=12 name="Disk" stage=QUERY_REPAIR error="..."
 * 12:00:00.500 INFO  migration - ORG_COMPLETED id=7 org=1 migrated=39 failed=1 duration_ms=490
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void runStarted(long runId, int orgCount) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} orgs={}", runId, orgCount);
        }
    }

    public static void orgStarted(long runId, long orgId, int alertCount) {
        if (shouldLogInfo()) {
            log.info("ORG_STARTED id={} org={} alerts={}", runId, orgId, alertCount);
        }
    }

    public static void alertMigrated(long orgId, long alertId, String ruleUid, String title) {
        if (shouldLogInfo()) {
            log.info("ALERT_MIGRATED org={} alert={} rule_uid={} title=\"{}\"", orgId, alertId, ruleUid, title);
        }
    }

    /**
     * Log when a rule title collided with an existing title in its folder.
     */
    public static void titleRenamed(long orgId, String folderUid, String oldTitle, String newTitle) {
        if (shouldLogWarn()) {
            log.warn("TITLE_RENAMED org={} folder={} old=\"{}\" new=\"{}\"", orgId, folderUid, oldTitle, newTitle);
        }
    }

    /**
     * Log when a compatibility silence could not be created. The rule is kept.
     *
     * @param kind which policy the silence was for ({@code NoData} or {@code Error})
     */
    public static void silenceFailed(long orgId, long alertId, String ruleTitle, String kind, Throwable error) {
        // Always log
        log.warn("SILENCE_FAILED org={} alert={} rule=\"{}\" kind={} error=\"{}\"",
                orgId, alertId, ruleTitle, kind, error.getMessage());
    }

    /**
     * Log when a legacy alert is skipped because its pipeline failed.
     */
    public static void alertSkipped(long orgId, long alertId, String alertName, MigrateException error) {
        // Always log
        log.warn("ALERT_SKIPPED org={} alert={} name=\"{}\" stage={} error=\"{}\"",
                orgId, alertId, alertName, error.getStage() != null ? error.getStage() : "UNKNOWN", error.getMessage());
    }

    public static void orgCompleted(long runId, long orgId, int migrated, int failed, long durationMs) {
        if (shouldLogInfo()) {
            log.info("ORG_COMPLETED id={} org={} migrated={} failed={} duration_ms={}",
                    runId, orgId, migrated, failed, durationMs);
        }
    }

    public static void orgFailed(long runId, long orgId, Throwable error) {
        // Always log errors
        log.error("ORG_FAILED id={} org={} error=\"{}\"", runId, orgId, error != null ? error.getMessage() : "Unknown error");
    }

    public static void runTimeout(long runId, MigrationTimeoutException timeout) {
        // Always log errors
        log.error("RUN_TIMEOUT id={} org={} timeout_ms={} remaining_alerts={}",
                runId, timeout.getOrgId(), timeout.getTimeout().toMillis(), timeout.getRemainingAlerts());
    }

    public static void runCompleted(long runId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} duration_ms={} orgs={} alerts_migrated={} alerts_failed={} silences={}",
                    runId,
                    metrics.totalDurationMs(),
                    metrics.orgCount(),
                    metrics.alertsMigrated(),
                    metrics.alertsFailed(),
                    metrics.silencesCreated());
        }
    }
}
