package alertmigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link alertmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: run and org start/finish, per-alert results, warnings, errors</li>
 *   <li>{@link #WARNING} - renamed titles, failed silences, skipped alerts and errors</li>
 *   <li>{@link #ERROR} - errors only (failed organizations, timeouts)</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors only. The default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
