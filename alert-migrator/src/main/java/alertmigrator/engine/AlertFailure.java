package alertmigrator.engine;

/**
 * A legacy alert that was skipped.
 *
 * @param alertId legacy alert id
 * @param alertName legacy alert name
 * @param stage pipeline stage that failed, or null if unknown
 * @param message failure description
 */
public record AlertFailure(long alertId, String alertName, String stage, String message) {
}
