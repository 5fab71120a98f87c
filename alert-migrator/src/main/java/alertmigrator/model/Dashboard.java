package alertmigrator.model;

/**
 * Dashboard a legacy alert belongs to.
 *
 * @param uid dashboard UID, copied to the rule as back-reference
 * @param title dashboard title, used in the rule group name
 * @param folderUid folder the dashboard lives in
 */
public record Dashboard(String uid, String title, String folderUid) {
}
