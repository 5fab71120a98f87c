package alertmigrator.model;

/**
 * Folder a migrated rule is placed in. The folder UID is the rule's namespace.
 */
public record Folder(String uid, String title) {
}
