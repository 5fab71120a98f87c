package alertmigrator.model;

/**
 * Equality label matcher of a {@link Silence}.
 */
public record Matcher(String name, String value) {
}
