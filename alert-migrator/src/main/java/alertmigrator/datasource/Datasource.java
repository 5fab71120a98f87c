package alertmigrator.datasource;

/**
 * Datasource descriptor as needed by the migration.
 *
 * @param id legacy numeric id
 * @param uid datasource UID referenced by unified queries
 * @param name display name
 * @param type plugin type, e.g. {@code prometheus} or {@code graphite}
 */
public record Datasource(long id, String uid, String name, String type) {

    public static final String TYPE_PROMETHEUS = "prometheus";

    public boolean isPrometheus() {
        return TYPE_PROMETHEUS.equals(type);
    }
}
