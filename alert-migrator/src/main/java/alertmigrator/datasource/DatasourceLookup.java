package alertmigrator.datasource;

import java.util.Optional;

/**
 * Resolves datasources of an organization.
 *
 * <p>Implementations may block on I/O. The migration never retries a lookup;
 * a failure aborts the migration of the current alert only. Implementations
 * must be safe to call from several organizations concurrently.
 */
public interface DatasourceLookup {

    /**
     * Finds a datasource by its legacy numeric id.
     *
     * @param orgId the owning organization
     * @param id the legacy datasource id
     * @return the datasource, or empty if none exists
     */
    Optional<Datasource> byId(long orgId, long id);

    /**
     * Finds a datasource by UID.
     *
     * @param orgId the owning organization
     * @param uid the datasource UID
     * @return the datasource, or empty if none exists
     */
    Optional<Datasource> byUid(long orgId, String uid);
}
