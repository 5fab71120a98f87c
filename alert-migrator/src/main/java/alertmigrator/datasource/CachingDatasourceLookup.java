package alertmigrator.datasource;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link DatasourceLookup} decorator that remembers every answer, including
 * misses, for the lifetime of a run. Legacy alerts of one organization tend to
 * share a handful of datasources.
 */
public final class CachingDatasourceLookup implements DatasourceLookup {

    private record IdKey(long orgId, long id) {}

    private record UidKey(long orgId, String uid) {}

    private final DatasourceLookup delegate;
    private final ConcurrentMap<IdKey, Optional<Datasource>> byId = new ConcurrentHashMap<>();
    private final ConcurrentMap<UidKey, Optional<Datasource>> byUid = new ConcurrentHashMap<>();

    public CachingDatasourceLookup(DatasourceLookup delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Optional<Datasource> byId(long orgId, long id) {
        return byId.computeIfAbsent(new IdKey(orgId, id), k -> orEmpty(delegate.byId(k.orgId(), k.id())));
    }

    @Override
    public Optional<Datasource> byUid(long orgId, String uid) {
        if (uid == null || uid.isEmpty()) {
            return Optional.empty();
        }
        return byUid.computeIfAbsent(new UidKey(orgId, uid), k -> orEmpty(delegate.byUid(k.orgId(), k.uid())));
    }

    // A null answer is a miss
    private static Optional<Datasource> orEmpty(Optional<Datasource> answer) {
        return answer != null ? answer : Optional.empty();
    }
}
