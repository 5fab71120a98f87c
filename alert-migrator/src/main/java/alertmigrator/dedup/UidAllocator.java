package alertmigrator.dedup;

import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.DeduplicationExhaustedException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Issues rule UIDs that are unique across a whole migration run.
 *
 * <p>Unlike {@link TitleDeduplicator} a single instance is shared by every
 * organization of the run, so it is thread-safe.
 */
public final class UidAllocator {

    private final Set<String> issued = ConcurrentHashMap.newKeySet();
    private final int maxLength;
    private final int maxAttempts;
    private final Supplier<String> generator;

    public UidAllocator(MigrationConfig config) {
        this(config.maxUidLength(), config.dedupMaxAttempts(), () -> ShortUid.generate(config.uidLength()));
    }

    public UidAllocator(int maxLength, int maxAttempts, Supplier<String> generator) {
        if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be positive");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
        this.maxLength = maxLength;
        this.maxAttempts = maxAttempts;
        this.generator = generator;
    }

    /**
     * Allocates a fresh UID.
     *
     * @return a UID not issued or reserved before in this run
     * @throws DeduplicationExhaustedException if every generated candidate collided
     */
    public String allocate() throws DeduplicationExhaustedException {
        String last = "";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String uid = generator.get();
            if (uid.length() > maxLength) {
                uid = uid.substring(0, maxLength);
            }
            last = uid;
            if (!uid.isEmpty() && issued.add(uid)) {
                return uid;
            }
        }
        throw new DeduplicationExhaustedException("rule uid " + last, maxAttempts);
    }

    /**
     * Marks an existing UID as taken, e.g. one already present in the target store.
     *
     * @return false if the UID was already taken
     */
    public boolean reserve(String uid) {
        return issued.add(uid);
    }

    public boolean isTaken(String uid) {
        return issued.contains(uid);
    }

    public int size() {
        return issued.size();
    }
}
