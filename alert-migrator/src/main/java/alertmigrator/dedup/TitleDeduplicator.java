package alertmigrator.dedup;

import alertmigrator.exceptions.DeduplicationExhaustedException;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Keeps rule titles of one folder unique and within the store's length limit.
 *
 * <p>One instance per folder per organization, discarded after the run. Not
 * thread-safe: alerts of an organization are migrated sequentially.
 *
 * <p>Protocol for every title: {@link #truncate}, then {@link #deduplicate} if
 * {@link #contains} reports a collision, then {@link #add} exactly once.
 *
 * <p>Collisions are resolved with numeric suffixes ({@code " #2"}, {@code " #3"}, ...)
 * and, on the last allowed attempt, a random suffix. The base name is shortened
 * so that base plus suffix never exceeds the maximum length.
 */
public final class TitleDeduplicator {

    private static final int RANDOM_SUFFIX_LENGTH = 8;

    private final Set<String> claimed = new HashSet<>();
    private final boolean caseInsensitive;
    private final int maxLength;
    private final int maxAttempts;
    private final Supplier<String> randomSuffix;

    /**
     * @param caseInsensitive true if the backing store compares titles ignoring case
     * @param maxLength maximum title length
     * @param maxAttempts candidate names tried before giving up
     */
    public TitleDeduplicator(boolean caseInsensitive, int maxLength, int maxAttempts) {
        this(caseInsensitive, maxLength, maxAttempts, () -> ShortUid.generate(RANDOM_SUFFIX_LENGTH));
    }

    TitleDeduplicator(boolean caseInsensitive, int maxLength, int maxAttempts, Supplier<String> randomSuffix) {
        if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be positive");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
        this.caseInsensitive = caseInsensitive;
        this.maxLength = maxLength;
        this.maxAttempts = maxAttempts;
        this.randomSuffix = randomSuffix;
    }

    /** Cuts the name to the maximum length. */
    public String truncate(String name) {
        return name.length() > maxLength ? name.substring(0, maxLength) : name;
    }

    /** Returns true if the name is already claimed, honouring the case policy. */
    public boolean contains(String name) {
        return claimed.contains(key(name));
    }

    /** Claims the name. */
    public void add(String name) {
        claimed.add(key(name));
    }

    /**
     * Finds an unclaimed variant of the name. Does not claim it.
     *
     * @param name the colliding name
     * @return a free name no longer than the maximum length
     * @throws DeduplicationExhaustedException if every attempt collided
     */
    public String deduplicate(String name) throws DeduplicationExhaustedException {
        String base = truncate(name);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String suffix = attempt < maxAttempts ? " #" + (attempt + 1) : "_" + randomSuffix.get();
            String candidate = withSuffix(base, suffix);
            if (!contains(candidate)) {
                return candidate;
            }
        }
        throw new DeduplicationExhaustedException(name, maxAttempts);
    }

    public int size() {
        return claimed.size();
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public int maxLength() {
        return maxLength;
    }

    private String withSuffix(String base, String suffix) {
        int room = maxLength - suffix.length();
        if (room <= 0) {
            return truncate(suffix);
        }
        return (base.length() > room ? base.substring(0, room) : base) + suffix;
    }

    private String key(String name) {
        return caseInsensitive ? name.toLowerCase(Locale.ROOT) : name;
    }
}
