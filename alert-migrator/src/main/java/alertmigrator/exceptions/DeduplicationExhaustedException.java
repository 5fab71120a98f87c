package alertmigrator.exceptions;

/**
 * Thrown when every allowed attempt to find a free rule title or rule UID
 * collided with an already claimed value.
 *
 * @see alertmigrator.dedup.TitleDeduplicator
 * @see alertmigrator.dedup.UidAllocator
 */
public class DeduplicationExhaustedException extends MigrateException {

    public static final String STAGE = "DEDUPLICATION";

    private final String candidate;
    private final int attempts;

    /**
     * Creates a new exhaustion exception.
     *
     * @param candidate the name that could not be made unique
     * @param attempts the number of attempts made
     */
    public DeduplicationExhaustedException(String candidate, int attempts) {
        super(String.format("Failed to deduplicate '%s' after %d attempts", candidate, attempts), STAGE, null);
        this.candidate = candidate;
        this.attempts = attempts;
    }

    /** The name that could not be made unique. */
    public String getCandidate() {
        return candidate;
    }

    /** The number of attempts made before giving up. */
    public int getAttempts() {
        return attempts;
    }
}
