package alertmigrator.exceptions;

/**
 * Exception thrown when migrating a single legacy alert fails.
 *
 * <p>Every failure in the per-alert pipeline is fatal to that alert only: the
 * engine logs it with the organization and alert context and continues with
 * the next alert. Subclasses identify the pipeline stage that failed:
 * <ul>
 *   <li>{@link SettingsParseException} - settings JSON could not be decoded</li>
 *   <li>{@link ConditionTranslationException} - legacy condition could not be translated</li>
 *   <li>{@link MalformedQueryException} - a query model is not a JSON object</li>
 *   <li>{@link SerializationException} - a repaired query model could not be re-encoded</li>
 *   <li>{@link DeduplicationExhaustedException} - no free title or UID was found</li>
 *   <li>{@link SilenceCreationException} - a compatibility silence could not be built</li>
 * </ul>
 *
 * @see alertmigrator.engine.RuleAssembler
 * @see alertmigrator.engine.MigrationEngine
 */
public class MigrateException extends Exception {

    private final String stage;

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        super(message);
        this.stage = null;
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        super(message, cause);
        this.stage = null;
    }

    /**
     * Creates a new migration exception for a pipeline stage.
     *
     * @param message the error message
     * @param stage the pipeline stage where the failure occurred
     * @param cause the underlying cause, may be null
     */
    public MigrateException(String message, String stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * Returns the pipeline stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (stage == null) {
            return base;
        }
        return base + " [stage=" + stage + "]";
    }
}
