package alertmigrator.exceptions;

/**
 * Thrown when a legacy condition cannot be turned into unified queries.
 */
public class ConditionTranslationException extends MigrateException {

    public static final String STAGE = "CONDITION_TRANSLATION";

    public ConditionTranslationException(String message) {
        super(message, STAGE, null);
    }

    public ConditionTranslationException(String message, Throwable cause) {
        super(message, STAGE, cause);
    }
}
