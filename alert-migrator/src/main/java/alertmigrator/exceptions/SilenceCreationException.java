package alertmigrator.exceptions;

/**
 * Thrown when a "keep last state" compatibility silence cannot be built.
 *
 * <p>Never fatal: the assembler logs it and keeps the rule.
 */
public class SilenceCreationException extends MigrateException {

    public static final String STAGE = "SILENCE";

    public SilenceCreationException(String message) {
        super(message, STAGE, null);
    }

    public SilenceCreationException(String message, Throwable cause) {
        super(message, STAGE, cause);
    }
}
