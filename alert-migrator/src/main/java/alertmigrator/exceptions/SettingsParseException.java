package alertmigrator.exceptions;

/**
 * Thrown when a legacy alert's settings JSON cannot be decoded.
 */
public class SettingsParseException extends MigrateException {

    public static final String STAGE = "SETTINGS";

    public SettingsParseException(String message) {
        super(message, STAGE, null);
    }

    public SettingsParseException(String message, Throwable cause) {
        super(message, STAGE, cause);
    }
}
