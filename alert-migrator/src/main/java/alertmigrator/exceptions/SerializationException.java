package alertmigrator.exceptions;

/**
 * Thrown when a repaired query model cannot be encoded back to JSON.
 */
public class SerializationException extends MigrateException {

    public static final String STAGE = "SERIALIZATION";

    public SerializationException(String message) {
        super(message, STAGE, null);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, STAGE, cause);
    }
}
