package alertmigrator.exceptions;

/**
 * Thrown when a query model is not a JSON object and cannot be repaired.
 */
public class MalformedQueryException extends MigrateException {

    public static final String STAGE = "QUERY_REPAIR";

    public MalformedQueryException(String message) {
        super(message, STAGE, null);
    }

    public MalformedQueryException(String message, Throwable cause) {
        super(message, STAGE, cause);
    }
}
