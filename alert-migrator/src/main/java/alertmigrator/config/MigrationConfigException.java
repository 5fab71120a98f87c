package alertmigrator.config;

/**
 * Exception thrown when migration configuration cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>Configuration file cannot be parsed (invalid YAML/properties syntax)</li>
 *   <li>A builder receives an out-of-range value (e.g., a non-positive length limit)</li>
 * </ul>
 *
 * @see MigrationConfigLoader
 * @see MigrationConfig
 */
public class MigrationConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public MigrationConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
