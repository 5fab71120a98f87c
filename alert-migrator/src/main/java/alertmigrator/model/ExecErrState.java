package alertmigrator.model;

/**
 * State a unified rule takes when query execution fails.
 */
public enum ExecErrState {
    ALERTING("Alerting"),
    ERROR("Error"),
    OK("OK");

    private final String value;

    ExecErrState(String value) {
        this.value = value;
    }

    /** Name used by the unified alerting store. */
    public String value() {
        return value;
    }
}
