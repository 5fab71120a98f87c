package alertmigrator.model;

/**
 * State a unified rule takes when its queries return no data.
 */
public enum NoDataState {
    ALERTING("Alerting"),
    NO_DATA("NoData"),
    OK("OK");

    private final String value;

    NoDataState(String value) {
        this.value = value;
    }

    /** Name used by the unified alerting store. */
    public String value() {
        return value;
    }
}
