package alertmigrator.model;

import java.util.Objects;

/**
 * One query of a unified rule.
 *
 * <p>The model is kept as raw JSON; only the query repair step looks inside it.
 *
 * @param refId reference id other queries and the condition use
 * @param queryType datasource specific query type, may be empty
 * @param timeRange relative time range
 * @param datasourceUid datasource UID, {@link #EXPRESSION_DATASOURCE_UID} for expressions
 * @param model raw JSON model
 */
public record AlertQuery(
        String refId,
        String queryType,
        RelativeTimeRange timeRange,
        String datasourceUid,
        String model
) {
    /** Datasource UID of server-side expressions. */
    public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

    public AlertQuery {
        Objects.requireNonNull(refId, "refId");
        Objects.requireNonNull(model, "model");
        queryType = queryType == null ? "" : queryType;
        timeRange = timeRange == null ? RelativeTimeRange.NONE : timeRange;
    }

    /** Returns true if this query is an expression evaluated by the alerting engine itself. */
    public boolean isExpression() {
        return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
    }

    public AlertQuery withModel(String newModel) {
        return new AlertQuery(refId, queryType, timeRange, datasourceUid, newModel);
    }
}
