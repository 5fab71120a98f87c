package alertmigrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One classic condition of a legacy alert, e.g.
 * {@code WHEN avg() OF query(A, 5m, now) IS ABOVE 90}.
 *
 * @param type condition type, always {@code query} for legacy alerts
 * @param evaluator threshold check
 * @param operator how this condition combines with the previous one ({@code and}/{@code or})
 * @param query the query reference
 * @param reducer series reducer ({@code avg}, {@code max}, ...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyCondition(
        String type,
        Evaluator evaluator,
        Operator operator,
        Query query,
        Reducer reducer
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Evaluator(String type, List<Double> params) {
        public Evaluator {
            params = params == null ? List.of() : List.copyOf(params);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Operator(String type) {
    }

    /**
     * @param params {@code [refId, from, to]}
     * @param datasourceId legacy numeric datasource id
     * @param model datasource specific query model
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Query(List<String> params, long datasourceId, JsonNode model) {
        public Query {
            params = params == null ? List.of() : List.copyOf(params);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Reducer(String type, List<Object> params) {
    }
}
