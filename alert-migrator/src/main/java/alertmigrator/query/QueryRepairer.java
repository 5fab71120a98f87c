package alertmigrator.query;

import alertmigrator.datasource.Datasource;
import alertmigrator.datasource.DatasourceLookup;
import alertmigrator.exceptions.MalformedQueryException;
import alertmigrator.exceptions.SerializationException;
import alertmigrator.json.ObjectMapperProvider;
import alertmigrator.model.AlertQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites query models that the legacy engine evaluated fine but the unified
 * engine would evaluate differently or not at all.
 *
 * <p>Each non-expression query model is decoded into a field map and run through:
 * <ol>
 *   <li>removal of the {@code hide} flag</li>
 *   <li>Graphite: {@code targetFull} (template variables expanded) replaces {@code target}</li>
 *   <li>Prometheus: a query that is both instant and range becomes a range query</li>
 * </ol>
 * Expression queries are returned unchanged.
 */
public final class QueryRepairer {

    private static final Logger log = LoggerFactory.getLogger(QueryRepairer.class);

    static final String HIDE_FIELD = "hide";
    static final String TARGET_FIELD = "target";
    static final String TARGET_FULL_FIELD = "targetFull";
    static final String INSTANT_FIELD = "instant";
    static final String RANGE_FIELD = "range";
    static final String DATASOURCE_FIELD = "datasource";

    private static final TypeReference<LinkedHashMap<String, JsonNode>> FIELD_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper = ObjectMapperProvider.get();
    private final DatasourceLookup datasources;

    /**
     * @param datasources used to find the datasource type when the model does not carry one
     */
    public QueryRepairer(DatasourceLookup datasources) {
        this.datasources = Objects.requireNonNull(datasources, "datasources");
    }

    /**
     * Repairs every query of a rule.
     *
     * @param orgId organization owning the queries
     * @param queries queries in evaluation order
     * @return repaired queries, same order and size
     * @throws MalformedQueryException if a model is not a JSON object
     * @throws SerializationException if a repaired model cannot be encoded
     */
    public List<AlertQuery> repairQueries(long orgId, List<AlertQuery> queries)
            throws MalformedQueryException, SerializationException {
        List<AlertQuery> result = new ArrayList<>(queries.size());
        for (AlertQuery query : queries) {
            result.add(repair(orgId, query));
        }
        return result;
    }

    AlertQuery repair(long orgId, AlertQuery query) throws MalformedQueryException, SerializationException {
        if (query.isExpression()) {
            return query;
        }
        Map<String, JsonNode> fields = decode(query);
        fields.remove(HIDE_FIELD);
        fixGraphiteReferencedSubQueries(fields);
        fixPrometheusBothTypeQuery(orgId, query, fields);
        return query.withModel(encode(query, fields));
    }

    private Map<String, JsonNode> decode(AlertQuery query) throws MalformedQueryException {
        Map<String, JsonNode> fields;
        try {
            fields = mapper.readValue(query.model(), FIELD_MAP);
        } catch (JsonProcessingException e) {
            throw new MalformedQueryException("Query " + query.refId() + " model is not a JSON object", e);
        }
        if (fields == null) {
            throw new MalformedQueryException("Query " + query.refId() + " model is null");
        }
        return fields;
    }

    private String encode(AlertQuery query, Map<String, JsonNode> fields) throws SerializationException {
        try {
            return mapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode repaired model of query " + query.refId(), e);
        }
    }

    /**
     * The legacy editor keeps template-expanded text in {@code targetFull};
     * the unified engine only evaluates {@code target}.
     */
    static void fixGraphiteReferencedSubQueries(Map<String, JsonNode> fields) {
        JsonNode full = fields.remove(TARGET_FULL_FIELD);
        if (full != null) {
            fields.put(TARGET_FIELD, full);
        }
    }

    /**
     * A Prometheus query that is both instant and range cannot be evaluated by
     * the unified engine; it becomes a range query.
     */
    void fixPrometheusBothTypeQuery(long orgId, AlertQuery query, Map<String, JsonNode> fields) {
        Optional<Boolean> instant = parseBoolean(fields.get(INSTANT_FIELD));
        if (instant.isEmpty()) {
            if (isPrometheus(orgId, query, fields)) {
                log.info("Failed to parse instant field on Prometheus query {}: {}", query.refId(), fields.get(INSTANT_FIELD));
            }
            return;
        }
        Optional<Boolean> range = parseBoolean(fields.get(RANGE_FIELD));
        if (range.isEmpty()) {
            if (isPrometheus(orgId, query, fields)) {
                log.info("Failed to parse range field on Prometheus query {}: {}", query.refId(), fields.get(RANGE_FIELD));
            }
            return;
        }

        if (!instant.get() || !range.get()) {
            return;
        }

        Optional<String> type = datasourceType(orgId, query, fields);
        if (type.isEmpty()) {
            log.info("Unable to convert query {} that resembles a Prometheus 'Both' type query to 'Range': "
                    + "datasource type unknown", query.refId());
            return;
        }
        if (!Datasource.TYPE_PROMETHEUS.equals(type.get())) {
            return;
        }

        log.warn("Prometheus 'Both' type queries are not supported in unified alerting. Converting query {} to range query.",
                query.refId());
        fields.put(INSTANT_FIELD, BooleanNode.FALSE);
    }

    private boolean isPrometheus(long orgId, AlertQuery query, Map<String, JsonNode> fields) {
        return datasourceType(orgId, query, fields).map(Datasource.TYPE_PROMETHEUS::equals).orElse(false);
    }

    /**
     * Type from the model's {@code datasource} object, else from the datasource
     * registered under the query's UID.
     */
    private Optional<String> datasourceType(long orgId, AlertQuery query, Map<String, JsonNode> fields) {
        JsonNode ds = fields.get(DATASOURCE_FIELD);
        if (ds != null && ds.isObject()) {
            JsonNode type = ds.get("type");
            if (type != null && type.isTextual() && !type.asText().isEmpty()) {
                return Optional.of(type.asText());
            }
        }
        try {
            Optional<Datasource> found = datasources.byUid(orgId, query.datasourceUid());
            if (found == null) {
                return Optional.empty();
            }
            return found.map(Datasource::type)
                    .filter(t -> !t.isEmpty());
        } catch (RuntimeException e) {
            log.info("Datasource lookup for query {} (uid={}) failed: {}", query.refId(), query.datasourceUid(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Absent and JSON null read as false; anything but a JSON boolean does not parse.
     */
    static Optional<Boolean> parseBoolean(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.of(false);
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        return Optional.empty();
    }
}
