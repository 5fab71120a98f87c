package alertmigrator.condition;

import alertmigrator.datasource.Datasource;
import alertmigrator.datasource.DatasourceLookup;
import alertmigrator.exceptions.ConditionTranslationException;
import alertmigrator.json.ObjectMapperProvider;
import alertmigrator.model.AlertQuery;
import alertmigrator.model.LegacyAlertSettings;
import alertmigrator.model.LegacyCondition;
import alertmigrator.model.RelativeTimeRange;
import alertmigrator.model.TranslatedCondition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates legacy classic conditions into datasource queries plus one
 * {@code classic_conditions} expression that evaluates them the legacy way.
 *
 * <p>Conditions referencing the same query with the same time range share one
 * unified query. Queries get fresh refIds {@code A}, {@code B}, ... in the
 * order they are first referenced; the expression takes the next free refId
 * and becomes the rule's condition.
 */
public final class ClassicConditionTranslator implements ConditionTranslator {

    public static final String CLASSIC_CONDITIONS_TYPE = "classic_conditions";

    private static final Pattern RELATIVE_TIME = Pattern.compile("^(?:now-)?(\\d+)(s|m|h|d|w)$");

    private record QueryKey(String refId, String from, String to) {}

    private final ObjectMapper mapper = ObjectMapperProvider.get();
    private final DatasourceLookup datasources;

    public ClassicConditionTranslator(DatasourceLookup datasources) {
        this.datasources = Objects.requireNonNull(datasources, "datasources");
    }

    @Override
    public TranslatedCondition translate(long orgId, LegacyAlertSettings settings) throws ConditionTranslationException {
        List<LegacyCondition> conditions = settings.conditions();
        if (conditions.isEmpty()) {
            throw new ConditionTranslationException("Alert has no conditions");
        }

        Map<QueryKey, String> newRefIds = new LinkedHashMap<>();
        List<AlertQuery> queries = new ArrayList<>();
        ArrayNode classicConditions = mapper.createArrayNode();

        for (int i = 0; i < conditions.size(); i++) {
            LegacyCondition cond = conditions.get(i);
            LegacyCondition.Query query = cond.query();
            if (query == null || query.params().size() < 3) {
                throw new ConditionTranslationException("Condition " + i + " has no query reference [refId, from, to]");
            }
            QueryKey key = new QueryKey(query.params().get(0), query.params().get(1), query.params().get(2));

            String refId = newRefIds.get(key);
            if (refId == null) {
                refId = refIdFor(newRefIds.size());
                newRefIds.put(key, refId);
                queries.add(toAlertQuery(orgId, refId, key, query));
            }
            classicConditions.add(toClassicCondition(cond, refId));
        }

        String conditionRefId = refIdFor(newRefIds.size());
        queries.add(classicConditionsExpression(conditionRefId, classicConditions));
        return new TranslatedCondition(conditionRefId, queries);
    }

    private AlertQuery toAlertQuery(long orgId, String refId, QueryKey key, LegacyCondition.Query query)
            throws ConditionTranslationException {
        Datasource ds = lookup(orgId, query.datasourceId());

        JsonNode legacyModel = query.model();
        if (legacyModel != null && !legacyModel.isNull() && !legacyModel.isObject()) {
            throw new ConditionTranslationException("Model of query " + key.refId() + " is not an object");
        }
        ObjectNode model = legacyModel == null || legacyModel.isNull()
                ? mapper.createObjectNode()
                : ((ObjectNode) legacyModel).deepCopy();
        model.put("refId", refId);
        ObjectNode dsRef = model.putObject("datasource");
        dsRef.put("uid", ds.uid());
        dsRef.put("type", ds.type());

        RelativeTimeRange range = new RelativeTimeRange(parseRelativeTime(key.from()), parseRelativeTime(key.to()));
        return new AlertQuery(refId, "", range, ds.uid(), write(model));
    }

    private Datasource lookup(long orgId, long datasourceId) throws ConditionTranslationException {
        Optional<Datasource> ds;
        try {
            ds = datasources.byId(orgId, datasourceId);
        } catch (RuntimeException e) {
            throw new ConditionTranslationException("Datasource lookup failed for id " + datasourceId, e);
        }
        if (ds == null || ds.isEmpty()) {
            throw new ConditionTranslationException("No datasource with id " + datasourceId + " in org " + orgId);
        }
        return ds.get();
    }

    private ObjectNode toClassicCondition(LegacyCondition cond, String refId) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", cond.type() != null ? cond.type() : "query");
        if (cond.evaluator() != null) {
            ObjectNode evaluator = node.putObject("evaluator");
            evaluator.put("type", cond.evaluator().type());
            ArrayNode params = evaluator.putArray("params");
            cond.evaluator().params().forEach(params::add);
        }
        node.putObject("operator").put("type", cond.operator() != null ? cond.operator().type() : "and");
        node.putObject("query").putArray("params").add(refId);
        if (cond.reducer() != null) {
            ObjectNode reducer = node.putObject("reducer");
            reducer.put("type", cond.reducer().type());
            reducer.set("params", mapper.valueToTree(cond.reducer().params() != null ? cond.reducer().params() : List.of()));
        }
        return node;
    }

    private AlertQuery classicConditionsExpression(String refId, ArrayNode conditions) throws ConditionTranslationException {
        ObjectNode model = mapper.createObjectNode();
        model.put("refId", refId);
        model.put("type", CLASSIC_CONDITIONS_TYPE);
        ObjectNode ds = model.putObject("datasource");
        ds.put("uid", AlertQuery.EXPRESSION_DATASOURCE_UID);
        ds.put("type", AlertQuery.EXPRESSION_DATASOURCE_UID);
        model.set("conditions", conditions);
        return new AlertQuery(refId, "", RelativeTimeRange.NONE, AlertQuery.EXPRESSION_DATASOURCE_UID, write(model));
    }

    private String write(ObjectNode model) throws ConditionTranslationException {
        try {
            return mapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new ConditionTranslationException("Failed to encode query model", e);
        }
    }

    /**
     * Parses legacy relative times: {@code now}, {@code 5m}, {@code now-1h}.
     */
    static Duration parseRelativeTime(String value) throws ConditionTranslationException {
        if (value == null) {
            throw new ConditionTranslationException("Missing relative time");
        }
        String v = value.trim();
        if (v.equals("now")) {
            return Duration.ZERO;
        }
        Matcher m = RELATIVE_TIME.matcher(v);
        if (!m.matches()) {
            throw new ConditionTranslationException("Unsupported relative time '" + value + "'");
        }
        long amount = Long.parseLong(m.group(1));
        switch (m.group(2)) {
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                return Duration.ofDays(amount * 7);
        }
    }

    /**
     * A, B, ..., Z, AA, AB, ...
     */
    static String refIdFor(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index;
        do {
            sb.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return sb.toString();
    }
}
