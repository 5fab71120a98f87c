package alertmigrator.model;

import java.util.List;

/**
 * Output of a {@link alertmigrator.condition.ConditionTranslator}.
 *
 * @param condition refId of the query whose result decides the alert state
 * @param data all queries, in evaluation order
 */
public record TranslatedCondition(String condition, List<AlertQuery> data) {

    public TranslatedCondition {
        data = List.copyOf(data);
    }
}
