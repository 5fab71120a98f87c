package alertmigrator.condition;

import alertmigrator.exceptions.ConditionTranslationException;
import alertmigrator.model.LegacyAlertSettings;
import alertmigrator.model.TranslatedCondition;

/**
 * Turns the conditions of a legacy alert into unified queries and a condition reference.
 *
 * <p>May perform blocking datasource lookups; must be safe to call from
 * several organizations concurrently.
 *
 * @see ClassicConditionTranslator
 */
@FunctionalInterface
public interface ConditionTranslator {

    /**
     * @param orgId organization owning the alert
     * @param settings decoded legacy settings
     * @return the condition refId and the queries it depends on
     * @throws ConditionTranslationException if the conditions cannot be translated
     */
    TranslatedCondition translate(long orgId, LegacyAlertSettings settings) throws ConditionTranslationException;
}
