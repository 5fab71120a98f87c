package alertmigrator.config;

/**
 * How the rule group of a migrated rule is named.
 *
 * <p>Every migrated rule lives alone in its group, so the name only has to be
 * unique and readable.
 *
 * @see MigrationConfig#ruleGroupMode()
 */
public enum RuleGroupMode {
    /** {@code "<dashboard title> - <panel id>"}. */
    DASHBOARD_PANEL,

    /** The rule's deduplicated title. */
    RULE_TITLE
}
