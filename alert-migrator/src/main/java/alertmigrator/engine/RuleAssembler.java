package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.condition.ConditionTranslator;
import alertmigrator.config.MigrationConfig;
import alertmigrator.config.RuleGroupMode;
import alertmigrator.dedup.TitleDeduplicator;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.SettingsParseException;
import alertmigrator.exceptions.SilenceCreationException;
import alertmigrator.json.ObjectMapperProvider;
import alertmigrator.metrics.MigrationMetrics.Phase;
import alertmigrator.metrics.MigrationMetricsCollector;
import alertmigrator.model.AlertQuery;
import alertmigrator.model.ChannelReference;
import alertmigrator.model.Dashboard;
import alertmigrator.model.Folder;
import alertmigrator.model.LegacyAlert;
import alertmigrator.model.LegacyAlertSettings;
import alertmigrator.model.NotificationTarget;
import alertmigrator.model.Silence;
import alertmigrator.model.TranslatedCondition;
import alertmigrator.model.UnifiedRule;
import alertmigrator.query.QueryRepairer;
import alertmigrator.silence.SilenceSynthesizer;
import alertmigrator.translate.StateTranslator;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Migrates a single legacy alert into a unified rule.
 *
 * <p>Pipeline, in order:
 * <ol>
 *   <li>decode the settings JSON</li>
 *   <li>translate the legacy condition into queries</li>
 *   <li>repair the queries</li>
 *   <li>derive labels and annotations</li>
 *   <li>make the title unique in its folder</li>
 *   <li>build the rule</li>
 *   <li>create "keep last state" silences (failures are logged, not fatal)</li>
 *   <li>extract notification channel references</li>
 * </ol>
 *
 * <p>The assembler itself is stateless and may be shared by organizations
 * migrated in parallel; all per-run state lives in the {@link OrgMigration}.
 */
public final class RuleAssembler {

    private static final Logger log = LoggerFactory.getLogger(RuleAssembler.class);

    private final MigrationConfig config;
    private final ConditionTranslator conditionTranslator;
    private final QueryRepairer queryRepairer;
    private final SilenceSynthesizer silenceSynthesizer;
    private final Clock clock;
    private final MigrationMetricsCollector metrics;

    public RuleAssembler(MigrationConfig config,
                         ConditionTranslator conditionTranslator,
                         QueryRepairer queryRepairer,
                         SilenceSynthesizer silenceSynthesizer,
                         Clock clock,
                         MigrationMetricsCollector metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.conditionTranslator = Objects.requireNonNull(conditionTranslator, "conditionTranslator");
        this.queryRepairer = Objects.requireNonNull(queryRepairer, "queryRepairer");
        this.silenceSynthesizer = Objects.requireNonNull(silenceSynthesizer, "silenceSynthesizer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Migrates one legacy alert.
     *
     * @param ctx state of the organization being migrated
     * @param alert the legacy alert
     * @param dashboard dashboard the alert was defined on
     * @param folder folder the rule goes into
     * @return the rule, its silences and channel references
     * @throws MigrateException if any fatal stage fails; the alert should be skipped
     */
    public AlertMigrationResult migrateAlert(OrgMigration ctx, LegacyAlert alert, Dashboard dashboard, Folder folder)
            throws MigrateException {
        log.debug("Migrating legacy alert {} '{}' of org {}", alert.id(), alert.name(), ctx.orgId());

        LegacyAlertSettings settings = parseSettings(alert.settings());

        TranslatedCondition cond = metrics.timed(Phase.CONDITION_TRANSLATION,
                () -> conditionTranslator.translate(ctx.orgId(), settings));

        List<AlertQuery> data = metrics.timed(Phase.QUERY_REPAIR,
                () -> queryRepairer.repairQueries(ctx.orgId(), cond.data()));

        return metrics.timed(Phase.RULE_ASSEMBLY,
                () -> assemble(ctx, alert, settings, cond.condition(), data, dashboard, folder));
    }

    private AlertMigrationResult assemble(OrgMigration ctx,
                                          LegacyAlert alert,
                                          LegacyAlertSettings settings,
                                          String condition,
                                          List<AlertQuery> data,
                                          Dashboard dashboard,
                                          Folder folder) throws MigrateException {
        Map<String, String> labels = new LinkedHashMap<>(settings.tagLabels());
        Map<String, String> annotations = migrationAnnotations(alert, dashboard);

        TitleDeduplicator dedup = ctx.titleDeduplicator(folder.uid());
        String truncated = dedup.truncate(alert.name());
        String title = dedup.contains(truncated) ? dedup.deduplicate(truncated) : truncated;
        String uid = ctx.allocateUid();

        labels.put(UnifiedRule.RULE_UID_LABEL, uid);

        UnifiedRule rule = UnifiedRule.builder()
                .orgId(alert.orgId())
                .uid(uid)
                .title(title)
                .condition(condition)
                .data(data)
                .intervalSeconds(adjustInterval(alert.frequency(), config.baseIntervalSeconds()))
                .namespaceUid(folder.uid())
                .dashboardUid(dashboard.uid())
                .panelId(alert.panelId())
                .ruleGroup(ruleGroup(title, dashboard, alert))
                .ruleGroupIndex(1)
                .forDuration(alert.forDuration())
                .labels(labels)
                .annotations(annotations)
                .paused(alert.isPaused())
                .noDataState(StateTranslator.translateNoData(settings.noDataState()))
                .execErrState(StateTranslator.translateExecErr(settings.executionErrorState()))
                .version(1)
                .updated(clock.instant())
                .build();

        // Claim the title only once the rule exists
        dedup.add(title);
        if (!title.equals(truncated)) {
            MigrationAlertLogger.titleRenamed(ctx.orgId(), folder.uid(), truncated, title);
            metrics.titleRenamed();
        }

        List<Silence> silences = new ArrayList<>(2);
        try {
            silenceSynthesizer.errorSilence(rule, settings).ifPresent(silences::add);
        } catch (SilenceCreationException e) {
            silenceFailed(ctx, alert, rule, "Error", e);
        }
        try {
            silenceSynthesizer.noDataSilence(rule, settings).ifPresent(silences::add);
        } catch (SilenceCreationException e) {
            silenceFailed(ctx, alert, rule, "NoData", e);
        }
        silences.forEach(s -> metrics.silenceCreated());

        return new AlertMigrationResult(rule, silences, extractChannelReferences(settings));
    }

    private void silenceFailed(OrgMigration ctx, LegacyAlert alert, UnifiedRule rule, String kind,
                               SilenceCreationException e) {
        MigrationAlertLogger.silenceFailed(ctx.orgId(), alert.id(), rule.title(), kind, e);
        metrics.silenceFailed();
    }

    private String ruleGroup(String title, Dashboard dashboard, LegacyAlert alert) {
        String group = config.ruleGroupMode() == RuleGroupMode.RULE_TITLE
                ? title
                : String.format("%s - %d", dashboard.title(), alert.panelId());
        int max = config.maxRuleGroupLength();
        return group.length() > max ? group.substring(0, max) : group;
    }

    /**
     * Decodes legacy settings JSON.
     *
     * @throws SettingsParseException if the JSON is malformed or not an object
     */
    public static LegacyAlertSettings parseSettings(String json) throws SettingsParseException {
        LegacyAlertSettings settings;
        try {
            settings = ObjectMapperProvider.get().readValue(json, LegacyAlertSettings.class);
        } catch (JsonProcessingException e) {
            throw new SettingsParseException("Failed to parse settings", e);
        }
        if (settings == null) {
            throw new SettingsParseException("Settings are null");
        }
        return settings;
    }

    /**
     * Provenance annotations plus the legacy message, which is always set.
     */
    static Map<String, String> migrationAnnotations(LegacyAlert alert, Dashboard dashboard) {
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(UnifiedRule.DASHBOARD_UID_ANNOTATION, Optional.ofNullable(dashboard.uid()).orElse(""));
        annotations.put(UnifiedRule.PANEL_ID_ANNOTATION, Long.toString(alert.panelId()));
        annotations.put(UnifiedRule.ALERT_ID_ANNOTATION, Long.toString(alert.id()));
        annotations.put(UnifiedRule.MESSAGE_ANNOTATION, alert.message());
        return annotations;
    }

    /**
     * Rounds the legacy frequency down to a multiple of the scheduler base
     * interval, with the base interval as lower bound.
     */
    public static long adjustInterval(long frequency, long baseInterval) {
        if (frequency <= baseInterval) {
            return baseInterval;
        }
        return frequency - (frequency % baseInterval);
    }

    /**
     * Channel references of the legacy notification list: the UID when set,
     * else the numeric id when positive. Entries with neither are dropped.
     */
    public static List<ChannelReference> extractChannelReferences(LegacyAlertSettings settings) {
        List<ChannelReference> refs = new ArrayList<>();
        for (NotificationTarget target : settings.notifications()) {
            if (target.uid() != null && !target.uid().isEmpty()) {
                refs.add(ChannelReference.of(target.uid()));
                continue;
            }
            // Older alerts reference channels by id only.
            if (target.id() > 0) {
                refs.add(ChannelReference.of(target.id()));
            }
        }
        return refs;
    }
}
