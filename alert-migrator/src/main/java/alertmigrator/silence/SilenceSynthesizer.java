package alertmigrator.silence;

import alertmigrator.exceptions.SilenceCreationException;
import alertmigrator.model.LegacyAlertSettings;
import alertmigrator.model.Matcher;
import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds silences that emulate the legacy "keep last state" policies.
 *
 * <p>A migrated rule whose legacy no-data (or error) policy was "keep last
 * state" enters the NoData (or Error) state instead, which makes the unified
 * engine raise a {@value #NO_DATA_ALERT_NAME} (or {@value #ERROR_ALERT_NAME})
 * alert. The silence mutes exactly that alert for exactly that rule, matched
 * through the rule's {@link UnifiedRule#RULE_UID_LABEL} label.
 */
public final class SilenceSynthesizer {

    public static final String ALERTNAME_LABEL = "alertname";
    public static final String NO_DATA_ALERT_NAME = "DatasourceNoData";
    public static final String ERROR_ALERT_NAME = "DatasourceError";
    public static final String CREATED_BY = "Grafana Migration";

    private final Clock clock;
    private final Duration duration;
    private final Supplier<String> idGenerator;

    public SilenceSynthesizer(Clock clock, Duration duration) {
        this(clock, duration, () -> UUID.randomUUID().toString());
    }

    public SilenceSynthesizer(Clock clock, Duration duration, Supplier<String> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Silence for the no-data policy, if it was "keep last state".
     *
     * @throws SilenceCreationException if the silence cannot be built
     */
    public Optional<Silence> noDataSilence(UnifiedRule rule, LegacyAlertSettings settings)
            throws SilenceCreationException {
        if (!settings.keepsStateOnNoData()) {
            return Optional.empty();
        }
        return Optional.of(build(rule, NO_DATA_ALERT_NAME, "NoData"));
    }

    /**
     * Silence for the execution-error policy, if it was "keep last state".
     *
     * @throws SilenceCreationException if the silence cannot be built
     */
    public Optional<Silence> errorSilence(UnifiedRule rule, LegacyAlertSettings settings)
            throws SilenceCreationException {
        if (!settings.keepsStateOnError()) {
            return Optional.empty();
        }
        return Optional.of(build(rule, ERROR_ALERT_NAME, "Error"));
    }

    private Silence build(UnifiedRule rule, String alertName, String state) throws SilenceCreationException {
        String ruleUid = rule.labels().get(UnifiedRule.RULE_UID_LABEL);
        if (ruleUid == null || ruleUid.isEmpty()) {
            throw new SilenceCreationException("Rule '" + rule.title() + "' has no " + UnifiedRule.RULE_UID_LABEL + " label");
        }

        String id;
        try {
            id = idGenerator.get();
        } catch (RuntimeException e) {
            throw new SilenceCreationException("Failed to generate silence id", e);
        }

        Instant now = clock.instant();
        String comment = String.format(
                "Created during migration to unified alerting to silence %s state for alert rule UID '%s' "
                        + "and title '%s' because the option 'Keep Last State' was selected for %s state",
                state, rule.uid(), rule.title(), state);

        return new Silence(
                id,
                List.of(new Matcher(ALERTNAME_LABEL, alertName), new Matcher(UnifiedRule.RULE_UID_LABEL, ruleUid)),
                now,
                now.plus(duration),
                CREATED_BY,
                comment);
    }
}
