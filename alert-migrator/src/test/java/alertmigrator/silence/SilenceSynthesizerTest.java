package alertmigrator.silence;

import alertmigrator.exceptions.SilenceCreationException;
import alertmigrator.model.LegacyAlertSettings;
import alertmigrator.model.Matcher;
import alertmigrator.model.Silence;
import alertmigrator.model.UnifiedRule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilenceSynthesizerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final SilenceSynthesizer synthesizer = new SilenceSynthesizer(CLOCK, Duration.ofDays(365), () -> "silence-1");

    private static UnifiedRule rule(Map<String, String> labels) {
        return UnifiedRule.builder()
                .orgId(1)
                .uid("rule-uid")
                .title("CPU")
                .condition("B")
                .intervalSeconds(60)
                .namespaceUid("folder-uid")
                .ruleGroup("Infra - 3")
                .labels(labels)
                .updated(NOW)
                .build();
    }

    private static LegacyAlertSettings settings(String noData, String execErr) {
        return new LegacyAlertSettings(noData, execErr, null, null, null);
    }

    @Test
    void noDataSilenceMatchesOnlyTheRulesNoDataAlert() throws SilenceCreationException {
        UnifiedRule rule = rule(Map.of(UnifiedRule.RULE_UID_LABEL, "rule-uid"));

        Silence silence = synthesizer.noDataSilence(rule, settings("keep_state", "")).orElseThrow();

        assertThat(silence.id()).isEqualTo("silence-1");
        assertThat(silence.matchers()).containsExactly(
                new Matcher(SilenceSynthesizer.ALERTNAME_LABEL, SilenceSynthesizer.NO_DATA_ALERT_NAME),
                new Matcher(UnifiedRule.RULE_UID_LABEL, "rule-uid"));
        assertThat(silence.startsAt()).isEqualTo(NOW);
        assertThat(silence.endsAt()).isEqualTo(NOW.plus(Duration.ofDays(365)));
        assertThat(silence.createdBy()).isEqualTo("Grafana Migration");
        assertThat(silence.comment()).contains("rule-uid").contains("NoData");

        assertThat(silence.matches(Map.of("alertname", "DatasourceNoData", UnifiedRule.RULE_UID_LABEL, "rule-uid"))).isTrue();
        assertThat(silence.matches(Map.of("alertname", "DatasourceError", UnifiedRule.RULE_UID_LABEL, "rule-uid"))).isFalse();
        assertThat(silence.matches(Map.of("alertname", "DatasourceNoData", UnifiedRule.RULE_UID_LABEL, "other"))).isFalse();
    }

    @Test
    void errorSilenceUsesErrorAlertName() throws SilenceCreationException {
        UnifiedRule rule = rule(Map.of(UnifiedRule.RULE_UID_LABEL, "rule-uid"));

        Silence silence = synthesizer.errorSilence(rule, settings("", "keep_state")).orElseThrow();

        assertThat(silence.matchers()).contains(new Matcher("alertname", "DatasourceError"));
    }

    @Test
    void otherPoliciesNeedNoSilence() throws SilenceCreationException {
        UnifiedRule rule = rule(Map.of(UnifiedRule.RULE_UID_LABEL, "rule-uid"));

        assertThat(synthesizer.noDataSilence(rule, settings("alerting", "ok"))).isEqualTo(Optional.empty());
        assertThat(synthesizer.errorSilence(rule, settings("alerting", "ok"))).isEmpty();
    }

    @Test
    void missingRuleUidLabelFails() {
        UnifiedRule rule = rule(Map.of());

        assertThatThrownBy(() -> synthesizer.noDataSilence(rule, settings("keep_state", "")))
                .isInstanceOf(SilenceCreationException.class)
                .hasMessageContaining(UnifiedRule.RULE_UID_LABEL);
    }

    @Test
    void failingIdGeneratorFails() {
        SilenceSynthesizer broken = new SilenceSynthesizer(CLOCK, Duration.ofDays(1), () -> {
            throw new IllegalStateException("no entropy");
        });
        UnifiedRule rule = rule(Map.of(UnifiedRule.RULE_UID_LABEL, "rule-uid"));

        assertThatThrownBy(() -> broken.errorSilence(rule, settings("", "keep_state")))
                .isInstanceOf(SilenceCreationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
