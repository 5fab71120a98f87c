package alertmigrator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationConfigTest {

    @Test
    void defaultsMatchUnifiedStoreLimits() {
        MigrationConfig c = MigrationConfig.DEFAULTS;

        assertThat(c.baseIntervalSeconds()).isEqualTo(10);
        assertThat(c.maxTitleLength()).isEqualTo(190);
        assertThat(c.maxUidLength()).isEqualTo(40);
        assertThat(c.uidLength()).isEqualTo(14);
        assertThat(c.caseInsensitiveTitles()).isTrue();
        assertThat(c.ruleGroupMode()).isEqualTo(RuleGroupMode.DASHBOARD_PANEL);
        assertThat(c.silenceDuration()).isEqualTo(Duration.ofDays(365));
        assertThat(c.orgParallelism()).isEqualTo(1);
        assertThat(c.hasRunTimeout()).isFalse();
        assertThat(c.alertLevel()).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    void nonPositiveValuesAreRejected() {
        assertThatThrownBy(() -> MigrationConfig.builder().baseIntervalSeconds(0))
                .isInstanceOf(MigrationConfigException.class)
                .hasMessageContaining("baseIntervalSeconds");
        assertThatThrownBy(() -> MigrationConfig.builder().dedupMaxAttempts(-1))
                .isInstanceOf(MigrationConfigException.class);
    }

    @Test
    void zeroRunTimeoutDisablesTimeout() {
        MigrationConfig c = MigrationConfig.builder().runTimeoutSeconds(0).build();

        assertThat(c.runTimeout()).isEqualTo(Duration.ZERO);
        assertThat(c.hasRunTimeout()).isFalse();
    }
}
