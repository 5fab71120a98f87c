package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.config.AlertLevel;
import alertmigrator.config.MigrationConfig;
import alertmigrator.datasource.Datasource;
import alertmigrator.datasource.DatasourceLookup;
import alertmigrator.exceptions.ConditionTranslationException;
import alertmigrator.exceptions.SettingsParseException;
import alertmigrator.model.Dashboard;
import alertmigrator.model.DashboardAlert;
import alertmigrator.model.Folder;
import alertmigrator.model.LegacyAlert;
import alertmigrator.model.UnifiedRule;
import alertmigrator.silence.SilenceSynthesizer;
import alertmigrator.store.InMemoryNotificationPolicyBuilder;
import alertmigrator.store.InMemoryRuleStore;
import alertmigrator.store.LegacyAlertSource;
import alertmigrator.store.RuleStore;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MigrationEngineTest {

    private static final Datasource PROM = new Datasource(3, "prom-uid", "Prometheus", Datasource.TYPE_PROMETHEUS);

    private static final String CONDITION = "{\"type\":\"query\",\"evaluator\":{\"type\":\"gt\",\"params\":[90]},"
            + "\"operator\":{\"type\":\"and\"},\"query\":{\"params\":[\"A\",\"5m\",\"now\"],\"datasourceId\":%d,"
            + "\"model\":{\"refId\":\"A\",\"expr\":\"up\",\"instant\":true,\"range\":true}},"
            + "\"reducer\":{\"type\":\"avg\",\"params\":[]}}";

    private DatasourceLookup datasources;
    private InMemoryRuleStore store;
    private InMemoryNotificationPolicyBuilder policies;

    @BeforeEach
    void setUp() {
        datasources = mock(DatasourceLookup.class);
        when(datasources.byId(anyLong(), eq(3L))).thenReturn(Optional.of(PROM));
        store = new InMemoryRuleStore();
        policies = new InMemoryNotificationPolicyBuilder();
    }

    private static String settings(long datasourceId, String extra) {
        return "{" + extra + "\"conditions\":[" + String.format(CONDITION, datasourceId) + "],"
                + "\"notifications\":[{\"uid\":\"team-a\"}]}";
    }

    private static DashboardAlert alert(long orgId, long id, String name, String settings) {
        LegacyAlert legacy = new LegacyAlert(id, orgId, 10L, id, name, "", 60, Duration.ZERO, "ok", settings);
        return new DashboardAlert(legacy, new Dashboard("dash-" + orgId, "Dashboard", "folder-" + orgId),
                new Folder("folder-" + orgId, "Folder"));
    }

    /** Source backed by a map; org order is insertion order. */
    private static final class MapSource implements LegacyAlertSource {
        private final Map<Long, List<DashboardAlert>> alerts = new LinkedHashMap<>();

        MapSource add(long orgId, DashboardAlert... orgAlerts) {
            alerts.computeIfAbsent(orgId, k -> new ArrayList<>()).addAll(List.of(orgAlerts));
            return this;
        }

        @Override
        public List<Long> orgIds() {
            return new ArrayList<>(alerts.keySet());
        }

        @Override
        public List<DashboardAlert> alerts(long orgId) {
            return alerts.getOrDefault(orgId, List.of());
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now = Instant.parse("2024-03-01T12:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        void migratesEveryOrganizationInSourceOrder() {
            MapSource source = new MapSource()
                    .add(2L, alert(2L, 1, "CPU", settings(3, "")), alert(2L, 2, "Memory", settings(3, "")))
                    .add(1L, alert(1L, 3, "CPU", settings(3, "")));
            MigrationConfig config = MigrationConfig.builder().orgParallelism(2).build();

            MigrationReport report = new MigrationEngine(config, datasources, store, policies).run(source);

            assertThat(report.orgs()).extracting(OrgMigrationResult::orgId).containsExactly(2L, 1L);
            assertThat(report.hasFailures()).isFalse();
            assertThat(store.rules(2L)).extracting(UnifiedRule::title).containsExactly("CPU", "Memory");
            assertThat(store.rules(1L)).extracting(UnifiedRule::title).containsExactly("CPU");
            assertThat(report.metrics().alertsMigrated()).isEqualTo(3);
            assertThat(report.metrics().orgCount()).isEqualTo(2);
        }

        @Test
        void ruleUidsAreUniqueAcrossOrganizations() {
            MapSource source = new MapSource();
            for (long org = 1; org <= 4; org++) {
                for (long id = 1; id <= 5; id++) {
                    source.add(org, alert(org, org * 100 + id, "Alert " + id, settings(3, "")));
                }
            }
            MigrationConfig config = MigrationConfig.builder().orgParallelism(4).build();

            MigrationReport report = new MigrationEngine(config, datasources, store, policies).run(source);

            Set<String> uids = report.allRules().stream().map(UnifiedRule::uid).collect(Collectors.toSet());
            assertThat(report.allRules()).hasSize(20);
            assertThat(uids).hasSize(20);
        }

        @Test
        void routesAndSilencesArePersisted() {
            MapSource source = new MapSource()
                    .add(1L, alert(1L, 1, "CPU", settings(3, "\"noDataState\":\"keep_state\",")));

            MigrationReport report = new MigrationEngine(MigrationConfig.DEFAULTS, datasources, store, policies).run(source);

            UnifiedRule rule = store.rules(1L).get(0);
            assertThat(policies.routes(1L)).containsOnlyKeys(rule.uid());
            assertThat(policies.routes(1L).get(rule.uid())).extracting(Object::toString).containsExactly("team-a");
            assertThat(store.silences(1L)).singleElement().satisfies(s -> {
                assertThat(s.createdBy()).isEqualTo(SilenceSynthesizer.CREATED_BY);
                assertThat(s.matches(Map.of("alertname", SilenceSynthesizer.NO_DATA_ALERT_NAME,
                        UnifiedRule.RULE_UID_LABEL, rule.uid()))).isTrue();
            });
            assertThat(report.org(1L)).hasValueSatisfying(o -> assertThat(o.silences()).hasSize(1));
        }

        @Test
        void prometheusBothQueriesBecomeRange() {
            MapSource source = new MapSource().add(1L, alert(1L, 1, "CPU", settings(3, "")));

            new MigrationEngine(MigrationConfig.DEFAULTS, datasources, store, policies).run(source);

            assertThat(store.rules(1L).get(0).data().get(0).model()).contains("\"instant\":false");
        }

        @Test
        void emptySourceGivesEmptyReport() {
            MigrationReport report = new MigrationEngine(MigrationConfig.DEFAULTS, datasources, store, policies)
                    .run(new MapSource());

            assertThat(report.orgs()).isEmpty();
            assertThat(report.hasFailures()).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void failedAlertIsSkippedAndOthersMigrate() {
            MapSource source = new MapSource().add(1L,
                    alert(1L, 1, "Broken", "{broken"),
                    alert(1L, 2, "Unknown datasource", settings(99, "")),
                    alert(1L, 3, "CPU", settings(3, "")));

            MigrationReport report = new MigrationEngine(MigrationConfig.DEFAULTS, datasources, store, policies).run(source);

            OrgMigrationResult org = report.org(1L).orElseThrow();
            assertThat(org.rules()).extracting(UnifiedRule::title).containsExactly("CPU");
            assertThat(org.failures()).extracting(AlertFailure::alertId).containsExactly(1L, 2L);
            assertThat(org.failures()).extracting(AlertFailure::stage)
                    .containsExactly(SettingsParseException.STAGE, ConditionTranslationException.STAGE);
            assertThat(report.hasFailures()).isTrue();
            assertThat(report.metrics().alertsFailed()).isEqualTo(2);
        }

        @Test
        void storeFailureFailsOnlyThatOrganization() {
            RuleStore failing = mock(RuleStore.class);
            doThrow(new IllegalStateException("db down")).when(failing).saveRules(eq(2L), anyList());
            MapSource source = new MapSource()
                    .add(1L, alert(1L, 1, "CPU", settings(3, "")))
                    .add(2L, alert(2L, 2, "CPU", settings(3, "")));

            MigrationReport report = new MigrationEngine(MigrationConfig.DEFAULTS, datasources, failing, policies).run(source);

            assertThat(report.org(1L).orElseThrow().isFailed()).isFalse();
            OrgMigrationResult org2 = report.org(2L).orElseThrow();
            assertThat(org2.isFailed()).isTrue();
            assertThat(org2.error()).isEqualTo("db down");
            assertThat(org2.rules()).isEmpty();
            assertThat(report.metrics().orgsFailed()).isEqualTo(1);
            verify(failing).saveRules(eq(1L), anyList());
        }

        @Test
        void sourceFailureFailsOnlyThatOrganization() {
            LegacyAlertSource source = mock(LegacyAlertSource.class);
            when(source.orgIds()).thenReturn(List.of(1L, 2L));
            when(source.alerts(1L)).thenThrow(new IllegalStateException("unreadable"));
            when(source.alerts(2L)).thenReturn(List.of(alert(2L, 1, "CPU", settings(3, ""))));

            MigrationReport report = new MigrationEngine(MigrationConfig.DEFAULTS, datasources, store, policies).run(source);

            assertThat(report.org(1L).orElseThrow().error()).isEqualTo("unreadable");
            assertThat(report.org(2L).orElseThrow().rules()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Migration event log")
    class EventLog {

        private final Logger migrationLog = (Logger) LoggerFactory.getLogger("migration");
        private final ListAppender<ILoggingEvent> events = new ListAppender<>();

        @BeforeEach
        void attachAppender() {
            events.start();
            migrationLog.addAppender(events);
        }

        @AfterEach
        void detachAppender() {
            migrationLog.detachAppender(events);
            events.stop();
            MigrationAlertLogger.setAlertLevel(AlertLevel.WARNING);
        }

        @Test
        void skippedAlertIsLoggedAtErrorLevel() {
            MapSource source = new MapSource().add(1L,
                    alert(1L, 77, "Broken", "{broken"),
                    alert(1L, 78, "CPU", settings(3, "")));
            MigrationConfig config = MigrationConfig.builder().alertLevel(AlertLevel.ERROR).build();

            new MigrationEngine(config, datasources, store, policies).run(source);

            assertThat(events.list)
                    .filteredOn(e -> e.getLevel().isGreaterOrEqual(Level.WARN))
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .singleElement()
                    .satisfies(m -> assertThat(m).startsWith("ALERT_SKIPPED").contains("alert=77")
                            .contains("stage=" + SettingsParseException.STAGE));
            assertThat(events.list).noneMatch(e -> e.getLevel() == Level.INFO);
        }

        @Test
        void migratedAlertsAreLoggedAtDebugLevel() {
            MapSource source = new MapSource().add(1L, alert(1L, 78, "CPU", settings(3, "")));
            MigrationConfig config = MigrationConfig.builder().alertLevel(AlertLevel.DEBUG).build();

            new MigrationEngine(config, datasources, store, policies).run(source);

            assertThat(events.list).extracting(ILoggingEvent::getFormattedMessage)
                    .anyMatch(m -> m.startsWith("ALERT_MIGRATED") && m.contains("alert=78"))
                    .anyMatch(m -> m.startsWith("RUN_COMPLETED"));
        }
    }

    @Test
    void expiredDeadlineStopsRemainingAlerts() {
        MutableClock clock = new MutableClock();
        LegacyAlertSource source = new LegacyAlertSource() {
            @Override
            public List<Long> orgIds() {
                return List.of(1L);
            }

            @Override
            public List<DashboardAlert> alerts(long orgId) {
                clock.advance(Duration.ofMinutes(1));
                return List.of(alert(1L, 1, "CPU", settings(3, "")), alert(1L, 2, "Memory", settings(3, "")));
            }
        };
        MigrationConfig config = MigrationConfig.builder().runTimeoutSeconds(10).build();
        RuleStore ruleStore = mock(RuleStore.class);

        MigrationReport report = new MigrationEngine(config, null, datasources, ruleStore, policies, clock).run(source);

        OrgMigrationResult org = report.org(1L).orElseThrow();
        assertThat(org.timedOut()).isTrue();
        assertThat(org.rules()).isEmpty();
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.metrics().alertsTimedOut()).isEqualTo(2);
        verify(ruleStore, never()).saveRules(anyLong(), anyList());
    }
}
