package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.condition.ClassicConditionTranslator;
import alertmigrator.condition.ConditionTranslator;
import alertmigrator.config.MigrationConfig;
import alertmigrator.datasource.CachingDatasourceLookup;
import alertmigrator.datasource.DatasourceLookup;
import alertmigrator.dedup.UidAllocator;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.MigrationTimeoutException;
import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.metrics.MigrationMetrics.Phase;
import alertmigrator.metrics.MigrationMetricsCollector;
import alertmigrator.model.DashboardAlert;
import alertmigrator.model.UnifiedRule;
import alertmigrator.query.QueryRepairer;
import alertmigrator.silence.SilenceSynthesizer;
import alertmigrator.store.LegacyAlertSource;
import alertmigrator.store.NotificationPolicyBuilder;
import alertmigrator.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates a migration run end-to-end:
 *  - list organizations and migrate them, in parallel up to {@code orgParallelism}
 *  - migrate the alerts of each organization sequentially, skipping failed alerts
 *  - check the run deadline between alerts
 *  - hand rules and silences to the {@link RuleStore} and channel references
 *    to the {@link NotificationPolicyBuilder}
 *
 * Notes:
 *  - every organization gets its own {@link OrgMigration}; only the
 *    {@link UidAllocator} and read-only collaborators are shared
 *  - there is no rollback; a failed organization leaves other organizations untouched
 */
public final class MigrationEngine {

    private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

    // run id generator
    private static final AtomicLong RUN_COUNTER = new AtomicLong(1L);

    private final MigrationConfig config;
    private final RuleStore ruleStore;
    private final NotificationPolicyBuilder policyBuilder;
    private final Clock clock;
    private final MigrationMetricsCollector metricsCollector = new MigrationMetricsCollector();
    private final RuleAssembler assembler;

    /**
     * Creates an engine translating classic conditions with the given datasource lookup.
     */
    public MigrationEngine(MigrationConfig config,
                           DatasourceLookup datasources,
                           RuleStore ruleStore,
                           NotificationPolicyBuilder policyBuilder) {
        this(config, null, datasources, ruleStore, policyBuilder, Clock.systemUTC());
    }

    /**
     * @param conditionTranslator translator to use, or null for {@link ClassicConditionTranslator}
     */
    public MigrationEngine(MigrationConfig config,
                           ConditionTranslator conditionTranslator,
                           DatasourceLookup datasources,
                           RuleStore ruleStore,
                           NotificationPolicyBuilder policyBuilder,
                           Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.ruleStore = Objects.requireNonNull(ruleStore, "ruleStore");
        this.policyBuilder = Objects.requireNonNull(policyBuilder, "policyBuilder");
        this.clock = Objects.requireNonNull(clock, "clock");

        DatasourceLookup cached = new CachingDatasourceLookup(datasources);
        ConditionTranslator translator = conditionTranslator != null
                ? conditionTranslator
                : new ClassicConditionTranslator(cached);
        this.assembler = new RuleAssembler(
                config,
                translator,
                new QueryRepairer(cached),
                new SilenceSynthesizer(clock, config.silenceDuration()),
                clock,
                metricsCollector);
    }

    /**
     * Migrates every organization of the source.
     *
     * @param source the legacy alerts
     * @return per-organization results and run metrics
     */
    public MigrationReport run(LegacyAlertSource source) {
        long runId = RUN_COUNTER.getAndIncrement();
        MigrationAlertLogger.setAlertLevel(config.alertLevel());
        metricsCollector.start(runId);
        log.debug("Starting run {} with {}", runId, config);

        List<Long> orgIds = source.orgIds();
        MigrationAlertLogger.runStarted(runId, orgIds.size());

        UidAllocator uids = new UidAllocator(config);
        Instant deadline = config.hasRunTimeout() ? clock.instant().plus(config.runTimeout()) : null;

        List<OrgMigrationResult> results = new ArrayList<>(orgIds.size());
        int threads = Math.max(1, Math.min(config.orgParallelism(), orgIds.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, orgThreadFactory(runId));
        try {
            List<Future<OrgMigrationResult>> futures = new ArrayList<>(orgIds.size());
            for (long orgId : orgIds) {
                futures.add(pool.submit(() -> migrateOrg(runId, orgId, source, uids, deadline)));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(runId, orgIds.get(i), futures.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        MigrationMetrics metrics = metricsCollector.finish();
        MigrationAlertLogger.runCompleted(runId, metrics);
        log.info(metrics.summary());
        return new MigrationReport(runId, results, metrics);
    }

    private OrgMigrationResult await(long runId, long orgId, Future<OrgMigrationResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            MigrationAlertLogger.orgFailed(runId, orgId, cause);
            metricsCollector.orgFailed();
            return OrgMigrationResult.failed(orgId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            MigrationAlertLogger.orgFailed(runId, orgId, e);
            metricsCollector.orgFailed();
            return OrgMigrationResult.failed(orgId, e);
        }
    }

    OrgMigrationResult migrateOrg(long runId, long orgId, LegacyAlertSource source, UidAllocator uids, Instant deadline) {
        long start = System.nanoTime();
        metricsCollector.orgStarted();

        List<DashboardAlert> alerts;
        try {
            alerts = source.alerts(orgId);
        } catch (RuntimeException e) {
            MigrationAlertLogger.orgFailed(runId, orgId, e);
            metricsCollector.orgFailed();
            return OrgMigrationResult.failed(orgId, e);
        }
        MigrationAlertLogger.orgStarted(runId, orgId, alerts.size());

        OrgMigration ctx = new OrgMigration(orgId, config, uids);
        boolean timedOut = false;
        for (int i = 0; i < alerts.size(); i++) {
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                MigrationTimeoutException timeout = new MigrationTimeoutException(orgId, config.runTimeout(), alerts.size() - i);
                MigrationAlertLogger.runTimeout(runId, timeout);
                metricsCollector.alertsTimedOut(alerts.size() - i);
                timedOut = true;
                break;
            }
            migrateOne(ctx, alerts.get(i));
        }

        try {
            metricsCollector.timedRun(Phase.PERSISTENCE, () -> persist(ctx));
        } catch (RuntimeException e) {
            MigrationAlertLogger.orgFailed(runId, orgId, e);
            metricsCollector.orgFailed();
            return OrgMigrationResult.failed(orgId, e);
        }

        MigrationAlertLogger.orgCompleted(runId, orgId, ctx.rules().size(), ctx.failureCount(),
                (System.nanoTime() - start) / 1_000_000);
        return ctx.toResult(timedOut);
    }

    private void migrateOne(OrgMigration ctx, DashboardAlert da) {
        try {
            AlertMigrationResult result;
            try {
                result = assembler.migrateAlert(ctx, da.alert(), da.dashboard(), da.folder());
            } catch (RuntimeException e) {
                throw new MigrateException("Unexpected failure: " + e.getMessage(), e);
            }
            ctx.record(result);
            metricsCollector.alertMigrated();
            MigrationAlertLogger.alertMigrated(ctx.orgId(), da.alert().id(), result.rule().uid(), result.rule().title());
        } catch (MigrateException e) {
            log.debug("Legacy alert {} of org {} failed", da.alert().id(), ctx.orgId(), e);
            ctx.recordFailure(da.alert(), e);
            metricsCollector.alertFailed();
            MigrationAlertLogger.alertSkipped(ctx.orgId(), da.alert().id(), da.alert().name(), e);
        }
    }

    private void persist(OrgMigration ctx) {
        if (!ctx.rules().isEmpty()) {
            ruleStore.saveRules(ctx.orgId(), ctx.rules());
        }
        if (!ctx.silences().isEmpty()) {
            ruleStore.saveSilences(ctx.orgId(), ctx.silences());
        }
        for (UnifiedRule rule : ctx.rules()) {
            policyBuilder.addRoute(ctx.orgId(), rule, ctx.channels().getOrDefault(rule.uid(), List.of()));
        }
    }

    private static java.util.concurrent.ThreadFactory orgThreadFactory(long runId) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, "alert-migration-" + runId + "-org-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
