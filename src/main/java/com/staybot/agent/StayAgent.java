package com.staybot.agent;

import com.staybot.config.Config;
import com.staybot.core.RunTelemetry;
import com.staybot.db.Database;
import com.staybot.db.MigrationRunner;
import com.staybot.db.StorageException;
import com.staybot.db.TrackedItemStore;
import com.staybot.fetch.FetchException;
import com.staybot.fetch.Fetcher;
import com.staybot.fetch.FetcherRegistry;
import com.staybot.fetch.http.HttpClientEx;
import com.staybot.filter.CandidateFilter;
import com.staybot.filter.CurrencyConverter;
import com.staybot.model.Candidate;
import com.staybot.model.NotificationKind;
import com.staybot.model.PriceDropReport;
import com.staybot.model.PruneResult;
import com.staybot.model.SearchCriteria;
import com.staybot.model.SearchStatistics;
import com.staybot.model.TrackedItem;
import com.staybot.notify.MailNotifier;
import com.staybot.notify.MailTemplateRenderer;
import com.staybot.notify.Mailer;
import com.staybot.notify.NotifyException;
import com.staybot.notify.Notifier;
import com.staybot.scheduler.TaskScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Wires fetch, filter, store, change detection and notification into passes and
 * registers those passes with the scheduler.
 */
public final class StayAgent {
    private static final Logger LOG = LogManager.getLogger(StayAgent.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneId.systemDefault());

    public static final String TASK_SEARCH = "accommodation_search";
    public static final String TASK_PRICE_ALERTS = "price_alerts";
    public static final String TASK_CLEANUP = "database_cleanup";
    public static final String TASK_HEARTBEAT = "system_heartbeat";

    private final Supplier<SearchCriteria> criteriaSource;
    private final FetcherRegistry fetchers;
    private final CurrencyConverter converter;
    private final TrackedItemStore store;
    private final Notifier notifier;
    private final Database database;
    private final TaskScheduler scheduler;
    private final AgentSettings settings;
    private final Clock clock;
    private final ReentrantLock priceDropLock = new ReentrantLock();

    private volatile PassResult lastPass;
    private volatile Instant lastHeartbeat;

    public StayAgent(
            Supplier<SearchCriteria> criteriaSource,
            FetcherRegistry fetchers,
            CurrencyConverter converter,
            TrackedItemStore store,
            Notifier notifier,
            Database database,
            TaskScheduler scheduler,
            AgentSettings settings,
            Clock clock
    ) {
        this.criteriaSource = criteriaSource;
        this.fetchers = fetchers;
        this.converter = converter;
        this.store = store;
        this.notifier = notifier;
        this.database = database;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Builds the production wiring: SQLite store (migrated), configured fetchers, mail notifier
     * and a scheduler using the configured tick. Criteria are re-read every pass so rolling
     * stay dates move forward.
     */
    public static StayAgent fromConfig(Config config) throws StorageException {
        Clock clock = Clock.systemDefaultZone();
        Supplier<SearchCriteria> criteria = () -> SearchCriteria.fromConfig(config, LocalDate.now(clock));
        criteria.get();
        AgentSettings settings = AgentSettings.fromConfig(config);

        Database database = Database.fromConfig(config);
        try {
            new MigrationRunner().run(database);
        } catch (SQLException e) {
            throw new StorageException("schema migration failed: " + e.getMessage(), e);
        }

        int timeoutSec = config.getInt("fetch.timeout_sec");
        HttpClientEx http = new HttpClientEx(config.getString("fetch.user_agent"), timeoutSec);
        Notifier notifier = new MailNotifier(new Mailer(), Mailer.loadSettings(config), new MailTemplateRenderer(), clock);
        TaskScheduler scheduler = new TaskScheduler(
                Duration.ofSeconds(Math.max(1, config.getInt("scheduler.tick_seconds"))),
                Duration.ofSeconds(Math.max(1, config.getInt("scheduler.stop_timeout_seconds"))),
                clock);

        return new StayAgent(
                criteria,
                FetcherRegistry.fromConfig(config, http),
                CurrencyConverter.fromConfig(config),
                new TrackedItemStore(database, clock),
                notifier,
                database,
                scheduler,
                settings,
                clock);
    }

    /**
     * One search pass: fetch from every source, filter, upsert, announce new items,
     * announce price drops, announce below-target prices, then log the search.
     */
    public PassResult runOnce() {
        return runSearchPass("manual");
    }

    PassResult runSearchPass(String trigger) {
        SearchCriteria criteria = criteriaSource.get();
        RunTelemetry telemetry = new RunTelemetry(TASK_SEARCH, trigger, clock);
        Instant startedAt = clock.instant();
        long startedNanos = System.nanoTime();
        LOG.info("Search pass started. destination={} stay={}..{} guests={}",
                criteria.destination, criteria.checkIn, criteria.checkOut, criteria.guests);

        telemetry.startStep(RunTelemetry.STEP_FETCH);
        List<Candidate> raw = new ArrayList<>();
        List<String> failedSources = new ArrayList<>();
        for (Fetcher fetcher : fetchers.all()) {
            try {
                raw.addAll(fetcher.fetch(criteria));
            } catch (FetchException e) {
                failedSources.add(fetcher.name());
                LOG.warn("Source {} failed, skipping: {}", fetcher.name(), e.getMessage());
            } catch (RuntimeException e) {
                failedSources.add(fetcher.name());
                LOG.error("Source {} failed unexpectedly, skipping", fetcher.name(), e);
            }
        }
        telemetry.endStep(RunTelemetry.STEP_FETCH, fetchers.all().size(), raw.size(), failedSources.size());

        telemetry.startStep(RunTelemetry.STEP_FILTER);
        List<Candidate> filtered = new CandidateFilter(criteria, converter, settings.highQualityOnly).applyAll(raw);
        telemetry.endStep(RunTelemetry.STEP_FILTER, raw.size(), filtered.size(), 0);
        if (raw.isEmpty()) {
            LOG.warn("No listings fetched this pass.");
        }

        PassResult.PassResultBuilder result = PassResult.builder()
                .startedAt(startedAt)
                .fetched(raw.size())
                .filtered(filtered.size())
                .failedSources(failedSources)
                .itemIds(List.of());
        try {
            telemetry.startStep(RunTelemetry.STEP_UPSERT);
            List<Long> ids = new ArrayList<>();
            int rejected = 0;
            for (Candidate candidate : filtered) {
                try {
                    ids.add(store.upsert(candidate));
                } catch (IllegalArgumentException e) {
                    rejected++;
                    LOG.warn("Skipping malformed listing '{}': {}", candidate.title, e.getMessage());
                }
            }
            telemetry.endStep(RunTelemetry.STEP_UPSERT, filtered.size(), ids.size(), rejected);
            result.itemIds(List.copyOf(ids));

            telemetry.startStep(RunTelemetry.STEP_NEW_ITEMS);
            List<TrackedItem> fresh = store.newSince(settings.newItemsWindow);
            telemetry.endStep(RunTelemetry.STEP_NEW_ITEMS, ids.size(), fresh.size(), 0);
            result.newItems(fresh.size());
            result.newItemsNotified(announceNewItems(fresh, criteria, telemetry));

            telemetry.startStep(RunTelemetry.STEP_PRICE_DROPS);
            int drops = announcePriceDrops();
            telemetry.endStep(RunTelemetry.STEP_PRICE_DROPS, 0, drops, 0);
            result.priceDrops(drops);
        } catch (StorageException e) {
            LOG.error("Search pass aborted by storage failure: {}", e.getMessage(), e);
            result.storageError(e.getMessage());
            return finishPass(result, telemetry, startedNanos);
        }

        result.belowTarget(announceBelowTarget(filtered, criteria));

        telemetry.startStep(RunTelemetry.STEP_RECORD);
        store.recordSearch(criteria, filtered.size(), (System.nanoTime() - startedNanos) / 1_000_000L);
        telemetry.endStep(RunTelemetry.STEP_RECORD, 1, 1, 0);
        return finishPass(result, telemetry, startedNanos);
    }

    private PassResult finishPass(PassResult.PassResultBuilder result, RunTelemetry telemetry, long startedNanos) {
        telemetry.finish();
        PassResult pass = result.durationMs((System.nanoTime() - startedNanos) / 1_000_000L).build();
        lastPass = pass;
        LOG.info("Search pass finished. {}", telemetry.getSummary());
        return pass;
    }

    private boolean announceNewItems(List<TrackedItem> fresh, SearchCriteria criteria, RunTelemetry telemetry)
            throws StorageException {
        if (fresh.isEmpty()) {
            return false;
        }
        List<Long> ids = new ArrayList<>();
        for (TrackedItem item : fresh) {
            ids.add(item.id);
        }
        telemetry.startStep(RunTelemetry.STEP_NOTIFY);
        boolean sent = false;
        String error = null;
        try {
            sent = notifier.notifyNewItems(fresh, criteria);
            if (!sent) {
                error = "notifier reported failure";
            }
        } catch (NotifyException | RuntimeException e) {
            error = e.getMessage();
            LOG.warn("New-item notification failed: {}", e.getMessage());
        }
        telemetry.endStep(RunTelemetry.STEP_NOTIFY, fresh.size(), sent ? fresh.size() : 0, sent ? 0 : 1);
        store.recordNotification(ids, NotificationKind.NEW_ITEMS, sent, error);
        if (sent) {
            store.markNotified(ids);
            LOG.info("Announced {} new listings.", ids.size());
        }
        return sent;
    }

    /**
     * Announces drops not yet announced for their current observation. Returns how many were announced.
     */
    private int announcePriceDrops() throws StorageException {
        // Search and price-alert tasks both announce drops; hold the lock until the drops are marked.
        priceDropLock.lock();
        try {
            return announcePendingPriceDrops();
        } finally {
            priceDropLock.unlock();
        }
    }

    private int announcePendingPriceDrops() throws StorageException {
        List<PriceDropReport> pending = new ArrayList<>();
        for (PriceDropReport report : store.priceDrops(settings.priceDropThresholdPct)) {
            if (!report.alerted) {
                pending.add(report);
            }
        }
        if (pending.isEmpty()) {
            return 0;
        }
        List<Long> ids = new ArrayList<>();
        for (PriceDropReport report : pending) {
            ids.add(report.itemId);
        }
        boolean sent = false;
        String error = null;
        try {
            sent = notifier.notifyPriceDrops(pending);
            if (!sent) {
                error = "notifier reported failure";
            }
        } catch (NotifyException | RuntimeException e) {
            error = e.getMessage();
            LOG.warn("Price-drop notification failed: {}", e.getMessage());
        }
        store.recordNotification(ids, NotificationKind.PRICE_DROP, sent, error);
        if (!sent) {
            return 0;
        }
        store.markPriceDropsAlerted(pending);
        LOG.info("Announced {} price drops.", pending.size());
        return pending.size();
    }

    private int announceBelowTarget(List<Candidate> filtered, SearchCriteria criteria) {
        if (settings.targetPriceRatio <= 0.0 || filtered.isEmpty()) {
            return 0;
        }
        double target = criteria.maxPrice * settings.targetPriceRatio;
        List<Candidate> hits = CandidateFilter.belowTarget(filtered, target, criteria.currency);
        if (hits.isEmpty()) {
            return 0;
        }
        boolean sent = false;
        String error = null;
        try {
            sent = notifier.notifyBelowTarget(hits, target, criteria.currency);
            if (!sent) {
                error = "notifier reported failure";
            }
        } catch (NotifyException | RuntimeException e) {
            error = e.getMessage();
            LOG.warn("Below-target notification failed: {}", e.getMessage());
        }
        store.recordNotification(List.of(), NotificationKind.BELOW_TARGET, sent, error);
        return sent ? hits.size() : 0;
    }

    /**
     * Price-drop check on its own. Returns how many drops were announced.
     */
    public int runPriceAlerts() throws StorageException {
        int announced = announcePriceDrops();
        LOG.info("Price alert check finished. announced={}", announced);
        return announced;
    }

    /**
     * Optional backup, then retention pruning. A failed backup skips the prune.
     */
    public PruneResult cleanup() throws StorageException {
        if (settings.backupBeforeCleanup) {
            Path target = settings.backupDir.resolve("staybot_backup_" + BACKUP_STAMP.format(clock.instant()) + ".db");
            try {
                database.backupTo(target);
            } catch (SQLException e) {
                throw new StorageException("backup before cleanup failed, prune skipped: " + e.getMessage(), e);
            }
        }
        return store.pruneOlderThan(settings.retention);
    }

    public void heartbeat() throws StorageException {
        long tracked = store.count();
        lastHeartbeat = clock.instant();
        LOG.info("Heartbeat. tracked_items={} scheduler_running={} tasks={}",
                tracked, scheduler.isRunning(), scheduler.status().taskCount);
    }

    /**
     * Registers the search, price-alert, cleanup and (optionally) heartbeat tasks.
     */
    public void registerTasks() {
        scheduler.addTask(TASK_SEARCH, settings.searchCadence, () -> runSearchPass("scheduled"));
        scheduler.addTask(TASK_PRICE_ALERTS, settings.priceAlertCadence, this::runPriceAlerts);
        scheduler.addTask(TASK_CLEANUP, settings.cleanupCadence, this::cleanup);
        if (settings.heartbeatEnabled) {
            scheduler.addTask(TASK_HEARTBEAT, settings.heartbeatCadence, this::heartbeat);
        }
    }

    public boolean startScheduler() {
        if (scheduler.findTask(TASK_SEARCH) == null) {
            registerTasks();
        }
        return scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public boolean testNotify() {
        boolean sent;
        String error = null;
        try {
            sent = notifier.sendTest();
        } catch (NotifyException | RuntimeException e) {
            sent = false;
            error = e.getMessage();
            LOG.warn("Test notification failed: {}", e.getMessage());
        }
        store.recordNotification(List.of(), NotificationKind.TEST, sent, error);
        return sent;
    }

    public AgentStatus status() {
        AgentStatus.AgentStatusBuilder status = AgentStatus.builder()
                .scheduler(scheduler.status())
                .sources(fetchers.names())
                .destination(criteriaSource.get().destination)
                .lastPass(lastPass)
                .lastHeartbeat(lastHeartbeat)
                .trackedItems(-1L);
        try {
            SearchStatistics statistics = store.statistics(Duration.ofDays(7));
            status.statistics(statistics).trackedItems(statistics.trackedItems);
        } catch (StorageException e) {
            LOG.warn("Status could not read the store: {}", e.getMessage());
            status.storageError(e.getMessage());
        }
        return status.build();
    }
}
