package com.staybot.agent;

import com.staybot.db.Database;
import com.staybot.db.MigrationRunner;
import com.staybot.db.TrackedItemStore;
import com.staybot.fetch.FetchException;
import com.staybot.fetch.Fetcher;
import com.staybot.fetch.FetcherRegistry;
import com.staybot.filter.CurrencyConverter;
import com.staybot.model.Candidate;
import com.staybot.model.PriceDropReport;
import com.staybot.model.PruneResult;
import com.staybot.model.SearchCriteria;
import com.staybot.model.TrackedItem;
import com.staybot.notify.NotifyException;
import com.staybot.notify.Notifier;
import com.staybot.scheduler.Cadence;
import com.staybot.scheduler.TaskScheduler;
import com.staybot.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StayAgentTest {

    private static final SearchCriteria CRITERIA = SearchCriteria.builder()
            .destination("București, România")
            .checkIn(LocalDate.of(2026, 4, 1))
            .checkOut(LocalDate.of(2026, 4, 3))
            .guests(2)
            .maxPrice(500.0)
            .currency("RON")
            .propertyTypes(List.of("hotel", "apartment"))
            .minRating(7.0)
            .build();

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Database database;
    private TrackedItemStore store;
    private StubFetcher booking;
    private RecordingNotifier notifier;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        database = new Database(tempDir.resolve("staybot.db"), 5000, false);
        new MigrationRunner().run(database);
        store = new TrackedItemStore(database, clock);
        booking = new StubFetcher("booking");
        notifier = new RecordingNotifier();
        scheduler = new TaskScheduler(Duration.ofSeconds(1), Duration.ofSeconds(1), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void runOnce_shouldTrackNewListingsAndAnnounceThemOnce() throws Exception {
        booking.results = List.of(
                listing("Hotel Central", "Centrul Vechi", 450.0),
                listing("Apartament Unirii", "Sector 3", 300.0),
                listing("HOTEL CENTRAL", "centrul vechi ", 450.0));
        StayAgent agent = agent(settings(0.0), registry(booking));

        PassResult first = agent.runOnce();

        assertTrue(first.completed());
        assertEquals(3, first.fetched);
        assertEquals(2, first.filtered);
        assertEquals(2, first.itemIds.size());
        assertEquals(2, first.newItems);
        assertTrue(first.newItemsNotified);
        assertEquals(1, notifier.newItemBatches.size());
        assertEquals(2, notifier.newItemBatches.get(0).size());
        assertTrue(store.newSince(Duration.ofHours(24)).isEmpty());

        clock.advance(Duration.ofHours(6));
        PassResult second = agent.runOnce();

        assertEquals(0, second.newItems);
        assertFalse(second.newItemsNotified);
        assertEquals(1, notifier.newItemBatches.size());
        assertEquals(2L, store.count());
        for (long id : second.itemIds) {
            assertEquals(2, store.findById(id).orElseThrow().timesSeen);
        }
        assertEquals(2, store.statistics(Duration.ofDays(1)).totalSearches);
    }

    @Test
    void runOnce_priceDrop_shouldBeAnnouncedOnlyOncePerObservation() throws Exception {
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 480.0));
        StayAgent agent = agent(settings(0.0), registry(booking));
        agent.runOnce();

        clock.advance(Duration.ofDays(1));
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 360.0));
        PassResult dropped = agent.runOnce();

        assertEquals(1, dropped.priceDrops);
        assertEquals(1, notifier.dropBatches.size());
        PriceDropReport report = notifier.dropBatches.get(0).get(0);
        assertEquals(480.0, report.previousPrice, 1e-9);
        assertEquals(360.0, report.currentPrice, 1e-9);
        assertEquals(25.0, report.dropPercent, 1e-9);

        clock.advance(Duration.ofHours(6));
        assertEquals(0, agent.runOnce().priceDrops);
        assertEquals(0, agent.runPriceAlerts());
        assertEquals(1, notifier.dropBatches.size());
    }

    @Test
    void runOnce_failingSource_shouldNotStopOtherSources() throws Exception {
        StubFetcher broken = new StubFetcher("broken");
        broken.failure = new FetchException("broken", "HTTP 503");
        StubFetcher crashing = new StubFetcher("crashing");
        crashing.crash = new IllegalStateException("parser bug");
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 450.0));
        StayAgent agent = agent(settings(0.0), registry(broken, crashing, booking));

        PassResult pass = agent.runOnce();

        assertTrue(pass.completed());
        assertEquals(List.of("broken", "crashing"), pass.failedSources);
        assertEquals(1, pass.itemIds.size());
        assertEquals(1L, store.count());
    }

    @Test
    void runOnce_emptyFetch_shouldStillRecordSearch() throws Exception {
        StayAgent agent = agent(settings(0.0), registry(booking));

        PassResult pass = agent.runOnce();

        assertTrue(pass.completed());
        assertEquals(0, pass.fetched);
        assertTrue(notifier.newItemBatches.isEmpty());
        assertEquals(1, store.statistics(Duration.ofDays(1)).totalSearches);
    }

    @Test
    void runOnce_notifyFailure_shouldKeepItemsPendingAndRecordSearch() throws Exception {
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 450.0));
        notifier.failNext = true;
        StayAgent agent = agent(settings(0.0), registry(booking));

        PassResult failed = agent.runOnce();

        assertTrue(failed.completed());
        assertEquals(1, failed.newItems);
        assertFalse(failed.newItemsNotified);
        assertEquals(1, store.newSince(Duration.ofHours(24)).size());
        assertEquals(1, store.statistics(Duration.ofDays(1)).totalSearches);
        assertEquals(0, store.statistics(Duration.ofDays(1)).notificationsSent);

        clock.advance(Duration.ofHours(1));
        PassResult retried = agent.runOnce();

        assertTrue(retried.newItemsNotified);
        assertEquals(1, notifier.newItemBatches.size());
        assertTrue(store.newSince(Duration.ofHours(24)).isEmpty());
    }

    @Test
    void runOnce_storageFailure_shouldEndPassEarly() {
        Database unmigrated = new Database(tempDir.resolve("empty.db"), 1000, false);
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 450.0));
        StayAgent agent = new StayAgent(() -> CRITERIA, registry(booking), converter(),
                new TrackedItemStore(unmigrated, clock), notifier, unmigrated, scheduler, settings(0.0), clock);

        PassResult pass = agent.runOnce();

        assertFalse(pass.completed());
        assertNotNull(pass.storageError);
        assertEquals(1, pass.fetched);
        assertTrue(notifier.newItemBatches.isEmpty());
        assertEquals(-1L, agent.status().trackedItems);
    }

    @Test
    void runOnce_belowTarget_shouldAlertCheapListings() {
        booking.results = List.of(
                listing("Garden Studio", "Floreasca", 350.0),
                listing("Hotel Central", "Centrul Vechi", 450.0));
        StayAgent agent = agent(settings(0.8), registry(booking));

        PassResult pass = agent.runOnce();

        assertEquals(1, pass.belowTarget);
        assertEquals(1, notifier.belowTargetBatches.size());
        assertEquals("Garden Studio", notifier.belowTargetBatches.get(0).get(0).title);
    }

    @Test
    void cleanup_shouldBackUpThenPrune() throws Exception {
        booking.results = List.of(listing("Hotel Central", "Centrul Vechi", 450.0));
        StayAgent agent = agent(settings(0.0), registry(booking));
        agent.runOnce();
        clock.advance(Duration.ofDays(45));

        PruneResult pruned = agent.cleanup();

        assertEquals(1, pruned.searchesDeleted);
        assertEquals(1, pruned.observationsDeleted);
        assertEquals(1L, store.count());
        try (Stream<Path> backups = Files.list(tempDir.resolve("backups"))) {
            assertEquals(1L, backups.filter(p -> p.getFileName().toString().endsWith(".db")).count());
        }
    }

    @Test
    void registerTasks_shouldScheduleAllPassesAndRunOnDemand() throws Exception {
        StayAgent agent = agent(settings(0.0), registry(booking));
        agent.registerTasks();

        assertEquals(4, scheduler.status().taskCount);
        assertNotNull(scheduler.findTask(StayAgent.TASK_SEARCH));
        assertNotNull(scheduler.findTask(StayAgent.TASK_PRICE_ALERTS));
        assertNotNull(scheduler.findTask(StayAgent.TASK_CLEANUP));
        assertNull(agent.status().lastHeartbeat);

        assertTrue(scheduler.runNow(StayAgent.TASK_HEARTBEAT));
        assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

        AgentStatus status = agent.status();
        assertNotNull(status.lastHeartbeat);
        assertEquals(0L, status.trackedItems);
        assertEquals(List.of("booking"), status.sources);
        assertEquals(1L, status.scheduler.tasks.stream()
                .filter(t -> t.name.equals(StayAgent.TASK_HEARTBEAT)).findFirst().orElseThrow().runCount);
    }

    @Test
    void testNotify_shouldReportNotifierOutcome() {
        StayAgent agent = agent(settings(0.0), registry(booking));

        assertTrue(agent.testNotify());
        notifier.failNext = true;
        assertFalse(agent.testNotify());
    }

    @Test
    void testNotify_notifierCrash_shouldStillRecordFailedAttempt() throws Exception {
        StayAgent agent = agent(settings(0.0), registry(booking));
        notifier.crashNext = true;

        assertFalse(agent.testNotify());

        clock.advance(Duration.ofDays(40));
        assertEquals(1, store.pruneOlderThan(Duration.ofDays(30)).notificationsDeleted);
    }

    @Test
    void runPriceAlerts_concurrentChecks_shouldAnnounceDropOnce() throws Exception {
        store.upsert(listing("Hotel Central", "Centrul Vechi", 480.0));
        clock.advance(Duration.ofDays(1));
        store.upsert(listing("Hotel Central", "Centrul Vechi", 360.0));
        notifier.dropDelayMs = 200L;
        StayAgent agent = agent(settings(0.0), registry(booking));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch go = new CountDownLatch(1);
            Callable<Integer> check = () -> {
                go.await();
                return agent.runPriceAlerts();
            };
            Future<Integer> first = pool.submit(check);
            Future<Integer> second = pool.submit(check);
            go.countDown();

            assertEquals(1, first.get(10, TimeUnit.SECONDS) + second.get(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, notifier.dropBatches.size());
        assertTrue(store.priceDrops(10.0).get(0).alerted);
    }

    private StayAgent agent(AgentSettings settings, FetcherRegistry registry) {
        return new StayAgent(() -> CRITERIA, registry, converter(), store, notifier, database, scheduler, settings, clock);
    }

    private AgentSettings settings(double targetRatio) {
        return AgentSettings.builder()
                .newItemsWindow(Duration.ofHours(24))
                .priceDropThresholdPct(10.0)
                .retention(Duration.ofDays(30))
                .backupBeforeCleanup(true)
                .backupDir(tempDir.resolve("backups"))
                .targetPriceRatio(targetRatio)
                .highQualityOnly(false)
                .searchCadence(Cadence.hours(6))
                .priceAlertCadence(Cadence.minutes(30))
                .cleanupCadence(Cadence.days(1))
                .heartbeatCadence(Cadence.minutes(15))
                .heartbeatEnabled(true)
                .build();
    }

    private static CurrencyConverter converter() {
        return new CurrencyConverter(Map.of("EUR:RON", 5.0));
    }

    private static FetcherRegistry registry(Fetcher... fetchers) {
        FetcherRegistry registry = new FetcherRegistry();
        for (Fetcher fetcher : fetchers) {
            registry.register(fetcher);
        }
        return registry;
    }

    private static Candidate listing(String title, String location, double price) {
        return Candidate.builder()
                .title(title)
                .location(location)
                .price(price)
                .currency("RON")
                .rating(8.5)
                .url("https://www.booking.com/hotel/ro/" + title.trim().toLowerCase().replace(' ', '-') + ".html")
                .amenities(List.of("wifi"))
                .source("booking")
                .build();
    }

    private static final class StubFetcher implements Fetcher {
        private final String name;
        private List<Candidate> results = List.of();
        private FetchException failure;
        private RuntimeException crash;

        private StubFetcher(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<Candidate> fetch(SearchCriteria criteria) throws FetchException {
            if (failure != null) {
                throw failure;
            }
            if (crash != null) {
                throw crash;
            }
            return results;
        }
    }

    private static final class RecordingNotifier implements Notifier {
        private final List<List<TrackedItem>> newItemBatches = new ArrayList<>();
        private final List<List<PriceDropReport>> dropBatches = Collections.synchronizedList(new ArrayList<>());
        private final List<List<Candidate>> belowTargetBatches = new ArrayList<>();
        private boolean failNext;
        private boolean crashNext;
        private long dropDelayMs;

        @Override
        public boolean notifyNewItems(List<TrackedItem> items, SearchCriteria criteria) throws NotifyException {
            failIfRequested();
            newItemBatches.add(List.copyOf(items));
            return true;
        }

        @Override
        public boolean notifyPriceDrops(List<PriceDropReport> drops) throws NotifyException {
            failIfRequested();
            if (dropDelayMs > 0) {
                try {
                    Thread.sleep(dropDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NotifyException("interrupted");
                }
            }
            dropBatches.add(List.copyOf(drops));
            return true;
        }

        @Override
        public boolean notifyBelowTarget(List<Candidate> candidates, double targetPrice, String currency)
                throws NotifyException {
            failIfRequested();
            belowTargetBatches.add(List.copyOf(candidates));
            return true;
        }

        @Override
        public boolean sendTest() throws NotifyException {
            failIfRequested();
            return true;
        }

        private void failIfRequested() throws NotifyException {
            if (failNext) {
                failNext = false;
                throw new NotifyException("smtp unavailable");
            }
            if (crashNext) {
                crashNext = false;
                throw new IllegalStateException("transport closed");
            }
        }
    }
}
