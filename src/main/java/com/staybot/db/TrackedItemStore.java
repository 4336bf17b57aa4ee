package com.staybot.db;

import com.staybot.db.mybatis.MyBatisSupport;
import com.staybot.db.mybatis.NotificationRecordInsertParam;
import com.staybot.db.mybatis.NotificationRecordMapper;
import com.staybot.db.mybatis.PriceDropRow;
import com.staybot.db.mybatis.PriceObservationMapper;
import com.staybot.db.mybatis.PriceObservationRow;
import com.staybot.db.mybatis.SearchRecordInsertParam;
import com.staybot.db.mybatis.SearchRecordMapper;
import com.staybot.db.mybatis.SourceCountRow;
import com.staybot.db.mybatis.TrackedItemMapper;
import com.staybot.db.mybatis.TrackedItemRow;
import com.staybot.identity.IdentityHasher;
import com.staybot.model.Candidate;
import com.staybot.model.NotificationKind;
import com.staybot.model.PriceDropReport;
import com.staybot.model.PriceObservation;
import com.staybot.model.PruneResult;
import com.staybot.model.SearchCriteria;
import com.staybot.model.SearchStatistics;
import com.staybot.model.TrackedItem;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable table of known listings with their price timeline and notification state.
 *
 * <p>Every write runs in one SQLite transaction under an in-process lock, so two
 * concurrent upserts of the same listing never lose an update. Observation timestamps
 * are strictly increasing per item: a write that would not be later than the newest
 * existing observation is placed one millisecond after it.
 */
public final class TrackedItemStore {
    private static final Logger LOG = LogManager.getLogger(TrackedItemStore.class);

    static final Duration RECENT_WINDOW = Duration.ofDays(7);
    static final Duration PRIOR_WINDOW = Duration.ofDays(14);

    private final Database database;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public TrackedItemStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public TrackedItemStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @FunctionalInterface
    private interface SessionWork<T> {
        T apply(SqlSession session);
    }

    /**
     * Inserts the listing or refreshes the stored copy, returning its stable id.
     * A price observation is appended on insert and whenever price or currency changed.
     */
    public long upsert(Candidate candidate) throws StorageException {
        validate(candidate);
        String identityKey = IdentityHasher.itemIdentity(candidate);
        String currency = candidate.currency.trim().toUpperCase(Locale.ROOT);
        String source = candidate.source.trim().toLowerCase(Locale.ROOT);
        String amenities = new JSONArray(candidate.amenities == null ? List.of() : candidate.amenities).toString();
        long now = nowMillis();

        return inTransaction("upsert", session -> {
            TrackedItemMapper items = session.getMapper(TrackedItemMapper.class);
            PriceObservationMapper observations = session.getMapper(PriceObservationMapper.class);

            TrackedItemRow existing = items.selectByIdentity(identityKey);
            if (existing == null) {
                items.insertItem(TrackedItemRow.builder()
                        .identityKey(identityKey)
                        .title(candidate.title.trim())
                        .price(candidate.price)
                        .currency(currency)
                        .rating(candidate.rating)
                        .location(candidate.location == null ? "" : candidate.location.trim())
                        .url(candidate.url)
                        .imageUrl(candidate.imageUrl)
                        .description(candidate.description)
                        .amenities(amenities)
                        .source(source)
                        .firstSeen(now)
                        .lastSeen(now)
                        .build());
                TrackedItemRow inserted = items.selectByIdentity(identityKey);
                if (inserted == null) {
                    throw new PersistenceException("inserted item not readable: " + identityKey);
                }
                appendObservation(observations, inserted.getId(), candidate.price, currency, now);
                LOG.debug("New tracked item id={} title={} price={} {}",
                        inserted.getId(), inserted.getTitle(), candidate.price, currency);
                return inserted.getId();
            }

            boolean priceChanged = Double.compare(existing.getPrice(), candidate.price) != 0
                    || !existing.getCurrency().equals(currency);
            items.updateObserved(TrackedItemRow.builder()
                    .id(existing.getId())
                    .price(candidate.price)
                    .currency(currency)
                    .rating(candidate.rating)
                    .url(candidate.url)
                    .imageUrl(candidate.imageUrl)
                    .description(candidate.description)
                    .amenities(amenities)
                    .lastSeen(Math.max(now, existing.getLastSeen()))
                    .build());
            if (priceChanged) {
                appendObservation(observations, existing.getId(), candidate.price, currency, now);
                LOG.debug("Price change id={} {} {} -> {} {}", existing.getId(),
                        existing.getPrice(), existing.getCurrency(), candidate.price, currency);
            }
            return existing.getId();
        });
    }

    /**
     * Items first seen inside the window that have not been announced yet, newest first.
     */
    public List<TrackedItem> newSince(Duration window) throws StorageException {
        long since = nowMillis() - window.toMillis();
        return read("newSince", session -> {
            List<TrackedItem> out = new ArrayList<>();
            for (TrackedItemRow row : session.getMapper(TrackedItemMapper.class).selectNewSince(since)) {
                out.add(toItem(row));
            }
            return out;
        });
    }

    public void markNotified(Collection<Long> itemIds) throws StorageException {
        if (itemIds == null || itemIds.isEmpty()) {
            return;
        }
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(itemIds));
        int updated = inTransaction("markNotified",
                session -> session.getMapper(TrackedItemMapper.class).markNotified(ids));
        LOG.debug("Marked notified. requested={} updated={}", ids.size(), updated);
    }

    /**
     * Items whose newest observation in the last 7 days is at least {@code thresholdPercent}
     * below the newest earlier observation of the last 14 days, largest drop first.
     */
    public List<PriceDropReport> priceDrops(double thresholdPercent) throws StorageException {
        Instant now = clock.instant();
        long recentSince = now.minus(RECENT_WINDOW).toEpochMilli();
        long priorSince = now.minus(PRIOR_WINDOW).toEpochMilli();
        return read("priceDrops", session -> {
            List<PriceDropReport> out = new ArrayList<>();
            for (PriceDropRow row : session.getMapper(PriceObservationMapper.class)
                    .selectPriceDrops(recentSince, priorSince, thresholdPercent)) {
                out.add(PriceDropReport.builder()
                        .itemId(row.getItemId())
                        .title(row.getTitle())
                        .location(row.getLocation())
                        .source(row.getSource())
                        .url(row.getUrl())
                        .currentPrice(row.getCurrentPrice())
                        .previousPrice(row.getPreviousPrice())
                        .currency(row.getCurrency())
                        .currentObservedAt(Instant.ofEpochMilli(row.getCurrentObservedAt()))
                        .previousObservedAt(Instant.ofEpochMilli(row.getPreviousObservedAt()))
                        .currentObservationId(row.getCurrentObservationId())
                        .dropPercent(row.getDropPercent())
                        .alerted(row.isAlerted())
                        .build());
            }
            return out;
        });
    }

    /**
     * Remembers the observation each report was computed from, so later queries flag it as alerted.
     */
    public void markPriceDropsAlerted(Collection<PriceDropReport> reports) throws StorageException {
        if (reports == null || reports.isEmpty()) {
            return;
        }
        inTransaction("markPriceDropsAlerted", session -> {
            TrackedItemMapper items = session.getMapper(TrackedItemMapper.class);
            int updated = 0;
            for (PriceDropReport report : reports) {
                updated += items.markDropAlerted(report.itemId, report.currentObservationId);
            }
            return updated;
        });
    }

    /**
     * Appends a search log entry. Failures are logged, never thrown.
     */
    public void recordSearch(SearchCriteria criteria, int resultCount, long durationMs) {
        try {
            SearchRecordInsertParam row = SearchRecordInsertParam.builder()
                    .criteriaHash(IdentityHasher.criteriaIdentity(criteria))
                    .criteriaJson(IdentityHasher.criteriaJson(criteria))
                    .resultCount(Math.max(0, resultCount))
                    .durationMs(Math.max(0L, durationMs))
                    .recordedAt(nowMillis())
                    .build();
            inTransaction("recordSearch",
                    session -> session.getMapper(SearchRecordMapper.class).insertSearchRecord(row));
        } catch (StorageException | RuntimeException e) {
            LOG.warn("Failed to record search. results={} err={}", resultCount, e.getMessage());
        }
    }

    /**
     * Appends a notification audit entry. Failures are logged, never thrown.
     */
    public void recordNotification(Collection<Long> itemIds, NotificationKind kind, boolean success, String error) {
        try {
            NotificationRecordInsertParam row = NotificationRecordInsertParam.builder()
                    .itemIds(new JSONArray(itemIds == null ? List.of() : itemIds).toString())
                    .kind(kind.label())
                    .success(success)
                    .error(error == null || error.isBlank() ? null : error)
                    .recordedAt(nowMillis())
                    .build();
            inTransaction("recordNotification",
                    session -> session.getMapper(NotificationRecordMapper.class).insertNotificationRecord(row));
        } catch (StorageException | RuntimeException e) {
            LOG.warn("Failed to record notification. kind={} err={}", kind, e.getMessage());
        }
    }

    /**
     * Deletes search, observation and notification rows older than the retention period.
     * Tracked items themselves are kept.
     */
    public PruneResult pruneOlderThan(Duration retention) throws StorageException {
        Instant cutoff = clock.instant().minus(retention);
        long cutoffMillis = cutoff.toEpochMilli();
        PruneResult result = inTransaction("pruneOlderThan", session -> PruneResult.builder()
                .cutoff(cutoff)
                .searchesDeleted(session.getMapper(SearchRecordMapper.class).deleteOlderThan(cutoffMillis))
                .observationsDeleted(session.getMapper(PriceObservationMapper.class).deleteOlderThan(cutoffMillis))
                .notificationsDeleted(session.getMapper(NotificationRecordMapper.class).deleteOlderThan(cutoffMillis))
                .build());
        LOG.info("Pruned rows older than {}. searches={} observations={} notifications={}",
                cutoff, result.searchesDeleted, result.observationsDeleted, result.notificationsDeleted);
        return result;
    }

    public SearchStatistics statistics(Duration window) throws StorageException {
        long since = nowMillis() - window.toMillis();
        return read("statistics", session -> {
            SearchRecordMapper searches = session.getMapper(SearchRecordMapper.class);
            TrackedItemMapper items = session.getMapper(TrackedItemMapper.class);
            Map<String, Integer> bySource = new LinkedHashMap<>();
            for (SourceCountRow row : items.selectSourceCountsSince(since)) {
                bySource.put(row.getSource(), row.getN());
            }
            Double average = searches.averageResultsSince(since);
            return SearchStatistics.builder()
                    .window(window)
                    .totalSearches(searches.countSince(since))
                    .averageResults(average == null ? 0.0 : average)
                    .newItemsBySource(bySource)
                    .trackedItems(items.countAll())
                    .notificationsSent(session.getMapper(NotificationRecordMapper.class).countSuccessfulSince(since))
                    .build();
        });
    }

    public Optional<TrackedItem> findById(long id) throws StorageException {
        TrackedItemRow row = read("findById", session -> session.getMapper(TrackedItemMapper.class).selectById(id));
        return row == null ? Optional.empty() : Optional.of(toItem(row));
    }

    public List<PriceObservation> observations(long itemId) throws StorageException {
        return read("observations", session -> {
            List<PriceObservation> out = new ArrayList<>();
            for (PriceObservationRow row : session.getMapper(PriceObservationMapper.class).selectByItem(itemId)) {
                out.add(PriceObservation.builder()
                        .id(row.getId())
                        .itemId(row.getItemId())
                        .price(row.getPrice())
                        .currency(row.getCurrency())
                        .observedAt(Instant.ofEpochMilli(row.getObservedAt()))
                        .build());
            }
            return out;
        });
    }

    public long count() throws StorageException {
        return read("count", session -> session.getMapper(TrackedItemMapper.class).countAll());
    }

    private void appendObservation(PriceObservationMapper observations, long itemId, double price, String currency, long now) {
        Long latest = observations.selectLatestObservedAt(itemId);
        long observedAt = latest != null && latest >= now ? latest + 1L : now;
        observations.insertObservation(PriceObservationRow.builder()
                .itemId(itemId)
                .price(price)
                .currency(currency)
                .observedAt(observedAt)
                .build());
    }

    private <T> T inTransaction(String operation, SessionWork<T> work) throws StorageException {
        writeLock.lock();
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try (SqlSession session = MyBatisSupport.openSession(conn)) {
                // The session does not own the connection, so commit and rollback go to JDBC.
                try {
                    T out = work.apply(session);
                    session.flushStatements();
                    conn.commit();
                    return out;
                } catch (RuntimeException | SQLException e) {
                    rollbackAfterFailure(conn, operation, e);
                    throw e;
                }
            }
        } catch (SQLException | PersistenceException e) {
            throw new StorageException(operation + " failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void rollbackAfterFailure(Connection conn, String operation, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            LOG.warn("Rollback failed after {} error: {}", operation, rollbackError.getMessage());
        }
    }

    private <T> T read(String operation, SessionWork<T> work) throws StorageException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return work.apply(session);
        } catch (SQLException | PersistenceException e) {
            throw new StorageException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private TrackedItem toItem(TrackedItemRow row) {
        return TrackedItem.builder()
                .id(row.getId())
                .identityKey(row.getIdentityKey())
                .title(row.getTitle())
                .price(row.getPrice())
                .currency(row.getCurrency())
                .rating(row.getRating())
                .location(row.getLocation())
                .url(row.getUrl())
                .imageUrl(row.getImageUrl())
                .description(row.getDescription())
                .amenities(parseAmenities(row.getAmenities()))
                .source(row.getSource())
                .firstSeen(Instant.ofEpochMilli(row.getFirstSeen()))
                .lastSeen(Instant.ofEpochMilli(row.getLastSeen()))
                .timesSeen(row.getTimesSeen())
                .notified(row.isNotified())
                .build();
    }

    private List<String> parseAmenities(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            JSONArray array = new JSONArray(raw);
            List<String> out = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                out.add(array.optString(i, ""));
            }
            return out;
        } catch (JSONException e) {
            LOG.warn("Unreadable amenities column, treating as empty: {}", e.getMessage());
            return List.of();
        }
    }

    private void validate(Candidate candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate must not be null");
        }
        if (candidate.title == null || candidate.title.isBlank()) {
            throw new IllegalArgumentException("candidate title must not be blank");
        }
        if (!Double.isFinite(candidate.price) || candidate.price < 0.0) {
            throw new IllegalArgumentException("candidate price must be a non-negative number: " + candidate.price);
        }
        if (candidate.currency == null || candidate.currency.isBlank()) {
            throw new IllegalArgumentException("candidate currency must not be blank");
        }
        if (candidate.source == null || candidate.source.isBlank()) {
            throw new IllegalArgumentException("candidate source must not be blank");
        }
    }

    private long nowMillis() {
        return clock.millis();
    }
}
