package com.staybot.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface PriceObservationMapper {
    @Insert("INSERT INTO price_observations(item_id, price, currency, observed_at) " +
            "VALUES(#{itemId}, #{price}, #{currency}, #{observedAt})")
    int insertObservation(PriceObservationRow row);

    @Select("SELECT MAX(observed_at) FROM price_observations WHERE item_id=#{itemId}")
    Long selectLatestObservedAt(@Param("itemId") long itemId);

    @Select("SELECT id, item_id, price, currency, observed_at FROM price_observations " +
            "WHERE item_id=#{itemId} ORDER BY observed_at ASC, id ASC")
    List<PriceObservationRow> selectByItem(@Param("itemId") long itemId);

    /**
     * Per item: newest observation at or after {@code recentSince} against the newest
     * earlier one at or after {@code priorSince}. Both must share a currency.
     */
    @Select("SELECT t.id AS item_id, t.title, t.location, t.source, t.url, " +
            "cur.id AS current_observation_id, cur.price AS current_price, cur.observed_at AS current_observed_at, " +
            "prev.price AS previous_price, prev.observed_at AS previous_observed_at, cur.currency AS currency, " +
            "(prev.price - cur.price) * 100.0 / prev.price AS drop_percent, " +
            "CASE WHEN t.last_drop_alert_observation_id = cur.id THEN 1 ELSE 0 END AS alerted " +
            "FROM tracked_items t " +
            "JOIN price_observations cur ON cur.id = (" +
            "  SELECT p.id FROM price_observations p " +
            "  WHERE p.item_id = t.id AND p.observed_at >= #{recentSince} " +
            "  ORDER BY p.observed_at DESC, p.id DESC LIMIT 1) " +
            "JOIN price_observations prev ON prev.id = (" +
            "  SELECT q.id FROM price_observations q " +
            "  WHERE q.item_id = t.id AND q.observed_at < cur.observed_at AND q.observed_at >= #{priorSince} " +
            "  ORDER BY q.observed_at DESC, q.id DESC LIMIT 1) " +
            "WHERE prev.currency = cur.currency AND prev.price > 0 " +
            "AND (prev.price - cur.price) * 100.0 / prev.price >= #{thresholdPercent} " +
            "ORDER BY drop_percent DESC, t.id ASC")
    List<PriceDropRow> selectPriceDrops(@Param("recentSince") long recentSince,
                                        @Param("priorSince") long priorSince,
                                        @Param("thresholdPercent") double thresholdPercent);

    @Delete("DELETE FROM price_observations WHERE observed_at < #{cutoff}")
    int deleteOlderThan(@Param("cutoff") long cutoff);
}
