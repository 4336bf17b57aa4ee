package com.staybot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface TrackedItemMapper {
    String COLUMNS = "id, identity_key, title, price, currency, rating, location, url, image_url, description, " +
            "amenities, source, first_seen, last_seen, times_seen, notified, last_drop_alert_observation_id";

    @Select("SELECT " + COLUMNS + " FROM tracked_items WHERE identity_key=#{identityKey}")
    TrackedItemRow selectByIdentity(@Param("identityKey") String identityKey);

    @Select("SELECT " + COLUMNS + " FROM tracked_items WHERE id=#{id}")
    TrackedItemRow selectById(@Param("id") long id);

    @Insert("INSERT INTO tracked_items(identity_key, title, price, currency, rating, location, url, image_url, description, " +
            "amenities, source, first_seen, last_seen, times_seen, notified) " +
            "VALUES(#{identityKey}, #{title}, #{price}, #{currency}, #{rating}, #{location}, #{url}, #{imageUrl}, #{description}, " +
            "#{amenities}, #{source}, #{firstSeen}, #{lastSeen}, 1, 0)")
    int insertItem(TrackedItemRow row);

    @Update("UPDATE tracked_items SET price=#{price}, currency=#{currency}, rating=#{rating}, url=#{url}, " +
            "image_url=#{imageUrl}, description=#{description}, amenities=#{amenities}, last_seen=#{lastSeen}, " +
            "times_seen=times_seen + 1 WHERE id=#{id}")
    int updateObserved(TrackedItemRow row);

    @Select("SELECT " + COLUMNS + " FROM tracked_items WHERE first_seen >= #{since} AND notified = 0 " +
            "ORDER BY first_seen DESC, id DESC")
    List<TrackedItemRow> selectNewSince(@Param("since") long since);

    @Update("<script>UPDATE tracked_items SET notified = 1 WHERE id IN " +
            "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach></script>")
    int markNotified(@Param("ids") List<Long> ids);

    @Update("UPDATE tracked_items SET last_drop_alert_observation_id=#{observationId} WHERE id=#{itemId}")
    int markDropAlerted(@Param("itemId") long itemId, @Param("observationId") long observationId);

    @Select("SELECT COUNT(*) FROM tracked_items")
    long countAll();

    @Select("SELECT source, COUNT(*) AS n FROM tracked_items WHERE first_seen >= #{since} " +
            "GROUP BY source ORDER BY n DESC, source")
    List<SourceCountRow> selectSourceCountsSince(@Param("since") long since);
}
