package com.staybot.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface NotificationRecordMapper {
    @Insert("INSERT INTO notification_records(item_ids, kind, success, error, recorded_at) " +
            "VALUES(#{itemIds}, #{kind}, #{success}, #{error}, #{recordedAt})")
    int insertNotificationRecord(NotificationRecordInsertParam row);

    @Select("SELECT COUNT(*) FROM notification_records WHERE recorded_at >= #{since} AND success = 1")
    int countSuccessfulSince(@Param("since") long since);

    @Delete("DELETE FROM notification_records WHERE recorded_at < #{cutoff}")
    int deleteOlderThan(@Param("cutoff") long cutoff);
}
