package com.staybot.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface SearchRecordMapper {
    @Insert("INSERT INTO search_records(criteria_hash, criteria_json, result_count, duration_ms, recorded_at) " +
            "VALUES(#{criteriaHash}, #{criteriaJson}, #{resultCount}, #{durationMs}, #{recordedAt})")
    int insertSearchRecord(SearchRecordInsertParam row);

    @Select("SELECT COUNT(*) FROM search_records WHERE recorded_at >= #{since}")
    int countSince(@Param("since") long since);

    @Select("SELECT AVG(result_count) FROM search_records WHERE recorded_at >= #{since}")
    Double averageResultsSince(@Param("since") long since);

    @Delete("DELETE FROM search_records WHERE recorded_at < #{cutoff}")
    int deleteOlderThan(@Param("cutoff") long cutoff);
}
