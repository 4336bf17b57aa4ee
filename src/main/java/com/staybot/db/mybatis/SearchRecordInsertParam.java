package com.staybot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRecordInsertParam {
    private String criteriaHash;
    private String criteriaJson;
    private int resultCount;
    private long durationMs;
    private long recordedAt;
}
