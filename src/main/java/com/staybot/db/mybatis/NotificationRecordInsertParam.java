package com.staybot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRecordInsertParam {
    private String itemIds;
    private String kind;
    private boolean success;
    private String error;
    private long recordedAt;
}
