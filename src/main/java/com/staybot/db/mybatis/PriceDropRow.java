package com.staybot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceDropRow {
    private long itemId;
    private String title;
    private String location;
    private String source;
    private String url;
    private long currentObservationId;
    private double currentPrice;
    private long currentObservedAt;
    private double previousPrice;
    private long previousObservedAt;
    private String currency;
    private double dropPercent;
    private boolean alerted;
}
