package com.staybot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceObservationRow {
    private long id;
    private long itemId;
    private double price;
    private String currency;
    private long observedAt;
}
