package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PriceObservation {
    public final long id;
    public final long itemId;
    public final double price;
    public final String currency;
    public final Instant observedAt;
}
