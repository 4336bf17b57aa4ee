package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest observation of an item compared with the one before it.
 * {@code alerted} is true once this exact current observation has been announced.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PriceDropReport {
    public final long itemId;
    public final String title;
    public final String location;
    public final String source;
    public final String url;
    public final double currentPrice;
    public final double previousPrice;
    public final String currency;
    public final Instant currentObservedAt;
    public final Instant previousObservedAt;
    public final long currentObservationId;
    public final double dropPercent;
    public final boolean alerted;
}
