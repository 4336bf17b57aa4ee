package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A listing the store has seen at least once.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TrackedItem {
    public final long id;
    public final String identityKey;
    public final String title;
    public final double price;
    public final String currency;
    public final double rating;
    public final String location;
    public final String url;
    public final String imageUrl;
    public final String description;
    public final List<String> amenities;
    public final String source;
    public final Instant firstSeen;
    public final Instant lastSeen;
    public final int timesSeen;
    public final boolean notified;
}
