package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SearchStatistics {
    public final Duration window;
    public final int totalSearches;
    public final double averageResults;
    /** Items first seen inside the window, keyed by source, largest first. */
    public final Map<String, Integer> newItemsBySource;
    public final long trackedItems;
    public final int notificationsSent;
}
