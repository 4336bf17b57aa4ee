package com.staybot.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one search-and-process pass.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PassResult {
    public final Instant startedAt;
    public final long durationMs;
    public final int fetched;
    public final int filtered;
    public final List<Long> itemIds;
    public final int newItems;
    public final boolean newItemsNotified;
    public final int priceDrops;
    public final int belowTarget;
    public final List<String> failedSources;
    /** Set when a storage failure ended the pass early. */
    public final String storageError;

    public boolean completed() {
        return storageError == null;
    }
}
