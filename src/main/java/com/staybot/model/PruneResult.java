package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PruneResult {
    public final Instant cutoff;
    public final int searchesDeleted;
    public final int observationsDeleted;
    public final int notificationsDeleted;

    public int total() {
        return searchesDeleted + observationsDeleted + notificationsDeleted;
    }
}
