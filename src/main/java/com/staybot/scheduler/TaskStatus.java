package com.staybot.scheduler;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TaskStatus {
    public final String name;
    public final String cadence;
    public final boolean enabled;
    public final boolean running;
    public final Instant lastRun;
    public final Instant nextRun;
    public final Instant lastSuccess;
    public final long runCount;
    public final long failureCount;
    public final String lastError;
}
