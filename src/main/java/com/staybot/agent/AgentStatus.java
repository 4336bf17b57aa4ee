package com.staybot.agent;

import com.staybot.model.SearchStatistics;
import com.staybot.scheduler.SchedulerStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AgentStatus {
    public final SchedulerStatus scheduler;
    public final List<String> sources;
    public final String destination;
    /** -1 when the store could not be read. */
    public final long trackedItems;
    public final SearchStatistics statistics;
    public final PassResult lastPass;
    public final Instant lastHeartbeat;
    public final String storageError;
}
