package com.staybot.scheduler;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SchedulerStatus {
    public final boolean running;
    public final int taskCount;
    public final List<TaskStatus> tasks;
}
