package com.staybot.scheduler;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named unit of periodic work.
 *
 * <p>{@code running} is an exclusion flag, not a queue: while it is set, the task is
 * never launched again. The next run is scheduled from completion time, success or not.
 */
public final class ScheduledTask {
    private final String name;
    private final Cadence cadence;
    private final TaskBody body;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private volatile boolean enabled = true;
    private volatile Instant lastRun;
    private volatile Instant nextRun;
    private volatile Instant lastSuccess;
    private volatile String lastError;

    ScheduledTask(String name, Cadence cadence, TaskBody body, Instant createdAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("task name must not be blank");
        }
        if (cadence == null || body == null) {
            throw new IllegalArgumentException("task cadence and body are required: " + name);
        }
        this.name = name.trim();
        this.cadence = cadence;
        this.body = body;
        this.nextRun = createdAt;
    }

    public String name() {
        return name;
    }

    public Cadence cadence() {
        return cadence;
    }

    TaskBody body() {
        return body;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Instant lastRun() {
        return lastRun;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public boolean isDue(Instant now) {
        return enabled && !running.get() && !nextRun.isAfter(now);
    }

    /**
     * Claims the task for one execution. False when another execution holds it.
     */
    boolean tryStart(Instant now) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        lastRun = now;
        return true;
    }

    void complete(Instant finishedAt, Throwable failure) {
        runCount.incrementAndGet();
        if (failure == null) {
            lastSuccess = finishedAt;
            lastError = null;
        } else {
            failureCount.incrementAndGet();
            lastError = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        }
        nextRun = finishedAt.plus(cadence.toDuration());
        running.set(false);
    }

    /**
     * Releases a claim whose body never started; the schedule is left untouched.
     */
    void abandon() {
        running.set(false);
    }

    public TaskStatus status() {
        return TaskStatus.builder()
                .name(name)
                .cadence(cadence.toString())
                .enabled(enabled)
                .running(running.get())
                .lastRun(lastRun)
                .nextRun(nextRun)
                .lastSuccess(lastSuccess)
                .runCount(runCount.get())
                .failureCount(failureCount.get())
                .lastError(lastError)
                .build();
    }
}
