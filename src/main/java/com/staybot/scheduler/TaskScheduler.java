package com.staybot.scheduler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs named tasks on independent cadences.
 *
 * <p>A single loop thread wakes every tick interval, claims each enabled due task with
 * one compare-and-set and hands its body to a worker thread, so a slow body never delays
 * the tick and a task is never executed twice at once. Anything a body throws is caught
 * at the worker boundary. At most one scheduler runs per process.
 */
public final class TaskScheduler {
    private static final Logger LOG = LogManager.getLogger(TaskScheduler.class);
    private static final AtomicReference<TaskScheduler> ACTIVE = new AtomicReference<>();

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(30);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    private final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();
    private final Duration tickInterval;
    private final Duration stopTimeout;
    private final Clock clock;
    private final Object lifecycleLock = new Object();
    private final AtomicInteger workerSeq = new AtomicInteger();

    private volatile boolean running;
    private volatile boolean accepting = true;
    private Thread loopThread;
    private ExecutorService workers;
    private CountDownLatch wakeup;

    public TaskScheduler() {
        this(DEFAULT_TICK, DEFAULT_STOP_TIMEOUT, Clock.systemUTC());
    }

    public TaskScheduler(Duration tickInterval, Duration stopTimeout, Clock clock) {
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tick interval must be positive");
        }
        this.tickInterval = tickInterval;
        this.stopTimeout = stopTimeout == null ? DEFAULT_STOP_TIMEOUT : stopTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Registers a task that is due immediately. Names are unique per scheduler.
     */
    public ScheduledTask addTask(String name, Cadence cadence, TaskBody body) {
        synchronized (lifecycleLock) {
            if (findTask(name) != null) {
                throw new IllegalArgumentException("task already registered: " + name);
            }
            ScheduledTask task = new ScheduledTask(name, cadence, body, clock.instant());
            tasks.add(task);
            LOG.info("Task registered. name={} cadence={}", task.name(), cadence);
            return task;
        }
    }

    /**
     * Removes the task from future ticks. An execution already in flight finishes normally.
     */
    public boolean removeTask(String name) {
        synchronized (lifecycleLock) {
            ScheduledTask task = findTask(name);
            if (task == null) {
                return false;
            }
            tasks.remove(task);
            LOG.info("Task removed. name={}", task.name());
            return true;
        }
    }

    public boolean enableTask(String name) {
        return setEnabled(name, true);
    }

    public boolean disableTask(String name) {
        return setEnabled(name, false);
    }

    private boolean setEnabled(String name, boolean enabled) {
        ScheduledTask task = findTask(name);
        if (task == null) {
            return false;
        }
        task.setEnabled(enabled);
        LOG.info("Task {}. name={}", enabled ? "enabled" : "disabled", task.name());
        return true;
    }

    public ScheduledTask findTask(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim();
        for (ScheduledTask task : tasks) {
            if (task.name().equals(key)) {
                return task;
            }
        }
        return null;
    }

    /**
     * Starts the loop thread. Calling it again while running is a no-op. Returns false when
     * another scheduler instance is already running in this process.
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (running) {
                return true;
            }
            if (!ACTIVE.compareAndSet(null, this)) {
                LOG.warn("Another scheduler is already running in this process; start ignored.");
                return false;
            }
            accepting = true;
            running = true;
            wakeup = new CountDownLatch(1);
            ensureWorkers();
            CountDownLatch latch = wakeup;
            loopThread = new Thread(() -> loop(latch), "staybot-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
            LOG.info("Scheduler started. tasks={} tick={}", tasks.size(), tickInterval);
            return true;
        }
    }

    /**
     * Stops dispatching and waits up to the stop timeout for the loop thread to exit.
     * Bodies already running are left to finish. Calling it again is a no-op.
     */
    public void stop() {
        Thread thread;
        ExecutorService pool;
        synchronized (lifecycleLock) {
            accepting = false;
            pool = workers;
            workers = null;
            if (!running) {
                if (pool != null) {
                    pool.shutdown();
                }
                return;
            }
            running = false;
            wakeup.countDown();
            thread = loopThread;
            loopThread = null;
        }

        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                LOG.warn("Scheduler loop did not exit within {}", stopTimeout);
            }
        }
        if (pool != null) {
            pool.shutdown();
        }
        ACTIVE.compareAndSet(this, null);
        LOG.info("Scheduler stopped.");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduling pass: dispatches every enabled, due, idle task. Returns how many were dispatched.
     */
    public int tick() {
        if (!accepting) {
            return 0;
        }
        Instant now = clock.instant();
        int dispatched = 0;
        for (ScheduledTask task : tasks) {
            if (!task.isDue(now)) {
                continue;
            }
            if (!task.tryStart(now)) {
                continue;
            }
            if (dispatch(task)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * Dispatches the named task immediately, enabled or not, unless it is already executing.
     */
    public boolean runNow(String name) {
        ScheduledTask task = findTask(name);
        if (task == null) {
            throw new IllegalArgumentException("unknown task: " + name);
        }
        if (!accepting || !task.tryStart(clock.instant())) {
            return false;
        }
        return dispatch(task);
    }

    /**
     * Waits until no task is executing. Returns false on timeout.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            boolean busy = false;
            for (ScheduledTask task : tasks) {
                if (task.isRunning()) {
                    busy = true;
                    break;
                }
            }
            if (!busy) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10L);
        }
    }

    public SchedulerStatus status() {
        List<TaskStatus> out = new ArrayList<>();
        for (ScheduledTask task : tasks) {
            out.add(task.status());
        }
        return SchedulerStatus.builder()
                .running(running)
                .taskCount(out.size())
                .tasks(out)
                .build();
    }

    private void loop(CountDownLatch latch) {
        while (running) {
            try {
                tick();
            } catch (RuntimeException e) {
                LOG.error("Scheduler tick failed", e);
            }
            try {
                if (latch.await(tickInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.debug("Scheduler loop exited.");
    }

    private boolean dispatch(ScheduledTask task) {
        ExecutorService pool;
        synchronized (lifecycleLock) {
            pool = accepting ? ensureWorkers() : null;
        }
        if (pool == null) {
            task.abandon();
            return false;
        }
        try {
            pool.execute(() -> execute(task));
            return true;
        } catch (RejectedExecutionException e) {
            task.abandon();
            LOG.warn("Task {} not dispatched: worker pool is shut down", task.name());
            return false;
        }
    }

    private void execute(ScheduledTask task) {
        LOG.info("Task started. name={}", task.name());
        long started = System.nanoTime();
        Throwable failure = null;
        try {
            task.body().run();
        } catch (Exception e) {
            failure = e;
            LOG.error("Task failed. name={} err={}", task.name(), e.getMessage(), e);
        } catch (Error e) {
            failure = e;
            LOG.error("Task failed with error. name={}", task.name(), e);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            task.complete(clock.instant(), failure);
        }
        if (failure == null) {
            LOG.info("Task finished. name={} elapsed_ms={} next_run={}",
                    task.name(), (System.nanoTime() - started) / 1_000_000L, task.nextRun());
        }
    }

    private ExecutorService ensureWorkers() {
        if (workers == null) {
            ThreadFactory factory = runnable -> {
                Thread t = new Thread(runnable, "staybot-task-" + workerSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
            workers = Executors.newCachedThreadPool(factory);
        }
        return workers;
    }
}
