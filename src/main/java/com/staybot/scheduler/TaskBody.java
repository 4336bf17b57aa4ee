package com.staybot.scheduler;

/**
 * The work a scheduled task performs. Anything thrown is caught and logged by the scheduler.
 */
@FunctionalInterface
public interface TaskBody {
    void run() throws Exception;
}
