package org.abstractica.realtime.impl.loop;

import java.time.Duration;

/**
 * Single-threaded executor that serializes all work of a realtime client.
 *
 * <p>Transport callbacks, timer callbacks and public client operations are all
 * submitted here, so client state is only ever touched by one task at a time.
 * Tasks run in submission order.</p>
 */
public interface EventLoop extends AutoCloseable
{
    /**
     * Submits a task for execution.
     *
     * <p>Tasks submitted after {@link #close()} are dropped.</p>
     *
     * @param task the task to run
     */
    void execute(Runnable task);

    /**
     * Schedules a task to run after a delay.
     *
     * @param task  the task to run
     * @param delay how long to wait
     * @return a handle to cancel the task
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Stops the loop. Pending tasks and timers are discarded.
     */
    @Override
    void close();
}
