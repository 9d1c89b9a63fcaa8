package org.abstractica.realtime.impl.loop;

/**
 * Handle for a scheduled task.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Cancels the task if it has not run yet.
     */
    void cancel();
}
