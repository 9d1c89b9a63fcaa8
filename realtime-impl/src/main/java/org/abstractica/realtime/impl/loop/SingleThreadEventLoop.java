package org.abstractica.realtime.impl.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event loop backed by a single daemon thread.
 */
public class SingleThreadEventLoop implements EventLoop
{
    private static final Logger LOG = LoggerFactory.getLogger(SingleThreadEventLoop.class);
    private static final AtomicInteger LOOP_COUNTER = new AtomicInteger();

    private final ScheduledThreadPoolExecutor executor;

    /**
     * Creates a loop with a generated thread name.
     */
    public SingleThreadEventLoop()
    {
        this("realtime-event-loop-" + LOOP_COUNTER.incrementAndGet());
    }

    /**
     * Creates a loop whose thread has the given name.
     *
     * @param threadName the thread name
     */
    public SingleThreadEventLoop(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.executor = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        try
        {
            executor.execute(() -> runSafely(task));
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Event loop closed, dropping task");
        }
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay)
    {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        try
        {
            ScheduledFuture<?> future = executor.schedule(
                    () -> runSafely(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Event loop closed, dropping timer");
            return () -> {};
        }
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }

    private static void runSafely(Runnable task)
    {
        try
        {
            task.run();
        }
        catch (Exception e)
        {
            LOG.error("Uncaught error in event loop task", e);
        }
    }
}
