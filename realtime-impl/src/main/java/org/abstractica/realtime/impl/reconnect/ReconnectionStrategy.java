package org.abstractica.realtime.impl.reconnect;

import org.abstractica.realtime.impl.loop.Cancellable;
import org.abstractica.realtime.impl.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Decides when to retry a failed connection and when to give up.
 *
 * <p>Each failed attempt doubles the delay, starting at the base delay and
 * capped at the maximum delay. A randomization factor spreads retries of many
 * clients apart. After {@code maxAttempts} consecutive failures the strategy
 * gives up until {@link #reset()} is called.</p>
 *
 * <p>Not thread-safe; all access happens on the event loop it schedules on.</p>
 */
public class ReconnectionStrategy
{
    private static final Logger LOG = LoggerFactory.getLogger(ReconnectionStrategy.class);

    /**
     * Default number of failed attempts before giving up.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    /**
     * Default delay before the first retry.
     */
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    /**
     * Default upper bound for any retry delay.
     */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    /**
     * Default randomization factor; 0.5 means +/- 50% around the nominal delay.
     */
    public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;

    /**
     * What to do after a failed attempt.
     */
    public sealed interface Decision
    {
        /**
         * Retry after a delay.
         *
         * @param attempt number of failed attempts so far
         * @param delay   time to wait before the next attempt
         */
        record Retry(int attempt, Duration delay) implements Decision {}

        /**
         * The attempt budget is spent.
         *
         * @param attempt number of failed attempts
         */
        record GiveUp(int attempt) implements Decision {}
    }

    private final EventLoop eventLoop;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double randomizationFactor;
    private final Random random;

    private int attempts;
    private Cancellable pendingRetry;

    /**
     * Creates a strategy with default settings.
     *
     * @param eventLoop loop used to schedule retries
     */
    public ReconnectionStrategy(EventLoop eventLoop)
    {
        this(eventLoop, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY,
                DEFAULT_RANDOMIZATION_FACTOR, new Random());
    }

    /**
     * Creates a strategy.
     *
     * @param eventLoop           loop used to schedule retries
     * @param maxAttempts         failed attempts before giving up
     * @param baseDelay           delay before the first retry
     * @param maxDelay            upper bound for any delay
     * @param randomizationFactor jitter in the range [0, 1)
     * @param random              source of jitter
     */
    public ReconnectionStrategy(
            EventLoop eventLoop,
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay,
            double randomizationFactor,
            Random random
    )
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.random = Objects.requireNonNull(random, "random");
        if (maxAttempts <= 0)
        {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (baseDelay.isNegative() || baseDelay.isZero())
        {
            throw new IllegalArgumentException("baseDelay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0)
        {
            throw new IllegalArgumentException("maxDelay must not be below baseDelay: " + maxDelay);
        }
        if (randomizationFactor < 0 || randomizationFactor >= 1)
        {
            throw new IllegalArgumentException("randomizationFactor must be in [0, 1): " + randomizationFactor);
        }
        this.maxAttempts = maxAttempts;
        this.randomizationFactor = randomizationFactor;
    }

    /**
     * Counts a failed attempt and decides what happens next.
     *
     * @return {@link Decision.Retry} with the delay, or {@link Decision.GiveUp}
     *         once the attempt budget is spent
     */
    public Decision recordFailure()
    {
        attempts++;
        if (attempts >= maxAttempts)
        {
            LOG.debug("Attempt budget spent after {} attempts", attempts);
            return new Decision.GiveUp(attempts);
        }
        return new Decision.Retry(attempts, calculateDelay(attempts));
    }

    /**
     * Calculates the delay after the given number of failed attempts.
     *
     * <p>Nominal delay is {@code baseDelay * 2^(attempt-1)}, jittered by the
     * randomization factor and capped at {@code maxDelay}.</p>
     *
     * @param attempt failed attempts so far, at least 1
     * @return the delay
     */
    public Duration calculateDelay(int attempt)
    {
        if (attempt < 1)
        {
            throw new IllegalArgumentException("Attempt must be at least 1: " + attempt);
        }

        long maxMs = maxDelay.toMillis();
        long nominalMs = baseDelay.toMillis() << Math.min(attempt - 1, 30);
        if (nominalMs <= 0 || nominalMs > maxMs)
        {
            nominalMs = maxMs;
        }

        if (randomizationFactor > 0)
        {
            double deviation = (random.nextDouble() * 2 - 1) * randomizationFactor * nominalMs;
            nominalMs = Math.round(nominalMs + deviation);
        }
        return Duration.ofMillis(Math.max(0, Math.min(nominalMs, maxMs)));
    }

    /**
     * Schedules a retry, replacing any retry already pending.
     *
     * @param delay time to wait
     * @param retry the attempt to run
     */
    public void scheduleRetry(Duration delay, Runnable retry)
    {
        Objects.requireNonNull(retry, "retry");
        cancelPendingRetry();
        LOG.debug("Retry {} of {} in {} ms", attempts + 1, maxAttempts, delay.toMillis());
        pendingRetry = eventLoop.schedule(() ->
        {
            pendingRetry = null;
            retry.run();
        }, delay);
    }

    /**
     * Cancels the pending retry, if any.
     */
    public void cancelPendingRetry()
    {
        if (pendingRetry != null)
        {
            pendingRetry.cancel();
            pendingRetry = null;
        }
    }

    public boolean hasPendingRetry()
    {
        return pendingRetry != null;
    }

    /**
     * Clears the attempt count and cancels any pending retry.
     */
    public void reset()
    {
        attempts = 0;
        cancelPendingRetry();
    }

    public int getAttempts()
    {
        return attempts;
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }
}
