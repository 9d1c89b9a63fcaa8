package org.abstractica.realtime;

/**
 * Handle returned when registering an event handler.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    /**
     * Removes the handler this subscription was created for.
     *
     * <p>Calling this more than once has no further effect.</p>
     */
    void unsubscribe();

    @Override
    default void close()
    {
        unsubscribe();
    }
}
