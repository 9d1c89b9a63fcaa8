package org.abstractica.realtime;

import java.util.Map;

/**
 * Receives transport errors for external error tracking.
 *
 * <p>Called on the client's event loop thread. Exceptions thrown by a reporter
 * are caught and logged; they never affect the connection.</p>
 */
@FunctionalInterface
public interface ErrorReporter
{
    /**
     * Reports a mid-session transport error.
     *
     * @param error   the normalized error
     * @param context diagnostic context: socket id, reconnect attempts,
     *                manual disconnect flag and connection state
     */
    void report(TransportError error, Map<String, Object> context);
}
