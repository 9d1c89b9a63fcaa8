package org.abstractica.realtime.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.realtime.RealtimeEvent;

/**
 * Handles exceptions thrown by event handlers.
 *
 * <p>When an event handler throws, the client catches the exception, logs it,
 * and invokes this error handler. The remaining handlers for the same event
 * still run; one buggy handler should not starve the others.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by an event handler.
     *
     * @param event     the event being dispatched
     * @param payload   the payload that caused the error
     * @param exception the exception thrown by the handler
     */
    void handle(RealtimeEvent event, JsonNode payload, Exception exception);
}
