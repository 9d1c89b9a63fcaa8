package org.abstractica.realtime.handlers;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles occurrences of a realtime event.
 *
 * <p>Handlers are called on the client's event loop thread, one at a time.
 * A handler that needs to do slow work should hand the payload off to
 * another executor.</p>
 */
@FunctionalInterface
public interface EventHandler
{
    /**
     * Handles an event occurrence.
     *
     * @param payload the event payload exactly as sent by the server
     */
    void handle(JsonNode payload);
}
