package org.abstractica.realtime.impl.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * An outbound message waiting for a connection.
 *
 * @param eventName  the client event name
 * @param payload    the event payload
 * @param enqueuedAt when the message was first queued
 */
public record QueuedMessage(String eventName, JsonNode payload, Instant enqueuedAt)
{
    public QueuedMessage
    {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }
}
