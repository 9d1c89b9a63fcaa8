package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives notifications from a {@link Transport}.
 *
 * <p>Methods may be called from any thread. Implementations must not block.</p>
 */
public interface TransportListener
{
    /**
     * The connection is open.
     *
     * @param transportId id assigned to this connection
     */
    void onOpen(String transportId);

    /**
     * An open connection closed. Not called after {@link Transport#close()}.
     *
     * @param reason why the connection closed
     */
    void onClose(CloseReason reason);

    /**
     * A connection attempt failed before the connection opened.
     *
     * @param error the failure, of any shape
     */
    void onConnectError(Object error);

    /**
     * The server or the transport reported an error on an open connection.
     *
     * @param error the error, of any shape
     */
    void onError(Object error);

    /**
     * A message arrived for an event this transport listens to.
     *
     * @param event   the event name
     * @param payload the payload as received
     */
    void onMessage(String event, JsonNode payload);
}
