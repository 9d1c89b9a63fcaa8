package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A bidirectional message connection to the realtime server.
 *
 * <p>A transport handle makes connection attempts on {@link #open()} and reports
 * outcomes to its {@link TransportListener}. Each attempt must end in
 * {@code onOpen} or {@code onConnectError} within the configured connect
 * timeout. The transport only delivers messages for events it has been asked to
 * {@link #listen} to.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Starts a connection attempt. Does nothing if already open or opening.
     */
    void open();

    /**
     * Sends an event.
     *
     * <p>"Sent" means handed to the underlying connection; there is no
     * acknowledgement from the server.</p>
     *
     * <p>A payload that cannot be encoded is logged and dropped; the call
     * returns true for it.</p>
     *
     * @param event   the event name
     * @param payload the payload
     * @return true if accepted or dropped as unencodable, false if the
     *         connection is not open
     */
    boolean send(String event, JsonNode payload);

    /**
     * Starts delivering messages for an event.
     *
     * @param event the event name
     */
    void listen(String event);

    /**
     * Stops delivering messages for an event.
     *
     * @param event the event name
     */
    void unlisten(String event);

    /**
     * Closes the connection. No further listener callbacks are made.
     */
    @Override
    void close();
}
