package org.abstractica.realtime;

import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time view of a realtime connection for monitoring.
 *
 * <p>Snapshots are pollable. The application can query them and push the values
 * to a monitoring system of choice.</p>
 *
 * @param connected         whether the transport is open
 * @param connecting        whether an attempt is in flight
 * @param socketId          transport-assigned id, or null when not connected
 * @param reconnectAttempts failed attempts since the last successful open
 * @param state             current connection state
 * @param queuedMessages    outbound messages waiting for a connection
 */
public record ConnectionSnapshot(
        boolean connected,
        boolean connecting,
        String socketId,
        int reconnectAttempts,
        ConnectionState state,
        int queuedMessages
)
{
    public ConnectionSnapshot
    {
        Objects.requireNonNull(state, "state");
    }

    public Optional<String> getSocketId()
    {
        return Optional.ofNullable(socketId);
    }
}
