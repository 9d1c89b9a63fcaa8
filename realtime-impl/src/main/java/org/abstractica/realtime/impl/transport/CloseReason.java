package org.abstractica.realtime.impl.transport;

import java.util.Objects;

/**
 * Reason a transport connection closed.
 *
 * <p>Sealed interface enabling exhaustive handling of close causes.</p>
 */
public sealed interface CloseReason
{
    /**
     * The server terminated the session. The server will not reconnect on its
     * own, so the client must re-initiate.
     *
     * @param message reason provided by the server, may be null
     */
    record ServerDisconnect(String message) implements CloseReason {}

    /**
     * The underlying connection was closed by the peer or an intermediary.
     *
     * @param code   the close status code
     * @param reason the close reason text
     */
    record TransportClosed(int code, String reason) implements CloseReason {}

    /**
     * Network-level error ended the connection.
     *
     * @param cause the underlying error
     */
    record NetworkError(Throwable cause) implements CloseReason
    {
        public NetworkError
        {
            Objects.requireNonNull(cause, "cause");
        }
    }

    /**
     * Returns a short description suitable for status payloads.
     *
     * @return the description
     */
    default String describe()
    {
        if (this instanceof ServerDisconnect)
        {
            return "io server disconnect";
        }
        if (this instanceof TransportClosed)
        {
            return "transport close";
        }
        return "transport error";
    }
}
