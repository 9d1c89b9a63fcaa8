package org.abstractica.realtime.impl.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one transport handle.
 *
 * @param serverUri      the server URI
 * @param authToken      bearer token for the handshake
 * @param connectTimeout how long an attempt may take
 */
public record TransportOptions(URI serverUri, String authToken, Duration connectTimeout)
{
    public TransportOptions
    {
        Objects.requireNonNull(serverUri, "serverUri");
        Objects.requireNonNull(authToken, "authToken");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public String toString()
    {
        // Keep the token out of logs
        return "TransportOptions[serverUri=" + serverUri + ", connectTimeout=" + connectTimeout + "]";
    }
}
