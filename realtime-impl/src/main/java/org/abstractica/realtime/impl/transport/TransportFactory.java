package org.abstractica.realtime.impl.transport;

/**
 * Creates transport handles.
 *
 * <p>The client creates a new handle for each connection it starts, so a
 * handle never outlives one session.</p>
 */
@FunctionalInterface
public interface TransportFactory
{
    /**
     * Creates an unopened transport.
     *
     * @param options  connection settings
     * @param listener receives the transport's notifications
     * @return the transport
     */
    Transport create(TransportOptions options, TransportListener listener);
}
