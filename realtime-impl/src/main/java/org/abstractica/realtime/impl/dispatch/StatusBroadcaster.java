package org.abstractica.realtime.impl.dispatch;

import org.abstractica.realtime.ConnectionState;
import org.abstractica.realtime.ConnectionStatus;
import org.abstractica.realtime.RealtimeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Republishes connection state changes as {@link RealtimeEvent#CONNECTION_STATUS} events.
 */
public class StatusBroadcaster
{
    private static final Logger LOG = LoggerFactory.getLogger(StatusBroadcaster.class);

    private final EventDispatcher dispatcher;

    public StatusBroadcaster(EventDispatcher dispatcher)
    {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Logs a status and dispatches it to status handlers.
     *
     * @param status the new status
     */
    public void publish(ConnectionStatus status)
    {
        Objects.requireNonNull(status, "status");
        if (status.status() == ConnectionState.FAILED)
        {
            LOG.warn("Connection status: {}", status);
        }
        else
        {
            LOG.debug("Connection status: {}", status);
        }

        dispatcher.dispatch(RealtimeEvent.CONNECTION_STATUS, status.toJson());
    }
}
