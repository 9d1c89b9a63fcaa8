package org.abstractica.realtime.impl.dispatch;

import org.abstractica.realtime.ConnectionStatus;
import org.abstractica.realtime.RealtimeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StatusBroadcaster}.
 */
class StatusBroadcasterTest
{
    private EventDispatcher dispatcher;
    private StatusBroadcaster broadcaster;

    @BeforeEach
    void setUp()
    {
        dispatcher = new EventDispatcher();
        broadcaster = new StatusBroadcaster(dispatcher);
    }

    @Test
    void publish_reachesStatusHandlersAsJson()
    {
        List<ConnectionStatus> received = new ArrayList<>();
        dispatcher.on(RealtimeEvent.CONNECTION_STATUS, p -> received.add(ConnectionStatus.fromJson(p)));

        ConnectionStatus status = ConnectionStatus.reconnecting(2, 10, "transport close");
        broadcaster.publish(status);

        assertEquals(List.of(status), received);
    }

    @Test
    void publish_failed_carriesMessage()
    {
        List<String> payloads = new ArrayList<>();
        dispatcher.on(RealtimeEvent.CONNECTION_STATUS, p -> payloads.add(p.get("status").asText() + "|" + p.get("message").asText()));

        broadcaster.publish(ConnectionStatus.failed(10, 10, "Unable to connect"));

        assertEquals(List.of("failed|Unable to connect"), payloads);
    }
}
