package org.abstractica.realtime.impl.transport;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketTransport#toWebSocketUri}.
 */
class WebSocketTransportTest
{
    @Test
    void http_becomesWsWithDefaultPath()
    {
        URI uri = WebSocketTransport.toWebSocketUri(URI.create("http://localhost:3001"), "/realtime");

        assertEquals(URI.create("ws://localhost:3001/realtime"), uri);
    }

    @Test
    void https_becomesWss()
    {
        URI uri = WebSocketTransport.toWebSocketUri(URI.create("https://api.example.com/"), "/realtime");

        assertEquals(URI.create("wss://api.example.com/realtime"), uri);
    }

    @Test
    void explicitPath_isKept()
    {
        URI uri = WebSocketTransport.toWebSocketUri(URI.create("wss://api.example.com/socket"), "/realtime");

        assertEquals(URI.create("wss://api.example.com/socket"), uri);
    }

    @Test
    void unsupportedScheme_throws()
    {
        assertThrows(IllegalArgumentException.class, () ->
                WebSocketTransport.toWebSocketUri(URI.create("ftp://example.com"), "/realtime"));
    }
}
