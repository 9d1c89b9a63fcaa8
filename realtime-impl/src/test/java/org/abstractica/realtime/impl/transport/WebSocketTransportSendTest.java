package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.POJONode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketTransport} sending and frame handling over an
 * in-memory {@link WebSocket}.
 */
class WebSocketTransportSendTest
{
    /**
     * WebSocket that records outgoing text frames.
     */
    private static class RecordingWebSocket implements WebSocket
    {
        final List<String> texts = new ArrayList<>();
        boolean closeSent;

        @Override
        public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last)
        {
            texts.add(data.toString());
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPing(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPong(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendClose(int statusCode, String reason)
        {
            closeSent = true;
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public void request(long n)
        {
        }

        @Override
        public String getSubprotocol()
        {
            return "";
        }

        @Override
        public boolean isOutputClosed()
        {
            return closeSent;
        }

        @Override
        public boolean isInputClosed()
        {
            return false;
        }

        @Override
        public void abort()
        {
        }
    }

    /**
     * Listener that records callbacks as strings.
     */
    private static class RecordingListener implements TransportListener
    {
        final List<String> calls = new ArrayList<>();
        final List<Object> errors = new ArrayList<>();
        CloseReason closeReason;

        @Override
        public void onOpen(String id)
        {
            calls.add("open");
        }

        @Override
        public void onClose(CloseReason reason)
        {
            calls.add("close");
            closeReason = reason;
        }

        @Override
        public void onConnectError(Object error)
        {
            calls.add("connectError");
        }

        @Override
        public void onError(Object error)
        {
            calls.add("error");
            errors.add(error);
        }

        @Override
        public void onMessage(String event, JsonNode payload)
        {
            calls.add("message:" + event);
        }
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private RecordingWebSocket socket;
    private RecordingListener listener;
    private WebSocketTransport transport;

    @BeforeEach
    void setUp()
    {
        socket = new RecordingWebSocket();
        listener = new RecordingListener();
        TransportOptions options = new TransportOptions(
                URI.create("http://localhost:3001"), "token", Duration.ofSeconds(1));
        transport = new WebSocketTransport(
                HttpClient.newHttpClient(), URI.create("ws://localhost:3001/realtime"), options, listener);
        transport.onOpen(socket);
    }

    @Test
    void send_beforeOpen_returnsFalse()
    {
        TransportOptions options = new TransportOptions(
                URI.create("http://localhost:3001"), "token", Duration.ofSeconds(1));
        WebSocketTransport unopened = new WebSocketTransport(
                HttpClient.newHttpClient(), URI.create("ws://localhost:3001/realtime"), options, listener);

        assertFalse(unopened.send("task:update", JsonNodeFactory.instance.objectNode()));
    }

    @Test
    void send_writesEncodedFrame() throws Exception
    {
        assertTrue(transport.send("task:update", JsonNodeFactory.instance.objectNode().put("id", "t1")));

        assertEquals(1, socket.texts.size());
        JsonNode frame = mapper.readTree(socket.texts.get(0));
        assertEquals("task:update", frame.get("event").asText());
        assertEquals("t1", frame.get("data").get("id").asText());
    }

    @Test
    void send_unencodablePayload_isDroppedAndReportedAccepted()
    {
        JsonNode unencodable = new POJONode(new Object());

        assertTrue(transport.send("task:update", unencodable));
        assertTrue(socket.texts.isEmpty());

        assertTrue(transport.send("task:update", JsonNodeFactory.instance.objectNode()));
        assertEquals(1, socket.texts.size());
    }

    @Test
    void inbound_onlyListenedEventsAreDelivered()
    {
        transport.listen("task:created");

        transport.onText(socket, "{\"event\":\"task:created\",\"data\":{}}", true);
        transport.onText(socket, "{\"event\":\"task:deleted\",\"data\":{}}", true);

        assertEquals(List.of("open", "message:task:created"), listener.calls);
    }

    @Test
    void inbound_fragmentsAreJoined()
    {
        transport.listen("pong");

        transport.onText(socket, "{\"event\":", false);
        transport.onText(socket, "\"pong\"}", true);

        assertEquals(List.of("open", "message:pong"), listener.calls);
    }

    @Test
    void inbound_disconnectFrame_closesAsServerDisconnect()
    {
        transport.onText(socket, "{\"event\":\"disconnect\",\"data\":{\"message\":\"kicked\"}}", true);

        assertEquals(new CloseReason.ServerDisconnect("kicked"), listener.closeReason);
        assertTrue(socket.closeSent);

        transport.onClose(socket, 1000, "");
        assertEquals(1, listener.calls.stream().filter("close"::equals).count());
    }

    @Test
    void inbound_errorAndMalformedFrames_reachOnError()
    {
        transport.onText(socket, "{\"event\":\"error\",\"data\":{\"message\":\"forbidden\"}}", true);
        transport.onText(socket, "garbage", true);

        assertEquals(2, listener.errors.size());
        assertEquals("forbidden", ((JsonNode) listener.errors.get(0)).get("message").asText());
        assertInstanceOf(IllegalArgumentException.class, listener.errors.get(1));
    }

    @Test
    void close_sendsCloseAndSuppressesCallbacks()
    {
        transport.close();
        transport.onClose(socket, 1000, "bye");

        assertTrue(socket.closeSent);
        assertEquals(List.of("open"), listener.calls);
    }
}
