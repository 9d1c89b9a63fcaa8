package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transport over a JDK {@link WebSocket}.
 *
 * <p>Authenticates with an {@code Authorization: Bearer} header and exchanges
 * JSON text frames encoded by {@link FrameCodec}. Two event names are reserved
 * by the server: {@code disconnect} ends the session from the server side and
 * {@code error} reports a session error.</p>
 */
public class WebSocketTransport implements Transport, WebSocket.Listener
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);

    static final String SERVER_DISCONNECT_EVENT = "disconnect";
    static final String SERVER_ERROR_EVENT = "error";

    private final HttpClient httpClient;
    private final URI uri;
    private final TransportOptions options;
    private final TransportListener listener;

    private final Set<String> listenedEvents;
    private final AtomicReference<WebSocket> socket;
    private final AtomicBoolean opening;
    private final AtomicBoolean finished;
    private final StringBuilder textBuffer;
    private final Object sendLock;

    private volatile boolean closed;
    private volatile String id;
    private CompletableFuture<WebSocket> sendChain;

    /**
     * Creates a transport.
     *
     * @param httpClient client used to open the WebSocket
     * @param uri        the WebSocket URI
     * @param options    token and connect timeout
     * @param listener   receives notifications
     */
    public WebSocketTransport(HttpClient httpClient, URI uri, TransportOptions options, TransportListener listener)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.options = Objects.requireNonNull(options, "options");
        this.listener = Objects.requireNonNull(listener, "listener");

        this.listenedEvents = ConcurrentHashMap.newKeySet();
        this.socket = new AtomicReference<>();
        this.opening = new AtomicBoolean(false);
        this.finished = new AtomicBoolean(false);
        this.textBuffer = new StringBuilder();
        this.sendLock = new Object();
    }

    // ========== Transport Interface ==========

    @Override
    public void open()
    {
        if (closed || socket.get() != null || !opening.compareAndSet(false, true))
        {
            return;
        }

        LOG.debug("Opening WebSocket to {}", uri);
        finished.set(false);

        httpClient.newWebSocketBuilder()
                .header("Authorization", "Bearer " + options.authToken())
                .connectTimeout(options.connectTimeout())
                .buildAsync(uri, this)
                .whenComplete((ws, error) ->
                {
                    opening.set(false);
                    if (error != null && !closed)
                    {
                        listener.onConnectError(unwrap(error));
                    }
                });
    }

    @Override
    public boolean send(String event, JsonNode payload)
    {
        WebSocket ws = socket.get();
        if (ws == null || ws.isOutputClosed())
        {
            return false;
        }

        String frame;
        try
        {
            frame = FrameCodec.encode(event, payload);
        }
        catch (IllegalArgumentException e)
        {
            LOG.warn("Dropping unencodable message for {}", event, e);
            return true;
        }

        // WebSocket allows one outstanding send; chain them to keep order
        synchronized (sendLock)
        {
            CompletableFuture<WebSocket> previous = sendChain != null
                    ? sendChain
                    : CompletableFuture.completedFuture(ws);
            sendChain = previous
                    .exceptionally(error -> ws)
                    .thenCompose(current -> ws.sendText(frame, true));
            sendChain.whenComplete((result, error) ->
            {
                if (error != null)
                {
                    LOG.warn("Send failed for {}: {}", event, unwrap(error).getMessage());
                }
            });
        }
        return true;
    }

    @Override
    public void listen(String event)
    {
        listenedEvents.add(Objects.requireNonNull(event, "event"));
    }

    @Override
    public void unlisten(String event)
    {
        listenedEvents.remove(event);
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        finished.set(true);

        WebSocket ws = socket.getAndSet(null);
        if (ws != null)
        {
            LOG.debug("Closing WebSocket {}", id);
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "io client disconnect")
                    .whenComplete((result, error) ->
                    {
                        if (error != null)
                        {
                            ws.abort();
                        }
                    });
        }
    }

    // ========== WebSocket.Listener ==========

    @Override
    public void onOpen(WebSocket webSocket)
    {
        if (closed)
        {
            webSocket.abort();
            return;
        }
        id = UUID.randomUUID().toString();
        socket.set(webSocket);
        webSocket.request(1);
        LOG.debug("WebSocket open: {}", id);
        listener.onOpen(id);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last)
    {
        textBuffer.append(data);
        if (last)
        {
            String text = textBuffer.toString();
            textBuffer.setLength(0);
            handleFrame(text);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason)
    {
        socket.compareAndSet(webSocket, null);
        notifyClosed(new CloseReason.TransportClosed(statusCode, reason));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error)
    {
        socket.compareAndSet(webSocket, null);
        notifyClosed(new CloseReason.NetworkError(error));
    }

    // ========== Helpers ==========

    private void handleFrame(String text)
    {
        FrameCodec.Frame frame;
        try
        {
            frame = FrameCodec.decode(text);
        }
        catch (IllegalArgumentException e)
        {
            listener.onError(e);
            return;
        }

        String event = frame.event();
        if (SERVER_DISCONNECT_EVENT.equals(event))
        {
            JsonNode message = frame.data().get("message");
            WebSocket ws = socket.getAndSet(null);
            if (ws != null)
            {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "");
            }
            notifyClosed(new CloseReason.ServerDisconnect(message != null ? message.asText() : null));
        }
        else if (SERVER_ERROR_EVENT.equals(event))
        {
            listener.onError(frame.data());
        }
        else if (listenedEvents.contains(event))
        {
            listener.onMessage(event, frame.data());
        }
        else
        {
            LOG.trace("No listener for event: {}", event);
        }
    }

    private void notifyClosed(CloseReason reason)
    {
        if (closed || !finished.compareAndSet(false, true))
        {
            return;
        }
        listener.onClose(reason);
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null)
        {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Derives a WebSocket URI from a server base URI.
     *
     * <p>{@code http} becomes {@code ws} and {@code https} becomes {@code wss}.
     * If the base URI has no path, {@code defaultPath} is used.</p>
     *
     * @param base        the server base URI
     * @param defaultPath path to use when the base has none
     * @return the WebSocket URI
     * @throws IllegalArgumentException if the scheme is not supported
     */
    public static URI toWebSocketUri(URI base, String defaultPath)
    {
        Objects.requireNonNull(base, "base");
        String scheme = base.getScheme() == null ? "" : base.getScheme().toLowerCase();
        String wsScheme;
        switch (scheme)
        {
            case "http", "ws" -> wsScheme = "ws";
            case "https", "wss" -> wsScheme = "wss";
            default -> throw new IllegalArgumentException("Unsupported scheme: " + base);
        }

        String path = base.getPath();
        if (path == null || path.isEmpty() || path.equals("/"))
        {
            path = defaultPath;
        }

        try
        {
            return new URI(wsScheme, base.getUserInfo(), base.getHost(), base.getPort(), path, base.getQuery(), null);
        }
        catch (URISyntaxException e)
        {
            throw new IllegalArgumentException("Invalid server URI: " + base, e);
        }
    }
}
