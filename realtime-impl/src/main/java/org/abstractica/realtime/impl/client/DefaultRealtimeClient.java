package org.abstractica.realtime.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.abstractica.realtime.AuthTokenProvider;
import org.abstractica.realtime.ConnectionSnapshot;
import org.abstractica.realtime.ConnectionState;
import org.abstractica.realtime.ConnectionStatus;
import org.abstractica.realtime.ErrorReporter;
import org.abstractica.realtime.RealtimeClient;
import org.abstractica.realtime.RealtimeEvent;
import org.abstractica.realtime.Subscription;
import org.abstractica.realtime.TransportError;
import org.abstractica.realtime.handlers.ErrorHandler;
import org.abstractica.realtime.handlers.EventHandler;
import org.abstractica.realtime.impl.dispatch.EventDispatcher;
import org.abstractica.realtime.impl.dispatch.StatusBroadcaster;
import org.abstractica.realtime.impl.loop.Cancellable;
import org.abstractica.realtime.impl.loop.EventLoop;
import org.abstractica.realtime.impl.queue.OutboundQueue;
import org.abstractica.realtime.impl.reconnect.ReconnectionStrategy;
import org.abstractica.realtime.impl.transport.CloseReason;
import org.abstractica.realtime.impl.transport.Transport;
import org.abstractica.realtime.impl.transport.TransportFactory;
import org.abstractica.realtime.impl.transport.TransportListener;
import org.abstractica.realtime.impl.transport.TransportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Default implementation of the RealtimeClient interface.
 *
 * <p>Owns the transport handle and drives the connection state. All state is
 * confined to the event loop: public operations and transport callbacks are
 * submitted to it, and only fields read by the snapshot getters are volatile.</p>
 */
public class DefaultRealtimeClient implements RealtimeClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultRealtimeClient.class);

    static final String PING_EVENT = "ping";
    static final String PONG_EVENT = "pong";
    static final String CLIENT_DISCONNECT_REASON = "io client disconnect";
    static final String NO_TOKEN_REASON = "no auth token";
    static final String TIMEOUT_REASON = "connect timeout";
    static final String FAILED_MESSAGE = "Unable to connect. Please reconnect manually.";

    private final RealtimeSettings settings;
    private final AuthTokenProvider tokenProvider;
    private final TransportFactory transportFactory;
    private final EventLoop eventLoop;
    private final boolean ownsEventLoop;
    private final ErrorReporter errorReporter;

    private final EventDispatcher dispatcher;
    private final StatusBroadcaster broadcaster;
    private final OutboundQueue queue;
    private final ReconnectionStrategy reconnection;

    // Event loop confined
    private Transport transport;
    private long transportGeneration;
    private Cancellable attemptTimeout;
    private boolean shutDown;

    // Written on the event loop, readable from any thread
    private volatile ConnectionState state;
    private volatile boolean connecting;
    private volatile boolean manualDisconnect;
    private volatile String socketId;
    private volatile int reconnectAttempts;
    private volatile int queuedMessages;

    private final AtomicBoolean closed;

    /**
     * Creates a new client.
     */
    DefaultRealtimeClient(
            RealtimeSettings settings,
            AuthTokenProvider tokenProvider,
            TransportFactory transportFactory,
            EventLoop eventLoop,
            boolean ownsEventLoop,
            Clock clock,
            Random random,
            ErrorReporter errorReporter,
            ErrorHandler errorHandler
    )
    {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.ownsEventLoop = ownsEventLoop;
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");

        this.dispatcher = new EventDispatcher();
        this.dispatcher.setErrorHandler(errorHandler);
        this.dispatcher.setListenerHooks(new TransportListenerHooks());
        this.broadcaster = new StatusBroadcaster(dispatcher);
        this.queue = new OutboundQueue(Objects.requireNonNull(clock, "clock"), settings.queueCapacity());
        this.reconnection = new ReconnectionStrategy(
                eventLoop,
                settings.maxReconnectAttempts(),
                settings.reconnectDelay(),
                settings.reconnectDelayMax(),
                settings.randomizationFactor(),
                Objects.requireNonNull(random, "random"));

        this.state = ConnectionState.DISCONNECTED;
        this.closed = new AtomicBoolean(false);
    }

    // ========== RealtimeClient Interface ==========

    @Override
    public void connect()
    {
        eventLoop.execute(this::doConnect);
    }

    @Override
    public void disconnect()
    {
        eventLoop.execute(this::doDisconnect);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        eventLoop.execute(() ->
        {
            doDisconnect();
            shutDown = true;
            int dropped = queue.clear();
            queuedMessages = 0;
            dispatcher.clear();
            if (dropped > 0)
            {
                LOG.warn("Client closed with {} unsent messages", dropped);
            }
            if (ownsEventLoop)
            {
                eventLoop.close();
            }
        });
    }

    @Override
    public void emitOrQueue(String eventName, JsonNode payload)
    {
        if (eventName == null || eventName.isEmpty())
        {
            LOG.warn("Ignoring emit without event name");
            return;
        }
        JsonNode data = payload != null ? payload : NullNode.getInstance();

        eventLoop.execute(() ->
        {
            if (shutDown)
            {
                LOG.debug("Client closed, dropping {}", eventName);
                return;
            }
            boolean backlog = !queue.isEmpty();
            if (state == ConnectionState.CONNECTED && !backlog && sendNow(eventName, data))
            {
                return;
            }
            queue.enqueue(eventName, data);
            queuedMessages = queue.size();
            if (state == ConnectionState.CONNECTED && backlog)
            {
                // Earlier messages are still waiting; they go first
                flushQueue();
            }
        });
    }

    @Override
    public void ping()
    {
        eventLoop.execute(() ->
        {
            if (state == ConnectionState.CONNECTED)
            {
                sendNow(PING_EVENT, NullNode.getInstance());
            }
        });
    }

    @Override
    public Subscription on(RealtimeEvent event, EventHandler handler)
    {
        if (event == null || handler == null)
        {
            LOG.warn("Ignoring subscription with missing event or handler");
            return () -> {};
        }

        eventLoop.execute(() ->
        {
            if (!shutDown)
            {
                dispatcher.on(event, handler);
            }
        });
        return () -> off(event, handler);
    }

    @Override
    public void off(RealtimeEvent event, EventHandler handler)
    {
        if (event == null || handler == null)
        {
            return;
        }
        eventLoop.execute(() -> dispatcher.off(event, handler));
    }

    @Override
    public Subscription onConnectionStatus(Consumer<ConnectionStatus> handler)
    {
        if (handler == null)
        {
            LOG.warn("Ignoring null status handler");
            return () -> {};
        }
        return on(RealtimeEvent.CONNECTION_STATUS, payload -> handler.accept(ConnectionStatus.fromJson(payload)));
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        eventLoop.execute(() -> dispatcher.setErrorHandler(handler));
    }

    @Override
    public boolean isConnected()
    {
        return state == ConnectionState.CONNECTED;
    }

    @Override
    public ConnectionState getState()
    {
        return state;
    }

    @Override
    public Optional<String> getSocketId()
    {
        return Optional.ofNullable(socketId);
    }

    @Override
    public ConnectionSnapshot getSnapshot()
    {
        ConnectionState current = state;
        return new ConnectionSnapshot(
                current == ConnectionState.CONNECTED,
                connecting,
                socketId,
                reconnectAttempts,
                current,
                queuedMessages);
    }

    // ========== Lifecycle ==========

    private void doConnect()
    {
        if (shutDown)
        {
            LOG.warn("Client is closed");
            return;
        }
        if (state == ConnectionState.CONNECTED || connecting)
        {
            LOG.debug("Already connected or connecting");
            return;
        }

        Optional<String> token = fetchToken();
        if (token.isEmpty())
        {
            LOG.warn("No authentication token available. Realtime connection disabled.");
            return;
        }

        manualDisconnect = false;
        if (state == ConnectionState.RECONNECTING)
        {
            // Skip the remaining backoff but keep counting attempts
            reconnection.cancelPendingRetry();
        }
        else
        {
            reconnection.reset();
            reconnectAttempts = 0;
            setState(ConnectionState.CONNECTING);
        }

        openTransport(token.get());
    }

    private void doDisconnect()
    {
        if (state == ConnectionState.DISCONNECTED && transport == null)
        {
            return;
        }

        LOG.info("Disconnecting");

        manualDisconnect = true;
        cancelAttemptTimeout();
        reconnection.reset();
        reconnectAttempts = 0;
        discardTransport();

        setState(ConnectionState.DISCONNECTED);
        broadcaster.publish(ConnectionStatus.disconnected(CLIENT_DISCONNECT_REASON));
    }

    private void reconnect()
    {
        if (shutDown || manualDisconnect)
        {
            return;
        }

        Optional<String> token = fetchToken();
        if (token.isEmpty())
        {
            LOG.warn("No authentication token available. Stopping reconnection.");
            reconnection.reset();
            reconnectAttempts = 0;
            discardTransport();
            setState(ConnectionState.DISCONNECTED);
            broadcaster.publish(ConnectionStatus.disconnected(NO_TOKEN_REASON));
            return;
        }

        LOG.info("Reconnection attempt {}/{}", reconnection.getAttempts() + 1, reconnection.getMaxAttempts());
        openTransport(token.get());
    }

    private void openTransport(String token)
    {
        discardTransport();

        long generation = transportGeneration;
        TransportOptions options = new TransportOptions(settings.serverUri(), token, settings.connectTimeout());

        LOG.info("Connecting to {}", settings.serverUri());

        try
        {
            transport = transportFactory.create(options, new HandleListener(generation));
            transport.listen(PONG_EVENT);
            for (RealtimeEvent event : dispatcher.getServerEvents())
            {
                transport.listen(event.getWireName());
            }
        }
        catch (Exception e)
        {
            LOG.error("Could not create transport", e);
            transport = null;
            onAttemptFailed(TransportError.from(e).message());
            return;
        }

        connecting = true;
        cancelAttemptTimeout();
        attemptTimeout = eventLoop.schedule(() -> onAttemptTimeout(generation), settings.connectTimeout());

        try
        {
            transport.open();
        }
        catch (Exception e)
        {
            handleConnectError(generation, e);
        }
    }

    // ========== Transport Events ==========

    private void handleOpen(long generation, String transportId)
    {
        if (generation != transportGeneration)
        {
            return;
        }

        LOG.info("Connected: {}", transportId);

        cancelAttemptTimeout();
        connecting = false;
        socketId = transportId;
        reconnection.reset();
        reconnectAttempts = 0;

        setState(ConnectionState.CONNECTED);
        broadcaster.publish(ConnectionStatus.connected());
        flushQueue();
    }

    private void handleClose(long generation, CloseReason reason)
    {
        if (generation != transportGeneration || manualDisconnect)
        {
            return;
        }

        LOG.info("Disconnected: {}", reason.describe());

        cancelAttemptTimeout();
        boolean wasConnected = state == ConnectionState.CONNECTED && !connecting;
        connecting = false;
        socketId = null;
        discardTransport();

        if (!wasConnected)
        {
            onAttemptFailed(reason.describe());
            return;
        }

        setState(ConnectionState.RECONNECTING);
        broadcaster.publish(ConnectionStatus.reconnecting(
                reconnection.getAttempts(), reconnection.getMaxAttempts(), reason.describe()));

        if (reason instanceof CloseReason.ServerDisconnect)
        {
            // The server will not bring the session back; start over at once
            reconnect();
        }
        else
        {
            reconnection.scheduleRetry(reconnection.calculateDelay(1), this::reconnect);
        }
    }

    private void handleConnectError(long generation, Object rawError)
    {
        if (generation != transportGeneration || manualDisconnect)
        {
            return;
        }

        TransportError error = TransportError.from(rawError);
        LOG.error("Connection error: {}", error.message());

        cancelAttemptTimeout();
        connecting = false;
        discardTransport();
        onAttemptFailed(error.message());
    }

    private void handleError(long generation, Object rawError)
    {
        if (generation != transportGeneration)
        {
            return;
        }

        TransportError error = TransportError.from(rawError);
        Map<String, Object> context = errorContext();
        LOG.error("Error event received: {} {}", error.message(), context);

        try
        {
            errorReporter.report(error, context);
        }
        catch (Exception e)
        {
            LOG.error("Error reporter failed", e);
        }
    }

    private void handleMessage(long generation, String eventName, JsonNode payload)
    {
        if (generation != transportGeneration)
        {
            return;
        }

        if (PONG_EVENT.equals(eventName))
        {
            LOG.debug("Pong received: {}", payload);
            return;
        }

        Optional<RealtimeEvent> event = RealtimeEvent.fromWireName(eventName);
        if (event.isEmpty())
        {
            LOG.debug("Ignoring unknown event: {}", eventName);
            return;
        }

        if (event.get() == RealtimeEvent.CONNECTION_ESTABLISHED)
        {
            LOG.info("Connection established: {}", payload);
        }
        dispatcher.dispatch(event.get(), payload);
    }

    private void onAttemptTimeout(long generation)
    {
        if (generation != transportGeneration || !connecting)
        {
            return;
        }

        LOG.warn("Connection attempt timed out after {}", settings.connectTimeout());
        attemptTimeout = null;
        connecting = false;
        discardTransport();
        onAttemptFailed(TIMEOUT_REASON);
    }

    private void onAttemptFailed(String reason)
    {
        if (manualDisconnect)
        {
            return;
        }

        ReconnectionStrategy.Decision decision = reconnection.recordFailure();
        reconnectAttempts = reconnection.getAttempts();

        if (decision instanceof ReconnectionStrategy.Decision.Retry retry)
        {
            setState(ConnectionState.RECONNECTING);
            broadcaster.publish(ConnectionStatus.reconnecting(
                    retry.attempt(), reconnection.getMaxAttempts(), reason));
            reconnection.scheduleRetry(retry.delay(), this::reconnect);
        }
        else
        {
            LOG.error("Max reconnection attempts reached");
            discardTransport();
            setState(ConnectionState.FAILED);
            broadcaster.publish(ConnectionStatus.failed(
                    reconnection.getAttempts(), reconnection.getMaxAttempts(), FAILED_MESSAGE));
        }
    }

    // ========== Helpers ==========

    private void flushQueue()
    {
        if (queue.isEmpty())
        {
            return;
        }

        LOG.info("Flushing {} queued messages", queue.size());
        OutboundQueue.FlushResult result = queue.flush(message ->
                state == ConnectionState.CONNECTED && sendNow(message.eventName(), message.payload()));
        queuedMessages = queue.size();
        LOG.debug("Flush complete: {} sent, {} re-queued", result.sent(), result.requeued());
    }

    private boolean sendNow(String eventName, JsonNode payload)
    {
        if (transport == null)
        {
            return false;
        }
        try
        {
            return transport.send(eventName, payload);
        }
        catch (Exception e)
        {
            LOG.warn("Send failed for {}", eventName, e);
            return false;
        }
    }

    private Optional<String> fetchToken()
    {
        try
        {
            return tokenProvider.currentToken().filter(token -> !token.isBlank());
        }
        catch (Exception e)
        {
            LOG.warn("Auth token provider failed", e);
            return Optional.empty();
        }
    }

    private void discardTransport()
    {
        if (transport == null)
        {
            return;
        }

        Transport current = transport;
        transport = null;
        transportGeneration++;
        connecting = false;
        socketId = null;

        try
        {
            current.close();
        }
        catch (Exception e)
        {
            LOG.warn("Error closing transport", e);
        }
    }

    private void cancelAttemptTimeout()
    {
        if (attemptTimeout != null)
        {
            attemptTimeout.cancel();
            attemptTimeout = null;
        }
    }

    private void setState(ConnectionState newState)
    {
        if (state != newState)
        {
            LOG.debug("State {} -> {}", state, newState);
            state = newState;
        }
    }

    private Map<String, Object> errorContext()
    {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("socketId", socketId != null ? socketId : "unknown");
        context.put("connected", state == ConnectionState.CONNECTED);
        context.put("reconnectAttempts", reconnection.getAttempts());
        context.put("manualDisconnect", manualDisconnect);
        return context;
    }

    /**
     * Installs and removes transport listeners as handlers come and go.
     */
    private class TransportListenerHooks implements EventDispatcher.ListenerHooks
    {
        @Override
        public void listenerAdded(RealtimeEvent event)
        {
            if (transport != null)
            {
                transport.listen(event.getWireName());
            }
        }

        @Override
        public void listenerRemoved(RealtimeEvent event)
        {
            if (transport != null)
            {
                transport.unlisten(event.getWireName());
            }
        }
    }

    /**
     * Moves callbacks of one transport handle onto the event loop.
     *
     * <p>Each handle gets its own listener tagged with a generation, so callbacks
     * from a handle that has since been discarded are ignored.</p>
     */
    private class HandleListener implements TransportListener
    {
        private final long generation;

        HandleListener(long generation)
        {
            this.generation = generation;
        }

        @Override
        public void onOpen(String transportId)
        {
            eventLoop.execute(() -> handleOpen(generation, transportId));
        }

        @Override
        public void onClose(CloseReason reason)
        {
            eventLoop.execute(() -> handleClose(generation, reason));
        }

        @Override
        public void onConnectError(Object error)
        {
            eventLoop.execute(() -> handleConnectError(generation, error));
        }

        @Override
        public void onError(Object error)
        {
            eventLoop.execute(() -> handleError(generation, error));
        }

        @Override
        public void onMessage(String event, JsonNode payload)
        {
            eventLoop.execute(() -> handleMessage(generation, event, payload));
        }
    }
}
