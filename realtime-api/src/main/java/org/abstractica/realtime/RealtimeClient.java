package org.abstractica.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.realtime.handlers.ErrorHandler;
import org.abstractica.realtime.handlers.EventHandler;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A client holding a realtime connection to the command-center backend.
 *
 * <p>The client owns the transport, authenticates with the current access token,
 * recovers from transient network failures and buffers outbound messages while
 * the connection is down. Applications register handlers for server-pushed
 * events and observe connection changes through
 * {@link RealtimeEvent#CONNECTION_STATUS}.</p>
 *
 * <p>None of the operations block or throw. Their outcomes are observed later
 * through event handlers.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RealtimeClient client = clientFactory.builder()
 *     .serverUri(URI.create("https://api.example.com"))
 *     .authTokenProvider(session::accessToken)
 *     .build();
 *
 * client.on(RealtimeEvent.TASK_UPDATED, payload -> {
 *     // Refresh the task list
 * });
 *
 * client.onConnectionStatus(status -> {
 *     // Render "reconnecting (attempt 3 of 10)"
 * });
 *
 * client.connect();
 * }</pre>
 */
public interface RealtimeClient extends AutoCloseable
{
    /**
     * Connects to the server.
     *
     * <p>Does nothing if already connected or if an attempt is in flight.
     * If no access token is available the client stays disconnected. After
     * {@link ConnectionState#FAILED} this starts over with a fresh attempt
     * budget.</p>
     */
    void connect();

    /**
     * Disconnects from the server.
     *
     * <p>Cancels any pending reconnection and suppresses automatic reconnects
     * until the next {@link #connect()}. Queued outbound messages are kept.</p>
     */
    void disconnect();

    /**
     * Disconnects and releases all resources.
     *
     * <p>The client cannot be used afterwards.</p>
     */
    @Override
    void close();

    /**
     * Sends a client event, or queues it until the connection is available.
     *
     * <p>Queued messages are sent in order on the next successful connect. When
     * the queue is full the oldest message is dropped. No acknowledgement of
     * queuing is given to the caller.</p>
     *
     * @param eventName the client event name, e.g. {@code "task:update"}
     * @param payload   the event payload
     */
    void emitOrQueue(String eventName, JsonNode payload);

    /**
     * Sends a ping to the server if connected.
     */
    void ping();

    /**
     * Registers a handler for an event.
     *
     * <p>The same handler instance may be registered for several events.</p>
     *
     * @param event   the event to handle
     * @param handler the handler to invoke
     * @return a subscription that removes exactly this registration
     */
    Subscription on(RealtimeEvent event, EventHandler handler);

    /**
     * Removes a handler registered with {@link #on}.
     *
     * @param event   the event the handler was registered for
     * @param handler the handler instance to remove
     */
    void off(RealtimeEvent event, EventHandler handler);

    /**
     * Registers a typed handler for connection status changes.
     *
     * @param handler called with each published status
     * @return a subscription that removes this handler
     */
    Subscription onConnectionStatus(Consumer<ConnectionStatus> handler);

    /**
     * Registers an error handler for event handler exceptions.
     *
     * @param handler called when an event handler throws an exception
     */
    void onError(ErrorHandler handler);

    /**
     * Returns whether the connection is currently open.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Returns the current connection state.
     *
     * @return the state
     */
    ConnectionState getState();

    /**
     * Returns the transport-assigned id of the current connection.
     *
     * @return the id, or empty if not connected
     */
    Optional<String> getSocketId();

    /**
     * Returns a snapshot of the connection for monitoring.
     *
     * @return current snapshot
     */
    ConnectionSnapshot getSnapshot();
}
