package org.abstractica.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A connection state change, as published under {@link RealtimeEvent#CONNECTION_STATUS}.
 *
 * <p>Optional fields are null when not applicable. {@code attempt} and
 * {@code maxAttempts} let consumers render progress such as "attempt 3 of 10".</p>
 *
 * @param status      the new state
 * @param attempt     current reconnection attempt, or null
 * @param maxAttempts configured attempt budget, or null
 * @param reason      why the connection closed, or null
 * @param message     human readable hint, or null
 */
public record ConnectionStatus(
        ConnectionState status,
        Integer attempt,
        Integer maxAttempts,
        String reason,
        String message
)
{
    private static final String STATUS = "status";
    private static final String ATTEMPT = "attempt";
    private static final String MAX_ATTEMPTS = "maxAttempts";
    private static final String REASON = "reason";
    private static final String MESSAGE = "message";

    public ConnectionStatus
    {
        Objects.requireNonNull(status, "status");
    }

    public static ConnectionStatus connected()
    {
        return new ConnectionStatus(ConnectionState.CONNECTED, null, null, null, null);
    }

    public static ConnectionStatus disconnected(String reason)
    {
        return new ConnectionStatus(ConnectionState.DISCONNECTED, null, null, reason, null);
    }

    public static ConnectionStatus reconnecting(int attempt, int maxAttempts, String reason)
    {
        return new ConnectionStatus(ConnectionState.RECONNECTING, attempt, maxAttempts, reason, null);
    }

    public static ConnectionStatus failed(int attempt, int maxAttempts, String message)
    {
        return new ConnectionStatus(ConnectionState.FAILED, attempt, maxAttempts, null, message);
    }

    public Optional<Integer> getAttempt()
    {
        return Optional.ofNullable(attempt);
    }

    public Optional<Integer> getMaxAttempts()
    {
        return Optional.ofNullable(maxAttempts);
    }

    public Optional<String> getReason()
    {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getMessage()
    {
        return Optional.ofNullable(message);
    }

    /**
     * Encodes this status as the payload of a status event.
     *
     * <p>Absent fields are omitted rather than written as null.</p>
     *
     * @return a JSON object
     */
    public ObjectNode toJson()
    {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(STATUS, status.getLabel());
        if (attempt != null)
        {
            node.put(ATTEMPT, attempt);
        }
        if (maxAttempts != null)
        {
            node.put(MAX_ATTEMPTS, maxAttempts);
        }
        if (reason != null)
        {
            node.put(REASON, reason);
        }
        if (message != null)
        {
            node.put(MESSAGE, message);
        }
        return node;
    }

    /**
     * Decodes a status event payload.
     *
     * @param node the payload produced by {@link #toJson()}
     * @return the decoded status
     * @throws IllegalArgumentException if the payload has no valid status
     */
    public static ConnectionStatus fromJson(JsonNode node)
    {
        Objects.requireNonNull(node, "node");
        JsonNode status = node.get(STATUS);
        if (status == null || !status.isTextual())
        {
            throw new IllegalArgumentException("Status payload has no status field: " + node);
        }
        return new ConnectionStatus(
                ConnectionState.fromLabel(status.asText()),
                node.hasNonNull(ATTEMPT) ? node.get(ATTEMPT).asInt() : null,
                node.hasNonNull(MAX_ATTEMPTS) ? node.get(MAX_ATTEMPTS).asInt() : null,
                node.hasNonNull(REASON) ? node.get(REASON).asText() : null,
                node.hasNonNull(MESSAGE) ? node.get(MESSAGE).asText() : null
        );
    }
}
