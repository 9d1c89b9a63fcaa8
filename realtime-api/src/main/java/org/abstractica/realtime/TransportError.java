package org.abstractica.realtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Uniform representation of an error reported by the transport.
 *
 * <p>Transports report errors as exceptions, structured objects or plain
 * strings. {@link #from(Object)} normalizes all of them at the boundary so the
 * rest of the client deals with a single shape.</p>
 *
 * @param kind    what the raw value was
 * @param message human readable message, never null
 * @param raw     the value as received, may be null
 */
public record TransportError(Kind kind, String message, Object raw)
{
    /**
     * Shape of the raw error value.
     */
    public enum Kind
    {
        /**
         * A {@link Throwable}.
         */
        EXCEPTION,

        /**
         * A structured object such as a JSON object or a map.
         */
        OBJECT,

        /**
         * A string or any other value, rendered as text.
         */
        TEXT
    }

    static final String UNKNOWN_MESSAGE = "Unknown transport error";

    public TransportError
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Normalizes a raw error value.
     *
     * @param raw the value from the transport's error callback
     * @return the normalized error
     */
    public static TransportError from(Object raw)
    {
        if (raw instanceof TransportError error)
        {
            return error;
        }
        if (raw instanceof Throwable throwable)
        {
            String message = throwable.getMessage() != null
                    ? throwable.getMessage()
                    : throwable.getClass().getName();
            return new TransportError(Kind.EXCEPTION, message, raw);
        }
        if (raw instanceof JsonNode node)
        {
            if (node.isObject())
            {
                JsonNode message = node.get("message");
                String text = message != null && message.isTextual() ? message.asText() : node.toString();
                return new TransportError(Kind.OBJECT, text, raw);
            }
            String text = node.isTextual() ? node.asText() : node.toString();
            return new TransportError(Kind.TEXT, text.isEmpty() ? UNKNOWN_MESSAGE : text, raw);
        }
        if (raw instanceof Map<?, ?> map)
        {
            Object message = map.get("message");
            return new TransportError(Kind.OBJECT, message != null ? message.toString() : map.toString(), raw);
        }
        if (raw == null)
        {
            return new TransportError(Kind.TEXT, UNKNOWN_MESSAGE, null);
        }
        String text = raw.toString();
        return new TransportError(Kind.TEXT, text.isEmpty() ? UNKNOWN_MESSAGE : text, raw);
    }

    /**
     * Returns a throwable suitable for error trackers.
     *
     * @return the raw throwable, or a {@link RealtimeException} carrying the message
     */
    public Throwable toThrowable()
    {
        if (raw instanceof Throwable throwable)
        {
            return throwable;
        }
        return new RealtimeException(message);
    }
}
