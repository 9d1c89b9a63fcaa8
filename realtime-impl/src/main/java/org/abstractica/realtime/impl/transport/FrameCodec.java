package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Encodes and decodes WebSocket text frames.
 *
 * <p>A frame is a JSON object {@code {"event": name, "data": payload}}. The
 * {@code data} member is omitted when the payload is null.</p>
 */
public final class FrameCodec
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String EVENT = "event";
    static final String DATA = "data";

    private FrameCodec() {}

    /**
     * A decoded frame.
     *
     * @param event the event name
     * @param data  the payload, {@link NullNode} if absent
     */
    public record Frame(String event, JsonNode data)
    {
        public Frame
        {
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * Encodes an event as a text frame.
     *
     * @param event   the event name
     * @param payload the payload, may be null
     * @return the frame text
     */
    public static String encode(String event, JsonNode payload)
    {
        Objects.requireNonNull(event, "event");
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put(EVENT, event);
        if (payload != null && !payload.isNull() && !payload.isMissingNode())
        {
            frame.set(DATA, payload);
        }
        try
        {
            return MAPPER.writeValueAsString(frame);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Cannot encode frame for event: " + event, e);
        }
    }

    /**
     * Decodes a text frame.
     *
     * @param text the frame text
     * @return the decoded frame
     * @throws IllegalArgumentException if the text is not a valid frame
     */
    public static Frame decode(String text)
    {
        Objects.requireNonNull(text, "text");
        JsonNode root;
        try
        {
            root = MAPPER.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Malformed frame: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject())
        {
            throw new IllegalArgumentException("Frame is not a JSON object");
        }
        JsonNode event = root.get(EVENT);
        if (event == null || !event.isTextual() || event.asText().isEmpty())
        {
            throw new IllegalArgumentException("Frame has no event name");
        }

        JsonNode data = root.get(DATA);
        return new Frame(event.asText(), data != null ? data : NullNode.getInstance());
    }
}
