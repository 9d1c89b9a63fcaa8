package org.abstractica.realtime.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FrameCodec}.
 */
class FrameCodecTest
{
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encode_writesEventAndData() throws Exception
    {
        String text = FrameCodec.encode("task:update", JsonNodeFactory.instance.objectNode().put("id", "t1"));

        JsonNode frame = mapper.readTree(text);
        assertEquals("task:update", frame.get("event").asText());
        assertEquals("t1", frame.get("data").get("id").asText());
    }

    @Test
    void encode_nullPayload_omitsData() throws Exception
    {
        JsonNode frame = mapper.readTree(FrameCodec.encode("ping", NullNode.getInstance()));

        assertEquals("ping", frame.get("event").asText());
        assertFalse(frame.has("data"));
    }

    @Test
    void decode_readsEventAndData()
    {
        FrameCodec.Frame frame = FrameCodec.decode("{\"event\":\"contact:created\",\"data\":{\"id\":7}}");

        assertEquals("contact:created", frame.event());
        assertEquals(7, frame.data().get("id").asInt());
    }

    @Test
    void decode_missingData_isNullNode()
    {
        FrameCodec.Frame frame = FrameCodec.decode("{\"event\":\"pong\"}");

        assertTrue(frame.data().isNull());
    }

    @Test
    void decode_rejectsBadFrames()
    {
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.decode("not json"));
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.decode("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.decode("{\"data\":{}}"));
        assertThrows(IllegalArgumentException.class, () -> FrameCodec.decode("{\"event\":\"\"}"));
    }
}
