package org.abstractica.realtime.impl.client;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RealtimeSettings}.
 */
class RealtimeSettingsTest
{
    @Test
    void fromEnvironment_emptyUsesDefaults()
    {
        assertEquals(RealtimeSettings.defaults(), RealtimeSettings.fromEnvironment(name -> null));
    }

    @Test
    void defaults_matchDocumentedValues()
    {
        RealtimeSettings settings = RealtimeSettings.defaults();

        assertEquals(URI.create("http://localhost:3001"), settings.serverUri());
        assertEquals(10, settings.maxReconnectAttempts());
        assertEquals(Duration.ofSeconds(1), settings.reconnectDelay());
        assertEquals(Duration.ofSeconds(30), settings.reconnectDelayMax());
        assertEquals(Duration.ofSeconds(20), settings.connectTimeout());
        assertEquals(100, settings.queueCapacity());
    }

    @Test
    void fromEnvironment_readsVariables()
    {
        Map<String, String> env = Map.of(
                RealtimeSettings.ENV_SERVER_URI, "https://api.example.com",
                RealtimeSettings.ENV_MAX_ATTEMPTS, "4",
                RealtimeSettings.ENV_DELAY_MS, "500",
                RealtimeSettings.ENV_DELAY_MAX_MS, " 8000 ",
                RealtimeSettings.ENV_CONNECT_TIMEOUT_MS, "3000",
                RealtimeSettings.ENV_QUEUE_CAPACITY, "25");

        RealtimeSettings settings = RealtimeSettings.fromEnvironment(env::get);

        assertEquals(URI.create("https://api.example.com"), settings.serverUri());
        assertEquals(4, settings.maxReconnectAttempts());
        assertEquals(Duration.ofMillis(500), settings.reconnectDelay());
        assertEquals(Duration.ofMillis(8000), settings.reconnectDelayMax());
        assertEquals(Duration.ofMillis(3000), settings.connectTimeout());
        assertEquals(25, settings.queueCapacity());
    }

    @Test
    void fromEnvironment_rejectsMalformedNumbers()
    {
        Map<String, String> env = Map.of(RealtimeSettings.ENV_MAX_ATTEMPTS, "ten");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RealtimeSettings.fromEnvironment(env::get));
        assertTrue(e.getMessage().contains(RealtimeSettings.ENV_MAX_ATTEMPTS));
    }

    @Test
    void constructor_rejectsInvalidValues()
    {
        RealtimeSettings defaults = RealtimeSettings.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxReconnectAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withQueueCapacity(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withConnectTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withReconnectDelay(Duration.ofSeconds(5), Duration.ofSeconds(1)));
    }
}
