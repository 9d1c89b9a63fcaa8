package org.abstractica.realtime.impl.client;

import org.abstractica.realtime.RealtimeClient;
import org.abstractica.realtime.impl.loop.ManualEventLoop;
import org.abstractica.realtime.impl.transport.FakeTransportFactory;
import org.abstractica.realtime.impl.transport.TransportOptions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultRealtimeClientFactory}.
 */
class DefaultRealtimeClientFactoryTest
{
    private final DefaultRealtimeClientFactory factory = new DefaultRealtimeClientFactory();

    @Test
    void build_withoutServerUri_throws()
    {
        DefaultRealtimeClientFactory.DefaultBuilder builder = factory.builder()
                .authTokenProvider(() -> Optional.of("t"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void build_withoutTokenProvider_throws()
    {
        DefaultRealtimeClientFactory.DefaultBuilder builder = factory.builder()
                .serverUri(URI.create("http://localhost:3001"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void serverUri_mustBeAbsolute()
    {
        assertThrows(IllegalArgumentException.class, () -> factory.builder().serverUri(URI.create("/realtime")));
    }

    @Test
    void builderSettings_reachTheTransport()
    {
        FakeTransportFactory transports = new FakeTransportFactory();
        ManualEventLoop loop = new ManualEventLoop();
        URI server = URI.create("https://api.example.com");

        RealtimeClient client = factory.builder()
                .serverUri(server)
                .authTokenProvider(() -> Optional.of("abc"))
                .connectTimeout(Duration.ofSeconds(5))
                .transportFactory(transports)
                .eventLoop(loop)
                .build();
        client.connect();

        TransportOptions options = transports.last().getOptions();
        assertEquals(server, options.serverUri());
        assertEquals("abc", options.authToken());
        assertEquals(Duration.ofSeconds(5), options.connectTimeout());
        assertFalse(options.toString().contains("abc"));

        client.close();
        assertFalse(loop.isClosed());
    }

    @Test
    void settingsFromEnvironment_countAsServerUri()
    {
        RealtimeClient client = factory.builder()
                .settings(RealtimeSettings.fromEnvironment(name -> null))
                .authTokenProvider(Optional::empty)
                .transportFactory(new FakeTransportFactory())
                .eventLoop(new ManualEventLoop())
                .build();

        assertNotNull(client);
        client.close();
    }
}
