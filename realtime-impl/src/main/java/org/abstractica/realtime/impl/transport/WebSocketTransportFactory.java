package org.abstractica.realtime.impl.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * Creates {@link WebSocketTransport} handles sharing one {@link HttpClient}.
 */
public class WebSocketTransportFactory implements TransportFactory
{
    /**
     * Path used when the server URI has none.
     */
    public static final String DEFAULT_PATH = "/realtime";

    private final HttpClient httpClient;
    private final String defaultPath;

    public WebSocketTransportFactory()
    {
        this(HttpClient.newHttpClient(), DEFAULT_PATH);
    }

    public WebSocketTransportFactory(HttpClient httpClient, String defaultPath)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.defaultPath = Objects.requireNonNull(defaultPath, "defaultPath");
    }

    @Override
    public Transport create(TransportOptions options, TransportListener listener)
    {
        URI uri = WebSocketTransport.toWebSocketUri(options.serverUri(), defaultPath);
        return new WebSocketTransport(httpClient, uri, options, listener);
    }
}
