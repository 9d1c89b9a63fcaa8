package org.abstractica.realtime.impl.client;

import org.abstractica.realtime.AuthTokenProvider;
import org.abstractica.realtime.ErrorReporter;
import org.abstractica.realtime.RealtimeClient;
import org.abstractica.realtime.RealtimeClientFactory;
import org.abstractica.realtime.handlers.ErrorHandler;
import org.abstractica.realtime.impl.error.LoggingErrorReporter;
import org.abstractica.realtime.impl.loop.EventLoop;
import org.abstractica.realtime.impl.loop.SingleThreadEventLoop;
import org.abstractica.realtime.impl.transport.TransportFactory;
import org.abstractica.realtime.impl.transport.WebSocketTransportFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Default implementation of RealtimeClientFactory.
 */
public class DefaultRealtimeClientFactory implements RealtimeClientFactory
{
    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private RealtimeSettings settings = RealtimeSettings.defaults();
        private boolean serverUriSet;
        private AuthTokenProvider tokenProvider;
        private TransportFactory transportFactory; // Optional, defaults to WebSocketTransportFactory
        private EventLoop eventLoop; // Optional, defaults to an owned SingleThreadEventLoop
        private Clock clock = Clock.systemUTC();
        private Random random = new Random();
        private ErrorReporter errorReporter = new LoggingErrorReporter();
        private ErrorHandler errorHandler;

        /**
         * Replaces all connection settings at once.
         *
         * <p>Settings applied afterwards through other builder methods override
         * the corresponding values.</p>
         *
         * @param settings the settings, e.g. from {@link RealtimeSettings#fromEnvironment}
         * @return this builder
         */
        public DefaultBuilder settings(RealtimeSettings settings)
        {
            this.settings = Objects.requireNonNull(settings, "settings");
            this.serverUriSet = true;
            return this;
        }

        @Override
        public DefaultBuilder serverUri(URI uri)
        {
            Objects.requireNonNull(uri, "uri");
            if (uri.getScheme() == null || uri.getHost() == null)
            {
                throw new IllegalArgumentException("Server URI must be absolute: " + uri);
            }
            this.settings = settings.withServerUri(uri);
            this.serverUriSet = true;
            return this;
        }

        @Override
        public DefaultBuilder authTokenProvider(AuthTokenProvider provider)
        {
            this.tokenProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        @Override
        public DefaultBuilder maxReconnectAttempts(int maxAttempts)
        {
            this.settings = settings.withMaxReconnectAttempts(maxAttempts);
            return this;
        }

        @Override
        public DefaultBuilder reconnectDelay(Duration base, Duration maxDelay)
        {
            this.settings = settings.withReconnectDelay(
                    Objects.requireNonNull(base, "base"),
                    Objects.requireNonNull(maxDelay, "maxDelay"));
            return this;
        }

        /**
         * Sets the jitter applied to retry delays.
         *
         * <p>Optional. Defaults to 0.5; 0 makes delays deterministic.</p>
         *
         * @param factor jitter in the range [0, 1)
         * @return this builder
         */
        public DefaultBuilder randomizationFactor(double factor)
        {
            this.settings = settings.withRandomizationFactor(factor);
            return this;
        }

        @Override
        public DefaultBuilder connectTimeout(Duration timeout)
        {
            this.settings = settings.withConnectTimeout(Objects.requireNonNull(timeout, "timeout"));
            return this;
        }

        @Override
        public DefaultBuilder queueCapacity(int capacity)
        {
            this.settings = settings.withQueueCapacity(capacity);
            return this;
        }

        @Override
        public DefaultBuilder clock(Clock clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        @Override
        public DefaultBuilder errorReporter(ErrorReporter reporter)
        {
            this.errorReporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        @Override
        public DefaultBuilder errorHandler(ErrorHandler handler)
        {
            this.errorHandler = handler;
            return this;
        }

        /**
         * Sets the factory for transport handles.
         *
         * <p>If not set, {@link WebSocketTransportFactory} is used.</p>
         *
         * @param transportFactory the transport factory
         * @return this builder
         */
        public DefaultBuilder transportFactory(TransportFactory transportFactory)
        {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
            return this;
        }

        /**
         * Sets the event loop the client runs on.
         *
         * <p>If not set, the client creates its own loop and closes it on
         * {@link RealtimeClient#close()}. A loop passed here is not closed by
         * the client.</p>
         *
         * @param eventLoop the event loop
         * @return this builder
         */
        public DefaultBuilder eventLoop(EventLoop eventLoop)
        {
            this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
            return this;
        }

        /**
         * Sets the random source for retry jitter.
         *
         * @param random the random source
         * @return this builder
         */
        public DefaultBuilder random(Random random)
        {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        @Override
        public DefaultRealtimeClient build()
        {
            if (!serverUriSet)
            {
                throw new IllegalStateException("Server URI must be specified");
            }
            if (tokenProvider == null)
            {
                throw new IllegalStateException("Auth token provider must be specified");
            }

            TransportFactory transports = transportFactory != null
                    ? transportFactory
                    : new WebSocketTransportFactory();
            boolean ownsLoop = eventLoop == null;
            EventLoop loop = ownsLoop ? new SingleThreadEventLoop() : eventLoop;

            return new DefaultRealtimeClient(
                    settings,
                    tokenProvider,
                    transports,
                    loop,
                    ownsLoop,
                    clock,
                    random,
                    errorReporter,
                    errorHandler);
        }
    }
}
