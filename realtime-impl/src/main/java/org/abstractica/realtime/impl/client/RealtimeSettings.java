package org.abstractica.realtime.impl.client;

import org.abstractica.realtime.impl.queue.OutboundQueue;
import org.abstractica.realtime.impl.reconnect.ReconnectionStrategy;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Connection settings for a realtime client.
 *
 * @param serverUri            backend base URI
 * @param maxReconnectAttempts failed attempts before giving up
 * @param reconnectDelay       delay before the first retry
 * @param reconnectDelayMax    upper bound for retry delays
 * @param randomizationFactor  jitter applied to retry delays, in [0, 1)
 * @param connectTimeout       how long one attempt may take
 * @param queueCapacity        outbound queue capacity
 */
public record RealtimeSettings(
        URI serverUri,
        int maxReconnectAttempts,
        Duration reconnectDelay,
        Duration reconnectDelayMax,
        double randomizationFactor,
        Duration connectTimeout,
        int queueCapacity
)
{
    /**
     * Backend address used when none is configured.
     */
    public static final URI DEFAULT_SERVER_URI = URI.create("http://localhost:3001");

    /**
     * Default connect timeout.
     */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(20);

    static final String ENV_SERVER_URI = "REALTIME_API_URL";
    static final String ENV_MAX_ATTEMPTS = "REALTIME_MAX_RECONNECT_ATTEMPTS";
    static final String ENV_DELAY_MS = "REALTIME_RECONNECT_DELAY_MS";
    static final String ENV_DELAY_MAX_MS = "REALTIME_RECONNECT_DELAY_MAX_MS";
    static final String ENV_CONNECT_TIMEOUT_MS = "REALTIME_CONNECT_TIMEOUT_MS";
    static final String ENV_QUEUE_CAPACITY = "REALTIME_QUEUE_CAPACITY";

    public RealtimeSettings
    {
        Objects.requireNonNull(serverUri, "serverUri");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(reconnectDelayMax, "reconnectDelayMax");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxReconnectAttempts <= 0)
        {
            throw new IllegalArgumentException("maxReconnectAttempts must be positive: " + maxReconnectAttempts);
        }
        if (reconnectDelay.isNegative() || reconnectDelay.isZero())
        {
            throw new IllegalArgumentException("reconnectDelay must be positive: " + reconnectDelay);
        }
        if (reconnectDelayMax.compareTo(reconnectDelay) < 0)
        {
            throw new IllegalArgumentException("reconnectDelayMax must not be below reconnectDelay: " + reconnectDelayMax);
        }
        if (randomizationFactor < 0 || randomizationFactor >= 1)
        {
            throw new IllegalArgumentException("randomizationFactor must be in [0, 1): " + randomizationFactor);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero())
        {
            throw new IllegalArgumentException("connectTimeout must be positive: " + connectTimeout);
        }
        if (queueCapacity <= 0)
        {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
    }

    /**
     * Returns the default settings.
     *
     * @return settings pointing at the local development backend
     */
    public static RealtimeSettings defaults()
    {
        return new RealtimeSettings(
                DEFAULT_SERVER_URI,
                ReconnectionStrategy.DEFAULT_MAX_ATTEMPTS,
                ReconnectionStrategy.DEFAULT_BASE_DELAY,
                ReconnectionStrategy.DEFAULT_MAX_DELAY,
                ReconnectionStrategy.DEFAULT_RANDOMIZATION_FACTOR,
                DEFAULT_CONNECT_TIMEOUT,
                OutboundQueue.DEFAULT_CAPACITY
        );
    }

    /**
     * Reads settings from environment variables, falling back to defaults.
     *
     * <p>Recognized variables: {@code REALTIME_API_URL},
     * {@code REALTIME_MAX_RECONNECT_ATTEMPTS}, {@code REALTIME_RECONNECT_DELAY_MS},
     * {@code REALTIME_RECONNECT_DELAY_MAX_MS}, {@code REALTIME_CONNECT_TIMEOUT_MS}
     * and {@code REALTIME_QUEUE_CAPACITY}.</p>
     *
     * @param environment variable lookup, e.g. {@code System::getenv}
     * @return the settings
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static RealtimeSettings fromEnvironment(Function<String, String> environment)
    {
        Objects.requireNonNull(environment, "environment");
        RealtimeSettings defaults = defaults();

        String uri = trimToNull(environment.apply(ENV_SERVER_URI));
        URI serverUri;
        try
        {
            serverUri = uri != null ? URI.create(uri) : defaults.serverUri();
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException(ENV_SERVER_URI + " is not a valid URI: " + uri, e);
        }

        return new RealtimeSettings(
                serverUri,
                readInt(environment, ENV_MAX_ATTEMPTS, defaults.maxReconnectAttempts()),
                readMillis(environment, ENV_DELAY_MS, defaults.reconnectDelay()),
                readMillis(environment, ENV_DELAY_MAX_MS, defaults.reconnectDelayMax()),
                defaults.randomizationFactor(),
                readMillis(environment, ENV_CONNECT_TIMEOUT_MS, defaults.connectTimeout()),
                readInt(environment, ENV_QUEUE_CAPACITY, defaults.queueCapacity())
        );
    }

    public RealtimeSettings withServerUri(URI uri)
    {
        return new RealtimeSettings(uri, maxReconnectAttempts, reconnectDelay, reconnectDelayMax,
                randomizationFactor, connectTimeout, queueCapacity);
    }

    public RealtimeSettings withMaxReconnectAttempts(int attempts)
    {
        return new RealtimeSettings(serverUri, attempts, reconnectDelay, reconnectDelayMax,
                randomizationFactor, connectTimeout, queueCapacity);
    }

    public RealtimeSettings withReconnectDelay(Duration base, Duration max)
    {
        return new RealtimeSettings(serverUri, maxReconnectAttempts, base, max,
                randomizationFactor, connectTimeout, queueCapacity);
    }

    public RealtimeSettings withRandomizationFactor(double factor)
    {
        return new RealtimeSettings(serverUri, maxReconnectAttempts, reconnectDelay, reconnectDelayMax,
                factor, connectTimeout, queueCapacity);
    }

    public RealtimeSettings withConnectTimeout(Duration timeout)
    {
        return new RealtimeSettings(serverUri, maxReconnectAttempts, reconnectDelay, reconnectDelayMax,
                randomizationFactor, timeout, queueCapacity);
    }

    public RealtimeSettings withQueueCapacity(int capacity)
    {
        return new RealtimeSettings(serverUri, maxReconnectAttempts, reconnectDelay, reconnectDelayMax,
                randomizationFactor, connectTimeout, capacity);
    }

    private static int readInt(Function<String, String> environment, String name, int defaultValue)
    {
        String value = trimToNull(environment.apply(name));
        if (value == null)
        {
            return defaultValue;
        }
        try
        {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static Duration readMillis(Function<String, String> environment, String name, Duration defaultValue)
    {
        String value = trimToNull(environment.apply(name));
        if (value == null)
        {
            return defaultValue;
        }
        try
        {
            return Duration.ofMillis(Long.parseLong(value));
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(name + " must be a number of milliseconds: " + value, e);
        }
    }

    private static String trimToNull(String value)
    {
        if (value == null)
        {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
