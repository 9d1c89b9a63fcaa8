package org.abstractica.realtime;

import org.abstractica.realtime.handlers.ErrorHandler;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * Factory for creating RealtimeClient instances.
 *
 * <p>Use the builder to configure the client before creation:</p>
 * <pre>{@code
 * RealtimeClientFactory factory = new DefaultRealtimeClientFactory();
 * RealtimeClient client = factory.builder()
 *     .serverUri(URI.create("http://localhost:3001"))
 *     .authTokenProvider(tokens)
 *     .maxReconnectAttempts(10)
 *     .build();
 * }</pre>
 */
public interface RealtimeClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a RealtimeClient.
     */
    interface Builder
    {
        /**
         * Sets the backend base URI.
         *
         * @param uri the server URI, http(s) or ws(s)
         * @return this builder
         */
        Builder serverUri(URI uri);

        /**
         * Sets the source of access tokens.
         *
         * @param provider the token provider
         * @return this builder
         */
        Builder authTokenProvider(AuthTokenProvider provider);

        /**
         * Sets the number of failed attempts after which the client gives up.
         *
         * <p>Optional. Defaults to 10.</p>
         *
         * @param maxAttempts the attempt budget, at least 1
         * @return this builder
         */
        Builder maxReconnectAttempts(int maxAttempts);

        /**
         * Sets the delay before the first retry and the cap for later retries.
         *
         * <p>Optional. Defaults to 1 second and 30 seconds.</p>
         *
         * @param base     delay before the first retry
         * @param maxDelay upper bound for any retry delay
         * @return this builder
         */
        Builder reconnectDelay(Duration base, Duration maxDelay);

        /**
         * Sets how long a single connection attempt may take.
         *
         * <p>Optional. Defaults to 20 seconds.</p>
         *
         * @param timeout the connect timeout
         * @return this builder
         */
        Builder connectTimeout(Duration timeout);

        /**
         * Sets the capacity of the outbound queue.
         *
         * <p>Optional. Defaults to 100.</p>
         *
         * @param capacity maximum number of queued messages
         * @return this builder
         */
        Builder queueCapacity(int capacity);

        /**
         * Sets the clock used to timestamp queued messages.
         *
         * <p>Optional. Defaults to the system UTC clock.</p>
         *
         * @param clock the clock
         * @return this builder
         */
        Builder clock(Clock clock);

        /**
         * Sets the collaborator that receives transport errors.
         *
         * <p>Optional. Defaults to logging them.</p>
         *
         * @param reporter the error reporter
         * @return this builder
         */
        Builder errorReporter(ErrorReporter reporter);

        /**
         * Sets the handler for event handler exceptions.
         *
         * <p>Optional. Exceptions are always logged.</p>
         *
         * @param handler the error handler
         * @return this builder
         */
        Builder errorHandler(ErrorHandler handler);

        /**
         * Builds the client.
         *
         * @return the configured client, disconnected
         * @throws IllegalStateException if required parameters are missing
         */
        RealtimeClient build();
    }
}
