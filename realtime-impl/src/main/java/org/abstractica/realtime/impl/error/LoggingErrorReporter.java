package org.abstractica.realtime.impl.error;

import org.abstractica.realtime.ErrorReporter;
import org.abstractica.realtime.TransportError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Error reporter that writes transport errors to the log.
 *
 * <p>Used when no error tracker is configured. Exceptions are logged with
 * their stack trace; other error shapes with their message and context.</p>
 */
public class LoggingErrorReporter implements ErrorReporter
{
    private static final Logger LOG = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(TransportError error, Map<String, Object> context)
    {
        if (error.kind() == TransportError.Kind.EXCEPTION)
        {
            LOG.error("Transport error: {} {}", error.message(), context, error.toThrowable());
        }
        else
        {
            LOG.error("Transport error ({}): {} {}", error.kind(), error.message(), context);
        }
    }
}
