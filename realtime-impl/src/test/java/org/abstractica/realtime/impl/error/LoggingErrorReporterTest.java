package org.abstractica.realtime.impl.error;

import org.abstractica.realtime.TransportError;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LoggingErrorReporter}.
 */
class LoggingErrorReporterTest
{
    private final LoggingErrorReporter reporter = new LoggingErrorReporter();

    @Test
    void report_acceptsEveryErrorKind()
    {
        Map<String, Object> context = Map.of("socketId", "abc", "connected", true);

        assertDoesNotThrow(() -> reporter.report(TransportError.from(new IOException("reset")), context));
        assertDoesNotThrow(() -> reporter.report(TransportError.from(Map.of("message", "denied")), context));
        assertDoesNotThrow(() -> reporter.report(TransportError.from("plain"), Map.of()));
    }
}
