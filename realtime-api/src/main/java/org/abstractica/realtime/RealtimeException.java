package org.abstractica.realtime;

/**
 * Error raised inside the realtime client.
 *
 * <p>Never thrown to callers of the client's public operations; used to give
 * non-exception transport errors a throwable form for reporting.</p>
 */
public class RealtimeException extends RuntimeException
{
    public RealtimeException(String message)
    {
        super(message);
    }

    public RealtimeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
