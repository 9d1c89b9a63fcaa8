package org.abstractica.realtime;

/**
 * State of a realtime connection.
 *
 * <p>{@link #CONNECTING} and {@link #RECONNECTING} are transient; every attempt
 * ends in {@link #CONNECTED} or, once the attempt budget is spent, {@link #FAILED}.</p>
 */
public enum ConnectionState
{
    /**
     * No connection and no attempt in progress.
     */
    DISCONNECTED("disconnected"),

    /**
     * First connection attempt in progress.
     */
    CONNECTING("connecting"),

    /**
     * Connection is open; outbound messages are sent directly.
     */
    CONNECTED("connected"),

    /**
     * Connection was lost or an attempt failed; a retry is pending.
     */
    RECONNECTING("reconnecting"),

    /**
     * Attempt budget exhausted. Only a manual connect leaves this state.
     */
    FAILED("failed");

    private final String label;

    ConnectionState(String label)
    {
        this.label = label;
    }

    /**
     * Returns the lowercase label used in status payloads.
     *
     * @return the label
     */
    public String getLabel()
    {
        return label;
    }

    /**
     * Parses a status label.
     *
     * @param label the lowercase label
     * @return the matching state
     * @throws IllegalArgumentException if the label is unknown
     */
    public static ConnectionState fromLabel(String label)
    {
        for (ConnectionState state : values())
        {
            if (state.label.equals(label))
            {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown connection state: " + label);
    }
}
