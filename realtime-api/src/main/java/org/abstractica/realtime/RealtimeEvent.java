package org.abstractica.realtime;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Events delivered to realtime consumers.
 *
 * <p>All constants except {@link #CONNECTION_STATUS} are pushed by the server
 * and forwarded verbatim. {@code CONNECTION_STATUS} is produced locally by the
 * client whenever its connection state changes.</p>
 */
public enum RealtimeEvent
{
    CONNECTION_ESTABLISHED("connection:established"),

    CONTACT_CREATED("contact:created"),
    CONTACT_UPDATED("contact:updated"),
    CONTACT_DELETED("contact:deleted"),

    TASK_CREATED("task:created"),
    TASK_UPDATED("task:updated"),
    TASK_DELETED("task:deleted"),
    TASK_STATUS_CHANGED("task:status-changed"),

    MESSAGE_RECEIVED("message:received"),
    CONVERSATION_UPDATED("conversation:updated"),

    CALENDAR_EVENT_CREATED("calendar:event-created"),
    CALENDAR_EVENT_UPDATED("calendar:event-updated"),
    CALENDAR_EVENT_DELETED("calendar:event-deleted"),

    WORKFLOW_TRIGGERED("workflow:triggered"),
    WORKFLOW_COMPLETED("workflow:completed"),
    WORKFLOW_FAILED("workflow:failed"),

    PERSON_CREATED("person:created"),
    PERSON_UPDATED("person:updated"),
    PERSON_DELETED("person:deleted"),

    /**
     * Reserved for connection state changes; never received from the server.
     */
    CONNECTION_STATUS("connectionStatus");

    private static final Map<String, RealtimeEvent> BY_WIRE_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(RealtimeEvent::getWireName, Function.identity()));

    private final String wireName;

    RealtimeEvent(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the event name used on the wire.
     *
     * @return the wire name, e.g. {@code "task:updated"}
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Returns whether this event originates from the server.
     *
     * @return false only for {@link #CONNECTION_STATUS}
     */
    public boolean isServerEvent()
    {
        return this != CONNECTION_STATUS;
    }

    /**
     * Looks up a server event by its wire name.
     *
     * <p>The reserved status event is never returned, so a server cannot
     * spoof connection status changes.</p>
     *
     * @param wireName the name received from the server
     * @return the event, or empty if the name is unknown or reserved
     */
    public static Optional<RealtimeEvent> fromWireName(String wireName)
    {
        if (wireName == null)
        {
            return Optional.empty();
        }
        RealtimeEvent event = BY_WIRE_NAME.get(wireName);
        if (event == null || !event.isServerEvent())
        {
            return Optional.empty();
        }
        return Optional.of(event);
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
