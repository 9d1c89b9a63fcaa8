package org.abstractica.realtime.impl.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.realtime.RealtimeEvent;
import org.abstractica.realtime.Subscription;
import org.abstractica.realtime.handlers.ErrorHandler;
import org.abstractica.realtime.handlers.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes realtime events to registered handlers.
 *
 * <p>For server events, the dispatcher tells its {@link ListenerHooks} when the
 * first handler for an event is added and when the last one is removed, so the
 * owner keeps exactly one transport listener per event that has handlers.</p>
 *
 * <p>Not thread-safe; all access happens on the owning client's event loop.</p>
 */
public class EventDispatcher
{
    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    /**
     * Notified when a server event gains its first handler or loses its last one.
     */
    public interface ListenerHooks
    {
        void listenerAdded(RealtimeEvent event);

        void listenerRemoved(RealtimeEvent event);
    }

    private static final ListenerHooks NO_HOOKS = new ListenerHooks()
    {
        @Override
        public void listenerAdded(RealtimeEvent event)
        {
        }

        @Override
        public void listenerRemoved(RealtimeEvent event)
        {
        }
    };

    private final Map<RealtimeEvent, Set<EventHandler>> handlers;
    private ListenerHooks hooks;
    private ErrorHandler errorHandler;

    public EventDispatcher()
    {
        this.handlers = new EnumMap<>(RealtimeEvent.class);
        this.hooks = NO_HOOKS;
    }

    public void setListenerHooks(ListenerHooks hooks)
    {
        this.hooks = hooks != null ? hooks : NO_HOOKS;
    }

    public void setErrorHandler(ErrorHandler errorHandler)
    {
        this.errorHandler = errorHandler;
    }

    /**
     * Registers a handler.
     *
     * @param event   the event to handle
     * @param handler the handler
     * @return a subscription removing exactly this handler from this event
     */
    public Subscription on(RealtimeEvent event, EventHandler handler)
    {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");

        Set<EventHandler> set = handlers.get(event);
        if (set == null)
        {
            set = new LinkedHashSet<>();
            handlers.put(event, set);
            if (event.isServerEvent())
            {
                hooks.listenerAdded(event);
            }
        }
        set.add(handler);

        return () -> off(event, handler);
    }

    /**
     * Removes a handler.
     *
     * @param event   the event the handler was registered for
     * @param handler the handler instance
     * @return true if the handler was registered
     */
    public boolean off(RealtimeEvent event, EventHandler handler)
    {
        Set<EventHandler> set = handlers.get(event);
        if (set == null || !set.remove(handler))
        {
            return false;
        }

        if (set.isEmpty())
        {
            handlers.remove(event);
            if (event.isServerEvent())
            {
                hooks.listenerRemoved(event);
            }
        }
        return true;
    }

    /**
     * Invokes every handler registered for an event.
     *
     * <p>Handlers run in turn on the calling thread, over a snapshot of the
     * registrations, so handlers may subscribe or unsubscribe while being
     * dispatched to. An exception from one handler is logged and passed to the
     * error handler; the rest still run.</p>
     *
     * @param event   the event that occurred
     * @param payload the event payload
     * @return the number of handlers invoked
     */
    public int dispatch(RealtimeEvent event, JsonNode payload)
    {
        Set<EventHandler> set = handlers.get(event);
        if (set == null)
        {
            LOG.debug("No handler for event: {}", event);
            return 0;
        }

        List<EventHandler> snapshot = new ArrayList<>(set);
        for (EventHandler handler : snapshot)
        {
            try
            {
                handler.handle(payload);
            }
            catch (Exception e)
            {
                LOG.error("Error in handler for {}", event, e);
                notifyErrorHandler(event, payload, e);
            }
        }
        return snapshot.size();
    }

    /**
     * Returns the server events that currently have at least one handler.
     *
     * @return an immutable set
     */
    public Set<RealtimeEvent> getServerEvents()
    {
        Set<RealtimeEvent> events = EnumSet.noneOf(RealtimeEvent.class);
        for (RealtimeEvent event : handlers.keySet())
        {
            if (event.isServerEvent())
            {
                events.add(event);
            }
        }
        return Collections.unmodifiableSet(events);
    }

    public int getHandlerCount(RealtimeEvent event)
    {
        Set<EventHandler> set = handlers.get(event);
        return set == null ? 0 : set.size();
    }

    /**
     * Removes every handler without notifying the hooks.
     */
    public void clear()
    {
        handlers.clear();
    }

    private void notifyErrorHandler(RealtimeEvent event, JsonNode payload, Exception exception)
    {
        if (errorHandler == null)
        {
            return;
        }
        try
        {
            errorHandler.handle(event, payload, exception);
        }
        catch (Exception e)
        {
            LOG.error("Error handler failed", e);
        }
    }
}
