package org.abstractica.realtime.impl.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.abstractica.realtime.RealtimeEvent;
import org.abstractica.realtime.Subscription;
import org.abstractica.realtime.handlers.EventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EventDispatcher}.
 */
class EventDispatcherTest
{
    private EventDispatcher dispatcher;
    private List<String> hookCalls;

    @BeforeEach
    void setUp()
    {
        dispatcher = new EventDispatcher();
        hookCalls = new ArrayList<>();
        dispatcher.setListenerHooks(new EventDispatcher.ListenerHooks()
        {
            @Override
            public void listenerAdded(RealtimeEvent event)
            {
                hookCalls.add("+" + event.getWireName());
            }

            @Override
            public void listenerRemoved(RealtimeEvent event)
            {
                hookCalls.add("-" + event.getWireName());
            }
        });
    }

    private static JsonNode payload()
    {
        return JsonNodeFactory.instance.objectNode().put("id", "t1");
    }

    @Test
    void dispatch_invokesHandlersInRegistrationOrder()
    {
        List<String> calls = new ArrayList<>();
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p -> calls.add("first"));
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p -> calls.add("second"));

        int invoked = dispatcher.dispatch(RealtimeEvent.TASK_UPDATED, payload());

        assertEquals(2, invoked);
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void dispatch_withoutHandlers_returnsZero()
    {
        assertEquals(0, dispatcher.dispatch(RealtimeEvent.CONTACT_CREATED, payload()));
    }

    @Test
    void dispatch_failingHandlerDoesNotStopOthers()
    {
        List<String> calls = new ArrayList<>();
        List<Exception> reported = new ArrayList<>();
        dispatcher.setErrorHandler((event, p, e) -> reported.add(e));
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p ->
        {
            throw new IllegalStateException("boom");
        });
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p -> calls.add("survivor"));

        dispatcher.dispatch(RealtimeEvent.TASK_UPDATED, payload());

        assertEquals(List.of("survivor"), calls);
        assertEquals(1, reported.size());
        assertEquals("boom", reported.get(0).getMessage());
    }

    @Test
    void dispatch_failingErrorHandlerIsContained()
    {
        List<String> calls = new ArrayList<>();
        dispatcher.setErrorHandler((event, p, e) ->
        {
            throw new IllegalStateException("handler of handler");
        });
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p ->
        {
            throw new IllegalStateException("boom");
        });
        dispatcher.on(RealtimeEvent.TASK_UPDATED, p -> calls.add("survivor"));

        assertDoesNotThrow(() -> dispatcher.dispatch(RealtimeEvent.TASK_UPDATED, payload()));
        assertEquals(List.of("survivor"), calls);
    }

    @Test
    void on_firstHandlerInstallsListener_lastRemovalUninstalls()
    {
        EventHandler a = p -> {};
        EventHandler b = p -> {};

        dispatcher.on(RealtimeEvent.TASK_CREATED, a);
        dispatcher.on(RealtimeEvent.TASK_CREATED, b);
        dispatcher.off(RealtimeEvent.TASK_CREATED, a);
        dispatcher.off(RealtimeEvent.TASK_CREATED, b);

        assertEquals(List.of("+task:created", "-task:created"), hookCalls);
    }

    @Test
    void on_statusHandlers_doNotTouchListeners()
    {
        dispatcher.on(RealtimeEvent.CONNECTION_STATUS, p -> {});

        assertTrue(hookCalls.isEmpty());
        assertTrue(dispatcher.getServerEvents().isEmpty());
    }

    @Test
    void subscription_removesOnlyItsHandler()
    {
        List<String> calls = new ArrayList<>();
        Subscription first = dispatcher.on(RealtimeEvent.MESSAGE_RECEIVED, p -> calls.add("first"));
        dispatcher.on(RealtimeEvent.MESSAGE_RECEIVED, p -> calls.add("second"));

        first.unsubscribe();
        dispatcher.dispatch(RealtimeEvent.MESSAGE_RECEIVED, payload());

        assertEquals(List.of("second"), calls);
        assertEquals(1, dispatcher.getHandlerCount(RealtimeEvent.MESSAGE_RECEIVED));
    }

    @Test
    void off_unknownHandler_returnsFalse()
    {
        dispatcher.on(RealtimeEvent.MESSAGE_RECEIVED, p -> {});

        assertFalse(dispatcher.off(RealtimeEvent.MESSAGE_RECEIVED, p -> {}));
        assertFalse(dispatcher.off(RealtimeEvent.PERSON_CREATED, p -> {}));
    }

    @Test
    void handlerMayUnsubscribeDuringDispatch()
    {
        List<String> calls = new ArrayList<>();
        Subscription[] self = new Subscription[1];
        self[0] = dispatcher.on(RealtimeEvent.WORKFLOW_COMPLETED, p ->
        {
            calls.add("once");
            self[0].unsubscribe();
        });

        dispatcher.dispatch(RealtimeEvent.WORKFLOW_COMPLETED, payload());
        dispatcher.dispatch(RealtimeEvent.WORKFLOW_COMPLETED, payload());

        assertEquals(List.of("once"), calls);
    }

    @Test
    void getServerEvents_listsRegisteredEvents()
    {
        dispatcher.on(RealtimeEvent.TASK_CREATED, p -> {});
        dispatcher.on(RealtimeEvent.PERSON_DELETED, p -> {});

        assertEquals(Set.of(RealtimeEvent.TASK_CREATED, RealtimeEvent.PERSON_DELETED),
                dispatcher.getServerEvents());
    }
}
