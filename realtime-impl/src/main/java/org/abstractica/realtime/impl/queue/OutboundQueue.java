package org.abstractica.realtime.impl.queue;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded FIFO buffer for messages emitted while disconnected.
 *
 * <p>When full, the oldest message is evicted to make room for the newest.
 * Not thread-safe; all access happens on the owning client's event loop.</p>
 */
public class OutboundQueue
{
    private static final Logger LOG = LoggerFactory.getLogger(OutboundQueue.class);

    /**
     * Default maximum number of queued messages.
     */
    public static final int DEFAULT_CAPACITY = 100;

    /**
     * Sends a single message during a flush.
     */
    @FunctionalInterface
    public interface Sender
    {
        /**
         * Hands a message to the transport.
         *
         * @param message the message to send
         * @return true if the transport accepted it, false if the connection is gone
         */
        boolean send(QueuedMessage message);
    }

    /**
     * Outcome of a flush.
     *
     * @param sent     messages handed to the transport
     * @param requeued messages put back because a send failed
     */
    public record FlushResult(int sent, int requeued) {}

    private final Deque<QueuedMessage> messages;
    private final int capacity;
    private final Clock clock;

    /**
     * Creates a queue with default capacity.
     *
     * @param clock clock used to timestamp messages
     */
    public OutboundQueue(Clock clock)
    {
        this(clock, DEFAULT_CAPACITY);
    }

    /**
     * Creates a queue with the specified capacity.
     *
     * @param clock    clock used to timestamp messages
     * @param capacity maximum number of queued messages
     */
    public OutboundQueue(Clock clock, int capacity)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (capacity <= 0)
        {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.messages = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a message, evicting the oldest one if the queue is full.
     *
     * @param eventName the client event name
     * @param payload   the event payload
     * @return the evicted message, or empty if nothing was evicted
     */
    public Optional<QueuedMessage> enqueue(String eventName, JsonNode payload)
    {
        QueuedMessage message = new QueuedMessage(eventName, payload, clock.instant());
        Optional<QueuedMessage> evicted = Optional.empty();

        if (messages.size() >= capacity)
        {
            evicted = Optional.of(messages.removeFirst());
            LOG.warn("Outbound queue full, dropping oldest message: {}", evicted.get().eventName());
        }

        messages.addLast(message);
        LOG.debug("Message queued: {} (queue size: {})", eventName, messages.size());
        return evicted;
    }

    /**
     * Sends every queued message in enqueue order.
     *
     * <p>The first failed send stops the flush. That message and all later ones
     * stay queued in their original order, with their original timestamps, for
     * the next flush.</p>
     *
     * @param sender hands each message to the transport
     * @return how many messages were sent and how many remain
     */
    public FlushResult flush(Sender sender)
    {
        Objects.requireNonNull(sender, "sender");
        if (messages.isEmpty())
        {
            return new FlushResult(0, 0);
        }

        LOG.debug("Flushing {} queued messages", messages.size());

        List<QueuedMessage> pending = new ArrayList<>(messages);
        messages.clear();

        int sent = 0;
        for (QueuedMessage message : pending)
        {
            if (!sender.send(message))
            {
                break;
            }
            sent++;
        }

        List<QueuedMessage> unsent = pending.subList(sent, pending.size());
        messages.addAll(unsent);

        if (!unsent.isEmpty())
        {
            LOG.info("Connection lost during flush, re-queued {} messages", unsent.size());
        }
        return new FlushResult(sent, unsent.size());
    }

    /**
     * Discards all queued messages.
     *
     * @return the number of discarded messages
     */
    public int clear()
    {
        int dropped = messages.size();
        messages.clear();
        return dropped;
    }

    /**
     * Returns the queued messages, oldest first.
     *
     * @return an immutable copy
     */
    public List<QueuedMessage> snapshot()
    {
        return List.copyOf(messages);
    }

    public int size()
    {
        return messages.size();
    }

    public boolean isEmpty()
    {
        return messages.isEmpty();
    }

    public int getCapacity()
    {
        return capacity;
    }
}
