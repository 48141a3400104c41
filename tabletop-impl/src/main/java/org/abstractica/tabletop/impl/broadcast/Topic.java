package org.abstractica.tabletop.impl.broadcast;

import org.abstractica.tabletop.protocol.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Publish/subscribe channel for the events of one room or game.
 *
 * <p>Each event is encoded once and offered to every subscriber in
 * subscription order. Offers never block; a subscriber that cannot take the
 * frame is removed. Callers publish from a single thread (the owning game's
 * mailbox or under the room's lock), so subscribers see events in sequence
 * order.</p>
 */
public final class Topic
{
    private static final Logger LOG = LoggerFactory.getLogger(Topic.class);

    private final String name;
    private final Function<EventEnvelope, byte[]> encoder;
    private final Runnable onPublished;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * Creates a topic.
     *
     * @param name        topic name for logging, e.g. {@code game-42}
     * @param encoder     turns an envelope into frame bytes
     * @param onPublished called once per published event
     */
    public Topic(String name, Function<EventEnvelope, byte[]> encoder, Runnable onPublished)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.onPublished = Objects.requireNonNull(onPublished, "onPublished");
    }

    /**
     * Adds a subscriber. Subscribing twice with the same id is a no-op.
     *
     * @param subscriber the subscriber
     * @return true if newly subscribed
     */
    public boolean subscribe(Subscriber subscriber)
    {
        Objects.requireNonNull(subscriber, "subscriber");
        if (closed)
        {
            return false;
        }
        synchronized (subscribers)
        {
            for (Subscriber existing : subscribers)
            {
                if (existing.subscriberId().equals(subscriber.subscriberId()))
                {
                    return false;
                }
            }
            subscribers.add(subscriber);
        }
        LOG.debug("{}: subscribed {}", name, subscriber.subscriberId());
        return true;
    }

    /**
     * Removes a subscriber.
     *
     * @param subscriberId id of the subscriber
     * @return true if it was subscribed
     */
    public boolean unsubscribe(String subscriberId)
    {
        boolean removed = subscribers.removeIf(s -> s.subscriberId().equals(subscriberId));
        if (removed)
        {
            LOG.debug("{}: unsubscribed {}", name, subscriberId);
        }
        return removed;
    }

    public boolean isSubscribed(String subscriberId)
    {
        for (Subscriber s : subscribers)
        {
            if (s.subscriberId().equals(subscriberId))
            {
                return true;
            }
        }
        return false;
    }

    /**
     * Delivers an event to every current subscriber.
     *
     * @param envelope the event
     * @return number of subscribers that accepted the frame
     */
    public int publish(EventEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");
        if (closed)
        {
            return 0;
        }

        byte[] frame = encoder.apply(envelope);
        onPublished.run();

        int delivered = 0;
        for (Subscriber subscriber : subscribers)
        {
            if (subscriber.offer(frame))
            {
                delivered++;
            }
            else
            {
                LOG.debug("{}: dropping subscriber {} at sequence {}", name, subscriber.subscriberId(), envelope.sequence());
                subscribers.remove(subscriber);
            }
        }
        return delivered;
    }

    public Collection<Subscriber> getSubscribers()
    {
        return List.copyOf(subscribers);
    }

    public int size()
    {
        return subscribers.size();
    }

    /**
     * Drops every subscriber and rejects further publications.
     */
    public void close()
    {
        closed = true;
        subscribers.clear();
    }

    public String getName()
    {
        return name;
    }
}
