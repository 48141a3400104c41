package org.abstractica.tabletop.protocol;

import java.util.Objects;

/**
 * A game event paired with its sequence number, as carried in resync and replay replies.
 *
 * @param sequence the event's sequence number
 * @param event    the event
 */
public record SequencedEvent(long sequence, GameEvent event)
{
    public SequencedEvent
    {
        Objects.requireNonNull(event, "event");
    }
}
