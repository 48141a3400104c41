package org.abstractica.tabletop.protocol;

import java.util.Objects;

/**
 * A state-change notification with its per-origin sequence number.
 *
 * @param originKind room or game
 * @param originId   id of the emitting room or game
 * @param sequence   per-origin sequence, starting at 1, gap-free
 * @param payload    the event
 */
public record EventEnvelope(OriginKind originKind, long originId, long sequence, Event payload)
{
    public EventEnvelope
    {
        Objects.requireNonNull(originKind, "originKind");
        Objects.requireNonNull(payload, "payload");
        if (sequence < 1)
        {
            throw new IllegalArgumentException("Sequence must be >= 1: " + sequence);
        }
    }

    public static EventEnvelope game(long gameId, long sequence, GameEvent event)
    {
        return new EventEnvelope(OriginKind.GAME, gameId, sequence, event);
    }

    public static EventEnvelope room(long roomId, long sequence, RoomEvent event)
    {
        return new EventEnvelope(OriginKind.ROOM, roomId, sequence, event);
    }
}
