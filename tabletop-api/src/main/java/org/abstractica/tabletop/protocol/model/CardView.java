package org.abstractica.tabletop.protocol.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Visible state of one card instance.
 *
 * @param instanceId per-game instance id
 * @param cardId     opaque card identifier
 * @param ownerId    identity id of the owning player
 * @param tapped     whether the card is tapped
 * @param faceDown   whether the card is face down
 * @param token      whether the card was created during play
 * @param counters   counters on the card, sorted by name
 * @param attachedTo instance id of the card this one is attached to
 */
public record CardView(
        long instanceId,
        String cardId,
        long ownerId,
        boolean tapped,
        boolean faceDown,
        boolean token,
        List<CounterView> counters,
        Optional<Long> attachedTo
)
{
    public CardView
    {
        Objects.requireNonNull(cardId, "cardId");
        counters = List.copyOf(counters);
        Objects.requireNonNull(attachedTo, "attachedTo");
    }
}
