package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * A card instance as dealt at game start.
 *
 * @param instanceId per-game instance id
 * @param cardId     opaque card identifier
 */
public record CardSeed(long instanceId, String cardId)
{
    public CardSeed
    {
        Objects.requireNonNull(cardId, "cardId");
    }
}
