package org.abstractica.tabletop.protocol.model;

import java.util.List;

/**
 * Cards dealt to one player when a game starts.
 *
 * @param playerId  identity id
 * @param library   shuffled library, index 0 is the top
 * @param sideboard sideboard cards
 */
public record PlayerSetup(long playerId, List<CardSeed> library, List<CardSeed> sideboard)
{
    public PlayerSetup
    {
        library = List.copyOf(library);
        sideboard = List.copyOf(sideboard);
    }
}
