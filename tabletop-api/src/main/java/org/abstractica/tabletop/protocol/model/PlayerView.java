package org.abstractica.tabletop.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * Seated player as seen in a snapshot.
 *
 * @param playerId     identity id
 * @param name         display name
 * @param seat         seat index, 0-based
 * @param deckSelected whether a deck has been submitted
 * @param ready        whether the player confirmed readiness
 * @param conceded     whether the player conceded
 * @param connected    whether the player's connection is live
 * @param counters     player counters (life and any custom ones), sorted by name
 */
public record PlayerView(
        long playerId,
        String name,
        int seat,
        boolean deckSelected,
        boolean ready,
        boolean conceded,
        boolean connected,
        List<CounterView> counters
)
{
    public PlayerView
    {
        Objects.requireNonNull(name, "name");
        counters = List.copyOf(counters);
    }
}
