package org.abstractica.tabletop.protocol.model;

import java.util.List;

/**
 * A deck submitted by a player: opaque card ids for the main deck and sideboard.
 *
 * @param main      main deck card ids
 * @param sideboard sideboard card ids
 */
public record DeckList(List<String> main, List<String> sideboard)
{
    public DeckList
    {
        main = List.copyOf(main);
        sideboard = List.copyOf(sideboard);
    }

    public static DeckList of(List<String> main)
    {
        return new DeckList(main, List.of());
    }
}
