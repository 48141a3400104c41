package org.abstractica.tabletop.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * Contents of one zone, in order.
 *
 * @param zone  the zone
 * @param cards cards from index 0 upward
 */
public record ZoneView(ZoneRef zone, List<CardView> cards)
{
    public ZoneView
    {
        Objects.requireNonNull(zone, "zone");
        cards = List.copyOf(cards);
    }
}
