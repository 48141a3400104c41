package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.protocol.model.CardView;
import org.abstractica.tabletop.protocol.model.ZoneRef;
import org.abstractica.tabletop.protocol.model.ZoneView;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered card container. Index 0 is the top.
 */
final class Zone
{
    private final ZoneRef ref;
    private final List<CardInstance> cards = new ArrayList<>();

    Zone(ZoneRef ref)
    {
        this.ref = Objects.requireNonNull(ref, "ref");
    }

    Zone copy()
    {
        Zone copy = new Zone(ref);
        for (CardInstance card : cards)
        {
            copy.cards.add(card.copy());
        }
        return copy;
    }

    ZoneRef getRef()
    {
        return ref;
    }

    int size()
    {
        return cards.size();
    }

    boolean isValidIndex(int index)
    {
        return index >= 0 && index < cards.size();
    }

    CardInstance get(int index)
    {
        return cards.get(index);
    }

    CardInstance remove(int index)
    {
        return cards.remove(index);
    }

    void insert(int index, CardInstance card)
    {
        cards.add(index, card);
    }

    void add(CardInstance card)
    {
        cards.add(card);
    }

    List<CardInstance> cards()
    {
        return cards;
    }

    List<Long> instanceIds()
    {
        List<Long> ids = new ArrayList<>(cards.size());
        for (CardInstance card : cards)
        {
            ids.add(card.getInstanceId());
        }
        return ids;
    }

    ZoneView view()
    {
        List<CardView> views = new ArrayList<>(cards.size());
        for (CardInstance card : cards)
        {
            views.add(card.view());
        }
        return new ZoneView(ref, views);
    }
}
