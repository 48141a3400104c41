package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.protocol.model.CounterView;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.PlayerView;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A seated player. Mutable; owned by a {@link GameState}.
 */
final class PlayerState
{
    private final long playerId;
    private final String name;
    private final int seat;
    private DeckList deck;
    private boolean ready;
    private boolean conceded;
    private boolean connected = true;
    private boolean left;
    private final TreeMap<String, Integer> counters = new TreeMap<>();

    PlayerState(long playerId, String name, int seat)
    {
        this.playerId = playerId;
        this.name = Objects.requireNonNull(name, "name");
        this.seat = seat;
    }

    PlayerState copy()
    {
        PlayerState copy = new PlayerState(playerId, name, seat);
        copy.deck = deck;
        copy.ready = ready;
        copy.conceded = conceded;
        copy.connected = connected;
        copy.left = left;
        copy.counters.putAll(counters);
        return copy;
    }

    long getPlayerId()
    {
        return playerId;
    }

    String getName()
    {
        return name;
    }

    int getSeat()
    {
        return seat;
    }

    Optional<DeckList> getDeck()
    {
        return Optional.ofNullable(deck);
    }

    void setDeck(DeckList deck)
    {
        this.deck = deck;
    }

    boolean isReady()
    {
        return ready;
    }

    void setReady(boolean ready)
    {
        this.ready = ready;
    }

    boolean isConceded()
    {
        return conceded;
    }

    void setConceded(boolean conceded)
    {
        this.conceded = conceded;
    }

    boolean isConnected()
    {
        return connected;
    }

    void setConnected(boolean connected)
    {
        this.connected = connected;
    }

    boolean hasLeft()
    {
        return left;
    }

    void setLeft(boolean left)
    {
        this.left = left;
    }

    /**
     * Returns whether the player still takes part in play.
     *
     * @return true unless the player conceded or left
     */
    boolean isActive()
    {
        return !conceded && !left;
    }

    Optional<Integer> getCounter(String counter)
    {
        return Optional.ofNullable(counters.get(counter));
    }

    void setCounter(String counter, int value)
    {
        counters.put(counter, value);
    }

    PlayerView view()
    {
        List<CounterView> counterViews = new ArrayList<>(counters.size());
        for (Map.Entry<String, Integer> entry : counters.entrySet())
        {
            counterViews.add(new CounterView(entry.getKey(), entry.getValue()));
        }
        return new PlayerView(playerId, name, seat, deck != null, ready, conceded, connected && !left, counterViews);
    }
}
