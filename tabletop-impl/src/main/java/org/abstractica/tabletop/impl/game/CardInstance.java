package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.protocol.model.CardView;
import org.abstractica.tabletop.protocol.model.CounterView;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One physical card on the table. Mutable; owned by a {@link GameState}.
 */
final class CardInstance
{
    private final long instanceId;
    private final String cardId;
    private final long ownerId;
    private final boolean token;
    private boolean tapped;
    private boolean faceDown;
    private final TreeMap<String, Integer> counters = new TreeMap<>();
    private Long attachedTo;

    CardInstance(long instanceId, String cardId, long ownerId, boolean token)
    {
        this.instanceId = instanceId;
        this.cardId = Objects.requireNonNull(cardId, "cardId");
        this.ownerId = ownerId;
        this.token = token;
    }

    CardInstance copy()
    {
        CardInstance copy = new CardInstance(instanceId, cardId, ownerId, token);
        copy.tapped = tapped;
        copy.faceDown = faceDown;
        copy.counters.putAll(counters);
        copy.attachedTo = attachedTo;
        return copy;
    }

    long getInstanceId()
    {
        return instanceId;
    }

    String getCardId()
    {
        return cardId;
    }

    long getOwnerId()
    {
        return ownerId;
    }

    boolean isToken()
    {
        return token;
    }

    boolean isTapped()
    {
        return tapped;
    }

    void setTapped(boolean tapped)
    {
        this.tapped = tapped;
    }

    boolean isFaceDown()
    {
        return faceDown;
    }

    void setFaceDown(boolean faceDown)
    {
        this.faceDown = faceDown;
    }

    int getCounter(String name)
    {
        return counters.getOrDefault(name, 0);
    }

    void setCounter(String name, int value)
    {
        if (value <= 0)
        {
            counters.remove(name);
        }
        else
        {
            counters.put(name, value);
        }
    }

    Optional<Long> getAttachedTo()
    {
        return Optional.ofNullable(attachedTo);
    }

    void setAttachedTo(Long attachedTo)
    {
        this.attachedTo = attachedTo;
    }

    /**
     * Clears the state a card only has while on the battlefield.
     */
    void resetTableState()
    {
        tapped = false;
        counters.clear();
        attachedTo = null;
    }

    CardView view()
    {
        List<CounterView> counterViews = new ArrayList<>(counters.size());
        for (Map.Entry<String, Integer> entry : counters.entrySet())
        {
            counterViews.add(new CounterView(entry.getKey(), entry.getValue()));
        }
        return new CardView(instanceId, cardId, ownerId, tapped, faceDown, token, counterViews, getAttachedTo());
    }
}
