package org.abstractica.tabletop.protocol;

import org.abstractica.tabletop.protocol.model.CardAttribute;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.LeaveReason;
import org.abstractica.tabletop.protocol.model.Phase;
import org.abstractica.tabletop.protocol.model.PlayerSetup;
import org.abstractica.tabletop.protocol.model.ZoneRef;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Events emitted by a game.
 *
 * <p>Each event describes one change. Folding a game's events in sequence
 * order from the first one reproduces its state exactly.</p>
 */
public sealed interface GameEvent extends Event
{
    // ========== Lifecycle ==========

    /** Always the first event of a game. */
    record GameCreated(long gameId, long roomId, GameConfig config, long creatorId) implements GameEvent
    {
        public GameCreated
        {
            Objects.requireNonNull(config, "config");
        }
    }

    /**
     * Deals every player's cards and opens turn 1.
     *
     * @param firstPlayer player taking the first turn
     * @param players     dealt cards per player, in seat order
     */
    record GameStarted(long firstPlayer, List<PlayerSetup> players) implements GameEvent
    {
        public GameStarted
        {
            players = List.copyOf(players);
        }
    }

    record GameStatusChanged(GameStatus status, String reason, Optional<Long> winner) implements GameEvent
    {
        public GameStatusChanged
        {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(winner, "winner");
        }
    }

    // ========== Membership ==========

    record PlayerJoined(long playerId, String name, int seat, boolean spectator) implements GameEvent
    {
        public PlayerJoined
        {
            Objects.requireNonNull(name, "name");
        }
    }

    record PlayerLeft(long playerId, LeaveReason reason) implements GameEvent
    {
        public PlayerLeft
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record PlayerDisconnected(long playerId) implements GameEvent {}

    record PlayerReconnected(long playerId) implements GameEvent {}

    record DeckSelected(long playerId, DeckList deck) implements GameEvent
    {
        public DeckSelected
        {
            Objects.requireNonNull(deck, "deck");
        }
    }

    record ReadyChanged(long playerId, boolean ready) implements GameEvent {}

    // ========== Cards ==========

    record CardMoved(
            long playerId,
            ZoneRef from,
            int fromIndex,
            ZoneRef to,
            int toIndex,
            long instanceId,
            boolean faceDown
    ) implements GameEvent
    {
        public CardMoved
        {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /**
     * A zone was shuffled.
     *
     * @param zone  the zone
     * @param order instance ids in their new order
     */
    record ZoneShuffled(ZoneRef zone, List<Long> order) implements GameEvent
    {
        public ZoneShuffled
        {
            Objects.requireNonNull(zone, "zone");
            order = List.copyOf(order);
        }
    }

    record CardsRevealed(
            long playerId,
            ZoneRef zone,
            List<Integer> indices,
            List<String> cardIds,
            Optional<Long> toPlayer
    ) implements GameEvent
    {
        public CardsRevealed
        {
            Objects.requireNonNull(zone, "zone");
            indices = List.copyOf(indices);
            cardIds = List.copyOf(cardIds);
            Objects.requireNonNull(toPlayer, "toPlayer");
        }
    }

    record CounterChanged(ZoneRef zone, int index, long instanceId, String counter, int value) implements GameEvent
    {
        public CounterChanged
        {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(counter, "counter");
        }
    }

    record CardAttributeChanged(
            ZoneRef zone,
            int index,
            long instanceId,
            CardAttribute attribute,
            boolean value
    ) implements GameEvent
    {
        public CardAttributeChanged
        {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(attribute, "attribute");
        }
    }

    record CardAttached(long instanceId, Optional<Long> target) implements GameEvent
    {
        public CardAttached
        {
            Objects.requireNonNull(target, "target");
        }
    }

    record CardCreated(long instanceId, String cardId, long ownerId, ZoneRef zone) implements GameEvent
    {
        public CardCreated
        {
            Objects.requireNonNull(cardId, "cardId");
            Objects.requireNonNull(zone, "zone");
        }
    }

    record CardDestroyed(ZoneRef zone, int index, long instanceId) implements GameEvent
    {
        public CardDestroyed
        {
            Objects.requireNonNull(zone, "zone");
        }
    }

    // ========== Turn and table ==========

    record PlayerCounterChanged(long playerId, String counter, int value) implements GameEvent
    {
        public PlayerCounterChanged
        {
            Objects.requireNonNull(counter, "counter");
        }
    }

    record PhaseChanged(Phase phase) implements GameEvent
    {
        public PhaseChanged
        {
            Objects.requireNonNull(phase, "phase");
        }
    }

    record TurnPassed(int turn, long activePlayer) implements GameEvent {}

    record PlayerConceded(long playerId) implements GameEvent {}

    record GameChat(long playerId, String text) implements GameEvent
    {
        public GameChat
        {
            Objects.requireNonNull(text, "text");
        }
    }
}
