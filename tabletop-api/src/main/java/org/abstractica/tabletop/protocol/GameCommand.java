package org.abstractica.tabletop.protocol;

import org.abstractica.tabletop.protocol.model.CardAttribute;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.ZoneRef;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Commands targeting a game.
 *
 * <p>Card positions are addressed by zone and index. Index 0 of a library is
 * its top card. A destination index of -1 appends to the end of the zone.</p>
 */
public sealed interface GameCommand extends Command
{
    int END_OF_ZONE = -1;

    // ========== Membership ==========

    record JoinGame(boolean spectator) implements GameCommand {}

    record LeaveGame() implements GameCommand {}

    record SelectDeck(DeckList deck) implements GameCommand
    {
        public SelectDeck
        {
            Objects.requireNonNull(deck, "deck");
        }
    }

    record SetReady(boolean ready) implements GameCommand {}

    // ========== Cards ==========

    record MoveCard(ZoneRef from, int index, ZoneRef to, int toIndex, boolean faceDown) implements GameCommand
    {
        public MoveCard
        {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    record DrawCards(int count) implements GameCommand {}

    record Shuffle(ZoneRef zone) implements GameCommand
    {
        public Shuffle
        {
            Objects.requireNonNull(zone, "zone");
        }
    }

    /**
     * Reveals cards to everyone, or to one player.
     */
    record RevealCards(ZoneRef zone, List<Integer> indices, Optional<Long> toPlayer) implements GameCommand
    {
        public RevealCards
        {
            Objects.requireNonNull(zone, "zone");
            indices = List.copyOf(indices);
            Objects.requireNonNull(toPlayer, "toPlayer");
        }
    }

    record ModifyCounter(ZoneRef zone, int index, String counter, int delta) implements GameCommand
    {
        public ModifyCounter
        {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(counter, "counter");
        }
    }

    record SetCardAttribute(ZoneRef zone, int index, CardAttribute attribute, boolean value) implements GameCommand
    {
        public SetCardAttribute
        {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(attribute, "attribute");
        }
    }

    /**
     * Attaches a card to another card instance, or detaches it when target is empty.
     */
    record AttachCard(ZoneRef zone, int index, Optional<Long> target) implements GameCommand
    {
        public AttachCard
        {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(target, "target");
        }
    }

    record CreateToken(String cardId, ZoneRef zone) implements GameCommand
    {
        public CreateToken
        {
            Objects.requireNonNull(cardId, "cardId");
            Objects.requireNonNull(zone, "zone");
        }
    }

    /** Removes a card from the game entirely. */
    record DestroyCard(ZoneRef zone, int index) implements GameCommand
    {
        public DestroyCard
        {
            Objects.requireNonNull(zone, "zone");
        }
    }

    // ========== Turn and table ==========

    record SetPlayerCounter(String counter, int value) implements GameCommand
    {
        public SetPlayerCounter
        {
            Objects.requireNonNull(counter, "counter");
        }
    }

    record AdvancePhase() implements GameCommand {}

    record PassTurn() implements GameCommand {}

    record Concede() implements GameCommand {}

    record GameSay(String text) implements GameCommand
    {
        public GameSay
        {
            Objects.requireNonNull(text, "text");
        }
    }

    // ========== Resync and replay ==========

    /**
     * Subscribes the caller and returns a snapshot, or the events after fromSequence.
     */
    record Resync(Optional<Long> fromSequence) implements GameCommand
    {
        public Resync
        {
            Objects.requireNonNull(fromSequence, "fromSequence");
        }
    }

    /**
     * Reads one page of the game's recorded event log.
     */
    record ExportReplay(long afterSequence, int maxEvents) implements GameCommand {}
}
