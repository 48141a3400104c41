package org.abstractica.tabletop.protocol;

import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Commands targeting a room.
 */
public sealed interface RoomCommand extends Command
{
    record JoinRoom() implements RoomCommand {}

    record LeaveRoom() implements RoomCommand {}

    record RoomSay(String text) implements RoomCommand
    {
        public RoomSay
        {
            Objects.requireNonNull(text, "text");
        }
    }

    record ListGames() implements RoomCommand {}

    /**
     * Opens a new game in the room and seats the caller.
     *
     * @param config table rules
     * @param deck   the creator's deck, validated before the game id is issued
     */
    record CreateGame(GameConfig config, Optional<DeckList> deck) implements RoomCommand
    {
        public CreateGame
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(deck, "deck");
        }
    }
}
