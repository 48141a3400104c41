package org.abstractica.tabletop.protocol;

import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.UserView;

import java.util.Objects;

/**
 * Events emitted by a room.
 */
public sealed interface RoomEvent extends Event
{
    record UserJoinedRoom(UserView user) implements RoomEvent
    {
        public UserJoinedRoom
        {
            Objects.requireNonNull(user, "user");
        }
    }

    record UserLeftRoom(long identityId) implements RoomEvent {}

    record RoomChat(long identityId, String name, String text) implements RoomEvent
    {
        public RoomChat
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(text, "text");
        }
    }

    record GameListed(GameSummary game) implements RoomEvent
    {
        public GameListed
        {
            Objects.requireNonNull(game, "game");
        }
    }

    record GameUpdated(GameSummary game) implements RoomEvent
    {
        public GameUpdated
        {
            Objects.requireNonNull(game, "game");
        }
    }

    record GameUnlisted(long gameId) implements RoomEvent {}
}
