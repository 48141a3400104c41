package org.abstractica.tabletop.protocol;

import org.abstractica.tabletop.protocol.model.GameSnapshot;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.RoomSummary;
import org.abstractica.tabletop.protocol.model.UserView;

import java.util.List;
import java.util.Objects;

/**
 * Success payloads of command responses.
 */
public sealed interface Reply extends ServerMessage
{
    record Ack() implements Reply {}

    record Pong(long clientTime, long serverTime) implements Reply {}

    record RoomList(List<RoomSummary> rooms) implements Reply
    {
        public RoomList
        {
            rooms = List.copyOf(rooms);
        }
    }

    record GameList(List<GameSummary> games) implements Reply
    {
        public GameList
        {
            games = List.copyOf(games);
        }
    }

    /**
     * Sent on joining a room.
     *
     * @param room     the room
     * @param members  current members
     * @param sequence sequence of the room's last event
     */
    record RoomJoined(RoomSummary room, List<UserView> members, long sequence) implements Reply
    {
        public RoomJoined
        {
            Objects.requireNonNull(room, "room");
            members = List.copyOf(members);
        }
    }

    record RoomCreated(RoomSummary room) implements Reply
    {
        public RoomCreated
        {
            Objects.requireNonNull(room, "room");
        }
    }

    /**
     * Sent on creating or joining a game.
     *
     * @param gameId   the game
     * @param seat     assigned seat, or -1 for spectators
     * @param sequence sequence of the game's last event at join time
     */
    record JoinedGame(long gameId, int seat, long sequence) implements Reply {}

    record Snapshot(GameSnapshot snapshot) implements Reply
    {
        public Snapshot
        {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    /**
     * Events after a requested sequence.
     */
    record EventTail(long gameId, List<SequencedEvent> events) implements Reply
    {
        public EventTail
        {
            events = List.copyOf(events);
        }
    }

    /**
     * One page of a replay export.
     *
     * @param gameId       the game
     * @param events       events in order
     * @param lastSequence sequence of the last event in the log when the page was read
     * @param complete     whether this page reaches the end of the log
     */
    record ReplayChunk(long gameId, List<SequencedEvent> events, long lastSequence, boolean complete) implements Reply
    {
        public ReplayChunk
        {
            events = List.copyOf(events);
        }
    }
}
