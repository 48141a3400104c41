package org.abstractica.tabletop.impl.registry;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.broadcast.Member;
import org.abstractica.tabletop.impl.broadcast.Topic;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.RoomEvent;
import org.abstractica.tabletop.protocol.RoomEvent.GameListed;
import org.abstractica.tabletop.protocol.RoomEvent.GameUnlisted;
import org.abstractica.tabletop.protocol.RoomEvent.GameUpdated;
import org.abstractica.tabletop.protocol.RoomEvent.RoomChat;
import org.abstractica.tabletop.protocol.RoomEvent.UserJoinedRoom;
import org.abstractica.tabletop.protocol.RoomEvent.UserLeftRoom;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.RoomSummary;
import org.abstractica.tabletop.protocol.model.UserView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * A lobby where users meet, chat and list games.
 *
 * <p>Membership changes and events are serialized on the room's monitor, so
 * room events carry a gap-free sequence and each reply is queued before any
 * later event of the room.</p>
 */
public final class Room
{
    private final long roomId;
    private final String name;
    private final String description;
    private final boolean permanent;
    private final Topic topic;

    private final Map<Long, Member> members = new LinkedHashMap<>();
    private final Map<Long, GameSummary> games = new TreeMap<>();
    private long sequence;
    private long lastActivityNanos = System.nanoTime();
    private boolean closed;

    public Room(
            long roomId,
            String name,
            String description,
            boolean permanent,
            Function<EventEnvelope, byte[]> encoder,
            Runnable onPublished)
    {
        this.roomId = roomId;
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
        this.permanent = permanent;
        this.topic = new Topic("room-" + roomId, encoder, onPublished);
    }

    // ========== Membership ==========

    /**
     * Adds a member and answers the command with the room's current view.
     *
     * @param member  the joining member
     * @param context the JoinRoom command
     */
    public synchronized void join(Member member, CommandContext context)
    {
        requireOpen();
        Member existing = members.get(member.identityId());
        if (existing != null && existing.subscriberId().equals(member.subscriberId()))
        {
            throw new ValidationException(ErrorCode.ALREADY_MEMBER, "Already in room " + roomId);
        }
        if (existing != null)
        {
            // same user on a new connection
            topic.unsubscribe(existing.subscriberId());
            members.put(member.identityId(), member);
        }
        else
        {
            publish(new UserJoinedRoom(member.userView()));
            members.put(member.identityId(), member);
        }
        topic.subscribe(member);
        member.joined(OriginKind.ROOM, roomId);
        if (!member.isConnected())
        {
            // the connection ended while the command was in flight
            removeIfPresent(member);
            throw new ValidationException(ErrorCode.INVALID_STATE, "Connection closed");
        }
        context.reply(new Reply.RoomJoined(summaryLocked(), memberViews(), sequence));
    }

    /**
     * Removes a member.
     *
     * @param member the leaving member
     * @throws ValidationException if the member is not in the room
     */
    public synchronized void leave(Member member)
    {
        if (!removeIfPresent(member))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Not in room " + roomId);
        }
    }

    /**
     * Removes a member if that exact connection is still in the room.
     *
     * @param member the member
     * @return true if removed
     */
    public synchronized boolean removeIfPresent(Member member)
    {
        Member existing = members.get(member.identityId());
        if (existing == null || !existing.subscriberId().equals(member.subscriberId()))
        {
            return false;
        }
        members.remove(member.identityId());
        topic.unsubscribe(member.subscriberId());
        member.left(OriginKind.ROOM, roomId);
        publish(new UserLeftRoom(member.identityId()));
        return true;
    }

    public synchronized boolean isMember(long identityId)
    {
        return members.containsKey(identityId);
    }

    public synchronized List<UserView> memberViews()
    {
        List<UserView> views = new ArrayList<>(members.size());
        for (Member member : members.values())
        {
            views.add(member.userView());
        }
        return views;
    }

    // ========== Chat ==========

    public synchronized void say(Member member, String text)
    {
        if (!members.containsKey(member.identityId()))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Not in room " + roomId);
        }
        publish(new RoomChat(member.identityId(), member.displayName(), GameRules.checkText(text)));
    }

    // ========== Game listing ==========

    /**
     * Lists or updates a game of this room.
     *
     * @param summary the game's current summary
     */
    public synchronized void gameChanged(GameSummary summary)
    {
        if (closed)
        {
            return;
        }
        GameSummary previous = games.put(summary.gameId(), summary);
        if (previous == null)
        {
            publish(new GameListed(summary));
        }
        else if (!previous.equals(summary))
        {
            publish(new GameUpdated(summary));
        }
    }

    public synchronized void gameRemoved(long gameId)
    {
        if (games.remove(gameId) != null && !closed)
        {
            publish(new GameUnlisted(gameId));
        }
    }

    public synchronized List<GameSummary> listGames()
    {
        return new ArrayList<>(games.values());
    }

    // ========== Lifecycle ==========

    private void publish(RoomEvent event)
    {
        sequence++;
        lastActivityNanos = System.nanoTime();
        topic.publish(EventEnvelope.room(roomId, sequence, event));
    }

    private void requireOpen()
    {
        if (closed)
        {
            throw new ValidationException(ErrorCode.UNKNOWN_ROOM, "Room " + roomId + " no longer exists");
        }
    }

    /**
     * Returns whether the room can be removed for inactivity.
     *
     * @param nowNanos    current {@link System#nanoTime()}
     * @param idleTimeout how long an empty room is kept, in nanoseconds
     * @return true for an empty, non-permanent room idle for at least the timeout
     */
    public synchronized boolean isIdle(long nowNanos, long idleTimeout)
    {
        return !permanent && members.isEmpty() && games.isEmpty() && nowNanos - lastActivityNanos >= idleTimeout;
    }

    /**
     * Closes the room, detaching every member.
     */
    public synchronized void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        for (Member member : members.values())
        {
            member.left(OriginKind.ROOM, roomId);
        }
        members.clear();
        games.clear();
        topic.close();
    }

    public synchronized RoomSummary summary()
    {
        return summaryLocked();
    }

    private RoomSummary summaryLocked()
    {
        return new RoomSummary(roomId, name, description, members.size(), games.size(), permanent);
    }

    public long getRoomId()
    {
        return roomId;
    }

    public String getName()
    {
        return name;
    }

    public boolean isPermanent()
    {
        return permanent;
    }

    public synchronized long getSequence()
    {
        return sequence;
    }

    @Override
    public String toString()
    {
        return "Room[" + roomId + " " + name + "]";
    }
}
