package org.abstractica.tabletop.impl.broadcast;

import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.model.UserView;

/**
 * A subscriber acting for an authenticated user in rooms and games.
 *
 * <p>Rooms and games report membership changes back so the member can keep
 * track of where it has to be removed from when its connection ends.</p>
 */
public interface Member extends Subscriber
{
    long identityId();

    String displayName();

    default UserView userView()
    {
        return new UserView(identityId(), displayName());
    }

    /**
     * Returns whether the member's connection is still open.
     *
     * @return false once the connection has ended
     */
    boolean isConnected();

    /**
     * Called after the member joined a room or game.
     *
     * @param kind ROOM or GAME
     * @param id   the room or game id
     */
    void joined(OriginKind kind, long id);

    /**
     * Called after the member left, or was removed from, a room or game.
     *
     * @param kind ROOM or GAME
     * @param id   the room or game id
     */
    void left(OriginKind kind, long id);
}
