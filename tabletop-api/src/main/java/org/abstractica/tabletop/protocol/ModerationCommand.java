package org.abstractica.tabletop.protocol;

import java.util.Objects;

/**
 * Commands available to moderators and administrators.
 */
public sealed interface ModerationCommand extends Command
{
    /** Disconnects a user from the server. */
    record KickUser(long identityId, String reason) implements ModerationCommand
    {
        public KickUser
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** Removes a user from a game; the target id selects the game. */
    record KickFromGame(long gameId, long identityId) implements ModerationCommand {}
}
