package org.abstractica.tabletop.protocol;

import java.util.Objects;

/**
 * Commands available to administrators only.
 */
public sealed interface AdminCommand extends Command
{
    record CreateRoom(String name, String description) implements AdminCommand
    {
        public CreateRoom
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(description, "description");
        }
    }

    record DestroyRoom(long roomId) implements AdminCommand {}

    record PauseGame(long gameId) implements AdminCommand {}

    record ResumeGame(long gameId) implements AdminCommand {}

    record AbandonGame(long gameId, String reason) implements AdminCommand
    {
        public AbandonGame
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record BroadcastNotice(String text) implements AdminCommand
    {
        public BroadcastNotice
        {
            Objects.requireNonNull(text, "text");
        }
    }
}
