package org.abstractica.tabletop.protocol;

/**
 * Commands scoped to the caller's own session.
 */
public sealed interface SessionCommand extends Command
{
    record Ping(long clientTime) implements SessionCommand {}

    record ListRooms() implements SessionCommand {}

    /** Lists the games the caller is seated in or watching. */
    record ListMyGames() implements SessionCommand {}
}
