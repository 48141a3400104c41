package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * Lobby listing entry for a game.
 *
 * @param gameId     game id
 * @param roomId     room the game belongs to
 * @param name       display name
 * @param status     current status
 * @param players    seated players
 * @param maxPlayers seats at the table
 * @param spectators watching spectators
 */
public record GameSummary(
        long gameId,
        long roomId,
        String name,
        GameStatus status,
        int players,
        int maxPlayers,
        int spectators
)
{
    public GameSummary
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }
}
