package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * Table rules chosen when a game is created.
 *
 * @param name             display name
 * @param minPlayers       players required to start
 * @param maxPlayers       seats at the table
 * @param startingLife     initial value of each player's life counter
 * @param openingHandSize  cards drawn by each player at start
 * @param minDeckSize      smallest legal main deck
 * @param maxDeckSize      largest legal main deck
 * @param maxSideboardSize largest legal sideboard
 * @param allowSpectators  whether non-players may watch
 */
public record GameConfig(
        String name,
        int minPlayers,
        int maxPlayers,
        int startingLife,
        int openingHandSize,
        int minDeckSize,
        int maxDeckSize,
        int maxSideboardSize,
        boolean allowSpectators
)
{
    public static final int MAX_SEATS = 8;

    public GameConfig
    {
        Objects.requireNonNull(name, "name");
        if (minPlayers < 1 || maxPlayers > MAX_SEATS || minPlayers > maxPlayers)
        {
            throw new IllegalArgumentException(
                    "Player bounds must satisfy 1 <= min <= max <= " + MAX_SEATS + ": " + minPlayers + ".." + maxPlayers);
        }
        if (openingHandSize < 0 || minDeckSize < 0 || maxDeckSize < minDeckSize || maxSideboardSize < 0)
        {
            throw new IllegalArgumentException("Invalid deck limits in game config: " + name);
        }
    }

    /**
     * Two-player constructed defaults.
     *
     * @param name display name
     * @return config with standard limits
     */
    public static GameConfig standard(String name)
    {
        return new GameConfig(name, 2, 2, 20, 7, 40, 250, 15, true);
    }
}
