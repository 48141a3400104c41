package org.abstractica.tabletop.protocol.model;

/**
 * Lifecycle state of a game.
 */
public enum GameStatus
{
    SETUP,
    IN_PROGRESS,
    PAUSED,
    FINISHED,
    ABANDONED;

    /**
     * Returns whether the game can no longer change.
     *
     * @return true for FINISHED and ABANDONED
     */
    public boolean isTerminal()
    {
        return this == FINISHED || this == ABANDONED;
    }
}
