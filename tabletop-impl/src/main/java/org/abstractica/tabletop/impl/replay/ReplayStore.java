package org.abstractica.tabletop.impl.replay;

import java.util.OptionalLong;

/**
 * Durable per-game event logs.
 *
 * <p>A log exists from the first append of its game and is never deleted by
 * the server. Logs outlive the games they record, so a destroyed game can
 * still be replayed.</p>
 */
public interface ReplayStore extends AutoCloseable
{
    /**
     * Opens the log of a game, creating it if absent.
     *
     * <p>Repeated calls for the same game return the same log instance until
     * the store is closed.</p>
     *
     * @param gameId the game
     * @return the log
     * @throws java.io.UncheckedIOException if the log cannot be opened
     */
    ReplayLog open(long gameId);

    /**
     * Returns whether a log exists for a game.
     *
     * @param gameId the game
     * @return true if events were ever recorded for it
     */
    boolean exists(long gameId);

    /**
     * Returns the highest game id with a log.
     *
     * @return the highest recorded game id, or empty if the store is empty
     */
    OptionalLong maxGameId();

    /**
     * Returns the ids of every recorded game, ascending.
     *
     * @return game ids
     */
    long[] gameIds();

    @Override
    void close();
}
