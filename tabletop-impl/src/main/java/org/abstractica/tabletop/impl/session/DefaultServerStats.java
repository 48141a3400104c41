package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.ServerStats;
import org.abstractica.tabletop.impl.registry.Lobby;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Provides real-time statistics about server operation.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final SessionRegistry sessions;
    private final Collection<Connection> connections;
    private final Lobby lobby;
    private final AtomicLong eventsPublished;
    private final AtomicLong commandsProcessed = new AtomicLong(0);
    private final AtomicLong overflowDisconnects = new AtomicLong(0);

    private volatile long lastStatTimeMs = System.currentTimeMillis();
    private volatile long lastCommandsProcessed = 0;

    /**
     * Creates stats over the server's registries.
     *
     * @param sessions        the session registry
     * @param connections     open connections
     * @param lobby           rooms and games
     * @param eventsPublished counter incremented by every topic
     */
    public DefaultServerStats(
            SessionRegistry sessions,
            Collection<Connection> connections,
            Lobby lobby,
            AtomicLong eventsPublished)
    {
        this.sessions = sessions;
        this.connections = connections;
        this.lobby = lobby;
        this.eventsPublished = eventsPublished;
    }

    @Override
    public int getActiveConnections()
    {
        return connections.size();
    }

    @Override
    public int getActiveSessions()
    {
        return sessions.size();
    }

    @Override
    public int getActiveRooms()
    {
        return lobby.getRoomCount();
    }

    @Override
    public int getActiveGames()
    {
        return lobby.getGameCount();
    }

    @Override
    public long getCommandsPerSecond()
    {
        long now = System.currentTimeMillis();
        long elapsed = now - lastStatTimeMs;
        if (elapsed <= 0)
        {
            return 0;
        }

        long current = commandsProcessed.get();
        long delta = current - lastCommandsProcessed;

        // Update for next call
        lastStatTimeMs = now;
        lastCommandsProcessed = current;

        return (delta * 1000) / elapsed;
    }

    @Override
    public long getEventsPublished()
    {
        return eventsPublished.get();
    }

    @Override
    public long getOverflowDisconnects()
    {
        return overflowDisconnects.get();
    }

    // ========== Update Methods ==========

    /**
     * Records a command accepted by the dispatcher.
     */
    public void recordCommand()
    {
        commandsProcessed.incrementAndGet();
    }

    /**
     * Records a connection dropped for outbound overflow.
     */
    public void recordOverflow()
    {
        overflowDisconnects.incrementAndGet();
    }

    public long getCommandsProcessed()
    {
        return commandsProcessed.get();
    }
}
