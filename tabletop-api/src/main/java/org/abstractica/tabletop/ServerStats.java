package org.abstractica.tabletop;

/**
 * Server statistics for monitoring and observability.
 *
 * <p>Statistics are pollable snapshots. The application can query these
 * values and push to a monitoring system of choice.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of open connections, including those still in handshake.
     *
     * @return active connection count
     */
    int getActiveConnections();

    /**
     * Returns the number of authenticated sessions.
     *
     * @return active session count
     */
    int getActiveSessions();

    /**
     * Returns the number of live rooms.
     *
     * @return room count
     */
    int getActiveRooms();

    /**
     * Returns the number of games not yet destroyed.
     *
     * @return game count
     */
    int getActiveGames();

    /**
     * Returns the current command throughput.
     *
     * @return commands processed per second since the previous call
     */
    long getCommandsPerSecond();

    /**
     * Returns the total number of events published.
     *
     * @return events published since start
     */
    long getEventsPublished();

    /**
     * Returns the number of connections dropped because their outbound queue overflowed.
     *
     * @return overflow disconnect count
     */
    long getOverflowDisconnects();
}
