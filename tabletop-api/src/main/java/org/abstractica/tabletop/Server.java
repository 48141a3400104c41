package org.abstractica.tabletop;

import org.abstractica.tabletop.handlers.CommandHandler;
import org.abstractica.tabletop.handlers.ErrorHandler;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.Scope;

import java.net.SocketAddress;
import java.util.Collection;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A server that accepts client connections, authenticates them and runs games.
 *
 * <p>The server handles transports, sessions, command dispatch, rooms, games,
 * event broadcast and replay recording. Applications may add handlers for
 * further commands and observe session lifecycle.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Server server = serverFactory.builder()
 *     .streamPort(7777)
 *     .webSocketPort(7778)
 *     .authenticator(authenticator)
 *     .replayDirectory(Path.of("replays"))
 *     .room("Lobby", "Main room")
 *     .build();
 *
 * server.onSessionStarted(session -> {
 *     // New session authenticated
 * });
 *
 * server.start();
 * }</pre>
 */
public interface Server extends AutoCloseable
{
    /**
     * Starts the server.
     *
     * <p>Binds the configured transports and begins accepting connections.
     * This method returns once the transports are listening; the server runs
     * on background threads.</p>
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Existing sessions remain active. Use this for graceful shutdown:
     * stop accepting, notify clients, wait, then close.</p>
     */
    void stop();

    /**
     * Closes the server, all sessions and the replay store.
     */
    @Override
    void close();

    /**
     * Registers a handler for commands of the specified scope and type.
     *
     * <p>Replaces any handler already registered for the pair. Handlers are
     * called from connection threads.</p>
     *
     * @param scope   the scope the command must arrive in
     * @param type    the command class to handle
     * @param handler the handler to invoke
     * @param <T>     the command type
     */
    <T extends Command> void onCommand(Scope scope, Class<T> type, CommandHandler<T> handler);

    /**
     * Registers a callback for newly authenticated sessions.
     *
     * @param handler called when a new session is established
     */
    void onSessionStarted(Consumer<Session> handler);

    /**
     * Registers a callback for session disconnections.
     *
     * @param handler called with the session and disconnect reason
     */
    void onSessionDisconnected(BiConsumer<Session, DisconnectReason> handler);

    /**
     * Registers an error handler for command handler exceptions.
     *
     * @param handler called when a command handler throws an unexpected exception
     */
    void onError(ErrorHandler handler);

    /**
     * Sends an announcement notice to every connected session.
     *
     * @param message the announcement text
     */
    void broadcastNotice(String message);

    /**
     * Returns all active sessions.
     *
     * @return unmodifiable collection of sessions
     */
    Collection<Session> getSessions();

    /**
     * Returns the address a transport is bound to.
     *
     * @param kind the transport kind
     * @return the bound address, or empty if that transport is not running
     */
    Optional<SocketAddress> getLocalAddress(TransportKind kind);

    /**
     * Returns the payload protocol clients must match.
     *
     * @return the protocol
     */
    Protocol getProtocol();

    /**
     * Returns server statistics.
     *
     * @return current statistics snapshot
     */
    ServerStats getStats();
}
