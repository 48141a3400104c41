package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.Authenticator;
import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.Protocol;
import org.abstractica.tabletop.Server;
import org.abstractica.tabletop.ServerStats;
import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.handlers.CommandHandler;
import org.abstractica.tabletop.handlers.ErrorHandler;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.dispatch.Dispatcher;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.handlers.AdminHandlers;
import org.abstractica.tabletop.impl.handlers.GameHandlers;
import org.abstractica.tabletop.impl.handlers.ModerationHandlers;
import org.abstractica.tabletop.impl.handlers.RoomHandlers;
import org.abstractica.tabletop.impl.handlers.SessionHandlers;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.Heartbeat;
import org.abstractica.tabletop.impl.protocol.Notice;
import org.abstractica.tabletop.impl.protocol.Reject;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.impl.replay.ReplayStore;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.abstractica.tabletop.impl.transport.MessageChannel;
import org.abstractica.tabletop.impl.transport.Transport;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.NoticeLevel;
import org.abstractica.tabletop.protocol.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Default implementation of the Server interface.
 *
 * <p>Wires transports, handshakes, sessions, command dispatch and the lobby.
 * A single scheduler thread drives heartbeats, liveness, handshake and
 * command timeouts and lobby cleanup.</p>
 */
public class DefaultServer implements Server, SessionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultServer.class);
    private static final Duration TICK_INTERVAL = Duration.ofMillis(100);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(2);

    private final ServerConfig config;
    private final List<Transport> transports;
    private final DefaultProtocol protocol;
    private final ReplayStore replayStore;
    private final ExecutorService gameWorkers;
    private final ExecutorService outbound;
    private final ScheduledExecutorService scheduler;

    private final SessionRegistry sessionRegistry;
    private final Set<Connection> connections;
    private final Lobby lobby;
    private final DispatchTable dispatchTable;
    private final Dispatcher dispatcher;
    private final HandshakeHandler handshakeHandler;
    private final AtomicLong eventsPublished;
    private final DefaultServerStats stats;

    private final List<Consumer<Session>> sessionStartedCallbacks;
    private final List<BiConsumer<Session, DisconnectReason>> sessionDisconnectedCallbacks;

    private volatile boolean started;
    private volatile boolean acceptingConnections;
    private volatile boolean closed;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultServerFactory} to create instances.</p>
     */
    DefaultServer(
            ServerConfig config,
            List<Transport> transports,
            DefaultProtocol protocol,
            Authenticator authenticator,
            ReplayStore replayStore,
            GameRules rules,
            ExecutorService gameWorkers,
            ExecutorService outbound,
            ScheduledExecutorService scheduler
    )
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = List.copyOf(transports);
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.replayStore = Objects.requireNonNull(replayStore, "replayStore");
        this.gameWorkers = Objects.requireNonNull(gameWorkers, "gameWorkers");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (this.transports.isEmpty())
        {
            throw new IllegalArgumentException("At least one transport is required");
        }

        EnvelopeCodec codec = new EnvelopeCodec(protocol);
        this.sessionRegistry = new SessionRegistry(config.maxConnections());
        this.connections = ConcurrentHashMap.newKeySet();
        this.eventsPublished = new AtomicLong();
        this.lobby = new Lobby(
                replayStore,
                rules,
                gameWorkers,
                scheduler,
                config.lobby(),
                codec::eventBytes,
                eventsPublished::incrementAndGet);
        this.stats = new DefaultServerStats(sessionRegistry, connections, lobby, eventsPublished);

        this.dispatchTable = new DispatchTable();
        this.dispatcher = new Dispatcher(dispatchTable, codec, config.maxMalformedCommands(), stats::recordCommand);
        new SessionHandlers(lobby).register(dispatchTable);
        new RoomHandlers(lobby).register(dispatchTable);
        new GameHandlers(lobby).register(dispatchTable);
        new ModerationHandlers(lobby, sessionRegistry).register(dispatchTable);
        new AdminHandlers(lobby, this::broadcastNotice).register(dispatchTable);

        this.sessionStartedCallbacks = new CopyOnWriteArrayList<>();
        this.sessionDisconnectedCallbacks = new CopyOnWriteArrayList<>();

        this.handshakeHandler = new HandshakeHandler(
                sessionRegistry,
                protocol,
                authenticator,
                config.heartbeatInterval(),
                config.livenessTimeout(),
                () -> acceptingConnections,
                this::notifySessionStarted
        );
    }

    // ========== Server Interface ==========

    @Override
    public synchronized void start()
    {
        if (started)
        {
            throw new IllegalStateException("Server already started");
        }
        if (closed)
        {
            throw new IllegalStateException("Server is closed");
        }
        started = true;

        LOG.info("Starting server");

        for (ServerConfig.RoomSpec room : config.rooms())
        {
            lobby.createRoom(room.name(), room.description(), true);
        }
        lobby.recover();

        acceptingConnections = true;
        for (Transport transport : transports)
        {
            transport.start(this::accept);
            LOG.info("Server started on {} {}", transport.kind(), transport.getLocalAddress());
        }

        scheduler.scheduleAtFixedRate(this::tick, TICK_INTERVAL.toMillis(), TICK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void stop()
    {
        LOG.info("Stopping server (no new connections)");
        acceptingConnections = false;
    }

    @Override
    public synchronized void close()
    {
        if (closed)
        {
            return;
        }

        LOG.info("Closing server");

        closed = true;
        acceptingConnections = false;

        // Close all sessions
        for (DefaultSession session : sessionRegistry.getAllSessions())
        {
            session.getConnection().closeAfter(Disconnect.shutdown(), new DisconnectReason.ServerShutdown());
        }

        lobby.close();
        shutdown(gameWorkers, "game workers");
        scheduler.shutdownNow();
        shutdown(outbound, "outbound writers");

        for (Transport transport : transports)
        {
            try
            {
                transport.close();
            }
            catch (RuntimeException e)
            {
                LOG.warn("Error closing {} transport", transport.kind(), e);
            }
        }
        replayStore.close();

        LOG.info("Server closed");
    }

    private static void shutdown(ExecutorService executor, String name)
    {
        executor.shutdown();
        try
        {
            if (!executor.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS))
            {
                LOG.warn("Timed out waiting for {} to finish", name);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public <T extends Command> void onCommand(Scope scope, Class<T> type, CommandHandler<T> handler)
    {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        dispatchTable.register(scope, type, handler);
    }

    @Override
    public void onSessionStarted(Consumer<Session> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionStartedCallbacks.add(handler);
    }

    @Override
    public void onSessionDisconnected(BiConsumer<Session, DisconnectReason> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionDisconnectedCallbacks.add(handler);
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        dispatcher.setErrorHandler(handler);
    }

    @Override
    public void broadcastNotice(String message)
    {
        Objects.requireNonNull(message, "message");
        Notice notice = new Notice(NoticeLevel.ANNOUNCEMENT, message);
        for (DefaultSession session : sessionRegistry.getAllSessions())
        {
            session.send(notice);
        }
    }

    @Override
    public Collection<Session> getSessions()
    {
        return Collections.unmodifiableCollection(sessionRegistry.getAllSessions());
    }

    @Override
    public Optional<SocketAddress> getLocalAddress(TransportKind kind)
    {
        for (Transport transport : transports)
        {
            if (transport.kind() == kind)
            {
                return Optional.ofNullable(transport.getLocalAddress());
            }
        }
        return Optional.empty();
    }

    @Override
    public Protocol getProtocol()
    {
        return protocol;
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    // ========== SessionCallback Interface ==========

    @Override
    public void onHandshake(Connection connection, Frame frame)
    {
        handshakeHandler.handle(connection, frame);
    }

    @Override
    public void onCommand(DefaultSession session, CommandFrame frame)
    {
        dispatcher.dispatch(session, frame);
    }

    @Override
    public void onConnectionClosed(Connection connection, DisconnectReason reason)
    {
        connections.remove(connection);
        if (reason instanceof DisconnectReason.Overflow)
        {
            stats.recordOverflow();
        }

        DefaultSession session = connection.getSession();
        if (session == null)
        {
            LOG.debug("{} closed before handshake: {}", connection, reason);
            return;
        }

        sessionRegistry.remove(session);
        LOG.info("Session removed: id={}, user={}, reason={}", session.getId(), session.displayName(), reason);

        if (!closed)
        {
            // off the caller's thread: overflow is detected while a room or game is publishing
            try
            {
                scheduler.execute(() -> releaseMemberships(session));
            }
            catch (RejectedExecutionException e)
            {
                LOG.debug("Scheduler stopped, not releasing memberships of {}", session.getId());
            }
        }

        for (BiConsumer<Session, DisconnectReason> callback : sessionDisconnectedCallbacks)
        {
            try
            {
                callback.accept(session, reason);
            }
            catch (Exception e)
            {
                LOG.error("Session disconnected callback error", e);
            }
        }
    }

    private void releaseMemberships(DefaultSession session)
    {
        for (long roomId : session.getRoomIds())
        {
            lobby.findRoom(roomId).ifPresent(room -> room.removeIfPresent(session));
        }
        for (long gameId : session.getGameIds())
        {
            lobby.findGame(gameId).ifPresent(game -> game.connectionLost(session));
        }
    }

    private void notifySessionStarted(DefaultSession session)
    {
        for (Consumer<Session> callback : sessionStartedCallbacks)
        {
            try
            {
                callback.accept(session);
            }
            catch (Exception e)
            {
                LOG.error("Session started callback error", e);
            }
        }
    }

    // ========== Connections ==========

    private void accept(MessageChannel channel)
    {
        Connection connection = new Connection(channel, this, outbound, config.maxOutboundQueue());
        if (!acceptingConnections)
        {
            channel.setHandler(connection);
            connection.reject(Reject.RejectReason.SHUTTING_DOWN, "Server is not accepting connections");
            return;
        }
        connections.add(connection);
        channel.setHandler(connection);
        LOG.debug("Accepted {}", connection);
    }

    // ========== Tick ==========

    private void tick()
    {
        try
        {
            long now = System.nanoTime();
            for (Connection connection : connections)
            {
                tick(connection, now);
            }
            lobby.sweep();
        }
        catch (Exception e)
        {
            LOG.error("Error in server tick", e);
        }
    }

    private void tick(Connection connection, long now)
    {
        connection.closeIfStuck(now, config.handshakeTimeout().toNanos());

        switch (connection.getState())
        {
            case HANDSHAKE ->
            {
                if (now - connection.getAcceptedNanos() > config.handshakeTimeout().toNanos())
                {
                    connection.reject(Reject.RejectReason.HANDSHAKE_TIMEOUT, "No HELLO within " + config.handshakeTimeout());
                }
            }
            case OPEN ->
            {
                if (now - connection.getLastInboundNanos() > config.livenessTimeout().toNanos())
                {
                    LOG.info("{} timed out", connection);
                    connection.closeAfter(Disconnect.timeout(),
                            new DisconnectReason.Timeout());
                    return;
                }
                if (now - connection.getLastHeartbeatNanos() >= config.heartbeatInterval().toNanos())
                {
                    connection.heartbeatSent(now);
                    connection.send(new Heartbeat(System.currentTimeMillis()));
                }
                DefaultSession session = connection.getSession();
                if (session != null)
                {
                    int expired = session.pendingCommands().expire(now, config.commandTimeout());
                    if (expired > 0)
                    {
                        LOG.warn("Session {}: {} commands timed out", session.getId(), expired);
                    }
                }
            }
            case CLOSED ->
            {
                // removed by onConnectionClosed
            }
        }
    }

    // ========== Accessors ==========

    /**
     * Returns the room and game registry.
     *
     * @return the lobby
     */
    public Lobby getLobby()
    {
        return lobby;
    }

    public SessionRegistry getSessionRegistry()
    {
        return sessionRegistry;
    }
}
