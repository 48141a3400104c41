package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.Authenticator;
import org.abstractica.tabletop.Server;
import org.abstractica.tabletop.ServerFactory;
import org.abstractica.tabletop.impl.concurrent.DaemonThreadFactory;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.registry.LobbySettings;
import org.abstractica.tabletop.impl.replay.FileReplayStore;
import org.abstractica.tabletop.impl.replay.InMemoryReplayStore;
import org.abstractica.tabletop.impl.replay.ReplayStore;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.abstractica.tabletop.impl.transport.StreamTransport;
import org.abstractica.tabletop.impl.transport.Transport;
import org.abstractica.tabletop.impl.transport.WebSocketTransport;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Default implementation of ServerFactory.
 *
 * <p>Creates DefaultServer instances using a builder pattern.</p>
 */
public class DefaultServerFactory implements ServerFactory
{
    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int streamPort = -1; // -1 = disabled
        private int webSocketPort = -1;
        private InetAddress bindAddress;
        private Authenticator authenticator;
        private Path replayDirectory;
        private boolean syncReplayWrites;
        private int maxConnections = 1024;
        private Duration heartbeatInterval = Duration.ofSeconds(5);
        private Duration livenessTimeout = Duration.ofSeconds(30);
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        private Duration commandTimeout = Duration.ofSeconds(30);
        private int maxOutboundQueue = 512;
        private int maxFrameSize = 4 * 1024 * 1024;
        private int maxMalformedCommands = 5;
        private Duration disconnectGracePeriod = Duration.ofMinutes(2);
        private Duration roomIdleTimeout = Duration.ofMinutes(5);
        private Duration finishedGameRetention = Duration.ofMinutes(30);
        private int gameWorkers = Runtime.getRuntime().availableProcessors();
        private final List<ServerConfig.RoomSpec> rooms = new ArrayList<>();
        private final List<Transport> customTransports = new ArrayList<>();
        private ReplayStore customReplayStore;
        private GameRules rules;

        @Override
        public DefaultBuilder streamPort(int port)
        {
            this.streamPort = checkPort(port);
            return this;
        }

        @Override
        public DefaultBuilder webSocketPort(int port)
        {
            this.webSocketPort = checkPort(port);
            return this;
        }

        private static int checkPort(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            return port;
        }

        @Override
        public DefaultBuilder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public DefaultBuilder authenticator(Authenticator authenticator)
        {
            this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
            return this;
        }

        @Override
        public DefaultBuilder replayDirectory(Path directory)
        {
            this.replayDirectory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        @Override
        public DefaultBuilder syncReplayWrites(boolean sync)
        {
            this.syncReplayWrites = sync;
            return this;
        }

        @Override
        public DefaultBuilder maxConnections(int maxConnections)
        {
            this.maxConnections = positive(maxConnections, "maxConnections");
            return this;
        }

        @Override
        public DefaultBuilder heartbeatInterval(Duration interval)
        {
            this.heartbeatInterval = positive(interval, "Heartbeat interval");
            return this;
        }

        @Override
        public DefaultBuilder livenessTimeout(Duration timeout)
        {
            this.livenessTimeout = positive(timeout, "Liveness timeout");
            return this;
        }

        @Override
        public DefaultBuilder handshakeTimeout(Duration timeout)
        {
            this.handshakeTimeout = positive(timeout, "Handshake timeout");
            return this;
        }

        @Override
        public DefaultBuilder commandTimeout(Duration timeout)
        {
            this.commandTimeout = positive(timeout, "Command timeout");
            return this;
        }

        @Override
        public DefaultBuilder maxOutboundQueue(int size)
        {
            this.maxOutboundQueue = positive(size, "maxOutboundQueue");
            return this;
        }

        @Override
        public DefaultBuilder maxFrameSize(int size)
        {
            this.maxFrameSize = positive(size, "maxFrameSize");
            return this;
        }

        @Override
        public DefaultBuilder maxMalformedCommands(int count)
        {
            this.maxMalformedCommands = positive(count, "maxMalformedCommands");
            return this;
        }

        @Override
        public DefaultBuilder disconnectGracePeriod(Duration period)
        {
            this.disconnectGracePeriod = positive(period, "Disconnect grace period");
            return this;
        }

        @Override
        public DefaultBuilder roomIdleTimeout(Duration timeout)
        {
            this.roomIdleTimeout = positive(timeout, "Room idle timeout");
            return this;
        }

        @Override
        public DefaultBuilder finishedGameRetention(Duration retention)
        {
            this.finishedGameRetention = positive(retention, "Finished game retention");
            return this;
        }

        @Override
        public DefaultBuilder gameWorkers(int workers)
        {
            this.gameWorkers = positive(workers, "gameWorkers");
            return this;
        }

        @Override
        public DefaultBuilder room(String name, String description)
        {
            rooms.add(new ServerConfig.RoomSpec(name, description));
            return this;
        }

        /**
         * Adds a transport created by the caller, typically a
         * {@link org.abstractica.tabletop.impl.transport.LocalTransport} in tests.
         *
         * @param transport the transport to serve
         * @return this builder
         */
        public DefaultBuilder transport(Transport transport)
        {
            customTransports.add(Objects.requireNonNull(transport, "transport"));
            return this;
        }

        /**
         * Replaces the replay store chosen from {@link #replayDirectory(Path)}.
         *
         * @param store the store to use
         * @return this builder
         */
        public DefaultBuilder replayStore(ReplayStore store)
        {
            this.customReplayStore = Objects.requireNonNull(store, "store");
            return this;
        }

        /**
         * Sets the rules used for new games, for example with a seeded random.
         *
         * @param rules the game rules
         * @return this builder
         */
        public DefaultBuilder rules(GameRules rules)
        {
            this.rules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        private static int positive(int value, String name)
        {
            if (value <= 0)
            {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static Duration positive(Duration value, String name)
        {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        @Override
        public DefaultServer build()
        {
            // Validate required parameters
            if (authenticator == null)
            {
                throw new IllegalStateException("Authenticator must be specified");
            }
            if (streamPort < 0 && webSocketPort < 0 && customTransports.isEmpty())
            {
                throw new IllegalStateException("At least one of streamPort, webSocketPort or transport must be specified");
            }

            DefaultProtocol protocol = DefaultProtocol.tabletop();

            List<Transport> transports = new ArrayList<>();
            if (streamPort >= 0)
            {
                transports.add(new StreamTransport(socketAddress(streamPort), maxConnections, maxFrameSize));
            }
            if (webSocketPort >= 0)
            {
                transports.add(new WebSocketTransport(socketAddress(webSocketPort), maxFrameSize));
            }
            transports.addAll(customTransports);

            ReplayStore store;
            if (customReplayStore != null)
            {
                store = customReplayStore;
            }
            else if (replayDirectory != null)
            {
                store = new FileReplayStore(replayDirectory, protocol, syncReplayWrites);
            }
            else
            {
                store = new InMemoryReplayStore();
            }

            ServerConfig config = new ServerConfig(
                    heartbeatInterval,
                    livenessTimeout,
                    handshakeTimeout,
                    commandTimeout,
                    maxConnections,
                    maxOutboundQueue,
                    maxMalformedCommands,
                    new LobbySettings(disconnectGracePeriod, finishedGameRetention, roomIdleTimeout),
                    rooms
            );

            ExecutorService workers = Executors.newFixedThreadPool(gameWorkers, new DaemonThreadFactory("game-worker"));
            ExecutorService outbound = Executors.newFixedThreadPool(
                    Math.max(2, Runtime.getRuntime().availableProcessors()), new DaemonThreadFactory("outbound"));
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                    new DaemonThreadFactory("server-scheduler"));

            return new DefaultServer(
                    config,
                    transports,
                    protocol,
                    authenticator,
                    store,
                    rules != null ? rules : new GameRules(),
                    workers,
                    outbound,
                    scheduler
            );
        }

        private InetSocketAddress socketAddress(int port)
        {
            if (bindAddress != null)
            {
                return new InetSocketAddress(bindAddress, port);
            }
            return new InetSocketAddress(port);
        }
    }
}
