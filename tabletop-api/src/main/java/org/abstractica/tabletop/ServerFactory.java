package org.abstractica.tabletop;

import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Factory for creating Server instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * ServerFactory factory = new DefaultServerFactory();
 * Server server = factory.builder()
 *     .streamPort(7777)
 *     .authenticator(authenticator)
 *     .disconnectGracePeriod(Duration.ofMinutes(2))
 *     .build();
 * }</pre>
 */
public interface ServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Server.
     */
    interface Builder
    {
        /**
         * Enables the stream-socket transport on a port.
         *
         * @param port the port number, 0 for an ephemeral port
         * @return this builder
         */
        Builder streamPort(int port);

        /**
         * Enables the web-socket transport on a port.
         *
         * @param port the port number, 0 for an ephemeral port
         * @return this builder
         */
        Builder webSocketPort(int port);

        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the credential verifier.
         *
         * @param authenticator the authenticator
         * @return this builder
         */
        Builder authenticator(Authenticator authenticator);

        /**
         * Sets the directory for durable replay logs.
         *
         * <p>Optional. Without it, replays are kept in memory only.</p>
         *
         * @param directory the replay directory
         * @return this builder
         */
        Builder replayDirectory(Path directory);

        /**
         * Sets whether each replay append is forced to disk.
         *
         * <p>Optional. Defaults to false.</p>
         *
         * @param sync true to force every append
         * @return this builder
         */
        Builder syncReplayWrites(boolean sync);

        /**
         * Sets the maximum number of concurrent sessions.
         *
         * <p>Optional. Defaults to 1024.</p>
         *
         * @param maxConnections maximum sessions
         * @return this builder
         */
        Builder maxConnections(int maxConnections);

        /**
         * Sets the interval between server heartbeats.
         *
         * <p>Optional. Defaults to 5 seconds.</p>
         *
         * @param interval the heartbeat interval
         * @return this builder
         */
        Builder heartbeatInterval(Duration interval);

        /**
         * Sets how long a connection may stay silent before it is dropped.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param timeout the liveness timeout
         * @return this builder
         */
        Builder livenessTimeout(Duration timeout);

        /**
         * Sets how long a new connection has to complete the handshake.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param timeout the handshake timeout
         * @return this builder
         */
        Builder handshakeTimeout(Duration timeout);

        /**
         * Sets how long a command may stay unanswered before it fails with TIMEOUT.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param timeout the command timeout
         * @return this builder
         */
        Builder commandTimeout(Duration timeout);

        /**
         * Sets the maximum number of frames queued for one connection.
         *
         * <p>Optional. Defaults to 512. A connection exceeding it is dropped.</p>
         *
         * @param size maximum queued frames
         * @return this builder
         */
        Builder maxOutboundQueue(int size);

        /**
         * Sets the maximum frame size in bytes.
         *
         * <p>Optional. Defaults to 4 MiB.</p>
         *
         * @param size maximum frame size
         * @return this builder
         */
        Builder maxFrameSize(int size);

        /**
         * Sets how many malformed commands a session may send before it is disconnected.
         *
         * <p>Optional. Defaults to 5.</p>
         *
         * @param count malformed command limit
         * @return this builder
         */
        Builder maxMalformedCommands(int count);

        /**
         * Sets how long a game waits for a disconnected player before it is abandoned.
         *
         * <p>Optional. Defaults to 2 minutes.</p>
         *
         * @param period the grace period
         * @return this builder
         */
        Builder disconnectGracePeriod(Duration period);

        /**
         * Sets how long an empty, non-permanent room survives.
         *
         * <p>Optional. Defaults to 5 minutes.</p>
         *
         * @param timeout the idle timeout
         * @return this builder
         */
        Builder roomIdleTimeout(Duration timeout);

        /**
         * Sets how long a finished or abandoned game stays listed while members remain.
         *
         * <p>Optional. Defaults to 30 minutes.</p>
         *
         * @param retention the retention period
         * @return this builder
         */
        Builder finishedGameRetention(Duration retention);

        /**
         * Sets the number of threads applying game commands.
         *
         * <p>Optional. Defaults to the number of processors.</p>
         *
         * @param workers game worker threads
         * @return this builder
         */
        Builder gameWorkers(int workers);

        /**
         * Adds a permanent room created at start.
         *
         * @param name        room name
         * @param description room description
         * @return this builder
         */
        Builder room(String name, String description);

        /**
         * Builds the server.
         *
         * @return the configured server
         * @throws IllegalStateException if required parameters are missing
         */
        Server build();
    }
}
