package org.abstractica.tabletop.impl.session;

import org.abstractica.tabletop.impl.registry.LobbySettings;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated server settings, as collected by the builder.
 *
 * @param heartbeatInterval    interval between server heartbeats
 * @param livenessTimeout      silence after which a connection is dropped
 * @param handshakeTimeout     time allowed for the handshake
 * @param commandTimeout       time after which an unanswered command fails with TIMEOUT
 * @param maxConnections       maximum concurrent sessions
 * @param maxOutboundQueue     queued frames per connection before it is dropped
 * @param maxMalformedCommands malformed commands tolerated per session
 * @param lobby                room and game lifetimes
 * @param rooms                permanent rooms created at start, in order
 */
public record ServerConfig(
        Duration heartbeatInterval,
        Duration livenessTimeout,
        Duration handshakeTimeout,
        Duration commandTimeout,
        int maxConnections,
        int maxOutboundQueue,
        int maxMalformedCommands,
        LobbySettings lobby,
        List<RoomSpec> rooms
)
{
    public ServerConfig
    {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(livenessTimeout, "livenessTimeout");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(lobby, "lobby");
        rooms = List.copyOf(rooms);
        if (maxConnections <= 0 || maxOutboundQueue <= 0 || maxMalformedCommands <= 0)
        {
            throw new IllegalArgumentException("Limits must be positive");
        }
    }

    /**
     * A permanent room to create at start.
     */
    public record RoomSpec(String name, String description)
    {
        public RoomSpec
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(description, "description");
        }
    }
}
