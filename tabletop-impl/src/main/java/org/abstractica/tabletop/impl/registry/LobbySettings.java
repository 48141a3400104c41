package org.abstractica.tabletop.impl.registry;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts governing room and game lifetimes.
 *
 * @param disconnectGracePeriod how long a disconnected player's seat is held
 * @param finishedGameRetention how long an ended game stays listed while members remain
 * @param roomIdleTimeout       how long an empty, non-permanent room survives
 */
public record LobbySettings(
        Duration disconnectGracePeriod,
        Duration finishedGameRetention,
        Duration roomIdleTimeout
)
{
    public LobbySettings
    {
        Objects.requireNonNull(disconnectGracePeriod, "disconnectGracePeriod");
        Objects.requireNonNull(finishedGameRetention, "finishedGameRetention");
        Objects.requireNonNull(roomIdleTimeout, "roomIdleTimeout");
    }

    public static LobbySettings defaults()
    {
        return new LobbySettings(Duration.ofMinutes(2), Duration.ofMinutes(30), Duration.ofMinutes(5));
    }
}
