package org.abstractica.tabletop.protocol.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Full state of a game at a given event sequence.
 *
 * @param gameId       game id
 * @param roomId       owning room
 * @param config       table rules
 * @param status       lifecycle status
 * @param sequence     sequence of the last event folded into this snapshot
 * @param turn         turn number, 0 before start
 * @param phase        current phase
 * @param activePlayer player whose turn it is
 * @param winner       winning player once finished
 * @param players      seated players by seat
 * @param spectators   watching users
 * @param zones        every zone of the game
 */
public record GameSnapshot(
        long gameId,
        long roomId,
        GameConfig config,
        GameStatus status,
        long sequence,
        int turn,
        Phase phase,
        Optional<Long> activePlayer,
        Optional<Long> winner,
        List<PlayerView> players,
        List<UserView> spectators,
        List<ZoneView> zones
)
{
    public GameSnapshot
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(activePlayer, "activePlayer");
        Objects.requireNonNull(winner, "winner");
        players = List.copyOf(players);
        spectators = List.copyOf(spectators);
        zones = List.copyOf(zones);
    }

    /**
     * Finds a zone by reference.
     *
     * @param zone the zone to look up
     * @return the zone contents, or empty if the game has no such zone
     */
    public Optional<ZoneView> zone(ZoneRef zone)
    {
        return zones.stream().filter(z -> z.zone().equals(zone)).findFirst();
    }
}
