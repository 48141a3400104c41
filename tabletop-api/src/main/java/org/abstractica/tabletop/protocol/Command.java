package org.abstractica.tabletop.protocol;

/**
 * Client-to-server command payloads.
 *
 * <p>Each sub-hierarchy holds the commands of one {@link Scope}. The sealed
 * structure is scanned to assign wire type ids and compute the protocol hash.</p>
 */
public sealed interface Command permits
        SessionCommand,
        RoomCommand,
        GameCommand,
        ModerationCommand,
        AdminCommand
{
}
