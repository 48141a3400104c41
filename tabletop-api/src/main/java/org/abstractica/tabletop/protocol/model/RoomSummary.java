package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * Lobby listing entry for a room.
 *
 * @param roomId      room id
 * @param name        display name
 * @param description free text
 * @param members     current member count
 * @param games       live games in the room
 * @param permanent   whether the room survives being empty
 */
public record RoomSummary(
        long roomId,
        String name,
        String description,
        int members,
        int games,
        boolean permanent
)
{
    public RoomSummary
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
    }
}
