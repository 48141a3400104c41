package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * Addresses one zone of a game.
 *
 * <p>Shared zones use owner id {@link #SHARED_OWNER}.</p>
 *
 * @param ownerId identity id of the owning player, or 0 for shared zones
 * @param type    the zone kind
 */
public record ZoneRef(long ownerId, ZoneType type)
{
    public static final long SHARED_OWNER = 0L;

    public ZoneRef
    {
        Objects.requireNonNull(type, "type");
        if (type.isShared() && ownerId != SHARED_OWNER)
        {
            throw new IllegalArgumentException("Shared zone " + type + " cannot have an owner: " + ownerId);
        }
    }

    public static ZoneRef of(long ownerId, ZoneType type)
    {
        return new ZoneRef(ownerId, type);
    }

    public static ZoneRef shared(ZoneType type)
    {
        return new ZoneRef(SHARED_OWNER, type);
    }

    public boolean isShared()
    {
        return type.isShared();
    }

    @Override
    public String toString()
    {
        return isShared() ? type.name() : type.name() + "@" + ownerId;
    }
}
