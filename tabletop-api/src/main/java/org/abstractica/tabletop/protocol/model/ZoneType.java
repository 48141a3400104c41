package org.abstractica.tabletop.protocol.model;

/**
 * Kinds of card containers on the table.
 *
 * <p>All zones except {@link #STACK} exist once per player. The stack is shared
 * and has no owner.</p>
 */
public enum ZoneType
{
    LIBRARY(false),
    HAND(false),
    GRAVEYARD(false),
    BATTLEFIELD(false),
    EXILE(false),
    SIDEBOARD(false),
    STACK(true);

    private final boolean shared;

    ZoneType(boolean shared)
    {
        this.shared = shared;
    }

    /**
     * Returns whether this zone is shared by all players.
     *
     * @return true for shared zones
     */
    public boolean isShared()
    {
        return shared;
    }
}
