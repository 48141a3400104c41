package org.abstractica.tabletop;

import java.util.Objects;

/**
 * An authenticated user.
 *
 * @param id        stable identity id, positive
 * @param name      display name
 * @param privilege privilege level
 */
public record Identity(long id, String name, Privilege privilege)
{
    public Identity
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(privilege, "privilege");
        if (id <= 0)
        {
            throw new IllegalArgumentException("Identity id must be positive: " + id);
        }
    }
}
