package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * Public view of an authenticated user.
 *
 * @param identityId stable identity id
 * @param name       display name
 */
public record UserView(long identityId, String name)
{
    public UserView
    {
        Objects.requireNonNull(name, "name");
    }
}
