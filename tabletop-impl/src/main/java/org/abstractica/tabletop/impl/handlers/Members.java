package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.impl.broadcast.Member;

final class Members
{
    private Members() {}

    /**
     * Returns the issuing session as a room and game member.
     *
     * @throws IllegalStateException if the session was not created by this server
     */
    static Member of(CommandContext context)
    {
        if (context.session() instanceof Member member)
        {
            return member;
        }
        throw new IllegalStateException("Session " + context.session().getId() + " cannot join rooms or games");
    }
}
