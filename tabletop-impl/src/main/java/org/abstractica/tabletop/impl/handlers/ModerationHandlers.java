package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.Identity;
import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.impl.session.DefaultSession;
import org.abstractica.tabletop.impl.session.SessionRegistry;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.ModerationCommand.KickFromGame;
import org.abstractica.tabletop.protocol.ModerationCommand.KickUser;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Handlers for MODERATION-scope commands.
 *
 * <p>A moderator may only act on users whose privilege does not exceed
 * their own.</p>
 */
public final class ModerationHandlers
{
    private static final Logger LOG = LoggerFactory.getLogger(ModerationHandlers.class);

    private final Lobby lobby;
    private final SessionRegistry sessions;

    public ModerationHandlers(Lobby lobby, SessionRegistry sessions)
    {
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    public void register(DispatchTable table)
    {
        table.register(Scope.MODERATION, KickUser.class, this::kickUser);
        table.register(Scope.MODERATION, KickFromGame.class, this::kickFromGame);
    }

    private void kickUser(CommandContext context, KickUser command)
    {
        DefaultSession target = sessions.findByIdentity(command.identityId())
                .orElseThrow(() -> new ValidationException(ErrorCode.UNKNOWN_USER,
                        "User " + command.identityId() + " is not connected"));
        requireOutranks(context.session().getIdentity(), target.getIdentity());

        LOG.info("{} kicks {}: {}", context.session().getIdentity().name(), target.getIdentity().name(), command.reason());
        context.reply(new Reply.Ack());
        target.close(command.reason().isBlank() ? "Kicked by moderator" : command.reason());
    }

    private void kickFromGame(CommandContext context, KickFromGame command)
    {
        Optional<DefaultSession> target = sessions.findByIdentity(command.identityId());
        if (target.isPresent())
        {
            requireOutranks(context.session().getIdentity(), target.get().getIdentity());
        }
        lobby.requireGame(command.gameId()).kick(command.identityId(), context);
    }

    private static void requireOutranks(Identity issuer, Identity target)
    {
        if (!issuer.privilege().includes(target.privilege()))
        {
            throw new ValidationException(ErrorCode.PERMISSION_DENIED,
                    "Cannot act on a user with privilege " + target.privilege());
        }
    }
}
