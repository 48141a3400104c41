package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.impl.registry.Room;
import org.abstractica.tabletop.protocol.AdminCommand.AbandonGame;
import org.abstractica.tabletop.protocol.AdminCommand.BroadcastNotice;
import org.abstractica.tabletop.protocol.AdminCommand.CreateRoom;
import org.abstractica.tabletop.protocol.AdminCommand.DestroyRoom;
import org.abstractica.tabletop.protocol.AdminCommand.PauseGame;
import org.abstractica.tabletop.protocol.AdminCommand.ResumeGame;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Handlers for ADMIN-scope commands.
 */
public final class AdminHandlers
{
    private static final Logger LOG = LoggerFactory.getLogger(AdminHandlers.class);

    private final Lobby lobby;
    private final Consumer<String> broadcaster;

    /**
     * @param lobby       the registry
     * @param broadcaster sends an announcement to every session
     */
    public AdminHandlers(Lobby lobby, Consumer<String> broadcaster)
    {
        this.lobby = Objects.requireNonNull(lobby, "lobby");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
    }

    public void register(DispatchTable table)
    {
        table.register(Scope.ADMIN, CreateRoom.class, this::createRoom);
        table.register(Scope.ADMIN, DestroyRoom.class, this::destroyRoom);
        table.register(Scope.ADMIN, PauseGame.class,
                (context, command) -> lobby.requireGame(command.gameId()).adminPause(context));
        table.register(Scope.ADMIN, ResumeGame.class,
                (context, command) -> lobby.requireGame(command.gameId()).adminResume(context));
        table.register(Scope.ADMIN, AbandonGame.class, this::abandonGame);
        table.register(Scope.ADMIN, BroadcastNotice.class, this::broadcastNotice);
    }

    private void createRoom(CommandContext context, CreateRoom command)
    {
        Room room = lobby.createRoom(command.name(), command.description(), false);
        context.reply(new Reply.RoomCreated(room.summary()));
    }

    private void destroyRoom(CommandContext context, DestroyRoom command)
    {
        lobby.destroyRoom(command.roomId());
        context.reply(new Reply.Ack());
    }

    private void abandonGame(CommandContext context, AbandonGame command)
    {
        String reason = command.reason().isBlank() ? "Abandoned by administrator" : command.reason();
        lobby.requireGame(command.gameId()).abandon(reason, context);
    }

    private void broadcastNotice(CommandContext context, BroadcastNotice command)
    {
        String text = GameRules.checkText(command.text());
        LOG.info("Announcement from {}: {}", context.session().getIdentity().name(), text);
        broadcaster.accept(text);
        context.reply(new Reply.Ack());
    }
}
