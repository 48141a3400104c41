package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.Scope;
import org.abstractica.tabletop.protocol.SessionCommand.ListMyGames;
import org.abstractica.tabletop.protocol.SessionCommand.ListRooms;
import org.abstractica.tabletop.protocol.SessionCommand.Ping;

import java.util.Objects;

/**
 * Handlers for SESSION-scope commands.
 */
public final class SessionHandlers
{
    private final Lobby lobby;

    public SessionHandlers(Lobby lobby)
    {
        this.lobby = Objects.requireNonNull(lobby, "lobby");
    }

    public void register(DispatchTable table)
    {
        table.register(Scope.SESSION, Ping.class, this::ping);
        table.register(Scope.SESSION, ListRooms.class, this::listRooms);
        table.register(Scope.SESSION, ListMyGames.class, this::listMyGames);
    }

    private void ping(CommandContext context, Ping ping)
    {
        context.reply(new Reply.Pong(ping.clientTime(), System.currentTimeMillis()));
    }

    private void listRooms(CommandContext context, ListRooms command)
    {
        context.reply(new Reply.RoomList(lobby.listRooms()));
    }

    private void listMyGames(CommandContext context, ListMyGames command)
    {
        context.reply(new Reply.GameList(lobby.gamesOf(context.session().getIdentity().id())));
    }
}
