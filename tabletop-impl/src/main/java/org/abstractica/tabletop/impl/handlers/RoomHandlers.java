package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.impl.registry.Room;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.RoomCommand.CreateGame;
import org.abstractica.tabletop.protocol.RoomCommand.JoinRoom;
import org.abstractica.tabletop.protocol.RoomCommand.LeaveRoom;
import org.abstractica.tabletop.protocol.RoomCommand.ListGames;
import org.abstractica.tabletop.protocol.RoomCommand.RoomSay;
import org.abstractica.tabletop.protocol.Scope;

import java.util.Objects;

/**
 * Handlers for ROOM-scope commands. The target id selects the room.
 */
public final class RoomHandlers
{
    private final Lobby lobby;

    public RoomHandlers(Lobby lobby)
    {
        this.lobby = Objects.requireNonNull(lobby, "lobby");
    }

    public void register(DispatchTable table)
    {
        table.register(Scope.ROOM, JoinRoom.class, this::joinRoom);
        table.register(Scope.ROOM, LeaveRoom.class, this::leaveRoom);
        table.register(Scope.ROOM, RoomSay.class, this::say);
        table.register(Scope.ROOM, ListGames.class, this::listGames);
        table.register(Scope.ROOM, CreateGame.class, this::createGame);
    }

    private void joinRoom(CommandContext context, JoinRoom command)
    {
        room(context).join(Members.of(context), context);
    }

    private void leaveRoom(CommandContext context, LeaveRoom command)
    {
        room(context).leave(Members.of(context));
        context.reply(new Reply.Ack());
    }

    private void say(CommandContext context, RoomSay command)
    {
        room(context).say(Members.of(context), command.text());
        context.reply(new Reply.Ack());
    }

    private void listGames(CommandContext context, ListGames command)
    {
        context.reply(new Reply.GameList(room(context).listGames()));
    }

    private void createGame(CommandContext context, CreateGame command)
    {
        lobby.createGame(room(context), Members.of(context), command.config(), command.deck(), context);
    }

    private Room room(CommandContext context)
    {
        return lobby.requireRoom(context.targetId());
    }
}
