package org.abstractica.tabletop.impl.handlers;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.impl.dispatch.DispatchTable;
import org.abstractica.tabletop.impl.game.Game;
import org.abstractica.tabletop.impl.registry.Lobby;
import org.abstractica.tabletop.impl.replay.ReplayExport;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameCommand.ExportReplay;
import org.abstractica.tabletop.protocol.GameCommand.Resync;
import org.abstractica.tabletop.protocol.Scope;

import java.util.Objects;
import java.util.Optional;

/**
 * Handlers for GAME-scope commands. The target id selects the game.
 *
 * <p>Gameplay and membership commands go to the live game's mailbox.
 * Replay export reads the log directly, so it works for destroyed games
 * and does not wait behind the game's queue. Resync of a game that is no
 * longer live is answered by folding its log.</p>
 */
public final class GameHandlers
{
    private final Lobby lobby;

    public GameHandlers(Lobby lobby)
    {
        this.lobby = Objects.requireNonNull(lobby, "lobby");
    }

    @SuppressWarnings("unchecked")
    public void register(DispatchTable table)
    {
        for (Class<?> type : GameCommand.class.getPermittedSubclasses())
        {
            table.register(Scope.GAME, (Class<GameCommand>) type, this::submit);
        }
        table.register(Scope.GAME, Resync.class, this::resync);
        table.register(Scope.GAME, ExportReplay.class, this::exportReplay);
    }

    private void submit(CommandContext context, GameCommand command)
    {
        lobby.requireGame(context.targetId()).submit(Members.of(context), command, context);
    }

    private void resync(CommandContext context, Resync command)
    {
        long gameId = context.targetId();
        Optional<Game> game = lobby.findGame(gameId);
        if (game.isPresent())
        {
            game.get().submit(Members.of(context), command, context);
        }
        else
        {
            context.reply(lobby.coldResync(gameId, command.fromSequence()));
        }
    }

    private void exportReplay(CommandContext context, ExportReplay command)
    {
        long gameId = context.targetId();
        context.reply(ReplayExport.page(lobby.replayLog(gameId), command.afterSequence(), command.maxEvents()));
    }
}
