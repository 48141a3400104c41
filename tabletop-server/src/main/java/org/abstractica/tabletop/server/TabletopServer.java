package org.abstractica.tabletop.server;

import org.abstractica.tabletop.Session;
import org.abstractica.tabletop.ServerStats;
import org.abstractica.tabletop.TransportKind;
import org.abstractica.tabletop.impl.game.Game;
import org.abstractica.tabletop.impl.session.DefaultServer;
import org.abstractica.tabletop.impl.session.DefaultServerFactory;
import org.abstractica.tabletop.impl.session.DefaultSession;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.RoomSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Tabletop server application with an operator console.
 *
 * <p>Usage: {@code TabletopServer [config-file]}. The file overrides keys of
 * the bundled {@code tabletop.properties}.</p>
 */
public class TabletopServer
{
    private static final Logger LOG = LoggerFactory.getLogger(TabletopServer.class);

    private final DefaultServer server;
    private final PrintStream out;

    public TabletopServer(DefaultServer server, PrintStream out)
    {
        this.server = Objects.requireNonNull(server, "server");
        this.out = Objects.requireNonNull(out, "out");
        registerLifecycleCallbacks();
    }

    private void registerLifecycleCallbacks()
    {
        server.onSessionStarted(session ->
                LOG.info("{} connected over {}", session.getIdentity().name(), session.getTransportKind()));

        server.onSessionDisconnected((session, reason) ->
                LOG.info("{} disconnected ({})", session.getIdentity().name(), reason));

        server.onError((session, command, exception) ->
                LOG.error("Error handling command: session={}, command={}", session.getId(), command, exception));
    }

    public void start()
    {
        server.start();
        for (TransportKind kind : TransportKind.values())
        {
            server.getLocalAddress(kind).ifPresent(address -> out.println(kind + " listening on " + address));
        }
    }

    public void stop()
    {
        server.close();
        LOG.info("Tabletop server stopped");
    }

    // ========== Console ==========

    public void runCommandLoop(BufferedReader reader)
    {
        out.println("Server commands: sessions, rooms, games, stats, kick <name>, notice <text>, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                if (!execute(line))
                {
                    return;
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    /**
     * Runs one console command.
     *
     * @param line the command line
     * @return false when the console should stop
     */
    public boolean execute(String line)
    {
        String[] parts = line.trim().split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String argument = parts.length > 1 ? parts[1].trim() : "";

        switch (command)
        {
            case "sessions" -> listSessions();
            case "rooms" -> listRooms();
            case "games" -> listGames();
            case "stats" -> printStats();
            case "kick" ->
            {
                if (argument.isEmpty())
                {
                    out.println("Usage: kick <user name>");
                }
                else
                {
                    kick(argument);
                }
            }
            case "notice" ->
            {
                if (argument.isEmpty())
                {
                    out.println("Usage: notice <text>");
                }
                else
                {
                    server.broadcastNotice(argument);
                    out.println("Notice sent to " + server.getSessions().size() + " sessions");
                }
            }
            case "quit", "exit", "q" ->
            {
                out.println("Shutting down...");
                return false;
            }
            case "" ->
            {
                // Ignore empty input
            }
            default -> out.println("Unknown command: " + command);
        }
        return true;
    }

    private void listSessions()
    {
        if (server.getSessions().isEmpty())
        {
            out.println("No sessions connected");
            return;
        }
        out.println("Connected sessions:");
        for (Session session : server.getSessions())
        {
            out.printf("  %s #%d %s via %s%n",
                    session.getIdentity().name(),
                    session.getIdentity().id(),
                    session.getIdentity().privilege(),
                    session.getTransportKind());
        }
    }

    private void listRooms()
    {
        for (RoomSummary room : server.getLobby().listRooms())
        {
            out.printf("  [%d] %s%s - %d members, %d games%n",
                    room.roomId(),
                    room.name(),
                    room.permanent() ? " (permanent)" : "",
                    room.members(),
                    room.games());
        }
    }

    private void listGames()
    {
        if (server.getLobby().getGameCount() == 0)
        {
            out.println("No games");
            return;
        }
        for (Game game : server.getLobby().getGames())
        {
            GameSummary summary = game.getSummary();
            out.printf("  [%d] %s in room %d - %s, %d/%d players, %d spectators%n",
                    summary.gameId(),
                    summary.name(),
                    summary.roomId(),
                    summary.status(),
                    summary.players(),
                    summary.maxPlayers(),
                    summary.spectators());
        }
    }

    private void printStats()
    {
        ServerStats stats = server.getStats();
        out.printf("  connections=%d sessions=%d rooms=%d games=%d commands/s=%d events=%d overflows=%d%n",
                stats.getActiveConnections(),
                stats.getActiveSessions(),
                stats.getActiveRooms(),
                stats.getActiveGames(),
                stats.getCommandsPerSecond(),
                stats.getEventsPublished(),
                stats.getOverflowDisconnects());
    }

    private void kick(String name)
    {
        Optional<DefaultSession> session = server.getSessionRegistry().findByName(name);
        if (session.isEmpty())
        {
            out.println("User not found: " + name);
            return;
        }
        LOG.info("Kicking user: {}", session.get().displayName());
        session.get().close("Kicked by operator");
        out.println("Kicked " + session.get().displayName());
    }

    public static void main(String[] args)
    {
        if (args.length > 1)
        {
            System.err.println("Usage: TabletopServer [config-file]");
            System.exit(1);
        }

        ServerSettings settings;
        DefaultServer server;
        try
        {
            settings = ServerSettings.load(args.length == 1 ? Optional.of(Path.of(args[0])) : Optional.empty());
            server = settings.applyTo(new DefaultServerFactory().builder()).build();
        }
        catch (RuntimeException e)
        {
            System.err.println("Invalid configuration: " + e.getMessage());
            LOG.error("Invalid configuration", e);
            System.exit(1);
            return;
        }

        TabletopServer app = new TabletopServer(server, System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown-hook"));

        app.start();
        app.runCommandLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        app.stop();
    }
}
