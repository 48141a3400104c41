package org.abstractica.tabletop.server;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.impl.auth.StaticAuthenticator;
import org.abstractica.tabletop.impl.session.DefaultServer;
import org.abstractica.tabletop.impl.session.DefaultServerFactory;
import org.abstractica.tabletop.impl.transport.LocalTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the operator console of {@link TabletopServer}.
 */
class TabletopServerTest
{
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private DefaultServer server;
    private TabletopServer app;

    @BeforeEach
    void setUp()
    {
        server = new DefaultServerFactory().builder()
                .authenticator(StaticAuthenticator.builder().user("admin", "x", Privilege.ADMIN, 1).build())
                .transport(new LocalTransport())
                .room("Lobby", "Main room")
                .build();
        app = new TabletopServer(server, new PrintStream(output, true, StandardCharsets.UTF_8));
        app.start();
    }

    @AfterEach
    void tearDown()
    {
        app.stop();
    }

    private String printed()
    {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void execute_rooms_listsConfiguredRooms()
    {
        assertTrue(app.execute("rooms"));
        assertTrue(printed().contains("[1] Lobby"), printed());
    }

    @Test
    void execute_emptyServer_reportsNothingRunning()
    {
        app.execute("sessions");
        app.execute("games");

        assertTrue(printed().contains("No sessions connected"));
        assertTrue(printed().contains("No games"));
    }

    @Test
    void execute_stats_printsCounters()
    {
        app.execute("stats");
        assertTrue(printed().contains("sessions=0"));
    }

    @Test
    void execute_kickWithoutName_printsUsage()
    {
        app.execute("kick");
        app.execute("kick nobody");

        assertTrue(printed().contains("Usage: kick <user name>"));
        assertTrue(printed().contains("User not found: nobody"));
    }

    @Test
    void execute_notice_reportsRecipients()
    {
        app.execute("notice maintenance at noon");
        assertTrue(printed().contains("Notice sent to 0 sessions"));
    }

    @Test
    void execute_unknownCommand_keepsRunning()
    {
        assertTrue(app.execute("dance"));
        assertTrue(app.execute("   "));
        assertTrue(printed().contains("Unknown command: dance"));
    }

    @Test
    void runCommandLoop_stopsAtQuit()
    {
        app.runCommandLoop(new BufferedReader(new StringReader("rooms\nquit\nnotice never sent\n")));

        assertTrue(printed().contains("Shutting down..."));
        assertFalse(printed().contains("Notice sent"));
    }
}
