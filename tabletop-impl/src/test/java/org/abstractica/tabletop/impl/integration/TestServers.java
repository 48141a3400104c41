package org.abstractica.tabletop.impl.integration;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.impl.auth.StaticAuthenticator;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.session.DefaultServerFactory;
import org.abstractica.tabletop.impl.transport.LocalTransport;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Users, tables and server settings shared by the integration tests.
 */
final class TestServers
{
    static final long ALICE = 1;
    static final long BOB = 2;
    static final long CAROL = 3;
    static final long MOD = 4;

    /** Id of the first configured room. */
    static final long MAIN_ROOM = 1;

    static final GameConfig DUEL = new GameConfig("duel", 2, 2, 20, 2, 3, 10, 2, true);

    static final GameConfig THREE_WAY = new GameConfig("three", 3, 3, 20, 2, 3, 10, 2, true);

    private TestServers() {}

    static StaticAuthenticator authenticator()
    {
        return StaticAuthenticator.builder()
                .user("alice", "a", Privilege.ADMIN, ALICE)
                .user("bob", "b", Privilege.USER, BOB)
                .user("carol", "c", Privilege.USER, CAROL)
                .user("mod", "m", Privilege.MODERATOR, MOD)
                .build();
    }

    /**
     * A builder serving the given local transport with one permanent room
     * and seeded rules.
     */
    static DefaultServerFactory.DefaultBuilder builder(LocalTransport transport)
    {
        return new DefaultServerFactory().builder()
                .authenticator(authenticator())
                .transport(transport)
                .room("Main", "General play")
                .rules(new GameRules(new Random(7)))
                .heartbeatInterval(Duration.ofSeconds(1))
                .gameWorkers(2);
    }

    static DeckList deck(String prefix)
    {
        return new DeckList(
                List.of(prefix + "-1", prefix + "-2", prefix + "-3", prefix + "-4"),
                List.of(prefix + "-side"));
    }

    /**
     * Polls a condition until it holds.
     */
    static void eventually(String what, BooleanSupplier condition)
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TestClient.TIMEOUT_SECONDS);
        while (!condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
            {
                fail("Timed out waiting for " + what);
            }
            try
            {
                Thread.sleep(10);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + what);
            }
        }
    }
}
