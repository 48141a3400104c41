package org.abstractica.tabletop.impl.integration;

import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.session.DefaultServer;
import org.abstractica.tabletop.impl.session.DefaultServerFactory;
import org.abstractica.tabletop.impl.transport.LocalChannel;
import org.abstractica.tabletop.impl.transport.LocalTransport;
import org.abstractica.tabletop.protocol.AdminCommand;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.ModerationCommand;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.RoomCommand;
import org.abstractica.tabletop.protocol.RoomEvent;
import org.abstractica.tabletop.protocol.Scope;
import org.abstractica.tabletop.protocol.SessionCommand;
import org.abstractica.tabletop.protocol.model.GameSnapshot;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.LeaveReason;
import org.abstractica.tabletop.protocol.model.ZoneType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.abstractica.tabletop.impl.integration.TestServers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Multi-client game scenarios: rooms, a full duel, reconnects, moderation
 * and administration.
 */
class ScenarioTest
{
    private final LocalTransport transport = new LocalTransport();
    private final List<TestClient> clients = new ArrayList<>();
    private DefaultServer server;

    @AfterEach
    void tearDown()
    {
        for (TestClient client : clients)
        {
            client.close();
        }
        if (server != null)
        {
            server.close();
        }
    }

    private void start(Consumer<DefaultServerFactory.DefaultBuilder> settings)
    {
        DefaultServerFactory.DefaultBuilder builder = TestServers.builder(transport);
        settings.accept(builder);
        server = builder.build();
        server.start();
    }

    private void start()
    {
        start(builder -> {});
    }

    private TestClient login(String user, String secret)
    {
        TestClient client = new TestClient(transport.connect());
        clients.add(client);
        client.login(user, secret);
        return client;
    }

    private static void joinMainRoom(TestClient client)
    {
        client.ok(Scope.ROOM, MAIN_ROOM, new RoomCommand.JoinRoom(), Reply.RoomJoined.class);
    }

    private static Reply.JoinedGame createDuel(TestClient creator)
    {
        return creator.ok(Scope.ROOM, MAIN_ROOM,
                new RoomCommand.CreateGame(DUEL, Optional.of(deck("alice"))), Reply.JoinedGame.class);
    }

    /**
     * Alice creates a duel, Bob joins, both pick decks and get ready.
     *
     * @return the game id
     */
    private static long startDuel(TestClient alice, TestClient bob)
    {
        joinMainRoom(alice);
        long gameId = createDuel(alice).gameId();
        bob.ok(Scope.GAME, gameId, new GameCommand.JoinGame(false), Reply.JoinedGame.class);
        bob.ok(Scope.GAME, gameId, new GameCommand.SelectDeck(deck("bob")), Reply.Ack.class);
        alice.ok(Scope.GAME, gameId, new GameCommand.SetReady(true), Reply.Ack.class);
        bob.ok(Scope.GAME, gameId, new GameCommand.SetReady(true), Reply.Ack.class);
        alice.awaitEvent(GameEvent.GameStarted.class);
        bob.awaitEvent(GameEvent.GameStarted.class);
        return gameId;
    }

    private static void assertContiguousFrom(long firstSequence, List<EventEnvelope> events)
    {
        long expected = firstSequence;
        for (EventEnvelope envelope : events)
        {
            assertEquals(expected, envelope.sequence(), "sequence gap in " + events);
            expected++;
        }
    }

    // ========== Rooms ==========

    @Test
    void room_membersSeeEachOtherAndChat()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        joinMainRoom(alice);

        Reply.RoomJoined joined = bob.ok(Scope.ROOM, MAIN_ROOM, new RoomCommand.JoinRoom(), Reply.RoomJoined.class);
        assertEquals(2, joined.members().size());
        assertEquals(BOB, alice.awaitEvent(RoomEvent.UserJoinedRoom.class).user().identityId());

        bob.ok(Scope.ROOM, MAIN_ROOM, new RoomCommand.RoomSay("hi all"), Reply.Ack.class);

        RoomEvent.RoomChat chat = alice.awaitEvent(RoomEvent.RoomChat.class);
        assertEquals(BOB, chat.identityId());
        assertEquals("bob", chat.name());
        assertEquals("hi all", chat.text());

        bob.ok(Scope.ROOM, MAIN_ROOM, new RoomCommand.LeaveRoom(), Reply.Ack.class);
        assertEquals(BOB, alice.awaitEvent(RoomEvent.UserLeftRoom.class).identityId());
    }

    @Test
    void room_slowSubscriberDropped_othersReceiveEveryEvent()
    {
        start(builder -> builder.maxOutboundQueue(4));
        TestClient alice = login("alice", "a");
        LocalChannel slowChannel = transport.connect();
        TestClient bob = new TestClient(slowChannel);
        clients.add(bob);
        bob.login("bob", "b");
        TestClient carol = login("carol", "c");
        joinMainRoom(alice);
        joinMainRoom(bob);
        joinMainRoom(carol);

        slowChannel.pause();
        for (int i = 0; i < 10; i++)
        {
            carol.ok(Scope.ROOM, MAIN_ROOM, new RoomCommand.RoomSay("m" + i), Reply.Ack.class);
        }

        assertEquals(BOB, alice.awaitEvent(RoomEvent.UserLeftRoom.class, e -> e.identityId() == BOB).identityId());
        eventually("ten chat lines", () -> chatFrom(alice, CAROL).size() == 10);
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9"), chatFrom(alice, CAROL));
        assertEquals(10, chatFrom(carol, CAROL).size());
        assertEquals(1, server.getStats().getOverflowDisconnects());
        eventually("slow session removed", () -> server.getSessions().size() == 2);
        slowChannel.resume();
    }

    private static List<String> chatFrom(TestClient client, long identityId)
    {
        List<String> lines = new ArrayList<>();
        for (EventEnvelope envelope : client.events())
        {
            if (envelope.payload() instanceof RoomEvent.RoomChat chat && chat.identityId() == identityId)
            {
                lines.add(chat.text());
            }
        }
        return lines;
    }

    @Test
    void room_nonMemberAndUnknownRoom_rejected()
    {
        start();
        TestClient carol = login("carol", "c");

        assertEquals(ErrorCode.NOT_A_MEMBER, carol.error(Scope.ROOM, MAIN_ROOM, new RoomCommand.RoomSay("hello")));
        assertEquals(ErrorCode.NOT_A_MEMBER, carol.error(Scope.ROOM, MAIN_ROOM,
                new RoomCommand.CreateGame(DUEL, Optional.empty())));
        assertEquals(ErrorCode.UNKNOWN_ROOM, carol.error(Scope.ROOM, 99L, new RoomCommand.JoinRoom()));
        assertEquals(ErrorCode.UNKNOWN_GAME, carol.error(Scope.GAME, 99L, new GameCommand.JoinGame(false)));
    }

    @Test
    void room_disconnectedMemberIsRemoved()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        joinMainRoom(alice);
        joinMainRoom(bob);

        bob.close();

        assertEquals(BOB, alice.awaitEvent(RoomEvent.UserLeftRoom.class).identityId());
    }

    // ========== A full duel ==========

    @Test
    void duel_everyoneSeesTheSameOrderedEvents()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        joinMainRoom(alice);
        joinMainRoom(bob);

        Reply.JoinedGame created = createDuel(alice);
        long gameId = created.gameId();
        assertEquals(0, created.seat());
        assertEquals(gameId, bob.awaitEvent(RoomEvent.GameListed.class).game().gameId());

        Reply.JoinedGame bobJoined = bob.ok(Scope.GAME, gameId, new GameCommand.JoinGame(false), Reply.JoinedGame.class);
        assertEquals(1, bobJoined.seat());
        bob.ok(Scope.GAME, gameId, new GameCommand.SelectDeck(deck("bob")), Reply.Ack.class);
        alice.ok(Scope.GAME, gameId, new GameCommand.SetReady(true), Reply.Ack.class);
        bob.ok(Scope.GAME, gameId, new GameCommand.SetReady(true), Reply.Ack.class);

        GameEvent.GameStarted started = alice.awaitEvent(GameEvent.GameStarted.class);
        assertEquals(started, bob.awaitEvent(GameEvent.GameStarted.class));
        long active = started.firstPlayer();
        TestClient first = active == ALICE ? alice : bob;

        first.ok(Scope.GAME, gameId, new GameCommand.DrawCards(1), Reply.Ack.class);
        first.ok(Scope.GAME, gameId, new GameCommand.AdvancePhase(), Reply.Ack.class);
        first.ok(Scope.GAME, gameId, new GameCommand.GameSay("gg"), Reply.Ack.class);
        alice.awaitEvent(GameEvent.GameChat.class);
        bob.awaitEvent(GameEvent.GameChat.class);

        List<EventEnvelope> aliceEvents = alice.gameEvents(gameId);
        List<EventEnvelope> bobEvents = bob.gameEvents(gameId);
        assertContiguousFrom(created.sequence() + 1, aliceEvents);
        assertContiguousFrom(bobJoined.sequence() + 1, bobEvents);
        assertEquals(bobEvents, aliceEvents.subList(aliceEvents.size() - bobEvents.size(), aliceEvents.size()));

        GameSnapshot snapshot = alice.ok(Scope.GAME, gameId,
                new GameCommand.Resync(Optional.empty()), Reply.Snapshot.class).snapshot();
        assertEquals(GameStatus.IN_PROGRESS, snapshot.status());
        assertEquals(aliceEvents.get(aliceEvents.size() - 1).sequence(), snapshot.sequence());
        assertEquals(2, snapshot.players().size());
        assertEquals(Optional.of(active), snapshot.activePlayer());
    }

    @Test
    void duel_replayExportAndTail()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        long gameId = startDuel(alice, bob);
        alice.ok(Scope.GAME, gameId, new GameCommand.GameSay("ready?"), Reply.Ack.class);
        bob.awaitEvent(GameEvent.GameChat.class);
        long last = alice.ok(Scope.GAME, gameId, new GameCommand.Resync(Optional.empty()), Reply.Snapshot.class)
                .snapshot().sequence();

        Reply.ReplayChunk all = bob.ok(Scope.GAME, gameId, new GameCommand.ExportReplay(0, 1000), Reply.ReplayChunk.class);
        assertEquals(last, all.events().size());
        assertEquals(last, all.lastSequence());
        assertTrue(all.complete());
        assertInstanceOf(GameEvent.GameCreated.class, all.events().get(0).event());

        Reply.ReplayChunk page = bob.ok(Scope.GAME, gameId, new GameCommand.ExportReplay(0, 2), Reply.ReplayChunk.class);
        assertEquals(2, page.events().size());
        assertEquals(2, page.events().get(1).sequence());
        assertEquals(last, page.lastSequence());
        assertFalse(page.complete());

        Reply.EventTail tail = bob.ok(Scope.GAME, gameId,
                new GameCommand.Resync(Optional.of(last - 1)), Reply.EventTail.class);
        assertEquals(1, tail.events().size());
        assertEquals(last, tail.events().get(0).sequence());
    }

    @Test
    void duel_gameCommandsCheckMembershipAndTurn()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        TestClient carol = login("carol", "c");
        long gameId = startDuel(alice, bob);
        long active = alice.awaitEvent(GameEvent.GameStarted.class).firstPlayer();
        TestClient waiting = active == ALICE ? bob : alice;

        assertEquals(ErrorCode.NOT_A_MEMBER, carol.error(Scope.GAME, gameId, new GameCommand.DrawCards(1)));
        assertEquals(ErrorCode.INVALID_STATE, carol.error(Scope.GAME, gameId, new GameCommand.JoinGame(false)));
        assertEquals(ErrorCode.NOT_YOUR_TURN, waiting.error(Scope.GAME, gameId, new GameCommand.PassTurn()));

        carol.ok(Scope.GAME, gameId, new GameCommand.JoinGame(true), Reply.JoinedGame.class);
        alice.ok(Scope.GAME, gameId, new GameCommand.DrawCards(1), Reply.Ack.class);
        assertEquals(ALICE, carol.awaitEvent(GameEvent.CardMoved.class).to().ownerId());
        assertEquals(ZoneType.HAND, carol.awaitEvent(GameEvent.CardMoved.class).to().type());
    }

    @Test
    void duel_concede_finishesWithWinner()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        long gameId = startDuel(alice, bob);

        bob.ok(Scope.GAME, gameId, new GameCommand.Concede(), Reply.Ack.class);

        GameEvent.GameStatusChanged finished = alice.awaitEvent(GameEvent.GameStatusChanged.class,
                e -> e.status() == GameStatus.FINISHED);
        assertEquals(Optional.of(ALICE), finished.winner());
        Reply.GameList mine = alice.ok(Scope.SESSION, null, new SessionCommand.ListMyGames(), Reply.GameList.class);
        assertEquals(GameStatus.FINISHED, mine.games().get(0).status());
    }

    // ========== Reconnects ==========

    @Test
    void reconnect_withinGrace_resumesGame()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        long gameId = startDuel(alice, bob);

        bob.close();

        assertEquals(BOB, alice.awaitEvent(GameEvent.PlayerDisconnected.class).playerId());
        alice.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.PAUSED);
        assertEquals(ErrorCode.INVALID_STATE, alice.error(Scope.GAME, gameId, new GameCommand.DrawCards(1)));

        TestClient bobAgain = login("bob", "b");
        GameSnapshot snapshot = bobAgain.ok(Scope.GAME, gameId,
                new GameCommand.Resync(Optional.empty()), Reply.Snapshot.class).snapshot();

        assertEquals(BOB, alice.awaitEvent(GameEvent.PlayerReconnected.class).playerId());
        alice.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.IN_PROGRESS
                && e.reason().equals("All players connected"));
        assertEquals(GameStatus.IN_PROGRESS, snapshot.status());
        alice.ok(Scope.GAME, gameId, new GameCommand.DrawCards(1), Reply.Ack.class);
        bobAgain.awaitEvent(GameEvent.CardMoved.class);
    }

    @Test
    void reconnect_afterGrace_gameAbandoned()
    {
        start(builder -> builder.disconnectGracePeriod(Duration.ofMillis(300)));
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        long gameId = startDuel(alice, bob);

        bob.close();

        GameEvent.GameStatusChanged abandoned = alice.awaitEvent(GameEvent.GameStatusChanged.class,
                e -> e.status() == GameStatus.ABANDONED);
        assertEquals("Player bob did not reconnect", abandoned.reason());
        TestClient bobAgain = login("bob", "b");
        assertEquals(ErrorCode.INVALID_STATE, bobAgain.error(Scope.GAME, gameId, new GameCommand.DrawCards(1)));
    }

    // ========== Moderation ==========

    @Test
    void kickUser_acksThenDisconnectsTarget()
    {
        start();
        TestClient mod = login("mod", "m");
        TestClient bob = login("bob", "b");

        mod.ok(Scope.MODERATION, null, new ModerationCommand.KickUser(BOB, "spam"), Reply.Ack.class);

        Disconnect disconnect = bob.awaitDisconnect();
        assertEquals(Disconnect.DisconnectCode.KICKED, disconnect.reasonCode());
        assertEquals("spam", disconnect.message());
        assertEquals(ErrorCode.UNKNOWN_USER,
                mod.error(Scope.MODERATION, null, new ModerationCommand.KickUser(99, "")));
    }

    @Test
    void kickUser_higherPrivilege_denied()
    {
        start();
        TestClient mod = login("mod", "m");
        TestClient alice = login("alice", "a");

        assertEquals(ErrorCode.PERMISSION_DENIED,
                mod.error(Scope.MODERATION, null, new ModerationCommand.KickUser(ALICE, "")));
        alice.ok(Scope.SESSION, null, new SessionCommand.Ping(1), Reply.Pong.class);
        assertFalse(alice.isClosed());
    }

    @Test
    void kickFromGame_removesPlayer()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        TestClient mod = login("mod", "m");
        joinMainRoom(alice);
        long gameId = createDuel(alice).gameId();
        bob.ok(Scope.GAME, gameId, new GameCommand.JoinGame(false), Reply.JoinedGame.class);

        mod.ok(Scope.MODERATION, null, new ModerationCommand.KickFromGame(gameId, BOB), Reply.Ack.class);

        GameEvent.PlayerLeft left = alice.awaitEvent(GameEvent.PlayerLeft.class);
        assertEquals(BOB, left.playerId());
        assertEquals(LeaveReason.KICKED, left.reason());
        assertEquals(ErrorCode.NOT_A_MEMBER, bob.error(Scope.GAME, gameId, new GameCommand.SetReady(false)));
    }

    @Test
    void kickFromGame_disconnectedPlayerOfThree_resumesGame()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        TestClient carol = login("carol", "c");
        TestClient mod = login("mod", "m");
        joinMainRoom(alice);
        long gameId = alice.ok(Scope.ROOM, MAIN_ROOM,
                new RoomCommand.CreateGame(THREE_WAY, Optional.of(deck("alice"))), Reply.JoinedGame.class).gameId();
        for (TestClient player : List.of(bob, carol))
        {
            player.ok(Scope.GAME, gameId, new GameCommand.JoinGame(false), Reply.JoinedGame.class);
        }
        bob.ok(Scope.GAME, gameId, new GameCommand.SelectDeck(deck("bob")), Reply.Ack.class);
        carol.ok(Scope.GAME, gameId, new GameCommand.SelectDeck(deck("carol")), Reply.Ack.class);
        for (TestClient player : List.of(alice, bob, carol))
        {
            player.ok(Scope.GAME, gameId, new GameCommand.SetReady(true), Reply.Ack.class);
        }
        alice.awaitEvent(GameEvent.GameStarted.class);

        carol.close();
        alice.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.PAUSED);

        mod.ok(Scope.MODERATION, null, new ModerationCommand.KickFromGame(gameId, CAROL), Reply.Ack.class);

        alice.awaitEvent(GameEvent.PlayerLeft.class, e -> e.playerId() == CAROL);
        bob.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.IN_PROGRESS
                && e.reason().equals("All players connected"));
        GameSnapshot snapshot = alice.ok(Scope.GAME, gameId,
                new GameCommand.Resync(Optional.empty()), Reply.Snapshot.class).snapshot();
        assertEquals(GameStatus.IN_PROGRESS, snapshot.status());
    }

    // ========== Administration ==========

    @Test
    void admin_roomLifecycle()
    {
        start();
        TestClient alice = login("alice", "a");

        Reply.RoomCreated created = alice.ok(Scope.ADMIN, null,
                new AdminCommand.CreateRoom("Draft", "Draft tables"), Reply.RoomCreated.class);
        assertEquals(2, created.room().roomId());
        assertFalse(created.room().permanent());
        assertEquals(2, alice.ok(Scope.SESSION, null, new SessionCommand.ListRooms(), Reply.RoomList.class).rooms().size());

        joinMainRoom(alice);
        long gameId = createDuel(alice).gameId();
        assertEquals(ErrorCode.INVALID_STATE, alice.error(Scope.ADMIN, null, new AdminCommand.DestroyRoom(MAIN_ROOM)));

        alice.ok(Scope.ADMIN, null, new AdminCommand.AbandonGame(gameId, ""), Reply.Ack.class);
        assertEquals("Abandoned by administrator", alice.awaitEvent(GameEvent.GameStatusChanged.class,
                e -> e.status() == GameStatus.ABANDONED).reason());
        alice.ok(Scope.ADMIN, null, new AdminCommand.DestroyRoom(MAIN_ROOM), Reply.Ack.class);

        assertEquals(ErrorCode.UNKNOWN_ROOM, alice.error(Scope.ADMIN, null, new AdminCommand.DestroyRoom(MAIN_ROOM)));
        assertEquals(ErrorCode.UNKNOWN_GAME, alice.error(Scope.GAME, gameId, new GameCommand.DrawCards(1)));
        assertEquals(1, alice.ok(Scope.SESSION, null, new SessionCommand.ListRooms(), Reply.RoomList.class).rooms().size());
    }

    @Test
    void admin_pauseAndResume()
    {
        start();
        TestClient alice = login("alice", "a");
        TestClient bob = login("bob", "b");
        long gameId = startDuel(alice, bob);

        alice.ok(Scope.ADMIN, null, new AdminCommand.PauseGame(gameId), Reply.Ack.class);

        bob.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.PAUSED);
        assertEquals(ErrorCode.INVALID_STATE, bob.error(Scope.GAME, gameId, new GameCommand.DrawCards(1)));
        assertEquals(ErrorCode.INVALID_STATE, alice.error(Scope.ADMIN, null, new AdminCommand.PauseGame(gameId)));

        alice.ok(Scope.ADMIN, null, new AdminCommand.ResumeGame(gameId), Reply.Ack.class);

        bob.awaitEvent(GameEvent.GameStatusChanged.class, e -> e.status() == GameStatus.IN_PROGRESS
                && e.reason().equals("Resumed"));
        bob.ok(Scope.GAME, gameId, new GameCommand.DrawCards(1), Reply.Ack.class);
    }
}
