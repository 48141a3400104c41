package org.abstractica.tabletop.impl.registry;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.broadcast.FakeMember;
import org.abstractica.tabletop.impl.game.Game;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.game.RecordingContext;
import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.replay.InMemoryReplayStore;
import org.abstractica.tabletop.impl.replay.ReplayExport;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.RoomEvent;
import org.abstractica.tabletop.protocol.SequencedEvent;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Lobby}.
 */
class LobbyTest
{
    private static final GameConfig CONFIG = new GameConfig("duel", 2, 2, 20, 2, 3, 10, 2, true);

    private final EnvelopeCodec codec = new EnvelopeCodec(DefaultProtocol.tabletop());

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private InMemoryReplayStore store;
    private Lobby lobby;

    private FakeMember alice;
    private FakeMember bob;

    @BeforeEach
    void setUp()
    {
        workers = Executors.newFixedThreadPool(2);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        store = new InMemoryReplayStore();
        lobby = newLobby(LobbySettings.defaults());
        alice = new FakeMember(1, "alice");
        bob = new FakeMember(2, "bob");
    }

    @AfterEach
    void tearDown() throws Exception
    {
        lobby.close();
        scheduler.shutdownNow();
        workers.shutdown();
        assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));
    }

    private Lobby newLobby(LobbySettings settings)
    {
        return new Lobby(store, new GameRules(new Random(1)), workers, scheduler, settings, codec::eventBytes, () -> {});
    }

    private static DeckList deck(String prefix)
    {
        return DeckList.of(List.of(prefix + "-1", prefix + "-2", prefix + "-3"));
    }

    private static void enter(Room room, FakeMember member)
    {
        RecordingContext context = new RecordingContext(room.getRoomId());
        room.join(member, context);
        context.awaitReply();
    }

    private static Reply submit(Game game, FakeMember member, GameCommand command)
    {
        RecordingContext context = new RecordingContext(game.getGameId());
        game.submit(member, command, context);
        return context.awaitReply();
    }

    private static void assertRejected(ErrorCode expected, Executable action)
    {
        ValidationException e = assertThrows(ValidationException.class, action);
        assertEquals(expected, e.getCode());
    }

    private static void await(BooleanSupplier condition, String description) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
            {
                fail("Timed out waiting until " + description);
            }
            Thread.sleep(10);
        }
    }

    /**
     * Creates a game in the room with alice and bob seated and ready.
     */
    private Game startDuel(Lobby target, Room room)
    {
        RecordingContext created = new RecordingContext(room.getRoomId());
        long gameId = target.createGame(room, alice, CONFIG, Optional.of(deck("alice")), created);
        created.awaitReply();
        Game game = target.requireGame(gameId);
        submit(game, bob, new GameCommand.JoinGame(false));
        submit(game, bob, new GameCommand.SelectDeck(deck("bob")));
        submit(game, alice, new GameCommand.SetReady(true));
        submit(game, bob, new GameCommand.SetReady(true));
        return game;
    }

    // ========== Rooms ==========

    @Test
    void createRoom_assignsIncreasingIds()
    {
        Room lobbyRoom = lobby.createRoom("Lobby", "Main room", true);
        Room casual = lobby.createRoom("Casual", "", false);

        assertEquals(1, lobbyRoom.getRoomId());
        assertEquals(2, casual.getRoomId());
        assertEquals(List.of("Lobby", "Casual"), lobby.listRooms().stream().map(r -> r.name()).toList());
        assertSame(casual, lobby.requireRoom(2));
        assertRejected(ErrorCode.UNKNOWN_ROOM, () -> lobby.requireRoom(3));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> lobby.createRoom(" ", "", false));
    }

    @Test
    void destroyRoom_withRunningGame_rejected()
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);
        RecordingContext context = new RecordingContext(room.getRoomId());
        lobby.createGame(room, alice, CONFIG, Optional.empty(), context);
        context.awaitReply();

        assertRejected(ErrorCode.INVALID_STATE, () -> lobby.destroyRoom(room.getRoomId()));
        assertRejected(ErrorCode.UNKNOWN_ROOM, () -> lobby.destroyRoom(99));
        assertEquals(1, lobby.getRoomCount());
    }

    @Test
    void destroyRoom_emptyRoom_detachesMembers()
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);

        lobby.destroyRoom(room.getRoomId());

        assertTrue(lobby.findRoom(room.getRoomId()).isEmpty());
        assertFalse(room.isMember(alice.identityId()));
    }

    // ========== Games ==========

    @Test
    void createGame_requiresRoomMembership()
    {
        Room room = lobby.createRoom("Casual", "", false);

        assertRejected(ErrorCode.NOT_A_MEMBER,
                () -> lobby.createGame(room, alice, CONFIG, Optional.empty(), new RecordingContext()));
        assertEquals(0, lobby.getGameCount());
    }

    @Test
    void createGame_invalidDeck_doesNotUseAnId()
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);

        assertRejected(ErrorCode.INVALID_DECK_LIST, () -> lobby.createGame(room, alice, CONFIG,
                Optional.of(DeckList.of(List.of("one"))), new RecordingContext()));

        RecordingContext context = new RecordingContext(room.getRoomId());
        long gameId = lobby.createGame(room, alice, CONFIG, Optional.empty(), context);
        assertEquals(1, gameId);
        assertEquals(new Reply.JoinedGame(1, 0, 2), context.awaitReply());
    }

    @Test
    void createGame_listedInRoom() throws Exception
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);
        enter(room, bob);

        Game game = startDuel(lobby, room);

        await(() -> room.listGames().size() == 1 && room.listGames().get(0).status() == GameStatus.IN_PROGRESS,
                "the room lists the running game");
        List<RoomEvent> seen = bob.events(codec, RoomEvent.class);
        assertTrue(seen.stream().anyMatch(e -> e instanceof RoomEvent.GameListed));
        assertEquals(List.of(game.getSummary()), lobby.gamesOf(bob.identityId()));
        assertEquals(List.of(), lobby.gamesOf(99));
    }

    @Test
    void gameIds_continueAfterRecordedGames()
    {
        store.open(7).append(new SequencedEvent(1, new GameEvent.GameCreated(7, 1, CONFIG, 1)));
        Lobby later = newLobby(LobbySettings.defaults());
        Room room = later.createRoom("Casual", "", false);
        enter(room, alice);

        long gameId = later.createGame(room, alice, CONFIG, Optional.empty(), new RecordingContext());

        assertEquals(8, gameId);
        later.close();
    }

    // ========== Lifetimes ==========

    @Test
    void endedGame_destroyedAfterRetention() throws Exception
    {
        Lobby quick = newLobby(new LobbySettings(Duration.ofMinutes(2), Duration.ZERO, Duration.ofMinutes(5)));
        Room room = quick.createRoom("Casual", "", false);
        enter(room, alice);
        enter(room, bob);
        Game game = startDuel(quick, room);

        submit(game, bob, new GameCommand.Concede());

        await(() -> quick.findGame(game.getGameId()).isEmpty(), "the finished game is destroyed");
        await(() -> room.listGames().isEmpty(), "the game is unlisted");
        assertTrue(alice.events(codec, RoomEvent.class).stream().anyMatch(e -> e instanceof RoomEvent.GameUnlisted));

        // the record outlives the live game
        Reply resync = quick.coldResync(game.getGameId(), Optional.empty());
        Reply.Snapshot snapshot = assertInstanceOf(Reply.Snapshot.class, resync);
        assertEquals(GameStatus.FINISHED, snapshot.snapshot().status());
        assertEquals(Optional.of(1L), snapshot.snapshot().winner());
        quick.close();
    }

    @Test
    void sweep_removesIdleRoomsOnly()
    {
        Lobby quick = newLobby(new LobbySettings(Duration.ofMinutes(2), Duration.ofMinutes(30), Duration.ZERO));
        quick.createRoom("Lobby", "", true);
        Room casual = quick.createRoom("Casual", "", false);
        Room busy = quick.createRoom("Busy", "", false);
        enter(busy, alice);

        quick.sweep();

        assertEquals(List.of("Lobby", "Busy"), quick.listRooms().stream().map(r -> r.name()).toList());
        assertTrue(quick.findRoom(casual.getRoomId()).isEmpty());
        quick.close();
    }

    // ========== Replay ==========

    @Test
    void coldResync_tailAndErrors()
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);
        RecordingContext context = new RecordingContext();
        long gameId = lobby.createGame(room, alice, CONFIG, Optional.empty(), context);
        context.awaitReply();

        Reply.EventTail tail = assertInstanceOf(Reply.EventTail.class, lobby.coldResync(gameId, Optional.of(1L)));

        assertEquals(1, tail.events().size());
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> lobby.coldResync(gameId, Optional.of(5L)));
        assertRejected(ErrorCode.UNKNOWN_GAME, () -> lobby.coldResync(42, Optional.empty()));
        assertEquals(2, lobby.foldSnapshot(gameId).sequence());
    }

    // ========== Recovery ==========

    @Test
    void recover_restoresUnfinishedGamePaused() throws Exception
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);
        Game game = startDuel(lobby, room);
        long gameId = game.getGameId();
        lobby.close();

        lobby = newLobby(LobbySettings.defaults());
        Room again = lobby.createRoom("Casual", "", false);

        assertEquals(1, lobby.recover());

        Game restored = lobby.requireGame(gameId);
        await(() -> restored.getStatus() == GameStatus.PAUSED, "the restored game waits for its players");
        assertEquals(1, again.listGames().size());
        assertEquals(0, lobby.recover());

        FakeMember aliceAgain = new FakeMember(1, "alice");
        submit(restored, aliceAgain, new GameCommand.JoinGame(false));
        FakeMember bobAgain = new FakeMember(2, "bob");
        submit(restored, bobAgain, new GameCommand.JoinGame(false));
        assertEquals(GameStatus.IN_PROGRESS, restored.getStatus());
    }

    @Test
    void recover_roomGone_abandonsInLog()
    {
        Room room = lobby.createRoom("Casual", "", false);
        enter(room, alice);
        long gameId = startDuel(lobby, room).getGameId();
        lobby.close();

        lobby = newLobby(LobbySettings.defaults());

        assertEquals(0, lobby.recover());
        List<SequencedEvent> events = ReplayExport.tail(store.open(gameId), 0);
        assertEquals(new GameEvent.GameStatusChanged(GameStatus.ABANDONED, "Room no longer exists", Optional.empty()),
                events.get(events.size() - 1).event());
        assertEquals(0, lobby.recover());
        assertEquals(0, lobby.getGameCount());
    }
}
