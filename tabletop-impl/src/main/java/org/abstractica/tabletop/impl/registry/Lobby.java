package org.abstractica.tabletop.impl.registry;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.broadcast.Member;
import org.abstractica.tabletop.impl.broadcast.Topic;
import org.abstractica.tabletop.impl.game.DeckValidator;
import org.abstractica.tabletop.impl.game.Game;
import org.abstractica.tabletop.impl.game.GameRules;
import org.abstractica.tabletop.impl.game.GameState;
import org.abstractica.tabletop.impl.game.InvariantViolationException;
import org.abstractica.tabletop.impl.replay.ReplayCursor;
import org.abstractica.tabletop.impl.replay.ReplayExport;
import org.abstractica.tabletop.impl.replay.ReplayLog;
import org.abstractica.tabletop.impl.replay.ReplayStore;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.GameEvent.GameStatusChanged;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.SequencedEvent;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.abstractica.tabletop.protocol.model.GameSnapshot;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.RoomSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Registry of rooms and live games.
 *
 * <p>Room and game ids come from counters that only grow. The game counter
 * starts above every game recorded in the replay store, so an id is never
 * reused across restarts. The maps are guarded by a read/write lock held
 * only while they are read or changed; rooms and games are never called
 * under it.</p>
 */
public final class Lobby implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(Lobby.class);

    private final ReplayStore replayStore;
    private final GameRules rules;
    private final Executor gameWorkers;
    private final ScheduledExecutorService scheduler;
    private final LobbySettings settings;
    private final Function<EventEnvelope, byte[]> encoder;
    private final Runnable onPublished;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, Room> rooms = new HashMap<>();
    private final Map<Long, Game> games = new HashMap<>();

    private final AtomicLong nextRoomId = new AtomicLong(1);
    private final AtomicLong nextGameId;

    /**
     * Creates a lobby.
     *
     * @param replayStore durable game logs
     * @param rules       game rules shared by every game
     * @param gameWorkers pool running game mailboxes
     * @param scheduler   timer thread for grace periods
     * @param settings    lifetime settings
     * @param encoder     turns event envelopes into frames
     * @param onPublished called once per published event
     */
    public Lobby(
            ReplayStore replayStore,
            GameRules rules,
            Executor gameWorkers,
            ScheduledExecutorService scheduler,
            LobbySettings settings,
            Function<EventEnvelope, byte[]> encoder,
            Runnable onPublished)
    {
        this.replayStore = Objects.requireNonNull(replayStore, "replayStore");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.gameWorkers = Objects.requireNonNull(gameWorkers, "gameWorkers");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.onPublished = Objects.requireNonNull(onPublished, "onPublished");
        this.nextGameId = new AtomicLong(replayStore.maxGameId().orElse(0) + 1);
    }

    // ========== Rooms ==========

    /**
     * Creates a room.
     *
     * @param name        display name
     * @param description free text
     * @param permanent   whether the room survives being empty
     * @return the room
     */
    public Room createRoom(String name, String description, boolean permanent)
    {
        if (name.isBlank())
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Room name must not be blank");
        }
        Room room = new Room(nextRoomId.getAndIncrement(), name, description, permanent, encoder, onPublished);
        lock.writeLock().lock();
        try
        {
            rooms.put(room.getRoomId(), room);
        }
        finally
        {
            lock.writeLock().unlock();
        }
        LOG.info("Room {} '{}' created", room.getRoomId(), name);
        return room;
    }

    /**
     * Destroys a room and its ended games.
     *
     * @param roomId the room
     * @throws ValidationException if the room is unknown or still has running games
     */
    public void destroyRoom(long roomId)
    {
        Room room;
        List<Game> roomGames = new ArrayList<>();
        lock.writeLock().lock();
        try
        {
            room = rooms.get(roomId);
            if (room == null)
            {
                throw new ValidationException(ErrorCode.UNKNOWN_ROOM, "No room " + roomId);
            }
            for (Game game : games.values())
            {
                if (game.getRoomId() == roomId)
                {
                    if (!game.getStatus().isTerminal())
                    {
                        throw new ValidationException(ErrorCode.INVALID_STATE,
                                "Room " + roomId + " has running game " + game.getGameId());
                    }
                    roomGames.add(game);
                }
            }
            rooms.remove(roomId);
            for (Game game : roomGames)
            {
                games.remove(game.getGameId());
            }
        }
        finally
        {
            lock.writeLock().unlock();
        }

        for (Game game : roomGames)
        {
            game.close();
        }
        room.close();
        LOG.info("Room {} destroyed", roomId);
    }

    public Optional<Room> findRoom(long roomId)
    {
        lock.readLock().lock();
        try
        {
            return Optional.ofNullable(rooms.get(roomId));
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    public Room requireRoom(long roomId)
    {
        return findRoom(roomId)
                .orElseThrow(() -> new ValidationException(ErrorCode.UNKNOWN_ROOM, "No room " + roomId));
    }

    public List<Room> getRooms()
    {
        List<Room> list;
        lock.readLock().lock();
        try
        {
            list = new ArrayList<>(rooms.values());
        }
        finally
        {
            lock.readLock().unlock();
        }
        list.sort(Comparator.comparingLong(Room::getRoomId));
        return list;
    }

    public List<RoomSummary> listRooms()
    {
        List<RoomSummary> summaries = new ArrayList<>();
        for (Room room : getRooms())
        {
            summaries.add(room.summary());
        }
        return summaries;
    }

    // ========== Games ==========

    /**
     * Creates a game in a room and seats its creator.
     *
     * <p>The deck is validated before a game id is issued. The command is
     * answered from the new game's mailbox.</p>
     *
     * @param room    the room
     * @param creator the creating member, who must be in the room
     * @param config  table rules
     * @param deck    the creator's deck, if chosen already
     * @param context the CreateGame command
     * @return the new game's id
     */
    public long createGame(Room room, Member creator, GameConfig config, Optional<DeckList> deck, CommandContext context)
    {
        if (!room.isMember(creator.identityId()))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Join room " + room.getRoomId() + " first");
        }
        if (config.name().isBlank())
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Game name must not be blank");
        }
        deck.ifPresent(d -> DeckValidator.validate(config, d));

        long gameId = nextGameId.getAndIncrement();
        Game game = Game.create(
                gameId,
                room.getRoomId(),
                config,
                replayStore.open(gameId),
                rules,
                gameWorkers,
                scheduler,
                settings.disconnectGracePeriod(),
                newTopic(gameId),
                this::gameChanged);
        lock.writeLock().lock();
        try
        {
            games.put(gameId, game);
        }
        finally
        {
            lock.writeLock().unlock();
        }
        game.open(creator, deck, context);
        return gameId;
    }

    public Optional<Game> findGame(long gameId)
    {
        lock.readLock().lock();
        try
        {
            return Optional.ofNullable(games.get(gameId));
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    public Game requireGame(long gameId)
    {
        return findGame(gameId)
                .orElseThrow(() -> new ValidationException(ErrorCode.UNKNOWN_GAME, "No live game " + gameId));
    }

    public List<Game> getGames()
    {
        List<Game> list;
        lock.readLock().lock();
        try
        {
            list = new ArrayList<>(games.values());
        }
        finally
        {
            lock.readLock().unlock();
        }
        list.sort(Comparator.comparingLong(Game::getGameId));
        return list;
    }

    /**
     * Lists the live games a user plays in or watches.
     *
     * @param identityId the user
     * @return summaries ordered by game id
     */
    public List<GameSummary> gamesOf(long identityId)
    {
        List<GameSummary> summaries = new ArrayList<>();
        for (Game game : getGames())
        {
            if (game.isMember(identityId))
            {
                summaries.add(game.getSummary());
            }
        }
        return summaries;
    }

    // ========== Replay ==========

    /**
     * Returns the replay log of a live or recorded game.
     *
     * @param gameId the game
     * @return its log
     * @throws ValidationException if the game was never recorded
     */
    public ReplayLog replayLog(long gameId)
    {
        Optional<Game> live = findGame(gameId);
        if (live.isPresent())
        {
            return live.get().getLog();
        }
        if (!replayStore.exists(gameId))
        {
            throw new ValidationException(ErrorCode.UNKNOWN_GAME, "No game " + gameId);
        }
        return replayStore.open(gameId);
    }

    /**
     * Answers a resync for a game that is no longer live by folding its log.
     *
     * @param gameId       the game
     * @param fromSequence last sequence the caller has, or empty for a snapshot
     * @return a snapshot or event tail
     */
    public Reply coldResync(long gameId, Optional<Long> fromSequence)
    {
        ReplayLog log = replayLog(gameId);
        long last = log.lastSequence();
        if (fromSequence.isPresent())
        {
            long from = fromSequence.get();
            if (from < 0 || from > last)
            {
                throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Sequence " + from + " outside 0.." + last);
            }
            return new Reply.EventTail(gameId, ReplayExport.tail(log, from));
        }
        return new Reply.Snapshot(fold(log).snapshot());
    }

    /**
     * Folds a game's log into a snapshot, whether or not the game is live.
     *
     * @param gameId the game
     * @return the snapshot at the log's last sequence
     */
    public GameSnapshot foldSnapshot(long gameId)
    {
        return fold(replayLog(gameId)).snapshot();
    }

    private static GameState fold(ReplayLog log)
    {
        try (ReplayCursor cursor = log.read(0))
        {
            return GameState.replay(cursor);
        }
    }

    /**
     * Brings back the games that were running when the server stopped.
     *
     * <p>Each unfinished game is folded from its log. Games whose room still
     * exists become live again with every player disconnected and paused
     * until they return; the others are abandoned in their log.</p>
     *
     * @return number of games restored
     */
    public int recover()
    {
        int restored = 0;
        for (long gameId : replayStore.gameIds())
        {
            if (findGame(gameId).isPresent())
            {
                continue;
            }
            ReplayLog log = replayStore.open(gameId);
            GameState state;
            try
            {
                state = fold(log);
            }
            catch (InvariantViolationException e)
            {
                LOG.error("Game {}: replay log cannot be folded, skipping", gameId, e);
                continue;
            }
            if (state.getStatus().isTerminal())
            {
                continue;
            }

            Optional<Room> room = findRoom(state.getRoomId());
            if (room.isEmpty())
            {
                GameEvent abandoned = new GameStatusChanged(GameStatus.ABANDONED, "Room no longer exists", Optional.empty());
                log.append(new SequencedEvent(state.getSequence() + 1, abandoned));
                LOG.warn("Game {}: room {} is gone, game abandoned", gameId, state.getRoomId());
                continue;
            }

            Game game = Game.restore(state, log, rules, gameWorkers, scheduler,
                    settings.disconnectGracePeriod(), newTopic(gameId), this::gameChanged);
            lock.writeLock().lock();
            try
            {
                games.put(gameId, game);
            }
            finally
            {
                lock.writeLock().unlock();
            }
            room.get().gameChanged(game.getSummary());
            game.recover();
            restored++;
        }
        if (restored > 0)
        {
            LOG.info("Recovered {} unfinished games", restored);
        }
        return restored;
    }

    // ========== Lifetimes ==========

    private void gameChanged(Game game)
    {
        findRoom(game.getRoomId()).ifPresent(room -> room.gameChanged(game.getSummary()));
        if (isDisposable(game, System.nanoTime()))
        {
            scheduler.execute(() -> destroyIfDisposable(game.getGameId()));
        }
    }

    private boolean isDisposable(Game game, long nowNanos)
    {
        if (!game.getStatus().isTerminal())
        {
            return false;
        }
        if (game.getMemberIds().isEmpty())
        {
            return true;
        }
        long endedAt = game.getEndedAtNanos();
        return endedAt != 0 && nowNanos - endedAt >= settings.finishedGameRetention().toNanos();
    }

    private void destroyIfDisposable(long gameId)
    {
        findGame(gameId).ifPresent(game ->
        {
            if (isDisposable(game, System.nanoTime()))
            {
                destroyGame(game);
            }
        });
    }

    private void destroyGame(Game game)
    {
        lock.writeLock().lock();
        try
        {
            if (games.get(game.getGameId()) != game)
            {
                return;
            }
            games.remove(game.getGameId());
        }
        finally
        {
            lock.writeLock().unlock();
        }
        findRoom(game.getRoomId()).ifPresent(room -> room.gameRemoved(game.getGameId()));
        game.close();
    }

    /**
     * Destroys ended games past their retention and idle rooms.
     * Called periodically by the server's scheduler.
     */
    public void sweep()
    {
        long now = System.nanoTime();
        for (Game game : getGames())
        {
            if (isDisposable(game, now))
            {
                destroyGame(game);
            }
        }

        long idleTimeout = settings.roomIdleTimeout().toNanos();
        for (Room room : getRooms())
        {
            if (room.isIdle(now, idleTimeout))
            {
                boolean removed;
                lock.writeLock().lock();
                try
                {
                    removed = rooms.remove(room.getRoomId(), room);
                }
                finally
                {
                    lock.writeLock().unlock();
                }
                if (removed)
                {
                    room.close();
                    LOG.info("Room {} removed after being idle", room.getRoomId());
                }
            }
        }
    }

    private Topic newTopic(long gameId)
    {
        return new Topic("game-" + gameId, encoder, onPublished);
    }

    public int getRoomCount()
    {
        lock.readLock().lock();
        try
        {
            return rooms.size();
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    public int getGameCount()
    {
        lock.readLock().lock();
        try
        {
            return games.size();
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    public ReplayStore getReplayStore()
    {
        return replayStore;
    }

    /**
     * Closes every game and room. The replay store stays open.
     */
    @Override
    public void close()
    {
        List<Game> allGames;
        List<Room> allRooms;
        lock.writeLock().lock();
        try
        {
            allGames = new ArrayList<>(games.values());
            allRooms = new ArrayList<>(rooms.values());
            games.clear();
            rooms.clear();
        }
        finally
        {
            lock.writeLock().unlock();
        }
        for (Game game : allGames)
        {
            game.close();
        }
        for (Room room : allRooms)
        {
            room.close();
        }
    }
}
