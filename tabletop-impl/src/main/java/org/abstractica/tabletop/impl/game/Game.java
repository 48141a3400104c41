package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.handlers.CommandContext;
import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.impl.broadcast.Member;
import org.abstractica.tabletop.impl.broadcast.Topic;
import org.abstractica.tabletop.impl.concurrent.SerialExecutor;
import org.abstractica.tabletop.impl.replay.ReplayCursor;
import org.abstractica.tabletop.impl.replay.ReplayExport;
import org.abstractica.tabletop.impl.replay.ReplayLog;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameCommand.JoinGame;
import org.abstractica.tabletop.protocol.GameCommand.LeaveGame;
import org.abstractica.tabletop.protocol.GameCommand.Resync;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.GameEvent.DeckSelected;
import org.abstractica.tabletop.protocol.GameEvent.GameCreated;
import org.abstractica.tabletop.protocol.GameEvent.GameStatusChanged;
import org.abstractica.tabletop.protocol.GameEvent.PlayerJoined;
import org.abstractica.tabletop.protocol.GameEvent.PlayerLeft;
import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.SequencedEvent;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.LeaveReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A live game: its state, event log, subscribers and mailbox.
 *
 * <p>Every operation is queued on the game's mailbox, a {@link SerialExecutor}
 * over the shared game worker pool, so operations on one game run one at a
 * time in arrival order while different games run in parallel. Each accepted
 * operation commits its events in three steps per event: append to the
 * replay log, fold into the state, publish to subscribers. The command's
 * reply is sent after its events.</p>
 */
public final class Game
{
    private static final Logger LOG = LoggerFactory.getLogger(Game.class);

    private final long gameId;
    private final long roomId;
    private final GameConfig config;
    private final ReplayLog log;
    private final GameRules rules;
    private final SerialExecutor mailbox;
    private final ScheduledExecutorService scheduler;
    private final Duration gracePeriod;
    private final Topic topic;
    private final GameListener listener;

    // ========== Mailbox-confined state ==========

    private GameState state;
    private final Map<Long, Member> attached = new HashMap<>();
    private final Map<Long, ScheduledFuture<?>> graceTimers = new HashMap<>();
    private boolean logFailed;
    private boolean closed;

    // ========== Published for other threads ==========

    private volatile GameSummary summary;
    private volatile Set<Long> memberIds = Set.of();
    private volatile long endedAtNanos;

    private Game(
            long gameId,
            long roomId,
            GameConfig config,
            ReplayLog log,
            GameRules rules,
            Executor workers,
            ScheduledExecutorService scheduler,
            Duration gracePeriod,
            Topic topic,
            GameListener listener)
    {
        this.gameId = gameId;
        this.roomId = roomId;
        this.config = Objects.requireNonNull(config, "config");
        this.log = Objects.requireNonNull(log, "log");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.mailbox = new SerialExecutor(workers, "game-" + gameId);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.summary = new GameSummary(gameId, roomId, config.name(), GameStatus.SETUP, 0, config.maxPlayers(), 0);
    }

    /**
     * Creates a new, empty game. {@link #open} must be the first call.
     */
    public static Game create(
            long gameId,
            long roomId,
            GameConfig config,
            ReplayLog log,
            GameRules rules,
            Executor workers,
            ScheduledExecutorService scheduler,
            Duration gracePeriod,
            Topic topic,
            GameListener listener)
    {
        return new Game(gameId, roomId, config, log, rules, workers, scheduler, gracePeriod, topic, listener);
    }

    /**
     * Resumes a game folded from its replay log after a restart.
     */
    public static Game restore(
            GameState recovered,
            ReplayLog log,
            GameRules rules,
            Executor workers,
            ScheduledExecutorService scheduler,
            Duration gracePeriod,
            Topic topic,
            GameListener listener)
    {
        Game game = new Game(recovered.getGameId(), recovered.getRoomId(), recovered.getConfig(), log, rules,
                workers, scheduler, gracePeriod, topic, listener);
        game.state = recovered;
        game.publishViews();
        if (recovered.getStatus().isTerminal())
        {
            game.endedAtNanos = System.nanoTime();
        }
        return game;
    }

    // ========== Operations ==========

    /**
     * Records the game's creation and seats its creator.
     *
     * @param creator the creating user
     * @param deck    the creator's deck, already validated
     * @param context the CreateGame command, answered with {@link Reply.JoinedGame}
     */
    public void open(Member creator, Optional<DeckList> deck, CommandContext context)
    {
        mailbox.execute(() -> guarded(context, () ->
        {
            if (state != null)
            {
                throw new IllegalStateException("Game " + gameId + " is already open");
            }
            GameCreated created = new GameCreated(gameId, roomId, config, creator.identityId());
            log.append(new SequencedEvent(1, created));
            state = GameState.created(created);
            topic.publish(EventEnvelope.game(gameId, 1, created));
            LOG.info("Game {} '{}' created in room {} by {}", gameId, config.name(), roomId, creator.displayName());

            List<GameEvent> events = new ArrayList<>(rules.join(state, creator.userView(), false));
            deck.ifPresent(d -> events.add(new DeckSelected(creator.identityId(), d)));
            if (!commit(events))
            {
                context.fail(ErrorCode.INTERNAL_ERROR, "Game " + gameId + " failed");
                return;
            }
            attach(creator);
            context.reply(new Reply.JoinedGame(gameId, seatOf(events), state.getSequence()));
        }));
    }

    /**
     * Handles a game-scope command from a user.
     *
     * @param member  the issuing member
     * @param command the command
     * @param context its context
     */
    public void submit(Member member, GameCommand command, CommandContext context)
    {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(command, "command");
        mailbox.execute(() -> guarded(context, () ->
        {
            if (command instanceof JoinGame join)
            {
                join(member, join.spectator(), context);
            }
            else if (command instanceof LeaveGame)
            {
                completeWith(context, rules.leave(state, member.identityId(), LeaveReason.LEFT));
            }
            else if (command instanceof Resync resync)
            {
                resync(member, resync.fromSequence(), context);
            }
            else
            {
                completeWith(context, rules.decide(state, member.identityId(), command));
            }
        }));
    }

    /**
     * Removes a user on a moderator's request.
     */
    public void kick(long identityId, CommandContext context)
    {
        mailbox.execute(() -> guarded(context, () ->
        {
            LOG.info("Game {}: kicking {}", gameId, identityId);
            completeWith(context, rules.leave(state, identityId, LeaveReason.KICKED));
        }));
    }

    public void adminPause(CommandContext context)
    {
        mailbox.execute(() -> guarded(context, () -> completeWith(context, rules.adminPause(state))));
    }

    public void adminResume(CommandContext context)
    {
        mailbox.execute(() -> guarded(context, () -> completeWith(context, rules.adminResume(state))));
    }

    public void abandon(String reason, CommandContext context)
    {
        mailbox.execute(() -> guarded(context, () -> completeWith(context, rules.abandon(state, reason))));
    }

    /**
     * Handles the end of a member's connection. A player is marked
     * disconnected and gets a grace period to come back; a spectator leaves.
     *
     * @param member the member whose connection ended
     */
    public void connectionLost(Member member)
    {
        mailbox.execute(() ->
        {
            topic.unsubscribe(member.subscriberId());
            if (closed || state == null)
            {
                return;
            }
            long id = member.identityId();
            Member current = attached.get(id);
            if (current == null || !current.subscriberId().equals(member.subscriberId()))
            {
                // a newer session already took over
                return;
            }
            attached.remove(id);

            if (state.isSpectator(id))
            {
                commit(rules.leave(state, id, LeaveReason.LEFT));
                return;
            }
            commit(rules.connectionLost(state, id));
            armGraceTimer(id);
        });
    }

    /**
     * Marks every player of a restored game as disconnected and starts their
     * grace periods. Called once after {@link #restore}.
     */
    public void recover()
    {
        mailbox.execute(() ->
        {
            if (state.getStatus().isTerminal())
            {
                return;
            }
            for (PlayerState player : state.seatOrder())
            {
                commit(rules.connectionLost(state, player.getPlayerId()));
            }
            for (PlayerState player : state.seatOrder())
            {
                armGraceTimer(player.getPlayerId());
            }
            LOG.info("Game {} recovered at sequence {} ({})", gameId, state.getSequence(), state.getStatus());
        });
    }

    /**
     * Runs a read-only query against the state inside the mailbox.
     *
     * @param query the query; must not retain or mutate the state
     * @param <T>   result type
     * @return the result, completed once the mailbox reaches the query
     */
    public <T> CompletableFuture<T> query(Function<GameState, T> query)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        mailbox.execute(() ->
        {
            try
            {
                result.complete(query.apply(state));
            }
            catch (RuntimeException e)
            {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Closes the game: cancels timers, detaches members and drops subscribers.
     */
    public void close()
    {
        mailbox.execute(() ->
        {
            if (closed)
            {
                return;
            }
            closed = true;
            for (ScheduledFuture<?> timer : graceTimers.values())
            {
                timer.cancel(false);
            }
            graceTimers.clear();
            for (Member member : attached.values())
            {
                member.left(OriginKind.GAME, gameId);
            }
            attached.clear();
            topic.close();
            LOG.info("Game {} destroyed", gameId);
        });
    }

    // ========== Command handling ==========

    private void join(Member member, boolean spectator, CommandContext context)
    {
        long id = member.identityId();
        if (state.isMember(id))
        {
            if (!commit(rules.connectionRestored(state, id)))
            {
                context.fail(ErrorCode.INTERNAL_ERROR, "Game " + gameId + " failed");
                return;
            }
            cancelGraceTimer(id);
            attach(member);
            int seat = state.player(id).map(PlayerState::getSeat).orElse(-1);
            context.reply(new Reply.JoinedGame(gameId, seat, state.getSequence()));
            return;
        }

        List<GameEvent> events = rules.join(state, member.userView(), spectator);
        if (!commit(events))
        {
            context.fail(ErrorCode.INTERNAL_ERROR, "Game " + gameId + " failed");
            return;
        }
        attach(member);
        context.reply(new Reply.JoinedGame(gameId, seatOf(events), state.getSequence()));
    }

    private void resync(Member member, Optional<Long> fromSequence, CommandContext context)
    {
        long id = member.identityId();
        if (!state.isMember(id))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Not in game " + gameId);
        }
        if (fromSequence.isPresent() && (fromSequence.get() < 0 || fromSequence.get() > state.getSequence()))
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT,
                    "Sequence " + fromSequence.get() + " outside 0.." + state.getSequence());
        }

        if (!commit(rules.connectionRestored(state, id)))
        {
            context.fail(ErrorCode.INTERNAL_ERROR, "Game " + gameId + " failed");
            return;
        }
        cancelGraceTimer(id);
        attach(member);

        if (fromSequence.isEmpty())
        {
            context.reply(new Reply.Snapshot(state.snapshot()));
        }
        else
        {
            context.reply(new Reply.EventTail(gameId, ReplayExport.tail(log, fromSequence.get())));
        }
    }

    private void completeWith(CommandContext context, List<GameEvent> events)
    {
        if (commit(events))
        {
            context.reply(new Reply.Ack());
        }
        else
        {
            context.fail(ErrorCode.INTERNAL_ERROR, "Game " + gameId + " failed");
        }
    }

    /**
     * Runs a command body, answering validation failures and defects.
     */
    private void guarded(CommandContext context, Runnable body)
    {
        if (closed)
        {
            context.fail(ErrorCode.UNKNOWN_GAME, "Game " + gameId + " no longer exists");
            return;
        }
        try
        {
            body.run();
        }
        catch (ValidationException e)
        {
            context.fail(e.getCode(), e.getMessage());
        }
        catch (RuntimeException e)
        {
            LOG.error("Game {}: command failed", gameId, e);
            context.fail(ErrorCode.INTERNAL_ERROR, "Internal error");
        }
    }

    private static int seatOf(List<GameEvent> events)
    {
        for (GameEvent event : events)
        {
            if (event instanceof PlayerJoined joined)
            {
                return joined.seat();
            }
        }
        return -1;
    }

    // ========== Commit ==========

    /**
     * Commits events: validate on a copy, then append, fold and publish each.
     *
     * @return false if the events broke an invariant or could not be recorded
     */
    private boolean commit(List<GameEvent> events)
    {
        if (events.isEmpty())
        {
            return true;
        }

        GameState candidate = state.copy();
        long sequence = state.getSequence();
        try
        {
            for (GameEvent event : events)
            {
                candidate.apply(++sequence, event);
            }
            candidate.checkInvariants();
        }
        catch (InvariantViolationException e)
        {
            LOG.error("Game {}: invariant violation, abandoning game", gameId, e);
            abandonAfterDefect("Internal error");
            afterCommit(List.of());
            return false;
        }

        GameStatus before = state.getStatus();
        boolean recorded = true;
        for (GameEvent event : events)
        {
            if (!record(event))
            {
                recorded = false;
                break;
            }
        }
        logTransition(before);
        afterCommit(events);
        return recorded;
    }

    private boolean record(GameEvent event)
    {
        long sequence = state.getSequence() + 1;
        if (!logFailed)
        {
            try
            {
                log.append(new SequencedEvent(sequence, event));
            }
            catch (UncheckedIOException | IllegalArgumentException e)
            {
                LOG.error("Game {}: replay append failed at sequence {}, abandoning game", gameId, sequence, e);
                logFailed = true;
                if (!state.getStatus().isTerminal())
                {
                    GameEvent abandoned = new GameStatusChanged(GameStatus.ABANDONED, "Replay log failure", Optional.empty());
                    state.apply(sequence, abandoned);
                    topic.publish(EventEnvelope.game(gameId, sequence, abandoned));
                }
                return false;
            }
        }
        state.apply(sequence, event);
        topic.publish(EventEnvelope.game(gameId, sequence, event));
        return true;
    }

    private void abandonAfterDefect(String reason)
    {
        if (!logFailed)
        {
            try (ReplayCursor cursor = log.read(0))
            {
                state = GameState.replay(cursor);
            }
            catch (RuntimeException e)
            {
                LOG.error("Game {}: cannot rebuild state from replay log", gameId, e);
            }
        }
        if (state.getStatus().isTerminal())
        {
            return;
        }
        GameStatus before = state.getStatus();
        try
        {
            record(new GameStatusChanged(GameStatus.ABANDONED, reason, Optional.empty()));
        }
        catch (InvariantViolationException e)
        {
            LOG.error("Game {}: cannot record abandonment", gameId, e);
        }
        logTransition(before);
    }

    private void logTransition(GameStatus before)
    {
        GameStatus after = state.getStatus();
        if (before == after)
        {
            return;
        }
        if (after == GameStatus.IN_PROGRESS && before == GameStatus.SETUP)
        {
            LOG.info("Game {} started with {} players", gameId, state.seatedPlayerCount());
        }
        else if (after.isTerminal())
        {
            LOG.info("Game {} {}: {}", gameId, after == GameStatus.FINISHED ? "finished" : "abandoned", state.getStatusReason());
            endedAtNanos = System.nanoTime();
            for (ScheduledFuture<?> timer : graceTimers.values())
            {
                timer.cancel(false);
            }
            graceTimers.clear();
        }
        else
        {
            LOG.debug("Game {}: {} -> {} ({})", gameId, before, after, state.getStatusReason());
        }
    }

    private void afterCommit(List<GameEvent> events)
    {
        for (GameEvent event : events)
        {
            if (event instanceof PlayerLeft left)
            {
                detach(left.playerId());
            }
        }
        GameSummary previousSummary = summary;
        Set<Long> previousMembers = memberIds;
        publishViews();
        if (!summary.equals(previousSummary) || !memberIds.equals(previousMembers))
        {
            try
            {
                listener.gameChanged(this);
            }
            catch (RuntimeException e)
            {
                LOG.error("Game {}: listener error", gameId, e);
            }
        }
    }

    private void publishViews()
    {
        summary = state.summary();
        memberIds = Set.copyOf(state.memberIds());
    }

    // ========== Members ==========

    private void attach(Member member)
    {
        Member previous = attached.put(member.identityId(), member);
        if (previous != null && !previous.subscriberId().equals(member.subscriberId()))
        {
            topic.unsubscribe(previous.subscriberId());
        }
        topic.subscribe(member);
        if (previous != member)
        {
            member.joined(OriginKind.GAME, gameId);
        }
        if (!member.isConnected())
        {
            // the connection ended while the command was queued
            connectionLost(member);
        }
    }

    private void detach(long identityId)
    {
        cancelGraceTimer(identityId);
        Member member = attached.remove(identityId);
        if (member != null)
        {
            topic.unsubscribe(member.subscriberId());
            member.left(OriginKind.GAME, gameId);
        }
    }

    private void armGraceTimer(long playerId)
    {
        if (state.getStatus().isTerminal() || !state.isPlayer(playerId)
                || state.player(playerId).map(PlayerState::isConnected).orElse(true))
        {
            return;
        }
        cancelGraceTimer(playerId);
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> mailbox.execute(() -> graceExpired(playerId)),
                gracePeriod.toMillis(),
                TimeUnit.MILLISECONDS);
        graceTimers.put(playerId, timer);
        LOG.debug("Game {}: player {} has {} to reconnect", gameId, playerId, gracePeriod);
    }

    private void cancelGraceTimer(long playerId)
    {
        ScheduledFuture<?> timer = graceTimers.remove(playerId);
        if (timer != null)
        {
            timer.cancel(false);
        }
    }

    private void graceExpired(long playerId)
    {
        graceTimers.remove(playerId);
        if (closed)
        {
            return;
        }
        List<GameEvent> events = rules.graceExpired(state, playerId);
        if (!events.isEmpty())
        {
            LOG.info("Game {}: player {} did not reconnect within {}", gameId, playerId, gracePeriod);
            commit(events);
        }
    }

    // ========== Accessors ==========

    public long getGameId()
    {
        return gameId;
    }

    public long getRoomId()
    {
        return roomId;
    }

    public GameConfig getConfig()
    {
        return config;
    }

    public ReplayLog getLog()
    {
        return log;
    }

    public GameSummary getSummary()
    {
        return summary;
    }

    public GameStatus getStatus()
    {
        return summary.status();
    }

    /**
     * Returns the ids of current players and spectators.
     *
     * @return member ids, as of the last commit
     */
    public Set<Long> getMemberIds()
    {
        return memberIds;
    }

    public boolean isMember(long identityId)
    {
        return memberIds.contains(identityId);
    }

    /**
     * Returns when the game reached a terminal status.
     *
     * @return {@link System#nanoTime()} at the end, or 0 while the game runs
     */
    public long getEndedAtNanos()
    {
        return endedAtNanos;
    }

    public int getSubscriberCount()
    {
        return topic.size();
    }

    @Override
    public String toString()
    {
        return "Game[" + gameId + " " + summary.status() + "]";
    }
}
