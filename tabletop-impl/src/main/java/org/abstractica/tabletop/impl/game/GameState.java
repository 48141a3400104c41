package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.GameEvent.CardAttached;
import org.abstractica.tabletop.protocol.GameEvent.CardAttributeChanged;
import org.abstractica.tabletop.protocol.GameEvent.CardCreated;
import org.abstractica.tabletop.protocol.GameEvent.CardDestroyed;
import org.abstractica.tabletop.protocol.GameEvent.CardMoved;
import org.abstractica.tabletop.protocol.GameEvent.CardsRevealed;
import org.abstractica.tabletop.protocol.GameEvent.CounterChanged;
import org.abstractica.tabletop.protocol.GameEvent.DeckSelected;
import org.abstractica.tabletop.protocol.GameEvent.GameChat;
import org.abstractica.tabletop.protocol.GameEvent.GameCreated;
import org.abstractica.tabletop.protocol.GameEvent.GameStarted;
import org.abstractica.tabletop.protocol.GameEvent.GameStatusChanged;
import org.abstractica.tabletop.protocol.GameEvent.PhaseChanged;
import org.abstractica.tabletop.protocol.GameEvent.PlayerConceded;
import org.abstractica.tabletop.protocol.GameEvent.PlayerCounterChanged;
import org.abstractica.tabletop.protocol.GameEvent.PlayerDisconnected;
import org.abstractica.tabletop.protocol.GameEvent.PlayerJoined;
import org.abstractica.tabletop.protocol.GameEvent.PlayerLeft;
import org.abstractica.tabletop.protocol.GameEvent.PlayerReconnected;
import org.abstractica.tabletop.protocol.GameEvent.ReadyChanged;
import org.abstractica.tabletop.protocol.GameEvent.TurnPassed;
import org.abstractica.tabletop.protocol.GameEvent.ZoneShuffled;
import org.abstractica.tabletop.protocol.SequencedEvent;
import org.abstractica.tabletop.protocol.model.CardAttribute;
import org.abstractica.tabletop.protocol.model.CardSeed;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.abstractica.tabletop.protocol.model.GameSnapshot;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.GameSummary;
import org.abstractica.tabletop.protocol.model.Phase;
import org.abstractica.tabletop.protocol.model.PlayerSetup;
import org.abstractica.tabletop.protocol.model.PlayerView;
import org.abstractica.tabletop.protocol.model.UserView;
import org.abstractica.tabletop.protocol.model.ZoneRef;
import org.abstractica.tabletop.protocol.model.ZoneType;
import org.abstractica.tabletop.protocol.model.ZoneView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative state of one game, built by folding its events.
 *
 * <p>The same fold serves the live game and cold reconstruction from a
 * replay log, so both always agree. {@link #apply} throws
 * {@link InvariantViolationException} for any event that does not fit the
 * current state; callers apply to a {@link #copy()} first when the events
 * have not been validated.</p>
 *
 * <p>Not thread-safe. A live state is only touched from its game's mailbox.</p>
 */
public final class GameState
{
    /**
     * Pause reason marking a pause requested by an administrator.
     */
    public static final String ADMIN_PAUSE_REASON = "Paused by administrator";

    /**
     * Pause reason used while players are disconnected.
     */
    public static final String WAITING_REASON = "Waiting for players to reconnect";

    public static final String LIFE_COUNTER = "life";

    private final long gameId;
    private final long roomId;
    private final GameConfig config;
    private final long creatorId;

    private GameStatus status = GameStatus.SETUP;
    private String statusReason = "";
    private long sequence;
    private int turn;
    private Phase phase = Phase.UNTAP;
    private Long activePlayer;
    private Long winner;

    private final Map<Long, PlayerState> players = new LinkedHashMap<>();
    private final Map<Long, String> spectators = new LinkedHashMap<>();
    private final Map<ZoneRef, Zone> zones = new LinkedHashMap<>();

    private int expectedCardCount;
    private long nextInstanceId = 1;

    private GameState(long gameId, long roomId, GameConfig config, long creatorId)
    {
        this.gameId = gameId;
        this.roomId = roomId;
        this.config = Objects.requireNonNull(config, "config");
        this.creatorId = creatorId;
    }

    /**
     * Creates the state described by a game's first event.
     *
     * @param created the first event
     * @return state at sequence 1
     */
    public static GameState created(GameCreated created)
    {
        GameState state = new GameState(created.gameId(), created.roomId(), created.config(), created.creatorId());
        state.sequence = 1;
        return state;
    }

    /**
     * Folds a complete event sequence.
     *
     * @param events events from sequence 1, in order
     * @return the resulting state
     * @throws InvariantViolationException if the sequence is not a valid game history
     */
    public static GameState replay(Iterator<SequencedEvent> events)
    {
        if (!events.hasNext())
        {
            throw new InvariantViolationException("Empty event log");
        }
        SequencedEvent first = events.next();
        if (first.sequence() != 1 || !(first.event() instanceof GameCreated created))
        {
            throw new InvariantViolationException(
                    "Log must start with GameCreated at sequence 1, found " + first.event().getClass().getSimpleName()
                            + " at " + first.sequence());
        }
        GameState state = created(created);
        while (events.hasNext())
        {
            SequencedEvent next = events.next();
            state.apply(next.sequence(), next.event());
        }
        state.checkInvariants();
        return state;
    }

    /**
     * Returns a deep copy.
     *
     * @return independent copy of this state
     */
    public GameState copy()
    {
        GameState copy = new GameState(gameId, roomId, config, creatorId);
        copy.status = status;
        copy.statusReason = statusReason;
        copy.sequence = sequence;
        copy.turn = turn;
        copy.phase = phase;
        copy.activePlayer = activePlayer;
        copy.winner = winner;
        for (PlayerState player : players.values())
        {
            copy.players.put(player.getPlayerId(), player.copy());
        }
        copy.spectators.putAll(spectators);
        for (Zone zone : zones.values())
        {
            copy.zones.put(zone.getRef(), zone.copy());
        }
        copy.expectedCardCount = expectedCardCount;
        copy.nextInstanceId = nextInstanceId;
        return copy;
    }

    // ========== Fold ==========

    /**
     * Applies one event.
     *
     * @param eventSequence the event's sequence, which must be the next one
     * @param event         the event
     * @throws InvariantViolationException if the event does not fit this state
     */
    public void apply(long eventSequence, GameEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (eventSequence != sequence + 1)
        {
            throw new InvariantViolationException(
                    "Game " + gameId + ": expected sequence " + (sequence + 1) + ", got " + eventSequence);
        }

        if (event instanceof GameCreated)
        {
            throw violation("GameCreated after the start of the log");
        }
        else if (event instanceof GameStarted started)
        {
            applyStarted(started);
        }
        else if (event instanceof GameStatusChanged changed)
        {
            applyStatusChanged(changed);
        }
        else if (event instanceof PlayerJoined joined)
        {
            applyJoined(joined);
        }
        else if (event instanceof PlayerLeft left)
        {
            applyLeft(left);
        }
        else if (event instanceof PlayerDisconnected disconnected)
        {
            requirePlayer(disconnected.playerId()).setConnected(false);
        }
        else if (event instanceof PlayerReconnected reconnected)
        {
            requirePlayer(reconnected.playerId()).setConnected(true);
        }
        else if (event instanceof DeckSelected selected)
        {
            requireStatus(GameStatus.SETUP, event);
            requirePlayer(selected.playerId()).setDeck(selected.deck());
        }
        else if (event instanceof ReadyChanged ready)
        {
            requireStatus(GameStatus.SETUP, event);
            requirePlayer(ready.playerId()).setReady(ready.ready());
        }
        else if (event instanceof CardMoved moved)
        {
            applyMoved(moved);
        }
        else if (event instanceof ZoneShuffled shuffled)
        {
            applyShuffled(shuffled);
        }
        else if (event instanceof CardsRevealed revealed)
        {
            Zone zone = requireZone(revealed.zone());
            for (int index : revealed.indices())
            {
                requireIndex(zone, index);
            }
        }
        else if (event instanceof CounterChanged counter)
        {
            requireCard(counter.zone(), counter.index(), counter.instanceId()).setCounter(counter.counter(), counter.value());
        }
        else if (event instanceof CardAttributeChanged changed)
        {
            CardInstance card = requireCard(changed.zone(), changed.index(), changed.instanceId());
            if (changed.attribute() == CardAttribute.TAPPED)
            {
                card.setTapped(changed.value());
            }
            else
            {
                card.setFaceDown(changed.value());
            }
        }
        else if (event instanceof CardAttached attached)
        {
            applyAttached(attached);
        }
        else if (event instanceof CardCreated created)
        {
            applyCreated(created);
        }
        else if (event instanceof CardDestroyed destroyed)
        {
            Zone zone = requireZone(destroyed.zone());
            requireCard(destroyed.zone(), destroyed.index(), destroyed.instanceId());
            zone.remove(destroyed.index());
            detachFrom(destroyed.instanceId());
            expectedCardCount--;
        }
        else if (event instanceof PlayerCounterChanged counter)
        {
            requirePlayer(counter.playerId()).setCounter(counter.counter(), counter.value());
        }
        else if (event instanceof PhaseChanged changed)
        {
            requirePlaying(event);
            phase = changed.phase();
        }
        else if (event instanceof TurnPassed passed)
        {
            requirePlaying(event);
            requirePlayer(passed.activePlayer());
            if (passed.turn() != turn + 1)
            {
                throw violation("Turn " + passed.turn() + " does not follow turn " + turn);
            }
            turn = passed.turn();
            activePlayer = passed.activePlayer();
            phase = Phase.UNTAP;
        }
        else if (event instanceof PlayerConceded conceded)
        {
            requirePlayer(conceded.playerId()).setConceded(true);
        }
        else if (event instanceof GameChat chat)
        {
            if (!isMember(chat.playerId()))
            {
                throw violation("Chat from non-member " + chat.playerId());
            }
        }
        else
        {
            throw violation("Unsupported event " + event.getClass().getSimpleName());
        }

        sequence = eventSequence;
    }

    private void applyStarted(GameStarted started)
    {
        requireStatus(GameStatus.SETUP, started);
        Set<Long> dealt = new HashSet<>();
        for (PlayerSetup setup : started.players())
        {
            requirePlayer(setup.playerId());
            dealt.add(setup.playerId());
        }
        if (!dealt.equals(players.keySet()))
        {
            throw violation("GameStarted deals " + dealt + " but players are " + players.keySet());
        }
        requirePlayer(started.firstPlayer());

        int count = 0;
        long maxInstance = 0;
        for (PlayerState player : seatOrder())
        {
            long owner = player.getPlayerId();
            for (ZoneType type : ZoneType.values())
            {
                if (!type.isShared())
                {
                    ZoneRef ref = ZoneRef.of(owner, type);
                    zones.put(ref, new Zone(ref));
                }
            }
            PlayerSetup setup = started.players().stream()
                    .filter(s -> s.playerId() == owner)
                    .findFirst()
                    .orElseThrow();
            for (CardSeed seed : setup.library())
            {
                zones.get(ZoneRef.of(owner, ZoneType.LIBRARY)).add(new CardInstance(seed.instanceId(), seed.cardId(), owner, false));
                maxInstance = Math.max(maxInstance, seed.instanceId());
                count++;
            }
            for (CardSeed seed : setup.sideboard())
            {
                zones.get(ZoneRef.of(owner, ZoneType.SIDEBOARD)).add(new CardInstance(seed.instanceId(), seed.cardId(), owner, false));
                maxInstance = Math.max(maxInstance, seed.instanceId());
                count++;
            }
            player.setCounter(LIFE_COUNTER, config.startingLife());
        }
        ZoneRef stack = ZoneRef.shared(ZoneType.STACK);
        zones.put(stack, new Zone(stack));

        expectedCardCount = count;
        nextInstanceId = maxInstance + 1;
        turn = 1;
        phase = Phase.UNTAP;
        activePlayer = started.firstPlayer();
        status = GameStatus.IN_PROGRESS;
        statusReason = "Started";
    }

    private void applyStatusChanged(GameStatusChanged changed)
    {
        if (status.isTerminal())
        {
            throw violation("Status change " + status + " -> " + changed.status() + " after the game ended");
        }
        if (changed.status() == GameStatus.SETUP)
        {
            throw violation("Cannot return to SETUP");
        }
        if ((changed.status() == GameStatus.IN_PROGRESS || changed.status() == GameStatus.PAUSED) && turn == 0)
        {
            throw violation(changed.status() + " before the game started");
        }
        if (changed.winner().isPresent())
        {
            requirePlayer(changed.winner().get());
        }
        status = changed.status();
        statusReason = changed.reason();
        winner = changed.winner().orElse(null);
    }

    private void applyJoined(PlayerJoined joined)
    {
        if (isMember(joined.playerId()))
        {
            throw violation("Player " + joined.playerId() + " joined twice");
        }
        if (joined.spectator())
        {
            spectators.put(joined.playerId(), joined.name());
            return;
        }
        requireStatus(GameStatus.SETUP, joined);
        if (joined.seat() < 0 || joined.seat() >= config.maxPlayers() || seatTaken(joined.seat()))
        {
            throw violation("Seat " + joined.seat() + " is not available");
        }
        players.put(joined.playerId(), new PlayerState(joined.playerId(), joined.name(), joined.seat()));
    }

    private void applyLeft(PlayerLeft left)
    {
        long id = left.playerId();
        if (spectators.remove(id) != null)
        {
            return;
        }
        PlayerState player = requirePlayer(id);
        if (player.hasLeft())
        {
            throw violation("Player " + id + " left twice");
        }
        if (status == GameStatus.SETUP)
        {
            players.remove(id);
        }
        else
        {
            player.setLeft(true);
            player.setConnected(false);
        }
    }

    private void applyMoved(CardMoved moved)
    {
        Zone from = requireZone(moved.from());
        Zone to = requireZone(moved.to());
        CardInstance card = requireCard(moved.from(), moved.fromIndex(), moved.instanceId());
        from.remove(moved.fromIndex());
        if (moved.toIndex() < 0 || moved.toIndex() > to.size())
        {
            throw violation("Destination index " + moved.toIndex() + " outside " + moved.to() + " of size " + to.size());
        }
        if (moved.from().type() == ZoneType.BATTLEFIELD && moved.to().type() != ZoneType.BATTLEFIELD)
        {
            card.resetTableState();
            detachFrom(card.getInstanceId());
        }
        card.setFaceDown(moved.faceDown());
        to.insert(moved.toIndex(), card);
    }

    private void applyShuffled(ZoneShuffled shuffled)
    {
        Zone zone = requireZone(shuffled.zone());
        if (!new HashSet<>(zone.instanceIds()).equals(new HashSet<>(shuffled.order()))
                || shuffled.order().size() != zone.size())
        {
            throw violation("Shuffle of " + shuffled.zone() + " changes its cards");
        }
        Map<Long, CardInstance> byId = new HashMap<>();
        for (CardInstance card : zone.cards())
        {
            byId.put(card.getInstanceId(), card);
        }
        zone.cards().clear();
        for (long id : shuffled.order())
        {
            zone.add(byId.get(id));
        }
    }

    private void applyAttached(CardAttached attached)
    {
        CardInstance card = findCard(attached.instanceId())
                .orElseThrow(() -> violation("Unknown card " + attached.instanceId()));
        if (attached.target().isPresent())
        {
            long target = attached.target().get();
            if (target == attached.instanceId() || findCard(target).isEmpty())
            {
                throw violation("Invalid attachment target " + target);
            }
        }
        card.setAttachedTo(attached.target().orElse(null));
    }

    private void applyCreated(CardCreated created)
    {
        Zone zone = requireZone(created.zone());
        if (findCard(created.instanceId()).isPresent())
        {
            throw violation("Instance id " + created.instanceId() + " already in use");
        }
        zone.add(new CardInstance(created.instanceId(), created.cardId(), created.ownerId(), true));
        expectedCardCount++;
        nextInstanceId = Math.max(nextInstanceId, created.instanceId() + 1);
    }

    private void detachFrom(long instanceId)
    {
        for (Zone zone : zones.values())
        {
            for (CardInstance card : zone.cards())
            {
                if (card.getAttachedTo().isPresent() && card.getAttachedTo().get() == instanceId)
                {
                    card.setAttachedTo(null);
                }
            }
        }
    }

    // ========== Invariants ==========

    /**
     * Verifies the state is internally consistent.
     *
     * @throws InvariantViolationException on the first inconsistency found
     */
    public void checkInvariants()
    {
        int count = 0;
        Set<Long> ids = new HashSet<>();
        for (Zone zone : zones.values())
        {
            for (CardInstance card : zone.cards())
            {
                count++;
                if (!ids.add(card.getInstanceId()))
                {
                    throw violation("Card " + card.getInstanceId() + " is in more than one place");
                }
            }
        }
        if (count != expectedCardCount)
        {
            throw violation("Card count " + count + " does not match expected " + expectedCardCount);
        }
        for (Zone zone : zones.values())
        {
            for (CardInstance card : zone.cards())
            {
                if (card.getAttachedTo().isPresent() && !ids.contains(card.getAttachedTo().get()))
                {
                    throw violation("Card " + card.getInstanceId() + " attached to missing card " + card.getAttachedTo().get());
                }
            }
        }
        if ((status == GameStatus.IN_PROGRESS || status == GameStatus.PAUSED)
                && (activePlayer == null || !players.containsKey(activePlayer)))
        {
            throw violation("No valid active player while " + status);
        }
        if (players.size() > config.maxPlayers())
        {
            throw violation(players.size() + " players exceed " + config.maxPlayers() + " seats");
        }
    }

    private InvariantViolationException violation(String message)
    {
        return new InvariantViolationException("Game " + gameId + " at sequence " + (sequence + 1) + ": " + message);
    }

    private void requireStatus(GameStatus required, GameEvent event)
    {
        if (status != required)
        {
            throw violation(event.getClass().getSimpleName() + " requires " + required + " but game is " + status);
        }
    }

    private void requirePlaying(GameEvent event)
    {
        if (status != GameStatus.IN_PROGRESS && status != GameStatus.PAUSED)
        {
            throw violation(event.getClass().getSimpleName() + " while " + status);
        }
    }

    private PlayerState requirePlayer(long playerId)
    {
        PlayerState player = players.get(playerId);
        if (player == null)
        {
            throw violation("Unknown player " + playerId);
        }
        return player;
    }

    private Zone requireZone(ZoneRef ref)
    {
        Zone zone = zones.get(ref);
        if (zone == null)
        {
            throw violation("Unknown zone " + ref);
        }
        return zone;
    }

    private void requireIndex(Zone zone, int index)
    {
        if (!zone.isValidIndex(index))
        {
            throw violation("Index " + index + " outside " + zone.getRef() + " of size " + zone.size());
        }
    }

    private CardInstance requireCard(ZoneRef ref, int index, long instanceId)
    {
        Zone zone = requireZone(ref);
        requireIndex(zone, index);
        CardInstance card = zone.get(index);
        if (card.getInstanceId() != instanceId)
        {
            throw violation("Expected card " + instanceId + " at " + ref + "[" + index + "], found " + card.getInstanceId());
        }
        return card;
    }

    // ========== Queries ==========

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

    public long getCreatorId()
    {
        return creatorId;
    }

    public GameStatus getStatus()
    {
        return status;
    }

    public String getStatusReason()
    {
        return statusReason;
    }

    public long getSequence()
    {
        return sequence;
    }

    public int getTurn()
    {
        return turn;
    }

    public Phase getPhase()
    {
        return phase;
    }

    public Optional<Long> getActivePlayer()
    {
        return Optional.ofNullable(activePlayer);
    }

    public Optional<Long> getWinner()
    {
        return Optional.ofNullable(winner);
    }

    /**
     * Returns whether the game is paused by an administrator.
     *
     * @return true while an admin pause is in force
     */
    public boolean isAdminPaused()
    {
        return status == GameStatus.PAUSED && ADMIN_PAUSE_REASON.equals(statusReason);
    }

    public int getCardCount()
    {
        return expectedCardCount;
    }

    long getNextInstanceId()
    {
        return nextInstanceId;
    }

    public boolean isPlayer(long identityId)
    {
        PlayerState player = players.get(identityId);
        return player != null && !player.hasLeft();
    }

    public boolean isSpectator(long identityId)
    {
        return spectators.containsKey(identityId);
    }

    public boolean isMember(long identityId)
    {
        return isPlayer(identityId) || isSpectator(identityId);
    }

    /**
     * Returns the identity ids of every player still seated and every spectator.
     *
     * @return member ids
     */
    public Set<Long> memberIds()
    {
        Set<Long> ids = new HashSet<>(spectators.keySet());
        for (PlayerState player : players.values())
        {
            if (!player.hasLeft())
            {
                ids.add(player.getPlayerId());
            }
        }
        return ids;
    }

    Optional<PlayerState> player(long playerId)
    {
        return Optional.ofNullable(players.get(playerId));
    }

    /**
     * Returns players ordered by seat, including those who left.
     */
    List<PlayerState> seatOrder()
    {
        List<PlayerState> ordered = new ArrayList<>(players.values());
        ordered.sort(Comparator.comparingInt(PlayerState::getSeat));
        return ordered;
    }

    /**
     * Returns the number of players that have not left.
     */
    int seatedPlayerCount()
    {
        int count = 0;
        for (PlayerState player : players.values())
        {
            if (!player.hasLeft())
            {
                count++;
            }
        }
        return count;
    }

    boolean seatTaken(int seat)
    {
        for (PlayerState player : players.values())
        {
            if (player.getSeat() == seat)
            {
                return true;
            }
        }
        return false;
    }

    Optional<Zone> zone(ZoneRef ref)
    {
        return Optional.ofNullable(zones.get(ref));
    }

    Optional<CardInstance> findCard(long instanceId)
    {
        for (Zone zone : zones.values())
        {
            for (CardInstance card : zone.cards())
            {
                if (card.getInstanceId() == instanceId)
                {
                    return Optional.of(card);
                }
            }
        }
        return Optional.empty();
    }

    Optional<ZoneRef> zoneOf(long instanceId)
    {
        for (Zone zone : zones.values())
        {
            for (CardInstance card : zone.cards())
            {
                if (card.getInstanceId() == instanceId)
                {
                    return Optional.of(zone.getRef());
                }
            }
        }
        return Optional.empty();
    }

    // ========== Views ==========

    /**
     * Builds the full snapshot of this state.
     *
     * @return snapshot at the current sequence
     */
    public GameSnapshot snapshot()
    {
        List<PlayerView> playerViews = new ArrayList<>();
        for (PlayerState player : seatOrder())
        {
            if (!player.hasLeft())
            {
                playerViews.add(player.view());
            }
        }
        List<UserView> spectatorViews = new ArrayList<>();
        for (Map.Entry<Long, String> spectator : spectators.entrySet())
        {
            spectatorViews.add(new UserView(spectator.getKey(), spectator.getValue()));
        }
        List<ZoneView> zoneViews = new ArrayList<>(zones.size());
        for (Zone zone : zones.values())
        {
            zoneViews.add(zone.view());
        }
        return new GameSnapshot(
                gameId,
                roomId,
                config,
                status,
                sequence,
                turn,
                phase,
                getActivePlayer(),
                getWinner(),
                playerViews,
                spectatorViews,
                zoneViews);
    }

    public GameSummary summary()
    {
        return new GameSummary(gameId, roomId, config.name(), status, seatedPlayerCount(), config.maxPlayers(), spectators.size());
    }
}
