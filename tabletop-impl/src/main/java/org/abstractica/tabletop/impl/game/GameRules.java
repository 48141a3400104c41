package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameCommand.AdvancePhase;
import org.abstractica.tabletop.protocol.GameCommand.AttachCard;
import org.abstractica.tabletop.protocol.GameCommand.Concede;
import org.abstractica.tabletop.protocol.GameCommand.CreateToken;
import org.abstractica.tabletop.protocol.GameCommand.DestroyCard;
import org.abstractica.tabletop.protocol.GameCommand.DrawCards;
import org.abstractica.tabletop.protocol.GameCommand.GameSay;
import org.abstractica.tabletop.protocol.GameCommand.ModifyCounter;
import org.abstractica.tabletop.protocol.GameCommand.MoveCard;
import org.abstractica.tabletop.protocol.GameCommand.PassTurn;
import org.abstractica.tabletop.protocol.GameCommand.RevealCards;
import org.abstractica.tabletop.protocol.GameCommand.SelectDeck;
import org.abstractica.tabletop.protocol.GameCommand.SetCardAttribute;
import org.abstractica.tabletop.protocol.GameCommand.SetPlayerCounter;
import org.abstractica.tabletop.protocol.GameCommand.SetReady;
import org.abstractica.tabletop.protocol.GameCommand.Shuffle;
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
import org.abstractica.tabletop.protocol.model.CardAttribute;
import org.abstractica.tabletop.protocol.model.CardSeed;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.LeaveReason;
import org.abstractica.tabletop.protocol.model.Phase;
import org.abstractica.tabletop.protocol.model.PlayerSetup;
import org.abstractica.tabletop.protocol.model.UserView;
import org.abstractica.tabletop.protocol.model.ZoneRef;
import org.abstractica.tabletop.protocol.model.ZoneType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Validates commands against a game state and decides the events they produce.
 *
 * <p>Decisions never mutate the state. A rejected command throws
 * {@link ValidationException}; an accepted one returns the events that
 * describe its effect, possibly none.</p>
 */
public class GameRules
{
    public static final int MAX_TEXT_LENGTH = 1000;
    public static final int MAX_COUNTER_NAME_LENGTH = 64;

    private final Random random;

    public GameRules(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    public GameRules()
    {
        this(new Random());
    }

    /**
     * Decides the events for a command from a current member.
     *
     * <p>Membership commands ({@code JoinGame}, {@code LeaveGame}) and
     * {@code Resync}/{@code ExportReplay} are handled by the game itself and
     * are rejected here.</p>
     *
     * @param state   current state
     * @param issuer  identity id of the issuing user
     * @param command the command
     * @return events to commit, in order
     * @throws ValidationException if the command is not allowed
     */
    public List<GameEvent> decide(GameState state, long issuer, GameCommand command)
    {
        if (command instanceof SelectDeck select)
        {
            return selectDeck(state, issuer, select.deck());
        }
        if (command instanceof SetReady ready)
        {
            return setReady(state, issuer, ready.ready());
        }
        if (command instanceof GameSay say)
        {
            return say(state, issuer, say.text());
        }
        if (command instanceof MoveCard move)
        {
            return moveCard(state, issuer, move);
        }
        if (command instanceof DrawCards draw)
        {
            return drawCards(state, issuer, draw.count());
        }
        if (command instanceof Shuffle shuffle)
        {
            return shuffle(state, issuer, shuffle.zone());
        }
        if (command instanceof RevealCards reveal)
        {
            return reveal(state, issuer, reveal);
        }
        if (command instanceof ModifyCounter counter)
        {
            return modifyCounter(state, issuer, counter);
        }
        if (command instanceof SetCardAttribute attribute)
        {
            return setAttribute(state, issuer, attribute);
        }
        if (command instanceof AttachCard attach)
        {
            return attach(state, issuer, attach);
        }
        if (command instanceof CreateToken token)
        {
            return createToken(state, issuer, token);
        }
        if (command instanceof DestroyCard destroy)
        {
            return destroyCard(state, issuer, destroy);
        }
        if (command instanceof SetPlayerCounter counter)
        {
            return setPlayerCounter(state, issuer, counter);
        }
        if (command instanceof AdvancePhase)
        {
            return advancePhase(state, issuer);
        }
        if (command instanceof PassTurn)
        {
            return passTurn(state, issuer);
        }
        if (command instanceof Concede)
        {
            return concede(state, issuer);
        }
        throw new ValidationException(ErrorCode.INVALID_ARGUMENT,
                command.getClass().getSimpleName() + " is not a gameplay command");
    }

    // ========== Membership ==========

    /**
     * Seats a user as a player, or admits them as a spectator.
     *
     * @param state     current state
     * @param user      the joining user
     * @param spectator whether to watch instead of play
     * @return the join event
     */
    public List<GameEvent> join(GameState state, UserView user, boolean spectator)
    {
        GameStatus status = state.getStatus();
        if (status.isTerminal())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game has ended");
        }
        if (state.isMember(user.identityId()))
        {
            throw new ValidationException(ErrorCode.ALREADY_MEMBER, "Already in game " + state.getGameId());
        }
        if (state.player(user.identityId()).isPresent())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Cannot rejoin a game after leaving it");
        }
        if (spectator)
        {
            if (!state.getConfig().allowSpectators())
            {
                throw new ValidationException(ErrorCode.SPECTATORS_NOT_ALLOWED, "Game does not allow spectators");
            }
            return List.of(new PlayerJoined(user.identityId(), user.name(), -1, true));
        }
        if (status != GameStatus.SETUP)
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game has already started");
        }
        for (int seat = 0; seat < state.getConfig().maxPlayers(); seat++)
        {
            if (!state.seatTaken(seat))
            {
                return List.of(new PlayerJoined(user.identityId(), user.name(), seat, false));
            }
        }
        throw new ValidationException(ErrorCode.GAME_FULL, "All " + state.getConfig().maxPlayers() + " seats are taken");
    }

    /**
     * Removes a member. A player leaving a running game concedes first.
     *
     * @param state    current state
     * @param memberId the leaving member
     * @param reason   why they leave
     * @return events to commit
     */
    public List<GameEvent> leave(GameState state, long memberId, LeaveReason reason)
    {
        if (!state.isMember(memberId))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Not in game " + state.getGameId());
        }
        List<GameEvent> events = new ArrayList<>();
        if (state.isSpectator(memberId))
        {
            events.add(new PlayerLeft(memberId, reason));
            return events;
        }

        PlayerState player = state.player(memberId).orElseThrow();
        GameStatus status = state.getStatus();
        boolean finished = false;
        if ((status == GameStatus.IN_PROGRESS || status == GameStatus.PAUSED) && !player.isConceded())
        {
            List<GameEvent> conceded = concession(state, memberId);
            finished = conceded.stream().anyMatch(e -> e instanceof GameStatusChanged);
            events.addAll(conceded);
        }
        events.add(new PlayerLeft(memberId, reason));

        // the leaving player may have been the one the game was waiting for
        if (status == GameStatus.PAUSED && !finished)
        {
            events.addAll(resumeIfAllConnected(state, memberId));
        }

        if (status == GameStatus.SETUP && state.seatedPlayerCount() == 1)
        {
            events.add(new GameStatusChanged(GameStatus.ABANDONED, "All players left", Optional.empty()));
        }
        else if (status == GameStatus.SETUP)
        {
            events.addAll(startIfReady(state, memberId, false));
        }
        return events;
    }

    // ========== Setup ==========

    private List<GameEvent> selectDeck(GameState state, long issuer, DeckList deck)
    {
        PlayerState player = requireSetupPlayer(state, issuer);
        DeckValidator.validate(state.getConfig(), deck);
        List<GameEvent> events = new ArrayList<>();
        if (player.isReady())
        {
            events.add(new ReadyChanged(issuer, false));
        }
        events.add(new DeckSelected(issuer, deck));
        return events;
    }

    private List<GameEvent> setReady(GameState state, long issuer, boolean ready)
    {
        PlayerState player = requireSetupPlayer(state, issuer);
        if (ready && player.getDeck().isEmpty())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Select a deck before getting ready");
        }
        if (player.isReady() == ready)
        {
            return List.of();
        }
        List<GameEvent> events = new ArrayList<>();
        events.add(new ReadyChanged(issuer, ready));
        if (ready)
        {
            events.addAll(startIfReady(state, issuer, true));
        }
        return events;
    }

    /**
     * Starts the game if every remaining player is ready.
     *
     * @param changedPlayer player whose ready flag or membership is changing
     * @param stillSeated   whether that player remains seated (and is now ready)
     */
    private List<GameEvent> startIfReady(GameState state, long changedPlayer, boolean stillSeated)
    {
        List<PlayerState> seated = new ArrayList<>();
        for (PlayerState player : state.seatOrder())
        {
            if (player.getPlayerId() == changedPlayer && !stillSeated)
            {
                continue;
            }
            if (player.getPlayerId() != changedPlayer && !player.isReady())
            {
                return List.of();
            }
            seated.add(player);
        }
        if (seated.size() < state.getConfig().minPlayers())
        {
            return List.of();
        }
        return start(state, seated);
    }

    private List<GameEvent> start(GameState state, List<PlayerState> seated)
    {
        long nextInstance = state.getNextInstanceId();
        List<PlayerSetup> setups = new ArrayList<>();
        for (PlayerState player : seated)
        {
            DeckList deck = player.getDeck().orElseThrow();
            List<String> library = new ArrayList<>(deck.main());
            Collections.shuffle(library, random);
            List<CardSeed> librarySeeds = new ArrayList<>(library.size());
            for (String cardId : library)
            {
                librarySeeds.add(new CardSeed(nextInstance++, cardId));
            }
            List<CardSeed> sideboardSeeds = new ArrayList<>(deck.sideboard().size());
            for (String cardId : deck.sideboard())
            {
                sideboardSeeds.add(new CardSeed(nextInstance++, cardId));
            }
            setups.add(new PlayerSetup(player.getPlayerId(), librarySeeds, sideboardSeeds));
        }

        List<GameEvent> events = new ArrayList<>();
        events.add(new GameStarted(seated.get(0).getPlayerId(), setups));
        int handSize = state.getConfig().openingHandSize();
        for (PlayerSetup setup : setups)
        {
            ZoneRef library = ZoneRef.of(setup.playerId(), ZoneType.LIBRARY);
            ZoneRef hand = ZoneRef.of(setup.playerId(), ZoneType.HAND);
            int draws = Math.min(handSize, setup.library().size());
            for (int i = 0; i < draws; i++)
            {
                events.add(new CardMoved(setup.playerId(), library, 0, hand, i, setup.library().get(i).instanceId(), false));
            }
        }
        return events;
    }

    private PlayerState requireSetupPlayer(GameState state, long issuer)
    {
        PlayerState player = state.player(issuer)
                .filter(p -> !p.hasLeft())
                .orElseThrow(() -> new ValidationException(ErrorCode.NOT_A_MEMBER, "Not a player in game " + state.getGameId()));
        if (state.getStatus() != GameStatus.SETUP)
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game is " + state.getStatus());
        }
        return player;
    }

    private List<GameEvent> say(GameState state, long issuer, String text)
    {
        if (!state.isMember(issuer))
        {
            throw new ValidationException(ErrorCode.NOT_A_MEMBER, "Not in game " + state.getGameId());
        }
        return List.of(new GameChat(issuer, checkText(text)));
    }

    public static String checkText(String text)
    {
        if (text.isBlank())
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Empty message");
        }
        if (text.length() > MAX_TEXT_LENGTH)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Message longer than " + MAX_TEXT_LENGTH + " characters");
        }
        return text;
    }

    // ========== Cards ==========

    private List<GameEvent> moveCard(GameState state, long issuer, MoveCard move)
    {
        requirePlaying(state, issuer);
        Zone from = requireZone(state, move.from());
        Zone to = requireZone(state, move.to());
        requireSourceAccess(issuer, move.from());
        if (!move.to().isShared() && move.to().ownerId() != issuer && move.to().type() != ZoneType.BATTLEFIELD)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Cannot put cards into " + move.to());
        }
        requireIndex(from, move.index());

        int sizeAfterRemoval = from == to ? to.size() - 1 : to.size();
        int toIndex = move.toIndex();
        if (toIndex == GameCommand.END_OF_ZONE)
        {
            toIndex = sizeAfterRemoval;
        }
        else if (toIndex < 0 || toIndex > sizeAfterRemoval)
        {
            throw new ValidationException(ErrorCode.INVALID_INDEX,
                    "Destination index " + move.toIndex() + " outside " + move.to() + " of size " + sizeAfterRemoval);
        }

        long instanceId = from.get(move.index()).getInstanceId();
        return List.of(new CardMoved(issuer, move.from(), move.index(), move.to(), toIndex, instanceId, move.faceDown()));
    }

    private List<GameEvent> drawCards(GameState state, long issuer, int count)
    {
        requirePlaying(state, issuer);
        if (count < 1)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Draw count must be positive: " + count);
        }
        ZoneRef libraryRef = ZoneRef.of(issuer, ZoneType.LIBRARY);
        ZoneRef handRef = ZoneRef.of(issuer, ZoneType.HAND);
        Zone library = requireZone(state, libraryRef);
        Zone hand = requireZone(state, handRef);
        if (count > library.size())
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT,
                    "Cannot draw " + count + " cards from a library of " + library.size());
        }
        List<GameEvent> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
        {
            events.add(new CardMoved(issuer, libraryRef, 0, handRef, hand.size() + i, library.get(i).getInstanceId(), false));
        }
        return events;
    }

    private List<GameEvent> shuffle(GameState state, long issuer, ZoneRef ref)
    {
        requirePlaying(state, issuer);
        Zone zone = requireZone(state, ref);
        requireSourceAccess(issuer, ref);
        List<Long> order = zone.instanceIds();
        Collections.shuffle(order, random);
        return List.of(new ZoneShuffled(ref, order));
    }

    private List<GameEvent> reveal(GameState state, long issuer, RevealCards reveal)
    {
        requirePlaying(state, issuer);
        Zone zone = requireZone(state, reveal.zone());
        requireSourceAccess(issuer, reveal.zone());
        if (reveal.indices().isEmpty())
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Nothing to reveal");
        }
        List<String> cardIds = new ArrayList<>(reveal.indices().size());
        for (int index : reveal.indices())
        {
            requireIndex(zone, index);
            cardIds.add(zone.get(index).getCardId());
        }
        if (reveal.toPlayer().isPresent() && !state.isPlayer(reveal.toPlayer().get()))
        {
            throw new ValidationException(ErrorCode.UNKNOWN_USER, "No player " + reveal.toPlayer().get() + " in this game");
        }
        return List.of(new CardsRevealed(issuer, reveal.zone(), reveal.indices(), cardIds, reveal.toPlayer()));
    }

    private List<GameEvent> modifyCounter(GameState state, long issuer, ModifyCounter modify)
    {
        requirePlaying(state, issuer);
        CardInstance card = requireOwnCard(state, issuer, modify.zone(), modify.index());
        String counter = checkCounterName(modify.counter());
        if (modify.delta() == 0)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Counter delta must not be zero");
        }
        long value = Math.max(0L, (long) card.getCounter(counter) + modify.delta());
        return List.of(new CounterChanged(modify.zone(), modify.index(), card.getInstanceId(), counter,
                (int) Math.min(value, Integer.MAX_VALUE)));
    }

    private List<GameEvent> setAttribute(GameState state, long issuer, SetCardAttribute set)
    {
        requirePlaying(state, issuer);
        CardInstance card = requireOwnCard(state, issuer, set.zone(), set.index());
        if (set.attribute() == CardAttribute.TAPPED && set.zone().type() != ZoneType.BATTLEFIELD)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Only cards on the battlefield can be tapped");
        }
        return List.of(new CardAttributeChanged(set.zone(), set.index(), card.getInstanceId(), set.attribute(), set.value()));
    }

    private List<GameEvent> attach(GameState state, long issuer, AttachCard attach)
    {
        requirePlaying(state, issuer);
        if (attach.zone().type() != ZoneType.BATTLEFIELD)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Only cards on the battlefield can be attached");
        }
        CardInstance card = requireOwnCard(state, issuer, attach.zone(), attach.index());
        if (attach.target().isPresent())
        {
            long target = attach.target().get();
            Optional<ZoneRef> targetZone = state.zoneOf(target);
            if (targetZone.isEmpty() || targetZone.get().type() != ZoneType.BATTLEFIELD)
            {
                throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Card " + target + " is not on a battlefield");
            }
            // walk the target's chain; reaching the card itself would form a loop
            Long cursor = target;
            while (cursor != null)
            {
                if (cursor == card.getInstanceId())
                {
                    throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Attachment would form a cycle");
                }
                cursor = state.findCard(cursor).flatMap(CardInstance::getAttachedTo).orElse(null);
            }
        }
        return List.of(new CardAttached(card.getInstanceId(), attach.target()));
    }

    private List<GameEvent> createToken(GameState state, long issuer, CreateToken token)
    {
        requirePlaying(state, issuer);
        if (token.cardId().isBlank() || token.cardId().length() > DeckValidator.MAX_CARD_ID_LENGTH)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Invalid card id");
        }
        requireZone(state, token.zone());
        if (!token.zone().isShared() && token.zone().ownerId() != issuer && token.zone().type() != ZoneType.BATTLEFIELD)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Cannot create cards in " + token.zone());
        }
        return List.of(new CardCreated(state.getNextInstanceId(), token.cardId(), issuer, token.zone()));
    }

    private List<GameEvent> destroyCard(GameState state, long issuer, DestroyCard destroy)
    {
        requirePlaying(state, issuer);
        CardInstance card = requireOwnCard(state, issuer, destroy.zone(), destroy.index());
        return List.of(new CardDestroyed(destroy.zone(), destroy.index(), card.getInstanceId()));
    }

    // ========== Turn and table ==========

    private List<GameEvent> setPlayerCounter(GameState state, long issuer, SetPlayerCounter set)
    {
        requirePlaying(state, issuer);
        return List.of(new PlayerCounterChanged(issuer, checkCounterName(set.counter()), set.value()));
    }

    private List<GameEvent> advancePhase(GameState state, long issuer)
    {
        requirePlaying(state, issuer);
        requireActive(state, issuer);
        Phase next = state.getPhase().next();
        if (next == null)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Last phase of the turn; pass the turn instead");
        }
        return List.of(new PhaseChanged(next));
    }

    private List<GameEvent> passTurn(GameState state, long issuer)
    {
        requirePlaying(state, issuer);
        requireActive(state, issuer);
        return List.of(new TurnPassed(state.getTurn() + 1, nextActive(state, issuer)));
    }

    private List<GameEvent> concede(GameState state, long issuer)
    {
        requirePlaying(state, issuer);
        return concession(state, issuer);
    }

    /**
     * Events for a player giving up: the concession, then either the end of
     * the game or a turn pass if it was their turn.
     */
    private List<GameEvent> concession(GameState state, long playerId)
    {
        List<GameEvent> events = new ArrayList<>();
        events.add(new PlayerConceded(playerId));

        List<Long> remaining = new ArrayList<>();
        for (PlayerState player : state.seatOrder())
        {
            if (player.isActive() && player.getPlayerId() != playerId)
            {
                remaining.add(player.getPlayerId());
            }
        }
        if (remaining.size() <= 1)
        {
            Optional<Long> winner = remaining.isEmpty() ? Optional.empty() : Optional.of(remaining.get(0));
            events.add(new GameStatusChanged(GameStatus.FINISHED, "Conceded", winner));
        }
        else if (state.getActivePlayer().isPresent() && state.getActivePlayer().get() == playerId)
        {
            events.add(new TurnPassed(state.getTurn() + 1, nextActive(state, playerId)));
        }
        return events;
    }

    /**
     * Returns the next player after a given one in seat order who still plays.
     */
    private static long nextActive(GameState state, long after)
    {
        List<PlayerState> seats = state.seatOrder();
        int start = 0;
        for (int i = 0; i < seats.size(); i++)
        {
            if (seats.get(i).getPlayerId() == after)
            {
                start = i;
                break;
            }
        }
        for (int step = 1; step <= seats.size(); step++)
        {
            PlayerState candidate = seats.get((start + step) % seats.size());
            if (candidate.isActive() && candidate.getPlayerId() != after)
            {
                return candidate.getPlayerId();
            }
        }
        return after;
    }

    // ========== Lifecycle ==========

    /**
     * Pauses a running game on administrator request.
     */
    public List<GameEvent> adminPause(GameState state)
    {
        if (state.isAdminPaused())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game is already paused");
        }
        if (state.getStatus() != GameStatus.IN_PROGRESS && state.getStatus() != GameStatus.PAUSED)
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game is " + state.getStatus());
        }
        return List.of(new GameStatusChanged(GameStatus.PAUSED, GameState.ADMIN_PAUSE_REASON, Optional.empty()));
    }

    /**
     * Lifts an administrator pause. The game stays paused while players are disconnected.
     */
    public List<GameEvent> adminResume(GameState state)
    {
        if (!state.isAdminPaused())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game is not paused by an administrator");
        }
        if (hasDisconnectedPlayers(state))
        {
            return List.of(new GameStatusChanged(GameStatus.PAUSED, GameState.WAITING_REASON, Optional.empty()));
        }
        return List.of(new GameStatusChanged(GameStatus.IN_PROGRESS, "Resumed", Optional.empty()));
    }

    public List<GameEvent> abandon(GameState state, String reason)
    {
        if (state.getStatus().isTerminal())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game has already ended");
        }
        return List.of(new GameStatusChanged(GameStatus.ABANDONED, reason, Optional.empty()));
    }

    /**
     * Events for a player's connection dropping. Pauses a running game.
     *
     * @return events, empty if the player is not a connected, seated player
     */
    public List<GameEvent> connectionLost(GameState state, long playerId)
    {
        Optional<PlayerState> player = state.player(playerId);
        if (player.isEmpty() || player.get().hasLeft() || !player.get().isConnected() || state.getStatus().isTerminal())
        {
            return List.of();
        }
        List<GameEvent> events = new ArrayList<>();
        events.add(new PlayerDisconnected(playerId));
        if (state.getStatus() == GameStatus.IN_PROGRESS && player.get().isActive())
        {
            events.add(new GameStatusChanged(GameStatus.PAUSED, GameState.WAITING_REASON, Optional.empty()));
        }
        return events;
    }

    /**
     * Events for a disconnected player coming back. Resumes the game when
     * nothing else keeps it paused.
     */
    public List<GameEvent> connectionRestored(GameState state, long playerId)
    {
        Optional<PlayerState> player = state.player(playerId);
        if (player.isEmpty() || player.get().hasLeft() || player.get().isConnected())
        {
            return List.of();
        }
        List<GameEvent> events = new ArrayList<>();
        events.add(new PlayerReconnected(playerId));
        if (state.getStatus() == GameStatus.PAUSED)
        {
            events.addAll(resumeIfAllConnected(state, playerId));
        }
        return events;
    }

    /**
     * Resumes a game paused for a disconnect once no active player other
     * than {@code settledPlayer} is still away. An admin pause is left alone.
     *
     * @param settledPlayer player who just reconnected or left
     */
    private static List<GameEvent> resumeIfAllConnected(GameState state, long settledPlayer)
    {
        if (state.isAdminPaused())
        {
            return List.of();
        }
        for (PlayerState other : state.seatOrder())
        {
            if (other.getPlayerId() != settledPlayer && !other.hasLeft() && other.isActive() && !other.isConnected())
            {
                return List.of();
            }
        }
        return List.of(new GameStatusChanged(GameStatus.IN_PROGRESS, "All players connected", Optional.empty()));
    }

    /**
     * Events when a disconnected player's grace period runs out. A player
     * still in setup loses their seat; a game in play is abandoned.
     */
    public List<GameEvent> graceExpired(GameState state, long playerId)
    {
        Optional<PlayerState> player = state.player(playerId);
        if (player.isEmpty() || player.get().hasLeft() || player.get().isConnected() || state.getStatus().isTerminal())
        {
            return List.of();
        }
        if (state.getStatus() == GameStatus.SETUP)
        {
            return leave(state, playerId, LeaveReason.LEFT);
        }
        if (!player.get().isActive())
        {
            return List.of();
        }
        return List.of(new GameStatusChanged(GameStatus.ABANDONED,
                "Player " + player.get().getName() + " did not reconnect", Optional.empty()));
    }

    public static boolean hasDisconnectedPlayers(GameState state)
    {
        for (PlayerState player : state.seatOrder())
        {
            if (player.isActive() && !player.isConnected())
            {
                return true;
            }
        }
        return false;
    }

    // ========== Checks ==========

    private static void requirePlaying(GameState state, long issuer)
    {
        if (state.getStatus() != GameStatus.IN_PROGRESS)
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Game is " + state.getStatus());
        }
        PlayerState player = state.player(issuer)
                .orElseThrow(() -> new ValidationException(ErrorCode.NOT_A_MEMBER, "Not a player in game " + state.getGameId()));
        if (!player.isActive())
        {
            throw new ValidationException(ErrorCode.INVALID_STATE, "Player is out of the game");
        }
    }

    private static void requireActive(GameState state, long issuer)
    {
        if (state.getActivePlayer().isEmpty() || state.getActivePlayer().get() != issuer)
        {
            throw new ValidationException(ErrorCode.NOT_YOUR_TURN, "It is not your turn");
        }
    }

    private static Zone requireZone(GameState state, ZoneRef ref)
    {
        return state.zone(ref)
                .orElseThrow(() -> new ValidationException(ErrorCode.UNKNOWN_ZONE, "No zone " + ref));
    }

    private static void requireIndex(Zone zone, int index)
    {
        if (!zone.isValidIndex(index))
        {
            throw new ValidationException(ErrorCode.INVALID_INDEX,
                    "Index " + index + " outside " + zone.getRef() + " of size " + zone.size());
        }
    }

    private static void requireSourceAccess(long issuer, ZoneRef ref)
    {
        if (!ref.isShared() && ref.ownerId() != issuer)
        {
            throw new ValidationException(ErrorCode.ILLEGAL_MOVE, "Zone " + ref + " belongs to another player");
        }
    }

    private static CardInstance requireOwnCard(GameState state, long issuer, ZoneRef ref, int index)
    {
        Zone zone = requireZone(state, ref);
        requireSourceAccess(issuer, ref);
        requireIndex(zone, index);
        return zone.get(index);
    }

    private static String checkCounterName(String counter)
    {
        if (counter.isBlank() || counter.length() > MAX_COUNTER_NAME_LENGTH)
        {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Invalid counter name");
        }
        return counter;
    }
}
