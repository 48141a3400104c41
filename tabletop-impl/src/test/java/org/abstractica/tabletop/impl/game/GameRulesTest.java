package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.GameCommand;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.model.CardAttribute;
import org.abstractica.tabletop.protocol.model.CounterView;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameStatus;
import org.abstractica.tabletop.protocol.model.LeaveReason;
import org.abstractica.tabletop.protocol.model.Phase;
import org.abstractica.tabletop.protocol.model.UserView;
import org.abstractica.tabletop.protocol.model.ZoneRef;
import org.abstractica.tabletop.protocol.model.ZoneType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.abstractica.tabletop.impl.game.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GameRules}.
 */
class GameRulesTest
{
    private GameFixtures game;

    @BeforeEach
    void setUp()
    {
        game = new GameFixtures(new GameRules(new Random(42)), DUEL);
    }

    private static void assertRejected(ErrorCode expected, Executable action)
    {
        ValidationException e = assertThrows(ValidationException.class, action);
        assertEquals(expected, e.getCode(), e.getMessage());
    }

    // ========== Membership ==========

    @Test
    void join_assignsLowestFreeSeat()
    {
        assertEquals(List.of(new GameEvent.PlayerJoined(ALICE, "alice", 0, false)), game.join(ALICE));
        assertEquals(List.of(new GameEvent.PlayerJoined(BOB, "bob", 1, false)), game.join(BOB));
    }

    @Test
    void decide_membershipCommand_rejected()
    {
        game.join(ALICE);
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE, new GameCommand.LeaveGame()));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE, new GameCommand.JoinGame(false)));
    }

    @Test
    void join_freedSeatIsReused()
    {
        game.join(ALICE);
        game.join(BOB);
        game.commit(game.rules.leave(game.state, ALICE, LeaveReason.LEFT));

        assertEquals(List.of(new GameEvent.PlayerJoined(CAROL, "carol", 0, false)), game.join(CAROL));
        assertEquals(2, game.state.summary().players());
    }

    @Test
    void join_fullTable_rejected()
    {
        game.join(ALICE);
        game.join(BOB);

        assertRejected(ErrorCode.GAME_FULL, () -> game.join(CAROL));
        assertRejected(ErrorCode.ALREADY_MEMBER, () -> game.join(BOB));
    }

    @Test
    void join_spectator_allowedUnlessDisabled()
    {
        game.watch(CAROL);
        assertTrue(game.state.isSpectator(CAROL));
        assertFalse(game.state.isPlayer(CAROL));

        GameFixtures closed = new GameFixtures(new GameRules(new Random(1)), NO_SPECTATORS);
        assertRejected(ErrorCode.SPECTATORS_NOT_ALLOWED, () -> closed.watch(CAROL));
    }

    @Test
    void leave_lastPlayerInSetup_abandonsGame()
    {
        game.join(ALICE);
        game.join(BOB);
        game.commit(game.rules.leave(game.state, ALICE, LeaveReason.LEFT));

        List<GameEvent> events = game.commit(game.rules.leave(game.state, BOB, LeaveReason.LEFT));

        assertEquals(new GameEvent.GameStatusChanged(GameStatus.ABANDONED, "All players left", Optional.empty()),
                events.get(events.size() - 1));
        assertEquals(GameStatus.ABANDONED, game.state.getStatus());
        assertRejected(ErrorCode.INVALID_STATE, () -> game.join(CAROL));
    }

    @Test
    void leave_nonMember_rejected()
    {
        game.join(ALICE);
        assertRejected(ErrorCode.NOT_A_MEMBER, () -> game.rules.leave(game.state, BOB, LeaveReason.LEFT));
    }

    // ========== Setup ==========

    @Test
    void setReady_withoutDeck_rejected()
    {
        game.join(ALICE);
        assertRejected(ErrorCode.INVALID_STATE, () -> game.run(ALICE, new GameCommand.SetReady(true)));
    }

    @Test
    void selectDeck_invalidDeck_rejected()
    {
        game.join(ALICE);
        assertRejected(ErrorCode.INVALID_DECK_LIST,
                () -> game.run(ALICE, new GameCommand.SelectDeck(DeckList.of(List.of("one", "two")))));
    }

    @Test
    void selectDeck_whileReady_clearsReady()
    {
        game.join(ALICE);
        game.run(ALICE, new GameCommand.SelectDeck(deck("alice")));
        game.run(ALICE, new GameCommand.SetReady(true));

        List<GameEvent> events = game.run(ALICE, new GameCommand.SelectDeck(deck("other")));

        assertEquals(new GameEvent.ReadyChanged(ALICE, false), events.get(0));
        assertInstanceOf(GameEvent.DeckSelected.class, events.get(1));
        assertFalse(game.state.player(ALICE).orElseThrow().isReady());
    }

    @Test
    void setReady_unchanged_producesNothing()
    {
        game.join(ALICE);
        assertEquals(List.of(), game.run(ALICE, new GameCommand.SetReady(false)));
    }

    @Test
    void setReady_singlePlayerBelowMinimum_doesNotStart()
    {
        game.join(ALICE);
        game.run(ALICE, new GameCommand.SelectDeck(deck("alice")));

        List<GameEvent> events = game.run(ALICE, new GameCommand.SetReady(true));

        assertEquals(List.of(new GameEvent.ReadyChanged(ALICE, true)), events);
        assertEquals(GameStatus.SETUP, game.state.getStatus());
    }

    // ========== Start ==========

    @Test
    void start_allReady_dealsOpeningHands()
    {
        List<GameEvent> events = game.start(ALICE, BOB);

        assertEquals(new GameEvent.ReadyChanged(BOB, true), events.get(0));
        GameEvent.GameStarted started = assertInstanceOf(GameEvent.GameStarted.class, events.get(1));
        assertEquals(ALICE, started.firstPlayer());
        // 1 ready + 1 start + 2 cards for each of two players
        assertEquals(6, events.size());

        assertEquals(GameStatus.IN_PROGRESS, game.state.getStatus());
        assertEquals(1, game.state.getTurn());
        assertEquals(Phase.UNTAP, game.state.getPhase());
        assertEquals(Optional.of(ALICE), game.state.getActivePlayer());
        assertEquals(2, game.size(ALICE, ZoneType.HAND));
        assertEquals(2, game.size(ALICE, ZoneType.LIBRARY));
        assertEquals(1, game.size(BOB, ZoneType.SIDEBOARD));
        assertEquals(10, game.state.getCardCount());
        assertEquals(List.of(new CounterView(GameState.LIFE_COUNTER, 20)),
                game.state.snapshot().players().get(0).counters());
    }

    @Test
    void start_sameSeed_sameDeal()
    {
        GameFixtures other = new GameFixtures(new GameRules(new Random(42)), DUEL);

        assertEquals(game.start(ALICE, BOB), other.start(ALICE, BOB));
        assertEquals(game.state.snapshot(), other.state.snapshot());
    }

    @Test
    void start_gameInProgress_rejectsNewPlayersButAdmitsSpectators()
    {
        game.start(ALICE, BOB);

        assertRejected(ErrorCode.INVALID_STATE, () -> game.join(CAROL));
        game.watch(CAROL);
        assertTrue(game.state.isSpectator(CAROL));
        assertRejected(ErrorCode.INVALID_STATE, () -> game.run(ALICE, new GameCommand.SetReady(false)));
    }

    // ========== Cards ==========

    @Test
    void drawCards_movesFromLibraryToHand()
    {
        game.start(ALICE, BOB);
        long top = game.cardAt(ALICE, ZoneType.LIBRARY, 0);

        game.run(ALICE, new GameCommand.DrawCards(1));

        assertEquals(3, game.size(ALICE, ZoneType.HAND));
        assertEquals(top, game.cardAt(ALICE, ZoneType.HAND, 2));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE, new GameCommand.DrawCards(0)));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE, new GameCommand.DrawCards(2)));
    }

    @Test
    void drawCards_outOfTurn_allowed()
    {
        game.start(ALICE, BOB);
        game.run(BOB, new GameCommand.DrawCards(2));
        assertEquals(0, game.size(BOB, ZoneType.LIBRARY));
    }

    @Test
    void moveCard_ownership()
    {
        game.start(ALICE, BOB);
        ZoneRef bobHand = zone(BOB, ZoneType.HAND);
        ZoneRef aliceHand = zone(ALICE, ZoneType.HAND);

        assertRejected(ErrorCode.ILLEGAL_MOVE, () -> game.run(ALICE,
                new GameCommand.MoveCard(bobHand, 0, zone(ALICE, ZoneType.GRAVEYARD), 0, false)));
        assertRejected(ErrorCode.ILLEGAL_MOVE, () -> game.run(ALICE,
                new GameCommand.MoveCard(aliceHand, 0, bobHand, 0, false)));
        assertRejected(ErrorCode.UNKNOWN_ZONE, () -> game.run(ALICE,
                new GameCommand.MoveCard(zone(99, ZoneType.HAND), 0, aliceHand, 0, false)));
        assertRejected(ErrorCode.INVALID_INDEX, () -> game.run(ALICE,
                new GameCommand.MoveCard(aliceHand, 5, zone(ALICE, ZoneType.GRAVEYARD), 0, false)));
        assertRejected(ErrorCode.INVALID_INDEX, () -> game.run(ALICE,
                new GameCommand.MoveCard(aliceHand, 0, zone(ALICE, ZoneType.GRAVEYARD), 1, false)));

        // anyone may put cards onto an opponent's battlefield
        long card = game.cardAt(ALICE, ZoneType.HAND, 0);
        game.run(ALICE, new GameCommand.MoveCard(aliceHand, 0, zone(BOB, ZoneType.BATTLEFIELD), 0, true));
        assertEquals(card, game.cardAt(BOB, ZoneType.BATTLEFIELD, 0));
        assertTrue(game.card(card).isFaceDown());
        assertEquals(ALICE, game.card(card).getOwnerId());
    }

    @Test
    void moveCard_withinZone_reorders()
    {
        game.start(ALICE, BOB);
        long first = game.cardAt(ALICE, ZoneType.HAND, 0);
        long second = game.cardAt(ALICE, ZoneType.HAND, 1);
        ZoneRef hand = zone(ALICE, ZoneType.HAND);

        game.run(ALICE, new GameCommand.MoveCard(hand, 0, hand, GameCommand.END_OF_ZONE, false));

        assertEquals(second, game.cardAt(ALICE, ZoneType.HAND, 0));
        assertEquals(first, game.cardAt(ALICE, ZoneType.HAND, 1));
    }

    @Test
    void setCardAttribute_tapOnlyOnBattlefield()
    {
        game.start(ALICE, BOB);
        ZoneRef battlefield = zone(ALICE, ZoneType.BATTLEFIELD);
        assertRejected(ErrorCode.ILLEGAL_MOVE, () -> game.run(ALICE,
                new GameCommand.SetCardAttribute(zone(ALICE, ZoneType.HAND), 0, CardAttribute.TAPPED, true)));

        long card = game.playFromHand(ALICE);
        game.run(ALICE, new GameCommand.SetCardAttribute(battlefield, 0, CardAttribute.TAPPED, true));
        assertTrue(game.card(card).isTapped());

        // leaving the battlefield clears table state
        game.run(ALICE, new GameCommand.MoveCard(battlefield, 0, zone(ALICE, ZoneType.GRAVEYARD), 0, false));
        assertFalse(game.card(card).isTapped());
    }

    @Test
    void modifyCounter_clampsAtZero()
    {
        game.start(ALICE, BOB);
        long card = game.playFromHand(ALICE);
        ZoneRef battlefield = zone(ALICE, ZoneType.BATTLEFIELD);

        game.run(ALICE, new GameCommand.ModifyCounter(battlefield, 0, "+1/+1", 2));
        assertEquals(2, game.card(card).getCounter("+1/+1"));

        game.run(ALICE, new GameCommand.ModifyCounter(battlefield, 0, "+1/+1", -5));
        assertEquals(0, game.card(card).getCounter("+1/+1"));

        assertRejected(ErrorCode.INVALID_ARGUMENT,
                () -> game.run(ALICE, new GameCommand.ModifyCounter(battlefield, 0, "+1/+1", 0)));
        assertRejected(ErrorCode.INVALID_ARGUMENT,
                () -> game.run(ALICE, new GameCommand.ModifyCounter(battlefield, 0, " ", 1)));
        assertRejected(ErrorCode.ILLEGAL_MOVE,
                () -> game.run(BOB, new GameCommand.ModifyCounter(battlefield, 0, "+1/+1", 1)));
    }

    @Test
    void attachCard_cycleRejected_detachedWhenTargetLeaves()
    {
        game.start(ALICE, BOB);
        long first = game.playFromHand(ALICE);
        long second = game.playFromHand(ALICE);
        ZoneRef battlefield = zone(ALICE, ZoneType.BATTLEFIELD);

        game.run(ALICE, new GameCommand.AttachCard(battlefield, 0, Optional.of(second)));
        assertEquals(Optional.of(second), game.card(first).getAttachedTo());

        assertRejected(ErrorCode.ILLEGAL_MOVE,
                () -> game.run(ALICE, new GameCommand.AttachCard(battlefield, 1, Optional.of(first))));
        assertRejected(ErrorCode.INVALID_ARGUMENT,
                () -> game.run(ALICE, new GameCommand.AttachCard(battlefield, 0, Optional.of(game.cardAt(ALICE, ZoneType.LIBRARY, 0)))));

        game.run(ALICE, new GameCommand.MoveCard(battlefield, 1, zone(ALICE, ZoneType.EXILE), 0, false));
        assertEquals(Optional.empty(), game.card(first).getAttachedTo());
    }

    @Test
    void createToken_thenDestroy()
    {
        game.start(ALICE, BOB);
        ZoneRef battlefield = zone(ALICE, ZoneType.BATTLEFIELD);

        List<GameEvent> created = game.run(ALICE, new GameCommand.CreateToken("goblin", battlefield));

        GameEvent.CardCreated event = assertInstanceOf(GameEvent.CardCreated.class, created.get(0));
        assertEquals(11, event.instanceId());
        assertTrue(game.card(11).isToken());
        assertEquals(11, game.state.getCardCount());

        game.run(ALICE, new GameCommand.DestroyCard(battlefield, 0));
        assertEquals(10, game.state.getCardCount());
        assertTrue(game.state.findCard(11).isEmpty());

        assertRejected(ErrorCode.INVALID_ARGUMENT,
                () -> game.run(ALICE, new GameCommand.CreateToken(" ", battlefield)));
        assertRejected(ErrorCode.ILLEGAL_MOVE,
                () -> game.run(ALICE, new GameCommand.CreateToken("goblin", zone(BOB, ZoneType.HAND))));
    }

    @Test
    void revealCards_namesTheCards()
    {
        game.start(ALICE, BOB);
        String first = game.card(game.cardAt(ALICE, ZoneType.HAND, 0)).getCardId();

        List<GameEvent> events = game.run(ALICE,
                new GameCommand.RevealCards(zone(ALICE, ZoneType.HAND), List.of(0), Optional.of(BOB)));

        GameEvent.CardsRevealed revealed = assertInstanceOf(GameEvent.CardsRevealed.class, events.get(0));
        assertEquals(List.of(first), revealed.cardIds());
        assertRejected(ErrorCode.UNKNOWN_USER, () -> game.run(ALICE,
                new GameCommand.RevealCards(zone(ALICE, ZoneType.HAND), List.of(0), Optional.of(99L))));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE,
                new GameCommand.RevealCards(zone(ALICE, ZoneType.HAND), List.of(), Optional.empty())));
    }

    @Test
    void shuffle_opponentZone_rejected()
    {
        game.start(ALICE, BOB);
        assertRejected(ErrorCode.ILLEGAL_MOVE, () -> game.run(ALICE, new GameCommand.Shuffle(zone(BOB, ZoneType.LIBRARY))));

        game.run(ALICE, new GameCommand.Shuffle(zone(ALICE, ZoneType.LIBRARY)));
        assertEquals(2, game.size(ALICE, ZoneType.LIBRARY));
    }

    // ========== Turns ==========

    @Test
    void advancePhase_onlyActivePlayer_untilCleanup()
    {
        game.start(ALICE, BOB);
        assertRejected(ErrorCode.NOT_YOUR_TURN, () -> game.run(BOB, new GameCommand.AdvancePhase()));

        for (int i = 0; i < Phase.values().length - 1; i++)
        {
            game.run(ALICE, new GameCommand.AdvancePhase());
        }
        assertEquals(Phase.CLEANUP, game.state.getPhase());
        assertRejected(ErrorCode.ILLEGAL_MOVE, () -> game.run(ALICE, new GameCommand.AdvancePhase()));
    }

    @Test
    void passTurn_rotatesActivePlayer()
    {
        game.start(ALICE, BOB);
        game.run(ALICE, new GameCommand.AdvancePhase());

        assertEquals(List.of(new GameEvent.TurnPassed(2, BOB)), game.run(ALICE, new GameCommand.PassTurn()));
        assertEquals(Phase.UNTAP, game.state.getPhase());
        assertRejected(ErrorCode.NOT_YOUR_TURN, () -> game.run(ALICE, new GameCommand.PassTurn()));

        game.run(BOB, new GameCommand.PassTurn());
        assertEquals(Optional.of(ALICE), game.state.getActivePlayer());
        assertEquals(3, game.state.getTurn());
    }

    @Test
    void passTurn_skipsPlayersWhoLeft()
    {
        GameFixtures three = new GameFixtures(new GameRules(new Random(3)), THREE_WAY);
        three.start(ALICE, BOB, CAROL);

        List<GameEvent> left = three.commit(three.rules.leave(three.state, CAROL, LeaveReason.LEFT));

        assertEquals(List.of(new GameEvent.PlayerConceded(CAROL), new GameEvent.PlayerLeft(CAROL, LeaveReason.LEFT)), left);
        three.run(ALICE, new GameCommand.PassTurn());
        three.run(BOB, new GameCommand.PassTurn());
        assertEquals(Optional.of(ALICE), three.state.getActivePlayer());
        assertRejected(ErrorCode.INVALID_STATE, () -> three.join(CAROL));
    }

    @Test
    void concede_activePlayerOfThree_passesTurn()
    {
        GameFixtures three = new GameFixtures(new GameRules(new Random(3)), THREE_WAY);
        three.start(ALICE, BOB, CAROL);

        List<GameEvent> events = three.run(ALICE, new GameCommand.Concede());

        assertEquals(List.of(new GameEvent.PlayerConceded(ALICE), new GameEvent.TurnPassed(2, BOB)), events);
        assertEquals(GameStatus.IN_PROGRESS, three.state.getStatus());
        assertRejected(ErrorCode.INVALID_STATE, () -> three.run(ALICE, new GameCommand.DrawCards(1)));
    }

    @Test
    void concede_lastOpponent_finishesWithWinner()
    {
        game.start(ALICE, BOB);

        game.run(BOB, new GameCommand.Concede());

        assertEquals(GameStatus.FINISHED, game.state.getStatus());
        assertEquals(Optional.of(ALICE), game.state.getWinner());
        assertRejected(ErrorCode.INVALID_STATE, () -> game.run(ALICE, new GameCommand.DrawCards(1)));
    }

    @Test
    void leave_duringPlay_concedesFirst()
    {
        game.start(ALICE, BOB);

        List<GameEvent> events = game.commit(game.rules.leave(game.state, ALICE, LeaveReason.KICKED));

        assertEquals(List.of(
                new GameEvent.PlayerConceded(ALICE),
                new GameEvent.GameStatusChanged(GameStatus.FINISHED, "Conceded", Optional.of(BOB)),
                new GameEvent.PlayerLeft(ALICE, LeaveReason.KICKED)), events);
        assertFalse(game.state.isMember(ALICE));
    }

    @Test
    void setPlayerCounter_updatesLife()
    {
        game.start(ALICE, BOB);
        game.run(BOB, new GameCommand.SetPlayerCounter(GameState.LIFE_COUNTER, 14));
        assertEquals(Optional.of(14), game.state.player(BOB).orElseThrow().getCounter(GameState.LIFE_COUNTER));
    }

    // ========== Chat ==========

    @Test
    void gameSay_checksMembershipAndText()
    {
        game.join(ALICE);
        game.watch(CAROL);

        assertEquals(List.of(new GameEvent.GameChat(CAROL, "hi")), game.run(CAROL, new GameCommand.GameSay("hi")));
        assertRejected(ErrorCode.NOT_A_MEMBER, () -> game.run(BOB, new GameCommand.GameSay("hi")));
        assertRejected(ErrorCode.INVALID_ARGUMENT, () -> game.run(ALICE, new GameCommand.GameSay("  ")));
        assertRejected(ErrorCode.INVALID_ARGUMENT,
                () -> game.run(ALICE, new GameCommand.GameSay("x".repeat(GameRules.MAX_TEXT_LENGTH + 1))));
    }

    // ========== Lifecycle ==========

    @Test
    void connectionLost_pausesUntilRestored()
    {
        game.start(ALICE, BOB);

        List<GameEvent> lost = game.commit(game.rules.connectionLost(game.state, BOB));

        assertEquals(new GameEvent.PlayerDisconnected(BOB), lost.get(0));
        assertEquals(GameStatus.PAUSED, game.state.getStatus());
        assertEquals(GameState.WAITING_REASON, game.state.getStatusReason());
        assertTrue(GameRules.hasDisconnectedPlayers(game.state));
        assertRejected(ErrorCode.INVALID_STATE, () -> game.run(ALICE, new GameCommand.DrawCards(1)));
        assertEquals(List.of(), game.rules.connectionLost(game.state, BOB));

        game.commit(game.rules.connectionRestored(game.state, BOB));

        assertEquals(GameStatus.IN_PROGRESS, game.state.getStatus());
        assertEquals(List.of(), game.rules.connectionRestored(game.state, BOB));
    }

    @Test
    void leave_awaitedPlayerOfThreeKicked_resumesGame()
    {
        GameFixtures three = new GameFixtures(new GameRules(new Random(3)), THREE_WAY);
        three.start(ALICE, BOB, CAROL);
        three.commit(three.rules.connectionLost(three.state, CAROL));
        assertEquals(GameStatus.PAUSED, three.state.getStatus());

        List<GameEvent> events = three.commit(three.rules.leave(three.state, CAROL, LeaveReason.KICKED));

        assertEquals(new GameEvent.GameStatusChanged(GameStatus.IN_PROGRESS, "All players connected", Optional.empty()),
                events.get(events.size() - 1));
        assertEquals(GameStatus.IN_PROGRESS, three.state.getStatus());
        assertFalse(GameRules.hasDisconnectedPlayers(three.state));
        three.run(ALICE, new GameCommand.PassTurn());
        assertEquals(Optional.of(BOB), three.state.getActivePlayer());
    }

    @Test
    void leave_anotherPlayerStillAway_staysPaused()
    {
        GameFixtures three = new GameFixtures(new GameRules(new Random(3)), THREE_WAY);
        three.start(ALICE, BOB, CAROL);
        three.commit(three.rules.connectionLost(three.state, BOB));
        three.commit(three.rules.connectionLost(three.state, CAROL));

        three.commit(three.rules.leave(three.state, CAROL, LeaveReason.KICKED));

        assertEquals(GameStatus.PAUSED, three.state.getStatus());
        assertEquals(GameState.WAITING_REASON, three.state.getStatusReason());

        three.commit(three.rules.connectionRestored(three.state, BOB));

        assertEquals(GameStatus.IN_PROGRESS, three.state.getStatus());
    }

    @Test
    void leave_duringAdminPause_keepsAdminPause()
    {
        GameFixtures three = new GameFixtures(new GameRules(new Random(3)), THREE_WAY);
        three.start(ALICE, BOB, CAROL);
        three.commit(three.rules.adminPause(three.state));
        three.commit(three.rules.connectionLost(three.state, CAROL));

        three.commit(three.rules.leave(three.state, CAROL, LeaveReason.KICKED));

        assertTrue(three.state.isAdminPaused());
    }

    @Test
    void leave_lastOpponentWhilePaused_finishesGame()
    {
        game.start(ALICE, BOB);
        game.commit(game.rules.connectionLost(game.state, BOB));

        game.commit(game.rules.leave(game.state, BOB, LeaveReason.KICKED));

        assertEquals(GameStatus.FINISHED, game.state.getStatus());
        assertEquals(Optional.of(ALICE), game.state.getWinner());
    }

    @Test
    void graceExpired_inSetup_removesPlayer()
    {
        game.join(ALICE);
        game.join(BOB);
        game.commit(game.rules.connectionLost(game.state, BOB));

        game.commit(game.rules.graceExpired(game.state, BOB));

        assertFalse(game.state.isMember(BOB));
        assertEquals(GameStatus.SETUP, game.state.getStatus());
    }

    @Test
    void graceExpired_duringPlay_abandonsGame()
    {
        game.start(ALICE, BOB);
        game.commit(game.rules.connectionLost(game.state, BOB));

        game.commit(game.rules.graceExpired(game.state, BOB));

        assertEquals(GameStatus.ABANDONED, game.state.getStatus());
        assertEquals("Player bob did not reconnect", game.state.getStatusReason());
    }

    @Test
    void graceExpired_afterReconnect_doesNothing()
    {
        game.start(ALICE, BOB);
        game.commit(game.rules.connectionLost(game.state, BOB));
        game.commit(game.rules.connectionRestored(game.state, BOB));

        assertEquals(List.of(), game.rules.graceExpired(game.state, BOB));
    }

    @Test
    void adminPause_resumeWaitsForDisconnectedPlayers()
    {
        assertRejected(ErrorCode.INVALID_STATE, () -> game.rules.adminPause(game.state));
        game.start(ALICE, BOB);

        game.commit(game.rules.adminPause(game.state));
        assertTrue(game.state.isAdminPaused());
        assertRejected(ErrorCode.INVALID_STATE, () -> game.rules.adminPause(game.state));

        game.commit(game.rules.connectionLost(game.state, BOB));
        assertTrue(game.state.isAdminPaused());

        game.commit(game.rules.adminResume(game.state));
        assertEquals(GameStatus.PAUSED, game.state.getStatus());
        assertFalse(game.state.isAdminPaused());
        assertRejected(ErrorCode.INVALID_STATE, () -> game.rules.adminResume(game.state));

        game.commit(game.rules.connectionRestored(game.state, BOB));
        assertEquals(GameStatus.IN_PROGRESS, game.state.getStatus());
    }

    @Test
    void abandon_terminalGame_rejected()
    {
        game.start(ALICE, BOB);
        game.commit(game.rules.abandon(game.state, "Room closed"));

        assertEquals(GameStatus.ABANDONED, game.state.getStatus());
        assertRejected(ErrorCode.INVALID_STATE, () -> game.rules.abandon(game.state, "again"));
        assertRejected(ErrorCode.INVALID_STATE, () -> game.rules.join(game.state, new UserView(CAROL, "carol"), true));
    }
}
