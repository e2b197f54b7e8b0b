package com.example.battlearena.service;

import com.example.battlearena.catalog.OpponentCatalog;
import com.example.battlearena.config.GameRules;
import com.example.battlearena.logic.Dice;
import com.example.battlearena.model.domain.*;
import com.example.battlearena.model.dto.BattleEndDTO;
import com.example.battlearena.model.dto.BattleUpdateDTO;
import com.example.battlearena.model.dto.MatchResult;
import com.example.battlearena.registry.BattleRegistry;
import com.example.battlearena.registry.MatchQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BattleServiceTest {

    private static final Long USER = 1L;
    private static final Long RIVAL = 2L;

    private BattleService battleService;
    private BattleRegistry registry;
    private MatchQueue matchQueue;

    @Mock
    private BattleNotifier notifier;
    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private PlayerProfileService profileService;
    @Mock
    private RewardService rewardService;
    @Mock
    private ProgressionService progressionService;
    @Mock
    private OpponentCatalog opponentCatalog;
    @Mock
    private Dice dice;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new BattleRegistry();
        matchQueue = new MatchQueue();
        battleService = new BattleService(registry, matchQueue, notifier, new BattleTimerService(taskScheduler),
                profileService, rewardService, progressionService, opponentCatalog, dice, new GameRules());

        when(dice.variance(anyDouble())).thenReturn(1.0);
        when(dice.chance(anyDouble())).thenReturn(false);
        when(profileService.computeBuild(USER)).thenReturn(build(100, 200, null));
        when(opponentCatalog.pick(dice)).thenReturn(new OpponentTemplate("Brute Orc", 120, 150));
        when(rewardService.settlePveWin(any())).thenReturn(RewardService.Settlement.none());
        when(rewardService.settlePveLoss(any())).thenReturn(RewardService.Settlement.none());
        when(rewardService.settlePvpWin(any())).thenReturn(RewardService.Settlement.none());
    }

    @Test
    void testStartPveBattlePublishesInitialState() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        assertNotNull(session);
        assertSame(session, registry.find(session.getSessionId()));
        assertEquals(BattleMode.PVE, session.getMode());
        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());

        ArgumentCaptor<BattleUpdateDTO> update = ArgumentCaptor.forClass(BattleUpdateDTO.class);
        verify(notifier).battleUpdate(eq(USER), update.capture());
        assertTrue(update.getValue().isPlayerTurn());
        assertEquals("Brute Orc", update.getValue().getOpponent().getName());
        assertEquals(200, update.getValue().getPlayer().getHealth());
    }

    @Test
    void testStartingTwiceResendsTheSameBattle() {
        BattleSession first = battleService.startPveBattle(USER, "hero", "conn-1");
        BattleSession second = battleService.startPveBattle(USER, "hero", "conn-1");

        assertSame(first, second);
        assertEquals(1, registry.size());
        verify(notifier, times(2)).battleUpdate(eq(USER), any());
        verify(profileService, times(1)).computeBuild(USER);
    }

    @Test
    void testResendMovesBattleToNewConnection() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.startPveBattle(USER, "hero", "conn-2");

        assertEquals("conn-2", session.getP1().getConnectionId());
        battleService.onDisconnect("conn-1");
        assertSame(session, registry.find(session.getSessionId()));
        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());

        battleService.onDisconnect("conn-2");
        assertNull(registry.find(session.getSessionId()));
    }

    @Test
    void testStartingPveCancelsPendingSearch() {
        matchQueue.enqueue(new MatchmakingEntry(USER, "hero", "conn-1", build(100, 200, null), 1L));
        matchQueue.enqueue(new MatchmakingEntry(RIVAL, "rival", "conn-2", build(100, 200, null), 2L));

        battleService.startPveBattle(USER, "hero", "conn-1");

        assertFalse(matchQueue.contains(USER));
        assertTrue(matchQueue.contains(RIVAL));
        verify(notifier).matchmaking(eq(USER), argThat(r -> r.getStatus() == MatchResult.Status.CANCELLED));
        verify(notifier, never()).matchmaking(eq(RIVAL), any());
    }

    @Test
    void testStartingPveWithoutSearchSendsNoMatchmakingEvent() {
        battleService.startPveBattle(USER, "hero", "conn-1");

        verify(notifier, never()).matchmaking(any(), any());
    }

    @Test
    void testStartFailsCleanlyWhenProfileCannotBeLoaded() {
        when(profileService.computeBuild(USER)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertNull(battleService.startPveBattle(USER, "hero", "conn-1"));

        assertEquals(0, registry.size());
        verify(notifier).error(eq(USER), argThat(e -> e.isRetryable()));
    }

    @Test
    void testOpponentRetaliatesAfterDelay() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        assertEquals(100, session.getP2().getHealth());
        assertEquals(BattlePhase.AWAITING_OPPONENT, session.getPhase());
        Runnable opponentTurn = captureScheduled(1);

        opponentTurn.run();

        assertEquals(104, session.getP1().getHealth());
        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());
        verify(notifier, times(3)).battleUpdate(eq(USER), any());
    }

    @Test
    void testRefusedActionResendsStateWithReason() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        // opponent turn still pending
        battleService.submitAction(session.getSessionId(), USER, BattleAction.STRONG_ATTACK);

        ArgumentCaptor<BattleUpdateDTO> update = ArgumentCaptor.forClass(BattleUpdateDTO.class);
        verify(notifier, times(3)).battleUpdate(eq(USER), update.capture());
        assertEquals(ActionRejection.INVALID_ACTION, update.getValue().getRejection());
        assertEquals(100, update.getValue().getOpponent().getHealth());
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void testVictoryIsSettledExactlyOnce() {
        when(profileService.computeBuild(USER)).thenReturn(build(400, 200, null));
        when(rewardService.settlePveWin(USER)).thenReturn(new RewardService.Settlement(50, 50, List.of(2)));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        assertEquals(BattlePhase.FINISHED, session.getPhase());
        assertNull(registry.find(session.getSessionId()));
        verify(rewardService, times(1)).settlePveWin(USER);

        InOrder inOrder = inOrder(notifier, progressionService);
        inOrder.verify(notifier, times(2)).battleUpdate(eq(USER), any());
        inOrder.verify(progressionService).announceLevelUps(USER, List.of(2));
        inOrder.verify(notifier).battleEnd(eq(USER), argThat(end -> end.isWin()
                && end.getReason() == BattleEndDTO.Reason.NORMAL && end.getCoinsDelta() == 50));

        // the battle is gone; a late click gets a stale answer and no second payout
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        verify(notifier).battleEnd(eq(USER), argThat(end -> end.getReason() == BattleEndDTO.Reason.STALE_SESSION));
        verify(rewardService, times(1)).settlePveWin(USER);
    }

    @Test
    void testDefeatChargesLossPenalty() {
        when(profileService.computeBuild(USER)).thenReturn(build(10, 50, null));
        when(rewardService.settlePveLoss(USER)).thenReturn(new RewardService.Settlement(-25, 0, Collections.emptyList()));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        captureScheduled(1).run();

        assertEquals(0, session.getP1().getHealth());
        verify(rewardService).settlePveLoss(USER);
        verify(rewardService, never()).settlePveWin(any());
        verify(notifier).battleEnd(eq(USER), argThat(end -> !end.isWin() && end.getCoinsDelta() == -25));
    }

    @Test
    void testFailedSettlementRollsBackDecidingAction() {
        when(profileService.computeBuild(USER)).thenReturn(build(400, 200, null));
        when(rewardService.settlePveWin(USER)).thenThrow(new DataAccessResourceFailureException("db down"));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");
        int logSize = session.getLog().size();

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        assertSame(session, registry.find(session.getSessionId()));
        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());
        assertEquals(150, session.getP2().getHealth());
        assertNull(session.getWinnerId());
        assertEquals(logSize, session.getLog().size());
        verify(notifier).error(eq(USER), argThat(e -> e.isRetryable()));
        verify(notifier, never()).battleEnd(any(), any());

        // the retry goes through once the store is back
        reset(rewardService);
        when(rewardService.settlePveWin(USER)).thenReturn(new RewardService.Settlement(50, 50, Collections.emptyList()));
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        verify(rewardService, times(1)).settlePveWin(USER);
        assertNull(registry.find(session.getSessionId()));
    }

    @Test
    void testFailedSettlementOnOpponentTurnIsRescheduled() {
        when(profileService.computeBuild(USER)).thenReturn(build(10, 50, null));
        when(rewardService.settlePveLoss(USER)).thenThrow(new DataAccessResourceFailureException("db down"));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        captureScheduled(1).run();

        assertEquals(BattlePhase.AWAITING_OPPONENT, session.getPhase());
        assertEquals(50, session.getP1().getHealth());
        captureScheduled(2);
    }

    @Test
    void testAwakeningCutsceneThenControlReturns() {
        when(profileService.computeBuild(USER)).thenReturn(build(100, 200, "Jacket"));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.submitAction(session.getSessionId(), USER, BattleAction.USE_ABILITY);

        assertEquals(BattlePhase.AWAKENING, session.getPhase());
        verify(notifier).awakening(eq(USER), argThat(cue -> "Jacket".equals(cue.getCharacter())
                && cue.getTheme().endsWith(".mp3") && cue.getDurationMs() == 4500));
        // scripted opponents have no queue
        verify(notifier).opponentAwakening(isNull(), any());

        captureScheduled(1).run();

        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());
        assertEquals("p1", session.getCurrentTurnPlayerId());

        battleService.submitAction(session.getSessionId(), USER, BattleAction.AWAKENED_ABILITY);
        assertEquals(0, session.getP2().getHealth());
    }

    @Test
    void testAwakeningEndIsAnnouncedBeforeTheHitThatFollows() {
        when(profileService.computeBuild(USER)).thenReturn(build(100, 100000, "Jacket"));
        when(opponentCatalog.pick(dice)).thenReturn(new OpponentTemplate("Training Golem", 10, 100000));
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");
        battleService.submitAction(session.getSessionId(), USER, BattleAction.USE_ABILITY);
        captureScheduled(1).run();

        for (int turn = 1; turn <= 3; turn++) {
            battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
            captureScheduled(turn + 1).run();
        }

        assertFalse(session.getP1().getAwakenedState().isActive());
        InOrder inOrder = inOrder(notifier);
        inOrder.verify(notifier).awakeningEnd(eq(USER), any());
        inOrder.verify(notifier).battleUpdate(eq(USER), argThat(u -> u.getDamageToPlayer() == 8));
        verify(notifier, times(1)).awakeningEnd(any(), any());
    }

    @Test
    void testPveDisconnectDiscardsBattleSilently() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        Runnable pending = captureScheduled(1);

        battleService.onDisconnect("conn-1");

        assertEquals(0, registry.size());
        pending.run();
        assertEquals(200, session.getP1().getHealth());
        verify(notifier, never()).battleEnd(any(), any());
        verifyNoInteractions(rewardService);
    }

    @Test
    void testPvpForfeitOnDisconnect() {
        BattleSession session = startPvp();

        battleService.onDisconnect("conn-1");

        assertEquals(BattlePhase.FINISHED, session.getPhase());
        assertEquals("p2", session.getWinnerId());
        assertFalse(registry.isInBattle(USER));
        assertFalse(registry.isInBattle(RIVAL));
        InOrder inOrder = inOrder(notifier);
        inOrder.verify(notifier).opponentDisconnected(RIVAL, session.getSessionId());
        inOrder.verify(notifier).battleEnd(eq(RIVAL), argThat(end -> end.isWin()
                && end.getReason() == BattleEndDTO.Reason.FORFEIT));
        verify(notifier, never()).battleEnd(eq(USER), any());
        verifyNoInteractions(rewardService);
    }

    @Test
    void testPvpUpdatesArePerspectiveSwapped() {
        BattleSession session = startPvp();
        clearInvocations(notifier);

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        ArgumentCaptor<BattleUpdateDTO> mine = ArgumentCaptor.forClass(BattleUpdateDTO.class);
        ArgumentCaptor<BattleUpdateDTO> theirs = ArgumentCaptor.forClass(BattleUpdateDTO.class);
        verify(notifier).battleUpdate(eq(USER), mine.capture());
        verify(notifier).battleUpdate(eq(RIVAL), theirs.capture());

        assertEquals("hero", mine.getValue().getPlayer().getName());
        assertEquals(50, mine.getValue().getDamageToOpponent());
        assertFalse(mine.getValue().isPlayerTurn());

        assertEquals("rival", theirs.getValue().getPlayer().getName());
        assertEquals(50, theirs.getValue().getDamageToPlayer());
        assertEquals(150, theirs.getValue().getPlayer().getHealth());
        assertTrue(theirs.getValue().isPlayerTurn());
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void testPvpOutOfTurnActionIsRefused() {
        BattleSession session = startPvp();
        clearInvocations(notifier);

        battleService.submitAction(session.getSessionId(), RIVAL, BattleAction.FAST_ATTACK);

        verify(notifier).battleUpdate(eq(RIVAL), argThat(u -> u.getRejection() == ActionRejection.INVALID_ACTION));
        verify(notifier, never()).battleUpdate(eq(USER), any());
        assertEquals(200, session.getP1().getHealth());
    }

    @Test
    void testPvpAwakeningShowsCutsceneToBothSides() {
        BattleSession session = startPvp(build(100, 100000, "Jacket"), build(10, 100000, null));
        clearInvocations(notifier);

        battleService.submitAction(session.getSessionId(), USER, BattleAction.USE_ABILITY);

        assertEquals(BattlePhase.AWAKENING, session.getPhase());
        verify(notifier).awakening(eq(USER), argThat(cue -> "Jacket".equals(cue.getCharacter())
                && "Violent Combo".equals(cue.getAbilityName())));
        verify(notifier).opponentAwakening(eq(RIVAL), argThat(cue -> "Jacket".equals(cue.getCharacter())
                && Awakening.JACKET.getOpponentLines().equals(cue.getMessages())
                && "/audio/jacket-theme.mp3".equals(cue.getTheme())
                && cue.getDurationMs() == 4500));
        verify(notifier).battleUpdate(eq(RIVAL), argThat(u -> !u.isPlayerTurn() && u.isAbilityUsed()));

        // nobody acts while the cutscene plays
        battleService.submitAction(session.getSessionId(), RIVAL, BattleAction.FAST_ATTACK);
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        verify(notifier).battleUpdate(eq(RIVAL), argThat(u -> u.getRejection() == ActionRejection.INVALID_ACTION));
        verify(notifier).battleUpdate(eq(USER), argThat(u -> u.getRejection() == ActionRejection.INVALID_ACTION));
        assertEquals(100000, session.getP1().getHealth());
        assertEquals(100000, session.getP2().getHealth());

        captureScheduled(1).run();

        assertEquals(BattlePhase.AWAITING_ACTION, session.getPhase());
        assertEquals("p1", session.getCurrentTurnPlayerId());
    }

    @Test
    void testPvpAwakeningEndReachesBothSidesBeforeTheThirdCounterattack() {
        BattleSession session = startPvp(build(100, 100000, "Jacket"), build(10, 100000, null));
        battleService.submitAction(session.getSessionId(), USER, BattleAction.USE_ABILITY);
        captureScheduled(1).run();

        battleService.submitAction(session.getSessionId(), USER, BattleAction.AWAKENED_ABILITY);
        assertEquals(99700, session.getP2().getHealth());
        battleService.submitAction(session.getSessionId(), RIVAL, BattleAction.FAST_ATTACK);
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        battleService.submitAction(session.getSessionId(), RIVAL, BattleAction.FAST_ATTACK);
        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);
        verify(notifier, never()).awakeningEnd(any(), any());
        clearInvocations(notifier);

        battleService.submitAction(session.getSessionId(), RIVAL, BattleAction.FAST_ATTACK);

        assertFalse(session.getP1().getAwakenedState().isActive());
        InOrder inOrder = inOrder(notifier);
        inOrder.verify(notifier).awakeningEnd(eq(USER), argThat(end -> "Jacket".equals(end.getCharacter())
                && "hero".equals(end.getCombatantName())));
        inOrder.verify(notifier).battleUpdate(eq(USER), argThat(u -> u.getDamageToPlayer() == 5));
        inOrder.verify(notifier).awakeningEnd(eq(RIVAL), any());
        inOrder.verify(notifier).battleUpdate(eq(RIVAL), argThat(u -> u.getDamageToOpponent() == 5));
        assertEquals(99985, session.getP1().getHealth());
    }

    @Test
    void testPvpWinnerIsRewarded() {
        when(rewardService.settlePvpWin(USER)).thenReturn(new RewardService.Settlement(0, 75, Collections.emptyList()));
        BattleSession session = startPvp();
        session.getP2().setHealth(10);

        battleService.submitAction(session.getSessionId(), USER, BattleAction.FAST_ATTACK);

        verify(rewardService).settlePvpWin(USER);
        verify(rewardService, never()).settlePvpWin(RIVAL);
        verify(notifier).battleEnd(eq(USER), argThat(end -> end.isWin() && end.getXpGained() == 75));
        verify(notifier).battleEnd(eq(RIVAL), argThat(end -> !end.isWin() && end.getCoinsDelta() == 0));
    }

    @Test
    void testNonParticipantCannotAct() {
        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        battleService.submitAction(session.getSessionId(), 99L, BattleAction.FAST_ATTACK);

        assertEquals(150, session.getP2().getHealth());
        verify(notifier).error(eq(99L), any());
    }

    @Test
    void testActiveBattleLookup() {
        assertNull(battleService.findActiveBattle(USER));

        BattleSession session = battleService.startPveBattle(USER, "hero", "conn-1");

        BattleUpdateDTO active = battleService.findActiveBattle(USER);
        assertEquals(session.getSessionId(), active.getSessionId());
        assertTrue(active.isPlayerTurn());
        assertFalse(active.isCanUseAbility());
    }

    private BattleSession startPvp() {
        return startPvp(build(100, 200, null), build(100, 200, null));
    }

    private BattleSession startPvp(PlayerBuild heroBuild, PlayerBuild rivalBuild) {
        BattleSession session = battleService.startPvpBattle(
                new MatchmakingEntry(USER, "hero", "conn-1", heroBuild, 1L),
                new MatchmakingEntry(RIVAL, "rival", "conn-2", rivalBuild, 2L));
        battleService.publishInitialState(session);
        return session;
    }

    private Runnable captureScheduled(int expectedCalls) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(expectedCalls)).schedule(task.capture(), any(Instant.class));
        return task.getValue();
    }

    private static PlayerBuild build(int power, int health, String abilityCollectible) {
        PlayerBuild build = new PlayerBuild();
        build.setTotalPower(power);
        build.setTotalHealth(health);
        build.setAbilityCollectible(abilityCollectible);
        return build;
    }
}
