package com.example.battlearena.service;

import com.example.battlearena.catalog.OpponentCatalog;
import com.example.battlearena.config.GameRules;
import com.example.battlearena.error.ErrorResponse;
import com.example.battlearena.error.GameException;
import com.example.battlearena.error.InvalidInputException;
import com.example.battlearena.error.PersistenceFailureException;
import com.example.battlearena.logic.ActionResult;
import com.example.battlearena.logic.BattleEngine;
import com.example.battlearena.logic.Dice;
import com.example.battlearena.model.domain.*;
import com.example.battlearena.model.dto.AwakeningDTO;
import com.example.battlearena.model.dto.AwakeningEndDTO;
import com.example.battlearena.model.dto.BattleEndDTO;
import com.example.battlearena.model.dto.BattleUpdateDTO;
import com.example.battlearena.model.dto.MatchResult;
import com.example.battlearena.registry.BattleRegistry;
import com.example.battlearena.registry.MatchQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;

/**
 * Runs live battles. Every state change of a session (player action, scheduled opponent
 * turn, end of a cutscene, disconnect) happens inside {@code synchronized (session)}.
 */
@Slf4j
@Service
public class BattleService {

    private final BattleRegistry registry;
    private final MatchQueue matchQueue;
    private final BattleNotifier notifier;
    private final BattleTimerService timerService;
    private final PlayerProfileService profileService;
    private final RewardService rewardService;
    private final ProgressionService progressionService;
    private final OpponentCatalog opponentCatalog;
    private final Dice dice;
    private final GameRules rules;
    private final BattleEngine battleEngine;

    public BattleService(BattleRegistry registry,
            MatchQueue matchQueue,
            BattleNotifier notifier,
            BattleTimerService timerService,
            PlayerProfileService profileService,
            RewardService rewardService,
            ProgressionService progressionService,
            OpponentCatalog opponentCatalog,
            Dice dice,
            GameRules rules) {
        this.registry = registry;
        this.matchQueue = matchQueue;
        this.notifier = notifier;
        this.timerService = timerService;
        this.profileService = profileService;
        this.rewardService = rewardService;
        this.progressionService = progressionService;
        this.opponentCatalog = opponentCatalog;
        this.dice = dice;
        this.rules = rules;
        this.battleEngine = new BattleEngine(dice, rules.getBattle().getAwakeningTurns());
    }

    // --- Starting battles ---

    /**
     * Starts a battle against a random scripted opponent. A player who is already fighting
     * just gets the current state of that battle again, bound to the connection that asked.
     * A pending PvP search is cancelled.
     */
    public BattleSession startPveBattle(Long userId, String username, String connectionId) {
        BattleSession existing = registry.findByUser(userId).orElse(null);
        if (existing != null) {
            synchronized (existing) {
                String side = existing.sideOf(userId);
                CombatantState self = existing.getCombatant(side);
                if (connectionId != null && !connectionId.equals(self.getConnectionId())) {
                    log.info("Session {}: user {} moved to connection {}", existing.getSessionId(), userId,
                            connectionId);
                    self.setConnectionId(connectionId);
                }
                notifier.battleUpdate(userId, toDto(existing, side, null));
            }
            return existing;
        }

        synchronized (matchQueue) {
            matchQueue.removeByUser(userId).ifPresent(entry -> {
                log.info("User {} left the match queue to start a PvE battle", userId);
                notifier.matchmaking(userId, MatchResult.status(MatchResult.Status.CANCELLED,
                        "Search cancelled: you started a battle."));
            });
        }

        PlayerBuild build;
        try {
            build = profileService.computeBuild(userId);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not load build for user {}", userId, e);
            notifier.error(userId, ErrorResponse.of(new PersistenceFailureException(e)));
            return null;
        }

        OpponentTemplate opponent = opponentCatalog.pick(dice);
        BattleSession session = BattleSession.pve(
                CombatantState.player("p1", userId, username, connectionId, build),
                CombatantState.scripted("p2", opponent));
        session.appendLog("A wild " + opponent.getName() + " appears!");

        if (!registry.tryRegister(session)) {
            // lost a race with a concurrent start for the same player
            return startPveBattle(userId, username, connectionId);
        }
        log.info("PvE session {} created: {} vs {}", session.getSessionId(), username, opponent.getName());

        synchronized (session) {
            publish(session, null);
        }
        return session;
    }

    /**
     * Creates the session for two matched players. The older queue entry is p1 and moves first.
     *
     * @return the new session, or {@code null} if either player is already fighting
     */
    public BattleSession startPvpBattle(MatchmakingEntry first, MatchmakingEntry second) {
        BattleSession session = BattleSession.pvp(
                CombatantState.player("p1", first.getUserId(), first.getUsername(), first.getConnectionId(),
                        first.getBuild()),
                CombatantState.player("p2", second.getUserId(), second.getUsername(), second.getConnectionId(),
                        second.getBuild()));
        session.appendLog(first.getUsername() + " vs " + second.getUsername() + ". Fight!");
        if (!registry.tryRegister(session)) {
            return null;
        }
        log.info("PvP session {} created: {} vs {}", session.getSessionId(), first.getUsername(),
                second.getUsername());
        return session;
    }

    /** Sends each participant its first view of a new session. */
    public void publishInitialState(BattleSession session) {
        synchronized (session) {
            publish(session, null);
        }
    }

    // --- Actions ---

    public void submitAction(String sessionId, Long userId, BattleAction action) {
        BattleSession session = registry.find(sessionId);
        if (session == null) {
            rejectStale(sessionId, userId);
            return;
        }

        synchronized (session) {
            if (session.isFinished() || registry.find(sessionId) == null) {
                rejectStale(sessionId, userId);
                return;
            }
            String side = session.sideOf(userId);
            if (side == null) {
                log.debug("User {} is not part of session {}", userId, sessionId);
                notifier.error(userId, ErrorResponse.of(new InvalidInputException("not a participant of this battle")));
                return;
            }

            BattleSession.Snapshot before = session.snapshot();
            ActionResult result = battleEngine.applyAction(session, side, action);

            if (!result.isAccepted()) {
                log.debug("Session {}: {} refused {} ({})", sessionId, side, action, result.getRejection());
                BattleUpdateDTO update = toDto(session, side, null);
                update.setRejection(result.getRejection());
                notifier.battleUpdate(userId, update);
                return;
            }

            if (result.getAwakeningCast() != null) {
                onAwakeningCast(session, side, result.getAwakeningCast(), result);
                return;
            }

            if (result.isFinished()) {
                settle(session, before, result, () -> publish(session, null));
                return;
            }

            publish(session, result);
            if (session.getPhase() == BattlePhase.AWAITING_OPPONENT) {
                scheduleOpponentTurn(session);
            }
        }
    }

    private void scheduleOpponentTurn(BattleSession session) {
        timerService.schedule(session, rules.getBattle().getOpponentTurnDelayMs(),
                () -> runOpponentTurn(session.getSessionId()));
    }

    void runOpponentTurn(String sessionId) {
        BattleSession session = registry.find(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.setPendingTimer(null);
            BattleSession.Snapshot before = session.snapshot();
            ActionResult result = battleEngine.resolveScriptedTurn(session);
            if (result == null) {
                return;
            }
            if (result.isFinished()) {
                settle(session, before, result, () -> scheduleOpponentTurn(session));
                return;
            }
            publish(session, result);
        }
    }

    private void onAwakeningCast(BattleSession session, String casterId, Awakening awakening, ActionResult result) {
        CombatantState caster = session.getCombatant(casterId);
        CombatantState other = session.getOpponentOf(casterId);
        long delay = rules.getBattle().getAwakeningDelayMs();
        log.info("Session {}: {} awakened {}", session.getSessionId(), caster.getName(), awakening.getCharacter());

        AwakeningDTO cue = new AwakeningDTO(session.getSessionId(), awakening.getCharacter(),
                awakening.getAbilityName(), new ArrayList<>(awakening.getOpponentLines()), awakening.getTheme(), delay);
        notifier.awakening(caster.getUserId(), cue);
        notifier.opponentAwakening(other.getUserId(), cue);
        publish(session, result);

        timerService.schedule(session, delay, () -> completeAwakening(session.getSessionId()));
    }

    void completeAwakening(String sessionId) {
        BattleSession session = registry.find(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.setPendingTimer(null);
            if (battleEngine.finishAwakening(session)) {
                publish(session, null);
            }
        }
    }

    // --- Termination ---

    /**
     * Pays out a finished battle. If the store refuses, the session goes back to where it was
     * before the deciding action and {@code onRollback} runs so the step can happen again.
     */
    private void settle(BattleSession session, BattleSession.Snapshot before, ActionResult result,
            Runnable onRollback) {
        String winnerId = session.getWinnerId();
        CombatantState winner = session.getCombatant(winnerId);
        CombatantState loser = session.getOpponentOf(winnerId);

        RewardService.Settlement winnerSettlement = RewardService.Settlement.none();
        RewardService.Settlement loserSettlement = RewardService.Settlement.none();
        try {
            if (session.getMode() == BattleMode.PVE) {
                if (winner.isScripted()) {
                    loserSettlement = rewardService.settlePveLoss(loser.getUserId());
                } else {
                    winnerSettlement = rewardService.settlePveWin(winner.getUserId());
                }
            } else {
                winnerSettlement = rewardService.settlePvpWin(winner.getUserId());
            }
        } catch (DataAccessException | TransactionException | PersistenceFailureException e) {
            log.warn("Session {}: settlement failed, rolling back the last action", session.getSessionId(), e);
            session.restore(before);
            ErrorResponse error = ErrorResponse.of(e instanceof PersistenceFailureException
                    ? (PersistenceFailureException) e
                    : new PersistenceFailureException(e));
            notifier.error(winner.getUserId(), error);
            notifier.error(loser.getUserId(), error);
            onRollback.run();
            return;
        } catch (GameException e) {
            // account vanished mid-battle: nothing left to pay, the battle still ends
            log.error("Session {}: settlement skipped: {}", session.getSessionId(), e.getMessage());
        }

        timerService.cancel(session);
        registry.remove(session);
        log.info("Session {} finished, winner {}", session.getSessionId(), winner.getName());

        publish(session, result);
        progressionService.announceLevelUps(winner.getUserId(), winnerSettlement.getLevelsReached());
        notifier.battleEnd(winner.getUserId(), new BattleEndDTO(session.getSessionId(), true,
                victoryMessage(loser, winnerSettlement), BattleEndDTO.Reason.NORMAL,
                winnerSettlement.getCoinsDelta(), winnerSettlement.getXpGained()));
        notifier.battleEnd(loser.getUserId(), new BattleEndDTO(session.getSessionId(), false,
                defeatMessage(winner, loserSettlement), BattleEndDTO.Reason.NORMAL,
                loserSettlement.getCoinsDelta(), loserSettlement.getXpGained()));
    }

    /**
     * Ends whatever battle the connection was in. PvE battles are dropped; in PvP the other
     * side wins by forfeit, without any reward.
     */
    public void onDisconnect(String connectionId) {
        BattleSession session = registry.findByConnection(connectionId).orElse(null);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (session.isFinished()) {
                return;
            }
            String leaver = session.sideOfConnection(connectionId);
            timerService.cancel(session);
            session.setPhase(BattlePhase.FINISHED);
            registry.remove(session);

            if (session.getMode() == BattleMode.PVE) {
                log.info("PvE session {} discarded, player disconnected", session.getSessionId());
                return;
            }

            String remainingId = session.getOpponentId(leaver);
            CombatantState remaining = session.getCombatant(remainingId);
            session.setWinnerId(remainingId);
            log.info("PvP session {}: {} disconnected, {} wins by forfeit", session.getSessionId(),
                    session.getCombatant(leaver).getName(), remaining.getName());

            notifier.opponentDisconnected(remaining.getUserId(), session.getSessionId());
            notifier.battleEnd(remaining.getUserId(), new BattleEndDTO(session.getSessionId(), true,
                    "Your opponent left the battle. You win!", BattleEndDTO.Reason.FORFEIT, 0, 0));
        }
    }

    public BattleUpdateDTO findActiveBattle(Long userId) {
        BattleSession session = registry.findByUser(userId).orElse(null);
        if (session == null) {
            return null;
        }
        synchronized (session) {
            if (session.isFinished()) {
                return null;
            }
            return toDto(session, session.sideOf(userId), null);
        }
    }

    // --- Views ---

    private void rejectStale(String sessionId, Long userId) {
        log.debug("Action for stale session {} from user {}", sessionId, userId);
        notifier.battleEnd(userId, new BattleEndDTO(sessionId, false, "This battle is no longer active.",
                BattleEndDTO.Reason.STALE_SESSION, 0, 0));
    }

    // Each human participant gets its own perspective; a pending awakening-end goes out first.
    private void publish(BattleSession session, ActionResult result) {
        for (String side : new String[]{"p1", "p2"}) {
            CombatantState self = session.getCombatant(side);
            if (self.isScripted()) {
                continue;
            }
            if (result != null && result.getAwakeningEndedFor() != null) {
                CombatantState ended = session.getCombatant(result.getAwakeningEndedFor());
                notifier.awakeningEnd(self.getUserId(), new AwakeningEndDTO(session.getSessionId(),
                        ended.getName(), ended.getAwakenedState().getCharacter()));
            }
            notifier.battleUpdate(self.getUserId(), toDto(session, side, result));
        }
    }

    BattleUpdateDTO toDto(BattleSession session, String side, ActionResult result) {
        CombatantState self = session.getCombatant(side);
        BattleUpdateDTO dto = new BattleUpdateDTO();
        dto.setSessionId(session.getSessionId());
        dto.setMode(session.getMode());
        dto.setPhase(session.getPhase());
        dto.setLog(new ArrayList<>(session.getLog()));
        dto.setPlayer(self.copy());
        dto.setOpponent(session.getOpponentOf(side).copy());

        boolean myTurn = session.getPhase() == BattlePhase.AWAITING_ACTION
                && side.equals(session.getCurrentTurnPlayerId());
        dto.setPlayerTurn(myTurn);
        dto.setCanUseAbility(myTurn && self.canUseAbility());

        if (result != null) {
            boolean mine = side.equals(result.getActorId());
            dto.setDamageToOpponent(mine ? result.getDamage() : 0);
            dto.setDamageToPlayer(mine ? 0 : result.getDamage());
            dto.setAbilityUsed(result.getAwakeningCast() != null);
            dto.setCritical(result.isCritical());
            dto.setMissed(result.isMissed());
        }
        return dto;
    }

    private static String victoryMessage(CombatantState loser, RewardService.Settlement settlement) {
        StringBuilder message = new StringBuilder("Victory! You defeated ").append(loser.getName()).append('.');
        if (settlement.getCoinsDelta() > 0) {
            message.append(" +").append(settlement.getCoinsDelta()).append(" coins.");
        }
        if (settlement.getXpGained() > 0) {
            message.append(" +").append(settlement.getXpGained()).append(" XP.");
        }
        return message.toString();
    }

    private static String defeatMessage(CombatantState winner, RewardService.Settlement settlement) {
        StringBuilder message = new StringBuilder("Defeat... ").append(winner.getName()).append(" was stronger.");
        if (settlement.getCoinsDelta() < 0) {
            message.append(" You lost ").append(-settlement.getCoinsDelta()).append(" coins.");
        }
        return message.toString();
    }
}
