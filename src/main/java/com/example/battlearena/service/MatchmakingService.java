package com.example.battlearena.service;

import com.example.battlearena.error.ErrorResponse;
import com.example.battlearena.error.PersistenceFailureException;
import com.example.battlearena.model.domain.BattleSession;
import com.example.battlearena.model.domain.MatchmakingEntry;
import com.example.battlearena.model.domain.PlayerBuild;
import com.example.battlearena.model.dto.MatchResult;
import com.example.battlearena.registry.BattleRegistry;
import com.example.battlearena.registry.ConnectionRegistry;
import com.example.battlearena.registry.MatchQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Pairs waiting players first come, first served. Enqueue, pairing and removal all happen
 * under the queue's monitor, so a player can never be matched twice.
 */
@Slf4j
@Service
public class MatchmakingService {

    private final MatchQueue matchQueue;
    private final ConnectionRegistry connections;
    private final BattleRegistry battles;
    private final BattleService battleService;
    private final PlayerProfileService profileService;
    private final BattleNotifier notifier;

    public MatchmakingService(MatchQueue matchQueue,
            ConnectionRegistry connections,
            BattleRegistry battles,
            BattleService battleService,
            PlayerProfileService profileService,
            BattleNotifier notifier) {
        this.matchQueue = matchQueue;
        this.connections = connections;
        this.battles = battles;
        this.battleService = battleService;
        this.profileService = profileService;
        this.notifier = notifier;
    }

    /**
     * Queues the player for a PvP match and starts one if somebody is already waiting.
     */
    public void findMatch(Long userId, String username, String connectionId) {
        if (battles.isInBattle(userId)) {
            notifier.matchmaking(userId, MatchResult.status(MatchResult.Status.ALREADY_IN_BATTLE,
                    "You are already in a battle."));
            return;
        }

        PlayerBuild build;
        try {
            build = profileService.computeBuild(userId);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not load build for user {}", userId, e);
            notifier.error(userId, ErrorResponse.of(new PersistenceFailureException(e)));
            return;
        }

        synchronized (matchQueue) {
            if (matchQueue.contains(userId)) {
                log.debug("User {} is already queued", userId);
                notifier.matchmaking(userId, MatchResult.status(MatchResult.Status.ALREADY_QUEUED,
                        "You are already searching for an opponent."));
                return;
            }
            if (battles.isInBattle(userId)) {
                notifier.matchmaking(userId, MatchResult.status(MatchResult.Status.ALREADY_IN_BATTLE,
                        "You are already in a battle."));
                return;
            }

            matchQueue.enqueue(new MatchmakingEntry(userId, username, connectionId, build,
                    System.currentTimeMillis()));
            log.info("User {} ({}) joined the match queue, {} waiting", username, userId, matchQueue.size());
            notifier.matchmaking(userId, MatchResult.status(MatchResult.Status.SEARCHING,
                    "Searching for an opponent..."));

            while (true) {
                Optional<MatchQueue.Pair> pair = matchQueue.pollPair(e -> connections.isAlive(e.getConnectionId()));
                if (pair.isEmpty()) {
                    return;
                }

                BattleSession session = battleService.startPvpBattle(pair.get().getFirst(), pair.get().getSecond());
                if (session != null) {
                    announce(session, pair.get());
                    battleService.publishInitialState(session);
                    return;
                }
                // one of them is already fighting: that entry leaves, the other keeps its place
                requeueOrCancel(pair.get().getSecond());
                requeueOrCancel(pair.get().getFirst());
            }
        }
    }

    private void requeueOrCancel(MatchmakingEntry entry) {
        if (battles.isInBattle(entry.getUserId())) {
            log.info("User {} left the match queue, already in a battle", entry.getUserId());
            notifier.matchmaking(entry.getUserId(), MatchResult.status(MatchResult.Status.CANCELLED,
                    "Search cancelled: you are already in a battle."));
        } else {
            matchQueue.requeueFront(entry);
        }
    }

    private void announce(BattleSession session, MatchQueue.Pair pair) {
        MatchmakingEntry first = pair.getFirst();
        MatchmakingEntry second = pair.getSecond();
        log.info("Match found: {} vs {} in {}", first.getUsername(), second.getUsername(), session.getSessionId());

        notifier.matchmaking(first.getUserId(), new MatchResult(MatchResult.Status.MATCH_FOUND,
                session.getSessionId(), "p1", first.getUsername(), second.getUsername(),
                "Opponent found: " + second.getUsername()));
        notifier.matchmaking(second.getUserId(), new MatchResult(MatchResult.Status.MATCH_FOUND,
                session.getSessionId(), "p2", first.getUsername(), second.getUsername(),
                "Opponent found: " + first.getUsername()));
    }

    /** Drops the connection's queue entry, if any, leaving everyone else in place. */
    public void onDisconnect(String connectionId) {
        synchronized (matchQueue) {
            matchQueue.removeByConnection(connectionId)
                    .ifPresent(entry -> log.info("User {} left the match queue", entry.getUserId()));
        }
    }
}
