package com.example.battlearena.registry;

import com.example.battlearena.model.domain.BattleSession;
import com.example.battlearena.model.domain.CombatantState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live battle sessions. A user is bound to at most one session at a time.
 */
@Component
public class BattleRegistry {

    private final Map<String, BattleSession> sessions = new ConcurrentHashMap<>();
    private final Map<Long, String> sessionByUser = new ConcurrentHashMap<>();

    /**
     * Adds the session unless one of its players is already bound to another battle.
     *
     * @return false if the session was not added
     */
    public synchronized boolean tryRegister(BattleSession session) {
        if (isBound(session.getP1()) || isBound(session.getP2())) {
            return false;
        }
        sessions.put(session.getSessionId(), session);
        bind(session.getP1(), session);
        bind(session.getP2(), session);
        return true;
    }

    private boolean isBound(CombatantState combatant) {
        return !combatant.isScripted() && sessionByUser.containsKey(combatant.getUserId());
    }

    private void bind(CombatantState combatant, BattleSession session) {
        if (!combatant.isScripted()) {
            sessionByUser.put(combatant.getUserId(), session.getSessionId());
        }
    }

    public BattleSession find(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    public Optional<BattleSession> findByUser(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        String sessionId = sessionByUser.get(userId);
        return Optional.ofNullable(sessionId == null ? null : sessions.get(sessionId));
    }

    public boolean isInBattle(Long userId) {
        return findByUser(userId).isPresent();
    }

    public Optional<BattleSession> findByConnection(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> s.sideOfConnection(connectionId) != null)
                .findFirst();
    }

    public synchronized void remove(BattleSession session) {
        sessions.remove(session.getSessionId());
        // only drop the user's binding if it still points at this session
        unbind(session.getP1(), session);
        unbind(session.getP2(), session);
    }

    private void unbind(CombatantState combatant, BattleSession session) {
        if (!combatant.isScripted()) {
            sessionByUser.remove(combatant.getUserId(), session.getSessionId());
        }
    }

    public int size() {
        return sessions.size();
    }
}
