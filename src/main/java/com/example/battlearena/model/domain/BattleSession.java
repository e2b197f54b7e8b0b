package com.example.battlearena.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Live state of one battle. All mutation happens while holding the session's monitor.
 */
@Data
@NoArgsConstructor
public class BattleSession {

    private String sessionId;
    private BattleMode mode;
    private CombatantState p1;
    private CombatantState p2; // scripted opponent in PvE
    private BattlePhase phase;
    private String currentTurnPlayerId;
    private String winnerId;
    private List<String> log = new ArrayList<>();
    private long createdAt;

    // Not serializable, owned by the session until it finishes
    @JsonIgnore
    private transient ScheduledFuture<?> pendingTimer;

    public static BattleSession pve(CombatantState player, CombatantState opponent) {
        return create(BattleMode.PVE, player, opponent);
    }

    public static BattleSession pvp(CombatantState first, CombatantState second) {
        return create(BattleMode.PVP, first, second);
    }

    private static BattleSession create(BattleMode mode, CombatantState p1, CombatantState p2) {
        BattleSession session = new BattleSession();
        session.sessionId = (mode == BattleMode.PVE ? "pve-" : "pvp-") + UUID.randomUUID();
        session.mode = mode;
        session.p1 = p1;
        session.p2 = p2;
        session.phase = BattlePhase.AWAITING_ACTION;
        session.currentTurnPlayerId = "p1";
        session.createdAt = System.currentTimeMillis();
        return session;
    }

    public CombatantState getCombatant(String combatantId) {
        return "p1".equals(combatantId) ? p1 : p2;
    }

    public String getOpponentId(String combatantId) {
        return "p1".equals(combatantId) ? "p2" : "p1";
    }

    public CombatantState getOpponentOf(String combatantId) {
        return getCombatant(getOpponentId(combatantId));
    }

    /** @return "p1", "p2" or {@code null} if the user does not fight in this session */
    public String sideOf(Long userId) {
        if (userId == null) {
            return null;
        }
        if (userId.equals(p1.getUserId())) {
            return "p1";
        }
        if (userId.equals(p2.getUserId())) {
            return "p2";
        }
        return null;
    }

    /** @return the side bound to the connection, or {@code null} */
    public String sideOfConnection(String connectionId) {
        if (connectionId == null) {
            return null;
        }
        if (connectionId.equals(p1.getConnectionId())) {
            return "p1";
        }
        if (connectionId.equals(p2.getConnectionId())) {
            return "p2";
        }
        return null;
    }

    @JsonIgnore
    public boolean isFinished() {
        return phase == BattlePhase.FINISHED;
    }

    public void appendLog(String line) {
        if (line != null && !line.isEmpty()) {
            log.add(line);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(p1.copy(), p2.copy(), phase, currentTurnPlayerId, winnerId, log.size());
    }

    /** Puts the combat state back to how it was when the snapshot was taken. */
    public void restore(Snapshot snapshot) {
        this.p1 = snapshot.p1;
        this.p2 = snapshot.p2;
        this.phase = snapshot.phase;
        this.currentTurnPlayerId = snapshot.turn;
        this.winnerId = snapshot.winnerId;
        while (log.size() > snapshot.logSize) {
            log.remove(log.size() - 1);
        }
    }

    public static final class Snapshot {
        private final CombatantState p1;
        private final CombatantState p2;
        private final BattlePhase phase;
        private final String turn;
        private final String winnerId;
        private final int logSize;

        private Snapshot(CombatantState p1, CombatantState p2, BattlePhase phase, String turn,
                String winnerId, int logSize) {
            this.p1 = p1;
            this.p2 = p2;
            this.phase = phase;
            this.turn = turn;
            this.winnerId = winnerId;
            this.logSize = logSize;
        }
    }
}
