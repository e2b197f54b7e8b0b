package com.example.battlearena.logic;

import com.example.battlearena.model.domain.ActionRejection;
import com.example.battlearena.model.domain.Awakening;
import com.example.battlearena.model.domain.BattleAction;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What one resolved (or refused) turn did to a session. */
@Data
@NoArgsConstructor
public class ActionResult {
    private String actorId;
    private BattleAction action; // null for a scripted turn
    private boolean accepted;
    private ActionRejection rejection;
    private int damage;
    private boolean critical;
    private boolean missed;
    private Awakening awakeningCast;
    private String awakeningEndedFor; // combatant whose awakening wore off before the damage
    private boolean finished;
    private String message;

    static ActionResult accepted(String actorId, BattleAction action) {
        ActionResult result = new ActionResult();
        result.actorId = actorId;
        result.action = action;
        result.accepted = true;
        return result;
    }

    static ActionResult rejected(String actorId, BattleAction action, ActionRejection reason) {
        ActionResult result = new ActionResult();
        result.actorId = actorId;
        result.action = action;
        result.rejection = reason;
        return result;
    }
}
