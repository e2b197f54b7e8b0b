package com.example.battlearena.model.dto;

import com.example.battlearena.model.domain.ActionRejection;
import com.example.battlearena.model.domain.BattleMode;
import com.example.battlearena.model.domain.BattlePhase;
import com.example.battlearena.model.domain.CombatantState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * A battle as seen by one of its participants: {@code player} is always the receiver.
 */
@Data
public class BattleUpdateDTO {
    private String sessionId;
    private BattleMode mode;
    private BattlePhase phase;
    private List<String> log;
    private CombatantState player;
    private CombatantState opponent;

    @JsonProperty("isPlayerTurn")
    private boolean playerTurn;

    private boolean canUseAbility;

    // effects of the action that produced this update
    private int damageToOpponent;
    private int damageToPlayer;
    private boolean abilityUsed;
    private boolean critical;
    private boolean missed;

    private ActionRejection rejection; // set only when the last request was refused
}
