package com.example.battlearena.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CombatantState {
    private String id; // "p1" or "p2"
    private Long userId; // null for a scripted opponent
    private String name;
    private int health;
    private int maxHealth;
    private int power;
    private boolean defending;
    private boolean abilityUsed;
    private String abilityCollectible;
    private AwakenedState awakenedState = new AwakenedState();

    @JsonIgnore
    private String connectionId;

    public static CombatantState player(String id, Long userId, String name, String connectionId, PlayerBuild build) {
        CombatantState state = new CombatantState();
        state.id = id;
        state.userId = userId;
        state.name = name;
        state.connectionId = connectionId;
        state.health = build.getTotalHealth();
        state.maxHealth = build.getTotalHealth();
        state.power = build.getTotalPower();
        state.abilityCollectible = build.getAbilityCollectible();
        return state;
    }

    public static CombatantState scripted(String id, OpponentTemplate template) {
        CombatantState state = new CombatantState();
        state.id = id;
        state.name = template.getName();
        state.health = template.getHealth();
        state.maxHealth = template.getHealth();
        state.power = template.getPower();
        return state;
    }

    @JsonIgnore
    public boolean isScripted() {
        return userId == null;
    }

    @JsonIgnore
    public boolean isDefeated() {
        return health <= 0;
    }

    public void takeDamage(int amount) {
        health = Math.max(0, health - amount);
    }

    /** Awakening this combatant could cast, if it has not already been used. */
    @JsonIgnore
    public Awakening getAvailableAwakening() {
        if (abilityUsed) {
            return null;
        }
        return Awakening.forCharacter(abilityCollectible).orElse(null);
    }

    public boolean canUseAbility() {
        return getAvailableAwakening() != null;
    }

    public CombatantState copy() {
        CombatantState copy = new CombatantState();
        copy.id = id;
        copy.userId = userId;
        copy.name = name;
        copy.health = health;
        copy.maxHealth = maxHealth;
        copy.power = power;
        copy.defending = defending;
        copy.abilityUsed = abilityUsed;
        copy.abilityCollectible = abilityCollectible;
        copy.awakenedState = awakenedState.copy();
        copy.connectionId = connectionId;
        return copy;
    }
}
