package com.example.battlearena.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AwakenedState {
    private boolean active;
    private String character;
    private String abilityName = "";
    private int turnsLeft;

    public void begin(Awakening awakening, int turns) {
        this.active = true;
        this.character = awakening.getCharacter();
        this.abilityName = awakening.getAbilityName();
        this.turnsLeft = turns;
    }

    public void end() {
        this.active = false;
        this.turnsLeft = 0;
    }

    public boolean isExpired() {
        return active && turnsLeft <= 0;
    }

    public AwakenedState copy() {
        return new AwakenedState(active, character, abilityName, turnsLeft);
    }
}
