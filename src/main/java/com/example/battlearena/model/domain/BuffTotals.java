package com.example.battlearena.model.domain;

import lombok.Data;

/** Running totals while folding a player's collectible buffs. */
@Data
public class BuffTotals {
    private double attackPercent;
    private double defensePercent;
    private int healthFlat;
    private int attackFlat;

    public void addAttackPercent(double amount) {
        attackPercent += amount;
    }

    public void addDefensePercent(double amount) {
        defensePercent += amount;
    }

    public void addHealthFlat(int amount) {
        healthFlat += amount;
    }

    public void addAttackFlat(int amount) {
        attackFlat += amount;
    }
}
