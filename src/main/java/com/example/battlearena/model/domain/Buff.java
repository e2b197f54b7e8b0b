package com.example.battlearena.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Buff {
    private BuffType type;
    private String description;
    private double value;

    // Only used by MIXED buffs
    private double attackPercent;
    private int healthFlat;

    public static Buff of(BuffType type, double value, String description) {
        return new Buff(type, description, value, 0, 0);
    }

    public static Buff mixed(double attackPercent, int healthFlat, String description) {
        return new Buff(BuffType.MIXED, description, 0, attackPercent, healthFlat);
    }

    public void applyTo(BuffTotals totals) {
        type.accumulate(this, totals);
    }
}
