package com.example.battlearena.model.domain;

import lombok.Getter;

/**
 * Rarity ladder in declared (draw) order. The ordinal doubles as the rarity rank used to
 * pick the collectible whose ability a combatant may awaken.
 */
@Getter
public enum Rarity {
    COMMON("Common", "#9e9e9e", 0.60),
    RARE("Rare", "#42a5f5", 0.25),
    LEGENDARY("Legendary", "#ab47bc", 0.10),
    MYTHIC("Mythic", "#ff7043", 0.045),
    ULTRA_RARE("Ultra Rare", "#ffee58", 0.005),
    SUPREME("Supreme", "#f1c40f", 0.0); // special grants only, never rolled

    private final String displayName;
    private final String color;
    private final double chance;

    Rarity(String displayName, String color, double chance) {
        this.displayName = displayName;
        this.color = color;
        this.chance = chance;
    }

    public int rank() {
        return ordinal();
    }
}
