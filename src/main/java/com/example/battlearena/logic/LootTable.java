package com.example.battlearena.logic;

import com.example.battlearena.catalog.CollectibleCatalog;
import com.example.battlearena.catalog.WeaponCatalog;
import com.example.battlearena.model.domain.CollectibleTemplate;
import com.example.battlearena.model.domain.Rarity;
import com.example.battlearena.model.domain.WeaponTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Rarity-weighted draws. The ladder is walked in declared order; tiers with nothing to
 * give for a table are left out and the draw is scaled to the mass that remains.
 */
@Component
public class LootTable {

    private final CollectibleCatalog collectibles;
    private final WeaponCatalog weapons;

    public LootTable(CollectibleCatalog collectibles, WeaponCatalog weapons) {
        this.collectibles = collectibles;
        this.weapons = weapons;
    }

    public CollectibleTemplate rollCollectible(Dice dice) {
        return roll(dice, collectibles::pool);
    }

    public WeaponTemplate rollWeapon(Dice dice) {
        return roll(dice, weapons::pool);
    }

    public Rarity rollRarity(Dice dice, Function<Rarity, List<?>> pools) {
        double eligibleMass = 0;
        for (Rarity rarity : Rarity.values()) {
            if (!pools.apply(rarity).isEmpty()) {
                eligibleMass += rarity.getChance();
            }
        }
        if (eligibleMass <= 0) {
            throw new IllegalStateException("Loot table has no rollable tier");
        }

        double draw = dice.nextDouble() * eligibleMass;
        double cumulative = 0;
        Rarity last = null;
        for (Rarity rarity : Rarity.values()) {
            if (rarity.getChance() <= 0 || pools.apply(rarity).isEmpty()) {
                continue;
            }
            cumulative += rarity.getChance();
            last = rarity;
            if (draw < cumulative) {
                return rarity;
            }
        }
        // Rounding can leave the draw a hair above the last boundary
        return last;
    }

    private <T> T roll(Dice dice, Function<Rarity, List<T>> pools) {
        Rarity rarity = rollRarity(dice, r -> pools.apply(r));
        List<T> pool = pools.apply(rarity);
        return pool.get(dice.pick(pool.size()));
    }
}
