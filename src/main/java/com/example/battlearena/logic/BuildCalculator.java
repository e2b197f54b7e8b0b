package com.example.battlearena.logic;

import com.example.battlearena.catalog.CollectibleCatalog;
import com.example.battlearena.model.domain.BuffTotals;
import com.example.battlearena.model.domain.CollectibleTemplate;
import com.example.battlearena.model.domain.PlayerBuild;
import com.example.battlearena.model.entity.OwnedCollectible;
import com.example.battlearena.model.entity.OwnedWeapon;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns attributes and inventory into combat stats.
 * Pure function of its inputs; safe to share between threads.
 */
@Component
public class BuildCalculator {

    private final CollectibleCatalog catalog;

    public BuildCalculator(CollectibleCatalog catalog) {
        this.catalog = catalog;
    }

    public PlayerBuild calculate(int strength, int vitality,
            List<OwnedCollectible> collectibles, List<OwnedWeapon> weapons) {
        PlayerBuild build = new PlayerBuild();
        build.setBasePower(10 + strength * 2);
        build.setBaseHealth(50 + vitality * 10);

        BuffTotals totals = new BuffTotals();
        if (!collectibles.isEmpty()) {
            OwnedCollectible dominant = findDominant(collectibles);
            build.setDominantCollectible(dominant.getName());
            catalog.find(dominant.getName()).ifPresent(t -> {
                totals.addAttackFlat(t.getAttack());
                totals.addHealthFlat(t.getHealth());
            });

            for (OwnedCollectible owned : collectibles) {
                catalog.find(owned.getName())
                        .map(CollectibleTemplate::getBuff)
                        .ifPresent(buff -> buff.applyTo(totals));
            }

            build.setAbilityCollectible(findHighestRarity(collectibles).getName());
        }

        int weaponBonus = 0;
        for (OwnedWeapon weapon : weapons) {
            weaponBonus = Math.max(weaponBonus, weapon.getAttackBonus());
        }

        build.setFlatAttackBonus(totals.getAttackFlat());
        build.setFlatHealthBonus(totals.getHealthFlat());
        build.setAttackPercentBonus(totals.getAttackPercent());
        build.setDefensePercentBonus(totals.getDefensePercent());
        build.setWeaponBonus(weaponBonus);

        // floor is applied once, after the weapon bonus
        build.setTotalPower((int) Math.floor(
                (build.getBasePower() + totals.getAttackFlat()) * (1 + totals.getAttackPercent()) + weaponBonus));
        build.setTotalHealth(build.getBaseHealth() + totals.getHealthFlat());

        describe(build, totals);
        return build;
    }

    // Highest template health wins; ties keep the earlier entry.
    private OwnedCollectible findDominant(List<OwnedCollectible> collectibles) {
        OwnedCollectible strongest = collectibles.get(0);
        int strongestHealth = templateHealth(strongest);
        for (OwnedCollectible current : collectibles) {
            int health = templateHealth(current);
            if (health > strongestHealth) {
                strongest = current;
                strongestHealth = health;
            }
        }
        return strongest;
    }

    // Highest rarity rank wins; ties keep the earlier entry.
    private OwnedCollectible findHighestRarity(List<OwnedCollectible> collectibles) {
        OwnedCollectible best = collectibles.get(0);
        for (OwnedCollectible current : collectibles) {
            if (current.getRarity().rank() > best.getRarity().rank()) {
                best = current;
            }
        }
        return best;
    }

    private int templateHealth(OwnedCollectible owned) {
        return catalog.find(owned.getName()).map(CollectibleTemplate::getHealth).orElse(0);
    }

    private void describe(PlayerBuild build, BuffTotals totals) {
        List<String> summary = build.getSummary();
        if (totals.getAttackPercent() > 0) {
            summary.add(String.format("+%.0f%% Attack", totals.getAttackPercent() * 100));
        }
        if (totals.getDefensePercent() > 0) {
            summary.add(String.format("+%.0f%% Defense", totals.getDefensePercent() * 100));
        }
        if (totals.getHealthFlat() > 0) {
            summary.add("+" + totals.getHealthFlat() + " Health");
        }
        if (build.getWeaponBonus() > 0) {
            summary.add("+" + build.getWeaponBonus() + " Attack (Weapon)");
        }
    }
}
