package com.example.battlearena.catalog;

import com.example.battlearena.model.domain.Rarity;
import com.example.battlearena.model.domain.WeaponTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Forgeable weapons. Only the lower tiers have any. */
@Component
public class WeaponCatalog {

    private final Map<Rarity, List<WeaponTemplate>> byRarity = new EnumMap<>(Rarity.class);

    public WeaponCatalog() {
        byRarity.put(Rarity.COMMON, List.of(
                new WeaponTemplate("Rusty Dagger", "Better than nothing.", 5, Rarity.COMMON),
                new WeaponTemplate("Short Sword", "A short, reliable sword.", 8, Rarity.COMMON)));
        byRarity.put(Rarity.RARE, List.of(
                new WeaponTemplate("Steel Scimitar", "A curved, sharp blade.", 15, Rarity.RARE),
                new WeaponTemplate("Battle Axe", "Heavy and intimidating.", 20, Rarity.RARE)));
        byRarity.put(Rarity.LEGENDARY, List.of(
                new WeaponTemplate("Vorpal Blade", "Cuts with deadly precision.", 40, Rarity.LEGENDARY)));
    }

    public List<WeaponTemplate> pool(Rarity rarity) {
        return byRarity.getOrDefault(rarity, Collections.emptyList());
    }
}
