package com.example.battlearena.catalog;

import com.example.battlearena.model.domain.Buff;
import com.example.battlearena.model.domain.BuffType;
import com.example.battlearena.model.domain.CollectibleTemplate;
import com.example.battlearena.model.domain.Rarity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every collectible that exists in the game, keyed by rarity for loot draws and by name for
 * build computation. Exclusive templates are granted, never rolled.
 */
@Component
public class CollectibleCatalog {

    private final Map<Rarity, List<CollectibleTemplate>> rollable = new EnumMap<>(Rarity.class);
    private final Map<String, CollectibleTemplate> byName = new LinkedHashMap<>();

    public CollectibleCatalog() {
        rollable.put(Rarity.COMMON, List.of(
                CollectibleTemplate.of("Tavern Warrior", "Basic Strike", Rarity.COMMON,
                        Buff.of(BuffType.HEALTH_FLAT, 5, "+5 Health")),
                CollectibleTemplate.of("Apprentice Mage", "Magic Spark", Rarity.COMMON,
                        Buff.of(BuffType.ATTACK_PERCENT, 0.01, "+1% Attack")),
                CollectibleTemplate.of("Alley Rogue", "Simple Sneak Attack", Rarity.COMMON,
                        Buff.of(BuffType.DEFENSE_PERCENT, 0.01, "+1% Defense"))));
        rollable.put(Rarity.RARE, List.of(
                CollectibleTemplate.of("Steel Knight", "Mighty Charge", Rarity.RARE,
                        Buff.of(BuffType.DEFENSE_PERCENT, 0.03, "+3% Defense")),
                CollectibleTemplate.of("Elemental Sorcerer", "Fireball", Rarity.RARE,
                        Buff.of(BuffType.ATTACK_PERCENT, 0.03, "+3% Attack")),
                CollectibleTemplate.of("Elven Archer", "Precise Arrow", Rarity.RARE,
                        Buff.of(BuffType.HEALTH_FLAT, 20, "+20 Health"))));
        rollable.put(Rarity.LEGENDARY, List.of(
                CollectibleTemplate.of("Sunlight Paladin", "Divine Heal", Rarity.LEGENDARY,
                        Buff.of(BuffType.DEFENSE_PERCENT, 0.10, "+10% Defense")),
                CollectibleTemplate.of("Archmage of Time", "Stop Time (1s)", Rarity.LEGENDARY,
                        Buff.of(BuffType.HEALTH_FLAT, 100, "+100 Health")),
                CollectibleTemplate.of("Shadow Master", "Invisibility", Rarity.LEGENDARY,
                        Buff.of(BuffType.ATTACK_PERCENT, 0.08, "+8% Attack"))));
        rollable.put(Rarity.MYTHIC, List.of(
                CollectibleTemplate.of("Dragon Avatar", "Fire Breath Cone", Rarity.MYTHIC,
                        Buff.of(BuffType.ATTACK_PERCENT, 0.15, "+15% Attack")),
                CollectibleTemplate.of("Cosmic Blade Bearer", "Meteor Strike", Rarity.MYTHIC,
                        Buff.of(BuffType.HEALTH_FLAT, 500, "+500 Health"))));
        rollable.put(Rarity.ULTRA_RARE, List.of(
                CollectibleTemplate.of("Starforge God", "Create Reality", Rarity.ULTRA_RARE,
                        Buff.of(BuffType.ALL_PERCENT, 0.25, "+25% Attack and Defense"))));
        rollable.put(Rarity.SUPREME, List.of(
                new CollectibleTemplate("The Overlord", "Absolute Power", Rarity.SUPREME, 999999, 9999999,
                        Buff.of(BuffType.ATTACK_FLAT, 999999, "Immune to all negative effects. Deals lethal damage."))));

        rollable.values().forEach(pool -> pool.forEach(this::index));

        // Exclusive grants
        index(new CollectibleTemplate("RATO MAROMBA", "Biceps Pump", Rarity.SUPREME, 500, 10000,
                Buff.mixed(0.20, 200, "+20% Attack and +200 Health")));
        index(new CollectibleTemplate("Jacket", "Violent Combo", Rarity.SUPREME, 300, 3500,
                Buff.of(BuffType.ATTACK_FLAT, 300, "Unleashes a devastating 300-hit combo.")));
    }

    private void index(CollectibleTemplate template) {
        byName.put(template.getName(), template);
    }

    public List<CollectibleTemplate> pool(Rarity rarity) {
        return rollable.getOrDefault(rarity, Collections.emptyList());
    }

    public Optional<CollectibleTemplate> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }
}
