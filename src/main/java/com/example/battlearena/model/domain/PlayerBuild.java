package com.example.battlearena.model.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Combat stats derived from a player's attributes and inventory. Recomputed at the start
 * of every battle, never stored.
 */
@Data
public class PlayerBuild {
    private int basePower;
    private int baseHealth;
    private int flatAttackBonus;
    private int flatHealthBonus;
    private double attackPercentBonus;
    private double defensePercentBonus;
    private int weaponBonus;

    /** Owned collectible with the highest template health; its intrinsic stats are added. */
    private String dominantCollectible;

    /** Owned collectible with the highest rarity; decides which ability can be awakened. */
    private String abilityCollectible;

    private int totalPower;
    private int totalHealth;

    private List<String> summary = new ArrayList<>();
}
