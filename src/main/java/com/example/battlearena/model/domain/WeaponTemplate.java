package com.example.battlearena.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeaponTemplate {
    private String name;
    private String description;
    private int attackBonus;
    private Rarity rarity;
}
