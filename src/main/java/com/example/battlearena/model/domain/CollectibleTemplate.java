package com.example.battlearena.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectibleTemplate {
    private String name;
    private String ability;
    private Rarity rarity;
    private int attack; // intrinsic, only counted for the dominant collectible
    private int health; // intrinsic, decides which collectible is dominant
    private Buff buff;

    public static CollectibleTemplate of(String name, String ability, Rarity rarity, Buff buff) {
        return new CollectibleTemplate(name, ability, rarity, 0, 0, buff);
    }
}
