package com.example.battlearena.model.dto;

import com.example.battlearena.model.domain.Rarity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LootResultDTO {
    private String name;
    private String description;
    private Rarity rarity;
    private String rarityName;
    private String rarityColor;
    private long remainingCoins;
}
