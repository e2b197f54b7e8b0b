package com.example.battlearena.model.dto;

import com.example.battlearena.model.entity.OwnedCollectible;
import com.example.battlearena.model.entity.OwnedWeapon;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryDTO {
    private long coins;
    private List<OwnedCollectible> collectibles;
    private List<OwnedWeapon> weapons;
}
