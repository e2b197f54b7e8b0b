package com.example.battlearena.service;

import com.example.battlearena.config.GameRules;
import com.example.battlearena.error.InsufficientFundsException;
import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.logic.Dice;
import com.example.battlearena.logic.LootTable;
import com.example.battlearena.model.domain.CollectibleTemplate;
import com.example.battlearena.model.domain.Rarity;
import com.example.battlearena.model.domain.WeaponTemplate;
import com.example.battlearena.model.dto.LootResultDTO;
import com.example.battlearena.model.entity.OwnedCollectible;
import com.example.battlearena.model.entity.OwnedWeapon;
import com.example.battlearena.repository.OwnedCollectibleRepository;
import com.example.battlearena.repository.OwnedWeaponRepository;
import com.example.battlearena.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Paid loot rolls. The charge and the grant share a transaction, and the charge is a
 * conditional update, so a balance can never be spent twice or go negative.
 */
@Slf4j
@Service
@Transactional
public class LootService {

    private final UserRepository userRepository;
    private final OwnedCollectibleRepository collectibleRepository;
    private final OwnedWeaponRepository weaponRepository;
    private final LootTable lootTable;
    private final Dice dice;
    private final GameRules rules;

    public LootService(UserRepository userRepository,
            OwnedCollectibleRepository collectibleRepository,
            OwnedWeaponRepository weaponRepository,
            LootTable lootTable,
            Dice dice,
            GameRules rules) {
        this.userRepository = userRepository;
        this.collectibleRepository = collectibleRepository;
        this.weaponRepository = weaponRepository;
        this.lootTable = lootTable;
        this.dice = dice;
        this.rules = rules;
    }

    public LootResultDTO rollCharacter(Long userId) {
        charge(userId, rules.getLoot().getCharacterCost());
        CollectibleTemplate template = lootTable.rollCollectible(dice);
        collectibleRepository.save(new OwnedCollectible(userId, template.getName(), template.getAbility(),
                template.getRarity()));
        log.info("User {} rolled character {} ({})", userId, template.getName(), template.getRarity());
        return result(userId, template.getName(), template.getAbility(), template.getRarity());
    }

    public LootResultDTO rollWeapon(Long userId) {
        charge(userId, rules.getLoot().getWeaponCost());
        WeaponTemplate template = lootTable.rollWeapon(dice);
        weaponRepository.save(new OwnedWeapon(userId, template.getName(), template.getDescription(),
                template.getAttackBonus(), template.getRarity()));
        log.info("User {} rolled weapon {} ({})", userId, template.getName(), template.getRarity());
        return result(userId, template.getName(), template.getDescription(), template.getRarity());
    }

    private void charge(Long userId, long cost) {
        if (userRepository.deductCoins(userId, cost) == 0) {
            if (!userRepository.existsById(userId)) {
                throw new PlayerNotFoundException(userId);
            }
            throw new InsufficientFundsException(cost);
        }
    }

    private LootResultDTO result(Long userId, String name, String description, Rarity rarity) {
        long coins = userRepository.findById(userId)
                .orElseThrow(() -> new PlayerNotFoundException(userId))
                .getCoins();
        return new LootResultDTO(name, description, rarity, rarity.getDisplayName(), rarity.getColor(), coins);
    }
}
