package com.example.battlearena.service;

import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.logic.BuildCalculator;
import com.example.battlearena.model.domain.PlayerBuild;
import com.example.battlearena.model.domain.ProgressionRecord;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.InventoryDTO;
import com.example.battlearena.model.dto.PlayerStatusDTO;
import com.example.battlearena.repository.OwnedCollectibleRepository;
import com.example.battlearena.repository.OwnedWeaponRepository;
import com.example.battlearena.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class PlayerProfileService {

    private final UserRepository userRepository;
    private final OwnedCollectibleRepository collectibleRepository;
    private final OwnedWeaponRepository weaponRepository;
    private final BuildCalculator buildCalculator;

    public PlayerProfileService(UserRepository userRepository,
            OwnedCollectibleRepository collectibleRepository,
            OwnedWeaponRepository weaponRepository,
            BuildCalculator buildCalculator) {
        this.userRepository = userRepository;
        this.collectibleRepository = collectibleRepository;
        this.weaponRepository = weaponRepository;
        this.buildCalculator = buildCalculator;
    }

    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new PlayerNotFoundException(userId));
    }

    /** Current combat stats, recomputed from the stored attributes and inventory. */
    public PlayerBuild computeBuild(Long userId) {
        ProgressionRecord progression = getUser(userId).getProgression();
        return buildCalculator.calculate(progression.getStrength(), progression.getVitality(),
                collectibleRepository.findByOwnerIdOrderByAcquiredAtAsc(userId),
                weaponRepository.findByOwnerIdOrderByAttackBonusDesc(userId));
    }

    public PlayerStatusDTO getStatus(Long userId) {
        User user = getUser(userId);
        return new PlayerStatusDTO(user.getUsername(), user.getCoins(), user.getProgression().copy());
    }

    public InventoryDTO getInventory(Long userId) {
        User user = getUser(userId);
        return new InventoryDTO(user.getCoins(),
                collectibleRepository.findByOwnerIdOrderByAcquiredAtAsc(userId),
                weaponRepository.findByOwnerIdOrderByAttackBonusDesc(userId));
    }
}
