package com.example.battlearena.service;

import com.example.battlearena.config.GameRules;
import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.repository.UserRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

/**
 * Pays out battle results. Each method is one transaction: coins and experience are
 * committed together or not at all.
 */
@Slf4j
@Service
@Transactional
public class RewardService {

    @Getter
    @AllArgsConstructor
    public static class Settlement {
        private final long coinsDelta;
        private final int xpGained;
        private final List<Integer> levelsReached;

        static Settlement none() {
            return new Settlement(0, 0, Collections.emptyList());
        }
    }

    private final UserRepository userRepository;
    private final ProgressionService progressionService;
    private final GameRules rules;

    public RewardService(UserRepository userRepository,
            ProgressionService progressionService, GameRules rules) {
        this.userRepository = userRepository;
        this.progressionService = progressionService;
        this.rules = rules;
    }

    public Settlement settlePveWin(Long userId) {
        GameRules.Rewards rewards = rules.getRewards();
        List<Integer> levels = progressionService.gainXp(userId, rewards.getPveWinXp());
        addCoins(userId, rewards.getPveWinCoins());
        log.info("PvE win settled for user {}: +{} coins, +{} xp", userId, rewards.getPveWinCoins(),
                rewards.getPveWinXp());
        return new Settlement(rewards.getPveWinCoins(), rewards.getPveWinXp(), levels);
    }

    public Settlement settlePveLoss(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new PlayerNotFoundException(userId));
        long lost = Math.min(user.getCoins(), rules.getRewards().getPveLossCoins());
        userRepository.deductCoinsClamped(userId, rules.getRewards().getPveLossCoins());
        log.info("PvE loss settled for user {}: -{} coins", userId, lost);
        return new Settlement(-lost, 0, Collections.emptyList());
    }

    public Settlement settlePvpWin(Long userId) {
        GameRules.Rewards rewards = rules.getRewards();
        List<Integer> levels = progressionService.gainXp(userId, rewards.getPvpWinXp());
        addCoins(userId, rewards.getPvpWinCoins());
        log.info("PvP win settled for user {}: +{} coins, +{} xp", userId, rewards.getPvpWinCoins(),
                rewards.getPvpWinXp());
        return new Settlement(rewards.getPvpWinCoins(), rewards.getPvpWinXp(), levels);
    }

    private void addCoins(Long userId, long amount) {
        if (amount > 0 && userRepository.addCoins(userId, amount) == 0) {
            throw new PlayerNotFoundException(userId);
        }
    }
}
