package com.example.battlearena.service;

import com.example.battlearena.error.InvalidInputException;
import com.example.battlearena.error.NotEnoughStatPointsException;
import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.logic.ProgressionCalculator;
import com.example.battlearena.model.domain.ProgressionRecord;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.NotificationDTO;
import com.example.battlearena.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@Transactional
public class ProgressionService {

    private final UserRepository userRepository;
    private final ProgressionCalculator calculator;
    private final BattleNotifier notifier;

    public ProgressionService(UserRepository userRepository, ProgressionCalculator calculator,
            BattleNotifier notifier) {
        this.userRepository = userRepository;
        this.calculator = calculator;
        this.notifier = notifier;
    }

    /**
     * Adds experience and saves the record once, however many levels were gained.
     *
     * @return the levels reached, in order
     */
    public List<Integer> gainXp(Long userId, int amount) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new PlayerNotFoundException(userId));
        List<Integer> levels = calculator.gainXp(user.getProgression(), amount);
        userRepository.save(user);
        if (!levels.isEmpty()) {
            log.info("User {} reached level {}", userId, levels.get(levels.size() - 1));
        }
        return levels;
    }

    /** One notification per level gained. Call only once the XP is committed. */
    public void announceLevelUps(Long userId, List<Integer> levels) {
        for (Integer level : levels) {
            notifier.notification(userId, new NotificationDTO(NotificationDTO.Type.LEVEL_UP,
                    "Level up! You reached level " + level + " and gained "
                            + ProgressionCalculator.STAT_POINTS_PER_LEVEL + " stat points.",
                    level));
        }
    }

    /**
     * Spends unallocated stat points. All or nothing.
     */
    public ProgressionRecord allocateStats(Long userId, int strength, int vitality) {
        if (strength < 0 || vitality < 0) {
            throw new InvalidInputException("stat values must not be negative");
        }
        if (strength + vitality <= 0) {
            throw new InvalidInputException("nothing to allocate");
        }
        int updated = userRepository.allocateStats(userId, strength, vitality);
        if (updated == 0) {
            if (!userRepository.existsById(userId)) {
                throw new PlayerNotFoundException(userId);
            }
            throw new NotEnoughStatPointsException(strength + vitality);
        }
        log.debug("User {} allocated {} strength, {} vitality", userId, strength, vitality);
        return userRepository.findById(userId)
                .map(u -> u.getProgression().copy())
                .orElseThrow(() -> new PlayerNotFoundException(userId));
    }
}
