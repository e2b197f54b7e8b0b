package com.example.battlearena.logic;

import com.example.battlearena.model.domain.ProgressionRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ProgressionCalculator {

    public static final int STAT_POINTS_PER_LEVEL = 5;

    /**
     * Adds experience and resolves every level-up it pays for.
     *
     * @return the levels reached, in order (empty when no level was gained)
     */
    public List<Integer> gainXp(ProgressionRecord record, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("XP amount must not be negative: " + amount);
        }
        List<Integer> levelsReached = new ArrayList<>();
        int xp = record.getXp() + amount;
        while (xp >= record.getXpToNextLevel()) {
            xp -= record.getXpToNextLevel();
            record.setLevel(record.getLevel() + 1);
            record.setStatPoints(record.getStatPoints() + STAT_POINTS_PER_LEVEL);
            record.setXpToNextLevel(xpToNextLevel(record.getLevel()));
            levelsReached.add(record.getLevel());
        }
        record.setXp(xp);
        return levelsReached;
    }

    public static int xpToNextLevel(int level) {
        return (int) Math.floor(100 * Math.pow(level, 1.5));
    }
}
