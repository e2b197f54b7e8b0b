package com.example.battlearena.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Level, experience and attribute points of a player. Stored inline in the users table.
 * After every update {@code 0 <= xp < xpToNextLevel} holds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class ProgressionRecord {

    @Column(nullable = false)
    private int level = 1;

    @Column(nullable = false)
    private int xp = 0;

    @Column(nullable = false)
    private int xpToNextLevel = 100;

    @Column(nullable = false)
    private int statPoints = 0;

    @Column(nullable = false)
    private int strength = 0;

    @Column(nullable = false)
    private int vitality = 0;

    public ProgressionRecord copy() {
        return new ProgressionRecord(level, xp, xpToNextLevel, statPoints, strength, vitality);
    }
}
