package com.example.battlearena.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunable game constants, bound from {@code game.*}.
 *
 * <pre>{@code
 * game.battle.opponent-turn-delay-ms=1500
 * game.rewards.pve-win-coins=50
 * game.loot.character-cost=150
 * }</pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "game")
public class GameRules {

    @NotNull @Valid private Battle battle = new Battle();
    @NotNull @Valid private Rewards rewards = new Rewards();
    @NotNull @Valid private Loot loot = new Loot();

    @Data
    public static class Battle {
        /** Pause before the scripted opponent retaliates. */
        @Min(0) private long opponentTurnDelayMs = 1500;

        /** Length of the awakening cutscene; actions are refused until it elapses. */
        @Min(0) private long awakeningDelayMs = 4500;

        @Min(1) private int awakeningTurns = 3;
    }

    @Data
    public static class Rewards {
        @Min(0) private long pveWinCoins = 50;
        @Min(0) private int pveWinXp = 50;
        @Min(0) private long pveLossCoins = 25;
        @Min(0) private int pvpWinXp = 75;
        @Min(0) private long pvpWinCoins = 0;
    }

    @Data
    public static class Loot {
        @Min(1) private long characterCost = 150;
        @Min(1) private long weaponCost = 250;
    }
}
