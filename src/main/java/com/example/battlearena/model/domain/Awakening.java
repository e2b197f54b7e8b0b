package com.example.battlearena.model.domain;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Collectibles whose owners can awaken them in battle. Only these carry an active ability;
 * every other collectible is passive.
 */
@Getter
public enum Awakening {
    JACKET("Jacket", "Violent Combo", 300,
            List.of("Do you know...", "what time it is?", "...It's time to hurt other people."),
            "/audio/jacket-theme.mp3"),
    THE_OVERLORD("The Overlord", "Annihilation", Awakening.LETHAL,
            List.of("You challenged the owner of this place...", "Brave, huh?"),
            "/audio/overlord-theme.mp3"),
    RATO_MAROMBA("RATO MAROMBA", "ABSOLUTE FIBER", 10000,
            List.of("HEY, BRO...", "YOU MESSED WITH THE WRONG RAT...", "I'M GONNA CRUSH YOU!"),
            "/audio/rato-maromba-theme.mp3");

    /** Damage that always empties the target's health bar. */
    public static final int LETHAL = Integer.MAX_VALUE;

    private final String character;
    private final String abilityName;
    private final int damage;
    private final List<String> opponentLines;
    private final String theme;

    Awakening(String character, String abilityName, int damage, List<String> opponentLines, String theme) {
        this.character = character;
        this.abilityName = abilityName;
        this.damage = damage;
        this.opponentLines = opponentLines;
        this.theme = theme;
    }

    public static Optional<Awakening> forCharacter(String character) {
        if (character == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.character.equals(character))
                .findFirst();
    }
}
