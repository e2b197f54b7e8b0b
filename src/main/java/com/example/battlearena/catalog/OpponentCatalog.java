package com.example.battlearena.catalog;

import com.example.battlearena.logic.Dice;
import com.example.battlearena.model.domain.OpponentTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OpponentCatalog {

    private final List<OpponentTemplate> opponents = List.of(
            new OpponentTemplate("Sneaky Goblin", 80, 60),
            new OpponentTemplate("Brute Orc", 120, 150),
            new OpponentTemplate("Swamp Witch", 150, 90),
            new OpponentTemplate("Fallen Knight", 200, 200),
            new OpponentTemplate("Ancient Lich", 280, 180),
            new OpponentTemplate("Young Red Dragon", 350, 400));

    public List<OpponentTemplate> getOpponents() {
        return opponents;
    }

    public OpponentTemplate pick(Dice dice) {
        return opponents.get(dice.pick(opponents.size()));
    }
}
