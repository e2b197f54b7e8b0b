package com.example.battlearena.logic;

import org.springframework.stereotype.Component;

import java.util.Random;

@Component
public class RandomDice implements Dice {

    private final Random random;

    public RandomDice() {
        this(new Random());
    }

    public RandomDice(Random random) {
        this.random = random;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    @Override
    public double variance(double spread) {
        return (1.0 - spread) + random.nextDouble() * spread * 2;
    }

    @Override
    public int pick(int bound) {
        return random.nextInt(bound);
    }
}
