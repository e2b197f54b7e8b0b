package com.example.battlearena.logic;

/**
 * Source of randomness for combat and loot. Swapped for a scripted stub in tests.
 */
public interface Dice {

    /** @return a uniform value in [0.0, 1.0) */
    double nextDouble();

    /** @return true with probability {@code probability} */
    boolean chance(double probability);

    /** @return a multiplier uniformly drawn from [1 - spread, 1 + spread) */
    double variance(double spread);

    /** @return a uniform index in [0, bound) */
    int pick(int bound);
}
