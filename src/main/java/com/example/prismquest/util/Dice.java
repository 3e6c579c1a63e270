package com.example.prismquest.util;

import java.util.List;
import java.util.Random;

/**
 * The engine's single source of randomness. Skill checks, attack rolls, dodge rolls,
 * effect chances and enemy attack selection all draw from one instance, so a
 * seeded {@link Random} replays a whole session.
 */
public class Dice {

    private final Random rng;

    public Dice() {
        this(new Random());
    }

    public Dice(Random rng) {
        if (rng == null) throw new IllegalArgumentException("rng must not be null");
        this.rng = rng;
    }

    public static Dice seeded(long seed) {
        return new Dice(new Random(seed));
    }

    /**
     * Roll a d100 (1-100).
     */
    public int rollD100() {
        return roll(100);
    }

    /**
     * Roll a die with the given number of sides (1..sides).
     */
    public int roll(int sides) {
        if (sides < 1) return 0;
        return rng.nextInt(sides) + 1;
    }

    /**
     * Whether a percentage chance (0-100) succeeds on a fresh d100.
     */
    public boolean percent(int chance) {
        return rollD100() <= chance;
    }

    /**
     * Uniformly pick one element. Returns null for an empty list.
     */
    public <T> T pick(List<T> options) {
        if (options == null || options.isEmpty()) return null;
        return options.get(rng.nextInt(options.size()));
    }
}
