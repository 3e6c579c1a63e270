package com.example.prismquest.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable attribute block for a player.
 */
public final class Stats {

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 5;
    /** Points a new character distributes across the four attributes. */
    public static final int CREATION_TOTAL = 9;

    /** Value assumed when a stored document lacks an attribute. */
    public static final int DEFAULT_VALUE = 2;

    private final EnumMap<Attribute, Integer> values;

    public Stats(int strength, int dexterity, int intelligence, int perception) {
        this.values = new EnumMap<>(Attribute.class);
        values.put(Attribute.STRENGTH, strength);
        values.put(Attribute.DEXTERITY, dexterity);
        values.put(Attribute.INTELLIGENCE, intelligence);
        values.put(Attribute.PERCEPTION, perception);
    }

    public static Stats defaults() {
        return new Stats(DEFAULT_VALUE, DEFAULT_VALUE, DEFAULT_VALUE, DEFAULT_VALUE);
    }

    public int get(Attribute attribute) {
        if (attribute == null) return DEFAULT_VALUE;
        return values.getOrDefault(attribute, DEFAULT_VALUE);
    }

    public int getStrength() { return get(Attribute.STRENGTH); }
    public int getDexterity() { return get(Attribute.DEXTERITY); }
    public int getIntelligence() { return get(Attribute.INTELLIGENCE); }
    public int getPerception() { return get(Attribute.PERCEPTION); }

    public int total() {
        int sum = 0;
        for (int v : values.values()) sum += v;
        return sum;
    }

    /**
     * Returns a copy with one attribute raised by {@code amount}.
     */
    public Stats plus(Attribute attribute, int amount) {
        Stats copy = new Stats(getStrength(), getDexterity(), getIntelligence(), getPerception());
        copy.values.put(attribute, get(attribute) + amount);
        return copy;
    }

    /**
     * Whether this block is a legal point allocation for character creation:
     * every attribute within 1-5 and a total of exactly 9.
     */
    public boolean isValidAllocation() {
        for (int v : values.values()) {
            if (v < MIN_VALUE || v > MAX_VALUE) return false;
        }
        return total() == CREATION_TOTAL;
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        for (Attribute a : Attribute.values()) {
            doc.put(a.key, get(a));
        }
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stats other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Stats" + values;
    }
}
