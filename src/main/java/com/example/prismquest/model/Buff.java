package com.example.prismquest.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A timed effect carried in the game state, such as hp regeneration.
 * {@code remaining} counts the ticks left before the buff expires.
 */
public record Buff(String id, int value, int remaining) {

    public static final String REGEN_HP = "regen_hp";

    public boolean isRegen() {
        return REGEN_HP.equals(id);
    }

    public boolean isExpired() {
        return remaining <= 0;
    }

    public Buff tick() {
        return new Buff(id, value, remaining - 1);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", id);
        doc.put("value", value);
        doc.put("remaining", remaining);
        return doc;
    }
}
