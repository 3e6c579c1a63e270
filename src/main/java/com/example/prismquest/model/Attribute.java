package com.example.prismquest.model;

/**
 * The four player attributes. Each is rated 1-5.
 */
public enum Attribute {
    STRENGTH("strength", "力量"),
    DEXTERITY("dexterity", "敏捷"),
    INTELLIGENCE("intelligence", "智力"),
    PERCEPTION("perception", "感知");

    public final String key;
    public final String displayName;

    Attribute(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /**
     * Look up an attribute by its document key. Returns null for unknown keys.
     */
    public static Attribute fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        // older saves call dexterity "agility"
        if (k.equals("agility") || k.equals("dex")) return DEXTERITY;
        if (k.equals("str")) return STRENGTH;
        if (k.equals("int")) return INTELLIGENCE;
        if (k.equals("per")) return PERCEPTION;
        for (Attribute a : values()) if (a.key.equals(k)) return a;
        return null;
    }

    /**
     * Same as {@link #fromKey(String)} but falls back to the given default.
     */
    public static Attribute fromKey(String key, Attribute fallback) {
        Attribute a = fromKey(key);
        return a != null ? a : fallback;
    }
}
