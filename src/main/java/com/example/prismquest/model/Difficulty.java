package com.example.prismquest.model;

/**
 * Skill check difficulty, expressed as a percentage modifier to the success threshold.
 */
public enum Difficulty {
    EASY("easy", 20),
    NORMAL("normal", 0),
    HARD("hard", -20),
    VERY_HARD("very_hard", -40);

    public final String key;
    public final int modifier;

    Difficulty(String key, int modifier) {
        this.key = key;
        this.modifier = modifier;
    }

    public String getKey() { return key; }
    public int getModifier() { return modifier; }

    /**
     * Parse a difficulty tag. "extreme" is an alias of very_hard; anything unknown is NORMAL.
     */
    public static Difficulty fromKey(String key) {
        if (key == null) return NORMAL;
        String k = key.trim().toLowerCase();
        if (k.equals("extreme") || k.equals("veryhard")) return VERY_HARD;
        for (Difficulty d : values()) if (d.key.equals(k)) return d;
        return NORMAL;
    }
}
