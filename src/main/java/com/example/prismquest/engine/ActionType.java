package com.example.prismquest.engine;

/**
 * Every action a player can send.
 */
public enum ActionType {
    START("start"),
    RESUME("resume"),
    CHOICE("choice"),
    SKILL_CHECK("skill_check"),
    ATTACK("attack"),
    USE_ITEM("use_item"),
    CONTINUE("continue"),
    CANCEL("cancel");

    public final String key;

    ActionType(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    /**
     * Look up an action type by its wire key. Returns null for unknown keys.
     */
    public static ActionType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (ActionType t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
