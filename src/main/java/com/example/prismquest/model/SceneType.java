package com.example.prismquest.model;

public enum SceneType {
    NARRATIVE("narrative"),
    COMBAT("combat"),
    EXPLORATION("exploration"),
    DIALOGUE("dialogue"),
    ENDING("ending");

    public final String key;

    SceneType(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static SceneType fromKey(String key) {
        if (key == null) return NARRATIVE;
        String k = key.trim().toLowerCase();
        for (SceneType t : values()) if (t.key.equals(k)) return t;
        return NARRATIVE;
    }
}
