package com.example.prismquest.combat;

import com.example.prismquest.model.Attribute;

/**
 * Player attack styles and the attribute each one rolls against.
 */
public enum AttackType {
    MELEE("melee", Attribute.STRENGTH, "近戰攻擊"),
    RANGED("ranged", Attribute.DEXTERITY, "遠程攻擊"),
    MAGIC("magic", Attribute.INTELLIGENCE, "魔法攻擊");

    public final String key;
    public final Attribute attribute;
    public final String label;

    AttackType(String key, Attribute attribute, String label) {
        this.key = key;
        this.attribute = attribute;
        this.label = label;
    }

    public String getKey() { return key; }
    public Attribute getAttribute() { return attribute; }
    public String getLabel() { return label; }

    /**
     * Parse an attack type. Returns null for unknown keys.
     */
    public static AttackType fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (AttackType t : values()) if (t.key.equals(k)) return t;
        return null;
    }
}
