package com.example.prismquest.model;

/**
 * Character backgrounds. Each grants +1 to one attribute and a pair of starting potions.
 */
public enum Background {
    WARRIOR("warrior", Attribute.STRENGTH, "red_potion", "紅光藥水"),
    HERBALIST("herbalist", Attribute.PERCEPTION, "green_potion", "綠光藥水"),
    MAGE("mage", Attribute.INTELLIGENCE, "blue_potion", "藍光藥水");

    /** How many of the starting item a new character carries. */
    public static final int STARTING_ITEM_QUANTITY = 2;

    public final String key;
    public final Attribute bonusAttribute;
    public final String startingItemId;
    public final String startingItemName;

    Background(String key, Attribute bonusAttribute, String startingItemId, String startingItemName) {
        this.key = key;
        this.bonusAttribute = bonusAttribute;
        this.startingItemId = startingItemId;
        this.startingItemName = startingItemName;
    }

    public String getKey() { return key; }
    public Attribute getBonusAttribute() { return bonusAttribute; }
    public String getStartingItemId() { return startingItemId; }

    public static Background fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Background b : values()) if (b.key.equals(k)) return b;
        return null;
    }
}
