package com.example.prismquest.model;

/**
 * Item categories used by the catalog and inventory stacks.
 */
public enum ItemType {
    CONSUMABLE("consumable"),
    MATERIAL("material"),
    WEAPON("weapon"),
    ARMOR("armor"),
    ACCESSORY("accessory"),
    KEY_ITEM("key_item"),
    AMMO("ammo"),
    MISC("misc");

    public final String key;

    ItemType(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    /** Only consumables and misc items can be "used". */
    public boolean isUsable() {
        return this == CONSUMABLE || this == MISC;
    }

    /**
     * Parse a type tag. Unknown or missing tags are treated as MISC.
     */
    public static ItemType fromKey(String key) {
        if (key == null) return MISC;
        String k = key.trim().toLowerCase();
        for (ItemType t : values()) if (t.key.equals(k)) return t;
        return MISC;
    }
}
