package com.example.prismquest.model;

public enum EquipmentSlot {
    WEAPON(1, "weapon", "Weapon"),
    ARMOR(2, "armor", "Armor"),
    ACCESSORY1(3, "accessory1", "Accessory I"),
    ACCESSORY2(4, "accessory2", "Accessory II");

    public final int id;
    public final String key;
    public final String displayName;

    EquipmentSlot(int id, String key, String displayName) {
        this.id = id;
        this.key = key;
        this.displayName = displayName;
    }

    public int getId() { return id; }
    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static EquipmentSlot fromId(int id) {
        for (EquipmentSlot s : values()) if (s.id == id) return s;
        return null;
    }

    public static EquipmentSlot fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        // Handle common aliases
        if (k.equals("main_hand") || k.equals("mainhand")) return WEAPON;
        if (k.equals("accessory")) return ACCESSORY1;
        for (EquipmentSlot s : values()) if (s.key.equals(k) || s.name().toLowerCase().equals(k)) return s;
        return null;
    }
}
