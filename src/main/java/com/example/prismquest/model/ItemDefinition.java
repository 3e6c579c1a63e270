package com.example.prismquest.model;

/**
 * Read-only catalog entry for an item.
 *
 * Weapons use {@code damage}, {@code attribute} and {@code light}; consumables
 * carry an {@link ItemEffect}. Unused fields keep their defaults.
 */
public class ItemDefinition {

    public static final int DEFAULT_WEAPON_DAMAGE = 2;

    private final String id;
    private final String name;
    private final String description;
    private final ItemType type;
    private final double weight;
    private final int damage;
    private final Attribute attribute;
    private final boolean light;
    private final ItemEffect effect;
    private final boolean usableInCombat;

    public ItemDefinition(String id, String name, String description, ItemType type, double weight,
                          int damage, Attribute attribute, boolean light,
                          ItemEffect effect, boolean usableInCombat) {
        this.id = id;
        this.name = name != null && !name.isBlank() ? name : id;
        this.description = description != null ? description : "";
        this.type = type != null ? type : ItemType.MISC;
        this.weight = weight;
        this.damage = damage;
        this.attribute = attribute != null ? attribute : Attribute.STRENGTH;
        this.light = light;
        this.effect = effect;
        this.usableInCombat = usableInCombat;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public ItemType getType() { return type; }
    public double getWeight() { return weight; }
    public int getDamage() { return damage; }
    public Attribute getAttribute() { return attribute; }
    public boolean isLight() { return light; }
    public boolean isUsableInCombat() { return usableInCombat; }

    /** The item's effect, or null for items without one. */
    public ItemEffect getEffect() { return effect; }

    public boolean hasEffect() {
        return effect != null && effect.getType() != null;
    }

    @Override
    public String toString() {
        return "ItemDefinition[" + id + " (" + type.key + ")]";
    }
}
