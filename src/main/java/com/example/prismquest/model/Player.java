package com.example.prismquest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable player record. Every {@code with*} method returns a copy, and hp/mp are
 * always clamped into {@code [0, max]}.
 */
public final class Player {

    public static final int BASE_HP = 20;
    public static final int HP_PER_STRENGTH = 2;
    public static final int BASE_MP = 10;
    public static final int MP_PER_INTELLIGENCE = 2;
    public static final int STARTING_GOLD = 50;

    private final String name;
    private final Background background;
    private final Stats stats;
    private final int hp;
    private final int maxHp;
    private final int mp;
    private final int maxMp;
    private final int gold;
    private final List<InventoryStack> inventory;
    private final Equipment equipment;
    private final List<String> recipes;
    private final Map<String, Object> choices;

    public Player(String name, Background background, Stats stats,
                  int hp, int maxHp, int mp, int maxMp, int gold,
                  List<InventoryStack> inventory, Equipment equipment,
                  List<String> recipes, Map<String, Object> choices) {
        this.name = name != null ? name : "";
        this.background = background;
        this.stats = stats != null ? stats : Stats.defaults();
        this.maxHp = Math.max(0, maxHp);
        this.hp = clamp(hp, 0, this.maxHp);
        this.maxMp = Math.max(0, maxMp);
        this.mp = clamp(mp, 0, this.maxMp);
        this.gold = Math.max(0, gold);
        this.inventory = inventory == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(inventory));
        this.equipment = equipment != null ? equipment : Equipment.empty();
        this.recipes = recipes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(recipes));
        this.choices = choices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
    }

    /**
     * Create a new character from a point allocation.
     *
     * @param name character name
     * @param background chosen background (grants +1 to its attribute and starting potions)
     * @param allocation the player's 9-point allocation, or null for the default 2/2/2/2 spread
     * @throws IllegalArgumentException if the allocation breaks the 1-5 / total 9 rule
     */
    public static Player create(String name, Background background, Stats allocation) {
        if (background == null) {
            throw new IllegalArgumentException("A background is required");
        }
        Stats base = allocation != null ? allocation : Stats.defaults();
        if (allocation != null && !allocation.isValidAllocation()) {
            throw new IllegalArgumentException("Stats must total " + Stats.CREATION_TOTAL
                + " points with each stat between " + Stats.MIN_VALUE + "-" + Stats.MAX_VALUE);
        }
        Stats stats = base.plus(background.bonusAttribute, 1);
        int maxHp = BASE_HP + stats.getStrength() * HP_PER_STRENGTH;
        int maxMp = BASE_MP + stats.getIntelligence() * MP_PER_INTELLIGENCE;
        List<InventoryStack> inventory = List.of(new InventoryStack(
            background.startingItemId, background.startingItemName, ItemType.CONSUMABLE,
            Background.STARTING_ITEM_QUANTITY));
        return new Player(name, background, stats, maxHp, maxHp, maxMp, maxMp, STARTING_GOLD,
            inventory, Equipment.empty(), List.of(), Map.of());
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public String getName() { return name; }
    public Background getBackground() { return background; }
    public Stats getStats() { return stats; }
    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }
    public int getMp() { return mp; }
    public int getMaxMp() { return maxMp; }
    public int getGold() { return gold; }
    public List<InventoryStack> getInventory() { return inventory; }
    public Equipment getEquipment() { return equipment; }
    public List<String> getRecipes() { return recipes; }
    public Map<String, Object> getChoices() { return choices; }

    public int getAttribute(Attribute attribute) {
        return stats.get(attribute);
    }

    public boolean isDefeated() {
        return hp <= 0;
    }

    public Player withHp(int newHp) {
        return new Player(name, background, stats, newHp, maxHp, mp, maxMp, gold, inventory, equipment, recipes, choices);
    }

    public Player withMp(int newMp) {
        return new Player(name, background, stats, hp, maxHp, newMp, maxMp, gold, inventory, equipment, recipes, choices);
    }

    public Player withGold(int newGold) {
        return new Player(name, background, stats, hp, maxHp, mp, maxMp, newGold, inventory, equipment, recipes, choices);
    }

    public Player withInventory(List<InventoryStack> newInventory) {
        return new Player(name, background, stats, hp, maxHp, mp, maxMp, gold, newInventory, equipment, recipes, choices);
    }

    public Player withEquipment(Equipment newEquipment) {
        return new Player(name, background, stats, hp, maxHp, mp, maxMp, gold, inventory, newEquipment, recipes, choices);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("name", name);
        doc.put("background", background != null ? background.key : null);
        doc.put("stats", stats.toDocument());
        doc.put("hp", hp);
        doc.put("max_hp", maxHp);
        doc.put("mp", mp);
        doc.put("max_mp", maxMp);
        doc.put("gold", gold);
        List<Map<String, Object>> inv = new ArrayList<>();
        for (InventoryStack s : inventory) inv.add(s.toDocument());
        doc.put("inventory", inv);
        doc.put("equipment", equipment.toDocument());
        doc.put("recipes", new ArrayList<>(recipes));
        doc.put("choices", new LinkedHashMap<>(choices));
        return doc;
    }

    @Override
    public String toString() {
        return String.format("Player[%s hp=%d/%d mp=%d/%d gold=%d]", name, hp, maxHp, mp, maxMp, gold);
    }
}
