package com.example.prismquest.model;

import java.util.List;

/**
 * Read-only catalog entry for an enemy.
 */
public class EnemyDefinition {

    public static final int DEFAULT_WEAKNESS_BONUS = 2;
    public static final int DEFAULT_EXP = 10;

    /**
     * One attack an enemy can choose on its turn.
     *
     * @param description line shown when the attack is made
     * @param damage flat damage dealt on a hit
     * @param effect status effect id, or null
     * @param effectChance percent chance (0-100) that the effect lands on a hit
     */
    public record Attack(String description, int damage, String effect, int effectChance) {
        public boolean hasEffect() {
            return effect != null && !effect.isBlank();
        }
    }

    /**
     * One drop table entry. The id {@code gold} denotes coins rather than an item.
     */
    public record Drop(String id, int quantity) {
        public static final String GOLD = "gold";

        public boolean isGold() {
            return GOLD.equals(id);
        }
    }

    private final String id;
    private final String name;
    private final int hp;
    private final int maxHp;
    private final int evasion;
    private final int armor;
    private final String weakness;
    private final int weaknessBonus;
    private final List<Attack> attacks;
    private final List<Drop> drops;
    private final int exp;
    private final String description;

    public EnemyDefinition(String id, String name, int hp, int maxHp, int evasion, int armor,
                           String weakness, int weaknessBonus, List<Attack> attacks,
                           List<Drop> drops, int exp, String description) {
        this.id = id;
        this.name = name != null && !name.isBlank() ? name : id;
        this.hp = hp;
        this.maxHp = maxHp > 0 ? maxHp : hp;
        this.evasion = evasion;
        this.armor = armor;
        this.weakness = weakness;
        this.weaknessBonus = weaknessBonus;
        this.attacks = attacks == null ? List.of() : List.copyOf(attacks);
        this.drops = drops == null ? List.of() : List.copyOf(drops);
        this.exp = exp;
        this.description = description != null ? description : "";
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }
    public int getEvasion() { return evasion; }
    public int getArmor() { return armor; }
    public String getWeakness() { return weakness; }
    public int getWeaknessBonus() { return weaknessBonus; }
    public List<Attack> getAttacks() { return attacks; }
    public List<Drop> getDrops() { return drops; }
    public int getExp() { return exp; }
    public String getDescription() { return description; }

    public boolean isWeakTo(String element) {
        return weakness != null && weakness.equals(element);
    }

    @Override
    public String toString() {
        return "EnemyDefinition[" + id + " hp=" + hp + "/" + maxHp + "]";
    }
}
