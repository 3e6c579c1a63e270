package com.example.prismquest.state;

import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.InventoryStack;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparse set of state changes produced by one action.
 *
 * Every field is optional; only fields that were set appear in {@link #toDocument()}.
 * Values are absolute (the new hp, the new gold total) except {@code flags}, which
 * the caller merges into the stored flags, and the report-only keys
 * ({@code gold_gained}, {@code drops}, {@code exp_gained}, {@code combat_victory},
 * {@code status_effect}, {@code game_over}).
 */
public class StateDelta {

    public static final String SCENE = "scene";
    public static final String CHAPTER = "chapter";
    public static final String FLAGS = "flags";
    public static final String PLAYER_HP = "player_hp";
    public static final String PLAYER_MP = "player_mp";
    public static final String GOLD = "gold";
    public static final String GOLD_GAINED = "gold_gained";
    public static final String COMBAT = "combat";
    public static final String DROPS = "drops";
    public static final String COMBAT_VICTORY = "combat_victory";
    public static final String EXP_GAINED = "exp_gained";
    public static final String INVENTORY_CHANGED = "inventory_changed";
    public static final String INVENTORY = "inventory";
    public static final String BUFFS = "buffs";
    public static final String STATUS_EFFECT = "status_effect";
    public static final String GAME_OVER = "game_over";

    private String scene;
    private String chapter;
    private final Map<String, Object> flags = new LinkedHashMap<>();
    private Integer playerHp;
    private Integer playerMp;
    private Integer gold;
    private Integer goldGained;
    private CombatSnapshot combat;
    private boolean combatCleared;
    private final List<EnemyDefinition.Drop> drops = new ArrayList<>();
    private Boolean combatVictory;
    private Integer expGained;
    private List<InventoryStack> inventory;
    private List<Buff> buffs;
    private String statusEffect;
    private Boolean gameOver;

    public static StateDelta empty() {
        return new StateDelta();
    }

    public StateDelta scene(String scene) { this.scene = scene; return this; }
    public StateDelta chapter(String chapter) { this.chapter = chapter; return this; }
    public StateDelta playerHp(int hp) { this.playerHp = hp; return this; }
    public StateDelta playerMp(int mp) { this.playerMp = mp; return this; }
    public StateDelta gold(int gold) { this.gold = gold; return this; }
    public StateDelta expGained(int exp) { this.expGained = exp; return this; }
    public StateDelta combatVictory(boolean victory) { this.combatVictory = victory; return this; }
    public StateDelta statusEffect(String effect) { this.statusEffect = effect; return this; }
    public StateDelta gameOver(boolean over) { this.gameOver = over; return this; }

    public StateDelta flags(Map<String, Object> newFlags) {
        if (newFlags != null) flags.putAll(newFlags);
        return this;
    }

    public StateDelta addGoldGained(int amount) {
        goldGained = (goldGained != null ? goldGained : 0) + amount;
        return this;
    }

    public StateDelta addDrop(EnemyDefinition.Drop drop) {
        drops.add(drop);
        return this;
    }

    /** Store the snapshot to persist. Replaces an earlier clear. */
    public StateDelta combat(CombatSnapshot snapshot) {
        this.combat = snapshot != null ? snapshot.copy() : null;
        this.combatCleared = snapshot == null;
        return this;
    }

    /** Remove the stored snapshot; rendered as an explicit null. */
    public StateDelta clearCombat() {
        return combat(null);
    }

    public StateDelta inventory(List<InventoryStack> newInventory) {
        this.inventory = newInventory != null ? List.copyOf(newInventory) : null;
        return this;
    }

    public StateDelta buffs(List<Buff> newBuffs) {
        this.buffs = newBuffs != null ? List.copyOf(newBuffs) : null;
        return this;
    }

    public String getScene() { return scene; }
    public String getChapter() { return chapter; }
    public Map<String, Object> getFlags() { return flags; }
    public Integer getPlayerHp() { return playerHp; }
    public Integer getPlayerMp() { return playerMp; }
    public Integer getGold() { return gold; }
    public Integer getGoldGained() { return goldGained; }
    public CombatSnapshot getCombat() { return combat != null ? combat.copy() : null; }
    public boolean isCombatCleared() { return combatCleared; }
    public boolean hasCombatChange() { return combat != null || combatCleared; }
    public List<EnemyDefinition.Drop> getDrops() { return drops; }
    public Boolean getCombatVictory() { return combatVictory; }
    public Integer getExpGained() { return expGained; }
    public List<InventoryStack> getInventory() { return inventory; }
    public List<Buff> getBuffs() { return buffs; }
    public String getStatusEffect() { return statusEffect; }
    public Boolean getGameOver() { return gameOver; }

    public boolean isInventoryChanged() {
        return inventory != null;
    }

    public boolean isEmpty() {
        return toDocument().isEmpty();
    }

    /**
     * Fold a later delta into this one. Scalars from {@code later} win; flags merge.
     */
    public StateDelta merge(StateDelta later) {
        if (later == null) return this;
        if (later.scene != null) scene = later.scene;
        if (later.chapter != null) chapter = later.chapter;
        flags.putAll(later.flags);
        if (later.playerHp != null) playerHp = later.playerHp;
        if (later.playerMp != null) playerMp = later.playerMp;
        if (later.gold != null) gold = later.gold;
        if (later.goldGained != null) addGoldGained(later.goldGained);
        if (later.hasCombatChange()) combat(later.combat);
        drops.addAll(later.drops);
        if (later.combatVictory != null) combatVictory = later.combatVictory;
        if (later.expGained != null) expGained = later.expGained;
        if (later.inventory != null) inventory = later.inventory;
        if (later.buffs != null) buffs = later.buffs;
        if (later.statusEffect != null) statusEffect = later.statusEffect;
        if (later.gameOver != null) gameOver = later.gameOver;
        return this;
    }

    /**
     * The wire form. A cleared snapshot appears as {@code combat: null}.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        if (scene != null) doc.put(SCENE, scene);
        if (chapter != null) doc.put(CHAPTER, chapter);
        if (!flags.isEmpty()) doc.put(FLAGS, new LinkedHashMap<>(flags));
        if (playerHp != null) doc.put(PLAYER_HP, playerHp);
        if (playerMp != null) doc.put(PLAYER_MP, playerMp);
        if (gold != null) doc.put(GOLD, gold);
        if (goldGained != null) doc.put(GOLD_GAINED, goldGained);
        if (combat != null) doc.put(COMBAT, combat.toDocument());
        else if (combatCleared) doc.put(COMBAT, null);
        if (!drops.isEmpty()) {
            List<Map<String, Object>> dropDocs = new ArrayList<>();
            for (EnemyDefinition.Drop d : drops) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("id", d.id());
                m.put("quantity", d.quantity());
                dropDocs.add(m);
            }
            doc.put(DROPS, dropDocs);
        }
        if (combatVictory != null) doc.put(COMBAT_VICTORY, combatVictory);
        if (expGained != null) doc.put(EXP_GAINED, expGained);
        if (inventory != null) {
            doc.put(INVENTORY_CHANGED, true);
            List<Map<String, Object>> inv = new ArrayList<>();
            for (InventoryStack s : inventory) inv.add(s.toDocument());
            doc.put(INVENTORY, inv);
        }
        if (buffs != null) {
            List<Map<String, Object>> buffDocs = new ArrayList<>();
            for (Buff b : buffs) buffDocs.add(b.toDocument());
            doc.put(BUFFS, buffDocs);
        }
        if (statusEffect != null) doc.put(STATUS_EFFECT, statusEffect);
        if (gameOver != null) doc.put(GAME_OVER, gameOver);
        return doc;
    }

    @Override
    public String toString() {
        return "StateDelta" + toDocument();
    }
}
