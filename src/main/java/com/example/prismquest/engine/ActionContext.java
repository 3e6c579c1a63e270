package com.example.prismquest.engine;

import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.combat.AttackType;
import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.combat.CombatSystem;
import com.example.prismquest.inventory.InventoryService;
import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.GameState;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.Player;
import com.example.prismquest.model.Scene;
import com.example.prismquest.model.StateChangeSpec;
import com.example.prismquest.state.GameStateCodec;
import com.example.prismquest.state.StateDelta;
import com.example.prismquest.util.Dice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request working view of the game state, passed to action handlers.
 *
 * Handlers change the player, scene and combat through this object only; each
 * change updates the working copy and records the new value in the delta. The
 * {@link GameState} the context was built from is never modified.
 */
public class ActionContext {

    /** Casting a magic attack costs this much mp. */
    public static final int MAGIC_MP_COST = 3;

    private final GameCatalog catalog;
    private final Dice dice;
    private final CombatSystem combatSystem;
    private final InventoryService inventory;
    private final StateDelta delta = StateDelta.empty();

    private String chapter;
    private String sceneId;
    private Scene scene;
    private Player player;
    private CombatSnapshot combat;
    private List<Buff> buffs;

    public ActionContext(GameState state, GameCatalog catalog, Dice dice,
                         CombatSystem combatSystem, InventoryService inventory) {
        this.catalog = catalog;
        this.dice = dice;
        this.combatSystem = combatSystem;
        this.inventory = inventory;
        this.chapter = state.getChapter();
        this.sceneId = state.getScene();
        this.scene = catalog.getScene(chapter, sceneId);
        this.player = state.getPlayer() != null ? state.getPlayer() : GameStateCodec.defaultPlayer();
        this.combat = state.getCombat();
        if (combat != null) {
            // the stored player hp wins over the snapshot's mirror
            combat.setPlayerHp(player.getHp());
        }
        this.buffs = new ArrayList<>(state.getBuffs());
    }

    public GameCatalog getCatalog() { return catalog; }
    public Dice getDice() { return dice; }
    public CombatSystem getCombatSystem() { return combatSystem; }
    public InventoryService getInventory() { return inventory; }
    public StateDelta getDelta() { return delta; }
    public String getChapter() { return chapter; }
    public String getSceneId() { return sceneId; }
    public Scene getScene() { return scene; }
    public Player getPlayer() { return player; }
    public List<Buff> getBuffs() { return List.copyOf(buffs); }

    /**
     * The working snapshot, or null. Handlers may change it in place and then call
     * {@link #recordCombat()}.
     */
    public CombatSnapshot getCombat() { return combat; }

    public boolean isInCombat() {
        return combat != null && combat.isActive();
    }

    // ========== Player ==========

    /** Set hp (clamped); in combat the snapshot mirror follows. */
    public void setHp(int hp) {
        player = player.withHp(hp);
        delta.playerHp(player.getHp());
        if (combat != null) {
            combat.setPlayerHp(player.getHp());
            recordCombat();
        }
    }

    public void setMp(int mp) {
        player = player.withMp(mp);
        delta.playerMp(player.getMp());
    }

    public void addGold(int amount) {
        if (amount == 0) return;
        player = player.withGold(player.getGold() + amount);
        delta.gold(player.getGold());
        if (amount > 0) delta.addGoldGained(amount);
    }

    public void setInventory(List<InventoryStack> items) {
        player = player.withInventory(items);
        delta.inventory(player.getInventory());
    }

    /**
     * Add catalog items to the inventory. Unknown ids are skipped by the inventory
     * rules and leave the inventory as it was.
     */
    public void addItem(String itemId, int quantity) {
        List<InventoryStack> updated = inventory.addItem(player.getInventory(), itemId, quantity);
        if (updated != player.getInventory()) setInventory(updated);
    }

    public boolean canCastMagic() {
        return player.getMp() >= MAGIC_MP_COST;
    }

    /**
     * Apply authored, relative changes: flags, damage, healing, gold and items.
     */
    public void applyStateChanges(StateChangeSpec changes) {
        if (changes == null || changes.isEmpty()) return;
        if (!changes.getFlags().isEmpty()) delta.flags(changes.getFlags());
        if (changes.getDamage() > 0 || changes.getHeal() > 0) {
            setHp(player.getHp() - changes.getDamage() + changes.getHeal());
        }
        addGold(changes.getGoldGained());
        for (EnemyDefinition.Drop item : changes.getItems()) {
            if (item.isGold()) addGold(item.quantity());
            else addItem(item.id(), item.quantity());
        }
    }

    // ========== Buffs ==========

    /** Start a buff, replacing an active one with the same id. */
    public void addBuff(Buff buff) {
        buffs.removeIf(b -> b.id().equals(buff.id()));
        buffs.add(buff);
        delta.buffs(buffs);
    }

    /**
     * Run one regeneration tick: every active regen buff heals its value (capped at
     * max hp) and loses one remaining tick. Expired buffs are dropped.
     *
     * @param narrative receives one line per heal
     */
    public void tickRegen(List<String> narrative) {
        if (buffs.isEmpty()) return;
        List<Buff> next = new ArrayList<>();
        int healed = 0;
        boolean changed = false;
        for (Buff buff : buffs) {
            if (!buff.isRegen()) {
                next.add(buff);
                continue;
            }
            changed = true;
            int amount = Math.max(0, Math.min(buff.value(), player.getMaxHp() - player.getHp() - healed));
            healed += amount;
            if (amount > 0) narrative.add("持續恢復了 " + amount + " 點 HP。");
            Buff ticked = buff.tick();
            if (ticked.isExpired()) narrative.add("恢復效果消失了。");
            else next.add(ticked);
        }
        if (!changed) return;
        buffs = next;
        delta.buffs(buffs);
        if (healed > 0) setHp(player.getHp() + healed);
    }

    // ========== Scenes ==========

    /**
     * Move to another scene, optionally in another chapter. The scene is
     * re-resolved for the (new) chapter, an active fight is left, the scene's
     * on-enter changes are applied and a combat scene starts its encounter.
     */
    public void switchScene(String nextScene, String nextChapter) {
        if (nextChapter != null && !nextChapter.equals(chapter)) {
            chapter = nextChapter;
            delta.chapter(chapter);
        }
        sceneId = nextScene;
        delta.scene(sceneId);
        scene = catalog.getScene(chapter, sceneId);
        if (combat != null) clearCombat();
        applyStateChanges(scene.getOnEnterStateChanges());
        enterCombatIfNeeded();
    }

    /**
     * Start the current scene's encounter when it is a combat scene and no
     * snapshot exists yet.
     */
    public void enterCombatIfNeeded() {
        if (combat != null || !scene.isCombat()) return;
        combatSystem.init(scene.getCombatInfo().enemyId(), player).ifPresent(this::setCombat);
    }

    public void setCombat(CombatSnapshot snapshot) {
        this.combat = snapshot;
        if (snapshot != null) recordCombat();
        else delta.clearCombat();
    }

    public void recordCombat() {
        delta.combat(combat);
    }

    public void clearCombat() {
        setCombat(null);
    }

    // ========== Actions ==========

    /** The combat menu while fighting, otherwise the scene's actions. */
    public List<ActionDescriptor> currentActions() {
        return isInCombat() ? combatActions() : scene.getActions();
    }

    /**
     * The combat menu, in fixed order: melee always, magic when mp allows, item use
     * when a combat-usable item is held.
     */
    public List<ActionDescriptor> combatActions() {
        List<ActionDescriptor> actions = new ArrayList<>();
        actions.add(attackAction(AttackType.MELEE, AttackType.MELEE.label));
        if (canCastMagic()) {
            actions.add(attackAction(AttackType.MAGIC, AttackType.MAGIC.label + "（" + MAGIC_MP_COST + " MP）"));
        }
        if (!inventory.usableItems(player.getInventory(), true).isEmpty()) {
            actions.add(ActionDescriptor.of("use_item", ActionType.USE_ITEM.key, "使用物品"));
        }
        return actions;
    }

    private ActionDescriptor attackAction(AttackType type, String label) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attack_type", type.key);
        return new ActionDescriptor("attack_" + type.key, ActionType.ATTACK.key, label, data);
    }

    /**
     * Display details of the current encounter, or null outside combat.
     */
    public Map<String, Object> combatInfo() {
        return combat != null ? combatInfo(combat) : null;
    }

    public Map<String, Object> combatInfo(CombatSnapshot snapshot) {
        EnemyDefinition enemy = catalog.getEnemy(snapshot.getEnemyId());
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("enemy_id", snapshot.getEnemyId());
        info.put("enemy_name", snapshot.getEnemyName());
        info.put("enemy_hp", snapshot.getEnemyHp());
        info.put("enemy_max_hp", snapshot.getEnemyMaxHp());
        info.put("enemy_evasion", snapshot.getEnemyEvasion());
        info.put("enemy_weakness", enemy != null ? enemy.getWeakness() : null);
        String attack = null;
        if (enemy != null && !enemy.getAttacks().isEmpty()) attack = enemy.getAttacks().get(0).description();
        info.put("enemy_attack", attack);
        info.put("turn", snapshot.getTurn());
        return info;
    }
}
