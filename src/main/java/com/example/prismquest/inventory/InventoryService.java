package com.example.prismquest.inventory;

import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.effect.EffectOutcome;
import com.example.prismquest.effect.ItemEffectRegistry;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.ItemDefinition;
import com.example.prismquest.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Item rules: usability, item effects, stacking and weight.
 *
 * Inventories are immutable lists; every mutation returns a new list and leaves
 * its input alone.
 */
public class InventoryService {

    private static final Logger logger = LoggerFactory.getLogger(InventoryService.class);

    public static final int BASE_CARRY_CAPACITY = 10;

    /**
     * Result of a usability check: success, or failure with a message for the player.
     */
    public static class CheckResult {
        private final boolean success;
        private final String failureMessage;

        private CheckResult(boolean success, String failureMessage) {
            this.success = success;
            this.failureMessage = failureMessage;
        }

        public static CheckResult success() {
            return new CheckResult(true, null);
        }

        public static CheckResult failure(String message) {
            return new CheckResult(false, message);
        }

        public boolean isSuccess() { return success; }
        public boolean isFailure() { return !success; }
        public String getFailureMessage() { return failureMessage; }
    }

    private final GameCatalog catalog;
    private final ItemEffectRegistry effects;

    public InventoryService(GameCatalog catalog) {
        this(catalog, ItemEffectRegistry.withDefaults());
    }

    public InventoryService(GameCatalog catalog, ItemEffectRegistry effects) {
        this.catalog = catalog;
        this.effects = effects;
    }

    public ItemDefinition getItem(String itemId) {
        return catalog.getItem(itemId);
    }

    public String getItemName(String itemId) {
        return catalog.getItemName(itemId);
    }

    // ========== Using items ==========

    /**
     * Whether an item may be used right now. Only consumable and misc items can be
     * used, and in combat only those marked usable in combat.
     */
    public CheckResult canUse(String itemId, boolean inCombat) {
        ItemDefinition item = catalog.getItem(itemId);
        if (item == null) {
            return CheckResult.failure("找不到該物品。");
        }
        if (!item.getType().isUsable()) {
            return CheckResult.failure(item.getName() + " 無法使用。");
        }
        if (inCombat && !item.isUsableInCombat()) {
            return CheckResult.failure("這個物品無法在戰鬥中使用。");
        }
        return CheckResult.success();
    }

    /**
     * Resolve an item's effect for the given player. Possession is the caller's
     * concern; so is removing the consumed unit.
     */
    public UseItemResult useItem(String itemId, Player player, boolean inCombat) {
        ItemDefinition item = catalog.getItem(itemId);
        if (item == null) {
            return UseItemResult.failure(UseItemResult.NOT_FOUND, "找不到該物品。");
        }
        CheckResult check = canUse(itemId, inCombat);
        if (check.isFailure()) {
            return UseItemResult.failure(UseItemResult.NOT_USABLE, check.getFailureMessage());
        }

        EffectOutcome outcome = new EffectOutcome();
        if (item.hasEffect()) {
            effects.apply(item.getEffect(), player, outcome);
        }
        UseItemResult result = UseItemResult.used(item.getName(), List.of("你使用了" + item.getName() + "。"), outcome);
        logger.debug("{} used {}: {}", player.getName(), itemId, result);
        return result;
    }

    // ========== Stacks ==========

    /**
     * Add items, stacking onto an existing entry. Ids missing from the catalog are ignored.
     */
    public List<InventoryStack> addItem(List<InventoryStack> inventory, String itemId, int quantity) {
        ItemDefinition item = catalog.getItem(itemId);
        if (item == null || quantity < 1) {
            if (item == null) logger.warn("Ignoring unknown item '{}'", itemId);
            return inventory;
        }
        List<InventoryStack> out = new ArrayList<>(inventory);
        for (int i = 0; i < out.size(); i++) {
            InventoryStack stack = out.get(i);
            if (stack.getId().equals(itemId)) {
                out.set(i, stack.withQuantity(stack.getQuantity() + quantity));
                return List.copyOf(out);
            }
        }
        out.add(new InventoryStack(itemId, item.getName(), item.getType(), quantity));
        return List.copyOf(out);
    }

    /**
     * Remove items. Fails, returning the input unchanged, if fewer are held or the
     * quantity is not positive.
     * Removing the last unit drops the stack.
     */
    public RemoveResult removeItem(List<InventoryStack> inventory, String itemId, int quantity) {
        if (quantity < 1) {
            return new RemoveResult(inventory, false);
        }
        for (int i = 0; i < inventory.size(); i++) {
            InventoryStack stack = inventory.get(i);
            if (!stack.getId().equals(itemId)) continue;
            if (stack.getQuantity() < quantity) {
                return new RemoveResult(inventory, false);
            }
            List<InventoryStack> out = new ArrayList<>(inventory);
            if (stack.getQuantity() == quantity) out.remove(i);
            else out.set(i, stack.withQuantity(stack.getQuantity() - quantity));
            return new RemoveResult(out, true);
        }
        return new RemoveResult(inventory, false);
    }

    public boolean hasItem(List<InventoryStack> inventory, String itemId, int quantity) {
        for (InventoryStack stack : inventory) {
            if (stack.getId().equals(itemId)) return stack.getQuantity() >= quantity;
        }
        return false;
    }

    public boolean hasItem(List<InventoryStack> inventory, String itemId) {
        return hasItem(inventory, itemId, 1);
    }

    /**
     * Held stacks that {@link #canUse} accepts, in inventory order.
     */
    public List<InventoryStack> usableItems(List<InventoryStack> inventory, boolean inCombat) {
        List<InventoryStack> out = new ArrayList<>();
        for (InventoryStack stack : inventory) {
            if (canUse(stack.getId(), inCombat).isSuccess()) out.add(stack);
        }
        return out;
    }

    // ========== Weight ==========

    public double calculateWeight(List<InventoryStack> inventory) {
        double total = 0.0;
        for (InventoryStack stack : inventory) {
            ItemDefinition item = catalog.getItem(stack.getId());
            if (item != null) total += item.getWeight() * stack.getQuantity();
        }
        return total;
    }

    public int getCarryCapacity(Player player) {
        return BASE_CARRY_CAPACITY + player.getAttribute(Attribute.STRENGTH);
    }

    /** Advisory only; nothing blocks an overweight player. */
    public boolean isOverweight(Player player) {
        return calculateWeight(player.getInventory()) > getCarryCapacity(player);
    }

    // ========== Weapons ==========

    /**
     * Profile of the equipped weapon, or {@link WeaponProfile#UNARMED} when nothing
     * (or an unknown id) is equipped.
     */
    public WeaponProfile equippedWeapon(Player player) {
        String weaponId = player.getEquipment().getWeapon();
        if (weaponId == null) return WeaponProfile.UNARMED;
        ItemDefinition weapon = catalog.getItem(weaponId);
        if (weapon == null) {
            logger.warn("Equipped weapon '{}' is not in the catalog", weaponId);
            return WeaponProfile.UNARMED;
        }
        return new WeaponProfile(weapon.getDamage(), weapon.getAttribute(), weapon.isLight());
    }
}
