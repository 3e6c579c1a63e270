package com.example.prismquest;

import com.example.prismquest.inventory.InventoryService;
import com.example.prismquest.inventory.RemoveResult;
import com.example.prismquest.inventory.UseItemResult;
import com.example.prismquest.inventory.WeaponProfile;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.Equipment;
import com.example.prismquest.model.EquipmentSlot;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.ItemType;
import com.example.prismquest.model.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InventoryService - using, stacking and removing items.
 */
@DisplayName("InventoryService Tests")
public class InventoryServiceTest {

    private InventoryService inventory;
    private Player player;

    @BeforeEach
    void setUp() {
        inventory = new InventoryService(Fixtures.catalog());
        player = Fixtures.warrior();
    }

    private static InventoryStack stack(String id, int quantity) {
        return new InventoryStack(id, id, ItemType.CONSUMABLE, quantity);
    }

    // === canUse ===

    @Test
    @DisplayName("Unknown items cannot be used")
    void canUseUnknown() {
        InventoryService.CheckResult check = inventory.canUse("dragon_egg", false);
        assertTrue(check.isFailure());
        assertEquals("找不到該物品。", check.getFailureMessage());
    }

    @Test
    @DisplayName("Weapons and materials are not usable")
    void canUseWrongType() {
        assertEquals("生鏽的劍 無法使用。", inventory.canUse("rusty_sword", false).getFailureMessage());
        assertTrue(inventory.canUse("shadow_essence", false).isFailure());
    }

    @Test
    @DisplayName("Items not marked for combat are refused in combat only")
    void canUseCombatRestriction() {
        assertTrue(inventory.canUse("panacea", false).isSuccess());
        InventoryService.CheckResult inCombat = inventory.canUse("panacea", true);
        assertTrue(inCombat.isFailure());
        assertEquals("這個物品無法在戰鬥中使用。", inCombat.getFailureMessage());
        assertTrue(inventory.canUse("red_potion", true).isSuccess());
    }

    // === useItem ===

    @Test
    @DisplayName("Healing never exceeds max hp")
    void healCappedAtMax() {
        UseItemResult result = inventory.useItem("red_potion", player.withHp(20), false);
        assertTrue(result.isSuccess());
        assertEquals(6, result.getHpChange());
        assertEquals("使用了紅光藥水", result.getMessage());
        assertEquals(List.of("你使用了紅光藥水。", "恢復了 6 點 HP。"), result.getNarrative());
        assertTrue(result.isItemConsumed());
    }

    @Test
    @DisplayName("Healing at full hp changes nothing but still uses the item")
    void healAtFullHp() {
        UseItemResult result = inventory.useItem("red_potion", player, false);
        assertTrue(result.isSuccess());
        assertEquals(0, result.getHpChange());
        assertTrue(result.getNarrative().contains("HP 已經是滿的了。"));
        assertTrue(result.isItemConsumed());
    }

    @Test
    @DisplayName("Mana potion restores mp up to max")
    void healMp() {
        UseItemResult result = inventory.useItem("blue_potion", player.withMp(4), false);
        assertEquals(8, result.getMpChange());
        assertEquals(0, result.getHpChange());
    }

    @Test
    @DisplayName("Regen potion starts a buff instead of healing")
    void regenPotion() {
        UseItemResult result = inventory.useItem("green_potion", player.withHp(10), true);
        assertEquals(0, result.getHpChange());
        assertEquals(new Buff(Buff.REGEN_HP, 3, 3), result.getRegen());
        assertEquals(Buff.REGEN_HP, result.getBuffApplied());
    }

    @Test
    @DisplayName("Unknown item fails without consuming anything")
    void useUnknownItem() {
        UseItemResult result = inventory.useItem("dragon_egg", player, false);
        assertFalse(result.isSuccess());
        assertEquals(UseItemResult.NOT_FOUND, result.getMessage());
        assertFalse(result.isItemConsumed());
    }

    @Test
    @DisplayName("Refused item reports the reason")
    void useRefusedItem() {
        UseItemResult result = inventory.useItem("fire_resist_tonic", player, true);
        assertFalse(result.isSuccess());
        assertEquals(UseItemResult.NOT_USABLE, result.getMessage());
        assertEquals(List.of("這個物品無法在戰鬥中使用。"), result.getNarrative());
    }

    // === Stacks ===

    @Test
    @DisplayName("Adding an item already held stacks onto it")
    void addStacks() {
        List<InventoryStack> start = List.of(stack("red_potion", 2));
        List<InventoryStack> out = inventory.addItem(start, "red_potion", 3);
        assertEquals(1, out.size());
        assertEquals(5, out.get(0).getQuantity());
        assertEquals(2, start.get(0).getQuantity());
    }

    @Test
    @DisplayName("Adding a new item appends it with catalog name and type")
    void addNew() {
        List<InventoryStack> out = inventory.addItem(List.of(), "rusty_sword", 1);
        assertEquals(1, out.size());
        assertEquals("生鏽的劍", out.get(0).getName());
        assertEquals(ItemType.WEAPON, out.get(0).getType());
    }

    @Test
    @DisplayName("Adding an unknown item returns the inventory unchanged")
    void addUnknown() {
        List<InventoryStack> start = List.of(stack("red_potion", 2));
        assertSame(start, inventory.addItem(start, "dragon_egg", 1));
    }

    @Test
    @DisplayName("Removing more than held fails and leaves the list unchanged")
    void removeTooMany() {
        List<InventoryStack> start = List.of(stack("red_potion", 2));
        RemoveResult result = inventory.removeItem(start, "red_potion", 3);
        assertFalse(result.removed());
        assertEquals(start, result.inventory());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -5})
    @DisplayName("Removing a non-positive quantity fails and leaves the list unchanged")
    void removeNonPositive(int quantity) {
        List<InventoryStack> start = List.of(stack("red_potion", 2));
        RemoveResult result = inventory.removeItem(start, "red_potion", quantity);
        assertFalse(result.removed());
        assertEquals(start, result.inventory());
        assertEquals(2, result.inventory().get(0).getQuantity());
    }

    @Test
    @DisplayName("Remove returns an unmodifiable list")
    void removeReturnsUnmodifiable() {
        RemoveResult result = inventory.removeItem(List.of(stack("red_potion", 3)), "red_potion", 1);
        assertTrue(result.removed());
        assertThrows(UnsupportedOperationException.class, () -> result.inventory().add(stack("antidote", 1)));
    }

    @Test
    @DisplayName("Removing the last unit drops the stack")
    void removeLast() {
        RemoveResult result = inventory.removeItem(List.of(stack("red_potion", 1), stack("antidote", 1)), "red_potion", 1);
        assertTrue(result.removed());
        assertEquals(1, result.inventory().size());
        assertEquals("antidote", result.inventory().get(0).getId());
    }

    @Test
    @DisplayName("Removing part of a stack decrements it")
    void removePartial() {
        RemoveResult result = inventory.removeItem(List.of(stack("red_potion", 3)), "red_potion", 2);
        assertTrue(result.removed());
        assertEquals(1, result.inventory().get(0).getQuantity());
    }

    @Test
    @DisplayName("Removing a missing item fails")
    void removeMissing() {
        assertFalse(inventory.removeItem(List.of(), "red_potion", 1).removed());
    }

    @Test
    @DisplayName("hasItem checks quantity")
    void hasItem() {
        List<InventoryStack> items = List.of(stack("red_potion", 2));
        assertTrue(inventory.hasItem(items, "red_potion"));
        assertTrue(inventory.hasItem(items, "red_potion", 2));
        assertFalse(inventory.hasItem(items, "red_potion", 3));
        assertFalse(inventory.hasItem(items, "antidote"));
    }

    @Test
    @DisplayName("Usable items keep inventory order and respect combat")
    void usableItems() {
        List<InventoryStack> items = List.of(
            stack("panacea", 1), stack("shadow_essence", 1), stack("red_potion", 2));
        assertEquals(2, inventory.usableItems(items, false).size());
        List<InventoryStack> inCombat = inventory.usableItems(items, true);
        assertEquals(1, inCombat.size());
        assertEquals("red_potion", inCombat.get(0).getId());
    }

    // === Weight ===

    @Test
    @DisplayName("Weight sums catalog weight times quantity")
    void weight() {
        List<InventoryStack> items = List.of(stack("red_potion", 2), stack("rusty_sword", 1), stack("unknown", 5));
        assertEquals(4.0, inventory.calculateWeight(items), 0.0001);
        assertEquals(13, inventory.getCarryCapacity(player));
        assertFalse(inventory.isOverweight(player));
        assertTrue(inventory.isOverweight(player.withInventory(List.of(stack("rusty_sword", 5)))));
    }

    // === Weapons ===

    @Test
    @DisplayName("No weapon means unarmed profile")
    void unarmed() {
        assertEquals(WeaponProfile.UNARMED, inventory.equippedWeapon(player));
        assertEquals(2, WeaponProfile.UNARMED.damage());
        assertEquals(Attribute.STRENGTH, WeaponProfile.UNARMED.attribute());
        assertFalse(WeaponProfile.UNARMED.light());
    }

    @Test
    @DisplayName("Equipped weapon profile comes from the catalog")
    void equippedWeapon() {
        Player armed = player.withEquipment(Equipment.empty().with(EquipmentSlot.WEAPON, "lantern_staff"));
        WeaponProfile weapon = inventory.equippedWeapon(armed);
        assertEquals(3, weapon.damage());
        assertEquals(Attribute.INTELLIGENCE, weapon.attribute());
        assertTrue(weapon.light());
    }

    @Test
    @DisplayName("Unknown equipped weapon falls back to unarmed")
    void unknownWeapon() {
        Player armed = player.withEquipment(Equipment.empty().with(EquipmentSlot.WEAPON, "excalibur"));
        assertEquals(WeaponProfile.UNARMED, inventory.equippedWeapon(armed));
    }
}
