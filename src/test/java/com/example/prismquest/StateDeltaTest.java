package com.example.prismquest;

import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.ItemType;
import com.example.prismquest.state.StateDelta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StateDelta Tests")
class StateDeltaTest {

    private static CombatSnapshot snapshot() {
        return new CombatSnapshot("shadow_wisp", "暗影幽光", 5, 8, 10, 0, 2, true, 20, 26);
    }

    @Test
    @DisplayName("An empty delta renders no keys")
    void emptyDelta() {
        StateDelta delta = StateDelta.empty();
        assertTrue(delta.isEmpty());
        assertTrue(delta.toDocument().isEmpty());
        assertFalse(delta.hasCombatChange());
        assertFalse(delta.isInventoryChanged());
    }

    @Test
    @DisplayName("Only set keys are rendered")
    void onlySetKeys() {
        Map<String, Object> doc = StateDelta.empty().scene("study_room").playerHp(12).toDocument();
        assertEquals(Map.of("scene", "study_room", "player_hp", 12), doc);
    }

    @Test
    @DisplayName("Flags accumulate across calls")
    void flagsMerge() {
        StateDelta delta = StateDelta.empty()
            .flags(Map.of("a", true))
            .flags(Map.of("b", 2));
        assertEquals(Map.of("a", true, "b", 2), delta.toDocument().get(StateDelta.FLAGS));
    }

    @Test
    @DisplayName("A cleared snapshot renders as explicit null")
    void clearedCombat() {
        StateDelta delta = StateDelta.empty().clearCombat();
        Map<String, Object> doc = delta.toDocument();
        assertTrue(doc.containsKey(StateDelta.COMBAT));
        assertNull(doc.get(StateDelta.COMBAT));
        assertTrue(delta.isCombatCleared());
        assertFalse(delta.isEmpty());
    }

    @Test
    @DisplayName("Setting a snapshot after clearing replaces the clear")
    void combatAfterClear() {
        StateDelta delta = StateDelta.empty().clearCombat().combat(snapshot());
        assertFalse(delta.isCombatCleared());
        @SuppressWarnings("unchecked")
        Map<String, Object> combat = (Map<String, Object>) delta.toDocument().get(StateDelta.COMBAT);
        assertEquals(5, combat.get("enemy_hp"));
    }

    @Test
    @DisplayName("Stored snapshot is a copy")
    void combatIsCopied() {
        CombatSnapshot snapshot = snapshot();
        StateDelta delta = StateDelta.empty().combat(snapshot);
        snapshot.damageEnemy(5);
        assertEquals(5, delta.getCombat().getEnemyHp());
    }

    @Test
    @DisplayName("Inventory changes carry the full list and a changed marker")
    void inventoryChanged() {
        StateDelta delta = StateDelta.empty()
            .inventory(List.of(new InventoryStack("red_potion", "紅光藥水", ItemType.CONSUMABLE, 1)));
        Map<String, Object> doc = delta.toDocument();
        assertEquals(true, doc.get(StateDelta.INVENTORY_CHANGED));
        assertEquals(List.of(Map.of("id", "red_potion", "name", "紅光藥水", "type", "consumable", "quantity", 1)),
            doc.get(StateDelta.INVENTORY));
    }

    @Test
    @DisplayName("Gold gained and drops accumulate")
    void rewardsAccumulate() {
        StateDelta delta = StateDelta.empty()
            .addGoldGained(10)
            .addGoldGained(5)
            .addDrop(new EnemyDefinition.Drop("shadow_essence", 1));
        assertEquals(15, delta.getGoldGained());
        assertEquals(List.of(Map.of("id", "shadow_essence", "quantity", 1)), delta.toDocument().get(StateDelta.DROPS));
    }

    @Test
    @DisplayName("Merge lets later scalars win and keeps both flag sets")
    void mergeDeltas() {
        StateDelta first = StateDelta.empty().scene("a").playerHp(10).flags(Map.of("x", 1)).addGoldGained(3);
        StateDelta later = StateDelta.empty().playerHp(7).flags(Map.of("y", 2)).addGoldGained(4)
            .buffs(List.of(new Buff(Buff.REGEN_HP, 3, 2)));
        first.merge(later);
        assertEquals("a", first.getScene());
        assertEquals(7, first.getPlayerHp());
        assertEquals(Map.of("x", 1, "y", 2), first.getFlags());
        assertEquals(7, first.getGoldGained());
        assertEquals(1, first.getBuffs().size());
        assertSame(first, first.merge(null));
    }
}
