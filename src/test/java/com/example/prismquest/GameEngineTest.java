package com.example.prismquest;

import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.engine.ActionResult;
import com.example.prismquest.engine.DiceReport;
import com.example.prismquest.engine.GameEngine;
import com.example.prismquest.engine.SceneActionHandler;
import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.GameState;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.ItemType;
import com.example.prismquest.model.Player;
import com.example.prismquest.model.SceneType;
import com.example.prismquest.state.DeltaMerger;
import com.example.prismquest.state.StateDelta;
import com.example.prismquest.util.CheckOutcome;
import com.example.prismquest.util.Dice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the action engine against the bundled catalog. Every random
 * draw is scripted, so each test states the rolls it expects the engine to make.
 */
@DisplayName("GameEngine Tests")
public class GameEngineTest {

    private ScriptedRandom rng;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        rng = new ScriptedRandom();
        engine = new GameEngine(Fixtures.catalog(), new Dice(rng));
    }

    private ActionResult act(GameState state, String type, Map<String, Object> data) {
        return engine.process(state, type, data);
    }

    private ActionResult act(GameState state, String type) {
        return engine.process(state, type, Map.of());
    }

    private static Map<String, Object> delta(ActionResult result) {
        return result.getStateChanges().toDocument();
    }

    private static List<String> actionIds(ActionResult result) {
        List<String> ids = new ArrayList<>();
        for (ActionDescriptor a : result.getAvailableActions()) ids.add(a.getId());
        return ids;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> combatDoc(ActionResult result) {
        return (Map<String, Object>) delta(result).get(StateDelta.COMBAT);
    }

    private static GameState atGate(Player player) {
        CombatSnapshot snapshot = new CombatSnapshot("shadow_wisp", "暗影幽光", 8, 8, 10, 0, 1, true,
            player.getHp(), player.getMaxHp());
        return Fixtures.at("prologue", "lighthouse_gate", player).withCombat(snapshot);
    }

    private static Player holding(Player player, String id, String name, ItemType type, int quantity) {
        return player.withInventory(List.of(new InventoryStack(id, name, type, quantity)));
    }

    // === Start and resume ===

    @Test
    @DisplayName("Start on the opening scene shows the opening dream and changes nothing")
    void startOnOpening() {
        ActionResult result = act(GameState.newGame(Fixtures.warrior()), "start");
        assertTrue(result.isSuccess());
        assertEquals("場景載入", result.getMessage());
        assertEquals(SceneActionHandler.OPENING_NARRATIVE, result.getNarrative());
        assertEquals(List.of("wake_up"), actionIds(result));
        assertEquals(SceneType.NARRATIVE, result.getSceneType());
        assertTrue(result.getStateChanges().isEmpty());
        assertNull(result.getCombatInfo());
    }

    @Test
    @DisplayName("Start without a loaded scene returns the opening narrative")
    void startWithoutScene() {
        GameEngine bare = new GameEngine(GameCatalog.empty(), new Dice(rng));
        ActionResult result = bare.process(GameState.newGame(Fixtures.warrior()), "start", null);
        assertTrue(result.isSuccess());
        assertEquals("遊戲開始", result.getMessage());
        assertEquals(SceneActionHandler.OPENING_NARRATIVE, result.getNarrative());
        assertTrue(result.getAvailableActions().isEmpty());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Resume shows the short narrative")
    void resume() {
        ActionResult result = act(Fixtures.at("study_room"), "resume");
        assertEquals("遊戲恢復", result.getMessage());
        assertEquals(List.of("你站在師父的書房裡。"), result.getNarrative());
        assertEquals(List.of("read_letter", "search_desk", "leave_study"), actionIds(result));
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Resume in an unknown scene falls back to a generic line")
    void resumeUnknownScene() {
        ActionResult result = act(Fixtures.at("nowhere"), "resume");
        assertTrue(result.isSuccess());
        assertEquals(List.of(SceneActionHandler.RESUME_FALLBACK), result.getNarrative());
        assertTrue(result.getAvailableActions().isEmpty());
    }

    @Test
    @DisplayName("Resume mid-fight shows the combat menu and the stored enemy")
    void resumeInCombat() {
        GameState state = atGate(Fixtures.warrior().withHp(20));
        ActionResult result = act(state, "resume");
        assertEquals(List.of("attack_melee", "attack_magic", "use_item"), actionIds(result));
        assertEquals(SceneType.COMBAT, result.getSceneType());
        assertEquals(8, result.getCombatInfo().get("enemy_hp"));
        assertEquals("暗影觸鬚掃向你！", result.getCombatInfo().get("enemy_attack"));
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Stored state documents are accepted directly")
    void processDocument() {
        Map<String, Object> doc = Fixtures.at("study_room").toDocument();
        Map<String, Object> before = new LinkedHashMap<>(doc);
        ActionResult result = engine.process(doc, "choice", Map.of("choice_id", "read_letter"));
        assertTrue(result.isSuccess());
        assertEquals(before, doc);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> withInventory(Map<String, Object> doc, List<Map<String, Object>> inventory) {
        Map<String, Object> out = new LinkedHashMap<>(doc);
        Map<String, Object> player = new LinkedHashMap<>((Map<String, Object>) doc.get("player"));
        player.put("inventory", inventory);
        out.put("player", player);
        return out;
    }

    @Test
    @DisplayName("Stored documents with blank inventory ids still load")
    void processDocumentWithBlankItemId() {
        Map<String, Object> doc = withInventory(Fixtures.at("study_room").toDocument(), List.of(
            Map.of("id", "", "quantity", 1),
            Map.of("id", "  ", "quantity", 1),
            Map.of("id", "red_potion", "quantity", 1)));

        ActionResult result = assertDoesNotThrow(() -> engine.process(doc, "start", Map.of()));
        assertTrue(result.isSuccess());
        assertEquals("場景載入", result.getMessage());
        assertTrue(result.getStateChanges().isEmpty());

        ActionResult menu = engine.process(doc, "use_item", Map.of());
        assertEquals(List.of("use_red_potion", "cancel"), actionIds(menu));
    }

    @Test
    @DisplayName("Duplicate stored stacks can be used up completely")
    void processDocumentWithDuplicateStacks() {
        Map<String, Object> doc = withInventory(
            Fixtures.at("prologue", "study_room", Fixtures.warrior().withHp(10)).toDocument(), List.of(
                Map.of("id", "red_potion", "name", "紅光藥水", "type", "consumable", "quantity", 1),
                Map.of("id", "red_potion", "name", "紅光藥水", "type", "consumable", "quantity", 1)));

        ActionResult first = engine.process(doc, "use_item", Map.of("item_id", "red_potion"));
        assertTrue(first.isSuccess());
        List<InventoryStack> left = first.getStateChanges().getInventory();
        assertEquals(1, left.size());
        assertEquals(1, left.get(0).getQuantity());

        Map<String, Object> next = DeltaMerger.merge(doc, first.getStateChanges());
        ActionResult second = engine.process(next, "use_item", Map.of("item_id", "red_potion"));
        assertTrue(second.isSuccess());
        assertTrue(second.getStateChanges().getInventory().isEmpty());
    }

    // === Choices and checks ===

    @Test
    @DisplayName("A plain choice sets its flags and keeps the scene actions")
    void choiceSetsFlag() {
        ActionResult result = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", "read_letter"));
        assertTrue(result.isSuccess());
        assertEquals("選擇完成", result.getMessage());
        assertEquals(Map.of("flags", Map.of("read_letter", true)), delta(result));
        assertEquals(2, result.getNarrative().size());
        assertEquals(3, result.getAvailableActions().size());
        assertNull(result.getSceneType());
    }

    @Test
    @DisplayName("An unknown choice fails without changes")
    void unknownChoice() {
        ActionResult result = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", "nope"));
        assertFalse(result.isSuccess());
        assertEquals("無效的選擇", result.getMessage());
        assertEquals(List.of("請選擇有效的選項。"), result.getNarrative());
        assertEquals(3, result.getAvailableActions().size());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("A choice can add items")
    void choiceAddsItem() {
        ActionResult result = act(Fixtures.at("lighthouse_interior"), "choice", Map.of("choice_id", "open_cellar"));
        Map<String, Object> delta = delta(result);
        assertEquals(Map.of("prism_shard", 1), delta.get("flags"));
        assertEquals(true, delta.get(StateDelta.INVENTORY_CHANGED));
        List<InventoryStack> inventory = result.getStateChanges().getInventory();
        assertEquals(2, inventory.size());
        assertEquals("prism_shard", inventory.get(1).getId());
    }

    @Test
    @DisplayName("A passed check applies its success changes")
    void checkSucceeds() {
        rng.d100(45);
        ActionResult result = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", "search_desk"));
        assertTrue(result.isSuccess());
        assertEquals("成功（45/60）", result.getMessage());
        assertEquals(new DiceReport(45, 60, CheckOutcome.SUCCESS, Attribute.PERCEPTION, 3), result.getDiceResult());
        Map<String, Object> delta = delta(result);
        assertEquals(Map.of("found_map", true), delta.get("flags"));
        assertEquals(60, delta.get("gold"));
        assertEquals(10, delta.get("gold_gained"));
        assertEquals(3, result.getAvailableActions().size());
    }

    @Test
    @DisplayName("A failed check reports failure and changes nothing")
    void checkFails() {
        rng.d100(80);
        ActionResult result = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", "search_desk"));
        assertFalse(result.isSuccess());
        assertEquals("失敗（80/60）", result.getMessage());
        assertEquals(List.of("你翻遍了抽屜，只找到一堆乾枯的墨水瓶。"), result.getNarrative());
        assertEquals(CheckOutcome.FAILURE, result.getDiceResult().outcome());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("A failed check applies its failure changes")
    void checkFailureDamage() {
        rng.d100(50);
        ActionResult result = act(Fixtures.at("lighthouse_path"), "choice", Map.of("choice_id", "climb_rocks"));
        assertFalse(result.isSuccess());
        assertEquals(20, result.getDiceResult().threshold());
        assertEquals(Map.of("player_hp", 24), delta(result));
    }

    @Test
    @DisplayName("A passed check moves to its next scene and starts the fight there")
    void checkMovesIntoCombat() {
        rng.d100(15);
        ActionResult result = act(Fixtures.at("lighthouse_path"), "choice", Map.of("choice_id", "climb_rocks"));
        assertTrue(result.isSuccess());
        assertEquals("lighthouse_gate", delta(result).get("scene"));
        assertEquals(8, combatDoc(result).get("enemy_hp"));
        assertEquals(SceneType.COMBAT, result.getSceneType());
        assertEquals("shadow_wisp", result.getCombatInfo().get("enemy_id"));
        assertEquals(List.of("attack_melee", "attack_magic", "use_item"), actionIds(result));
    }

    @Test
    @DisplayName("Standalone skill check with a critical roll")
    void standaloneCheck() {
        rng.d100(3);
        Map<String, Object> payload = Map.of("attribute", "strength", "difficulty", "very_hard",
            "success_text", List.of("你推開了巨石。"));
        ActionResult result = act(Fixtures.at("study_room"), "skill_check", payload);
        assertTrue(result.isSuccess());
        assertEquals(CheckOutcome.CRITICAL_SUCCESS, result.getDiceResult().outcome());
        assertEquals(20, result.getDiceResult().threshold());
        assertEquals(List.of("你推開了巨石。"), result.getNarrative());
    }

    @Test
    @DisplayName("A critical failure fails even under the threshold")
    void criticalFailure() {
        rng.d100(98);
        ActionResult result = act(Fixtures.at("study_room"), "skill_check",
            Map.of("attribute", "perception", "difficulty", "easy"));
        assertFalse(result.isSuccess());
        assertEquals(80, result.getDiceResult().threshold());
        assertEquals(CheckOutcome.CRITICAL_FAILURE, result.getDiceResult().outcome());
        assertEquals(List.of("檢定失敗。"), result.getNarrative());
    }

    @Test
    @DisplayName("Authored damage that kills the player ends the game")
    void authoredDamageEndsGame() {
        rng.d100(99);
        Map<String, Object> payload = Map.of("failure_state_changes", Map.of("damage", 100));
        ActionResult result = act(Fixtures.at("study_room"), "skill_check", payload);
        assertFalse(result.isSuccess());
        assertEquals("遊戲結束", result.getMessage());
        assertEquals(0, delta(result).get("player_hp"));
        assertEquals(true, delta(result).get("game_over"));
        assertTrue(result.getAvailableActions().isEmpty());
    }

    // === Navigation ===

    @Test
    @DisplayName("Continue moves to the next scene")
    void continueToNextScene() {
        ActionResult result = act(GameState.newGame(Fixtures.warrior()), "continue",
            Map.of("next_scene", "study_room"));
        assertEquals("繼續", result.getMessage());
        assertEquals(Map.of("scene", "study_room"), delta(result));
        assertEquals(Fixtures.catalog().getScene("prologue", "study_room").getNarrative(), result.getNarrative());
        assertEquals(SceneType.EXPLORATION, result.getSceneType());
    }

    @Test
    @DisplayName("Entering a scene applies its on-enter changes")
    void onEnterChanges() {
        ActionResult result = act(Fixtures.at("study_room"), "continue", Map.of("next_scene", "lighthouse_path"));
        assertEquals(Map.of("visited_path", true), delta(result).get("flags"));
    }

    @Test
    @DisplayName("Continue without a target stays put")
    void continueInPlace() {
        ActionResult result = act(Fixtures.at("study_room"), "continue");
        assertTrue(result.getStateChanges().isEmpty());
        assertEquals(3, result.getAvailableActions().size());
    }

    @Test
    @DisplayName("Continue into an unknown scene shows an ellipsis")
    void continueIntoUnknownScene() {
        ActionResult result = act(Fixtures.at("study_room"), "continue", Map.of("next_scene", "void"));
        assertEquals(List.of("..."), result.getNarrative());
        assertTrue(result.getAvailableActions().isEmpty());
    }

    @Test
    @DisplayName("Continue can cross into the next chapter")
    void continueAcrossChapters() {
        ActionResult result = act(Fixtures.at("lighthouse_interior"), "continue",
            Map.of("next_scene", "harbor_town", "next_chapter", "chapter_one"));
        assertEquals(Map.of("chapter", "chapter_one", "scene", "harbor_town"), delta(result));
        assertEquals(List.of("visit_market"), actionIds(result));
    }

    @Test
    @DisplayName("Continue into a combat scene starts the encounter")
    void continueIntoCombat() {
        ActionResult result = act(Fixtures.at("lighthouse_path"), "continue",
            Map.of("next_scene", "lighthouse_gate"));
        Map<String, Object> combat = combatDoc(result);
        assertEquals("shadow_wisp", combat.get("enemy_id"));
        assertEquals(8, combat.get("enemy_hp"));
        assertEquals(1, combat.get("turn"));
        assertEquals(SceneType.COMBAT, result.getSceneType());
    }

    @Test
    @DisplayName("Cancel returns the current menu without changes")
    void cancel() {
        ActionResult outside = act(Fixtures.at("study_room"), "cancel");
        assertEquals("返回", outside.getMessage());
        assertEquals(3, outside.getAvailableActions().size());
        assertTrue(outside.getStateChanges().isEmpty());

        ActionResult inCombat = act(atGate(Fixtures.warrior()), "cancel");
        assertEquals(List.of("attack_melee", "attack_magic", "use_item"), actionIds(inCombat));
        assertNotNull(inCombat.getCombatInfo());
    }

    @Test
    @DisplayName("Magic leaves the combat menu when mp is short")
    void combatMenuWithoutMp() {
        ActionResult result = act(atGate(Fixtures.warrior().withMp(2)), "cancel");
        assertEquals(List.of("attack_melee", "use_item"), actionIds(result));
    }

    // === Combat ===

    @Test
    @DisplayName("A hit is followed by the enemy's reply")
    void hitAndReply() {
        rng.d100(30).index(0).d100(50);
        ActionResult result = act(Fixtures.at("lighthouse_gate"), "attack", Map.of("attack_type", "melee"));
        assertTrue(result.isSuccess());
        assertEquals("攻擊命中", result.getMessage());
        assertEquals(new DiceReport(30, 60, CheckOutcome.SUCCESS, Attribute.STRENGTH, 3), result.getDiceResult());
        Map<String, Object> combat = combatDoc(result);
        assertEquals(3, combat.get("enemy_hp"));
        assertEquals(2, combat.get("turn"));
        assertEquals(23, combat.get("player_hp"));
        assertEquals(23, delta(result).get("player_hp"));
        assertEquals(3, result.getCombatInfo().get("enemy_hp"));
        assertEquals(List.of("attack_melee", "attack_magic", "use_item"), actionIds(result));
        assertEquals(0, rng.remaining());
    }

    @Test
    @DisplayName("A miss leaves the enemy untouched")
    void missAndDodge() {
        rng.d100(70).index(0).d100(10);
        ActionResult result = act(atGate(Fixtures.warrior()), "attack");
        assertEquals("攻擊落空", result.getMessage());
        assertEquals(8, combatDoc(result).get("enemy_hp"));
        assertEquals(26, delta(result).get("player_hp"));
    }

    @Test
    @DisplayName("A fumble is reported as a critical failure")
    void fumble() {
        rng.d100(3).index(0).d100(10);
        ActionResult result = act(atGate(Fixtures.warrior()), "attack");
        assertEquals(CheckOutcome.CRITICAL_FAILURE, result.getDiceResult().outcome());
        assertEquals(8, combatDoc(result).get("enemy_hp"));
    }

    @Test
    @DisplayName("Repeated hits defeat the enemy and pay out its rewards")
    void victoryOverTwoTurns() {
        GameState state = atGate(Fixtures.warrior());
        rng.d100(30).index(0).d100(10);
        ActionResult first = act(state, "attack");
        assertEquals(3, combatDoc(first).get("enemy_hp"));
        state = DeltaMerger.apply(state, first.getStateChanges());

        rng.d100(40);
        ActionResult second = act(state, "attack");
        assertTrue(second.isSuccess());
        assertEquals("戰鬥勝利", second.getMessage());
        Map<String, Object> delta = delta(second);
        assertTrue(delta.containsKey("combat"));
        assertNull(delta.get("combat"));
        assertEquals(true, delta.get("combat_victory"));
        assertEquals(65, delta.get("gold"));
        assertEquals(15, delta.get("gold_gained"));
        assertEquals(List.of(Map.of("id", "shadow_essence", "quantity", 1)), delta.get("drops"));
        assertEquals(20, delta.get("exp_gained"));
        assertEquals("lighthouse_interior", delta.get("scene"));
        assertEquals(Map.of("lighthouse_cleared", true), delta.get("flags"));
        assertEquals(List.of("continue"), actionIds(second));
        assertEquals(true, second.getCombatInfo().get("enemy_defeated"));
        assertEquals(0, second.getCombatInfo().get("enemy_hp"));

        GameState after = DeltaMerger.apply(state, second.getStateChanges());
        assertNull(after.getCombat());
        assertEquals("lighthouse_interior", after.getScene());
        assertEquals(65, after.getPlayer().getGold());
        assertEquals("shadow_essence", after.getPlayer().getInventory().get(1).getId());
    }

    @Test
    @DisplayName("A critical hit can end the fight before the enemy acts")
    void criticalOneShot() {
        rng.d100(97);
        ActionResult result = act(atGate(Fixtures.warrior()), "attack");
        assertEquals("戰鬥勝利", result.getMessage());
        assertEquals(CheckOutcome.CRITICAL_SUCCESS, result.getDiceResult().outcome());
        assertEquals(0, rng.remaining());
    }

    @Test
    @DisplayName("Dropping to 0 hp ends the game")
    void defeat() {
        GameState state = atGate(Fixtures.warrior().withHp(2));
        rng.d100(70).index(0).d100(90);
        ActionResult result = act(state, "attack");
        assertFalse(result.isSuccess());
        assertEquals("戰鬥失敗", result.getMessage());
        assertTrue(result.getAvailableActions().isEmpty());
        assertEquals(true, delta(result).get("game_over"));
        assertEquals(0, delta(result).get("player_hp"));
        assertTrue(result.getNarrative().contains("你倒下了。"));

        ActionResult after = act(DeltaMerger.apply(state, result.getStateChanges()), "continue");
        assertFalse(after.isSuccess());
        assertEquals("遊戲結束", after.getMessage());
        assertTrue(after.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("An enemy status effect is reported in the delta")
    void statusEffect() {
        rng.d100(70).index(1).d100(80).d100(20);
        ActionResult result = act(atGate(Fixtures.warrior()), "attack");
        assertEquals("blind", delta(result).get("status_effect"));
        assertEquals(24, delta(result).get("player_hp"));
    }

    @Test
    @DisplayName("Magic costs mp and uses intelligence")
    void magicCostsMp() {
        rng.d100(20).index(0).d100(10);
        ActionResult result = act(atGate(Fixtures.warrior()), "attack", Map.of("attack_type", "magic"));
        assertTrue(result.isSuccess());
        assertEquals(11, delta(result).get("player_mp"));
        assertEquals(Attribute.INTELLIGENCE, result.getDiceResult().attribute());
        assertEquals(40, result.getDiceResult().threshold());
        assertEquals(4, combatDoc(result).get("enemy_hp"));
        assertTrue(result.getNarrative().contains("你消耗了 3 點 MP。"));
    }

    @Test
    @DisplayName("Magic without enough mp is refused before any roll")
    void magicWithoutMp() {
        ActionResult result = act(Fixtures.at("prologue", "lighthouse_gate", Fixtures.warrior().withMp(2)),
            "attack", Map.of("attack_type", "magic"));
        assertFalse(result.isSuccess());
        assertEquals("魔力不足", result.getMessage());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("An enemy override starts a fight outside combat scenes")
    void enemyOverride() {
        rng.d100(30).index(0).d100(90).d100(50);
        ActionResult result = act(Fixtures.at("chapter_one", "market", Fixtures.warrior()), "attack",
            Map.of("enemy_id", "lighthouse_rat"));
        Map<String, Object> combat = combatDoc(result);
        assertEquals("lighthouse_rat", combat.get("enemy_id"));
        assertEquals(1, combat.get("enemy_hp"));
        assertEquals(24, delta(result).get("player_hp"));
        assertFalse(delta(result).containsKey("status_effect"));
    }

    @Test
    @DisplayName("Attacking with nothing to fight fails")
    void nothingToAttack() {
        ActionResult none = act(Fixtures.at("study_room"), "attack");
        assertFalse(none.isSuccess());
        assertEquals("找不到敵人", none.getMessage());
        assertTrue(none.getStateChanges().isEmpty());

        ActionResult unknown = act(Fixtures.at("study_room"), "attack", Map.of("enemy_id", "dragon"));
        assertEquals("找不到敵人", unknown.getMessage());
        assertTrue(unknown.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Regeneration ticks at the start of an attack")
    void regenTicksOnAttack() {
        GameState state = atGate(Fixtures.warrior().withHp(20)).withBuffs(List.of(new Buff(Buff.REGEN_HP, 3, 2)));
        rng.d100(70).index(0).d100(10);
        ActionResult result = act(state, "attack");
        assertEquals(23, delta(result).get("player_hp"));
        assertEquals(List.of(new Buff(Buff.REGEN_HP, 3, 1)), result.getStateChanges().getBuffs());
        assertEquals("持續恢復了 3 點 HP。", result.getNarrative().get(0));
    }

    // === Items ===

    @Test
    @DisplayName("Using an item the player lacks fails without changes")
    void missingItem() {
        ActionResult result = act(Fixtures.at("study_room"), "use_item", Map.of("item_id", "blue_potion"));
        assertFalse(result.isSuccess());
        assertEquals("物品不存在", result.getMessage());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Without an item id the usable items are offered")
    void itemMenu() {
        ActionResult result = act(Fixtures.at("study_room"), "use_item");
        assertEquals(List.of("use_red_potion", "cancel"), actionIds(result));
        ActionDescriptor potion = result.getAvailableActions().get(0);
        assertEquals("紅光藥水 x2", potion.getLabel());
        assertEquals("red_potion", potion.getData().get("item_id"));
        assertEquals(List.of("選擇要使用的物品："), result.getNarrative());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("The combat item menu hides items not usable in combat")
    void combatItemMenu() {
        Player player = holding(Fixtures.warrior(), "panacea", "萬靈藥", ItemType.CONSUMABLE, 1);
        ActionResult result = act(atGate(player), "use_item");
        assertEquals(List.of("cancel"), actionIds(result));
        assertEquals(List.of("你沒有可以使用的物品。"), result.getNarrative());
    }

    @Test
    @DisplayName("Materials cannot be used")
    void notUsable() {
        Player player = holding(Fixtures.warrior(), "shadow_essence", "暗影精華", ItemType.MATERIAL, 1);
        ActionResult result = act(Fixtures.at("prologue", "study_room", player), "use_item",
            Map.of("item_id", "shadow_essence"));
        assertFalse(result.isSuccess());
        assertEquals("無法使用", result.getMessage());
        assertEquals(List.of("暗影精華 無法使用。"), result.getNarrative());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Healing in combat updates hp and the snapshot without an enemy turn")
    void healInCombat() {
        ActionResult result = act(atGate(Fixtures.warrior().withHp(20)), "use_item", Map.of("item_id", "red_potion"));
        assertTrue(result.isSuccess());
        assertEquals("使用了紅光藥水", result.getMessage());
        assertEquals(26, delta(result).get("player_hp"));
        assertEquals(26, combatDoc(result).get("player_hp"));
        assertEquals(1, result.getStateChanges().getInventory().get(0).getQuantity());
        assertEquals(SceneType.COMBAT, result.getSceneType());
        assertEquals(0, rng.remaining());
    }

    @Test
    @DisplayName("A full-hp heal still uses up the item")
    void healAtFullHp() {
        ActionResult result = act(Fixtures.at("study_room"), "use_item", Map.of("item_id", "red_potion"));
        assertTrue(result.isSuccess());
        assertFalse(delta(result).containsKey("player_hp"));
        assertEquals(1, result.getStateChanges().getInventory().get(0).getQuantity());
    }

    @Test
    @DisplayName("A regen potion heals over the following turns")
    void regenOverTime() {
        Player player = holding(Fixtures.warrior().withHp(20), "green_potion", "綠光藥水", ItemType.CONSUMABLE, 1);
        GameState state = Fixtures.at("prologue", "study_room", player);
        ActionResult used = act(state, "use_item", Map.of("item_id", "green_potion"));
        assertEquals(List.of(new Buff(Buff.REGEN_HP, 3, 3)), used.getStateChanges().getBuffs());
        assertTrue(used.getStateChanges().getInventory().isEmpty());
        assertFalse(delta(used).containsKey("player_hp"));

        state = DeltaMerger.apply(state, used.getStateChanges());
        ActionResult next = act(state, "continue");
        assertEquals(23, delta(next).get("player_hp"));
        assertEquals(List.of(new Buff(Buff.REGEN_HP, 3, 2)), next.getStateChanges().getBuffs());
        assertEquals("持續恢復了 3 點 HP。", next.getNarrative().get(0));
    }

    @Test
    @DisplayName("Regen stops at max hp and expires")
    void regenExpires() {
        GameState state = Fixtures.at("prologue", "study_room", Fixtures.warrior().withHp(25))
            .withBuffs(List.of(new Buff(Buff.REGEN_HP, 3, 1)));
        ActionResult result = act(state, "continue");
        assertEquals(26, delta(result).get("player_hp"));
        assertTrue(result.getStateChanges().getBuffs().isEmpty());
        assertTrue(result.getNarrative().contains("持續恢復了 1 點 HP。"));
        assertTrue(result.getNarrative().contains("恢復效果消失了。"));
    }

    // === Rejections ===

    @Test
    @DisplayName("Unknown action types fail without changes")
    void unknownAction() {
        ActionResult result = act(Fixtures.at("study_room"), "dance");
        assertFalse(result.isSuccess());
        assertEquals("未知的行動", result.getMessage());
        assertEquals(List.of("無法執行此行動。"), result.getNarrative());
        assertEquals(3, result.getAvailableActions().size());
        assertTrue(result.getStateChanges().isEmpty());
    }

    @Test
    @DisplayName("Malformed payloads fail without changes")
    void invalidPayload() {
        ActionResult result = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", 42));
        assertFalse(result.isSuccess());
        assertEquals("無效的行動", result.getMessage());
        assertEquals(List.of("行動資料格式錯誤。"), result.getNarrative());
        assertTrue(result.getStateChanges().isEmpty());

        ActionResult badAttack = act(atGate(Fixtures.warrior()), "attack", Map.of("attack_type", "kick"));
        assertEquals("無效的行動", badAttack.getMessage());
        assertEquals(0, rng.remaining());
    }

    @Test
    @DisplayName("Results render to the wire form")
    void wireForm() {
        rng.d100(45);
        Map<String, Object> doc = act(Fixtures.at("study_room"), "choice", Map.of("choice_id", "search_desk"))
            .toDocument();
        assertEquals(true, doc.get("success"));
        assertEquals(Map.of("roll", 45, "threshold", 60, "outcome", "success",
            "attribute", "perception", "attribute_value", 3), doc.get("dice_result"));
        assertTrue(doc.containsKey("state_changes"));
        assertTrue(doc.containsKey("available_actions"));
        assertFalse(doc.containsKey("scene_type"));
    }
}
