package com.example.prismquest.catalog;

import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.Choice;
import com.example.prismquest.model.Difficulty;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.ItemDefinition;
import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.ItemType;
import com.example.prismquest.model.Scene;
import com.example.prismquest.model.SceneType;
import com.example.prismquest.model.SkillCheckSpec;
import com.example.prismquest.model.StateChangeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.prismquest.util.Documents.asMap;
import static com.example.prismquest.util.Documents.getBoolean;
import static com.example.prismquest.util.Documents.getDouble;
import static com.example.prismquest.util.Documents.getInt;
import static com.example.prismquest.util.Documents.getMap;
import static com.example.prismquest.util.Documents.getMapList;
import static com.example.prismquest.util.Documents.getString;
import static com.example.prismquest.util.Documents.getStringList;

/**
 * Converts parsed catalog documents (maps from YAML or JSON) into model objects.
 *
 * Parsing is lenient about individual fields (missing values take defaults) but
 * rejects documents whose top-level shape is wrong.
 */
public final class CatalogParser {

    private static final Logger logger = LoggerFactory.getLogger(CatalogParser.class);

    /** Action keys that are not part of the payload. */
    private static final Set<String> ACTION_META_KEYS = Set.of("id", "type", "label", "text", "data");

    private CatalogParser() {
    }

    // ========== Items ==========

    /**
     * Parse an item document. Accepts either the categorized form
     * ({@code category -> id -> item}) or a flat {@code items:} list with ids.
     */
    public static Map<String, ItemDefinition> parseItems(Map<String, Object> root) {
        Map<String, ItemDefinition> out = new LinkedHashMap<>();
        if (root == null) return out;
        if (root.get("items") instanceof List) {
            for (Map<String, Object> item : getMapList(root, "items")) {
                String id = getString(item, "id", null);
                if (id == null) {
                    logger.warn("Skipping item without id: {}", item);
                    continue;
                }
                out.put(id, parseItem(id, item));
            }
            return out;
        }
        for (Map.Entry<String, Object> category : root.entrySet()) {
            Map<String, Object> entries = asMap(category.getValue());
            if (entries == null) continue;
            for (Map.Entry<String, Object> e : entries.entrySet()) {
                Map<String, Object> item = asMap(e.getValue());
                if (item == null) continue;
                out.put(e.getKey(), parseItem(e.getKey(), item));
            }
        }
        return out;
    }

    public static ItemDefinition parseItem(String id, Map<String, Object> item) {
        ItemType type = ItemType.fromKey(getString(item, "type", null));
        ItemEffect effect = parseEffect(getMap(item, "effect"));
        return new ItemDefinition(
            id,
            getString(item, "name", id),
            getString(item, "description", ""),
            type,
            getDouble(item, "weight", 0.0),
            getInt(item, "damage", ItemDefinition.DEFAULT_WEAPON_DAMAGE),
            Attribute.fromKey(getString(item, "attribute", null), Attribute.STRENGTH),
            getBoolean(item, "is_light", getBoolean(item, "light", false)),
            effect,
            getBoolean(item, "usable_in_combat", false));
    }

    public static ItemEffect parseEffect(Map<String, Object> effect) {
        if (effect == null) return null;
        ItemEffect.Type type = ItemEffect.Type.fromKey(getString(effect, "type", null));
        if (type == null) {
            logger.warn("Unknown item effect type '{}'", getString(effect, "type", ""));
            return null;
        }
        return new ItemEffect(
            type,
            getInt(effect, "value", 0),
            getInt(effect, "duration", ItemEffect.DEFAULT_REGEN_DURATION),
            getString(effect, "status", null),
            getString(effect, "buff_id", null));
    }

    // ========== Enemies ==========

    /**
     * Parse an enemy document: {@code id -> enemy}, optionally wrapped in {@code enemies:}.
     */
    public static Map<String, EnemyDefinition> parseEnemies(Map<String, Object> root) {
        Map<String, EnemyDefinition> out = new LinkedHashMap<>();
        if (root == null) return out;
        Map<String, Object> entries = root.containsKey("enemies") ? getMap(root, "enemies") : root;
        if (entries == null) {
            throw new CatalogException("'enemies' must be a map of enemy id to definition");
        }
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            Map<String, Object> enemy = asMap(e.getValue());
            if (enemy == null) continue;
            out.put(e.getKey(), parseEnemy(e.getKey(), enemy));
        }
        return out;
    }

    public static EnemyDefinition parseEnemy(String id, Map<String, Object> enemy) {
        int hp = getInt(enemy, "hp", 1);
        List<EnemyDefinition.Attack> attacks = new ArrayList<>();
        for (Map<String, Object> a : getMapList(enemy, "attacks")) {
            attacks.add(new EnemyDefinition.Attack(
                getString(a, "description", null),
                getInt(a, "damage", 4),
                getString(a, "effect", null),
                getInt(a, "effect_chance", 0)));
        }
        return new EnemyDefinition(
            id,
            getString(enemy, "name", id),
            hp,
            getInt(enemy, "max_hp", hp),
            getInt(enemy, "evasion", 0),
            getInt(enemy, "armor", 0),
            getString(enemy, "weakness", null),
            getInt(enemy, "weakness_bonus", EnemyDefinition.DEFAULT_WEAKNESS_BONUS),
            attacks,
            parseDrops(enemy.get("drops")),
            getInt(enemy, "exp", EnemyDefinition.DEFAULT_EXP),
            getString(enemy, "description", ""));
    }

    /**
     * Parse a drop/item list. A single map is accepted as a one-entry list.
     */
    public static List<EnemyDefinition.Drop> parseDrops(Object raw) {
        List<EnemyDefinition.Drop> out = new ArrayList<>();
        List<Object> entries = new ArrayList<>();
        if (raw instanceof List<?> list) entries.addAll(list);
        else if (raw != null) entries.add(raw);
        for (Object o : entries) {
            Map<String, Object> d = asMap(o);
            if (d == null) continue;
            String id = getString(d, "id", null);
            if (id == null) continue;
            out.add(new EnemyDefinition.Drop(id, getInt(d, "quantity", 1)));
        }
        return out;
    }

    // ========== Scenes ==========

    /**
     * Parse a chapter document: {@code scenes: id -> scene}.
     */
    public static Map<String, Scene> parseScenes(Map<String, Object> chapterDoc) {
        Map<String, Scene> out = new LinkedHashMap<>();
        if (chapterDoc == null) return out;
        Map<String, Object> scenes = getMap(chapterDoc, "scenes");
        if (scenes == null) {
            throw new CatalogException("Chapter document has no 'scenes' map");
        }
        for (Map.Entry<String, Object> e : scenes.entrySet()) {
            Map<String, Object> scene = asMap(e.getValue());
            if (scene == null) continue;
            out.put(e.getKey(), parseScene(e.getKey(), scene));
        }
        return out;
    }

    public static Scene parseScene(String id, Map<String, Object> scene) {
        Map<String, Choice> choices = new LinkedHashMap<>();
        Map<String, Object> choiceDocs = getMap(scene, "choices");
        if (choiceDocs != null) {
            for (Map.Entry<String, Object> e : choiceDocs.entrySet()) {
                Map<String, Object> c = asMap(e.getValue());
                if (c != null) choices.put(e.getKey(), parseChoice(e.getKey(), c));
            }
        }
        Scene.CombatInfo combatInfo = null;
        Map<String, Object> ci = getMap(scene, "combat_info");
        if (ci != null) {
            combatInfo = new Scene.CombatInfo(getString(ci, "enemy_id", null), getString(ci, "description", null));
        }
        return new Scene(
            id,
            SceneType.fromKey(getString(scene, "type", null)),
            getStringList(scene, "narrative"),
            getStringList(scene, "resume_narrative"),
            parseActions(scene.get("actions")),
            choices,
            combatInfo,
            parseStateChanges(getMap(scene, "on_enter_state_changes")),
            getString(scene, "post_combat_scene", null));
    }

    public static Choice parseChoice(String id, Map<String, Object> choice) {
        SkillCheckSpec check = null;
        if (getMap(choice, "skill_check") != null) {
            Map<String, Object> merged = new LinkedHashMap<>(choice);
            merged.putAll(getMap(choice, "skill_check"));
            check = parseSkillCheck(merged);
        }
        return new Choice(
            id,
            getStringList(choice, "narrative"),
            check,
            parseStateChanges(getMap(choice, "state_changes")),
            getString(choice, "next_scene", null),
            getString(choice, "next_chapter", null),
            parseActionsOrNull(choice.get("next_actions")));
    }

    /**
     * Parse a skill check with its outcome branches. Shared by nested choice checks
     * and {@code skill_check} action payloads, which use the same field names.
     */
    public static SkillCheckSpec parseSkillCheck(Map<String, Object> doc) {
        return new SkillCheckSpec(
            Attribute.fromKey(getString(doc, "attribute", null), Attribute.PERCEPTION),
            Difficulty.fromKey(getString(doc, "difficulty", null)),
            getStringList(doc, "success_text"),
            getStringList(doc, "failure_text"),
            parseStateChanges(getMap(doc, "state_changes")),
            parseStateChanges(getMap(doc, "failure_state_changes")),
            getString(doc, "next_scene", null),
            getString(doc, "next_chapter", null),
            parseActionsOrNull(doc.get("next_actions")));
    }

    /**
     * Parse authored state changes. Recognized keys: {@code flags}, {@code damage},
     * {@code heal}, {@code gold_gained} (or {@code gold}), {@code add_item} / {@code items}.
     */
    public static StateChangeSpec parseStateChanges(Map<String, Object> doc) {
        if (doc == null || doc.isEmpty()) return StateChangeSpec.none();
        Map<String, Object> flags = getMap(doc, "flags");
        List<EnemyDefinition.Drop> items = parseDrops(doc.containsKey("add_item") ? doc.get("add_item") : doc.get("items"));
        int gold = getInt(doc, "gold_gained", getInt(doc, "gold", 0));
        return new StateChangeSpec(flags, getInt(doc, "damage", 0), getInt(doc, "heal", 0), gold, items);
    }

    // ========== Actions ==========

    public static List<ActionDescriptor> parseActions(Object raw) {
        List<ActionDescriptor> out = new ArrayList<>();
        if (!(raw instanceof List<?> list)) return out;
        int index = 0;
        for (Object o : list) {
            index++;
            Map<String, Object> a = asMap(o);
            if (a == null) continue;
            Map<String, Object> data = new LinkedHashMap<>();
            Map<String, Object> nested = getMap(a, "data");
            if (nested != null) data.putAll(nested);
            for (Map.Entry<String, Object> e : a.entrySet()) {
                if (!ACTION_META_KEYS.contains(e.getKey())) data.put(e.getKey(), e.getValue());
            }
            out.add(new ActionDescriptor(
                getString(a, "id", "action_" + index),
                getString(a, "type", "continue"),
                getString(a, "label", getString(a, "text", "")),
                data));
        }
        return out;
    }

    private static List<ActionDescriptor> parseActionsOrNull(Object raw) {
        return raw instanceof List ? parseActions(raw) : null;
    }
}
