package com.example.prismquest.state;

import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.Background;
import com.example.prismquest.model.Buff;
import com.example.prismquest.model.Equipment;
import com.example.prismquest.model.EquipmentSlot;
import com.example.prismquest.model.GameState;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.ItemType;
import com.example.prismquest.model.Player;
import com.example.prismquest.model.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.prismquest.util.Documents.asMap;
import static com.example.prismquest.util.Documents.getInt;
import static com.example.prismquest.util.Documents.getMap;
import static com.example.prismquest.util.Documents.getMapList;
import static com.example.prismquest.util.Documents.getString;
import static com.example.prismquest.util.Documents.getStringList;

/**
 * Converts between the stored state document and {@link GameState}.
 *
 * Reading is lenient: missing values take the character-creation defaults and
 * broken inventory entries are dropped with a warning.
 */
public final class GameStateCodec {

    private static final Logger logger = LoggerFactory.getLogger(GameStateCodec.class);

    private GameStateCodec() {
    }

    public static GameState fromDocument(Map<String, Object> doc) {
        if (doc == null) {
            return new GameState(null, null, readPlayer(null), null, null, null);
        }
        List<Buff> buffs = new ArrayList<>();
        for (Map<String, Object> b : getMapList(doc, "buffs")) {
            String id = getString(b, "id", null);
            if (id == null) continue;
            buffs.add(new Buff(id, getInt(b, "value", 0), getInt(b, "remaining", 0)));
        }
        return new GameState(
            getString(doc, "chapter", GameState.FIRST_CHAPTER),
            getString(doc, "scene", ""),
            readPlayer(getMap(doc, "player")),
            getMap(doc, "flags"),
            CombatSnapshot.fromDocument(getMap(doc, "combat")),
            buffs);
    }

    public static Map<String, Object> toDocument(GameState state) {
        return state.toDocument();
    }

    /**
     * The player a document without a {@code player} section decodes to.
     */
    public static Player defaultPlayer() {
        return readPlayer(null);
    }

    static Player readPlayer(Map<String, Object> doc) {
        Map<String, Object> statsDoc = getMap(doc, "stats");
        Stats stats = new Stats(
            getInt(statsDoc, Attribute.STRENGTH.key, Stats.DEFAULT_VALUE),
            getInt(statsDoc, Attribute.DEXTERITY.key, getInt(statsDoc, "agility", Stats.DEFAULT_VALUE)),
            getInt(statsDoc, Attribute.INTELLIGENCE.key, Stats.DEFAULT_VALUE),
            getInt(statsDoc, Attribute.PERCEPTION.key, Stats.DEFAULT_VALUE));
        int maxHp = getInt(doc, "max_hp", Player.BASE_HP + stats.getStrength() * Player.HP_PER_STRENGTH);
        int maxMp = getInt(doc, "max_mp", Player.BASE_MP + stats.getIntelligence() * Player.MP_PER_INTELLIGENCE);

        // one stack per id; repeated ids are folded into the first
        Map<String, InventoryStack> stacks = new LinkedHashMap<>();
        for (Map<String, Object> item : getMapList(doc, "inventory")) {
            String id = getString(item, "id", null);
            int quantity = getInt(item, "quantity", 1);
            if (id == null || id.isBlank() || quantity < 1) {
                logger.warn("Dropping invalid inventory entry {}", item);
                continue;
            }
            InventoryStack existing = stacks.get(id);
            if (existing != null) {
                logger.warn("Merging duplicate inventory entry for '{}'", id);
                stacks.put(id, existing.withQuantity(existing.getQuantity() + quantity));
            } else {
                stacks.put(id, new InventoryStack(id, getString(item, "name", id),
                    ItemType.fromKey(getString(item, "type", null)), quantity));
            }
        }
        List<InventoryStack> inventory = new ArrayList<>(stacks.values());

        EnumMap<EquipmentSlot, String> slots = new EnumMap<>(EquipmentSlot.class);
        Map<String, Object> equipment = getMap(doc, "equipment");
        if (equipment != null) {
            for (Map.Entry<String, Object> e : equipment.entrySet()) {
                EquipmentSlot slot = EquipmentSlot.fromKey(e.getKey());
                if (slot != null && e.getValue() != null) slots.put(slot, e.getValue().toString());
            }
        }

        List<String> recipes = getStringList(doc, "recipes");
        Map<String, Object> choices = asMap(doc != null ? doc.get("choices") : null);
        return new Player(
            getString(doc, "name", ""),
            Background.fromKey(getString(doc, "background", null)),
            stats,
            getInt(doc, "hp", maxHp), maxHp,
            getInt(doc, "mp", maxMp), maxMp,
            getInt(doc, "gold", 0),
            inventory,
            new Equipment(slots),
            recipes,
            choices);
    }
}
