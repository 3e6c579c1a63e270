package com.example.prismquest.engine;

import com.example.prismquest.catalog.CatalogParser;
import com.example.prismquest.combat.AttackType;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.SkillCheckSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated player action.
 *
 * Built from the wire form by {@link #fromDocument}; fields that do not apply to
 * the action type are null. Unknown payload keys are ignored.
 */
public final class ActionRequest {

    private final ActionType type;
    private final String choiceId;
    private final String itemId;
    private final String enemyId;
    private final AttackType attackType;
    private final String nextScene;
    private final String nextChapter;
    private final SkillCheckSpec skillCheck;
    private final Map<String, Object> data;

    private ActionRequest(ActionType type, String choiceId, String itemId, String enemyId,
                          AttackType attackType, String nextScene, String nextChapter,
                          SkillCheckSpec skillCheck, Map<String, Object> data) {
        this.type = type;
        this.choiceId = choiceId;
        this.itemId = itemId;
        this.enemyId = enemyId;
        this.attackType = attackType;
        this.nextScene = nextScene;
        this.nextChapter = nextChapter;
        this.skillCheck = skillCheck;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ActionRequest of(ActionType type) {
        return fromDocument(type, null);
    }

    public static ActionRequest choice(String choiceId) {
        return fromDocument(ActionType.CHOICE, Map.of("choice_id", choiceId));
    }

    public static ActionRequest attack(AttackType attackType) {
        return fromDocument(ActionType.ATTACK, Map.of("attack_type", attackType.key));
    }

    public static ActionRequest useItem(String itemId) {
        return fromDocument(ActionType.USE_ITEM, itemId != null ? Map.of("item_id", itemId) : null);
    }

    /**
     * Validate a payload for the given action type.
     *
     * @throws InvalidActionException if a known field has the wrong type or value
     */
    public static ActionRequest fromDocument(ActionType type, Map<String, Object> data) {
        if (type == null) {
            throw new InvalidActionException("Action type is required");
        }
        Map<String, Object> payload = data != null ? data : Map.of();
        String nextScene = optionalString(payload, "next_scene");
        String nextChapter = optionalString(payload, "next_chapter");

        switch (type) {
            case CHOICE: {
                String choiceId = optionalString(payload, "choice_id");
                return new ActionRequest(type, choiceId, null, null, null, null, null, null, payload);
            }
            case SKILL_CHECK: {
                String attributeKey = optionalString(payload, "attribute");
                if (attributeKey != null && Attribute.fromKey(attributeKey) == null) {
                    throw new InvalidActionException("Unknown attribute '" + attributeKey + "'");
                }
                optionalString(payload, "difficulty");
                requireList(payload, "success_text", "failure_text", "next_actions");
                requireMap(payload, "state_changes", "failure_state_changes");
                SkillCheckSpec check = CatalogParser.parseSkillCheck(payload);
                return new ActionRequest(type, null, null, null, null, nextScene, nextChapter, check, payload);
            }
            case ATTACK: {
                String attackKey = optionalString(payload, "attack_type");
                AttackType attackType = AttackType.MELEE;
                if (attackKey != null) {
                    attackType = AttackType.fromKey(attackKey);
                    if (attackType == null) {
                        throw new InvalidActionException("Unknown attack type '" + attackKey + "'");
                    }
                }
                String enemyId = optionalString(payload, "enemy_id");
                return new ActionRequest(type, null, null, enemyId, attackType, null, null, null, payload);
            }
            case USE_ITEM: {
                String itemId = optionalString(payload, "item_id");
                if (itemId != null && itemId.isBlank()) itemId = null;
                return new ActionRequest(type, null, itemId, null, null, null, null, null, payload);
            }
            case CONTINUE:
                return new ActionRequest(type, null, null, null, null, nextScene, nextChapter, null, payload);
            default:
                return new ActionRequest(type, null, null, null, null, null, null, null, payload);
        }
    }

    private static String optionalString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new InvalidActionException("'" + key + "' must be a string");
        }
        return s.isEmpty() ? null : s;
    }

    private static void requireList(Map<String, Object> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null && !(value instanceof List) && !(value instanceof String)) {
                throw new InvalidActionException("'" + key + "' must be a list");
            }
        }
    }

    private static void requireMap(Map<String, Object> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null && !(value instanceof Map)) {
                throw new InvalidActionException("'" + key + "' must be a map");
            }
        }
    }

    public ActionType getType() { return type; }
    public String getChoiceId() { return choiceId; }
    public String getItemId() { return itemId; }
    public String getEnemyId() { return enemyId; }
    public AttackType getAttackType() { return attackType; }
    public String getNextScene() { return nextScene; }
    public String getNextChapter() { return nextChapter; }
    public SkillCheckSpec getSkillCheck() { return skillCheck; }
    public Map<String, Object> getData() { return data; }

    @Override
    public String toString() {
        return "ActionRequest[" + type.key + " " + data + "]";
    }
}
