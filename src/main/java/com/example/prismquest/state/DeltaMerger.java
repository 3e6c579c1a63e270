package com.example.prismquest.state;

import com.example.prismquest.model.GameState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a {@link StateDelta} to a stored state document, the way a host does
 * before persisting it.
 *
 * Flags are merged, player values are written into the {@code player} section,
 * and keys the delta does not carry are left untouched. Report-only keys
 * (gold gained, drops, experience, status effect, game over) are not persisted.
 */
public final class DeltaMerger {

    private DeltaMerger() {
    }

    public static Map<String, Object> merge(Map<String, Object> document, StateDelta delta) {
        Map<String, Object> out = document != null ? new LinkedHashMap<>(document) : new LinkedHashMap<>();
        if (delta == null) return out;

        if (delta.getScene() != null) out.put("scene", delta.getScene());
        if (delta.getChapter() != null) out.put("chapter", delta.getChapter());

        if (!delta.getFlags().isEmpty()) {
            Map<String, Object> flags = new LinkedHashMap<>();
            Object existing = out.get("flags");
            if (existing instanceof Map<?, ?> m) {
                for (Map.Entry<?, ?> e : m.entrySet()) flags.put(String.valueOf(e.getKey()), e.getValue());
            }
            flags.putAll(delta.getFlags());
            out.put("flags", flags);
        }

        Map<String, Object> player = new LinkedHashMap<>();
        Object existingPlayer = out.get("player");
        if (existingPlayer instanceof Map<?, ?> m) {
            for (Map.Entry<?, ?> e : m.entrySet()) player.put(String.valueOf(e.getKey()), e.getValue());
        }
        boolean playerChanged = false;
        if (delta.getPlayerHp() != null) { player.put("hp", delta.getPlayerHp()); playerChanged = true; }
        if (delta.getPlayerMp() != null) { player.put("mp", delta.getPlayerMp()); playerChanged = true; }
        if (delta.getGold() != null) { player.put("gold", delta.getGold()); playerChanged = true; }
        if (delta.isInventoryChanged()) {
            player.put("inventory", delta.toDocument().get(StateDelta.INVENTORY));
            playerChanged = true;
        }
        if (playerChanged) out.put("player", player);

        if (delta.hasCombatChange()) {
            out.put("combat", delta.isCombatCleared() ? null : delta.getCombat().toDocument());
        }
        if (delta.getBuffs() != null) {
            out.put("buffs", delta.toDocument().get(StateDelta.BUFFS));
        }
        return out;
    }

    /**
     * Typed variant: merge into the state's document form and decode the result.
     */
    public static GameState apply(GameState state, StateDelta delta) {
        return GameStateCodec.fromDocument(merge(GameStateCodec.toDocument(state), delta));
    }
}
