package com.example.prismquest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State changes authored in the catalog (a choice outcome, a check branch or a
 * scene's on-enter block). They are relative: the engine applies them to the
 * current player to produce the absolute values it reports in its delta.
 */
public final class StateChangeSpec {

    private static final StateChangeSpec NONE = new StateChangeSpec(null, 0, 0, 0, null);

    private final Map<String, Object> flags;
    private final int damage;
    private final int heal;
    private final int goldGained;
    private final List<EnemyDefinition.Drop> items;

    public StateChangeSpec(Map<String, Object> flags, int damage, int heal, int goldGained,
                           List<EnemyDefinition.Drop> items) {
        this.flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
        this.damage = Math.max(0, damage);
        this.heal = Math.max(0, heal);
        this.goldGained = goldGained;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static StateChangeSpec none() {
        return NONE;
    }

    public static StateChangeSpec flags(Map<String, Object> flags) {
        return new StateChangeSpec(flags, 0, 0, 0, null);
    }

    public Map<String, Object> getFlags() { return flags; }
    public int getDamage() { return damage; }
    public int getHeal() { return heal; }
    public int getGoldGained() { return goldGained; }
    public List<EnemyDefinition.Drop> getItems() { return items; }

    public boolean isEmpty() {
        return flags.isEmpty() && damage == 0 && heal == 0 && goldGained == 0 && items.isEmpty();
    }
}
