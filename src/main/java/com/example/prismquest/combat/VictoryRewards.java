package com.example.prismquest.combat;

import com.example.prismquest.model.EnemyDefinition;

import java.util.List;

/**
 * Loot for defeating an enemy: coins, item drops and experience.
 */
public record VictoryRewards(int gold, List<EnemyDefinition.Drop> items, int exp) {

    public VictoryRewards {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static VictoryRewards none() {
        return new VictoryRewards(0, List.of(), 0);
    }

    public boolean isEmpty() {
        return gold == 0 && items.isEmpty() && exp == 0;
    }
}
