package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

import java.util.Map;

/**
 * Removes one status (cure_status) or all of them (cure_all_status).
 * Statuses are reported by id only; the engine keeps no status list.
 */
public class CureStatusEffect implements ItemEffectHandler {

    public static final String ALL = "all";

    private static final Map<String, String> STATUS_NAMES = Map.of(
        "poison", "中毒",
        "blind", "致盲",
        "fear", "恐懼");

    public static String statusName(String status) {
        return STATUS_NAMES.getOrDefault(status, status);
    }

    @Override
    public void apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        if (effect.getType() == ItemEffect.Type.CURE_ALL_STATUS) {
            outcome.setStatusCured(ALL);
            outcome.addLine("解除了所有異常狀態。");
            return;
        }
        String status = effect.getStatus();
        outcome.setStatusCured(status);
        outcome.addLine("解除了" + statusName(status) + "狀態。");
    }
}
