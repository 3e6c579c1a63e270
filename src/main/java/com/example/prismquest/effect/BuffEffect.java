package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

import java.util.Map;

public class BuffEffect implements ItemEffectHandler {

    private static final Map<String, String> BUFF_NAMES = Map.of(
        "fire_resist", "火焰抗性",
        "ice_resist", "冰霜抗性");

    @Override
    public void apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        String buffId = effect.getBuffId();
        outcome.setBuffApplied(buffId);
        outcome.addLine("獲得了" + BUFF_NAMES.getOrDefault(buffId, buffId) + "效果。");
    }
}
