package com.example.prismquest.effect;

import com.example.prismquest.model.Buff;
import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

/**
 * Starts an hp regeneration buff. The heal itself happens later, one tick per
 * attack or continue action.
 */
public class RegenerationEffect implements ItemEffectHandler {

    @Override
    public void apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        int duration = effect.getDuration() > 0 ? effect.getDuration() : ItemEffect.DEFAULT_REGEN_DURATION;
        int value = effect.getValue();
        outcome.setRegen(new Buff(Buff.REGEN_HP, value, duration));
        outcome.setBuffApplied(Buff.REGEN_HP);
        outcome.addLine("接下來 " + duration + " 回合，每回合恢復 " + value + " HP。");
    }
}
