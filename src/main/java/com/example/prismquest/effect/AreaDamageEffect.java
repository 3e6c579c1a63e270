package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

/**
 * Area damage. Reported only; there is a single enemy per encounter and the
 * value is not applied to its hp.
 */
public class AreaDamageEffect implements ItemEffectHandler {

    @Override
    public void apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        outcome.setAreaDamage(effect.getValue());
        outcome.addLine("對所有敵人造成 " + effect.getValue() + " 點傷害！");
    }
}
