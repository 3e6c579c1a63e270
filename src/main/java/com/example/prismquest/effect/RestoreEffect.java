package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

/**
 * Instant hp or mp restore. Never heals past the maximum.
 */
public class RestoreEffect implements ItemEffectHandler {

    @Override
    public void apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        boolean mana = effect.getType() == ItemEffect.Type.HEAL_MP;
        String label = mana ? "MP" : "HP";
        int current = mana ? player.getMp() : player.getHp();
        int max = mana ? player.getMaxMp() : player.getMaxHp();
        int amount = Math.max(0, Math.min(effect.getValue(), max - current));

        if (mana) outcome.setMpChange(amount);
        else outcome.setHpChange(amount);

        if (amount > 0) {
            outcome.addLine("恢復了 " + amount + " 點 " + label + "。");
        } else {
            outcome.addLine(label + " 已經是滿的了。");
        }
    }
}
