package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;

/**
 * Resolves one kind of item effect against the player who used the item.
 */
public interface ItemEffectHandler {

    /**
     * Apply the effect. Handlers never change the player; they record what the
     * effect does in {@code outcome} and the caller turns that into state changes.
     *
     * @param effect the item's effect with its parameters
     * @param player the player using the item
     * @param outcome accumulator for narrative and hp/mp/status changes
     */
    void apply(ItemEffect effect, Player player, EffectOutcome outcome);
}
