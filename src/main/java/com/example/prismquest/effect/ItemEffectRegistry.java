package com.example.prismquest.effect;

import com.example.prismquest.model.ItemEffect;
import com.example.prismquest.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of item effect handlers keyed by effect type. Each inventory service
 * owns its own instance.
 */
public class ItemEffectRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ItemEffectRegistry.class);

    private final Map<ItemEffect.Type, ItemEffectHandler> handlers = new EnumMap<>(ItemEffect.Type.class);

    /**
     * A registry with the built-in handler for every effect type.
     */
    public static ItemEffectRegistry withDefaults() {
        ItemEffectRegistry registry = new ItemEffectRegistry();
        RestoreEffect restore = new RestoreEffect();
        registry.registerHandler(ItemEffect.Type.HEAL_HP, restore);
        registry.registerHandler(ItemEffect.Type.HEAL_MP, restore);
        registry.registerHandler(ItemEffect.Type.REGEN_HP, new RegenerationEffect());
        CureStatusEffect cure = new CureStatusEffect();
        registry.registerHandler(ItemEffect.Type.CURE_STATUS, cure);
        registry.registerHandler(ItemEffect.Type.CURE_ALL_STATUS, cure);
        registry.registerHandler(ItemEffect.Type.BUFF, new BuffEffect());
        registry.registerHandler(ItemEffect.Type.DAMAGE_AOE, new AreaDamageEffect());
        return registry;
    }

    public void registerHandler(ItemEffect.Type type, ItemEffectHandler handler) {
        if (type != null && handler != null) handlers.put(type, handler);
    }

    public ItemEffectHandler getHandler(ItemEffect.Type type) {
        if (type == null) return null;
        return handlers.get(type);
    }

    /**
     * Apply an effect through its registered handler.
     *
     * @return false when the effect is null or has no handler
     */
    public boolean apply(ItemEffect effect, Player player, EffectOutcome outcome) {
        if (effect == null) return false;
        ItemEffectHandler handler = handlers.get(effect.getType());
        if (handler == null) {
            logger.warn("No handler registered for item effect {}", effect.getType());
            return false;
        }
        handler.apply(effect, player, outcome);
        return true;
    }
}
