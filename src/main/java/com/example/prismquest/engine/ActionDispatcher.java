package com.example.prismquest.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes each action type to its handler.
 */
public class ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    /**
     * A dispatcher with the built-in handlers for every action type.
     */
    public static ActionDispatcher withDefaults() {
        ActionDispatcher dispatcher = new ActionDispatcher();
        dispatcher.register(new SceneActionHandler());
        dispatcher.register(new ChoiceActionHandler());
        dispatcher.register(new CombatActionHandler());
        dispatcher.register(new ItemActionHandler());
        return dispatcher;
    }

    /**
     * Register a handler for every action type it supports.
     */
    public void register(ActionHandler handler) {
        for (ActionType type : ActionType.values()) {
            if (handler.supports(type)) handlers.put(type, handler);
        }
    }

    /**
     * Register a custom handler for one action type. Used for testing or extensions.
     */
    public void registerHandler(ActionType type, ActionHandler handler) {
        handlers.put(type, handler);
    }

    public boolean hasHandler(ActionType type) {
        return type != null && handlers.containsKey(type);
    }

    /**
     * @return the handler's result, or null when no handler is registered for the type
     */
    public ActionResult dispatch(ActionContext ctx, ActionRequest request) {
        ActionHandler handler = handlers.get(request.getType());
        if (handler == null || !handler.supports(request.getType())) {
            return null;
        }
        logger.debug("Dispatching {} to {}", request, handler.getClass().getSimpleName());
        return handler.handle(ctx, request);
    }
}
