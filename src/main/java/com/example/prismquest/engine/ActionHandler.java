package com.example.prismquest.engine;

/**
 * Handles one or more related action types.
 */
public interface ActionHandler {

    /**
     * Resolve the action. Rejections must return before changing the context, so a
     * failed lookup leaves the delta empty.
     *
     * @param ctx working view of the state; all changes go through it
     * @param request the validated action
     * @return the result; the engine attaches the context's delta
     */
    ActionResult handle(ActionContext ctx, ActionRequest request);

    /**
     * Check if this handler can process the given action type.
     */
    boolean supports(ActionType type);
}
