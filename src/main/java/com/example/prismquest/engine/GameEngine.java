package com.example.prismquest.engine;

import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.combat.CombatSystem;
import com.example.prismquest.config.EngineConfig;
import com.example.prismquest.inventory.InventoryService;
import com.example.prismquest.model.GameState;
import com.example.prismquest.state.GameStateCodec;
import com.example.prismquest.state.StateDelta;
import com.example.prismquest.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the rules engine: one state plus one action in, one result out.
 *
 * The engine keeps no session. Each call builds an {@link ActionContext} from the
 * supplied state, dispatches the action and returns the context's delta inside the
 * result. No exception escapes {@code process}; every problem becomes a failure
 * result with an empty delta.
 */
public class GameEngine {

    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    private final GameCatalog catalog;
    private final Dice dice;
    private final CombatSystem combatSystem;
    private final InventoryService inventory;
    private final ActionDispatcher dispatcher;

    public GameEngine(GameCatalog catalog) {
        this(catalog, new Dice());
    }

    public GameEngine(GameCatalog catalog, Dice dice) {
        this(catalog, dice, ActionDispatcher.withDefaults());
    }

    public GameEngine(GameCatalog catalog, Dice dice, ActionDispatcher dispatcher) {
        this.catalog = catalog != null ? catalog : GameCatalog.empty();
        this.dice = dice;
        this.combatSystem = new CombatSystem(this.catalog, dice);
        this.inventory = new InventoryService(this.catalog);
        this.dispatcher = dispatcher;
    }

    /**
     * Build an engine from configuration: loads the catalog and seeds the dice.
     *
     * @throws com.example.prismquest.catalog.CatalogException if the catalog cannot be loaded
     */
    public static GameEngine fromConfig(EngineConfig config) {
        logger.info("Starting engine with {}", config);
        return new GameEngine(config.createCatalogLoader().load(), config.createDice());
    }

    public GameCatalog getCatalog() { return catalog; }
    public CombatSystem getCombatSystem() { return combatSystem; }
    public InventoryService getInventory() { return inventory; }
    public ActionDispatcher getDispatcher() { return dispatcher; }

    /**
     * Process an action given in wire form against a stored state document.
     */
    public ActionResult process(Map<String, Object> stateDocument, String actionType, Map<String, Object> actionData) {
        GameState state;
        try {
            state = GameStateCodec.fromDocument(stateDocument);
        } catch (RuntimeException e) {
            logger.error("Failed to decode state document for {}", actionType, e);
            return internalError();
        }
        return process(state, actionType, actionData);
    }

    /**
     * Process an action given in wire form. Unknown action types and malformed
     * payloads produce failure results.
     */
    public ActionResult process(GameState state, String actionType, Map<String, Object> actionData) {
        ActionType type = ActionType.fromKey(actionType);
        if (type == null) {
            logger.debug("Unknown action type '{}'", actionType);
            return unknownAction(newContext(state));
        }
        ActionRequest request;
        try {
            request = ActionRequest.fromDocument(type, actionData);
        } catch (InvalidActionException e) {
            logger.warn("Rejected {} payload: {}", type.key, e.getMessage());
            return invalidAction(newContext(state));
        }
        return process(state, request);
    }

    public ActionResult process(GameState state, ActionRequest request) {
        ActionContext ctx = newContext(state);
        if (ctx.getPlayer().isDefeated()) {
            return gameOver();
        }
        ActionResult result;
        try {
            result = dispatcher.dispatch(ctx, request);
        } catch (InvalidActionException e) {
            logger.warn("Rejected {}: {}", request, e.getMessage());
            return invalidAction(newContext(state));
        } catch (RuntimeException e) {
            logger.error("Failed to process {} in {}/{}", request, state.getChapter(), state.getScene(), e);
            return internalError().actions(newContext(state).currentActions());
        }
        if (result == null) {
            return unknownAction(ctx);
        }
        StateDelta delta = ctx.getDelta();
        if (ctx.getPlayer().isDefeated() && delta.getGameOver() == null) {
            // authored damage can also end the game
            delta.gameOver(true);
            ActionResult over = ActionResult.failure("遊戲結束").narrative(result.getNarrative()).line("你倒下了。");
            return over.stateChanges(delta);
        }
        if (Boolean.TRUE.equals(delta.getGameOver())) {
            result.actions(List.of());
        }
        result.stateChanges(delta);
        logger.debug("{} -> {}", request, result);
        return result;
    }

    private ActionContext newContext(GameState state) {
        return new ActionContext(state, catalog, dice, combatSystem, inventory);
    }

    private static ActionResult unknownAction(ActionContext ctx) {
        return ActionResult.failure("未知的行動")
            .line("無法執行此行動。")
            .actions(ctx.currentActions());
    }

    private static ActionResult invalidAction(ActionContext ctx) {
        return ActionResult.failure("無效的行動")
            .line("行動資料格式錯誤。")
            .actions(ctx.currentActions());
    }

    private static ActionResult internalError() {
        return ActionResult.failure("發生錯誤").line("系統發生錯誤，請稍後再試。");
    }

    private static ActionResult gameOver() {
        return ActionResult.failure("遊戲結束").line("你已經倒下了，無法再行動。");
    }
}
