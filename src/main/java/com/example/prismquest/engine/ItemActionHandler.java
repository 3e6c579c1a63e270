package com.example.prismquest.engine;

import com.example.prismquest.inventory.InventoryService;
import com.example.prismquest.inventory.RemoveResult;
import com.example.prismquest.inventory.UseItemResult;
import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.InventoryStack;
import com.example.prismquest.model.Player;
import com.example.prismquest.model.SceneType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Item use. Without an item id the player gets a selection menu; with one, the
 * item's effect is applied and one unit is consumed. Using an item in combat does
 * not give the enemy a turn.
 */
public class ItemActionHandler implements ActionHandler {

    @Override
    public boolean supports(ActionType type) {
        return type == ActionType.USE_ITEM;
    }

    @Override
    public ActionResult handle(ActionContext ctx, ActionRequest request) {
        if (request.getItemId() == null) {
            return selectionMenu(ctx);
        }
        return useItem(ctx, request.getItemId());
    }

    private ActionResult selectionMenu(ActionContext ctx) {
        boolean inCombat = ctx.isInCombat();
        List<InventoryStack> usable = ctx.getInventory().usableItems(ctx.getPlayer().getInventory(), inCombat);
        List<ActionDescriptor> actions = new ArrayList<>();
        for (InventoryStack stack : usable) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("item_id", stack.getId());
            actions.add(new ActionDescriptor("use_" + stack.getId(), ActionType.USE_ITEM.key,
                stack.getName() + " x" + stack.getQuantity(), data));
        }
        actions.add(ActionDescriptor.of("cancel", ActionType.CANCEL.key, "取消"));
        return withCombat(ctx, ActionResult.success("選擇物品")
            .line(usable.isEmpty() ? "你沒有可以使用的物品。" : "選擇要使用的物品：")
            .actions(actions));
    }

    private ActionResult useItem(ActionContext ctx, String itemId) {
        InventoryService inventory = ctx.getInventory();
        Player player = ctx.getPlayer();
        if (!inventory.hasItem(player.getInventory(), itemId)) {
            return withCombat(ctx, ActionResult.failure(UseItemResult.NOT_FOUND)
                .line("你沒有這個物品。")
                .actions(ctx.currentActions()));
        }

        UseItemResult used = inventory.useItem(itemId, player, ctx.isInCombat());
        if (!used.isSuccess()) {
            return withCombat(ctx, ActionResult.failure(used.getMessage())
                .narrative(used.getNarrative())
                .actions(ctx.currentActions()));
        }

        if (used.getHpChange() != 0) ctx.setHp(player.getHp() + used.getHpChange());
        if (used.getMpChange() != 0) ctx.setMp(player.getMp() + used.getMpChange());
        if (used.getRegen() != null) ctx.addBuff(used.getRegen());
        if (used.isItemConsumed()) {
            RemoveResult removed = inventory.removeItem(ctx.getPlayer().getInventory(), itemId, 1);
            if (removed.removed()) ctx.setInventory(removed.inventory());
        }

        return withCombat(ctx, ActionResult.success(used.getMessage())
            .narrative(used.getNarrative())
            .actions(ctx.currentActions()));
    }

    private static ActionResult withCombat(ActionContext ctx, ActionResult result) {
        if (ctx.isInCombat()) {
            result.sceneType(SceneType.COMBAT).combatInfo(ctx.combatInfo());
        }
        return result;
    }
}
