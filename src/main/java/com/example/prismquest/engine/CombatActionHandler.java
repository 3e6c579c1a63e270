package com.example.prismquest.engine;

import com.example.prismquest.combat.AttackType;
import com.example.prismquest.combat.CombatResult;
import com.example.prismquest.combat.CombatSnapshot;
import com.example.prismquest.combat.CombatSystem;
import com.example.prismquest.combat.VictoryRewards;
import com.example.prismquest.inventory.WeaponProfile;
import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.Scene;
import com.example.prismquest.model.SceneType;
import com.example.prismquest.util.CheckOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One combat exchange per {@code attack} action: the player's attack and, if the
 * enemy is still standing, the enemy's reply.
 */
public class CombatActionHandler implements ActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CombatActionHandler.class);

    @Override
    public boolean supports(ActionType type) {
        return type == ActionType.ATTACK;
    }

    @Override
    public ActionResult handle(ActionContext ctx, ActionRequest request) {
        CombatSystem combatSystem = ctx.getCombatSystem();
        CombatSnapshot snapshot = resolveSnapshot(ctx, request.getEnemyId());
        if (snapshot == null) {
            return ActionResult.failure("找不到敵人")
                .line("這裡沒有可以攻擊的對象。")
                .actions(ctx.currentActions());
        }

        AttackType attackType = request.getAttackType() != null ? request.getAttackType() : AttackType.MELEE;
        if (attackType == AttackType.MAGIC && !ctx.canCastMagic()) {
            return ActionResult.failure("魔力不足")
                .line("你的魔力不足以施展魔法。")
                .actions(ctx.currentActions())
                .combatInfo(ctx.combatInfo());
        }

        if (snapshot != ctx.getCombat()) ctx.setCombat(snapshot);

        List<String> narrative = new ArrayList<>();
        ctx.tickRegen(narrative);
        if (attackType == AttackType.MAGIC) {
            ctx.setMp(ctx.getPlayer().getMp() - ActionContext.MAGIC_MP_COST);
            narrative.add("你消耗了 " + ActionContext.MAGIC_MP_COST + " 點 MP。");
        }

        WeaponProfile weapon = ctx.getInventory().equippedWeapon(ctx.getPlayer());
        CombatResult attack = combatSystem.playerAttack(snapshot, ctx.getPlayer(), attackType,
            weapon.damage(), weapon.light());
        narrative.addAll(attack.getNarrative());
        DiceReport report = new DiceReport(attack.getRoll(), attack.getThreshold(), outcomeOf(attack),
            attackType.attribute, ctx.getPlayer().getAttribute(attackType.attribute));

        if (snapshot.isEnemyDefeated()) {
            return victory(ctx, snapshot, narrative).diceResult(report);
        }

        narrative.add("");
        CombatResult reply = combatSystem.enemyAttack(snapshot, ctx.getPlayer());
        narrative.addAll(reply.getNarrative());
        if (reply.getEffect() != null) {
            ctx.getDelta().statusEffect(reply.getEffect());
        }
        snapshot.nextTurn();
        ctx.setHp(snapshot.getPlayerHp());

        if (ctx.getPlayer().isDefeated()) {
            logger.debug("Player {} defeated by {}", ctx.getPlayer().getName(), snapshot.getEnemyId());
            ctx.getDelta().gameOver(true);
            narrative.add("");
            narrative.add("你的意識逐漸模糊……");
            narrative.add("你倒下了。");
            return ActionResult.failure("戰鬥失敗")
                .narrative(narrative)
                .diceResult(report)
                .sceneType(SceneType.COMBAT)
                .combatInfo(ctx.combatInfo());
        }

        return ActionResult.success(attack.isHit() ? "攻擊命中" : "攻擊落空")
            .narrative(narrative)
            .actions(ctx.combatActions())
            .diceResult(report)
            .sceneType(SceneType.COMBAT)
            .combatInfo(ctx.combatInfo());
    }

    /**
     * The snapshot to fight with: the stored one when it matches the requested
     * enemy, otherwise a new encounter. Returns null when there is no enemy to fight.
     * A new snapshot is not recorded yet, so a later rejection leaves no trace.
     */
    private CombatSnapshot resolveSnapshot(ActionContext ctx, String requestedEnemy) {
        CombatSnapshot current = ctx.getCombat();
        if (current != null && current.isActive()
                && (requestedEnemy == null || requestedEnemy.equals(current.getEnemyId()))) {
            return current;
        }
        String enemyId = requestedEnemy;
        if (enemyId == null) {
            Scene.CombatInfo info = ctx.getScene().getCombatInfo();
            enemyId = info != null ? info.enemyId() : null;
        }
        if (enemyId == null) return null;
        Optional<CombatSnapshot> created = ctx.getCombatSystem().init(enemyId, ctx.getPlayer());
        return created.orElse(null);
    }

    private ActionResult victory(ActionContext ctx, CombatSnapshot snapshot, List<String> narrative) {
        Map<String, Object> finalInfo = ctx.combatInfo(snapshot);
        finalInfo.put("enemy_defeated", true);

        VictoryRewards rewards = ctx.getCombatSystem().victoryRewards(snapshot.getEnemyId());
        ctx.clearCombat();
        ctx.getDelta().combatVictory(true);

        narrative.add("");
        narrative.add("戰鬥勝利！");
        if (rewards.gold() > 0) {
            ctx.addGold(rewards.gold());
            narrative.add("獲得 " + rewards.gold() + " 枚金幣。");
        }
        for (EnemyDefinition.Drop drop : rewards.items()) {
            ctx.addItem(drop.id(), drop.quantity());
            ctx.getDelta().addDrop(drop);
            narrative.add("獲得 " + ctx.getInventory().getItemName(drop.id()) + " x" + drop.quantity() + "。");
        }
        if (rewards.exp() > 0) {
            ctx.getDelta().expGained(rewards.exp());
            narrative.add("獲得 " + rewards.exp() + " 點經驗。");
        }
        logger.debug("Victory over {}: {}", snapshot.getEnemyId(), rewards);

        String postCombat = ctx.getScene().getPostCombatScene();
        if (postCombat != null) {
            ctx.switchScene(postCombat, null);
        }
        return ActionResult.success("戰鬥勝利")
            .narrative(narrative)
            .actions(List.of(ActionDescriptor.of("continue", ActionType.CONTINUE.key, "繼續")))
            .sceneType(ctx.getScene().getType())
            .combatInfo(finalInfo);
    }

    private static CheckOutcome outcomeOf(CombatResult attack) {
        switch (attack.getType()) {
            case CRITICAL_HIT:
                return CheckOutcome.CRITICAL_SUCCESS;
            case HIT:
                return CheckOutcome.SUCCESS;
            case FUMBLE:
                return CheckOutcome.CRITICAL_FAILURE;
            default:
                return CheckOutcome.FAILURE;
        }
    }
}
