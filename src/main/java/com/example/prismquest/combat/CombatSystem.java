package com.example.prismquest.combat;

import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.Player;
import com.example.prismquest.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves encounters between the player and one catalog enemy.
 *
 * An encounter runs Init, then alternating player and enemy turns, until either
 * side reaches 0 hp. The snapshot passed in is updated in place; callers pass a
 * working copy.
 */
public class CombatSystem {

    private static final Logger logger = LoggerFactory.getLogger(CombatSystem.class);

    private final GameCatalog catalog;
    private final Dice dice;
    private final CombatCalculator calculator;

    public CombatSystem(GameCatalog catalog, Dice dice) {
        this(catalog, dice, new CombatCalculator());
    }

    public CombatSystem(GameCatalog catalog, Dice dice, CombatCalculator calculator) {
        this.catalog = catalog;
        this.dice = dice;
        this.calculator = calculator;
    }

    public CombatCalculator getCalculator() {
        return calculator;
    }

    public EnemyDefinition getEnemy(String enemyId) {
        return catalog.getEnemy(enemyId);
    }

    /**
     * Start an encounter.
     *
     * @return a fresh active snapshot, or empty if the enemy is not in the catalog
     */
    public Optional<CombatSnapshot> init(String enemyId, Player player) {
        EnemyDefinition enemy = catalog.getEnemy(enemyId);
        if (enemy == null) {
            logger.warn("Cannot start combat: unknown enemy '{}'", enemyId);
            return Optional.empty();
        }
        int playerHp = player != null ? player.getHp() : 20;
        int playerMaxHp = player != null ? player.getMaxHp() : 20;
        CombatSnapshot snapshot = new CombatSnapshot(
            enemyId, enemy.getName(), enemy.getMaxHp(), enemy.getMaxHp(),
            enemy.getEvasion(), enemy.getArmor(), 1, true, playerHp, playerMaxHp);
        logger.debug("Combat started: {}", snapshot);
        return Optional.of(snapshot);
    }

    /**
     * Resolve the player's attack and apply the damage to the snapshot.
     *
     * @param snapshot working snapshot, updated in place
     * @param player the attacking player
     * @param attackType attack style; decides the attribute used
     * @param weaponDamage base damage of the equipped weapon
     * @param isLightAttack whether the attack carries light affinity
     */
    public CombatResult playerAttack(CombatSnapshot snapshot, Player player, AttackType attackType,
                                     int weaponDamage, boolean isLightAttack) {
        AttackType type = attackType != null ? attackType : AttackType.MELEE;
        int attribute = player.getAttribute(type.attribute);
        int threshold = calculator.calculateHitThreshold(attribute, snapshot.getEnemyEvasion());
        int roll = dice.rollD100();
        String enemyName = snapshot.getEnemyName();

        if (calculator.isFumble(roll)) {
            return CombatResult.fumble(roll, threshold, snapshot.getEnemyHp())
                .addLine("你的攻擊完全偏離了目標！")
                .addLine("（骰出 " + roll + "，大失敗）");
        }

        boolean critical = calculator.isCriticalHit(roll);
        if (!calculator.isHit(roll, threshold)) {
            return CombatResult.miss(roll, threshold, snapshot.getEnemyHp())
                .addLine(enemyName + "靈巧地躲開了你的攻擊！")
                .addLine("（骰出 " + roll + "，需要 " + threshold + " 以下）");
        }

        List<String> lines = new ArrayList<>();
        int weaknessBonus = calculator.calculateWeaknessBonus(catalog.getEnemy(snapshot.getEnemyId()), isLightAttack);
        if (weaknessBonus > 0) {
            lines.add("光系攻擊對暗影生物造成額外傷害！");
        }
        int damage = calculator.calculateDamage(weaponDamage, attribute, weaknessBonus, critical, snapshot.getEnemyArmor());
        int remaining = snapshot.damageEnemy(damage);

        CombatResult result = critical
            ? CombatResult.criticalHit(damage, roll, threshold, remaining)
            : CombatResult.hit(damage, roll, threshold, remaining);
        for (String line : lines) result.addLine(line);
        if (critical) {
            result.addLine("完美的一擊！")
                .addLine("你的攻擊精準命中" + enemyName + "的要害！")
                .addLine("（骰出 " + roll + "，大成功！傷害翻倍）");
        } else {
            result.addLine("你的攻擊命中了" + enemyName + "！")
                .addLine("（骰出 " + roll + "，成功）");
        }
        result.addLine("造成 " + damage + " 點傷害！")
            .addLine(enemyName + " HP: " + remaining + "/" + snapshot.getEnemyMaxHp());
        if (remaining <= 0) {
            result.addLine("").addLine(enemyName + "倒下了！");
        }
        logger.debug("Player {} attack on {}: {}", type.key, snapshot.getEnemyId(), result);
        return result;
    }

    /**
     * Resolve the enemy's counter attack against the player and apply it to the
     * snapshot's player hp mirror. The attack is chosen uniformly at random.
     */
    public CombatResult enemyAttack(CombatSnapshot snapshot, Player player) {
        EnemyDefinition enemy = catalog.getEnemy(snapshot.getEnemyId());
        if (enemy == null) {
            return CombatResult.idle(snapshot.getPlayerHp(), "敵人無法行動。");
        }
        EnemyDefinition.Attack attack = dice.pick(enemy.getAttacks());
        if (attack == null) {
            return CombatResult.idle(snapshot.getPlayerHp(), "敵人猶豫不決。");
        }

        int dexterity = player.getAttribute(Attribute.DEXTERITY);
        int dodgeThreshold = calculator.calculateDodgeThreshold(dexterity);
        int roll = dice.rollD100();
        String opening = attack.description() != null ? attack.description() : snapshot.getEnemyName() + "發動攻擊！";

        if (roll <= dodgeThreshold) {
            return CombatResult.dodged(roll, dodgeThreshold, snapshot.getPlayerHp())
                .addLine(opening)
                .addLine("你靈活地閃避了攻擊！")
                .addLine("（迴避骰 " + roll + "，需要 " + dodgeThreshold + " 以下）");
        }

        int damage = attack.damage();
        int remaining = snapshot.damagePlayer(damage);

        String effect = null;
        if (attack.hasEffect() && dice.percent(attack.effectChance())) {
            effect = attack.effect();
        }

        CombatResult result = CombatResult.enemyHit(damage, roll, dodgeThreshold, remaining, effect)
            .addLine(opening)
            .addLine("你受到 " + damage + " 點傷害！")
            .addLine("HP: " + remaining + "/" + snapshot.getPlayerMaxHp());
        if (effect != null) {
            result.addLine("你陷入了" + effect + "狀態！");
        }
        logger.debug("Enemy {} attack: {}", snapshot.getEnemyId(), result);
        return result;
    }

    /**
     * Flatten an enemy's drop table into gold, item drops and experience.
     * Unknown enemies give nothing.
     */
    public VictoryRewards victoryRewards(String enemyId) {
        EnemyDefinition enemy = catalog.getEnemy(enemyId);
        if (enemy == null) return VictoryRewards.none();
        int gold = 0;
        List<EnemyDefinition.Drop> items = new ArrayList<>();
        for (EnemyDefinition.Drop drop : enemy.getDrops()) {
            if (drop.isGold()) gold += drop.quantity();
            else items.add(drop);
        }
        return new VictoryRewards(gold, items, enemy.getExp());
    }
}
