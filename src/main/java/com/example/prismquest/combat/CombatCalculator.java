package com.example.prismquest.combat;

import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.util.SkillCheck;

/**
 * Combat calculator for hit chances, damage and dodge chances.
 *
 * Hit threshold: attribute * 20 + 10 - enemy evasion, clamped to 5-95.
 *
 * Damage: max(1, (weapon damage + attribute + weakness bonus) * crit multiplier - enemy armor).
 * The weakness bonus only applies to light attacks against enemies weak to light.
 *
 * Dodge threshold: dexterity * 10 + 5 (no clamp).
 */
public class CombatCalculator {

    /** Flat bonus to every player hit threshold. */
    public static final int BASE_HIT_BONUS = 10;

    /** Rolls at or under this are fumbles: the attack misses regardless of threshold. */
    public static final int FUMBLE_MAX = 5;

    /** Rolls at or over this are critical hits: the attack lands with doubled damage. */
    public static final int CRITICAL_MIN = 96;

    public static final int CRITICAL_MULTIPLIER = 2;

    /** Every landed hit deals at least this much, whatever the armor. */
    public static final int MIN_DAMAGE = 1;

    public static final int DODGE_PER_DEXTERITY = 10;
    public static final int BASE_DODGE = 5;

    public static final String LIGHT_ELEMENT = "light";

    /**
     * Calculate the player's hit threshold.
     *
     * @param attribute the attack's governing attribute value
     * @param enemyEvasion the target's evasion
     * @return threshold in the range 5-95
     */
    public int calculateHitThreshold(int attribute, int enemyEvasion) {
        return SkillCheck.clampThreshold(attribute * SkillCheck.PERCENT_PER_POINT + BASE_HIT_BONUS - enemyEvasion);
    }

    public boolean isFumble(int roll) {
        return roll <= FUMBLE_MAX;
    }

    public boolean isCriticalHit(int roll) {
        return roll >= CRITICAL_MIN;
    }

    /**
     * Whether an attack roll lands. Fumbles always miss and critical hits always land.
     */
    public boolean isHit(int roll, int threshold) {
        if (isFumble(roll)) return false;
        if (isCriticalHit(roll)) return true;
        return roll <= threshold;
    }

    /**
     * Damage before armor: (weapon + attribute + weakness) times the crit multiplier.
     */
    public int calculateRawDamage(int weaponDamage, int attribute, int weaknessBonus, boolean critical) {
        int multiplier = critical ? CRITICAL_MULTIPLIER : 1;
        return (weaponDamage + attribute + weaknessBonus) * multiplier;
    }

    /**
     * Damage after armor, floored at 1.
     */
    public int calculateDamage(int weaponDamage, int attribute, int weaknessBonus, boolean critical, int armor) {
        return Math.max(MIN_DAMAGE, calculateRawDamage(weaponDamage, attribute, weaknessBonus, critical) - armor);
    }

    /**
     * Extra damage a light attack deals to an enemy weak to light. 0 otherwise.
     */
    public int calculateWeaknessBonus(EnemyDefinition enemy, boolean isLightAttack) {
        if (!isLightAttack || enemy == null) return 0;
        return enemy.isWeakTo(LIGHT_ELEMENT) ? enemy.getWeaknessBonus() : 0;
    }

    /**
     * The player's dodge threshold against enemy attacks.
     */
    public int calculateDodgeThreshold(int dexterity) {
        return dexterity * DODGE_PER_DEXTERITY + BASE_DODGE;
    }
}
