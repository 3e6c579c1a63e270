package com.example.prismquest.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one attack, by the player or by the enemy.
 * Contains all information needed to narrate the attack and update the snapshot.
 */
public class CombatResult {

    public enum ResultType {
        HIT,            // Normal hit with damage
        CRITICAL_HIT,   // Critical hit (double damage)
        MISS,           // Attack missed
        FUMBLE,         // Critical failure, forced miss
        DODGED,         // Player dodged the enemy's attack
        IDLE            // Attacker could not act
    }

    private final ResultType type;

    /** Damage dealt (0 on a miss) */
    private final int damage;

    /** Roll values for display */
    private final int roll;
    private final int threshold;

    /** Target hp after the attack */
    private final int remainingHp;

    /** Status effect applied by the attack, or null */
    private final String effect;

    private final List<String> narrative = new ArrayList<>();

    private CombatResult(ResultType type, int damage, int roll, int threshold, int remainingHp, String effect) {
        this.type = type;
        this.damage = damage;
        this.roll = roll;
        this.threshold = threshold;
        this.remainingHp = remainingHp;
        this.effect = effect;
    }

    // Static factory methods

    public static CombatResult hit(int damage, int roll, int threshold, int remainingHp) {
        return new CombatResult(ResultType.HIT, damage, roll, threshold, remainingHp, null);
    }

    public static CombatResult criticalHit(int damage, int roll, int threshold, int remainingHp) {
        return new CombatResult(ResultType.CRITICAL_HIT, damage, roll, threshold, remainingHp, null);
    }

    public static CombatResult miss(int roll, int threshold, int remainingHp) {
        return new CombatResult(ResultType.MISS, 0, roll, threshold, remainingHp, null);
    }

    public static CombatResult fumble(int roll, int threshold, int remainingHp) {
        return new CombatResult(ResultType.FUMBLE, 0, roll, threshold, remainingHp, null);
    }

    public static CombatResult dodged(int roll, int threshold, int remainingHp) {
        return new CombatResult(ResultType.DODGED, 0, roll, threshold, remainingHp, null);
    }

    public static CombatResult enemyHit(int damage, int roll, int threshold, int remainingHp, String effect) {
        return new CombatResult(ResultType.HIT, damage, roll, threshold, remainingHp, effect);
    }

    public static CombatResult idle(int remainingHp, String line) {
        CombatResult r = new CombatResult(ResultType.IDLE, 0, 0, 0, remainingHp, null);
        r.addLine(line);
        return r;
    }

    // Getters

    public ResultType getType() { return type; }
    public int getDamage() { return damage; }
    public int getRoll() { return roll; }
    public int getThreshold() { return threshold; }
    public int getRemainingHp() { return remainingHp; }
    public String getEffect() { return effect; }

    public List<String> getNarrative() { return Collections.unmodifiableList(narrative); }

    public CombatResult addLine(String line) {
        narrative.add(line);
        return this;
    }

    public boolean isHit() { return type == ResultType.HIT || type == ResultType.CRITICAL_HIT; }
    public boolean isCritical() { return type == ResultType.CRITICAL_HIT; }
    public boolean isMiss() { return type == ResultType.MISS || type == ResultType.FUMBLE || type == ResultType.DODGED; }

    /** Whether the attack brought its target to 0 hp. */
    public boolean isDefeated() {
        return isHit() && remainingHp <= 0;
    }

    @Override
    public String toString() {
        return String.format("CombatResult[%s damage=%d roll=%d/%d hp=%d]",
            type, damage, roll, threshold, remainingHp);
    }
}
