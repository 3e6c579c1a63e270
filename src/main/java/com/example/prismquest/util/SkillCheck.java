package com.example.prismquest.util;

import com.example.prismquest.model.Difficulty;

/**
 * Utility class for d100 skill checks.
 *
 * Success threshold: attribute * 20 + difficulty modifier, clamped to 5-95.
 * A roll of 1-5 is always a critical success and 96-100 always a critical
 * failure, whatever the threshold; otherwise the roll succeeds when it is at or
 * under the threshold.
 */
public class SkillCheck {

    public static final int PERCENT_PER_POINT = 20;
    public static final int MIN_THRESHOLD = 5;
    public static final int MAX_THRESHOLD = 95;

    /** Rolls at or under this are critical successes. */
    public static final int CRITICAL_SUCCESS_MAX = 5;
    /** Rolls at or over this are critical failures. */
    public static final int CRITICAL_FAILURE_MIN = 96;

    /**
     * Result of a check: the graded outcome plus the roll and threshold that produced it.
     */
    public record Result(CheckOutcome outcome, int roll, int threshold) {
        public boolean isSuccess() {
            return outcome.isSuccess();
        }
    }

    private SkillCheck() {
    }

    /**
     * Clamp a percentage into the 5-95 band every check uses.
     */
    public static int clampThreshold(int raw) {
        return Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, raw));
    }

    /**
     * Calculate the success threshold for an attribute value at a given difficulty.
     *
     * @param attribute attribute value (1-5 for players)
     * @param difficulty difficulty of the check; null counts as NORMAL
     * @return threshold in the range 5-95
     */
    public static int successThreshold(int attribute, Difficulty difficulty) {
        int modifier = difficulty != null ? difficulty.modifier : 0;
        return clampThreshold(attribute * PERCENT_PER_POINT + modifier);
    }

    /**
     * Grade a roll against a threshold. The critical bands are checked first.
     */
    public static CheckOutcome grade(int roll, int threshold) {
        if (roll <= CRITICAL_SUCCESS_MAX) return CheckOutcome.CRITICAL_SUCCESS;
        if (roll >= CRITICAL_FAILURE_MIN) return CheckOutcome.CRITICAL_FAILURE;
        return roll <= threshold ? CheckOutcome.SUCCESS : CheckOutcome.FAILURE;
    }

    /**
     * Perform a skill check with a fresh d100 from the given dice.
     */
    public static Result check(Dice dice, int attribute, Difficulty difficulty) {
        int threshold = successThreshold(attribute, difficulty);
        int roll = dice.rollD100();
        return new Result(grade(roll, threshold), roll, threshold);
    }
}
