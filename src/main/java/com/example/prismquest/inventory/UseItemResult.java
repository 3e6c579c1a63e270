package com.example.prismquest.inventory;

import com.example.prismquest.effect.EffectOutcome;
import com.example.prismquest.model.Buff;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of using an item. A failed use changes nothing and consumes nothing.
 */
public class UseItemResult {

    public static final String NOT_FOUND = "物品不存在";
    public static final String NOT_USABLE = "無法使用";

    private final boolean success;
    private final String message;
    private final List<String> narrative;
    private final int hpChange;
    private final int mpChange;
    private final String statusCured;
    private final String buffApplied;
    private final Buff regen;
    private final int areaDamage;
    private final boolean itemConsumed;

    private UseItemResult(boolean success, String message, List<String> narrative, int hpChange, int mpChange,
                          String statusCured, String buffApplied, Buff regen, int areaDamage, boolean itemConsumed) {
        this.success = success;
        this.message = message;
        this.narrative = List.copyOf(narrative);
        this.hpChange = hpChange;
        this.mpChange = mpChange;
        this.statusCured = statusCured;
        this.buffApplied = buffApplied;
        this.regen = regen;
        this.areaDamage = areaDamage;
        this.itemConsumed = itemConsumed;
    }

    public static UseItemResult failure(String message, String reason) {
        return new UseItemResult(false, message, List.of(reason), 0, 0, null, null, null, 0, false);
    }

    static UseItemResult used(String itemName, List<String> opening, EffectOutcome outcome) {
        List<String> lines = new ArrayList<>(opening);
        lines.addAll(outcome.getNarrative());
        return new UseItemResult(true, "使用了" + itemName, lines, outcome.getHpChange(), outcome.getMpChange(),
            outcome.getStatusCured(), outcome.getBuffApplied(), outcome.getRegen(), outcome.getAreaDamage(), true);
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public List<String> getNarrative() { return narrative; }
    public int getHpChange() { return hpChange; }
    public int getMpChange() { return mpChange; }
    public String getStatusCured() { return statusCured; }
    public String getBuffApplied() { return buffApplied; }
    public Buff getRegen() { return regen; }
    public int getAreaDamage() { return areaDamage; }
    public boolean isItemConsumed() { return itemConsumed; }

    @Override
    public String toString() {
        return "UseItemResult[" + (success ? "ok" : "fail") + " " + message + " hp+" + hpChange + " mp+" + mpChange + "]";
    }
}
