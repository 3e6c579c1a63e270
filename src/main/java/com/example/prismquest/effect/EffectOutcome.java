package com.example.prismquest.effect;

import com.example.prismquest.model.Buff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What an item effect did: narrative plus the changes it asks for.
 * hp/mp changes are actual amounts, already limited by the player's deficit.
 */
public class EffectOutcome {

    private final List<String> narrative = new ArrayList<>();
    private int hpChange;
    private int mpChange;
    private String statusCured;
    private String buffApplied;
    private Buff regen;
    private int areaDamage;

    public EffectOutcome addLine(String line) {
        narrative.add(line);
        return this;
    }

    public void setHpChange(int hpChange) { this.hpChange = hpChange; }
    public void setMpChange(int mpChange) { this.mpChange = mpChange; }
    public void setStatusCured(String statusCured) { this.statusCured = statusCured; }
    public void setBuffApplied(String buffApplied) { this.buffApplied = buffApplied; }
    public void setRegen(Buff regen) { this.regen = regen; }
    public void setAreaDamage(int areaDamage) { this.areaDamage = areaDamage; }

    public List<String> getNarrative() { return Collections.unmodifiableList(narrative); }
    public int getHpChange() { return hpChange; }
    public int getMpChange() { return mpChange; }
    public String getStatusCured() { return statusCured; }
    public String getBuffApplied() { return buffApplied; }
    public int getAreaDamage() { return areaDamage; }

    /** Regeneration buff started by the effect, or null. */
    public Buff getRegen() { return regen; }
}
