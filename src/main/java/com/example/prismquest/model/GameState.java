package com.example.prismquest.model;

import com.example.prismquest.combat.CombatSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root state document of one save slot, in typed form.
 *
 * Instances are immutable; the engine never changes the state it was given and
 * reports its changes as a {@link com.example.prismquest.state.StateDelta} instead.
 */
public final class GameState {

    public static final String FIRST_CHAPTER = "prologue";
    public static final String FIRST_SCENE = "dream_opening";

    private final String chapter;
    private final String scene;
    private final Player player;
    private final Map<String, Object> flags;
    private final CombatSnapshot combat;
    private final List<Buff> buffs;

    public GameState(String chapter, String scene, Player player, Map<String, Object> flags,
                     CombatSnapshot combat, List<Buff> buffs) {
        this.chapter = chapter != null ? chapter : FIRST_CHAPTER;
        this.scene = scene != null ? scene : "";
        this.player = player;
        this.flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
        this.combat = combat != null ? combat.copy() : null;
        this.buffs = buffs == null ? List.of() : List.copyOf(buffs);
    }

    /**
     * The initial state of a brand-new save: prologue, opening dream scene, no flags.
     */
    public static GameState newGame(Player player) {
        return new GameState(FIRST_CHAPTER, FIRST_SCENE, player, Map.of(), null, List.of());
    }

    public String getChapter() { return chapter; }
    public String getScene() { return scene; }
    public Player getPlayer() { return player; }
    public Map<String, Object> getFlags() { return flags; }
    public List<Buff> getBuffs() { return buffs; }

    /** A copy of the embedded combat snapshot, or null when no fight is in progress. */
    public CombatSnapshot getCombat() {
        return combat != null ? combat.copy() : null;
    }

    public boolean isInCombat() {
        return combat != null && combat.isActive();
    }

    public GameState withScene(String chapter, String scene) {
        return new GameState(chapter, scene, player, flags, combat, buffs);
    }

    public GameState withPlayer(Player newPlayer) {
        return new GameState(chapter, scene, newPlayer, flags, combat, buffs);
    }

    public GameState withFlags(Map<String, Object> newFlags) {
        return new GameState(chapter, scene, player, newFlags, combat, buffs);
    }

    public GameState withCombat(CombatSnapshot newCombat) {
        return new GameState(chapter, scene, player, flags, newCombat, buffs);
    }

    public GameState withBuffs(List<Buff> newBuffs) {
        return new GameState(chapter, scene, player, flags, combat, newBuffs);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("chapter", chapter);
        doc.put("scene", scene);
        doc.put("player", player != null ? player.toDocument() : null);
        doc.put("flags", new LinkedHashMap<>(flags));
        doc.put("combat", combat != null ? combat.toDocument() : null);
        List<Map<String, Object>> buffDocs = new ArrayList<>();
        for (Buff b : buffs) buffDocs.add(b.toDocument());
        doc.put("buffs", buffDocs);
        return doc;
    }
}
