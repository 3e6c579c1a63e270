package com.example.prismquest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only catalog scene. Unknown scene ids resolve to {@link #EMPTY}.
 */
public final class Scene {

    /**
     * Enemy reference of a combat scene.
     */
    public record CombatInfo(String enemyId, String description) {}

    public static final Scene EMPTY = new Scene("", SceneType.NARRATIVE, null, null, null, null, null, null, null);

    private final String id;
    private final SceneType type;
    private final List<String> narrative;
    private final List<String> resumeNarrative;
    private final List<ActionDescriptor> actions;
    private final Map<String, Choice> choices;
    private final CombatInfo combatInfo;
    private final StateChangeSpec onEnterStateChanges;
    private final String postCombatScene;

    public Scene(String id, SceneType type, List<String> narrative, List<String> resumeNarrative,
                 List<ActionDescriptor> actions, Map<String, Choice> choices, CombatInfo combatInfo,
                 StateChangeSpec onEnterStateChanges, String postCombatScene) {
        this.id = id != null ? id : "";
        this.type = type != null ? type : SceneType.NARRATIVE;
        this.narrative = narrative == null ? List.of() : List.copyOf(narrative);
        this.resumeNarrative = resumeNarrative == null ? List.of() : List.copyOf(resumeNarrative);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.choices = choices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(choices));
        this.combatInfo = combatInfo;
        this.onEnterStateChanges = onEnterStateChanges != null ? onEnterStateChanges : StateChangeSpec.none();
        this.postCombatScene = postCombatScene;
    }

    public String getId() { return id; }
    public SceneType getType() { return type; }
    public List<String> getNarrative() { return narrative; }
    public List<ActionDescriptor> getActions() { return actions; }
    public Map<String, Choice> getChoices() { return choices; }
    public StateChangeSpec getOnEnterStateChanges() { return onEnterStateChanges; }

    /** Combat reference, or null for non-combat scenes. */
    public CombatInfo getCombatInfo() { return combatInfo; }

    /** Scene to move to after winning this scene's fight, or null. */
    public String getPostCombatScene() { return postCombatScene; }

    /**
     * The short narrative shown when a session is resumed, falling back to the full one.
     */
    public List<String> getResumeNarrative() {
        return resumeNarrative.isEmpty() ? narrative : resumeNarrative;
    }

    public boolean isEmpty() {
        return this == EMPTY || (id.isEmpty() && narrative.isEmpty() && actions.isEmpty());
    }

    public boolean isCombat() {
        return type == SceneType.COMBAT && combatInfo != null && combatInfo.enemyId() != null;
    }

    public Choice getChoice(String choiceId) {
        if (choiceId == null) return null;
        return choices.get(choiceId);
    }

    @Override
    public String toString() {
        return "Scene[" + id + " (" + type.key + ")]";
    }
}
