package com.example.prismquest.model;

import java.util.List;

/**
 * One entry of a scene's choice map. Either gated by a skill check or resolved directly.
 */
public final class Choice {

    private final String id;
    private final List<String> narrative;
    private final SkillCheckSpec skillCheck;
    private final StateChangeSpec stateChanges;
    private final String nextScene;
    private final String nextChapter;
    private final List<ActionDescriptor> nextActions;

    public Choice(String id, List<String> narrative, SkillCheckSpec skillCheck,
                  StateChangeSpec stateChanges, String nextScene, String nextChapter,
                  List<ActionDescriptor> nextActions) {
        this.id = id;
        this.narrative = narrative == null ? List.of() : List.copyOf(narrative);
        this.skillCheck = skillCheck;
        this.stateChanges = stateChanges != null ? stateChanges : StateChangeSpec.none();
        this.nextScene = nextScene;
        this.nextChapter = nextChapter;
        this.nextActions = nextActions == null ? null : List.copyOf(nextActions);
    }

    public String getId() { return id; }
    public List<String> getNarrative() { return narrative; }
    public StateChangeSpec getStateChanges() { return stateChanges; }
    public String getNextScene() { return nextScene; }
    public String getNextChapter() { return nextChapter; }

    /** Actions offered after the choice, or null to use the resulting scene's actions. */
    public List<ActionDescriptor> getNextActions() { return nextActions; }

    /** The nested check, or null when the choice resolves without a roll. */
    public SkillCheckSpec getSkillCheck() { return skillCheck; }

    public boolean requiresCheck() {
        return skillCheck != null;
    }
}
