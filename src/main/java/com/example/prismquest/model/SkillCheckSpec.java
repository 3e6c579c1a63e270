package com.example.prismquest.model;

import java.util.List;

/**
 * A skill check with both of its outcome branches.
 *
 * The success branch applies {@code successChanges} and moves to {@code nextScene}
 * (if any); the failure branch applies only {@code failureChanges}.
 * {@code nextActions} replaces the offered actions after either outcome; null
 * means "whatever the resulting scene offers".
 */
public final class SkillCheckSpec {

    public static final List<String> DEFAULT_SUCCESS_TEXT = List.of("檢定成功！");
    public static final List<String> DEFAULT_FAILURE_TEXT = List.of("檢定失敗。");

    private final Attribute attribute;
    private final Difficulty difficulty;
    private final List<String> successText;
    private final List<String> failureText;
    private final StateChangeSpec successChanges;
    private final StateChangeSpec failureChanges;
    private final String nextScene;
    private final String nextChapter;
    private final List<ActionDescriptor> nextActions;

    public SkillCheckSpec(Attribute attribute, Difficulty difficulty,
                          List<String> successText, List<String> failureText,
                          StateChangeSpec successChanges, StateChangeSpec failureChanges,
                          String nextScene, String nextChapter, List<ActionDescriptor> nextActions) {
        this.attribute = attribute != null ? attribute : Attribute.PERCEPTION;
        this.difficulty = difficulty != null ? difficulty : Difficulty.NORMAL;
        this.successText = successText == null || successText.isEmpty() ? DEFAULT_SUCCESS_TEXT : List.copyOf(successText);
        this.failureText = failureText == null || failureText.isEmpty() ? DEFAULT_FAILURE_TEXT : List.copyOf(failureText);
        this.successChanges = successChanges != null ? successChanges : StateChangeSpec.none();
        this.failureChanges = failureChanges != null ? failureChanges : StateChangeSpec.none();
        this.nextScene = nextScene;
        this.nextChapter = nextChapter;
        this.nextActions = nextActions == null ? null : List.copyOf(nextActions);
    }

    public static SkillCheckSpec simple(Attribute attribute, Difficulty difficulty) {
        return new SkillCheckSpec(attribute, difficulty, null, null, null, null, null, null, null);
    }

    public Attribute getAttribute() { return attribute; }
    public Difficulty getDifficulty() { return difficulty; }
    public List<String> getSuccessText() { return successText; }
    public List<String> getFailureText() { return failureText; }
    public StateChangeSpec getSuccessChanges() { return successChanges; }
    public StateChangeSpec getFailureChanges() { return failureChanges; }
    public String getNextScene() { return nextScene; }
    public String getNextChapter() { return nextChapter; }
    public List<ActionDescriptor> getNextActions() { return nextActions; }
}
