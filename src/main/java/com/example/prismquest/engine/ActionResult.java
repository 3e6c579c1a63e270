package com.example.prismquest.engine;

import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.SceneType;
import com.example.prismquest.state.StateDelta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one action produces: narrative, the state delta, the next actions
 * and optional dice, scene and combat details.
 */
public class ActionResult {

    private final boolean success;
    private final String message;
    private final List<String> narrative = new ArrayList<>();
    private final List<ActionDescriptor> availableActions = new ArrayList<>();
    private StateDelta stateChanges = StateDelta.empty();
    private DiceReport diceResult;
    private SceneType sceneType;
    private Map<String, Object> combatInfo;

    private ActionResult(boolean success, String message) {
        this.success = success;
        this.message = message != null ? message : "";
    }

    public static ActionResult success(String message) {
        return new ActionResult(true, message);
    }

    public static ActionResult failure(String message) {
        return new ActionResult(false, message);
    }

    public ActionResult narrative(List<String> lines) {
        if (lines != null) narrative.addAll(lines);
        return this;
    }

    public ActionResult line(String line) {
        narrative.add(line);
        return this;
    }

    public ActionResult actions(List<ActionDescriptor> actions) {
        availableActions.clear();
        if (actions != null) availableActions.addAll(actions);
        return this;
    }

    public ActionResult stateChanges(StateDelta delta) {
        this.stateChanges = delta != null ? delta : StateDelta.empty();
        return this;
    }

    public ActionResult diceResult(DiceReport report) {
        this.diceResult = report;
        return this;
    }

    public ActionResult sceneType(SceneType type) {
        this.sceneType = type;
        return this;
    }

    public ActionResult combatInfo(Map<String, Object> info) {
        this.combatInfo = info != null ? new LinkedHashMap<>(info) : null;
        return this;
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public List<String> getNarrative() { return Collections.unmodifiableList(narrative); }
    public List<ActionDescriptor> getAvailableActions() { return Collections.unmodifiableList(availableActions); }
    public StateDelta getStateChanges() { return stateChanges; }
    public DiceReport getDiceResult() { return diceResult; }
    public SceneType getSceneType() { return sceneType; }
    public Map<String, Object> getCombatInfo() { return combatInfo; }

    /**
     * The wire form with snake_case keys. Optional parts are omitted when absent.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("success", success);
        doc.put("message", message);
        doc.put("narrative", new ArrayList<>(narrative));
        doc.put("state_changes", stateChanges.toDocument());
        List<Map<String, Object>> actions = new ArrayList<>();
        for (ActionDescriptor a : availableActions) actions.add(a.toDocument());
        doc.put("available_actions", actions);
        if (diceResult != null) doc.put("dice_result", diceResult.toDocument());
        if (sceneType != null) doc.put("scene_type", sceneType.key);
        if (combatInfo != null) doc.put("combat_info", new LinkedHashMap<>(combatInfo));
        return doc;
    }

    @Override
    public String toString() {
        return "ActionResult[" + (success ? "ok" : "fail") + " '" + message + "' actions=" + availableActions.size()
            + " delta=" + stateChanges.toDocument().keySet() + "]";
    }
}
