package com.example.prismquest.engine;

import com.example.prismquest.model.ActionDescriptor;
import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.Choice;
import com.example.prismquest.model.SkillCheckSpec;
import com.example.prismquest.util.SkillCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scene choices and skill checks. A choice with a nested check is resolved the
 * same way as a standalone {@code skill_check} action.
 */
public class ChoiceActionHandler implements ActionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChoiceActionHandler.class);

    @Override
    public boolean supports(ActionType type) {
        return type == ActionType.CHOICE || type == ActionType.SKILL_CHECK;
    }

    @Override
    public ActionResult handle(ActionContext ctx, ActionRequest request) {
        if (request.getType() == ActionType.SKILL_CHECK) {
            return resolveCheck(ctx, request.getSkillCheck());
        }
        return handleChoice(ctx, request.getChoiceId());
    }

    private ActionResult handleChoice(ActionContext ctx, String choiceId) {
        Choice choice = ctx.getScene().getChoice(choiceId);
        if (choice == null) {
            logger.debug("Unknown choice '{}' in scene {}", choiceId, ctx.getSceneId());
            return ActionResult.failure("無效的選擇")
                .line("請選擇有效的選項。")
                .actions(ctx.currentActions());
        }
        if (choice.requiresCheck()) {
            return resolveCheck(ctx, choice.getSkillCheck());
        }

        ctx.applyStateChanges(choice.getStateChanges());
        boolean moved = choice.getNextScene() != null;
        if (moved) {
            ctx.switchScene(choice.getNextScene(), choice.getNextChapter());
        }
        ActionResult result = ActionResult.success("選擇完成")
            .narrative(choice.getNarrative())
            .actions(nextActions(ctx, choice.getNextActions()));
        if (moved) {
            result.sceneType(ctx.getScene().getType()).combatInfo(ctx.combatInfo());
        }
        return result;
    }

    /**
     * Roll the check and apply the matching branch. The result's success flag is
     * the check's outcome.
     */
    private ActionResult resolveCheck(ActionContext ctx, SkillCheckSpec check) {
        Attribute attribute = check.getAttribute();
        int value = ctx.getPlayer().getAttribute(attribute);
        SkillCheck.Result roll = SkillCheck.check(ctx.getDice(), value, check.getDifficulty());
        DiceReport report = new DiceReport(roll.roll(), roll.threshold(), roll.outcome(), attribute, value);
        logger.debug("Skill check {} ({}) at {}: {}", attribute.key, value, check.getDifficulty().key, report);

        boolean success = roll.isSuccess();
        ActionResult result;
        if (success) {
            ctx.applyStateChanges(check.getSuccessChanges());
            if (check.getNextScene() != null) {
                ctx.switchScene(check.getNextScene(), check.getNextChapter());
                result = ActionResult.success(label(report))
                    .sceneType(ctx.getScene().getType());
            } else {
                result = ActionResult.success(label(report));
            }
            result.narrative(check.getSuccessText());
        } else {
            ctx.applyStateChanges(check.getFailureChanges());
            result = ActionResult.failure(label(report)).narrative(check.getFailureText());
        }
        return result
            .diceResult(report)
            .actions(nextActions(ctx, check.getNextActions()))
            .combatInfo(ctx.combatInfo());
    }

    private static String label(DiceReport report) {
        String verdict = report.outcome().isSuccess() ? "成功" : "失敗";
        return verdict + "（" + report.roll() + "/" + report.threshold() + "）";
    }

    private static List<ActionDescriptor> nextActions(ActionContext ctx, List<ActionDescriptor> authored) {
        return authored != null && !authored.isEmpty() ? authored : ctx.currentActions();
    }
}
