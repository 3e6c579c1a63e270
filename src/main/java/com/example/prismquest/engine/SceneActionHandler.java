package com.example.prismquest.engine;

import com.example.prismquest.model.Scene;
import com.example.prismquest.model.SceneType;

import java.util.ArrayList;
import java.util.List;

/**
 * Scene navigation: start, resume, continue and cancel.
 */
public class SceneActionHandler implements ActionHandler {

    /** Shown by start when no scene is loaded yet. */
    public static final List<String> OPENING_NARRATIVE = List.of(
        "黑暗。",
        "",
        "你聽見師父的聲音，彷彿從很遠的地方傳來。",
        "",
        "「記住，孩子...光與暗從不對立...」",
        "",
        "聲音漸漸模糊。",
        "",
        "「三稜聖杯...碎片...你必須...」",
        "",
        "你猛然醒來。",
        "",
        "冷汗浸濕了後背。窗外，殘月如鉤。",
        "桌上，師父的最後一封信靜靜躺著。",
        "信封上只有一行字：「廢棄燈塔，答案在那裡。」");

    public static final String RESUME_FALLBACK = "繼續你的冒險...";

    @Override
    public boolean supports(ActionType type) {
        switch (type) {
            case START:
            case RESUME:
            case CONTINUE:
            case CANCEL:
                return true;
            default:
                return false;
        }
    }

    @Override
    public ActionResult handle(ActionContext ctx, ActionRequest request) {
        switch (request.getType()) {
            case START:
                return handleStart(ctx);
            case RESUME:
                return handleResume(ctx);
            case CONTINUE:
                return handleContinue(ctx, request);
            case CANCEL:
                return handleCancel(ctx);
            default:
                return null;
        }
    }

    private ActionResult handleStart(ActionContext ctx) {
        Scene scene = ctx.getScene();
        if (scene.isEmpty()) {
            return ActionResult.success("遊戲開始")
                .narrative(OPENING_NARRATIVE)
                .actions(scene.getActions());
        }
        ctx.enterCombatIfNeeded();
        return render(ctx, ActionResult.success("場景載入").narrative(scene.getNarrative()));
    }

    private ActionResult handleResume(ActionContext ctx) {
        Scene scene = ctx.getScene();
        if (scene.isEmpty()) {
            return ActionResult.success("遊戲恢復").line(RESUME_FALLBACK);
        }
        ctx.enterCombatIfNeeded();
        return render(ctx, ActionResult.success("遊戲恢復").narrative(scene.getResumeNarrative()));
    }

    private ActionResult handleContinue(ActionContext ctx, ActionRequest request) {
        List<String> narrative = new ArrayList<>();
        ctx.tickRegen(narrative);
        if (request.getNextScene() != null) {
            ctx.switchScene(request.getNextScene(), request.getNextChapter());
        } else {
            ctx.enterCombatIfNeeded();
        }
        List<String> sceneText = ctx.getScene().getNarrative();
        narrative.addAll(sceneText.isEmpty() ? List.of("...") : sceneText);
        return render(ctx, ActionResult.success("繼續").narrative(narrative));
    }

    private ActionResult handleCancel(ActionContext ctx) {
        ActionResult result = ActionResult.success("返回").actions(ctx.currentActions());
        if (ctx.isInCombat()) {
            result.sceneType(SceneType.COMBAT).combatInfo(ctx.combatInfo());
        }
        return result;
    }

    /**
     * Attach the current actions, scene type and combat details.
     */
    static ActionResult render(ActionContext ctx, ActionResult result) {
        return result
            .actions(ctx.currentActions())
            .sceneType(ctx.getScene().getType())
            .combatInfo(ctx.combatInfo());
    }
}
