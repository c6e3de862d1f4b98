package com.github.salilvnair.commandconsole.plan;

import com.github.salilvnair.commandconsole.entity.CcPlan;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.preview.PlanPreview;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class PlanIntents {

    public static Intent intent(CcPlan plan) {
        return JsonUtil.fromJson(plan.getIntentJson(), Intent.class);
    }

    public static PlanPreview preview(CcPlan plan) {
        return plan.getPreviewJson() == null ? null : JsonUtil.fromJson(plan.getPreviewJson(), PlanPreview.class);
    }
}
