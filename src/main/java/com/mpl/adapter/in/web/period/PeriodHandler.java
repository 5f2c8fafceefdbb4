package com.mpl.adapter.in.web.period;

import com.mpl.adapter.in.web.ApiResponse;
import com.mpl.adapter.in.web.HttpResponses;
import com.mpl.application.port.in.PeriodAmountsUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handlers for period edits
 * PATCH /api/cases/:caseId/periods/:periodId, PUT /api/cases/:caseId/periods/:periodId/status
 */
@Slf4j
@RequiredArgsConstructor
public class PeriodHandler {

    private final PeriodAmountsUseCase periodUseCase;

    public void updateAmounts(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        String periodId = context.pathParam("periodId");
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        PeriodAmountsRequest request;
        try {
            request = body.mapTo(PeriodAmountsRequest.class);
        } catch (IllegalArgumentException e) {
            HttpResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        periodUseCase.updatePeriodAmounts(caseId, periodId, request.toCommand())
                .onSuccess(updated -> HttpResponses.ok(context, ApiResponse.success("Period updated", updated)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void setStatus(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        String periodId = context.pathParam("periodId");
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        periodUseCase.setPeriodStatus(caseId, periodId, body.getString("status"))
                .onSuccess(updated -> HttpResponses.ok(context, ApiResponse.success("Period status updated", updated)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
