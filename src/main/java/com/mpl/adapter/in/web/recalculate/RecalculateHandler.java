package com.mpl.adapter.in.web.recalculate;

import com.mpl.adapter.in.web.ApiResponse;
import com.mpl.adapter.in.web.HttpResponses;
import com.mpl.application.port.in.RecalculateUseCase;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP Controller for manual CMP recalculation
 * POST /api/cases/:caseId/recalculate recalculates one case, POST /api/recalculate every active case
 */
public class RecalculateHandler implements Handler<RoutingContext> {
    private static final Logger log = LoggerFactory.getLogger(RecalculateHandler.class);

    private final RecalculateUseCase recalculateUseCase;

    public RecalculateHandler(RecalculateUseCase recalculateUseCase) {
        this.recalculateUseCase = recalculateUseCase;
    }

    @Override
    public void handle(RoutingContext context) {
        String caseId = context.pathParam("caseId");

        if (caseId == null) {
            recalculateUseCase.recalculateAll()
                    .onSuccess(count -> HttpResponses.ok(context, ApiResponse.success(
                            "Recalculation completed", new JsonObject().put("casesRecalculated", count).getMap())))
                    .onFailure(error -> {
                        log.error("Recalculation failed", error);
                        HttpResponses.sendFailure(context, error);
                    });
            return;
        }

        recalculateUseCase.recalculate(caseId)
                .onSuccess(updated -> HttpResponses.ok(context, ApiResponse.success("Recalculation completed", updated)))
                .onFailure(error -> {
                    log.error("Recalculation of case {} failed", caseId, error);
                    HttpResponses.sendFailure(context, error);
                });
    }
}
