package com.mpl.adapter.in.web.maternitycase;

import com.mpl.adapter.in.web.ApiResponse;
import com.mpl.adapter.in.web.HttpResponses;
import com.mpl.application.port.in.MaternityCaseUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handlers for the case lifecycle
 * POST /api/cases, PATCH /api/cases/:caseId, PUT /api/cases/:caseId/actual-return,
 * POST /api/cases/:caseId/archive
 */
@Slf4j
@RequiredArgsConstructor
public class MaternityCaseHandler {

    private final MaternityCaseUseCase caseUseCase;

    public void create(RoutingContext context) {
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        CreateCaseRequest request;
        try {
            request = body.mapTo(CreateCaseRequest.class);
        } catch (IllegalArgumentException e) {
            log.error("Error parsing request body", e);
            HttpResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }
        log.info("Received new case request for employee {}", request.employeeId());

        caseUseCase.createCase(request.toCommand())
                .onSuccess(result -> HttpResponses.send(context, 201, ApiResponse.success(
                        result.hasWarnings() ? "Case created with warnings" : "Case created",
                        result.maternityCase(), result.warnings())))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void update(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        UpdateCaseRequest request;
        try {
            request = body.mapTo(UpdateCaseRequest.class);
        } catch (IllegalArgumentException e) {
            HttpResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        caseUseCase.updateCase(caseId, request.toCommand())
                .onSuccess(result -> HttpResponses.ok(context, ApiResponse.success(
                        "Case updated", result.maternityCase(), result.warnings())))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void setActualReturn(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        caseUseCase.setActualReturnDate(caseId, body.getString("actualReturnDate"))
                .onSuccess(result -> HttpResponses.ok(context, ApiResponse.success(
                        "Actual return date recorded", result.maternityCase(), result.warnings())))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void archive(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        JsonObject body = HttpResponses.requireBody(context);
        if (body == null) {
            return;
        }

        caseUseCase.archiveCase(caseId, body.getString("reason"))
                .onSuccess(archived -> HttpResponses.ok(context, ApiResponse.success("Case archived", archived)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
