package com.mpl.adapter.in.web.query;

import com.mpl.adapter.in.web.ApiResponse;
import com.mpl.adapter.in.web.HttpResponses;
import com.mpl.application.port.in.CaseQueryUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for read-only projections
 */
@RequiredArgsConstructor
public class CaseQueryHandler {

    private final CaseQueryUseCase queryUseCase;

    public void getCase(RoutingContext context) {
        queryUseCase.getCase(context.pathParam("caseId"))
                .onSuccess(found -> HttpResponses.ok(context, ApiResponse.success("Case found", found)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void listCases(RoutingContext context) {
        boolean includeArchived = Boolean.parseBoolean(context.queryParams().get("includeArchived"));
        queryUseCase.listCases(includeArchived)
                .onSuccess(cases -> HttpResponses.ok(context, ApiResponse.success(cases.size() + " case(s)", cases)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void dashboard(RoutingContext context) {
        queryUseCase.dashboard()
                .onSuccess(dashboard -> HttpResponses.ok(context, ApiResponse.success("Dashboard", dashboard)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void periodDetail(RoutingContext context) {
        queryUseCase.periodDetail(context.pathParam("caseId"))
                .onSuccess(detail -> HttpResponses.ok(context, ApiResponse.success("Period detail", detail)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
