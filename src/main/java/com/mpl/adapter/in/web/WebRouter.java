package com.mpl.adapter.in.web;

import com.mpl.adapter.in.web.calendar.CalendarHandler;
import com.mpl.adapter.in.web.maternitycase.MaternityCaseHandler;
import com.mpl.adapter.in.web.period.PeriodHandler;
import com.mpl.adapter.in.web.query.CaseQueryHandler;
import com.mpl.adapter.in.web.recalculate.RecalculateHandler;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for maternity case endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final MaternityCaseHandler caseHandler;
    private final PeriodHandler periodHandler;
    private final RecalculateHandler recalculateHandler;
    private final CaseQueryHandler queryHandler;
    private final CalendarHandler calendarHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, PUT, PATCH, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With")
                    .putHeader("Access-Control-Allow-Credentials", "true");
            ctx.next();
        });

        // Preflight
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Case lifecycle
        router.post("/api/cases").handler(caseHandler::create);
        router.get("/api/cases").handler(queryHandler::listCases);
        router.get("/api/cases/:caseId").handler(queryHandler::getCase);
        router.patch("/api/cases/:caseId").handler(caseHandler::update);
        router.put("/api/cases/:caseId/actual-return").handler(caseHandler::setActualReturn);
        router.post("/api/cases/:caseId/archive").handler(caseHandler::archive);

        // Periods
        router.get("/api/cases/:caseId/periods").handler(queryHandler::periodDetail);
        router.patch("/api/cases/:caseId/periods/:periodId").handler(periodHandler::updateAmounts);
        router.put("/api/cases/:caseId/periods/:periodId/status").handler(periodHandler::setStatus);

        // Recalculation
        router.post("/api/cases/:caseId/recalculate").handler(recalculateHandler);
        router.post("/api/recalculate").handler(recalculateHandler);

        // Projections and calendar checks
        router.get("/api/dashboard").handler(queryHandler::dashboard);
        router.get("/api/calendar/validate-smp-start").handler(calendarHandler::validateSmpStart);
        router.get("/api/system-check").handler(calendarHandler::systemCheck);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"maternity-pay-ledger\"}"));

        // Root endpoint
        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"Maternity Pay Ledger\",\"version\":\"1.0.0\"}"));
    }
}
