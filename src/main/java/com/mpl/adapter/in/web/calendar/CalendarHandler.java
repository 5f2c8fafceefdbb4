package com.mpl.adapter.in.web.calendar;

import com.mpl.adapter.in.web.ApiResponse;
import com.mpl.adapter.in.web.HttpResponses;
import com.mpl.application.port.in.CalendarCheckUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for payroll calendar checks
 * GET /api/calendar/validate-smp-start?date=&staffClass=, GET /api/system-check
 */
@RequiredArgsConstructor
public class CalendarHandler {

    private final CalendarCheckUseCase calendarUseCase;

    public void validateSmpStart(RoutingContext context) {
        String date = context.queryParams().get("date");
        String staffClass = context.queryParams().get("staffClass");

        calendarUseCase.validateSmpStartDate(date, staffClass)
                .onSuccess(validation -> HttpResponses.ok(context,
                        ApiResponse.success(validation.message(), validation)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    public void systemCheck(RoutingContext context) {
        calendarUseCase.systemCheck()
                .onSuccess(report -> HttpResponses.ok(context, ApiResponse.success(
                        report.healthy() ? "Payroll calendar complete" : "Payroll calendar has issues", report)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
