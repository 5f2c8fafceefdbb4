package com.mpl.application.port.out;

import com.mpl.domain.model.PayrollPeriod;
import io.vertx.core.Future;

import java.util.List;

/**
 * Output port for the payroll calendar. Loaders must keep cutoffDate verbatim.
 */
public interface PayrollCalendarSource {

    Future<List<PayrollPeriod>> loadCalendar();
}
