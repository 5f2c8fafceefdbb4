package com.mpl.application.port.in;

import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Input port for per-period edits made by payroll staff
 */
public interface PeriodAmountsUseCase {

    /**
     * Apply the non-null fields; an SMP change recalculates CMP across the whole case
     */
    Future<MaternityCase> updatePeriodAmounts(String caseId, String periodId, PeriodAmountsCommand command);

    /**
     * Override the workflow status of a period (pending / amounts_entered)
     */
    Future<MaternityCase> setPeriodStatus(String caseId, String periodId, String status);

    record PeriodAmountsCommand(
            BigDecimal smpAmount,
            BigDecimal companyAmount,
            BigDecimal holidayAccrued,
            String smpNotes,
            String companyNotes,
            String holidayNotes,
            String notes
    ) {}
}
