package com.mpl.application.port.in;

import com.mpl.domain.model.CaseResult;
import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input port for the case lifecycle: create, update, actual return and archive
 */
public interface MaternityCaseUseCase {

    /**
     * Validate, snapshot the employee, generate periods and calculate CMP.
     * A CMP failure does not block creation; it comes back as a warning.
     */
    Future<CaseResult> createCase(CreateCaseCommand command);

    /**
     * Merge the non-null fields of the command. Key date changes regenerate the periods.
     */
    Future<CaseResult> updateCase(String caseId, UpdateCaseCommand command);

    /**
     * Record the actual return date; periods after it are dropped, entered amounts kept
     */
    Future<CaseResult> setActualReturnDate(String caseId, String actualReturnDate);

    /**
     * Soft-delete; periods are retained for audit
     */
    Future<MaternityCase> archiveCase(String caseId, String reason);

    /**
     * Command object for case creation - dates are ISO yyyy-MM-dd strings
     */
    record CreateCaseCommand(
            String employeeId,
            String babyDueDate,
            String maternityStartDate,
            String smpStartDate,
            String expectedReturnDate,
            String actualReturnDate,
            BigDecimal totalSMP,
            Map<String, BigDecimal> monthlySMPBreakdown,
            BigDecimal averageWeeklyEarnings,
            Integer cmpWeeksEntitlement
    ) {}

    /**
     * Command object for case updates - null means unchanged
     */
    record UpdateCaseCommand(
            String babyDueDate,
            String maternityStartDate,
            String smpStartDate,
            String expectedReturnDate,
            BigDecimal totalSMP,
            Map<String, BigDecimal> monthlySMPBreakdown,
            BigDecimal averageWeeklyEarnings,
            Integer cmpWeeksEntitlement
    ) {}
}
