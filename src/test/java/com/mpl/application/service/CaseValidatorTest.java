package com.mpl.application.service;

import com.mpl.application.port.in.MaternityCaseUseCase.CreateCaseCommand;
import com.mpl.application.port.in.MaternityCaseUseCase.UpdateCaseCommand;
import com.mpl.application.port.in.PeriodAmountsUseCase.PeriodAmountsCommand;
import com.mpl.domain.model.MaternityCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CaseValidator
 */
class CaseValidatorTest {

    private CaseValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CaseValidator();
    }

    @Test
    void testValidCreateCommand() {
        ValidationResult result = validator.validate(createCommand("2025-03-03", "2025-03-03", "2025-12-01"));

        assertTrue(result.isValid());
        assertFalse(result.hasErrors());
    }

    @Test
    void testMissingRequiredFields() {
        CreateCaseCommand command = new CreateCaseCommand(
                " ", null, null, null, null, null, null, null, null, null);

        ValidationResult result = validator.validate(command);

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("employeeId is required"));
        assertTrue(result.errors().contains("babyDueDate is required"));
        assertTrue(result.errors().contains("maternityStartDate is required"));
        assertTrue(result.errors().contains("smpStartDate is required"));
        assertTrue(result.errors().contains("expectedReturnDate is required"));
        assertTrue(result.errors().contains("totalSMP is required"));
        assertTrue(result.errors().contains("averageWeeklyEarnings is required"));
    }

    @Test
    void testInvalidDateFormat() {
        ValidationResult result = validator.validate(createCommand("03/03/2025", "2025-03-03", "2025-12-01"));

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("maternityStartDate must be in ISO format (YYYY-MM-DD)"));
    }

    @Test
    void testDateOrdering() {
        ValidationResult returnFirst = validator.validate(createCommand("2025-12-01", "2025-12-01", "2025-03-03"));
        assertTrue(returnFirst.errors().contains("maternityStartDate must be before expectedReturnDate"));
        assertTrue(returnFirst.errors().contains("smpStartDate must be before expectedReturnDate"));

        ValidationResult smpTooEarly = validator.validate(createCommand("2025-03-03", "2025-02-20", "2025-12-01"));
        assertTrue(smpTooEarly.errors().contains("smpStartDate must not be before maternityStartDate"));
    }

    @Test
    void testNegativeAndOverPreciseAmounts() {
        CreateCaseCommand command = new CreateCaseCommand(
                "E1001", "2025-03-10", "2025-03-03", "2025-03-03", "2025-12-01", null,
                new BigDecimal("-1.00"), null, new BigDecimal("300.123"), 8);

        ValidationResult result = validator.validate(command);

        assertTrue(result.errors().contains("totalSMP must be non-negative"));
        assertTrue(result.errors().contains("averageWeeklyEarnings must have at most 2 decimal places"));
    }

    @Test
    void testEntitlementRange() {
        CreateCaseCommand command = new CreateCaseCommand(
                "E1001", "2025-03-10", "2025-03-03", "2025-03-03", "2025-12-01", null,
                new BigDecimal("5000.00"), null, new BigDecimal("300.00"), 53);

        assertTrue(validator.validate(command).errors()
                .contains("cmpWeeksEntitlement must be between 0 and 52"));
    }

    @Test
    void testBreakdownMustNotExceedTotal() {
        Map<String, BigDecimal> breakdown = new TreeMap<>();
        breakdown.put("2025-03", new BigDecimal("3000.00"));
        breakdown.put("2025-04", new BigDecimal("2500.00"));
        CreateCaseCommand command = new CreateCaseCommand(
                "E1001", "2025-03-10", "2025-03-03", "2025-03-03", "2025-12-01", null,
                new BigDecimal("5000.00"), breakdown, new BigDecimal("300.00"), 8);

        ValidationResult result = validator.validate(command);

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("monthlySMPBreakdown total 5500.00 exceeds totalSMP 5000.00"));
    }

    @Test
    void testBreakdownKeyFormat() {
        Map<String, BigDecimal> breakdown = Map.of("March 2025", new BigDecimal("100.00"));
        CreateCaseCommand command = new CreateCaseCommand(
                "E1001", "2025-03-10", "2025-03-03", "2025-03-03", "2025-12-01", null,
                new BigDecimal("5000.00"), breakdown, new BigDecimal("300.00"), 8);

        assertTrue(validator.validate(command).errors()
                .contains("monthlySMPBreakdown key March 2025 must be in format YYYY-MM"));
    }

    @Test
    void testUpdateCommandChecksFormatsOnly() {
        UpdateCaseCommand valid = new UpdateCaseCommand(null, null, "2025-04-01", null, null, null, null, null);
        assertTrue(validator.validate(valid).isValid());

        UpdateCaseCommand invalid = new UpdateCaseCommand(null, null, "next week", null, null, null,
                new BigDecimal("-5"), null);
        ValidationResult result = validator.validate(invalid);
        assertTrue(result.errors().contains("smpStartDate must be in ISO format (YYYY-MM-DD)"));
        assertTrue(result.errors().contains("averageWeeklyEarnings must be non-negative"));
    }

    @Test
    void testMergedCaseOrdering() {
        MaternityCase maternityCase = MaternityCase.builder()
                .babyDueDate(LocalDate.of(2025, 3, 10))
                .maternityStartDate(LocalDate.of(2025, 3, 3))
                .smpStartDate(LocalDate.of(2026, 1, 5))
                .expectedReturnDate(LocalDate.of(2025, 12, 1))
                .build();

        ValidationResult result = validator.validate(maternityCase);

        assertEquals(1, result.errors().size());
        assertEquals("smpStartDate must be before expectedReturnDate", result.errors().get(0));
    }

    @Test
    void testPeriodAmounts() {
        assertTrue(validator.validate(new PeriodAmountsCommand(new BigDecimal("812.33"), null, null,
                "from payslip", null, null, null)).isValid());

        ValidationResult result = validator.validate(new PeriodAmountsCommand(
                null, new BigDecimal("-0.01"), new BigDecimal("1.001"), null, null, null, null));
        assertTrue(result.errors().contains("companyAmount must be non-negative"));
        assertTrue(result.errors().contains("holidayAccrued must have at most 2 decimal places"));
    }

    @Test
    void testArchiveReason() {
        assertTrue(validator.validateArchiveReason("Employee resigned").isValid());
        assertEquals("archive reason is required", validator.validateArchiveReason("  ").errors().get(0));
        assertFalse(validator.validateArchiveReason(null).isValid());
    }

    @Test
    void testActualReturnDate() {
        MaternityCase maternityCase = MaternityCase.builder()
                .maternityStartDate(LocalDate.of(2025, 3, 3))
                .build();

        assertTrue(validator.validateActualReturnDate("2025-09-01", maternityCase).isValid());
        assertTrue(validator.validateActualReturnDate("2025-03-03", maternityCase).errors()
                .contains("actualReturnDate must be after maternityStartDate"));
        assertTrue(validator.validateActualReturnDate(null, maternityCase).errors()
                .contains("actualReturnDate is required"));
    }

    static CreateCaseCommand createCommand(String maternityStart, String smpStart, String expectedReturn) {
        return new CreateCaseCommand(
                "E1001",
                "2025-03-10",
                maternityStart,
                smpStart,
                expectedReturn,
                null,
                new BigDecimal("5000.00"),
                null,
                new BigDecimal("300.00"),
                8
        );
    }
}
