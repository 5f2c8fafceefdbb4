package com.mpl.application.service;

import com.mpl.application.port.in.MaternityCaseUseCase.CreateCaseCommand;
import com.mpl.application.port.in.MaternityCaseUseCase.UpdateCaseCommand;
import com.mpl.application.port.in.PeriodAmountsUseCase.PeriodAmountsCommand;
import com.mpl.domain.model.MaternityCase;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates case and period input before any mutation
 */
public class CaseValidator {

    public static final int MAX_CMP_WEEKS_ENTITLEMENT = 52;
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999.99");
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    /**
     * Validate a case creation command
     */
    public ValidationResult validate(CreateCaseCommand command) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(command, errors);

        LocalDate babyDue = parseDate("babyDueDate", command.babyDueDate(), errors);
        LocalDate maternityStart = parseDate("maternityStartDate", command.maternityStartDate(), errors);
        LocalDate smpStart = parseDate("smpStartDate", command.smpStartDate(), errors);
        LocalDate expectedReturn = parseDate("expectedReturnDate", command.expectedReturnDate(), errors);
        LocalDate actualReturn = parseDate("actualReturnDate", command.actualReturnDate(), errors);

        validateDateOrder(maternityStart, smpStart, expectedReturn, actualReturn, errors);
        validateAmount("totalSMP", command.totalSMP(), errors);
        validateAmount("averageWeeklyEarnings", command.averageWeeklyEarnings(), errors);
        validateEntitlement(command.cmpWeeksEntitlement(), errors);
        validateBreakdown(command.monthlySMPBreakdown(), command.totalSMP(), errors);

        return ValidationResult.of(errors);
    }

    /**
     * Validate the formats in an update command; ordering is checked on the merged case
     */
    public ValidationResult validate(UpdateCaseCommand command) {
        List<String> errors = new ArrayList<>();

        parseDate("babyDueDate", command.babyDueDate(), errors);
        parseDate("maternityStartDate", command.maternityStartDate(), errors);
        parseDate("smpStartDate", command.smpStartDate(), errors);
        parseDate("expectedReturnDate", command.expectedReturnDate(), errors);
        validateAmount("totalSMP", command.totalSMP(), errors);
        validateAmount("averageWeeklyEarnings", command.averageWeeklyEarnings(), errors);
        validateEntitlement(command.cmpWeeksEntitlement(), errors);

        return ValidationResult.of(errors);
    }

    /**
     * Validate the consistency of a case after updates have been merged in
     */
    public ValidationResult validate(MaternityCase maternityCase) {
        List<String> errors = new ArrayList<>();

        if (maternityCase.getBabyDueDate() == null) {
            errors.add("babyDueDate is required");
        }
        if (maternityCase.getMaternityStartDate() == null) {
            errors.add("maternityStartDate is required");
        }
        if (maternityCase.getSmpStartDate() == null) {
            errors.add("smpStartDate is required");
        }
        if (maternityCase.getExpectedReturnDate() == null) {
            errors.add("expectedReturnDate is required");
        }
        validateDateOrder(maternityCase.getMaternityStartDate(), maternityCase.getSmpStartDate(),
                maternityCase.getExpectedReturnDate(), maternityCase.getActualReturnDate(), errors);
        validateEntitlement(maternityCase.getCmpWeeksEntitlement(), errors);
        validateBreakdown(maternityCase.getMonthlySMPBreakdown(), maternityCase.getTotalSMP(), errors);

        return ValidationResult.of(errors);
    }

    /**
     * Validate a period amounts command
     */
    public ValidationResult validate(PeriodAmountsCommand command) {
        List<String> errors = new ArrayList<>();

        validateAmount("smpAmount", command.smpAmount(), errors);
        validateAmount("companyAmount", command.companyAmount(), errors);
        validateAmount("holidayAccrued", command.holidayAccrued(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validateArchiveReason(String reason) {
        if (isBlank(reason)) {
            return ValidationResult.invalid("archive reason is required");
        }
        return ValidationResult.valid();
    }

    public ValidationResult validateActualReturnDate(String actualReturnDate, MaternityCase maternityCase) {
        List<String> errors = new ArrayList<>();
        if (isBlank(actualReturnDate)) {
            errors.add("actualReturnDate is required");
            return ValidationResult.invalid(errors);
        }
        LocalDate actualReturn = parseDate("actualReturnDate", actualReturnDate, errors);
        if (actualReturn != null && maternityCase.getMaternityStartDate() != null
                && !actualReturn.isAfter(maternityCase.getMaternityStartDate())) {
            errors.add("actualReturnDate must be after maternityStartDate");
        }
        return ValidationResult.of(errors);
    }

    private void validateRequiredFields(CreateCaseCommand command, List<String> errors) {
        if (isBlank(command.employeeId())) {
            errors.add("employeeId is required");
        }
        if (isBlank(command.babyDueDate())) {
            errors.add("babyDueDate is required");
        }
        if (isBlank(command.maternityStartDate())) {
            errors.add("maternityStartDate is required");
        }
        if (isBlank(command.smpStartDate())) {
            errors.add("smpStartDate is required");
        }
        if (isBlank(command.expectedReturnDate())) {
            errors.add("expectedReturnDate is required");
        }
        if (command.totalSMP() == null) {
            errors.add("totalSMP is required");
        }
        if (command.averageWeeklyEarnings() == null) {
            errors.add("averageWeeklyEarnings is required");
        }
    }

    private void validateDateOrder(LocalDate maternityStart, LocalDate smpStart, LocalDate expectedReturn,
                                   LocalDate actualReturn, List<String> errors) {
        if (maternityStart != null && expectedReturn != null && !maternityStart.isBefore(expectedReturn)) {
            errors.add("maternityStartDate must be before expectedReturnDate");
        }
        if (smpStart != null && maternityStart != null && smpStart.isBefore(maternityStart)) {
            errors.add("smpStartDate must not be before maternityStartDate");
        }
        if (smpStart != null && expectedReturn != null && !smpStart.isBefore(expectedReturn)) {
            errors.add("smpStartDate must be before expectedReturnDate");
        }
        if (actualReturn != null && maternityStart != null && !actualReturn.isAfter(maternityStart)) {
            errors.add("actualReturnDate must be after maternityStartDate");
        }
    }

    private void validateAmount(String field, BigDecimal amount, List<String> errors) {
        if (amount == null) {
            return;
        }
        if (amount.signum() < 0) {
            errors.add(field + " must be non-negative");
        }
        if (amount.scale() > 2) {
            errors.add(field + " must have at most 2 decimal places");
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            errors.add(field + " exceeds maximum allowed value");
        }
    }

    private void validateEntitlement(Integer weeks, List<String> errors) {
        if (weeks != null && (weeks < 0 || weeks > MAX_CMP_WEEKS_ENTITLEMENT)) {
            errors.add("cmpWeeksEntitlement must be between 0 and " + MAX_CMP_WEEKS_ENTITLEMENT);
        }
    }

    private void validateBreakdown(Map<String, BigDecimal> breakdown, BigDecimal totalSMP, List<String> errors) {
        if (breakdown == null || breakdown.isEmpty()) {
            return;
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : breakdown.entrySet()) {
            try {
                YearMonth.parse(entry.getKey(), MONTH_KEY);
            } catch (DateTimeParseException | NullPointerException e) {
                errors.add("monthlySMPBreakdown key " + entry.getKey() + " must be in format YYYY-MM");
            }
            if (entry.getValue() == null) {
                errors.add("monthlySMPBreakdown amount for " + entry.getKey() + " is required");
                continue;
            }
            validateAmount("monthlySMPBreakdown[" + entry.getKey() + "]", entry.getValue(), errors);
            sum = sum.add(entry.getValue());
        }

        if (totalSMP != null && sum.compareTo(totalSMP) > 0) {
            errors.add("monthlySMPBreakdown total " + sum + " exceeds totalSMP " + totalSMP);
        }
    }

    private LocalDate parseDate(String field, String value, List<String> errors) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            errors.add(field + " must be in ISO format (YYYY-MM-DD)");
            return null;
        }
    }

    static LocalDate toDate(String value) {
        return isBlank(value) ? null : LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private static boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
