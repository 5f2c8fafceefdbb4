package com.mpl.adapter.in.web.maternitycase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mpl.application.port.in.MaternityCaseUseCase.CreateCaseCommand;

import java.math.BigDecimal;
import java.util.Map;

/**
 * DTO for a new maternity case entered by payroll staff
 */
public record CreateCaseRequest(
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
) {
    @JsonCreator
    public CreateCaseRequest(
            @JsonProperty("employeeId") String employeeId,
            @JsonProperty("babyDueDate") String babyDueDate,
            @JsonProperty("maternityStartDate") String maternityStartDate,
            @JsonProperty("smpStartDate") String smpStartDate,
            @JsonProperty("expectedReturnDate") String expectedReturnDate,
            @JsonProperty("actualReturnDate") String actualReturnDate,
            @JsonProperty("totalSMP") BigDecimal totalSMP,
            @JsonProperty("monthlySMPBreakdown") Map<String, BigDecimal> monthlySMPBreakdown,
            @JsonProperty("averageWeeklyEarnings") BigDecimal averageWeeklyEarnings,
            @JsonProperty("cmpWeeksEntitlement") Integer cmpWeeksEntitlement
    ) {
        this.employeeId = employeeId;
        this.babyDueDate = babyDueDate;
        this.maternityStartDate = maternityStartDate;
        this.smpStartDate = smpStartDate;
        this.expectedReturnDate = expectedReturnDate;
        this.actualReturnDate = actualReturnDate;
        this.totalSMP = totalSMP;
        this.monthlySMPBreakdown = monthlySMPBreakdown;
        this.averageWeeklyEarnings = averageWeeklyEarnings;
        this.cmpWeeksEntitlement = cmpWeeksEntitlement;
    }

    public CreateCaseCommand toCommand() {
        return new CreateCaseCommand(employeeId, babyDueDate, maternityStartDate, smpStartDate,
                expectedReturnDate, actualReturnDate, totalSMP, monthlySMPBreakdown,
                averageWeeklyEarnings, cmpWeeksEntitlement);
    }
}
