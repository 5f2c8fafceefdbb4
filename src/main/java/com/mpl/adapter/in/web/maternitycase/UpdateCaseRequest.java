package com.mpl.adapter.in.web.maternitycase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mpl.application.port.in.MaternityCaseUseCase.UpdateCaseCommand;

import java.math.BigDecimal;
import java.util.Map;

/**
 * DTO for a partial case update - absent fields stay unchanged
 */
public record UpdateCaseRequest(
        String babyDueDate,
        String maternityStartDate,
        String smpStartDate,
        String expectedReturnDate,
        BigDecimal totalSMP,
        Map<String, BigDecimal> monthlySMPBreakdown,
        BigDecimal averageWeeklyEarnings,
        Integer cmpWeeksEntitlement
) {
    @JsonCreator
    public UpdateCaseRequest(
            @JsonProperty("babyDueDate") String babyDueDate,
            @JsonProperty("maternityStartDate") String maternityStartDate,
            @JsonProperty("smpStartDate") String smpStartDate,
            @JsonProperty("expectedReturnDate") String expectedReturnDate,
            @JsonProperty("totalSMP") BigDecimal totalSMP,
            @JsonProperty("monthlySMPBreakdown") Map<String, BigDecimal> monthlySMPBreakdown,
            @JsonProperty("averageWeeklyEarnings") BigDecimal averageWeeklyEarnings,
            @JsonProperty("cmpWeeksEntitlement") Integer cmpWeeksEntitlement
    ) {
        this.babyDueDate = babyDueDate;
        this.maternityStartDate = maternityStartDate;
        this.smpStartDate = smpStartDate;
        this.expectedReturnDate = expectedReturnDate;
        this.totalSMP = totalSMP;
        this.monthlySMPBreakdown = monthlySMPBreakdown;
        this.averageWeeklyEarnings = averageWeeklyEarnings;
        this.cmpWeeksEntitlement = cmpWeeksEntitlement;
    }

    public UpdateCaseCommand toCommand() {
        return new UpdateCaseCommand(babyDueDate, maternityStartDate, smpStartDate, expectedReturnDate,
                totalSMP, monthlySMPBreakdown, averageWeeklyEarnings, cmpWeeksEntitlement);
    }
}
