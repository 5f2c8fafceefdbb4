package com.mpl.adapter.in.web.period;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mpl.application.port.in.PeriodAmountsUseCase.PeriodAmountsCommand;

import java.math.BigDecimal;

/**
 * DTO for amounts entered against one period - absent fields stay unchanged
 */
public record PeriodAmountsRequest(
        BigDecimal smpAmount,
        BigDecimal companyAmount,
        BigDecimal holidayAccrued,
        String smpNotes,
        String companyNotes,
        String holidayNotes,
        String notes
) {
    @JsonCreator
    public PeriodAmountsRequest(
            @JsonProperty("smpAmount") BigDecimal smpAmount,
            @JsonProperty("companyAmount") BigDecimal companyAmount,
            @JsonProperty("holidayAccrued") BigDecimal holidayAccrued,
            @JsonProperty("smpNotes") String smpNotes,
            @JsonProperty("companyNotes") String companyNotes,
            @JsonProperty("holidayNotes") String holidayNotes,
            @JsonProperty("notes") String notes
    ) {
        this.smpAmount = smpAmount;
        this.companyAmount = companyAmount;
        this.holidayAccrued = holidayAccrued;
        this.smpNotes = smpNotes;
        this.companyNotes = companyNotes;
        this.holidayNotes = holidayNotes;
        this.notes = notes;
    }

    public PeriodAmountsCommand toCommand() {
        return new PeriodAmountsCommand(smpAmount, companyAmount, holidayAccrued,
                smpNotes, companyNotes, holidayNotes, notes);
    }
}
