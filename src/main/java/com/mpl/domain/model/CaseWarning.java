package com.mpl.domain.model;

/**
 * Non-blocking problem raised while processing a case
 */
public record CaseWarning(String code, String message) {

    public static final String CMP_CALCULATION_FAILED = "CMP_CALCULATION_FAILED";
    public static final String CMP_NOT_CALCULATED = "CMP_NOT_CALCULATED";
    public static final String FALLBACK_PERIODS = "FALLBACK_PERIODS";

    public static CaseWarning of(String code, String message) {
        return new CaseWarning(code, message);
    }
}
