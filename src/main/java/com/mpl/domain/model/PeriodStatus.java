package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Workflow status of a single maternity pay period
 */
public enum PeriodStatus {
    PENDING("pending"),
    AMOUNTS_ENTERED("amounts_entered");

    private final String value;

    PeriodStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PeriodStatus fromValue(String value) {
        for (PeriodStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown period status: " + value);
    }

    public static boolean isValid(String value) {
        for (PeriodStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
