package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a maternity case. ARCHIVED is terminal.
 */
public enum CaseStatus {
    ACTIVE("active"),
    ARCHIVED("archived");

    private final String value;

    CaseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CaseStatus fromValue(String value) {
        for (CaseStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown case status: " + value);
    }

    public static boolean isValid(String value) {
        for (CaseStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
