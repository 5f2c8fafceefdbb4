package com.mpl.domain.model;

/**
 * Outcome of the last company maternity pay calculation on a case.
 * FAILED means the case was stored with zero CMP and needs attention.
 */
public enum CmpStatus {
    CALCULATED,
    NOT_CALCULATED,
    FAILED
}
