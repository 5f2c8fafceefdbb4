package com.mpl.domain.model;

/**
 * Where an active case sits relative to today
 */
public enum DashboardBucket {
    UPCOMING,
    ON_LEAVE,
    RETURNING,
    OVERDUE,
    RETURNED
}
