package com.mpl.application.service;

import com.mpl.application.port.in.CalendarCheckUseCase.SmpStartValidation;
import com.mpl.application.port.in.CalendarCheckUseCase.StaffClassCoverage;
import com.mpl.application.port.in.CalendarCheckUseCase.SystemCheckReport;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.domain.exception.ValidationException;
import com.mpl.domain.model.PayrollPeriod;
import com.mpl.domain.model.StaffClass;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for CalendarCheckUseCaseImpl
 */
class CalendarCheckUseCaseImplTest {

    @Mock
    private PayrollCalendarSource calendarSource;

    private CalendarCheckUseCaseImpl useCase;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        useCase = new CalendarCheckUseCaseImpl(calendarSource, CaseFixtures.CLOCK, 12);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void validateSmpStartDate_shouldReturnMatchingPeriod() {
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(CaseFixtures.hourlyCalendar(2025)));

        Future<SmpStartValidation> future = useCase.validateSmpStartDate("2025-03-24", "Hourly");

        assertTrue(future.succeeded());
        assertTrue(future.result().valid());
        assertEquals(LocalDate.of(2025, 3, 20), future.result().period().getPeriodStart());
    }

    @Test
    void validateSmpStartDate_shouldReportUnresolvedDate() {
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(CaseFixtures.salariedCalendar(2025)));

        Future<SmpStartValidation> future = useCase.validateSmpStartDate("2026-02-02", "Salaried");

        assertTrue(future.succeeded());
        assertFalse(future.result().valid());
        assertNull(future.result().period());
        assertTrue(future.result().message().contains("estimated monthly periods"));
    }

    @Test
    void validateSmpStartDate_shouldRejectBadInput() {
        Future<SmpStartValidation> future = useCase.validateSmpStartDate("24/03/2025", "Contractor");

        assertTrue(future.failed());
        ValidationException error = assertInstanceOf(ValidationException.class, future.cause());
        assertEquals(2, error.getErrors().size());
        verify(calendarSource, never()).loadCalendar();
    }

    @Test
    void systemCheck_shouldPassForCompleteCalendar() {
        List<PayrollPeriod> calendar = new ArrayList<>();
        calendar.addAll(CaseFixtures.salariedCalendar(2025));
        calendar.addAll(CaseFixtures.salariedCalendar(2026));
        calendar.addAll(CaseFixtures.hourlyCalendar(2025));
        calendar.addAll(CaseFixtures.hourlyCalendar(2026));
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(calendar));

        Future<SystemCheckReport> future = useCase.systemCheck();

        assertTrue(future.succeeded());
        SystemCheckReport report = future.result();
        assertTrue(report.healthy(), () -> "unexpected issues: " + report.issues());
        assertEquals(LocalDate.of(2026, 3, 1), report.horizonDate());
        assertEquals(2, report.coverage().size());
        assertEquals(24, report.coverage().get(0).periodCount());
    }

    @Test
    void systemCheck_shouldReportGaps() {
        List<PayrollPeriod> calendar = new ArrayList<>(CaseFixtures.salariedCalendar(2025));
        calendar.add(PayrollPeriod.builder()
                .staffClass(StaffClass.HOURLY)
                .periodStart(LocalDate.of(2026, 2, 20))
                .periodEnd(LocalDate.of(2026, 3, 19))
                .payDate(LocalDate.of(2026, 3, 25))
                .periodName("Mar 2026 Hourly")
                .build());
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(calendar));

        Future<SystemCheckReport> future = useCase.systemCheck();

        assertTrue(future.succeeded());
        SystemCheckReport report = future.result();
        assertFalse(report.healthy());
        assertTrue(report.issues().contains("1 Hourly payroll period(s) have no cutoff date"));
        assertTrue(report.issues().contains(
                "Salaried calendar ends 2025-12-31, before the 12-month horizon 2026-03-01"));

        StaffClassCoverage hourly = report.coverage().get(1);
        assertEquals("Hourly", hourly.staffClass());
        assertEquals(1, hourly.periodsMissingCutoff());
        assertTrue(hourly.coversHorizon());
    }

    @Test
    void systemCheck_shouldReportEmptyCalendar() {
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(List.of()));

        SystemCheckReport report = useCase.systemCheck().result();

        assertFalse(report.healthy());
        assertTrue(report.issues().contains("No Salaried payroll periods loaded"));
        assertTrue(report.issues().contains("No Hourly payroll periods loaded"));
    }
}
