package com.mpl.application.service;

import com.mpl.application.port.in.MaternityCaseUseCase.CreateCaseCommand;
import com.mpl.application.port.in.MaternityCaseUseCase.UpdateCaseCommand;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.EmployeeDirectory;
import com.mpl.application.port.out.IdentityProvider;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.domain.exception.CalculationException;
import com.mpl.domain.exception.NotFoundException;
import com.mpl.domain.exception.StaleCaseException;
import com.mpl.domain.exception.ValidationException;
import com.mpl.domain.model.CaseResult;
import com.mpl.domain.model.CaseStatus;
import com.mpl.domain.model.CaseWarning;
import com.mpl.domain.model.CmpAllocation;
import com.mpl.domain.model.CmpStatus;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import com.mpl.domain.model.PeriodStatus;
import com.mpl.domain.service.CmpCalculator;
import com.mpl.domain.service.PeriodGenerator;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit test for MaternityCaseUseCaseImpl
 * Repository, directory and calendar are mocked; period generation and CMP run for real
 */
class MaternityCaseUseCaseImplTest {

    @Mock
    private CaseRepository caseRepository;

    @Mock
    private EmployeeDirectory employeeDirectory;

    @Mock
    private IdentityProvider identityProvider;

    @Mock
    private PayrollCalendarSource calendarSource;

    private CmpCalculator cmpCalculator;
    private MaternityCaseUseCaseImpl useCase;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        cmpCalculator = spy(new CmpCalculator());
        CaseLedgerService ledgerService = new CaseLedgerService(caseRepository, calendarSource, new PeriodGenerator());
        useCase = new MaternityCaseUseCaseImpl(new CaseValidator(), caseRepository, employeeDirectory,
                identityProvider, ledgerService, cmpCalculator, CaseFixtures.CLOCK, 8);

        when(identityProvider.currentUser()).thenReturn(CaseFixtures.USER);
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(concat(
                CaseFixtures.salariedCalendar(2025), CaseFixtures.hourlyCalendar(2025))));
        when(employeeDirectory.lookupByNumber("E1001"))
                .thenReturn(Future.succeededFuture(Optional.of(CaseFixtures.salariedEmployee())));
        when(employeeDirectory.lookupByNumber("E2001"))
                .thenReturn(Future.succeededFuture(Optional.of(CaseFixtures.hourlyEmployee())));
        when(employeeDirectory.lookupByNumber("E404")).thenReturn(Future.succeededFuture(Optional.empty()));
        when(caseRepository.insert(any())).thenAnswer(inv -> {
            MaternityCase inserted = inv.getArgument(0);
            inserted.setVersion(1L);
            return Future.succeededFuture(inserted);
        });
        when(caseRepository.update(any())).thenAnswer(inv -> {
            MaternityCase updated = inv.getArgument(0);
            updated.setVersion(updated.getVersion() + 1);
            return Future.succeededFuture(updated);
        });
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void createCase_shouldGeneratePeriodsSeedSmpAndCalculateCmp() {
        Future<CaseResult> future = useCase.createCase(createCommand("E1001", "2025-03-03", breakdown()));

        assertTrue(future.succeeded());
        CaseResult result = future.result();
        assertFalse(result.hasWarnings());

        MaternityCase created = result.maternityCase();
        assertTrue(created.getCaseId().startsWith("MAT-"));
        assertEquals(CaseStatus.ACTIVE, created.getStatus());
        assertEquals(CaseFixtures.USER, created.getCreatedBy());
        assertEquals(8, created.getCmpWeeksEntitlement());
        assertEquals(new BigDecimal("500.00"), created.getContractedWeeklyEarnings());
        assertEquals(new BigDecimal("500.00"), created.getTargetWeeklyAmount());

        List<MaternityPeriod> periods = created.getPeriods();
        assertEquals(4, periods.size());
        assertEquals(created.getCaseId() + "_P1", periods.get(0).getPeriodId());
        assertEquals(new BigDecimal("1000.00"), periods.get(0).getSmpAmount());
        assertEquals(new BigDecimal("800.00"), periods.get(1).getSmpAmount());

        // March: 5 weeks * 500 - 1000; April: remaining 3 weeks * 500 - 800
        assertEquals(new BigDecimal("1500.00"), periods.get(0).getCompanyAmount());
        assertEquals(new BigDecimal("700.00"), periods.get(1).getCompanyAmount());
        assertEquals(CmpAllocation.BEYOND_ENTITLEMENT, periods.get(2).getCmpAllocation());
        assertEquals(new BigDecimal("2200.00"), created.getTotalCMP());
        assertEquals(8, created.getCmpWeeksConsumed());
        assertEquals(CmpStatus.CALCULATED, created.getCmpStatus());
        verify(caseRepository, times(1)).insert(any());
    }

    @Test
    void createCase_shouldAlignHourlyStaffOnCutoff() {
        Future<CaseResult> future = useCase.createCase(createCommand("E2001", "2025-03-20", null));

        assertTrue(future.succeeded());
        MaternityCase created = future.result().maternityCase();
        assertEquals(LocalDate.of(2025, 3, 20), created.getPeriods().get(0).getPeriodStart());
        assertEquals(new BigDecimal("250.00"), created.getContractedWeeklyEarnings());
        assertEquals(new BigDecimal("300.00"), created.getTargetWeeklyAmount());
    }

    @Test
    void createCase_shouldRejectInvalidInput() {
        CreateCaseCommand command = new CreateCaseCommand("E1001", "2025-03-10", "2025-03-03", "2025-03-03",
                "2025-03-01", null, new BigDecimal("5000.00"), null, new BigDecimal("300.00"), null);

        Future<CaseResult> future = useCase.createCase(command);

        assertTrue(future.failed());
        assertInstanceOf(ValidationException.class, future.cause());
        verify(employeeDirectory, never()).lookupByNumber(any());
        verify(caseRepository, never()).insert(any());
    }

    @Test
    void createCase_shouldFailForUnknownEmployee() {
        Future<CaseResult> future = useCase.createCase(createCommand("E404", "2025-03-03", null));

        assertTrue(future.failed());
        assertInstanceOf(NotFoundException.class, future.cause());
        verify(caseRepository, never()).insert(any());
    }

    @Test
    void createCase_shouldKeepCaseWhenCmpFails() {
        doThrow(new CalculationException("engine exploded")).when(cmpCalculator).recalculate(any());

        Future<CaseResult> future = useCase.createCase(createCommand("E1001", "2025-03-03", breakdown()));

        assertTrue(future.succeeded());
        CaseResult result = future.result();
        assertTrue(result.hasWarning(CaseWarning.CMP_CALCULATION_FAILED));
        MaternityCase created = result.maternityCase();
        assertEquals(CmpStatus.FAILED, created.getCmpStatus());
        assertEquals(new BigDecimal("0.00"), created.getTotalCMP());
        assertEquals(4, created.getPeriods().size());
        verify(caseRepository, times(1)).insert(any());
    }

    @Test
    void createCase_shouldWarnWhenFallingBackToEstimatedPeriods() {
        when(calendarSource.loadCalendar()).thenReturn(Future.succeededFuture(List.of()));

        Future<CaseResult> future = useCase.createCase(createCommand("E1001", "2025-03-03", null));

        assertTrue(future.succeeded());
        assertTrue(future.result().hasWarning(CaseWarning.FALLBACK_PERIODS));
        assertTrue(future.result().maternityCase().isFallbackPeriods());
        assertTrue(future.result().maternityCase().getPeriods().get(0).getPeriodName().endsWith("(estimated)"));
    }

    @Test
    void updateCase_shouldRegeneratePeriodsWhenDatesChange() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        UpdateCaseCommand command = new UpdateCaseCommand(null, null, null, "2025-08-01", null, null, null, null);
        Future<CaseResult> future = useCase.updateCase("MAT-1", command);

        assertTrue(future.succeeded());
        MaternityCase updated = future.result().maternityCase();
        assertEquals(LocalDate.of(2025, 8, 1), updated.getExpectedReturnDate());
        assertEquals(6, updated.getPeriods().size());
        assertEquals(CmpStatus.CALCULATED, updated.getCmpStatus());
        assertEquals(2L, updated.getVersion());
        verify(calendarSource, times(1)).loadCalendar();
    }

    @Test
    void updateCase_shouldSkipCmpWhenAverageEarningsIsZero() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        stored.setAverageWeeklyEarnings(BigDecimal.ZERO);
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        UpdateCaseCommand command = new UpdateCaseCommand(null, null, "2025-03-10", null, null, null, null, null);
        Future<CaseResult> future = useCase.updateCase("MAT-1", command);

        assertTrue(future.succeeded());
        assertTrue(future.result().hasWarning(CaseWarning.CMP_NOT_CALCULATED));
        assertEquals(CmpStatus.NOT_CALCULATED, future.result().maternityCase().getCmpStatus());
        verify(cmpCalculator, never()).recalculate(any());
    }

    @Test
    void updateCase_shouldRecalculateWhenOnlyEarningsChange() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        UpdateCaseCommand command = new UpdateCaseCommand(null, null, null, null, null, null,
                new BigDecimal("650.00"), null);
        Future<CaseResult> future = useCase.updateCase("MAT-1", command);

        assertTrue(future.succeeded());
        assertEquals(new BigDecimal("650.00"), future.result().maternityCase().getTargetWeeklyAmount());
        verify(cmpCalculator, times(1)).recalculate(any());
        verify(calendarSource, never()).loadCalendar();
    }

    @Test
    void updateCase_shouldReseedPendingPeriodsWhenOnlyBreakdownChanges() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        MaternityPeriod march = MaternityPeriod.skeleton("MAT-1", 1, LocalDate.of(2025, 3, 1),
                LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 28), "MARCH 2025");
        march.setSmpAmount(new BigDecimal("1000.00"));
        march.amountsEntered();
        MaternityPeriod april = MaternityPeriod.skeleton("MAT-1", 2, LocalDate.of(2025, 4, 1),
                LocalDate.of(2025, 4, 30), LocalDate.of(2025, 4, 28), "APRIL 2025");
        stored.setPeriods(new ArrayList<>(List.of(march, april)));
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Map<String, BigDecimal> revised = new TreeMap<>();
        revised.put("2025-03", new BigDecimal("1200.00"));
        revised.put("2025-04", new BigDecimal("800.00"));
        Future<CaseResult> future = useCase.updateCase("MAT-1",
                new UpdateCaseCommand(null, null, null, null, null, revised, null, null));

        assertTrue(future.succeeded());
        MaternityCase updated = future.result().maternityCase();
        assertEquals(revised, updated.getMonthlySMPBreakdown());
        // March was already entered by hand, April was still pending
        assertEquals(new BigDecimal("1000.00"), updated.getPeriods().get(0).getSmpAmount());
        assertEquals(new BigDecimal("800.00"), updated.getPeriods().get(1).getSmpAmount());
        assertEquals(PeriodStatus.AMOUNTS_ENTERED, updated.getPeriods().get(1).getStatus());
        assertEquals(new BigDecimal("1500.00"), updated.getPeriods().get(0).getCompanyAmount());
        assertEquals(new BigDecimal("700.00"), updated.getPeriods().get(1).getCompanyAmount());
        assertEquals(new BigDecimal("2200.00"), updated.getTotalCMP());
        verify(cmpCalculator, times(1)).recalculate(any());
        verify(calendarSource, never()).loadCalendar();
    }

    @Test
    void updateCase_shouldNotReseedWhenBreakdownIsUnchanged() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        stored.setMonthlySMPBreakdown(new TreeMap<>(Map.of("2025-03", new BigDecimal("1000.00"))));
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<CaseResult> future = useCase.updateCase("MAT-1", new UpdateCaseCommand(null, null, null, null, null,
                Map.of("2025-03", new BigDecimal("1000.0")), null, null));

        assertTrue(future.succeeded());
        verify(cmpCalculator, never()).recalculate(any());
    }

    @Test
    void updateCase_shouldRejectInconsistentMergedDates() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        UpdateCaseCommand command = new UpdateCaseCommand(null, null, "2025-07-01", null, null, null, null, null);
        Future<CaseResult> future = useCase.updateCase("MAT-1", command);

        assertTrue(future.failed());
        ValidationException error = assertInstanceOf(ValidationException.class, future.cause());
        assertTrue(error.getErrors().contains("smpStartDate must be before expectedReturnDate"));
        verify(caseRepository, never()).update(any());
    }

    @Test
    void updateCase_shouldRejectArchivedCase() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        stored.setStatus(CaseStatus.ARCHIVED);
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<CaseResult> future = useCase.updateCase("MAT-1",
                new UpdateCaseCommand(null, null, null, "2025-08-01", null, null, null, null));

        assertTrue(future.failed());
        assertInstanceOf(IllegalStateException.class, future.cause());
        verify(caseRepository, never()).update(any());
    }

    @Test
    void updateCase_shouldSurfaceStaleWrites() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));
        when(caseRepository.update(any())).thenReturn(Future.failedFuture(new StaleCaseException("MAT-1", 1L)));

        Future<CaseResult> future = useCase.updateCase("MAT-1",
                new UpdateCaseCommand(null, null, null, null, new BigDecimal("5100.00"), null, null, null));

        assertTrue(future.failed());
        assertInstanceOf(StaleCaseException.class, future.cause());
    }

    @Test
    void setActualReturnDate_shouldShortenLedgerAndKeepEnteredAmounts() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        MaternityPeriod march = MaternityPeriod.skeleton("MAT-1", 1, LocalDate.of(2025, 3, 1),
                LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 28), "MARCH 2025");
        march.setSmpAmount(new BigDecimal("1000.00"));
        march.setSmpNotes("from payslip");
        march.setEnteredBy("someone");
        march.amountsEntered();
        stored.setPeriods(new ArrayList<>(List.of(march)));
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<CaseResult> future = useCase.setActualReturnDate("MAT-1", "2025-04-15");

        assertTrue(future.succeeded());
        MaternityCase updated = future.result().maternityCase();
        assertEquals(LocalDate.of(2025, 4, 15), updated.getActualReturnDate());
        assertEquals(2, updated.getPeriods().size());
        MaternityPeriod carried = updated.getPeriods().get(0);
        assertEquals(new BigDecimal("1000.00"), carried.getSmpAmount());
        assertEquals("from payslip", carried.getSmpNotes());
        assertEquals(new BigDecimal("1500.00"), carried.getCompanyAmount());
        assertEquals(new BigDecimal("1500.00"), updated.getTotalCMP());
    }

    @Test
    void setActualReturnDate_shouldKeepExplicitStatusWhenCmpIsCleared() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        stored.setAverageWeeklyEarnings(BigDecimal.ZERO);
        MaternityPeriod march = MaternityPeriod.skeleton("MAT-1", 1, LocalDate.of(2025, 3, 1),
                LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 28), "MARCH 2025");
        march.setSmpAmount(new BigDecimal("1000.00"));
        march.setEnteredBy("someone");
        march.amountsEntered();
        march.setStatus(PeriodStatus.PENDING);
        stored.setPeriods(new ArrayList<>(List.of(march)));
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<CaseResult> future = useCase.setActualReturnDate("MAT-1", "2025-04-15");

        assertTrue(future.succeeded());
        MaternityCase updated = future.result().maternityCase();
        assertEquals(CmpStatus.NOT_CALCULATED, updated.getCmpStatus());
        MaternityPeriod carried = updated.getPeriods().get(0);
        assertTrue(carried.isDataComplete());
        assertEquals(PeriodStatus.PENDING, carried.getStatus());
        assertEquals(PeriodStatus.PENDING, updated.getPeriods().get(1).getStatus());
    }

    @Test
    void setActualReturnDate_shouldRejectDateBeforeLeave() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<CaseResult> future = useCase.setActualReturnDate("MAT-1", "2025-02-01");

        assertTrue(future.failed());
        assertInstanceOf(ValidationException.class, future.cause());
    }

    @Test
    void archiveCase_shouldStampArchiveMetadata() {
        MaternityCase stored = CaseFixtures.activeCase("MAT-1");
        when(caseRepository.findById("MAT-1")).thenReturn(Future.succeededFuture(Optional.of(stored)));

        Future<MaternityCase> future = useCase.archiveCase("MAT-1", "  Employee resigned ");

        assertTrue(future.succeeded());
        MaternityCase archived = future.result();
        assertEquals(CaseStatus.ARCHIVED, archived.getStatus());
        assertEquals("Employee resigned", archived.getArchiveReason());
        assertEquals(CaseFixtures.USER, archived.getArchivedBy());
        assertNotNull(archived.getArchivedAt());
    }

    @Test
    void archiveCase_shouldRequireReason() {
        Future<MaternityCase> future = useCase.archiveCase("MAT-1", "");

        assertTrue(future.failed());
        assertInstanceOf(ValidationException.class, future.cause());
        verify(caseRepository, never()).findById(any());
    }

    @Test
    void archiveCase_shouldFailForUnknownCase() {
        when(caseRepository.findById("MAT-X")).thenReturn(Future.succeededFuture(Optional.empty()));

        Future<MaternityCase> future = useCase.archiveCase("MAT-X", "duplicate");

        assertTrue(future.failed());
        assertInstanceOf(NotFoundException.class, future.cause());
    }

    private static CreateCaseCommand createCommand(String employeeId, String smpStart,
                                                   Map<String, BigDecimal> breakdown) {
        return new CreateCaseCommand(employeeId, "2025-03-10", "2025-03-03", smpStart, "2025-06-01", null,
                new BigDecimal("5000.00"), breakdown, new BigDecimal("300.00"), null);
    }

    private static Map<String, BigDecimal> breakdown() {
        Map<String, BigDecimal> breakdown = new TreeMap<>();
        breakdown.put("2025-03", new BigDecimal("1000.00"));
        breakdown.put("2025-04", new BigDecimal("800.00"));
        return breakdown;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
