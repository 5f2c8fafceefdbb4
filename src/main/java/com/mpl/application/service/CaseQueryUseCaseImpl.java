package com.mpl.application.service;

import com.mpl.application.port.in.CaseQueryUseCase;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.domain.model.CmpStatus;
import com.mpl.domain.model.DashboardBucket;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import com.mpl.domain.service.PeriodGenerator;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only projections over stored cases
 */
@Slf4j
@RequiredArgsConstructor
public class CaseQueryUseCaseImpl implements CaseQueryUseCase {

    static final int RETURNING_WINDOW_DAYS = 28;

    private final CaseRepository caseRepository;
    private final CaseLedgerService ledgerService;
    private final Clock clock;

    @Override
    public Future<MaternityCase> getCase(String caseId) {
        return ledgerService.load(caseId);
    }

    @Override
    public Future<List<MaternityCase>> listCases(boolean includeArchived) {
        return caseRepository.findAll()
                .map(cases -> cases.stream()
                        .filter(c -> includeArchived || c.isActive())
                        .sorted(Comparator.comparing(MaternityCase::getMaternityStartDate,
                                Comparator.nullsLast(Comparator.naturalOrder())))
                        .toList());
    }

    @Override
    public Future<Dashboard> dashboard() {
        LocalDate today = LocalDate.now(clock);

        return caseRepository.findAll()
                .map(cases -> {
                    List<DashboardRow> rows = cases.stream()
                            .filter(MaternityCase::isActive)
                            .sorted(Comparator.comparing(MaternityCase::getMaternityStartDate,
                                    Comparator.nullsLast(Comparator.naturalOrder())))
                            .map(c -> toRow(c, today))
                            .toList();

                    Map<DashboardBucket, Long> counts = new EnumMap<>(DashboardBucket.class);
                    for (DashboardBucket bucket : DashboardBucket.values()) {
                        counts.put(bucket, rows.stream().filter(r -> r.bucket() == bucket).count());
                    }

                    log.debug("Dashboard built for {} active case(s) as of {}", rows.size(), today);
                    return new Dashboard(today, rows, counts,
                            sum(rows, DashboardRow::remainingSmp),
                            sum(rows, DashboardRow::remainingCmp));
                });
    }

    @Override
    public Future<PeriodDetail> periodDetail(String caseId) {
        return ledgerService.load(caseId)
                .map(maternityCase -> {
                    Map<String, List<MaternityPeriod>> byMonth = new TreeMap<>();
                    maternityCase.getPeriods().stream()
                            .sorted(Comparator.comparingInt(MaternityPeriod::getPeriodNumber))
                            .forEach(p -> byMonth
                                    .computeIfAbsent(PeriodGenerator.monthKey(p.getPeriodStart()), k -> new ArrayList<>())
                                    .add(p));

                    List<MonthGroup> months = byMonth.entrySet().stream()
                            .map(e -> new MonthGroup(e.getKey(), e.getValue(),
                                    sumPeriods(e.getValue(), MaternityPeriod::getSmpAmount),
                                    sumPeriods(e.getValue(), MaternityPeriod::getCompanyAmount)))
                            .toList();

                    return new PeriodDetail(caseId, months,
                            maternityCase.sumSmpAmounts(),
                            maternityCase.sumCompanyAmounts());
                });
    }

    DashboardBucket bucketFor(MaternityCase maternityCase, LocalDate today) {
        LocalDate actualReturn = maternityCase.getActualReturnDate();
        if (actualReturn != null && !today.isBefore(actualReturn)) {
            return DashboardBucket.RETURNED;
        }
        if (today.isBefore(maternityCase.getMaternityStartDate())) {
            return DashboardBucket.UPCOMING;
        }
        if (actualReturn == null && today.isAfter(maternityCase.getExpectedReturnDate())) {
            return DashboardBucket.OVERDUE;
        }
        LocalDate returnDate = actualReturn != null ? actualReturn : maternityCase.getExpectedReturnDate();
        if (!returnDate.isAfter(today.plusDays(RETURNING_WINDOW_DAYS))) {
            return DashboardBucket.RETURNING;
        }
        return DashboardBucket.ON_LEAVE;
    }

    private DashboardRow toRow(MaternityCase maternityCase, LocalDate today) {
        List<MaternityPeriod> remaining = maternityCase.getPeriods().stream()
                .filter(p -> p.getPayDate() != null && !p.getPayDate().isBefore(today))
                .toList();

        return new DashboardRow(
                maternityCase.getCaseId(),
                maternityCase.getEmployeeId(),
                maternityCase.getEmployee() != null ? maternityCase.getEmployee().getFullName() : null,
                maternityCase.getEmployee() != null ? maternityCase.getEmployee().getLocation() : null,
                maternityCase.getStaffClass() != null ? maternityCase.getStaffClass().getValue() : null,
                bucketFor(maternityCase, today),
                maternityCase.getMaternityStartDate(),
                maternityCase.getExpectedReturnDate(),
                maternityCase.getActualReturnDate(),
                maternityCase.getTotalCMP(),
                sumPeriods(remaining, MaternityPeriod::getSmpAmount),
                sumPeriods(remaining, MaternityPeriod::getCompanyAmount),
                maternityCase.getCmpStatus() == CmpStatus.FAILED || maternityCase.isFallbackPeriods()
        );
    }

    private static BigDecimal sumPeriods(List<MaternityPeriod> periods, Function<MaternityPeriod, BigDecimal> amount) {
        return periods.stream()
                .map(amount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(List<DashboardRow> rows, Function<DashboardRow, BigDecimal> amount) {
        return rows.stream()
                .map(amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
