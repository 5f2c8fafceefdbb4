package com.mpl.application.service;

import com.mpl.application.port.in.RecalculateUseCase;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.IdentityProvider;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.service.CmpCalculator;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Use case implementation for forced CMP recalculation
 */
public class RecalculateUseCaseImpl implements RecalculateUseCase {
    private static final Logger log = LoggerFactory.getLogger(RecalculateUseCaseImpl.class);

    private final CaseRepository caseRepository;
    private final CaseLedgerService ledgerService;
    private final CmpCalculator cmpCalculator;
    private final IdentityProvider identityProvider;
    private final Clock clock;

    public RecalculateUseCaseImpl(
            CaseRepository caseRepository,
            CaseLedgerService ledgerService,
            CmpCalculator cmpCalculator,
            IdentityProvider identityProvider,
            Clock clock
    ) {
        this.caseRepository = caseRepository;
        this.ledgerService = ledgerService;
        this.cmpCalculator = cmpCalculator;
        this.identityProvider = identityProvider;
        this.clock = clock;
    }

    @Override
    public Future<MaternityCase> recalculate(String caseId) {
        log.info("Manual CMP recalculation requested by {} for case {}", identityProvider.currentUser(), caseId);

        return ledgerService.loadActive(caseId)
                .compose(this::recalculateAndStore)
                .onSuccess(updated -> log.info("Recalculated case {}: CMP {}", caseId, updated.getTotalCMP()))
                .onFailure(error -> log.error("Recalculation of case {} failed", caseId, error));
    }

    @Override
    public Future<Integer> recalculateAll() {
        log.info("Manual CMP recalculation of all active cases requested by {}", identityProvider.currentUser());

        return caseRepository.findAll()
                .compose(cases -> {
                    List<MaternityCase> active = cases.stream().filter(MaternityCase::isActive).toList();
                    log.info("Found {} active case(s) to recalculate", active.size());

                    // One case after the other, stopping at the first failure
                    Future<Void> result = Future.succeededFuture();
                    for (MaternityCase maternityCase : active) {
                        result = result.compose(v -> recalculateAndStore(maternityCase).mapEmpty());
                    }
                    return result.map(active.size());
                })
                .onSuccess(count -> log.info("Recalculated {} case(s)", count))
                .onFailure(error -> log.error("Recalculation of all cases failed", error));
    }

    private Future<MaternityCase> recalculateAndStore(MaternityCase maternityCase) {
        cmpCalculator.recalculate(maternityCase);
        maternityCase.setLastUpdatedBy(identityProvider.currentUser());
        maternityCase.setLastUpdatedAt(LocalDateTime.now(clock));
        return caseRepository.update(maternityCase);
    }
}
