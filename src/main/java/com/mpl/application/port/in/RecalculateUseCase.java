package com.mpl.application.port.in;

import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;

/**
 * Input port - forced CMP recalculation
 */
public interface RecalculateUseCase {

    /**
     * Recalculate CMP for one case from its stored periods
     * @param caseId Case identifier
     * @return Future with the updated case
     */
    Future<MaternityCase> recalculate(String caseId);

    /**
     * Recalculate every active case one after the other
     * @return Future with the number of cases recalculated
     */
    Future<Integer> recalculateAll();
}
