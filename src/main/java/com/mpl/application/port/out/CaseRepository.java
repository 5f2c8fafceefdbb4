package com.mpl.application.port.out;

import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Output port - keyed store of maternity cases with optimistic concurrency.
 * Implementations hand out copies; mutating a returned case never touches the store.
 */
public interface CaseRepository {

    /**
     * @param caseId Case identifier
     * @return Future with the case, empty if unknown
     */
    Future<Optional<MaternityCase>> findById(String caseId);

    /**
     * @return Future with every stored case, archived included
     */
    Future<List<MaternityCase>> findAll();

    /**
     * Store a new case at version 1
     * @return Future with the stored copy
     */
    Future<MaternityCase> insert(MaternityCase maternityCase);

    /**
     * Replace a case if its stored version still equals maternityCase.getVersion().
     * Fails with StaleCaseException otherwise.
     * @return Future with the stored copy carrying the incremented version
     */
    Future<MaternityCase> update(MaternityCase maternityCase);
}
