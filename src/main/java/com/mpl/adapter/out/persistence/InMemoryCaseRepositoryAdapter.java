package com.mpl.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.domain.exception.PersistenceException;
import com.mpl.domain.exception.StaleCaseException;
import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory case store. Every read and write goes through a deep copy so callers
 * can never change stored state without a versioned update.
 */
@Slf4j
public class InMemoryCaseRepositoryAdapter implements CaseRepository {

    private final Map<String, MaternityCase> cases = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    public InMemoryCaseRepositoryAdapter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Future<Optional<MaternityCase>> findById(String caseId) {
        try {
            MaternityCase stored = cases.get(caseId);
            return Future.succeededFuture(Optional.ofNullable(stored).map(this::copy));
        } catch (PersistenceException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<List<MaternityCase>> findAll() {
        try {
            List<MaternityCase> all = cases.values().stream()
                    .sorted(Comparator.comparing(MaternityCase::getCaseId))
                    .map(this::copy)
                    .toList();
            return Future.succeededFuture(all);
        } catch (PersistenceException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<MaternityCase> insert(MaternityCase maternityCase) {
        try {
            MaternityCase toStore = copy(maternityCase);
            toStore.setVersion(1L);
            MaternityCase existing = cases.putIfAbsent(toStore.getCaseId(), toStore);
            if (existing != null) {
                return Future.failedFuture(new PersistenceException("Case " + toStore.getCaseId() + " already exists"));
            }
            log.debug("Inserted case {}", toStore.getCaseId());
            return Future.succeededFuture(copy(toStore));
        } catch (PersistenceException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<MaternityCase> update(MaternityCase maternityCase) {
        String caseId = maternityCase.getCaseId();
        long expectedVersion = maternityCase.getVersion();
        try {
            MaternityCase toStore = copy(maternityCase);
            toStore.setVersion(expectedVersion + 1);

            MaternityCase result = cases.computeIfPresent(caseId, (id, current) ->
                    current.getVersion() == expectedVersion ? toStore : current);

            if (result == null) {
                return Future.failedFuture(new PersistenceException("Case " + caseId + " does not exist"));
            }
            if (result != toStore) {
                log.warn("Rejected stale write to case {} at version {} (stored {})",
                        caseId, expectedVersion, result.getVersion());
                return Future.failedFuture(new StaleCaseException(caseId, expectedVersion));
            }
            log.debug("Updated case {} to version {}", caseId, toStore.getVersion());
            return Future.succeededFuture(copy(toStore));
        } catch (PersistenceException e) {
            return Future.failedFuture(e);
        }
    }

    private MaternityCase copy(MaternityCase maternityCase) {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(maternityCase), MaternityCase.class);
        } catch (IOException e) {
            throw new PersistenceException("Could not copy case " + maternityCase.getCaseId(), e);
        }
    }
}
