package com.mpl.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.domain.exception.PersistenceException;
import com.mpl.domain.exception.StaleCaseException;
import com.mpl.domain.model.MaternityCase;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of CaseRepository.
 * One row per case: the case is kept as a JSON payload, VERSION guards concurrent writes.
 */
@Slf4j
public class JdbcCaseRepositoryAdapter implements CaseRepository {

    private static final String SELECT_BY_ID =
            "SELECT PAYLOAD, VERSION FROM MATERNITY_CASE WHERE CASE_ID = ?";
    private static final String SELECT_ALL =
            "SELECT PAYLOAD, VERSION FROM MATERNITY_CASE ORDER BY CASE_ID";
    private static final String INSERT =
            "INSERT INTO MATERNITY_CASE (CASE_ID, EMPLOYEE_ID, STATUS, VERSION, PAYLOAD, CREATE_TIME, UPDATE_TIME) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String UPDATE =
            "UPDATE MATERNITY_CASE SET STATUS = ?, VERSION = ?, PAYLOAD = ?, UPDATE_TIME = ? " +
            "WHERE CASE_ID = ? AND VERSION = ?";

    private final SqlClient sqlClient;
    private final ObjectMapper mapper;

    public JdbcCaseRepositoryAdapter(SqlClient sqlClient, ObjectMapper mapper) {
        this.sqlClient = sqlClient;
        this.mapper = mapper;
    }

    @Override
    public Future<Optional<MaternityCase>> findById(String caseId) {
        return sqlClient.preparedQuery(SELECT_BY_ID)
                .execute(Tuple.of(caseId))
                .<Optional<MaternityCase>>map(rows -> {
                    if (rows.size() == 0) {
                        log.debug("No case found for {}", caseId);
                        return Optional.empty();
                    }
                    return Optional.of(fromRow(rows.iterator().next()));
                })
                .recover(error -> Future.failedFuture(persistenceError("Failed to load case " + caseId, error)));
    }

    @Override
    public Future<List<MaternityCase>> findAll() {
        return sqlClient.query(SELECT_ALL)
                .execute()
                .map(rows -> {
                    List<MaternityCase> cases = new ArrayList<>();
                    rows.forEach(row -> cases.add(fromRow(row)));
                    log.debug("Loaded {} case(s)", cases.size());
                    return cases;
                })
                .recover(error -> Future.failedFuture(persistenceError("Failed to load cases", error)));
    }

    @Override
    public Future<MaternityCase> insert(MaternityCase maternityCase) {
        LocalDateTime now = LocalDateTime.now();
        final String payload;
        try {
            maternityCase.setVersion(1L);
            payload = toJson(maternityCase);
        } catch (PersistenceException e) {
            return Future.failedFuture(e);
        }

        Tuple params = Tuple.tuple()
                .addString(maternityCase.getCaseId())
                .addString(maternityCase.getEmployeeId())
                .addString(maternityCase.getStatus().getValue())
                .addLong(1L)
                .addString(payload)
                .addLocalDateTime(now)
                .addLocalDateTime(now);

        return sqlClient.preparedQuery(INSERT)
                .execute(params)
                .map(result -> {
                    log.debug("Inserted case {}", maternityCase.getCaseId());
                    return maternityCase;
                })
                .recover(error -> Future.failedFuture(
                        persistenceError("Failed to insert case " + maternityCase.getCaseId(), error)));
    }

    @Override
    public Future<MaternityCase> update(MaternityCase maternityCase) {
        String caseId = maternityCase.getCaseId();
        long expectedVersion = maternityCase.getVersion();
        long nextVersion = expectedVersion + 1;
        final String payload;
        try {
            maternityCase.setVersion(nextVersion);
            payload = toJson(maternityCase);
        } catch (PersistenceException e) {
            maternityCase.setVersion(expectedVersion);
            return Future.failedFuture(e);
        }

        Tuple params = Tuple.tuple()
                .addString(maternityCase.getStatus().getValue())
                .addLong(nextVersion)
                .addString(payload)
                .addLocalDateTime(LocalDateTime.now())
                .addString(caseId)
                .addLong(expectedVersion);

        return sqlClient.preparedQuery(UPDATE)
                .execute(params)
                .recover(error -> {
                    maternityCase.setVersion(expectedVersion);
                    return Future.failedFuture(persistenceError("Failed to update case " + caseId, error));
                })
                .compose(result -> {
                    if (result.rowCount() == 0) {
                        maternityCase.setVersion(expectedVersion);
                        log.warn("Rejected stale write to case {} at version {}", caseId, expectedVersion);
                        return Future.failedFuture(new StaleCaseException(caseId, expectedVersion));
                    }
                    log.debug("Updated case {} to version {}", caseId, nextVersion);
                    return Future.succeededFuture(maternityCase);
                });
    }

    private MaternityCase fromRow(Row row) {
        try {
            MaternityCase maternityCase = mapper.readValue(row.getString("PAYLOAD"), MaternityCase.class);
            maternityCase.setVersion(row.getLong("VERSION"));
            return maternityCase;
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored case payload is unreadable", e);
        }
    }

    private String toJson(MaternityCase maternityCase) {
        try {
            return mapper.writeValueAsString(maternityCase);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Could not serialize case " + maternityCase.getCaseId(), e);
        }
    }

    private static Throwable persistenceError(String message, Throwable error) {
        if (error instanceof PersistenceException) {
            return error;
        }
        log.error("{}: {}", message, error.getMessage());
        return new PersistenceException(message, error);
    }
}
