package com.mpl.adapter.out.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.domain.exception.PersistenceException;
import com.mpl.domain.model.PayrollPeriod;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the payroll calendar from a JSON classpath resource.
 * Every field, cutoffDate included, is carried through as published.
 */
@Slf4j
public class JsonPayrollCalendarAdapter implements PayrollCalendarSource {

    private static final TypeReference<List<PayrollPeriod>> PERIOD_LIST = new TypeReference<>() {};

    private final Future<List<PayrollPeriod>> calendar;

    /**
     * Reads the resource once, at construction. A missing or unreadable resource fails every load.
     */
    public JsonPayrollCalendarAdapter(String resource, ObjectMapper mapper) {
        this.calendar = load(resource, mapper);
    }

    @Override
    public Future<List<PayrollPeriod>> loadCalendar() {
        return calendar;
    }

    private static Future<List<PayrollPeriod>> load(String resource, ObjectMapper mapper) {
        try (InputStream is = JsonPayrollCalendarAdapter.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.error("Payroll calendar {} not found in classpath", resource);
                return Future.failedFuture(new PersistenceException("Payroll calendar " + resource + " not found in classpath"));
            }
            List<PayrollPeriod> loaded = List.copyOf(mapper.readValue(is, PERIOD_LIST));

            long withCutoff = loaded.stream().filter(PayrollPeriod::hasCutoff).count();
            log.info("Loaded {} payroll period(s) from {} ({} with cutoff date)", loaded.size(), resource, withCutoff);
            return Future.succeededFuture(loaded);
        } catch (IOException e) {
            log.error("Failed to read payroll calendar {}: {}", resource, e.getMessage());
            return Future.failedFuture(new PersistenceException("Failed to read payroll calendar " + resource, e));
        }
    }
}
