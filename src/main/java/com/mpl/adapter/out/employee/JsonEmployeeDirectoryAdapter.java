package com.mpl.adapter.out.employee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mpl.application.port.out.EmployeeDirectory;
import com.mpl.domain.exception.PersistenceException;
import com.mpl.domain.model.EmployeeSnapshot;
import com.mpl.domain.model.StaffClass;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Employee directory backed by a JSON classpath resource
 */
@Slf4j
public class JsonEmployeeDirectoryAdapter implements EmployeeDirectory {

    private static final TypeReference<List<DirectoryEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Map<String, DirectoryEntry> entries;

    public JsonEmployeeDirectoryAdapter(String resource, ObjectMapper mapper) {
        this.entries = load(resource, mapper);
    }

    @Override
    public Future<Optional<EmployeeSnapshot>> lookupByNumber(String employeeId) {
        DirectoryEntry entry = entries.get(employeeId);
        if (entry == null) {
            log.debug("Employee {} not in directory", employeeId);
            return Future.succeededFuture(Optional.empty());
        }
        try {
            return Future.succeededFuture(Optional.of(entry.toSnapshot()));
        } catch (IllegalArgumentException e) {
            log.error("Employee {} has an unusable directory record: {}", employeeId, e.getMessage());
            return Future.failedFuture(e);
        }
    }

    private static Map<String, DirectoryEntry> load(String resource, ObjectMapper mapper) {
        try (InputStream is = JsonEmployeeDirectoryAdapter.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new PersistenceException("Employee directory " + resource + " not found in classpath");
            }
            List<DirectoryEntry> list = mapper.readValue(is, ENTRY_LIST);
            log.info("Loaded {} employee(s) from {}", list.size(), resource);
            return list.stream().collect(Collectors.toMap(DirectoryEntry::employeeNumber, Function.identity()));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read employee directory " + resource, e);
        }
    }

    /**
     * Directory record as published - payType is Salary or Hourly
     */
    record DirectoryEntry(
            String employeeNumber,
            String payType,
            BigDecimal salary,
            BigDecimal hourlyRate,
            BigDecimal contractedHours,
            String fullName,
            String location
    ) {
        @JsonCreator
        DirectoryEntry(
                @JsonProperty("employeeNumber") String employeeNumber,
                @JsonProperty("payType") String payType,
                @JsonProperty("salary") BigDecimal salary,
                @JsonProperty("hourlyRate") BigDecimal hourlyRate,
                @JsonProperty("contractedHours") BigDecimal contractedHours,
                @JsonProperty("fullName") String fullName,
                @JsonProperty("location") String location
        ) {
            this.employeeNumber = employeeNumber;
            this.payType = payType;
            this.salary = salary;
            this.hourlyRate = hourlyRate;
            this.contractedHours = contractedHours;
            this.fullName = fullName;
            this.location = location;
        }

        EmployeeSnapshot toSnapshot() {
            return EmployeeSnapshot.builder()
                    .employeeId(employeeNumber)
                    .fullName(fullName)
                    .location(location)
                    .staffClass(StaffClass.fromPayType(payType))
                    .annualSalary(salary)
                    .hourlyRate(hourlyRate)
                    .contractedHours(contractedHours)
                    .build();
        }
    }
}
