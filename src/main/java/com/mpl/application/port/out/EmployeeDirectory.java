package com.mpl.application.port.out;

import com.mpl.domain.model.EmployeeSnapshot;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for employee master data
 */
public interface EmployeeDirectory {

    /**
     * @param employeeId Employee number
     * @return Future with the employee's current details, empty if unknown
     */
    Future<Optional<EmployeeSnapshot>> lookupByNumber(String employeeId);
}
