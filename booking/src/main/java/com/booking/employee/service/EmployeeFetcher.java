package com.booking.employee.service;

import com.booking.employee.domain.Employee;
import com.booking.employee.repository.EmployeeRepository;
import com.booking.shared.error.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EmployeeFetcher {

    public static final String RESOURCE = "employee";

    private final EmployeeRepository employeeRepository;

    public Employee getByKey(String id) {
        return employeeRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    public List<Employee> listByKeys(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return employeeRepository.findAllById(ids);
    }
}
