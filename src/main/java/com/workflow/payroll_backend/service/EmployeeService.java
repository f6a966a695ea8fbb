package com.workflow.payroll_backend.service;

import com.workflow.payroll_backend.dto.request.EmployeeRequest;
import com.workflow.payroll_backend.dto.request.EmployeeUpdateRequest;
import com.workflow.payroll_backend.dto.response.EmployeeResponse;
import com.workflow.payroll_backend.enums.EmployeeStatus;
import com.workflow.payroll_backend.model.Employee;
import com.workflow.payroll_backend.repository.EmployeeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<EmployeeResponse> getAllEmployees(EmployeeStatus status) {
        List<Employee> employees = status == null
                ? employeeRepository.findAllByOrderByIdAsc()
                : employeeRepository.findByStatusOrderByIdAsc(status);

        return employees.stream()
                .map(this::mapToEmployeeResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Optional<EmployeeResponse> getEmployeeById(Long id) {
        return employeeRepository.findById(id).map(this::mapToEmployeeResponse);
    }

    @Transactional
    public EmployeeResponse createEmployee(EmployeeRequest request) {
        Employee employee = Employee.builder()
                .name(request.getName().trim())
                .role(request.getRole())
                .department(request.getDepartment())
                .salary(request.getSalary())
                .bankAccount(request.getBankAccount())
                .status(request.getStatus() != null ? request.getStatus() : EmployeeStatus.ACTIVE)
                .contractPath(request.getContractPath())
                .build();

        Employee savedEmployee = employeeRepository.save(employee);
        log.info("Employee created with ID: {}", savedEmployee.getId());

        return mapToEmployeeResponse(savedEmployee);
    }

    /**
     * Merges the supplied fields onto the stored employee. The row stays locked from the read
     * until commit, so two concurrent updates are applied one after the other.
     *
     * @return the merged employee, or empty if no employee has this id
     */
    @Transactional
    public Optional<EmployeeResponse> updateEmployee(Long id, EmployeeUpdateRequest request) {
        Optional<Employee> current = employeeRepository.findByIdForUpdate(id);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        Employee employee = current.get();
        modelMapper.map(request, employee);
        if (request.getName() != null) {
            employee.setName(request.getName().trim());
        }

        Employee updatedEmployee = employeeRepository.saveAndFlush(employee);
        log.info("Employee updated with ID: {}", id);

        return Optional.of(mapToEmployeeResponse(updatedEmployee));
    }

    /**
     * Moves the employee to {@code exited}. The history of approved runs is left as it is.
     *
     * @return false if the employee does not exist or has already exited
     */
    @Transactional
    public boolean terminateEmployee(Long id) {
        boolean terminated = employeeRepository.updateStatusUnlessAlready(
                id, EmployeeStatus.EXITED, LocalDateTime.now()) > 0;
        if (terminated) {
            log.info("Employee terminated with ID: {}", id);
        } else {
            log.info("Employee {} not terminated: unknown or already exited", id);
        }
        return terminated;
    }

    private EmployeeResponse mapToEmployeeResponse(Employee employee) {
        return modelMapper.map(employee, EmployeeResponse.class);
    }
}
