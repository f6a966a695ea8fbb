package com.workflow.payroll_backend.controller;

import com.workflow.payroll_backend.dto.request.EmployeeRequest;
import com.workflow.payroll_backend.dto.request.EmployeeUpdateRequest;
import com.workflow.payroll_backend.dto.response.EmployeeResponse;
import com.workflow.payroll_backend.enums.EmployeeStatus;
import com.workflow.payroll_backend.exception.ResourceNotFoundException;
import com.workflow.payroll_backend.service.EmployeeService;
import com.workflow.payroll_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;

    @GetMapping
    public ResponseEntity<List<EmployeeResponse>> getAllEmployees(
            @RequestParam(required = false) EmployeeStatus status) {

        return ResponseEntity.ok(employeeService.getAllEmployees(status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmployeeResponse> getEmployeeById(@PathVariable Long id) {
        EmployeeResponse employee = employeeService.getEmployeeById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));
        return ResponseEntity.ok(employee);
    }

    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@Valid @RequestBody EmployeeRequest request) {
        EmployeeResponse employee = employeeService.createEmployee(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(employee);
    }

    @PutMapping("/{id}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable Long id,
            @Valid @RequestBody EmployeeUpdateRequest request) {

        EmployeeResponse employee = employeeService.updateEmployee(id, request)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));
        return ResponseEntity.ok(employee);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> terminateEmployee(@PathVariable Long id) {
        if (!employeeService.terminateEmployee(id)) {
            throw new ResourceNotFoundException(Constants.ERROR_EMPLOYEE_NOT_FOUND_OR_EXITED);
        }
        return ResponseEntity.noContent().build();
    }
}
