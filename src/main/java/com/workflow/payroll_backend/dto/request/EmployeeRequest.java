package com.workflow.payroll_backend.dto.request;

import com.workflow.payroll_backend.enums.EmployeeStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @Size(max = 255, message = "Role must be at most 255 characters")
    private String role;

    @Size(max = 255, message = "Department must be at most 255 characters")
    private String department;

    @NotNull(message = "Salary is required")
    @DecimalMin(value = "0.0", message = "Salary must not be negative")
    @Digits(integer = 10, fraction = 2, message = "Salary must have at most 10 integer digits and 2 decimals")
    private BigDecimal salary;

    @Size(max = 255, message = "Bank account must be at most 255 characters")
    private String bankAccount;

    // Defaults to active when omitted
    private EmployeeStatus status;

    @Size(max = 255, message = "Contract path must be at most 255 characters")
    private String contractPath;
}
