package com.workflow.payroll_backend.dto.response;

import com.workflow.payroll_backend.enums.EmployeeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeResponse {
    private Long id;
    private String name;
    private String role;
    private String department;
    private BigDecimal salary;
    private String bankAccount;
    private EmployeeStatus status;
    private String contractPath;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
