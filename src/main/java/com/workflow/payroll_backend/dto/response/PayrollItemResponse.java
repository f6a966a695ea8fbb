package com.workflow.payroll_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollItemResponse {
    private Long employeeId;
    private String name;
    private BigDecimal gross;
    private BigDecimal deductions;
    private BigDecimal net;
}
