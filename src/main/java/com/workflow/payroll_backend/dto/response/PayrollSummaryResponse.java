package com.workflow.payroll_backend.dto.response;

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
public class PayrollSummaryResponse {
    private Long id;
    private int month;
    private int year;
    private BigDecimal totalCost;
    private LocalDateTime approvedAt;
}
