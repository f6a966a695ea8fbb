package com.workflow.payroll_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollResponse {
    private Long id;
    private int month;
    private int year;
    private BigDecimal totalCost;
    private LocalDateTime approvedAt;

    @Builder.Default
    private List<PayrollItemResponse> items = new ArrayList<>();
}
