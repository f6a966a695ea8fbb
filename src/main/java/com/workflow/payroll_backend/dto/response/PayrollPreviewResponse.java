package com.workflow.payroll_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollPreviewResponse {
    private int month;
    private int year;
    private BigDecimal totalCost;

    @Builder.Default
    private List<PayrollItemResponse> items = new ArrayList<>();
}
