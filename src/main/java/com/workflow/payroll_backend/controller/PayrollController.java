package com.workflow.payroll_backend.controller;

import com.workflow.payroll_backend.dto.response.PayrollApprovalResponse;
import com.workflow.payroll_backend.dto.response.PayrollPreviewResponse;
import com.workflow.payroll_backend.dto.response.PayrollResponse;
import com.workflow.payroll_backend.dto.response.PayrollSummaryResponse;
import com.workflow.payroll_backend.exception.ResourceNotFoundException;
import com.workflow.payroll_backend.service.PayrollService;
import com.workflow.payroll_backend.util.Constants;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class PayrollController {

    private final PayrollService payrollService;

    @GetMapping("/payroll/preview")
    public ResponseEntity<PayrollPreviewResponse> previewPayroll(
            @RequestParam @Min(value = Constants.MIN_MONTH, message = "Month must be between 1 and 12")
            @Max(value = Constants.MAX_MONTH, message = "Month must be between 1 and 12") int month,
            @RequestParam @Min(value = Constants.MIN_YEAR, message = "Year must be between 1 and 9999")
            @Max(value = Constants.MAX_YEAR, message = "Year must be between 1 and 9999") int year) {

        return ResponseEntity.ok(payrollService.previewPayroll(month, year));
    }

    @PostMapping("/payroll/approve")
    public ResponseEntity<PayrollApprovalResponse> approvePayroll(
            @RequestParam @Min(value = Constants.MIN_MONTH, message = "Month must be between 1 and 12")
            @Max(value = Constants.MAX_MONTH, message = "Month must be between 1 and 12") int month,
            @RequestParam @Min(value = Constants.MIN_YEAR, message = "Year must be between 1 and 9999")
            @Max(value = Constants.MAX_YEAR, message = "Year must be between 1 and 9999") int year) {

        Long payrollId = payrollService.approvePayroll(month, year);
        return ResponseEntity.ok(PayrollApprovalResponse.builder()
                .payrollId(payrollId)
                .message(Constants.PAYROLL_APPROVED)
                .build());
    }

    @GetMapping("/payrolls")
    public ResponseEntity<List<PayrollSummaryResponse>> getAllPayrolls() {
        return ResponseEntity.ok(payrollService.getAllPayrolls());
    }

    @GetMapping("/payrolls/{id}")
    public ResponseEntity<PayrollResponse> getPayrollById(@PathVariable Long id) {
        PayrollResponse payroll = payrollService.getPayrollById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Payroll", "id", id));
        return ResponseEntity.ok(payroll);
    }
}
