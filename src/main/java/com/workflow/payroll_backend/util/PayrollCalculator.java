package com.workflow.payroll_backend.util;

import com.workflow.payroll_backend.config.PayrollProperties;
import com.workflow.payroll_backend.dto.response.PayrollItemResponse;
import com.workflow.payroll_backend.model.Employee;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns one employee into one payroll line. Deductions are a flat share of gross,
 * net is gross minus deductions. No I/O; the same employee always yields the same line.
 */
@Component
@RequiredArgsConstructor
public class PayrollCalculator {

    private final PayrollProperties payrollProperties;

    public PayrollItemResponse calculate(Employee employee) {
        BigDecimal gross = employee.getSalary().setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal deductions = gross.multiply(payrollProperties.getDeductionRate())
                .setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal net = gross.subtract(deductions);

        return PayrollItemResponse.builder()
                .employeeId(employee.getId())
                .name(employee.getName())
                .gross(gross)
                .deductions(deductions)
                .net(net)
                .build();
    }
}
