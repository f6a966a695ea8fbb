package com.workflow.payroll_backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "payroll")
@Validated
@Data
public class PayrollProperties {

    /**
     * Flat share of gross withheld from every line item. A placeholder policy, not a tax table.
     */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal deductionRate = new BigDecimal("0.10");
}
