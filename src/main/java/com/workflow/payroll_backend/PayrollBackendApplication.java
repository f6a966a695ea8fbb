package com.workflow.payroll_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PayrollBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayrollBackendApplication.class, args);
    }
}
