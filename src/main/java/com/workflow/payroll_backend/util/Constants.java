package com.workflow.payroll_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Money
    public static final int MONEY_SCALE = 2;

    // Payroll period bounds
    public static final int MIN_MONTH = 1;
    public static final int MAX_MONTH = 12;
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    // Messages
    public static final String PAYROLL_APPROVED = "Payroll approved";
    public static final String ERROR_EMPLOYEE_NOT_FOUND_OR_EXITED = "Employee not found or already exited";
}
