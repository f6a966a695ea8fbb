package com.workflow.payroll_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum EmployeeStatus {
    ACTIVE("active"),
    ON_LEAVE("on_leave"),
    EXITED("exited");

    private final String value;

    EmployeeStatus(String value) {
        this.value = value;
    }

    /**
     * Resolves a stored or submitted status. Only the exact lowercase values are accepted;
     * anything else is rejected rather than defaulted, since the status gates payroll eligibility.
     */
    @JsonCreator
    public static EmployeeStatus fromString(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Employee status must not be empty");
        }

        for (EmployeeStatus status : EmployeeStatus.values()) {
            if (status.value.equals(text)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown employee status: '" + text
                + "'. Expected one of: active, on_leave, exited");
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
