package com.workflow.payroll_backend.enums.converter;

import com.workflow.payroll_backend.enums.EmployeeStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class EmployeeStatusConverter implements AttributeConverter<EmployeeStatus, String> {

    @Override
    public String convertToDatabaseColumn(EmployeeStatus status) {
        if (status == null) {
            return EmployeeStatus.ACTIVE.getValue();
        }
        return status.getValue(); // Stored lowercase: active, on_leave, exited
    }

    @Override
    public EmployeeStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return EmployeeStatus.ACTIVE;
        }
        return EmployeeStatus.fromString(dbData);
    }
}
