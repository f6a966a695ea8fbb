package com.workflow.payroll_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;

@Entity
@Table(name = "payroll_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "payroll_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Payroll payroll;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "employee_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Employee employee;

    @Column(name = "employee_id", insertable = false, updatable = false)
    private Long employeeId;

    // Name as it was when the run was approved
    @Column(nullable = false, updatable = false)
    private String employeeName;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal gross;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal deductions;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal net;

    public void setEmployee(Employee employee) {
        this.employee = employee;
        if (employee != null) {
            this.employeeId = employee.getId();
        }
    }
}
