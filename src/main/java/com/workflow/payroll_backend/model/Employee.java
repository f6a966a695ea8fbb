package com.workflow.payroll_backend.model;

import com.workflow.payroll_backend.enums.EmployeeStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "employees")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String role;

    private String department;

    // Monthly gross, never negative
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal salary;

    private String bankAccount;

    @Column(nullable = false, length = 16)
    @Builder.Default
    private EmployeeStatus status = EmployeeStatus.ACTIVE;

    private String contractPath;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
