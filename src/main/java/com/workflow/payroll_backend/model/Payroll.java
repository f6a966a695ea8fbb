package com.workflow.payroll_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One approved payroll run. The total and the items are a snapshot taken at approval
 * and are never recomputed.
 */
@Entity
@Table(name = "payrolls")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payroll {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private int month;

    @Column(nullable = false, updatable = false)
    private int year;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalCost;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime approvedAt;

    @OneToMany(mappedBy = "payroll", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<PayrollItem> items = new ArrayList<>();

    public void addItem(PayrollItem item) {
        item.setPayroll(this);
        items.add(item);
    }
}
