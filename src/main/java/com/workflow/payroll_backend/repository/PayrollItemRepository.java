package com.workflow.payroll_backend.repository;

import com.workflow.payroll_backend.model.PayrollItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PayrollItemRepository extends JpaRepository<PayrollItem, Long> {

    long countByPayrollId(Long payrollId);
}
