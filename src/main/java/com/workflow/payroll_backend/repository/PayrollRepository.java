package com.workflow.payroll_backend.repository;

import com.workflow.payroll_backend.model.Payroll;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollRepository extends JpaRepository<Payroll, Long> {

    // Most recent period first; runs for the same period keep approval order
    List<Payroll> findAllByOrderByYearDescMonthDescIdAsc();

    @EntityGraph(attributePaths = "items")
    Optional<Payroll> findWithItemsById(Long id);
}
