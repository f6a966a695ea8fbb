package com.workflow.payroll_backend.repository;

import com.workflow.payroll_backend.enums.EmployeeStatus;
import com.workflow.payroll_backend.model.Employee;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    List<Employee> findAllByOrderByIdAsc();

    List<Employee> findByStatusOrderByIdAsc(EmployeeStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Employee e WHERE e.id = :id")
    Optional<Employee> findByIdForUpdate(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    // Bulk updates bypass @UpdateTimestamp, so the caller supplies updatedAt
    @Query("UPDATE Employee e SET e.status = :target, e.version = e.version + 1, e.updatedAt = :now " +
            "WHERE e.id = :id AND e.status <> :target")
    int updateStatusUnlessAlready(@Param("id") Long id, @Param("target") EmployeeStatus target,
                                  @Param("now") LocalDateTime now);
}
